/**
 * Default codec implementations.
 *
 * <p>{@link com.questrail.amilink.protocol.ami.codec.impl.AmiLines} holds the
 * line-level rules shared by reader, classifier and encoder. The other classes
 * are small and stateless except
 * {@link com.questrail.amilink.protocol.ami.codec.impl.DefaultAmiFrameReader},
 * which buffers at most one partial block for one connection.</p>
 */
package com.questrail.amilink.protocol.ami.codec.impl;
