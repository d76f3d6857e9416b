/**
 * Manager protocol codec boundary.
 *
 * <h2>Inbound</h2>
 * <pre>
 *   transport lines
 *        → {@link com.questrail.amilink.protocol.ami.codec.AmiFrameReader}
 *            → AmiFrame (Greeting | Block)
 *                → {@link com.questrail.amilink.protocol.ami.codec.AmiMessageClassifier}
 *                    → AmiMessage (EVENT | RESPONSE | UNKNOWN)
 * </pre>
 *
 * <h2>Outbound</h2>
 * <pre>
 *   AmiAction + ActionID
 *        → {@link com.questrail.amilink.protocol.ami.codec.AmiActionEncoder}
 *            → CRLF wire text
 * </pre>
 *
 * Nothing in this package performs I/O, holds timers or knows about
 * correlation. Malformed input is reported with
 * {@link com.questrail.amilink.protocol.ami.internal.decode.AmiDecodeException}
 * and never stops the stream.
 */
package com.questrail.amilink.protocol.ami.codec;
