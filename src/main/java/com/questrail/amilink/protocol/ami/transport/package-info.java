/**
 * Manager Transport Ports
 * =============================================================================
 *
 * These interfaces define the <em>framework-agnostic transport boundary</em>
 * between a concrete networking implementation (Netty TCP, a loopback test
 * server, or a test double) and the manager client.
 *
 * <h2>Why these ports exist</h2>
 * Netty does the socket work in production (event loop model, line framing,
 * robust lifecycle handling) <strong>without</strong> Netty types leaking into
 * the protocol core.
 *
 * <p>Everything above the transport adapter sees only:</p>
 * <ul>
 *   <li>Inbound lines as {@code String}, terminator removed</li>
 *   <li>Outbound text as {@code String}</li>
 *   <li>Transport lifecycle notifications (up/down)</li>
 * </ul>
 *
 * <h2>Architectural constraints</h2>
 * Implementations of these ports MUST:
 * <ul>
 *   <li>Perform transport I/O only</li>
 *   <li>Not group lines into blocks or interpret them</li>
 *   <li>Not schedule retries or timeouts, nor reconnect on their own</li>
 * </ul>
 */
package com.questrail.amilink.protocol.ami.transport;
