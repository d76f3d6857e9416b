package com.questrail.amilink.api;

/**
 * Lifecycle of the manager connection.
 *
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED_LOGGED_OUT → READY → DISCONNECTED
 * </pre>
 *
 * Any failure returns the connection to {@link #DISCONNECTED}.
 */
public enum ConnectionState
{
    DISCONNECTED,
    CONNECTING,
    /** Transport open and greeting read; login not yet accepted. */
    CONNECTED_LOGGED_OUT,
    /** Connected, authenticated and listening. The only state that accepts actions. */
    READY
}
