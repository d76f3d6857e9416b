package com.questrail.amilink.api;

/**
 * Direction of a call relative to the switch, derived from its dialplan context.
 */
public enum CallDirection
{
    INBOUND,
    OUTBOUND,
    INTERNAL
}
