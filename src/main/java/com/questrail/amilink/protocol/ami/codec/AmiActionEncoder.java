package com.questrail.amilink.protocol.ami.codec;

import com.questrail.amilink.protocol.ami.model.AmiAction;

/**
 * AmiActionEncoder
 * -----------------------------------------------------------------------------
 * Serializes an outbound action into its wire text.
 *
 * <p>The output always starts with an {@code Action:} line, carries the
 * correlation token as an {@code ActionID} line, and ends with the blank line
 * that terminates the message. Every line ends in CRLF.</p>
 */
public interface AmiActionEncoder
{
    /**
     * @param action   action to encode
     * @param actionId correlation token assigned by the correlator
     * @return complete wire text for one action
     * @throws IllegalArgumentException if a name or value would break framing
     */
    String encode(AmiAction action, String actionId);
}
