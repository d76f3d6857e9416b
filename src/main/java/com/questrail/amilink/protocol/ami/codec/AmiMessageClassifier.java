package com.questrail.amilink.protocol.ami.codec;

import com.questrail.amilink.protocol.ami.internal.decode.AmiDecodeException;
import com.questrail.amilink.protocol.ami.internal.frame.AmiFrame;
import com.questrail.amilink.protocol.ami.model.AmiMessage;

/**
 * Turns a raw block into a classified {@link AmiMessage}.
 *
 * <p>Classification: an {@code Event} key makes an event, otherwise a
 * {@code Response} key makes a response, otherwise the message is
 * {@link AmiMessage.Kind#UNKNOWN}. Unknown messages are returned, not thrown;
 * callers log and drop them.</p>
 */
public interface AmiMessageClassifier
{
    /**
     * @throws AmiDecodeException if the block is malformed
     */
    AmiMessage classify(AmiFrame.Block block);
}
