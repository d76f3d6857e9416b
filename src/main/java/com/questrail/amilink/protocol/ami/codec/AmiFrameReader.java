package com.questrail.amilink.protocol.ami.codec;

import com.questrail.amilink.protocol.ami.internal.frame.AmiFrame;

import java.util.Optional;

/**
 * AmiFrameReader
 * -----------------------------------------------------------------------------
 * Line-level reader for manager protocol framing.
 *
 * <p>This interface defines the inbound boundary between the transport's line
 * stream and structured {@link AmiFrame}s. The transport delivers one line at a
 * time with its CRLF already removed; the reader accumulates lines and emits a
 * frame whenever one is complete.</p>
 *
 * <p>The reader is responsible only for:</p>
 * <ul>
 *   <li>Recognizing the connection banner</li>
 *   <li>Grouping lines into blank-line-terminated blocks</li>
 *   <li>Discarding partial blocks when the stream ends or a line is rejected</li>
 * </ul>
 *
 * <p>The reader is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Splitting lines into keys and values</li>
 *   <li>Classifying blocks as events or responses</li>
 *   <li>Reading from sockets</li>
 * </ul>
 *
 * <p>Implementations are stateful and confined to one connection's inbound
 * thread. {@link #reset()} makes a reader reusable for the next connection.</p>
 */
public interface AmiFrameReader
{
    /**
     * Accept one inbound line.
     *
     * @param line a line without its terminator
     * @return the frame completed by this line, if any
     */
    Optional<AmiFrame> onLine(String line);

    /**
     * Drop the block being accumulated and skip every line up to the next
     * blank line. Used when the transport rejects a line (for example one that
     * exceeds the maximum length) so the damaged block is never delivered.
     *
     * @return the number of lines discarded so far
     */
    int discardPartialBlock();

    /**
     * Forget all state, including any partial block, and expect a banner again.
     * Called when the stream ends.
     *
     * @return the number of buffered lines that were discarded
     */
    int reset();
}
