package com.questrail.amilink.protocol.ami.internal.events;

import com.questrail.amilink.protocol.ami.model.AmiMessage;

import java.time.Instant;
import java.util.Objects;

/**
 * AmiLinkEvent
 * -----------------------------------------------------------------------------
 * Items carried from the inbound I/O thread to the client's event loop.
 *
 * <h2>Role in the architecture</h2>
 * The I/O thread only reads, classifies and correlates. Everything that runs
 * consumer code or touches derived state is handed over as an
 * {@link AmiLinkEvent} and processed one at a time, in arrival order, on the
 * event loop thread.
 * <p>
 * Every item is stamped with the generation of the connection that produced
 * it, so the loop can drop items that outlived their connection.
 */
public sealed interface AmiLinkEvent
        permits AmiLinkEvent.EventReceived, AmiLinkEvent.ConnectionLost
{
    /**
     * Generation of the connection this item came from.
     */
    long generation();

    /**
     * Time at which the item was produced.
     */
    Instant timestamp();

    /** An event, or a response no pending action claimed. */
    record EventReceived(long generation, AmiMessage message, Instant timestamp) implements AmiLinkEvent {
        public EventReceived {
            Objects.requireNonNull(message, "message");
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }

    /** The transport of a connection went down without being asked to. */
    record ConnectionLost(long generation, Throwable cause, Instant timestamp) implements AmiLinkEvent {
        public ConnectionLost {
            Objects.requireNonNull(timestamp, "timestamp");
        }
    }
}
