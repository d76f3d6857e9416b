package com.questrail.amilink.api;

import com.questrail.amilink.protocol.ami.model.AmiMessage;

/**
 * Callback for events delivered by an {@link AmiClient}.
 *
 * <p>Handlers run on the client's single event thread, one event at a time and
 * in wire order. A handler that throws is logged and skipped; delivery to the
 * remaining handlers continues. Handlers may call back into the client,
 * including {@link AmiClient#sendAction}.</p>
 */
@FunctionalInterface
public interface AmiEventHandler
{
    void onEvent(AmiMessage event);
}
