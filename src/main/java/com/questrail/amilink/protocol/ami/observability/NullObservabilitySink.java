package com.questrail.amilink.protocol.ami.observability;

/**
 * No-op implementation of AmiObservabilitySink.
 */
public final class NullObservabilitySink implements AmiObservabilitySink {
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onStateTransition(AmiConnectionTransitionEvent event) {}

    @Override
    public void onError(AmiErrorEvent event) {}
}
