package com.questrail.amilink.protocol.ami.transport.tcp;

import com.questrail.amilink.api.AmiTransportException;
import com.questrail.amilink.api.ConnectionClosedException;
import com.questrail.amilink.protocol.ami.codec.AmiActionEncoder;
import com.questrail.amilink.protocol.ami.codec.AmiFrameReader;
import com.questrail.amilink.protocol.ami.codec.AmiMessageClassifier;
import com.questrail.amilink.protocol.ami.internal.decode.AmiDecodeException;
import com.questrail.amilink.protocol.ami.internal.exec.AmiActionCorrelator;
import com.questrail.amilink.protocol.ami.internal.exec.AmiEventLoop;
import com.questrail.amilink.protocol.ami.internal.exec.PendingAction;
import com.questrail.amilink.protocol.ami.internal.frame.AmiFrame;
import com.questrail.amilink.protocol.ami.model.AmiAction;
import com.questrail.amilink.protocol.ami.model.AmiMessage;
import com.questrail.amilink.protocol.ami.model.AmiResponse;
import com.questrail.amilink.protocol.ami.observability.AmiErrorEvent;
import com.questrail.amilink.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.amilink.protocol.ami.observability.NullObservabilitySink;
import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpoint;
import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * AmiTransportAdapter
 * =============================================================================
 * Per-connection translation layer between an {@link AmiStreamEndpoint} and the
 * client core. One adapter exists for each connection generation and is
 * discarded with it.
 *
 * <h2>Inbound path (on the endpoint's inbound thread)</h2>
 *
 * <pre>
 *   AmiStreamEndpoint.onLine
 *        → AmiFrameReader            (greeting | block)
 *            → AmiMessageClassifier  (event | response | unknown)
 *                → AmiActionCorrelator     responses with a pending token
 *                → AmiEventLoop            events and unclaimed responses
 * </pre>
 *
 * Responses are resolved here, not on the event loop, so a handler that sends
 * an action and waits for it cannot deadlock the loop.
 *
 * <h2>Outbound path (on caller threads)</h2>
 *
 * <pre>
 *   AmiAction
 *        → AmiActionCorrelator.register   (fresh ActionID, deadline armed)
 *            → AmiActionEncoder
 *                → AmiStreamEndpoint.send (under the write lock)
 * </pre>
 *
 * <h2>Failure policy</h2>
 * <ul>
 *   <li>A malformed block is reported and dropped; the stream continues.</li>
 *   <li>An over-long line drops the block it belongs to.</li>
 *   <li>A failed write fails only the action being written.</li>
 *   <li>Loss of the connection fails every outstanding action and is reported
 *       to the event loop unless {@link #close()} caused it.</li>
 * </ul>
 */
public final class AmiTransportAdapter implements AmiStreamEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(AmiTransportAdapter.class);

    private final long generation;
    private final AmiStreamEndpoint endpoint;
    private final AmiFrameReader frameReader;
    private final AmiMessageClassifier classifier;
    private final AmiActionEncoder encoder;
    private final AmiActionCorrelator correlator;
    private final AmiEventLoop eventLoop;
    private final Clock clock;
    private final AmiObservabilitySink observabilitySink;

    private final CompletableFuture<String> greeting = new CompletableFuture<>();
    private final Object writeLock = new Object();
    private final AtomicBoolean closing = new AtomicBoolean(false);
    private final AtomicBoolean down = new AtomicBoolean(false);

    public AmiTransportAdapter(long generation,
                               AmiStreamEndpoint endpoint,
                               AmiFrameReader frameReader,
                               AmiMessageClassifier classifier,
                               AmiActionEncoder encoder,
                               AmiActionCorrelator correlator,
                               AmiEventLoop eventLoop,
                               Clock clock,
                               AmiObservabilitySink observabilitySink) {
        this.generation = generation;
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.frameReader = Objects.requireNonNull(frameReader, "frameReader");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.correlator = Objects.requireNonNull(correlator, "correlator");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        // The endpoint is the raw I/O surface; this adapter is the translation layer.
        this.endpoint.setListener(this);
    }

    public long generation() {
        return generation;
    }

    /**
     * Open the connection. Blocks for at most the endpoint's connect timeout.
     */
    public void start() {
        endpoint.start();
    }

    /**
     * Close the connection on purpose. Outstanding actions fail with
     * {@link ConnectionClosedException}; no connection-loss notification is
     * raised.
     */
    public void close() {
        if (closing.compareAndSet(false, true)) {
            int cancelled = correlator.cancelAll(new ConnectionClosedException("Connection closed by client"));
            if (cancelled > 0) {
                log.debug("Cancelled {} outstanding actions on connection #{}", cancelled, generation);
            }
            greeting.completeExceptionally(new ConnectionClosedException("Connection closed by client"));
            endpoint.stop();
        }
    }

    /**
     * Drop the connection as if the peer had closed it. Unlike {@link #close()},
     * the loss is reported to the event loop and recovery proceeds as usual.
     */
    public void abort() {
        log.debug("Aborting connection #{}", generation);
        endpoint.stop();
    }

    public boolean isOpen() {
        return !down.get() && endpoint.isOpen();
    }

    /**
     * Completes with the banner line once the switch has sent it.
     */
    public CompletableFuture<String> greeting() {
        return greeting;
    }

    public int outstandingActions() {
        return correlator.outstanding();
    }

    /**
     * Assign a correlation token to {@code action}, write it, and return the
     * future that its response will complete.
     */
    public CompletableFuture<AmiResponse> send(AmiAction action) {
        Objects.requireNonNull(action, "action");
        if (closing.get() || down.get()) {
            return CompletableFuture.failedFuture(
                    new AmiTransportException("Connection #" + generation + " is closed"));
        }

        PendingAction pending = correlator.register(action.name());
        final String wire;
        try {
            wire = encoder.encode(action, pending.actionId());
        } catch (IllegalArgumentException e) {
            correlator.abandon(pending, e);
            return pending.future();
        }

        final CompletableFuture<Void> written;
        synchronized (writeLock) {
            try {
                written = endpoint.send(wire);
            } catch (RuntimeException e) {
                correlator.abandon(pending, asTransportFailure(action, e));
                return pending.future();
            }
        }
        written.whenComplete((ignored, failure) -> {
            if (failure != null) {
                correlator.abandon(pending, asTransportFailure(action, failure));
            }
        });
        return pending.future();
    }

    // -------------------------------------------------------------------------
    // AmiStreamEndpointListener
    // -------------------------------------------------------------------------

    @Override
    public void onTransportUp() {
        log.debug("Connection #{} transport up", generation);
    }

    @Override
    public void onTransportDown(Throwable cause) {
        if (!down.compareAndSet(false, true)) {
            return;
        }
        int discarded = frameReader.reset();
        if (discarded > 0) {
            log.debug("Connection #{} ended mid-block; discarded {} lines", generation, discarded);
        }

        if (closing.get()) {
            return;
        }

        ConnectionClosedException lost = new ConnectionClosedException("Connection #" + generation + " lost", cause);
        correlator.cancelAll(lost);
        greeting.completeExceptionally(lost);
        eventLoop.submitConnectionLost(generation, cause);
    }

    @Override
    public void onLine(String line) {
        Optional<AmiFrame> frame = frameReader.onLine(line);
        if (frame.isEmpty()) {
            return;
        }

        if (frame.get() instanceof AmiFrame.Greeting g) {
            log.debug("Connection #{} greeting: {}", generation, g.banner());
            greeting.complete(g.banner());
        } else if (frame.get() instanceof AmiFrame.Block block) {
            // Some switches omit the banner; the first block proves the session is alive.
            greeting.complete("");
            onBlock(block);
        }
    }

    @Override
    public void onLineRejected(Throwable cause) {
        int discarded = frameReader.discardPartialBlock();
        observabilitySink.onError(new AmiErrorEvent(
                clock.instant(),
                "Rejected inbound line on connection #" + generation + "; dropped block after " + discarded + " lines",
                cause));
    }

    private void onBlock(AmiFrame.Block block) {
        final AmiMessage message;
        try {
            message = classifier.classify(block);
        } catch (AmiDecodeException e) {
            observabilitySink.onError(new AmiErrorEvent(clock.instant(), "Dropped malformed block", e));
            return;
        }

        switch (message.kind()) {
            case RESPONSE:
                if (!correlator.onResponse(message)) {
                    eventLoop.submitEvent(generation, message);
                }
                break;
            case EVENT:
                correlator.onEvent(message);
                eventLoop.submitEvent(generation, message);
                break;
            default:
                log.debug("Dropped unclassifiable block on connection #{}: {}", generation, block.lines());
                break;
        }
    }

    private static AmiTransportException asTransportFailure(AmiAction action, Throwable cause) {
        if (cause instanceof AmiTransportException) {
            return (AmiTransportException) cause;
        }
        return new AmiTransportException("Failed to write action " + action.name(), cause);
    }
}
