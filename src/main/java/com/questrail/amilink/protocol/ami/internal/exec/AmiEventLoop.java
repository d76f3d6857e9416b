package com.questrail.amilink.protocol.ami.internal.exec;

import com.questrail.amilink.protocol.ami.internal.dispatch.AmiEventDispatcher;
import com.questrail.amilink.protocol.ami.internal.events.AmiLinkEvent;
import com.questrail.amilink.protocol.ami.model.AmiMessage;
import com.questrail.amilink.protocol.ami.observability.AmiErrorEvent;
import com.questrail.amilink.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.amilink.protocol.ami.observability.NullObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * AmiEventLoop
 * =============================================================================
 * Serialized event loop that runs everything downstream of the wire:
 * state tracking, consumer handlers and connection-loss handling.
 *
 * <h2>Threading Model</h2>
 * The loop runs a single thread. The inbound I/O thread submits items to a
 * queue and returns immediately; the loop processes them one at a time. This
 * ensures:
 * <ul>
 *   <li>Handlers observe events in wire order</li>
 *   <li>Derived state is mutated by one thread only</li>
 *   <li>A slow or blocking handler never stalls reading, so a handler may
 *       itself send an action and wait for its response</li>
 * </ul>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 *   loop.start()                  → starts the loop thread
 *   loop.submitEvent(gen, msg)    → enqueues a message for dispatch
 *   loop.submitConnectionLost(..) → enqueues a connection-loss notification
 *   loop.stop()                   → stops the loop thread
 * </pre>
 * Items submitted while the loop is stopped are dropped.
 */
public final class AmiEventLoop
{
    private static final Logger log = LoggerFactory.getLogger(AmiEventLoop.class);

    private final AmiEventDispatcher dispatcher;
    private final Clock clock;
    private final AmiObservabilitySink observabilitySink;

    private final BlockingQueue<AmiLinkEvent> eventQueue = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile BiConsumer<Long, Throwable> connectionLossListener = (generation, cause) -> {};
    private volatile Thread eventLoopThread;

    public AmiEventLoop(AmiEventDispatcher dispatcher, Clock clock, AmiObservabilitySink observabilitySink) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Receives connection-loss notifications on the loop thread, after every
     * message the lost connection delivered before it went down.
     */
    public void setConnectionLossListener(BiConsumer<Long, Throwable> listener) {
        this.connectionLossListener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Starts the loop thread. Calling start() again has no effect.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            eventLoopThread = new Thread(this::runEventLoop, "ami-event-loop");
            eventLoopThread.setDaemon(true);
            eventLoopThread.start();
        }
    }

    /**
     * Stops the loop thread and discards queued items.
     * Blocks until the thread terminates unless called from the loop itself.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Thread t = eventLoopThread;
            if (t != null) {
                t.interrupt();
                if (t != Thread.currentThread()) {
                    try {
                        t.join(5000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
            }
            int dropped = eventQueue.size();
            eventQueue.clear();
            if (dropped > 0) {
                log.debug("Event loop stopped with {} undelivered items", dropped);
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public boolean isLoopThread() {
        return Thread.currentThread() == eventLoopThread;
    }

    public void submitEvent(long generation, AmiMessage message) {
        submit(new AmiLinkEvent.EventReceived(generation, message, clock.instant()));
    }

    public void submitConnectionLost(long generation, Throwable cause) {
        submit(new AmiLinkEvent.ConnectionLost(generation, cause, clock.instant()));
    }

    private void submit(AmiLinkEvent event) {
        if (running.get()) {
            eventQueue.offer(event);
        }
    }

    /**
     * Main event loop - runs on dedicated thread.
     */
    private void runEventLoop() {
        while (running.get()) {
            try {
                AmiLinkEvent event = eventQueue.take();
                if (running.get()) {
                    processEvent(event);
                }
            } catch (InterruptedException e) {
                // Expected during shutdown
                if (running.get()) {
                    log.debug("Event loop interrupted while running");
                }
            } catch (VirtualMachineError e) {
                // The loop cannot continue; do not report a live loop that is gone.
                running.set(false);
                log.error("Event loop terminated", e);
                throw e;
            } catch (Throwable e) {
                observabilitySink.onError(new AmiErrorEvent(clock.instant(), "Event processing error", e));
            }
        }
    }

    private void processEvent(AmiLinkEvent event) {
        if (event instanceof AmiLinkEvent.EventReceived received) {
            if (!dispatcher.dispatch(received.generation(), received.message())) {
                log.trace("Dropped {} from stale connection #{}", received.message().name(), received.generation());
            }
        } else if (event instanceof AmiLinkEvent.ConnectionLost lost) {
            connectionLossListener.accept(lost.generation(), lost.cause());
        }
    }
}
