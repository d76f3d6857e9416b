package com.questrail.amilink.protocol.ami.runtime;

import com.questrail.amilink.api.AmiClient;
import com.questrail.amilink.protocol.ami.AmiConnectionSupervisor;
import com.questrail.amilink.protocol.ami.config.AmiClientConfig;
import com.questrail.amilink.protocol.ami.internal.dispatch.AmiEventDispatcher;
import com.questrail.amilink.protocol.ami.internal.exec.AmiEventLoop;
import com.questrail.amilink.protocol.ami.internal.state.AmiStateTracker;
import com.questrail.amilink.protocol.ami.internal.time.MonotonicScheduler;
import com.questrail.amilink.protocol.ami.internal.time.ScheduledExecutorScheduler;
import com.questrail.amilink.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.amilink.protocol.ami.observability.NullObservabilitySink;
import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpointFactory;
import com.questrail.amilink.protocol.ami.transport.tcp.netty.NettyTcpStreamEndpointFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * AmiClientRuntime
 * =============================================================================
 * Composition root and lifecycle owner for the production client stack.
 *
 * <pre>
 *   AmiClientRuntime runtime = AmiClientRuntime.builder()
 *       .withConfig(config)
 *       .withObservabilitySink(new Slf4jAmiObservabilitySink())
 *       .build();
 *   runtime.start();                 // threads up, then connect()
 *   runtime.client().sendAction(...);
 *   runtime.stop();                  // disconnect, threads down
 * </pre>
 *
 * The runtime owns every thread the client uses: the timer thread, the event
 * loop, the reconnect worker, the callback pool that completes
 * {@code sendActionAsync} futures and, unless an endpoint factory is supplied,
 * the Netty I/O thread.
 */
public final class AmiClientRuntime
{
    private static final Logger log = LoggerFactory.getLogger(AmiClientRuntime.class);

    private final AmiConnectionSupervisor client;
    private final AmiEventLoop eventLoop;
    private final ScheduledExecutorService schedulerExecutor;
    private final ExecutorService reconnectExecutor;
    private final ExecutorService callbackExecutor;
    private final AutoCloseable ownedTransport;

    private AmiClientRuntime(AmiConnectionSupervisor client,
                             AmiEventLoop eventLoop,
                             ScheduledExecutorService schedulerExecutor,
                             ExecutorService reconnectExecutor,
                             ExecutorService callbackExecutor,
                             AutoCloseable ownedTransport) {
        this.client = client;
        this.eventLoop = eventLoop;
        this.schedulerExecutor = schedulerExecutor;
        this.reconnectExecutor = reconnectExecutor;
        this.callbackExecutor = callbackExecutor;
        this.ownedTransport = ownedTransport;
    }

    /**
     * Start the event loop and connect. A failed connect is thrown; the
     * threads stay up so the caller may retry with {@code client().connect()}.
     */
    public void start() {
        eventLoop.start();
        client.connect();
    }

    public void stop() {
        client.disconnect();
        eventLoop.stop();
        shutdown(reconnectExecutor);
        shutdown(callbackExecutor);
        shutdown(schedulerExecutor);
        if (ownedTransport != null) {
            try {
                ownedTransport.close();
            } catch (Exception e) {
                log.warn("Failed to release transport resources", e);
            }
        }
    }

    public AmiClient client() {
        return client;
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory numberedDaemon(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private AmiClientConfig config;
        private AmiObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private AmiStreamEndpointFactory endpointFactory;
        private Clock clock = Clock.systemUTC();

        public Builder withConfig(AmiClientConfig config) {
            this.config = config;
            return this;
        }

        public Builder withObservabilitySink(AmiObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        /**
         * Replace the Netty TCP transport, e.g. with a test double.
         */
        public Builder withEndpointFactory(AmiStreamEndpointFactory factory) {
            this.endpointFactory = factory;
            return this;
        }

        /**
         * Wall clock used for record and observability timestamps.
         */
        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AmiClientRuntime build() {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(clock, "clock");
            AmiObservabilitySink sink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

            // 1. Threads and time
            ScheduledExecutorService schedulerExec = Executors.newSingleThreadScheduledExecutor(daemon("ami-timer"));
            ExecutorService reconnectExec = Executors.newSingleThreadExecutor(daemon("ami-reconnect"));
            ExecutorService callbackExec = Executors.newCachedThreadPool(numberedDaemon("ami-callback-"));
            MonotonicScheduler scheduler = new ScheduledExecutorScheduler(schedulerExec);

            // 2. Derived state and event delivery
            AmiStateTracker tracker = new AmiStateTracker(clock);
            AmiEventDispatcher dispatcher = new AmiEventDispatcher(tracker, clock, sink);
            AmiEventLoop eventLoop = new AmiEventLoop(dispatcher, clock, sink);

            // 3. Transport
            NettyTcpStreamEndpointFactory nettyFactory = null;
            AmiStreamEndpointFactory factory = endpointFactory;
            if (factory == null) {
                nettyFactory = new NettyTcpStreamEndpointFactory();
                factory = nettyFactory;
            }

            // 4. Supervisor (the client)
            AmiConnectionSupervisor supervisor = new AmiConnectionSupervisor(
                    config, factory, tracker, dispatcher, eventLoop, scheduler, reconnectExec, callbackExec, clock, sink);

            return new AmiClientRuntime(supervisor, eventLoop, schedulerExec, reconnectExec, callbackExec, nettyFactory);
        }
    }
}
