package com.questrail.amilink.protocol.ami;

import com.questrail.amilink.api.AmiAuthenticationException;
import com.questrail.amilink.api.AmiClient;
import com.questrail.amilink.api.AmiEventHandler;
import com.questrail.amilink.api.AmiException;
import com.questrail.amilink.api.AmiTransportException;
import com.questrail.amilink.api.CallRecord;
import com.questrail.amilink.api.ConnectionClosedException;
import com.questrail.amilink.api.ConnectionState;
import com.questrail.amilink.api.DeviceState;
import com.questrail.amilink.protocol.ami.codec.AmiActionEncoder;
import com.questrail.amilink.protocol.ami.codec.impl.DefaultAmiActionEncoder;
import com.questrail.amilink.protocol.ami.codec.impl.DefaultAmiFrameReader;
import com.questrail.amilink.protocol.ami.codec.impl.DefaultAmiMessageClassifier;
import com.questrail.amilink.protocol.ami.config.AmiClientConfig;
import com.questrail.amilink.protocol.ami.internal.dispatch.AmiEventDispatcher;
import com.questrail.amilink.protocol.ami.internal.exec.AmiActionCorrelator;
import com.questrail.amilink.protocol.ami.internal.exec.AmiEventLoop;
import com.questrail.amilink.protocol.ami.internal.exec.AmiTimingPolicy;
import com.questrail.amilink.protocol.ami.internal.state.AmiStateTracker;
import com.questrail.amilink.protocol.ami.internal.time.Cancellable;
import com.questrail.amilink.protocol.ami.internal.time.MonotonicScheduler;
import com.questrail.amilink.protocol.ami.model.AmiAction;
import com.questrail.amilink.protocol.ami.model.AmiResponse;
import com.questrail.amilink.protocol.ami.observability.AmiConnectionTransitionEvent;
import com.questrail.amilink.protocol.ami.observability.AmiErrorEvent;
import com.questrail.amilink.protocol.ami.observability.AmiObservabilitySink;
import com.questrail.amilink.protocol.ami.observability.NullObservabilitySink;
import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpoint;
import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpointFactory;
import com.questrail.amilink.protocol.ami.transport.tcp.AmiTransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AmiConnectionSupervisor
 * =============================================================================
 * The {@link AmiClient} implementation. Owns the manager connection from
 * connect through login, keep-alive, loss and recovery.
 *
 * <h2>State machine</h2>
 * <pre>
 *   DISCONNECTED → CONNECTING → CONNECTED_LOGGED_OUT → READY → DISCONNECTED
 *        ↑______________|_______________|   (any failure)
 * </pre>
 * <ul>
 *   <li><b>connect()</b>: open the transport within the connect timeout, wait
 *       for the banner within the read timeout, log in. Success ends in
 *       {@code READY}, followed by the initial status requests and the first
 *       keep-alive timer. Any failure tears the transport down, returns to
 *       {@code DISCONNECTED} and is thrown to the caller.</li>
 *   <li><b>disconnect()</b>: best-effort {@code Logoff}, close the transport,
 *       fail outstanding actions, clear derived state.</li>
 *   <li><b>reconnect()</b>: disconnect, wait the reconnect backoff, connect.</li>
 * </ul>
 *
 * <h2>Generations</h2>
 * Every connection attempt gets a new generation number. The state tracker is
 * reset to that generation before the transport opens, and it is moved past
 * it whenever the connection ends, so nothing a dead connection left in the
 * event queue can reach handlers or derived state.
 *
 * <h2>Liveness</h2>
 * The inbound side never reconnects by itself. When the transport goes down
 * unexpectedly, the adapter reports the loss through the event loop, behind
 * every event the connection delivered. The supervisor then moves to
 * {@code DISCONNECTED} and, when auto-reconnect is enabled, schedules a
 * connect after the fixed backoff, repeating until one succeeds or
 * {@link #disconnect()} is called.
 *
 * <h2>Thread Safety</h2>
 * Lifecycle operations are serialized on one lock. Sending does not take that
 * lock; it uses whichever connection is current when the call is made.
 */
public final class AmiConnectionSupervisor implements AmiClient
{
    private static final Logger log = LoggerFactory.getLogger(AmiConnectionSupervisor.class);

    private final AmiClientConfig config;
    private final AmiTimingPolicy timingPolicy;
    private final AmiStreamEndpointFactory endpointFactory;
    private final AmiStateTracker tracker;
    private final AmiEventDispatcher dispatcher;
    private final AmiEventLoop eventLoop;
    private final MonotonicScheduler scheduler;
    private final Executor reconnectExecutor;
    private final Executor callbackExecutor;
    private final Clock clock;
    private final AmiObservabilitySink observabilitySink;
    private final AmiActionEncoder encoder = new DefaultAmiActionEncoder();

    private final Object lifecycleLock = new Object();
    private final AtomicLong generation = new AtomicLong();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile AmiTransportAdapter current;

    // Guarded by lifecycleLock
    private boolean recoveryWanted;
    private Cancellable reconnectTimer = Cancellable.NONE;

    // Re-armed from I/O callbacks, which must never wait for lifecycleLock
    private volatile Cancellable pingTimer = Cancellable.NONE;

    /**
     * @param reconnectExecutor runs automatic reconnect attempts; must not be
     *                          the scheduler's own thread, whose timers bound
     *                          the login the attempt waits for
     * @param callbackExecutor  completes the futures returned by
     *                          {@link #sendActionAsync(AmiAction)}, so stages a
     *                          caller chains never run on the I/O thread
     */
    public AmiConnectionSupervisor(AmiClientConfig config,
                                   AmiStreamEndpointFactory endpointFactory,
                                   AmiStateTracker tracker,
                                   AmiEventDispatcher dispatcher,
                                   AmiEventLoop eventLoop,
                                   MonotonicScheduler scheduler,
                                   Executor reconnectExecutor,
                                   Executor callbackExecutor,
                                   Clock clock,
                                   AmiObservabilitySink observabilitySink)
    {
        this.config = Objects.requireNonNull(config, "config");
        this.timingPolicy = config.timingPolicy();
        this.endpointFactory = Objects.requireNonNull(endpointFactory, "endpointFactory");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.reconnectExecutor = Objects.requireNonNull(reconnectExecutor, "reconnectExecutor");
        this.callbackExecutor = Objects.requireNonNull(callbackExecutor, "callbackExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);

        eventLoop.setConnectionLossListener(this::onConnectionLost);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void connect() {
        synchronized (lifecycleLock) {
            if (state == ConnectionState.READY) {
                return;
            }
            recoveryWanted = true;
            reconnectTimer.cancel();
            openSession();
        }
    }

    @Override
    public void disconnect() {
        synchronized (lifecycleLock) {
            recoveryWanted = false;
            reconnectTimer.cancel();
            pingTimer.cancel();

            AmiTransportAdapter adapter = current;
            current = null;
            if (adapter != null) {
                if (state == ConnectionState.READY) {
                    logoff(adapter);
                }
                adapter.close();
            }
            long gen = invalidateGeneration();
            transition(ConnectionState.DISCONNECTED, gen, "disconnect requested");
        }
    }

    @Override
    public void reconnect() {
        disconnect();
        Duration backoff = timingPolicy.reconnectBackoff();
        if (!backoff.isZero()) {
            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new AmiTransportException("Interrupted while waiting to reconnect", e);
            }
        }
        connect();
    }

    @Override
    public boolean isConnected() {
        AmiTransportAdapter adapter = current;
        return state == ConnectionState.READY && adapter != null && adapter.isOpen();
    }

    @Override
    public ConnectionState connectionState() {
        return state;
    }

    // -------------------------------------------------------------------------
    // Actions
    // -------------------------------------------------------------------------

    @Override
    public AmiResponse sendAction(AmiAction action) {
        // The caller only waits; no stage of its own can land on the I/O thread.
        return await(submit(action));
    }

    @Override
    public CompletableFuture<AmiResponse> sendActionAsync(AmiAction action) {
        CompletableFuture<AmiResponse> resolved = submit(action);
        if (resolved.isDone()) {
            return resolved;
        }
        CompletableFuture<AmiResponse> handed = new CompletableFuture<>();
        resolved.whenComplete((response, failure) -> {
            try {
                callbackExecutor.execute(() -> handOver(handed, response, failure));
            } catch (RejectedExecutionException e) {
                handOver(handed, response, failure);
            }
        });
        return handed;
    }

    private CompletableFuture<AmiResponse> submit(AmiAction action) {
        Objects.requireNonNull(action, "action");
        AmiTransportAdapter adapter = current;
        if (adapter == null || state != ConnectionState.READY) {
            return CompletableFuture.failedFuture(
                    new AmiTransportException("Cannot send " + action.name() + ": client is " + state));
        }
        return adapter.send(action);
    }

    private static void handOver(CompletableFuture<AmiResponse> handed, AmiResponse response, Throwable failure) {
        if (failure != null) {
            handed.completeExceptionally(unwrap(failure));
        } else {
            handed.complete(response);
        }
    }

    // -------------------------------------------------------------------------
    // Events and state
    // -------------------------------------------------------------------------

    @Override
    public void registerEventHandler(String eventName, AmiEventHandler handler) {
        dispatcher.register(eventName, handler);
    }

    @Override
    public boolean unregisterEventHandler(String eventName, AmiEventHandler handler) {
        return dispatcher.unregister(eventName, handler);
    }

    @Override
    public List<CallRecord> activeCalls() {
        return tracker.activeCalls();
    }

    @Override
    public Map<String, DeviceState> deviceStates() {
        return tracker.deviceStates();
    }

    // -------------------------------------------------------------------------
    // Internals (lifecycleLock held unless noted)
    // -------------------------------------------------------------------------

    private void openSession() {
        long gen = generation.incrementAndGet();
        tracker.reset(gen);
        transition(ConnectionState.CONNECTING, gen, "connecting to " + config.host() + ":" + config.port());

        AmiStreamEndpoint endpoint = endpointFactory.create(
                config.host(), config.port(), config.connectTimeout(), config.maxLineLength());
        AmiTransportAdapter adapter = new AmiTransportAdapter(
                gen,
                endpoint,
                new DefaultAmiFrameReader(),
                new DefaultAmiMessageClassifier(),
                encoder,
                new AmiActionCorrelator("amilink-" + gen, scheduler, timingPolicy.actionTimeout()),
                eventLoop,
                clock,
                observabilitySink);
        current = adapter;

        try {
            adapter.start();
            String banner = awaitGreeting(adapter);
            transition(ConnectionState.CONNECTED_LOGGED_OUT, gen, banner.isEmpty() ? "connected" : banner);

            AmiResponse login = await(adapter.send(loginAction()));
            if (!login.isSuccess()) {
                throw new AmiAuthenticationException(config.username(), login);
            }
            transition(ConnectionState.READY, gen, "login accepted");
        } catch (RuntimeException e) {
            current = null;
            adapter.close();
            long stale = invalidateGeneration();
            transition(ConnectionState.DISCONNECTED, stale, "connect failed: " + e.getMessage());
            if (e instanceof ConnectionClosedException) {
                throw new AmiTransportException("Connection lost before login completed", e);
            }
            throw e;
        }

        requestInitialStatus(adapter);
        armKeepAlive(adapter);
    }

    private AmiAction loginAction() {
        AmiAction.Builder login = AmiAction.builder("Login")
                .header("Username", config.username())
                .header("Secret", config.secret());
        config.eventMask().ifPresent(mask -> login.header("Events", mask));
        return login.build();
    }

    private String awaitGreeting(AmiTransportAdapter adapter) {
        Duration readTimeout = config.readTimeout();
        try {
            return adapter.greeting().get(readTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new AmiTransportException("No greeting from " + config.host() + ":" + config.port()
                    + " within " + readTimeout.toMillis() + " ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AmiTransportException("Interrupted while waiting for greeting", e);
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    private void logoff(AmiTransportAdapter adapter) {
        try {
            AmiResponse goodbye = await(adapter.send(AmiAction.of("Logoff")));
            log.debug("Logoff answered with {}", goodbye.status());
        } catch (AmiException e) {
            log.debug("Logoff failed; closing anyway: {}", e.getMessage());
        }
    }

    /**
     * Best-effort bulk requests that seed call, device and queue state.
     * Their events flow through the normal dispatch path; failures are only reported.
     */
    private void requestInitialStatus(AmiTransportAdapter adapter) {
        for (String actionName : config.initialStatusActions()) {
            adapter.send(AmiAction.of(actionName)).whenComplete((response, failure) -> {
                if (failure != null) {
                    observabilitySink.onError(new AmiErrorEvent(
                            clock.instant(), "Initial status request " + actionName + " failed", unwrap(failure)));
                } else if (!response.isSuccess()) {
                    log.debug("Initial status request {} answered {}: {}", actionName, response.status(),
                            response.message().getOrDefault("Message", ""));
                }
            });
        }
    }

    private void armKeepAlive(AmiTransportAdapter adapter) {
        if (!timingPolicy.keepAliveEnabled()) {
            return;
        }
        pingTimer = scheduler.schedule(timingPolicy.pingInterval(), () -> ping(adapter));
    }

    /**
     * Runs on the scheduler thread. A failed ping aborts the transport so that
     * the ordinary connection-loss path takes over.
     */
    private void ping(AmiTransportAdapter adapter) {
        if (current != adapter || state != ConnectionState.READY) {
            return;
        }
        adapter.send(AmiAction.of("Ping")).whenComplete((response, failure) -> {
            if (current != adapter) {
                // Connection already retired by disconnect() or loss handling.
                log.debug("Keep-alive ping on retired connection #{} ended", adapter.generation());
                return;
            }
            if (failure == null) {
                armKeepAlive(adapter);
                return;
            }
            observabilitySink.onError(new AmiErrorEvent(
                    clock.instant(), "Keep-alive ping failed on connection #" + adapter.generation(), unwrap(failure)));
            adapter.abort();
        });
    }

    /**
     * Runs on the event loop thread, after every event the lost connection delivered.
     */
    private void onConnectionLost(long lostGeneration, Throwable cause) {
        synchronized (lifecycleLock) {
            AmiTransportAdapter adapter = current;
            if (adapter == null || adapter.generation() != lostGeneration) {
                return;
            }
            pingTimer.cancel();
            current = null;
            adapter.close();
            long gen = invalidateGeneration();
            transition(ConnectionState.DISCONNECTED, gen,
                    "connection lost" + (cause == null ? "" : ": " + cause.getMessage()));

            if (config.autoReconnect() && recoveryWanted) {
                scheduleReconnect();
            }
        }
    }

    private void scheduleReconnect() {
        log.info("Reconnecting to {}:{} in {} ms", config.host(), config.port(), timingPolicy.reconnectBackoff().toMillis());
        reconnectTimer = scheduler.schedule(timingPolicy.reconnectBackoff(),
                () -> reconnectExecutor.execute(this::attemptReconnect));
    }

    /**
     * Runs on the reconnect executor.
     */
    private void attemptReconnect() {
        synchronized (lifecycleLock) {
            if (!recoveryWanted || state != ConnectionState.DISCONNECTED) {
                return;
            }
            try {
                openSession();
            } catch (AmiException e) {
                observabilitySink.onError(new AmiErrorEvent(clock.instant(), "Reconnect attempt failed", e));
                scheduleReconnect();
            }
        }
    }

    /**
     * Move the tracker past every generation issued so far, clearing derived state.
     */
    private long invalidateGeneration() {
        long gen = generation.incrementAndGet();
        tracker.reset(gen);
        return gen;
    }

    private void transition(ConnectionState newState, long gen, String reason) {
        ConnectionState oldState = state;
        if (oldState == newState) {
            return;
        }
        state = newState;
        observabilitySink.onStateTransition(new AmiConnectionTransitionEvent(
                clock.instant(), oldState, newState, gen, reason));
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private static RuntimeException unwrap(Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new AmiTransportException("Action failed", cause);
    }
}
