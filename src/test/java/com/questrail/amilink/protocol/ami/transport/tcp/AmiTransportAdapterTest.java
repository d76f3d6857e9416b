package com.questrail.amilink.protocol.ami.transport.tcp;

import com.questrail.amilink.api.AmiTransportException;
import com.questrail.amilink.api.ConnectionClosedException;
import com.questrail.amilink.protocol.ami.codec.impl.DefaultAmiActionEncoder;
import com.questrail.amilink.protocol.ami.codec.impl.DefaultAmiFrameReader;
import com.questrail.amilink.protocol.ami.codec.impl.DefaultAmiMessageClassifier;
import com.questrail.amilink.protocol.ami.internal.dispatch.AmiEventDispatcher;
import com.questrail.amilink.protocol.ami.internal.exec.AmiActionCorrelator;
import com.questrail.amilink.protocol.ami.internal.exec.AmiEventLoop;
import com.questrail.amilink.protocol.ami.internal.state.AmiStateTracker;
import com.questrail.amilink.protocol.ami.model.AmiAction;
import com.questrail.amilink.protocol.ami.model.AmiMessage;
import com.questrail.amilink.protocol.ami.model.AmiResponse;
import com.questrail.amilink.protocol.ami.observability.RecordingObservabilitySink;
import com.questrail.amilink.protocol.ami.time.DeterministicScheduler;
import com.questrail.amilink.protocol.ami.time.ManualMonotonicClock;
import com.questrail.amilink.protocol.ami.transport.FakeStreamEndpoint;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * AmiTransportAdapterTest
 * -----------------------------------------------------------------------------
 * One connection's worth of inbound and outbound translation over
 * {@link FakeStreamEndpoint}.
 */
class AmiTransportAdapterTest {

    private static final long GENERATION = 1;

    private FakeStreamEndpoint endpoint;
    private RecordingObservabilitySink sink;
    private AmiEventLoop eventLoop;
    private AmiTransportAdapter adapter;

    private final BlockingQueue<AmiMessage> delivered = new LinkedBlockingQueue<>();
    private final BlockingQueue<Long> losses = new LinkedBlockingQueue<>();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.systemUTC();
        sink = new RecordingObservabilitySink();

        AmiStateTracker tracker = new AmiStateTracker(clock);
        tracker.reset(GENERATION);
        AmiEventDispatcher dispatcher = new AmiEventDispatcher(tracker, clock, sink);
        dispatcher.register(AmiEventDispatcher.WILDCARD, delivered::add);

        eventLoop = new AmiEventLoop(dispatcher, clock, sink);
        eventLoop.setConnectionLossListener((generation, cause) -> losses.add(generation));
        eventLoop.start();

        DeterministicScheduler scheduler = new DeterministicScheduler(new ManualMonotonicClock());
        endpoint = new FakeStreamEndpoint();
        adapter = new AmiTransportAdapter(
                GENERATION,
                endpoint,
                new DefaultAmiFrameReader(),
                new DefaultAmiMessageClassifier(),
                new DefaultAmiActionEncoder(),
                new AmiActionCorrelator("t1", scheduler, Duration.ofSeconds(5)),
                eventLoop,
                clock,
                sink);
        adapter.start();
    }

    @AfterEach
    void tearDown() {
        adapter.close();
        eventLoop.stop();
    }

    @Test
    void bannerCompletesGreeting() {
        assertEquals(FakeStreamEndpoint.BANNER, adapter.greeting().join());
        assertTrue(adapter.isOpen());
    }

    @Test
    void responseResolvesTheSentAction() {
        AmiResponse response = adapter.send(AmiAction.of("Ping")).join();

        assertTrue(response.isSuccess());
        assertEquals(endpoint.sent().get(0).actionId(), response.message().actionId().orElseThrow());
        assertTrue(endpoint.sent().get(0).actionId().startsWith("t1-"));
        assertEquals(0, adapter.outstandingActions());
    }

    @Test
    void malformedBlockIsReportedAndStreamContinues() throws InterruptedException {
        endpoint.injectBlock("Response: Success", "no separator here");
        endpoint.injectBlock("Event: FullyBooted", "Status: Fully Booted");

        AmiMessage next = delivered.poll(2, TimeUnit.SECONDS);
        assertNotNull(next);
        assertEquals("FullyBooted", next.name());
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void rejectedLineDropsItsBlock() throws InterruptedException {
        endpoint.injectLines("Event: Newchannel", "Uniqueid: 1.1");
        adapter.onLineRejected(new IllegalStateException("line too long"));
        endpoint.injectLines("Channel: SIP/1001-1", "");
        endpoint.injectBlock("Event: Hangup", "Uniqueid: 1.1");

        AmiMessage next = delivered.poll(2, TimeUnit.SECONDS);
        assertNotNull(next);
        assertEquals("Hangup", next.name());
        assertNull(delivered.poll(100, TimeUnit.MILLISECONDS));
        assertEquals(1, sink.getErrors().size());
    }

    @Test
    void failedWriteFailsOnlyThatAction() {
        endpoint.withResponder(action -> {
            if ("Originate".equals(action.name())) {
                throw new IllegalStateException("socket broke");
            }
            return FakeStreamEndpoint.acceptEverything(action);
        });

        CompletableFuture<AmiResponse> originate = adapter.send(AmiAction.of("Originate"));
        CompletionException failure = assertThrows(CompletionException.class, originate::join);
        assertInstanceOf(AmiTransportException.class, failure.getCause());

        assertTrue(adapter.send(AmiAction.of("Ping")).join().isSuccess());
        assertEquals(0, adapter.outstandingActions());
    }

    @Test
    void unencodableActionFailsBeforeWriting() {
        CompletableFuture<AmiResponse> bad = adapter.send(
                AmiAction.builder("Setvar").header("Value", "a\r\nAction: Logoff").build());

        CompletionException failure = assertThrows(CompletionException.class, bad::join);
        assertInstanceOf(IllegalArgumentException.class, failure.getCause());
        assertTrue(endpoint.sent().isEmpty());
    }

    @Test
    void lossFailsOutstandingAndIsReported() throws InterruptedException {
        endpoint.withResponder(FakeStreamEndpoint::noReply);
        CompletableFuture<AmiResponse> pending = adapter.send(AmiAction.of("Ping"));

        endpoint.dropConnection(new IOException("reset by peer"));

        CompletionException failure = assertThrows(CompletionException.class, pending::join);
        assertInstanceOf(ConnectionClosedException.class, failure.getCause());
        assertEquals(GENERATION, losses.poll(2, TimeUnit.SECONDS));
        assertFalse(adapter.isOpen());

        CompletionException late = assertThrows(CompletionException.class,
                () -> adapter.send(AmiAction.of("Ping")).join());
        assertInstanceOf(AmiTransportException.class, late.getCause());
    }

    @Test
    void closeIsNotReportedAsLoss() throws InterruptedException {
        endpoint.withResponder(FakeStreamEndpoint::noReply);
        CompletableFuture<AmiResponse> pending = adapter.send(AmiAction.of("Ping"));

        adapter.close();

        CompletionException failure = assertThrows(CompletionException.class, pending::join);
        assertInstanceOf(ConnectionClosedException.class, failure.getCause());
        assertNull(losses.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void abortIsReportedAsLoss() throws InterruptedException {
        adapter.abort();

        assertEquals(GENERATION, losses.poll(2, TimeUnit.SECONDS));
        assertEquals(List.of(), endpoint.sent());
    }
}
