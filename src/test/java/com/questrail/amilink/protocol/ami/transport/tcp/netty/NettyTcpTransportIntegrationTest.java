package com.questrail.amilink.protocol.ami.transport.tcp.netty;

import com.questrail.amilink.api.AmiAuthenticationException;
import com.questrail.amilink.api.AmiClient;
import com.questrail.amilink.api.AmiTransportException;
import com.questrail.amilink.api.ConnectionState;
import com.questrail.amilink.protocol.ami.config.AmiClientConfig;
import com.questrail.amilink.protocol.ami.internal.exec.AmiTimingPolicy;
import com.questrail.amilink.protocol.ami.model.AmiAction;
import com.questrail.amilink.protocol.ami.model.AmiResponse;
import com.questrail.amilink.protocol.ami.observability.RecordingObservabilitySink;
import com.questrail.amilink.protocol.ami.runtime.AmiClientRuntime;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NettyTcpTransportIntegrationTest
 * -----------------------------------------------------------------------------
 * Full production stack (runtime, Netty endpoint, real timers) against a
 * loopback manager server.
 */
final class NettyTcpTransportIntegrationTest {

    private LoopbackManagerServer server;
    private AmiClientRuntime runtime;
    private RecordingObservabilitySink sink;

    @BeforeEach
    void setUp() throws IOException {
        server = new LoopbackManagerServer("amp111");
        sink = new RecordingObservabilitySink();
    }

    @AfterEach
    void tearDown() throws IOException {
        if (runtime != null) {
            runtime.stop();
        }
        server.close();
    }

    @Test
    void connectsSendsActionsAndTracksCalls() throws IOException {
        runtime = runtime(server.port(), "amp111", false);
        runtime.start();
        AmiClient client = runtime.client();

        assertTrue(client.isConnected());
        AmiResponse pong = client.sendAction(AmiAction.of("Ping"));
        assertEquals("Pong", pong.message().get("Ping").orElseThrow());

        server.push("Event: Newchannel", "Uniqueid: 1700000000.1", "Channel: SIP/1001-00000001",
                "CallerIDNum: 5551234", "Exten: 2000", "Context: from-internal");
        eventually(() -> client.activeCalls().size() == 1);
        assertEquals("1001", client.activeCalls().get(0).extension());

        client.disconnect();
        assertFalse(client.isConnected());
        eventually(() -> server.received().stream().anyMatch(a -> "Logoff".equals(a.get("Action"))));
    }

    @Test
    void asyncStageMayBlockOnAnotherAction() throws Exception {
        runtime = runtime(server.port(), "amp111", false);
        runtime.start();
        AmiClient client = runtime.client();

        CompletableFuture<String> nested = client.sendActionAsync(AmiAction.of("Ping"))
                .thenApply(first -> client.sendAction(AmiAction.of("Ping")).status());

        assertEquals("Success", nested.get(5, TimeUnit.SECONDS));
        assertTrue(client.isConnected());
    }

    @Test
    void wrongSecretIsRejected() {
        runtime = runtime(server.port(), "wrong", false);

        assertThrows(AmiAuthenticationException.class, runtime::start);
        assertFalse(runtime.client().isConnected());
        assertEquals(ConnectionState.DISCONNECTED, runtime.client().connectionState());
    }

    @Test
    void closedPortIsTransportError() throws IOException {
        int closedPort;
        try (ServerSocket probe = new ServerSocket(0)) {
            closedPort = probe.getLocalPort();
        }
        runtime = runtime(closedPort, "amp111", false);

        assertThrows(AmiTransportException.class, runtime::start);
        assertEquals(ConnectionState.DISCONNECTED, runtime.client().connectionState());
    }

    @Test
    void droppedConnectionIsRecovered() throws IOException {
        runtime = runtime(server.port(), "amp111", true);
        runtime.start();
        AmiClient client = runtime.client();
        server.push("Event: Newchannel", "Uniqueid: U1", "Channel: SIP/1001-1", "Context: from-internal");
        eventually(() -> client.activeCalls().size() == 1);

        server.dropClient();

        eventually(() -> server.connections() == 2 && client.isConnected());
        assertTrue(client.activeCalls().isEmpty());
        assertTrue(sink.getStateTransitions().stream().anyMatch(t -> t.lostReady()));
    }

    private AmiClientRuntime runtime(int port, String secret, boolean autoReconnect) {
        AmiClientConfig config = AmiClientConfig.builder()
                .withHost("127.0.0.1")
                .withPort(port)
                .withCredentials("admin", secret)
                .withConnectTimeout(Duration.ofSeconds(2))
                .withReadTimeout(Duration.ofSeconds(2))
                .withTimingPolicy(new AmiTimingPolicy(Duration.ofSeconds(2), Duration.ofMillis(100), Duration.ZERO))
                .withAutoReconnect(autoReconnect)
                .build();
        return AmiClientRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(sink)
                .build();
    }

    private static void eventually(BooleanSupplier condition) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5 s");
            }
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                fail("interrupted");
            }
        }
    }
}
