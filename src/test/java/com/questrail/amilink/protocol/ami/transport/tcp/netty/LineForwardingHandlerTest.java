package com.questrail.amilink.protocol.ami.transport.tcp.netty;

import com.questrail.amilink.protocol.ami.transport.AmiStreamEndpointListener;
import io.netty.buffer.Unpooled;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import io.netty.handler.codec.string.StringDecoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * LineForwardingHandlerTest
 * -----------------------------------------------------------------------------
 * Runs the inbound half of the production pipeline on an {@link EmbeddedChannel}.
 */
class LineForwardingHandlerTest {

    private RecordingListener listener;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
        channel = new EmbeddedChannel(
                new LineBasedFrameDecoder(64, true, false),
                new StringDecoder(StandardCharsets.UTF_8),
                new LineForwardingHandler(listener));
    }

    @Test
    void crlfLinesAreForwardedWithoutTerminators() {
        write("Asterisk Call Manager/5.0.1\r\nEvent: FullyBooted\r\nStatus: Fully Booted\r\n\r\n");

        assertEquals(List.of("Asterisk Call Manager/5.0.1", "Event: FullyBooted", "Status: Fully Booted", ""),
                listener.lines);
    }

    @Test
    void linesSplitAcrossReadsAreReassembled() {
        write("Event: Hang");
        write("up\r\nUniqueid: 1\r");
        write("\n\r\n");

        assertEquals(List.of("Event: Hangup", "Uniqueid: 1", ""), listener.lines);
    }

    @Test
    void overlongLineIsRejectedAndStreamContinues() {
        write("Event: VarSet\r\nValue: " + "x".repeat(200) + "\r\n\r\nEvent: Hangup\r\n\r\n");

        assertEquals(1, listener.rejected.size());
        assertInstanceOf(TooLongFrameException.class, listener.rejected.get(0));
        assertEquals(List.of("Event: VarSet", "", "Event: Hangup", ""), listener.lines);
        assertTrue(channel.isActive());
    }

    @Test
    void streamEndingMidBlockReportsOrderlyClose() {
        write("Event: Newchannel\r\nUniqueid: 1\r\n");

        channel.close();

        assertEquals(List.of("Event: Newchannel", "Uniqueid: 1"), listener.lines);
        assertEquals(1, listener.downs);
        assertNull(listener.downCause);
    }

    @Test
    void readFailureClosesChannelAndIsReportedOnce() {
        IOException reset = new IOException("Connection reset by peer");

        channel.pipeline().fireExceptionCaught(reset);
        channel.runPendingTasks();

        assertFalse(channel.isActive());
        assertEquals(1, listener.downs);
        assertSame(reset, listener.downCause);
    }

    private void write(String text) {
        channel.writeInbound(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8));
    }

    private static final class RecordingListener implements AmiStreamEndpointListener {
        final List<String> lines = new ArrayList<>();
        final List<Throwable> rejected = new ArrayList<>();
        int downs;
        Throwable downCause;

        @Override
        public void onTransportUp() {
        }

        @Override
        public void onTransportDown(Throwable cause) {
            downs++;
            downCause = cause;
        }

        @Override
        public void onLine(String line) {
            lines.add(line);
        }

        @Override
        public void onLineRejected(Throwable cause) {
            rejected.add(cause);
        }
    }
}
