package com.questrail.amilink.protocol.ami.codec.impl;

import com.questrail.amilink.protocol.ami.internal.frame.AmiFrame;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DefaultAmiFrameReaderTest
 * -----------------------------------------------------------------------------
 * Unit tests for {@link DefaultAmiFrameReader}.
 *
 * <p>The reader only groups lines; it never splits or interprets them.</p>
 */
final class DefaultAmiFrameReaderTest
{
    private final DefaultAmiFrameReader reader = new DefaultAmiFrameReader();

    @Test
    void firstColonlessLineIsTheGreeting()
    {
        Optional<AmiFrame> frame = reader.onLine("Asterisk Call Manager/5.0.1\r");

        assertEquals(new AmiFrame.Greeting("Asterisk Call Manager/5.0.1"), frame.orElseThrow());
    }

    @Test
    void blankLineClosesBlock()
    {
        reader.onLine("Asterisk Call Manager/5.0.1");

        assertTrue(reader.onLine("Event: Newchannel").isEmpty());
        assertTrue(reader.onLine("Uniqueid: 1700000000.1").isEmpty());
        AmiFrame frame = reader.onLine("").orElseThrow();

        AmiFrame.Block block = assertInstanceOf(AmiFrame.Block.class, frame);
        assertEquals(List.of("Event: Newchannel", "Uniqueid: 1700000000.1"), block.lines());
    }

    @Test
    void blockWithoutGreetingIsAccepted()
    {
        List<AmiFrame> frames = feed("Response: Success", "Message: Pong", "");

        assertEquals(1, frames.size());
        assertInstanceOf(AmiFrame.Block.class, frames.get(0));
    }

    @Test
    void carriageReturnsAreStripped()
    {
        List<AmiFrame> frames = feed("Banner\r", "Event: Hangup\r", "Uniqueid: 42\r", "\r");

        AmiFrame.Block block = (AmiFrame.Block) frames.get(1);
        assertEquals(List.of("Event: Hangup", "Uniqueid: 42"), block.lines());
    }

    @Test
    void runsOfBlankLinesProduceNoEmptyBlocks()
    {
        List<AmiFrame> frames = feed("Banner", "", "", "Event: A", "", "", "", "Event: B", "");

        assertEquals(3, frames.size());
        assertEquals(List.of("Event: A"), ((AmiFrame.Block) frames.get(1)).lines());
        assertEquals(List.of("Event: B"), ((AmiFrame.Block) frames.get(2)).lines());
    }

    @Test
    void resetDiscardsPartialBlockAndExpectsNewGreeting()
    {
        feed("Banner", "Event: Newchannel", "Uniqueid: 1");

        assertEquals(2, reader.reset());

        List<AmiFrame> frames = feed("Banner 2", "Event: Hangup", "");
        assertEquals(new AmiFrame.Greeting("Banner 2"), frames.get(0));
        assertEquals(List.of("Event: Hangup"), ((AmiFrame.Block) frames.get(1)).lines());
    }

    @Test
    void discardPartialBlockSkipsToNextBlankLine()
    {
        feed("Banner", "Event: Newchannel", "Uniqueid: 1");

        reader.discardPartialBlock();

        // Tail of the damaged block.
        List<AmiFrame> frames = feed("Channel: SIP/1001-0001", "", "Event: Hangup", "");
        assertEquals(1, frames.size());
        assertEquals(List.of("Event: Hangup"), ((AmiFrame.Block) frames.get(0)).lines());
    }

    private List<AmiFrame> feed(String... lines)
    {
        List<AmiFrame> frames = new ArrayList<>();
        for (String line : lines) {
            reader.onLine(line).ifPresent(frames::add);
        }
        return frames;
    }
}
