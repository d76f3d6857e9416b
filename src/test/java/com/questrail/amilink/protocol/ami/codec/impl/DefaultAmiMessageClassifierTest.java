package com.questrail.amilink.protocol.ami.codec.impl;

import com.questrail.amilink.protocol.ami.internal.decode.AmiDecodeException;
import com.questrail.amilink.protocol.ami.internal.frame.AmiFrame;
import com.questrail.amilink.protocol.ami.model.AmiMessage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultAmiMessageClassifierTest
{
    private final DefaultAmiMessageClassifier classifier = new DefaultAmiMessageClassifier();

    @Test
    void eventHeaderMakesAnEvent()
    {
        AmiMessage m = classify("Event: Newchannel", "Channel: SIP/1001-00000001", "Uniqueid: 1700000000.1");

        assertTrue(m.isEvent());
        assertEquals("Newchannel", m.name());
        assertEquals("SIP/1001-00000001", m.get("channel").orElseThrow());
    }

    @Test
    void responseHeaderMakesAResponse()
    {
        AmiMessage m = classify("Response: Success", "ActionID: amilink-1-1", "Message: Authentication accepted");

        assertTrue(m.isResponse());
        assertEquals("Success", m.name());
        assertEquals("amilink-1-1", m.actionId().orElseThrow());
    }

    @Test
    void eventWinsOverResponse()
    {
        AmiMessage m = classify("Response: Success", "Event: FullyBooted");

        assertEquals(AmiMessage.Kind.EVENT, m.kind());
    }

    @Test
    void blockWithNeitherIsUnknown()
    {
        AmiMessage m = classify("Foo: bar");

        assertEquals(AmiMessage.Kind.UNKNOWN, m.kind());
        assertEquals("", m.name());
    }

    @Test
    void valuesMayContainColonsAndDuplicateKeysArePreserved()
    {
        AmiMessage m = classify("Event: VarSet", "Value: a:b: c", "Variable: X=1", "Variable: Y=2");

        assertEquals("a:b: c", m.get("Value").orElseThrow());
        assertEquals(List.of("X=1", "Y=2"), m.getAll("variable"));
    }

    @Test
    void colonlessLineIsDecodeError()
    {
        assertThrows(AmiDecodeException.class, () -> classify("Event: Newchannel", "garbage line"));
    }

    @Test
    void followsResponseKeepsCommandOutput()
    {
        AmiMessage m = classify(
                "Response: Follows",
                "Privilege: Command",
                "ActionID: amilink-1-7",
                "Name/username             Host",
                "1001/1001                 10.0.0.5",
                "--END COMMAND--");

        assertTrue(m.isResponse());
        assertEquals("amilink-1-7", m.actionId().orElseThrow());
        assertEquals(3, m.output().size());
        assertEquals("--END COMMAND--", m.output().get(2));
    }

    private AmiMessage classify(String... lines)
    {
        return classifier.classify(new AmiFrame.Block(List.of(lines)));
    }
}
