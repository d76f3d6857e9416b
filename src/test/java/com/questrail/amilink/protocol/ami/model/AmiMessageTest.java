package com.questrail.amilink.protocol.ami.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class AmiMessageTest {

    @Test
    void headerLookupIgnoresCaseAndKeepsRepeats() {
        AmiMessage m = new AmiMessage(AmiMessage.Kind.EVENT, List.of(
                new AmiHeader("Event", "VarSet"),
                new AmiHeader("Variable", "A=1"),
                new AmiHeader("variable", "B=2")));

        assertEquals("VarSet", m.name());
        assertEquals("A=1", m.get("VARIABLE").orElseThrow());
        assertEquals(List.of("A=1", "B=2"), m.getAll("Variable"));
    }

    @Test
    void legacyEventListAnnouncementIsRecognised() {
        AmiMessage m = response("Channels will follow");

        assertTrue(m.isEventListStart());
    }

    @Test
    void eventListAnnouncementIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertTrue(response("QUEUE STATUS WILL FOLLOW").isEventListStart());
        } finally {
            Locale.setDefault(saved);
        }
    }

    @Test
    void eventListCompleteByHeaderOrName() {
        AmiMessage byHeader = new AmiMessage(AmiMessage.Kind.EVENT, List.of(
                new AmiHeader("Event", "CoreShowChannelsComplete"),
                new AmiHeader("EventList", "Complete")));
        AmiMessage byName = new AmiMessage(AmiMessage.Kind.EVENT, List.of(
                new AmiHeader("Event", "QueueStatusComplete")));

        assertTrue(byHeader.isEventListComplete());
        assertTrue(byName.isEventListComplete());
    }

    private static AmiMessage response(String text) {
        return new AmiMessage(AmiMessage.Kind.RESPONSE, List.of(
                new AmiHeader("Response", "Success"),
                new AmiHeader("Message", text)));
    }
}
