package com.example.linguarelay.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RoomTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void addUser_keepsJoinOrder_andIgnoresDuplicateName() {
        Room r = new Room("123456", TranslationDirection.EN_TO_HI, T0);
        r.addUser(new PresenceEntry("Asha", "c1", T0));
        r.addUser(new PresenceEntry("Ben", "c2", T0));
        r.addUser(new PresenceEntry("Asha", "c3", T0)); // same name: first entry stays

        assertEquals(List.of(new UserView("c1", "Asha"), new UserView("c2", "Ben")), r.userViews());
        assertEquals(2, r.userCount());
    }

    @Test
    void rebind_movesEntryToNewConnection_andBackToActive() {
        Room r = new Room("123456", TranslationDirection.EN_TO_HI, T0);
        PresenceEntry asha = new PresenceEntry("Asha", "c1", T0);
        r.addUser(asha);

        asha.markGrace();
        assertFalse(asha.isActive());

        asha.rebind("c9");
        assertTrue(asha.isActive());
        assertTrue(r.findByConnectionId("c1").isEmpty(), "old connection id must no longer resolve");
        assertSame(asha, r.findByConnectionId("c9").orElseThrow());
    }

    @Test
    void removeUser_onlyWhenStillBoundToGivenConnection() {
        Room r = new Room("123456", TranslationDirection.HI_TO_EN, T0);
        r.addUser(new PresenceEntry("Asha", "c2", T0));

        assertFalse(r.removeUser("Asha", "c1"), "stale connection must not remove the entry");
        assertEquals(1, r.userCount());

        assertTrue(r.removeUser("Asha", "c2"));
        assertTrue(r.isEmpty());
    }

    @Test
    void lastActivity_startsAtCreation_andMovesOnTouch() {
        Room r = new Room("123456", TranslationDirection.EN_TO_HI, T0);
        assertEquals(T0, r.getCreatedAt());
        assertEquals(T0, r.getLastActivity());

        Instant later = T0.plusSeconds(90);
        r.touch(later);
        assertEquals(later, r.getLastActivity());
        assertEquals(T0, r.getCreatedAt());
    }

    @Test
    void direction_parsesWireValuesAndResolvesLanguages() {
        assertEquals(TranslationDirection.EN_TO_HI, TranslationDirection.parse("en-to-hi").orElseThrow());
        assertEquals(TranslationDirection.HI_TO_EN, TranslationDirection.parse(" HI_TO_EN ").orElseThrow());
        assertTrue(TranslationDirection.parse("fr-to-de").isEmpty());
        assertTrue(TranslationDirection.parse(null).isEmpty());

        assertEquals(new LanguagePair("English", "Hindi"), TranslationDirection.EN_TO_HI.languages());
        assertEquals(new LanguagePair("Hindi", "English"), TranslationDirection.HI_TO_EN.languages());
    }
}
