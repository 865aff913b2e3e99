package com.example.linguarelay.service;

import com.example.linguarelay.model.PresenceEntry;
import com.example.linguarelay.model.Room;
import com.example.linguarelay.model.TranslationDirection;
import com.example.linguarelay.support.TestClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class RoomStoreTest {

    private TestClock clock;
    private RoomStore store;

    @BeforeEach
    void setUp() {
        clock = new TestClock(Instant.parse("2024-05-01T10:00:00Z"));
        store = new RoomStore(clock, new Random(42));
    }

    @Test
    void createRoom_returnsSixDigitCode_andRegistersEmptyRoom() {
        String code = store.createRoom(TranslationDirection.EN_TO_HI);

        assertTrue(code.matches("[1-9]\\d{5}"), "code should be six digits: " + code);
        Room room = store.getRoom(code).orElseThrow();
        assertEquals(TranslationDirection.EN_TO_HI, room.getTranslationDirection());
        assertTrue(room.isEmpty());
        assertEquals(clock.instant(), room.getCreatedAt());
        assertTrue(store.exists(code));
    }

    @Test
    @DisplayName("a code that is already taken is regenerated, never overwritten")
    void createRoom_regeneratesOnCollision() {
        Random scripted = new Random() {
            private final int[] draws = {5, 5, 7};
            private int i = 0;

            @Override
            public int nextInt(int bound) {
                return draws[i++];
            }
        };
        RoomStore colliding = new RoomStore(clock, scripted);

        String first = colliding.createRoom(TranslationDirection.EN_TO_HI);
        String second = colliding.createRoom(TranslationDirection.HI_TO_EN);

        assertEquals("100005", first);
        assertEquals("100007", second);
        assertEquals(TranslationDirection.EN_TO_HI, colliding.getRoom(first).orElseThrow().getTranslationDirection());
        assertEquals(2, colliding.size());
    }

    @Test
    void deleteRoom_isIdempotent_andClosesTheRoom() {
        String code = store.createRoom(TranslationDirection.HI_TO_EN);
        Room room = store.getRoom(code).orElseThrow();

        assertTrue(store.deleteRoom(code));
        assertFalse(store.deleteRoom(code));
        assertFalse(store.deleteRoom("000000"));
        assertFalse(store.exists(code));
        assertTrue(room.isClosed());
    }

    @Test
    void deleteIf_respectsCondition_andLeavesPopulatedRoomsAlone() {
        String code = store.createRoom(TranslationDirection.EN_TO_HI);
        Room room = store.getRoom(code).orElseThrow();
        room.addUser(new PresenceEntry("Asha", "c1", clock.instant()));

        assertFalse(store.deleteIf(room, Room::isEmpty));
        assertTrue(store.exists(code));

        room.removeUser("Asha", "c1");
        assertTrue(store.deleteIf(room, Room::isEmpty));
        assertFalse(store.exists(code));
        assertFalse(store.deleteIf(room, Room::isEmpty), "already closed");
    }

    @Test
    void listRooms_isASnapshot() {
        store.createRoom(TranslationDirection.EN_TO_HI);
        store.createRoom(TranslationDirection.HI_TO_EN);

        var snapshot = store.listRooms();
        store.createRoom(TranslationDirection.EN_TO_HI);

        assertEquals(2, snapshot.size());
        assertEquals(3, store.size());
    }

    @Test
    void getRoom_handlesNullAndWhitespace() {
        String code = store.createRoom(TranslationDirection.EN_TO_HI);
        assertTrue(store.getRoom(null).isEmpty());
        assertTrue(store.getRoom(" " + code + " ").isPresent());
    }
}
