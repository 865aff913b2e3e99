package com.example.linguarelay.handler;

import com.example.linguarelay.model.TranslationDirection;
import com.example.linguarelay.model.UserView;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RelayMessageCodecTest {

    private final RelayMessageCodec codec = new RelayMessageCodec();

    @Test
    void decode_readsEventAndTypedPayload() throws Exception {
        var env = codec.decode("{\"event\":\"join-room\",\"data\":{\"roomCode\":\"123456\",\"userName\":\"Asha\",\"extra\":1}}")
                .orElseThrow();

        assertEquals("join-room", env.event());
        var join = codec.payload(env, RelayMessages.JoinRoom.class);
        assertEquals("123456", join.roomCode());
        assertEquals("Asha", join.userName());
    }

    @Test
    void decode_missingData_becomesEmptyObject() throws Exception {
        var env = codec.decode("{\"event\":\"heartbeat\"}").orElseThrow();
        assertTrue(env.data().isObject());
        assertNull(codec.payload(env, RelayMessages.Heartbeat.class).roomCode());
    }

    @Test
    void decode_rejectsNonFrames() {
        assertTrue(codec.decode(null).isEmpty());
        assertTrue(codec.decode("  ").isEmpty());
        assertTrue(codec.decode("not json").isEmpty());
        assertTrue(codec.decode("[1,2]").isEmpty());
        assertTrue(codec.decode("{\"event\":42}").isEmpty());
        assertTrue(codec.decode("{\"data\":{}}").isEmpty());
    }

    @Test
    void payload_withWrongShape_throws() {
        var env = codec.decode("{\"event\":\"speech-data\",\"data\":{\"text\":{\"nested\":true}}}").orElseThrow();
        assertThrows(JsonProcessingException.class, () -> codec.payload(env, RelayMessages.SpeechData.class));
    }

    @Test
    void encode_usesWireDirection_andUserViews() throws Exception {
        String json = codec.encode(RelayMessages.ROOM_JOINED, new RelayMessages.RoomJoined(
                "123456", TranslationDirection.HI_TO_EN, List.of(new UserView("c1", "Asha"))));

        JsonNode root = codec.objectMapper().readTree(json);
        assertEquals("room-joined", root.path("event").asText());
        assertEquals("hi-to-en", root.path("data").path("translationDirection").asText());
        assertEquals("c1", root.path("data").path("users").get(0).path("id").asText());
        assertEquals("Asha", root.path("data").path("users").get(0).path("name").asText());
    }

    @Test
    void encode_bareEvent_hasNoData() {
        assertEquals("{\"event\":\"heartbeat-ack\"}", codec.encode(RelayMessages.HEARTBEAT_ACK, null));
    }
}
