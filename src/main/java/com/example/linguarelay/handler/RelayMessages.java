package com.example.linguarelay.handler;

import com.example.linguarelay.model.TranslationDirection;
import com.example.linguarelay.model.UserView;

import java.util.List;

/** Event names and payload shapes of the relay socket protocol. */
public final class RelayMessages {

    private RelayMessages() { }

    // client -> server
    public static final String JOIN_ROOM = "join-room";
    public static final String HEARTBEAT = "heartbeat";
    public static final String SPEECH_DATA = "speech-data";
    public static final String CONNECTION_STATUS = "connection-status";

    // server -> client
    public static final String ROOM_JOINED = "room-joined";
    public static final String USER_JOINED = "user-joined";
    public static final String USER_LEFT = "user-left";
    public static final String HEARTBEAT_ACK = "heartbeat-ack";
    public static final String TRANSLATED_SPEECH = "translated-speech";
    public static final String ERROR = "error";

    public static final String ROOM_NOT_FOUND = "Room not found";
    public static final String TRANSLATION_FAILED = "Translation failed. Please try again.";

    public record JoinRoom(String roomCode, String userName) { }

    public record Heartbeat(String roomCode) { }

    public record SpeechData(String roomCode, String text) { }

    public record ConnectionStatus(String roomCode, String status) { }

    public record RoomJoined(String roomCode, TranslationDirection translationDirection, List<UserView> users) { }

    public record UserPresence(String userId, String userName, List<UserView> users) { }

    public record TranslatedSpeech(String originalText, String translatedText, String userId) { }

    public record ErrorMessage(String message) { }
}
