package com.example.linguarelay.handler;

import com.example.linguarelay.model.UserView;
import com.example.linguarelay.service.PresenceListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions and per-room broadcast groups.
 * Sessions are wrapped in ConcurrentWebSocketSessionDecorator: translation workers, presence timers and
 * the session's own thread all send to the same sessions.
 */
@Component
public class RoomBroadcaster implements PresenceListener {

    private static final Logger log = LoggerFactory.getLogger(RoomBroadcaster.class);

    static final int SEND_TIME_LIMIT_MS = 10_000;
    static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final RelayMessageCodec codec;

    /** connection id -> session */
    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    /** room code -> connection ids subscribed to it */
    private final Map<String, Set<String>> groups = new ConcurrentHashMap<>();

    public RoomBroadcaster(RelayMessageCodec codec) {
        this.codec = codec;
    }

    // --- sessions ---

    public void register(WebSocketSession session) {
        sessions.put(session.getId(),
                new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    /** Forgets the session and drops it from every group. */
    public void unregister(String connectionId) {
        if (connectionId == null) return;
        sessions.remove(connectionId);
        for (String code : new ArrayList<>(groups.keySet())) unsubscribe(code, connectionId);
    }

    // --- groups ---

    public void subscribe(String roomCode, String connectionId) {
        if (roomCode == null || connectionId == null) return;
        groups.computeIfAbsent(roomCode, k -> ConcurrentHashMap.newKeySet()).add(connectionId);
    }

    public void unsubscribe(String roomCode, String connectionId) {
        if (roomCode == null || connectionId == null) return;
        groups.computeIfPresent(roomCode, (k, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    public Set<String> members(String roomCode) {
        Set<String> m = (roomCode == null) ? null : groups.get(roomCode);
        return (m == null) ? Set.of() : Set.copyOf(m);
    }

    // --- sending ---

    /** Sends one frame to one connection; false if it is gone or the send failed. */
    public boolean sendTo(String connectionId, String event, Object data) {
        return deliver(connectionId, codec.encode(event, data));
    }

    public int broadcast(String roomCode, String event, Object data) {
        return broadcastExcept(roomCode, null, event, data);
    }

    /** Sends to every member of the room except {@code excludedConnectionId}; returns the delivery count. */
    public int broadcastExcept(String roomCode, String excludedConnectionId, String event, Object data) {
        Set<String> targets = members(roomCode);
        if (targets.isEmpty()) return 0;

        String json = codec.encode(event, data);
        int delivered = 0;
        for (String id : targets) {
            if (id.equals(excludedConnectionId)) continue;
            if (deliver(id, json)) delivered++;
        }
        return delivered;
    }

    private boolean deliver(String connectionId, String json) {
        WebSocketSession session = (connectionId == null) ? null : sessions.get(connectionId);
        if (session == null) return false;
        if (!session.isOpen()) {
            unregister(connectionId);
            return false;
        }
        try {
            session.sendMessage(new TextMessage(json));
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("WS send failed to {} : {}", connectionId, e.toString());
            unregister(connectionId);
            return false;
        }
    }

    // --- presence notifications ---

    @Override
    public void userJoined(String roomCode, String connectionId, String displayName, List<UserView> users) {
        broadcast(roomCode, RelayMessages.USER_JOINED, new RelayMessages.UserPresence(connectionId, displayName, users));
    }

    @Override
    public void userLeft(String roomCode, String connectionId, String displayName, List<UserView> users) {
        broadcast(roomCode, RelayMessages.USER_LEFT, new RelayMessages.UserPresence(connectionId, displayName, users));
    }

    @Override
    public void roomDeleted(String roomCode) {
        if (roomCode != null) groups.remove(roomCode);
    }
}
