package com.example.linguarelay.handler;

import com.example.linguarelay.model.JoinResult;
import com.example.linguarelay.model.LanguagePair;
import com.example.linguarelay.model.TranslationDirection;
import com.example.linguarelay.service.PresenceManager;
import com.example.linguarelay.service.RoomStore;
import com.example.linguarelay.translation.Translation;
import com.example.linguarelay.translation.TranslationGateway;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * WebSocket handler for the relay socket.
 * - join-room: binds the connection to one room (PresenceManager decides join vs. reconnect)
 * - heartbeat: refreshes room activity, acks if the room exists
 * - speech-data: translates off-thread and relays to everyone else in the room, in send order per connection
 * - connection-status: logged only
 * - on close: hands the connection to PresenceManager's grace period
 * Anything else is ignored.
 */
@Component
public class RelayWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(RelayWebSocketHandler.class);

    private final PresenceManager presence;
    private final RoomStore rooms;
    private final TranslationGateway gateway;
    private final RoomBroadcaster broadcaster;
    private final RelayMessageCodec codec;

    /** Per WebSocket session → bound room + speech chain */
    private final Map<String, Conn> bySession = new ConcurrentHashMap<>();

    public RelayWebSocketHandler(PresenceManager presence,
                                 RoomStore rooms,
                                 TranslationGateway gateway,
                                 RoomBroadcaster broadcaster,
                                 RelayMessageCodec codec) {
        this.presence = presence;
        this.rooms = rooms;
        this.gateway = gateway;
        this.broadcaster = broadcaster;
        this.codec = codec;
    }

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        broadcaster.register(session);
        bySession.put(session.getId(), new Conn());
        log.info("WS OPEN sid={} remote={}", session.getId(), session.getRemoteAddress());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) throws Exception {
        Conn c = bySession.get(session.getId());
        if (c == null) {
            log.warn("WS message from unknown session sid={}", session.getId());
            return;
        }

        var envelope = codec.decode(message.getPayload()).orElse(null);
        if (envelope == null) {
            log.warn("WS malformed frame ignored (sid={})", session.getId());
            return;
        }

        try {
            switch (envelope.event()) {
                case RelayMessages.JOIN_ROOM ->
                        onJoin(session.getId(), c, codec.payload(envelope, RelayMessages.JoinRoom.class));
                case RelayMessages.HEARTBEAT ->
                        onHeartbeat(session.getId(), codec.payload(envelope, RelayMessages.Heartbeat.class));
                case RelayMessages.SPEECH_DATA ->
                        onSpeech(session.getId(), c, codec.payload(envelope, RelayMessages.SpeechData.class));
                case RelayMessages.CONNECTION_STATUS -> {
                    var s = codec.payload(envelope, RelayMessages.ConnectionStatus.class);
                    log.info("WS STATUS sid={} room={} status={}", session.getId(), s.roomCode(), s.status());
                }
                default -> log.debug("Ignored event: {}", envelope.event());
            }
        } catch (JsonProcessingException e) {
            log.warn("WS bad '{}' payload ignored (sid={}): {}", envelope.event(), session.getId(), e.getOriginalMessage());
        } catch (Throwable t) {
            log.error("WS handleTextMessage failed (sid={}, event={})", session.getId(), envelope.event(), t);
            try { session.close(CloseStatus.SERVER_ERROR); } catch (Exception closeError) { t.addSuppressed(closeError); }
            throw t;
        }
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        log.error("WS ERROR sid={} : transport error", session.getId(), exception);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        Conn c = bySession.remove(session.getId());
        broadcaster.unregister(session.getId());

        String roomCode = (c == null) ? null : c.roomCode();
        log.info("WS CLOSE sid={} room={} code={} reason={}",
                session.getId(), roomCode, status.getCode(), status.getReason());

        if (roomCode != null) {
            try {
                presence.disconnect(roomCode, session.getId());
            } catch (RuntimeException e) {
                log.error("WS afterConnectionClosed handling failed (room={}, sid={})", roomCode, session.getId(), e);
            }
        }
    }

    /* ---------------- events ---------------- */

    private void onJoin(String sid, Conn c, RelayMessages.JoinRoom req) {
        String code = trimToNull(req.roomCode());
        log.info("WS JOIN sid={} name={} room={}", sid, req.userName(), code);
        if (code == null) {
            broadcaster.sendTo(sid, RelayMessages.ERROR, new RelayMessages.ErrorMessage(RelayMessages.ROOM_NOT_FOUND));
            return;
        }

        String previous = c.roomCode();

        // Subscribe first so the user-joined broadcast from PresenceManager reaches this connection too.
        broadcaster.subscribe(code, sid);
        Optional<JoinResult> joined = presence.join(code, req.userName(), sid);
        if (joined.isEmpty()) {
            broadcaster.unsubscribe(code, sid);
            if (code.equals(previous)) c.bind(null);
            broadcaster.sendTo(sid, RelayMessages.ERROR, new RelayMessages.ErrorMessage(RelayMessages.ROOM_NOT_FOUND));
            return;
        }

        // One room per connection: switching rooms leaves the old one through the usual grace path.
        if (previous != null && !previous.equals(code)) {
            broadcaster.unsubscribe(previous, sid);
            presence.disconnect(previous, sid);
        }
        c.bind(code);

        JoinResult r = joined.get();
        broadcaster.sendTo(sid, RelayMessages.ROOM_JOINED,
                new RelayMessages.RoomJoined(r.roomCode(), r.direction(), r.users()));
    }

    private void onHeartbeat(String sid, RelayMessages.Heartbeat req) {
        if (presence.heartbeat(trimToNull(req.roomCode()))) {
            broadcaster.sendTo(sid, RelayMessages.HEARTBEAT_ACK, null);
        }
    }

    private void onSpeech(String sid, Conn c, RelayMessages.SpeechData req) {
        String text = req.text();
        if (text == null || text.isBlank()) {
            log.debug("WS empty speech ignored (sid={})", sid);
            return;
        }
        String code = trimToNull(req.roomCode());
        if (code == null) code = c.roomCode();

        log.info("SPEECH room={} from={} text=\"{}\"", code, sid, abbreviate(text));

        Optional<TranslationDirection> direction = presence.recordSpeech(code);
        if (direction.isEmpty()) {
            broadcaster.sendTo(sid, RelayMessages.ERROR, new RelayMessages.ErrorMessage(RelayMessages.ROOM_NOT_FOUND));
            return;
        }

        final String roomCode = code;
        final LanguagePair languages = direction.get().languages();
        c.chain(prev -> prev
                .thenCompose(v -> gateway.translateAsync(text, languages))
                .thenAccept(t -> relaySpeech(roomCode, sid, text, t))
                .exceptionally(ex -> {
                    Throwable cause = (ex instanceof CompletionException && ex.getCause() != null) ? ex.getCause() : ex;
                    log.error("Translation processing error (room={}, sid={})", roomCode, sid, cause);
                    broadcaster.sendTo(sid, RelayMessages.ERROR,
                            new RelayMessages.ErrorMessage(RelayMessages.TRANSLATION_FAILED));
                    return null;
                }));
    }

    private void relaySpeech(String roomCode, String sid, String originalText, Translation t) {
        if (!rooms.exists(roomCode)) {
            throw new IllegalStateException("Room " + roomCode + " disappeared during translation");
        }
        int n = broadcaster.broadcastExcept(roomCode, sid, RelayMessages.TRANSLATED_SPEECH,
                new RelayMessages.TranslatedSpeech(originalText, t.text(), sid));
        log.info("SPEECH relayed room={} from={} to={} degraded={} text=\"{}\"",
                roomCode, sid, n, t.degraded(), abbreviate(t.text()));
    }

    /* ---------------- helpers ---------------- */

    private static String trimToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 30 ? s.substring(0, 30) + "..." : s;
    }

    /** Mutable per-connection state: the bound room and the tail of its speech chain. */
    private static final class Conn {
        private volatile String roomCode;
        private CompletableFuture<Void> speechTail = CompletableFuture.completedFuture(null);

        String roomCode() { return roomCode; }

        void bind(String roomCode) { this.roomCode = roomCode; }

        synchronized void chain(UnaryOperator<CompletableFuture<Void>> next) {
            speechTail = next.apply(speechTail);
        }
    }
}
