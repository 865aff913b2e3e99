package com.example.linguarelay.service;

import com.example.linguarelay.config.RelayProperties;
import com.example.linguarelay.model.JoinResult;
import com.example.linguarelay.model.PresenceEntry;
import com.example.linguarelay.model.Room;
import com.example.linguarelay.model.TranslationDirection;
import com.example.linguarelay.model.UserView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.*;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Presence state machine per (room, display name): join, heartbeat, disconnect with grace, departure.
 *
 * A disconnect does not remove anyone. It schedules a departure check that re-reads the room when it fires:
 * if the name was rebound to another connection in the meantime the check does nothing, so a reconnect
 * cancels the pending departure without touching the timer. When the last user leaves, a second, longer
 * check deletes the room if it is still empty by then.
 */
@Service
public class PresenceManager {

    private static final Logger log = LoggerFactory.getLogger(PresenceManager.class);

    static final int MAX_NAME_LENGTH = 80;

    private static final long ANY_EPOCH = -1L;

    private final RoomStore store;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final List<PresenceListener> listeners;
    private final Duration shortGrace;
    private final Duration longGrace;

    @Autowired
    public PresenceManager(RoomStore store,
                           Clock clock,
                           @Qualifier("presenceScheduler") ScheduledExecutorService scheduler,
                           RelayProperties props,
                           ObjectProvider<PresenceListener> listeners) {
        this(store, clock, scheduler, props.getShortGrace(), props.getLongGrace(),
                listeners.orderedStream().toList());
    }

    public PresenceManager(RoomStore store,
                           Clock clock,
                           ScheduledExecutorService scheduler,
                           Duration shortGrace,
                           Duration longGrace,
                           List<PresenceListener> listeners) {
        this.store = Objects.requireNonNull(store, "store");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.shortGrace = Objects.requireNonNull(shortGrace, "shortGrace");
        this.longGrace = Objects.requireNonNull(longGrace, "longGrace");
        this.listeners = List.copyOf(listeners);
    }

    // ========================================================================
    //  JOIN / HEARTBEAT / ACTIVITY
    // ========================================================================

    /**
     * Adds the user to the room, or rebinds an existing entry of the same name to {@code connectionId}.
     * A connection already present under a different name is renamed: the old entry leaves, the new one joins.
     * Empty if the room does not exist (or was deleted while we were looking at it).
     */
    public Optional<JoinResult> join(String roomCode, String requestedName, String connectionId) {
        Objects.requireNonNull(connectionId, "connectionId");
        Room room = store.getRoom(roomCode).orElse(null);
        if (room == null) return Optional.empty();

        String name = normalizeName(requestedName);
        JoinResult result;
        String replacedName = null;

        synchronized (room) {
            if (room.isClosed()) return Optional.empty();

            // One entry per connection: joining again under another name replaces the old entry.
            PresenceEntry renamed = room.findByConnectionId(connectionId)
                    .filter(e -> !e.getDisplayName().equals(name))
                    .orElse(null);
            if (renamed != null) {
                room.removeUser(renamed.getDisplayName(), connectionId);
                replacedName = renamed.getDisplayName();
            }

            PresenceEntry existing = room.getUser(name);
            boolean reconnected = existing != null;
            if (reconnected) {
                existing.rebind(connectionId);
            } else {
                room.addUser(new PresenceEntry(name, connectionId, clock.instant()));
            }
            room.touch(clock.instant());
            result = new JoinResult(room.getCode(), room.getTranslationDirection(), name,
                    room.userViews(), reconnected);
        }

        if (replacedName != null) {
            log.info("PRESENCE RENAME room={} conn={} {} -> {}", result.roomCode(), connectionId, replacedName, name);
            for (PresenceListener l : listeners) {
                try {
                    l.userLeft(result.roomCode(), connectionId, replacedName, result.users());
                } catch (RuntimeException e) {
                    log.warn("PRESENCE listener failed on rename (room={}, name={})", result.roomCode(), replacedName, e);
                }
            }
        }

        if (result.reconnected()) {
            log.info("PRESENCE RECONNECT room={} name={} conn={}", result.roomCode(), name, connectionId);
        } else {
            log.info("PRESENCE JOIN room={} name={} conn={} total={}",
                    result.roomCode(), name, connectionId, result.users().size());
        }

        for (PresenceListener l : listeners) {
            try {
                l.userJoined(result.roomCode(), connectionId, name, result.users());
            } catch (RuntimeException e) {
                log.warn("PRESENCE listener failed on join (room={}, name={})", result.roomCode(), name, e);
            }
        }
        return Optional.of(result);
    }

    /** Liveness signal; true if the room exists. */
    public boolean heartbeat(String roomCode) {
        Room room = store.getRoom(roomCode).orElse(null);
        if (room == null) return false;
        synchronized (room) {
            if (room.isClosed()) return false;
            room.touch(clock.instant());
        }
        return true;
    }

    /** Marks a message in the room as activity; returns the room's direction, empty if absent. */
    public Optional<TranslationDirection> recordSpeech(String roomCode) {
        Room room = store.getRoom(roomCode).orElse(null);
        if (room == null) return Optional.empty();
        synchronized (room) {
            if (room.isClosed()) return Optional.empty();
            room.touch(clock.instant());
            return Optional.of(room.getTranslationDirection());
        }
    }

    // ========================================================================
    //  DISCONNECT / DEPARTURE
    // ========================================================================

    /**
     * Starts the grace period for whoever is bound to {@code connectionId}.
     * Returns false if no entry matches (the user already came back under a newer connection).
     */
    public boolean disconnect(String roomCode, String connectionId) {
        Room room = store.getRoom(roomCode).orElse(null);
        if (room == null || connectionId == null) return false;

        final String name;
        final long epoch;
        synchronized (room) {
            PresenceEntry entry = room.findByConnectionId(connectionId).orElse(null);
            if (entry == null) return false;
            epoch = entry.markGrace();
            name = entry.getDisplayName();
        }

        log.info("PRESENCE GRACE room={} name={} conn={} delay={}", room.getCode(), name, connectionId, shortGrace);
        scheduler.schedule(() -> {
            try {
                checkDeparture(room.getCode(), name, connectionId, epoch);
            } catch (RuntimeException e) {
                log.error("PRESENCE departure check failed (room={}, name={})", room.getCode(), name, e);
            }
        }, shortGrace.toMillis(), TimeUnit.MILLISECONDS);
        return true;
    }

    /** Departure check for whatever grace period the entry is currently in. */
    public boolean checkDeparture(String roomCode, String displayName, String connectionId) {
        return checkDeparture(roomCode, displayName, connectionId, ANY_EPOCH);
    }

    /**
     * Fires after the short grace delay. Removes the user only if their entry is still bound to the
     * connection that dropped, still in GRACE, and in the grace period this check was scheduled for
     * (a rejoin on the same connection makes it ACTIVE again; a later drop starts a new epoch).
     * Returns whether the user was removed.
     */
    public boolean checkDeparture(String roomCode, String displayName, String connectionId, long epoch) {
        Room room = store.getRoom(roomCode).orElse(null);
        if (room == null) return false;

        List<UserView> users;
        boolean empty;
        synchronized (room) {
            PresenceEntry entry = room.getUser(displayName);
            if (entry == null) return false;
            if (!Objects.equals(entry.getConnectionId(), connectionId)) {
                log.debug("PRESENCE departure skipped, {} reconnected as {}", displayName, entry.getConnectionId());
                return false;
            }
            if (entry.isActive() || (epoch != ANY_EPOCH && entry.getGraceEpoch() != epoch)) {
                log.debug("PRESENCE departure skipped, {} rejoined on {}", displayName, connectionId);
                return false;
            }
            room.removeUser(displayName, connectionId);
            room.touch(clock.instant());
            users = room.userViews();
            empty = room.isEmpty();
        }

        log.info("PRESENCE LEAVE room={} name={} remaining={}", roomCode, displayName, users.size());
        for (PresenceListener l : listeners) {
            try {
                l.userLeft(roomCode, connectionId, displayName, users);
            } catch (RuntimeException e) {
                log.warn("PRESENCE listener failed on leave (room={}, name={})", roomCode, displayName, e);
            }
        }

        if (empty) scheduleEmptyRoomCheck(room);
        return true;
    }

    private void scheduleEmptyRoomCheck(Room room) {
        log.info("ROOM EMPTY code={} deleting in {} unless someone joins", room.getCode(), longGrace);
        scheduler.schedule(() -> {
            try {
                checkEmptyRoom(room);
            } catch (RuntimeException e) {
                log.error("ROOM empty check failed (code={})", room.getCode(), e);
            }
        }, longGrace.toMillis(), TimeUnit.MILLISECONDS);
    }

    /** Fires after the long grace delay: deletes the room if it is still registered and still empty. */
    public boolean checkEmptyRoom(Room room) {
        if (!store.deleteIf(room, Room::isEmpty)) return false;
        log.info("ROOM DELETE code={} (empty after grace)", room.getCode());
        notifyRoomDeleted(listeners, room.getCode());
        return true;
    }

    // ========================================================================
    //  MISC HELPERS
    // ========================================================================

    static void notifyRoomDeleted(List<PresenceListener> listeners, String roomCode) {
        for (PresenceListener l : listeners) {
            try {
                l.roomDeleted(roomCode);
            } catch (RuntimeException e) {
                log.warn("ROOM listener failed on delete (code={})", roomCode, e);
            }
        }
    }

    static String normalizeName(String s) {
        String t = (s == null) ? "" : s.trim();
        if (t.isEmpty()) t = "Guest";
        if (t.length() > MAX_NAME_LENGTH) t = t.substring(0, MAX_NAME_LENGTH);
        return t;
    }
}
