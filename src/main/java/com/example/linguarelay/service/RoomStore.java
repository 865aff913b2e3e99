package com.example.linguarelay.service;

import com.example.linguarelay.model.Room;
import com.example.linguarelay.model.TranslationDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-memory registry of rooms keyed by their six-digit code.
 * The map itself is concurrent; anything that reads and then mutates a room's user list locks the Room instance.
 */
@Service
public class RoomStore {

    private static final Logger log = LoggerFactory.getLogger(RoomStore.class);

    static final int CODE_MIN = 100_000;
    static final int CODE_SPAN = 900_000;
    private static final int MAX_CODE_ATTEMPTS = 100;

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Random random;

    @Autowired
    public RoomStore(Clock clock) {
        this(clock, new SecureRandom());
    }

    public RoomStore(Clock clock, Random random) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    /** Creates an empty room and returns its code. A code already in use is regenerated. */
    public String createRoom(TranslationDirection direction) {
        Objects.requireNonNull(direction, "direction");
        for (int attempt = 1; attempt <= MAX_CODE_ATTEMPTS; attempt++) {
            String code = Integer.toString(CODE_MIN + random.nextInt(CODE_SPAN));
            Room room = new Room(code, direction, clock.instant());
            if (rooms.putIfAbsent(code, room) == null) {
                log.info("ROOM CREATE code={} direction={} total={}", code, direction, rooms.size());
                return code;
            }
            log.warn("ROOM CREATE code collision on {} (attempt {})", code, attempt);
        }
        throw new IllegalStateException("No free room code after " + MAX_CODE_ATTEMPTS + " attempts");
    }

    public Optional<Room> getRoom(String code) {
        if (code == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(code.trim()));
    }

    public boolean exists(String code) {
        return getRoom(code).isPresent();
    }

    /** Removes the room if present; returns whether anything was removed. */
    public boolean deleteRoom(String code) {
        if (code == null) return false;
        Room removed = rooms.remove(code.trim());
        if (removed == null) return false;
        synchronized (removed) {
            removed.markClosed();
        }
        log.info("ROOM DELETE code={} total={}", removed.getCode(), rooms.size());
        return true;
    }

    /**
     * Removes exactly this room instance if the condition still holds under its lock.
     * A room that was already replaced or closed is left alone.
     */
    public boolean deleteIf(Room room, Predicate<Room> condition) {
        if (room == null) return false;
        synchronized (room) {
            if (room.isClosed() || !condition.test(room)) return false;
            if (!rooms.remove(room.getCode(), room)) return false;
            room.markClosed();
        }
        return true;
    }

    /** Snapshot of all rooms (for the janitor and diagnostics). */
    public List<Room> listRooms() {
        return new ArrayList<>(rooms.values());
    }

    public int size() {
        return rooms.size();
    }
}
