package com.example.linguarelay.model;

import java.time.Instant;
import java.util.*;

/**
 * Room model: translation direction, member list and activity timestamps.
 * PresenceManager and RoomStore synchronize on Room instances, so this class itself does not add extra locking.
 */
public class Room {

    // ---------------------------------------------------------------------
    // Core identity
    // ---------------------------------------------------------------------

    private final String code;
    private final TranslationDirection translationDirection;
    private final Instant createdAt;

    /** Members by display name (insertion order preserved = join order). */
    private final Map<String, PresenceEntry> users = new LinkedHashMap<>();

    private Instant lastActivity;

    /** Set once the room has been removed from the store; a closed room accepts no joins. */
    private boolean closed = false;

    // ---------------------------------------------------------------------
    // Construction
    // ---------------------------------------------------------------------

    public Room(String code, TranslationDirection translationDirection, Instant createdAt) {
        this.code = Objects.requireNonNull(code, "code");
        this.translationDirection = Objects.requireNonNull(translationDirection, "translationDirection");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivity = createdAt;
    }

    // ---------------------------------------------------------------------
    // Basic accessors
    // ---------------------------------------------------------------------

    public String getCode() {
        return code;
    }

    public TranslationDirection getTranslationDirection() {
        return translationDirection;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    public void touch(Instant now) {
        if (now != null) this.lastActivity = now;
    }

    public boolean isClosed() {
        return closed;
    }

    public void markClosed() {
        this.closed = true;
    }

    // ---------------------------------------------------------------------
    // Users API (used by PresenceManager)
    // ---------------------------------------------------------------------

    /** Returns a snapshot list of entries, preserving join order. */
    public List<PresenceEntry> getUsers() {
        return new ArrayList<>(users.values());
    }

    /** Wire snapshot of the user list. */
    public List<UserView> userViews() {
        List<UserView> out = new ArrayList<>(users.size());
        for (PresenceEntry e : users.values()) out.add(UserView.of(e));
        return out;
    }

    public int userCount() {
        return users.size();
    }

    public boolean isEmpty() {
        return users.isEmpty();
    }

    public PresenceEntry getUser(String displayName) {
        if (displayName == null) return null;
        return users.get(displayName);
    }

    public Optional<PresenceEntry> findByConnectionId(String connectionId) {
        if (connectionId == null) return Optional.empty();
        for (PresenceEntry e : users.values()) {
            if (connectionId.equals(e.getConnectionId())) return Optional.of(e);
        }
        return Optional.empty();
    }

    /** Appends a new entry; an existing entry under the same name is kept in place. */
    public void addUser(PresenceEntry entry) {
        if (entry == null) return;
        users.putIfAbsent(entry.getDisplayName(), entry);
    }

    /** Removes the entry only if it is still bound to the given connection. */
    public boolean removeUser(String displayName, String connectionId) {
        PresenceEntry e = getUser(displayName);
        if (e == null || !Objects.equals(e.getConnectionId(), connectionId)) return false;
        users.remove(displayName);
        return true;
    }

    @Override
    public String toString() {
        return "Room{" +
                "code='" + code + '\'' +
                ", direction=" + translationDirection +
                ", users=" + users.keySet() +
                ", lastActivity=" + lastActivity +
                ", closed=" + closed +
                '}';
    }
}
