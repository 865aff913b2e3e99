package com.example.linguarelay.model;

import java.time.Instant;
import java.util.Objects;

/** A room member: stable display name bound to the connection currently speaking for it. */
public class PresenceEntry {

    public enum State { ACTIVE, GRACE }

    private final String displayName;
    private final Instant joinedAt;
    private String connectionId;         // overwritten on reconnect
    private State state = State.ACTIVE;  // GRACE while a departure check is pending
    private long graceEpoch;             // bumped on every markGrace

    public PresenceEntry(String displayName, String connectionId, Instant joinedAt) {
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.joinedAt = Objects.requireNonNull(joinedAt, "joinedAt");
    }

    // identity
    public String getDisplayName() { return displayName; }
    public Instant getJoinedAt() { return joinedAt; }

    // connection binding
    public String getConnectionId() { return connectionId; }

    /** Rebinds the entry to a new connection and marks it active again. */
    public void rebind(String connectionId) {
        this.connectionId = Objects.requireNonNull(connectionId, "connectionId");
        this.state = State.ACTIVE;
    }

    // presence
    public State getState() { return state; }
    public boolean isActive() { return state == State.ACTIVE; }
    public long getGraceEpoch() { return graceEpoch; }

    /** Enters GRACE and returns the new epoch; a departure check only acts on the epoch it was scheduled for. */
    public long markGrace() {
        this.state = State.GRACE;
        return ++graceEpoch;
    }

    @Override
    public String toString() {
        return "PresenceEntry{" +
                "displayName='" + displayName + '\'' +
                ", connectionId='" + connectionId + '\'' +
                ", state=" + state +
                '}';
    }
}
