package com.example.linguarelay.model;

/** Immutable user-list element as sent to clients: {@code {"id": connectionId, "name": displayName}}. */
public record UserView(String id, String name) {

    public static UserView of(PresenceEntry e) {
        return new UserView(e.getConnectionId(), e.getDisplayName());
    }
}
