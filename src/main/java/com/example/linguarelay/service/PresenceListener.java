package com.example.linguarelay.service;

import com.example.linguarelay.model.UserView;

import java.util.List;

/** Room-wide presence notifications emitted by PresenceManager and RoomJanitor. */
public interface PresenceListener {

    /** A user joined or reconnected; {@code users} is the full list after the join. */
    void userJoined(String roomCode, String connectionId, String displayName, List<UserView> users);

    /** A user's grace period ran out; {@code users} is the list without them. */
    void userLeft(String roomCode, String connectionId, String displayName, List<UserView> users);

    default void roomDeleted(String roomCode) { }
}
