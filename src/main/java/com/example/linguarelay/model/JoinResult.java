package com.example.linguarelay.model;

import java.util.List;

/** Outcome of a successful join: the room's direction and the user list right after the join. */
public record JoinResult(String roomCode,
                         TranslationDirection direction,
                         String displayName,
                         List<UserView> users,
                         boolean reconnected) {

    public JoinResult {
        users = List.copyOf(users);
    }
}
