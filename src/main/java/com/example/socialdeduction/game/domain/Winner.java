package com.example.socialdeduction.game.domain;

import java.util.Objects;

/**
 * Outcome of a game. Team games fill {@code team}; free-for-all games name the
 * surviving player. {@code forced} marks a time-box fallback.
 */
public record Winner(String name, Team team, String reason, boolean forced) {

    public Winner {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(reason, "reason");
    }

    public static Winner team(Team team, String reason) {
        return new Winner(team.getDisplayName(), team, reason, false);
    }

    public static Winner player(String playerName, String reason) {
        return new Winner(playerName, Team.SOLO, reason, false);
    }

    public Winner asForced() {
        return new Winner(name, team, reason, true);
    }
}
