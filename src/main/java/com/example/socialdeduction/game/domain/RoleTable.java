package com.example.socialdeduction.game.domain;

import com.example.socialdeduction.global.random.RandomSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Player-count keyed balance table. Changing a variant's table is the only way
 * to change its balance.
 */
public interface RoleTable {

    int getMinPlayers();

    int getMaxPlayers();

    /**
     * Team sizes for {@code playerCount} seats.
     */
    Map<Team, Integer> teamCounts(int playerCount);

    /**
     * Draws a role multiset (unshuffled) that satisfies {@link #teamCounts(int)}.
     */
    List<Role> draw(int playerCount, RandomSource random);

    /**
     * Exact count of each role a roster of {@code playerCount} must hold. Roles not
     * listed fill the rest of their team freely.
     */
    default Map<Role, Integer> requiredRoleCounts(int playerCount) {
        return Map.of();
    }

    /**
     * Checks an explicit roster beyond its team sizes and required role counts.
     *
     * @return what is wrong with the roster, or empty when it can be dealt
     */
    default Optional<String> rosterProblem(int playerCount, List<Role> roles) {
        return Optional.empty();
    }

    default boolean supports(int playerCount) {
        return playerCount >= getMinPlayers() && playerCount <= getMaxPlayers();
    }
}
