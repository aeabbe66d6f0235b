package com.example.socialdeduction.game.variant;

import com.example.socialdeduction.game.domain.PhaseCycle;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.NightReport;
import com.example.socialdeduction.game.strategy.RoleActionFactory;

import java.util.List;
import java.util.Map;

/**
 * Rules of one game. Implementations are stateless; per-game state lives on the
 * {@link GameSession} (its {@link GameSession#getBoard(Class) board}).
 */
public interface GameVariant {

    /**
     * Registry key, e.g. {@code "botc"}.
     */
    String getKey();

    RoleTable getRoleTable();

    PhaseCycle getPhaseCycle();

    /**
     * Agent seats that are not players (an arbiter, for instance).
     */
    default List<String> getExtraSeats() {
        return List.of();
    }

    /**
     * Night-zero work: boards, decks, ally knowledge.
     */
    void setup(GameSession session);

    default RoleActionFactory getRoleActionFactory() {
        return RoleActionFactory.none();
    }

    /**
     * Runs after the night engine and before the win check.
     */
    default void afterNight(GameSession session, NightReport report) {
    }

    /**
     * The whole day: talk, nominations, votes, overrides, one-shot abilities.
     * Must return as soon as the game has a winner.
     */
    void runDay(GameSession session);

    List<WinCondition> getWinConditions();

    /**
     * Deterministic winner used when the round cap or the time budget runs out.
     */
    Winner fallbackWinner(GameSession session);

    /**
     * Public board counters shown to every agent. Values must not be null.
     */
    default Map<String, Object> describeBoard(GameSession session) {
        return Map.of();
    }
}
