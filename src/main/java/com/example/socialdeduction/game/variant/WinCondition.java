package com.example.socialdeduction.game.variant;

import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.service.GameSession;

import java.util.Optional;

/**
 * One win predicate. A variant lists them in evaluation order; the first one
 * that yields a winner ends the game.
 */
@FunctionalInterface
public interface WinCondition {

    Optional<Winner> check(GameSession session);
}
