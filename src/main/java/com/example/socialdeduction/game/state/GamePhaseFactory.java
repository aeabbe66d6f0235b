package com.example.socialdeduction.game.state;

import com.example.socialdeduction.game.domain.GamePhase;
import org.springframework.stereotype.Component;

/**
 * Entry state for a phase.
 */
@Component
public class GamePhaseFactory {

    public GamePhaseState getState(GamePhase phase) {
        return switch (phase) {
            case NIGHT -> new NightActionState();
            case DAY -> new DayDiscussionState();
            case TERMINAL -> new GameOverState();
            case SETUP -> throw new IllegalArgumentException("SETUP has no phase state");
        };
    }
}
