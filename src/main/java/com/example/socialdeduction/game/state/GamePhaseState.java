package com.example.socialdeduction.game.state;

import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.PhaseResultProcessor;

/**
 * One phase of the game loop (State Pattern).
 */
public interface GamePhaseState {

    /**
     * Phase entry: counters move exactly once here.
     */
    void process(GameSession session);

    /**
     * Phase exit: resolve what happened, delegating to the processor.
     */
    void onExit(GameSession session, PhaseResultProcessor processor);

    GamePhaseState nextState(GameSession session);

    GamePhase getGamePhase();
}
