package com.example.socialdeduction.game.state;

import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.domain.GameStatus;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.PhaseResultProcessor;

/**
 * Terminal state. Absorbing: it never leads anywhere else.
 */
public class GameOverState implements GamePhaseState {

    @Override
    public void process(GameSession session) {
        session.getState().setGamePhase(GamePhase.TERMINAL);
        session.getState().setStatus(GameStatus.ENDED);
    }

    @Override
    public void onExit(GameSession session, PhaseResultProcessor processor) {
    }

    @Override
    public GamePhaseState nextState(GameSession session) {
        return this;
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.TERMINAL;
    }
}
