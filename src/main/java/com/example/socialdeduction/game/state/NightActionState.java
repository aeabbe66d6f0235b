package com.example.socialdeduction.game.state;

import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.PhaseResultProcessor;

import java.util.Map;

public class NightActionState implements GamePhaseState {

    @Override
    public void process(GameSession session) {
        session.getState().enterPhase(GamePhase.NIGHT);
        session.getRecorder().record(EventType.PHASE_STARTED, "Night " + session.getState().getNight(),
                Map.of("phase", GamePhase.NIGHT.name(), "night", session.getState().getNight()));
    }

    @Override
    public void onExit(GameSession session, PhaseResultProcessor processor) {
        processor.processNight(session);
    }

    @Override
    public GamePhaseState nextState(GameSession session) {
        if (session.getState().isTerminal()) {
            return new GameOverState();
        }
        return new DayDiscussionState();
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.NIGHT;
    }
}
