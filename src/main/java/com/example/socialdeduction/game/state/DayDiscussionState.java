package com.example.socialdeduction.game.state;

import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.domain.PhaseCycle;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.PhaseResultProcessor;

import java.util.Map;

/**
 * The day: talk, nominations and votes, all run by the variant.
 */
public class DayDiscussionState implements GamePhaseState {

    @Override
    public void process(GameSession session) {
        session.getState().enterPhase(GamePhase.DAY);
        session.getRecorder().record(EventType.PHASE_STARTED, "Day " + session.getState().getDay(),
                Map.of("phase", GamePhase.DAY.name(), "day", session.getState().getDay()));
    }

    @Override
    public void onExit(GameSession session, PhaseResultProcessor processor) {
        processor.processDay(session);
    }

    @Override
    public GamePhaseState nextState(GameSession session) {
        if (session.getState().isTerminal()) {
            return new GameOverState();
        }
        if (session.getVariant().getPhaseCycle() == PhaseCycle.DAY_ONLY) {
            return new DayDiscussionState();
        }
        return new NightActionState();
    }

    @Override
    public GamePhase getGamePhase() {
        return GamePhase.DAY;
    }
}
