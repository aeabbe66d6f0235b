package com.example.socialdeduction.game.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Resolves a phase when it ends. Called back from {@code GamePhaseState.onExit}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PhaseResultProcessor {

    private final NightActionService nightActionService;
    private final WinEvaluator winEvaluator;

    // ==================== phase results ====================

    /**
     * NIGHT end: resolve the powers, let the variant react, check for a winner.
     */
    public void processNight(GameSession session) {
        NightReport report = nightActionService.resolveNight(session);
        if (!session.getState().isTerminal()) {
            session.getVariant().afterNight(session, report);
        }
        checkGameEnd(session);
    }

    /**
     * DAY end: the variant runs its day, then the win check.
     */
    public void processDay(GameSession session) {
        session.getVariant().runDay(session);
        checkGameEnd(session);
    }

    // ==================== game end ====================

    public boolean checkGameEnd(GameSession session) {
        boolean ended = winEvaluator.evaluate(session).isPresent();
        if (ended) {
            log.debug("[game] ended after {}: gameId={}", session.getState().getGamePhase(), session.getGameId());
        }
        return ended;
    }
}
