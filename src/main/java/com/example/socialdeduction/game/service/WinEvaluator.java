package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.record.IncidentType;
import com.example.socialdeduction.game.variant.WinCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Checks the variant's win conditions in order. The first winner found is cached
 * on the game state; every later call returns it unchanged.
 */
@Service
@Slf4j
public class WinEvaluator {

    public Optional<Winner> evaluate(GameSession session) {
        Optional<Winner> cached = session.getState().getWinner();
        if (cached.isPresent()) {
            return cached;
        }
        for (WinCondition condition : session.getVariant().getWinConditions()) {
            Optional<Winner> winner = condition.check(session);
            if (winner.isPresent()) {
                return Optional.of(session.declareWinner(winner.get()));
            }
        }
        return Optional.empty();
    }

    /**
     * Ends the game with the variant's fallback winner when a budget runs out.
     */
    public Winner forceFallback(GameSession session, String reason) {
        Optional<Winner> cached = session.getState().getWinner();
        if (cached.isPresent()) {
            return cached.get();
        }
        log.warn("[game] budget exceeded: gameId={}, reason={}, round={}",
                session.getGameId(), reason, session.getState().getRound());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("reason", reason);
        data.put("round", session.getState().getRound());
        session.getRecorder().incident(IncidentType.BUDGET_EXCEEDED, reason, data);
        return session.declareWinner(session.getVariant().fallbackWinner(session).asForced());
    }
}
