package com.example.socialdeduction.game.record;

import com.example.socialdeduction.game.domain.GameState;
import com.example.socialdeduction.game.domain.knowledge.HiddenFact;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-game front of a {@link Recorder}: stamps game id, sequence, round and phase
 * on each event and keeps a failing sink from aborting the game.
 */
@Slf4j
public class GameRecorder {

    private final Recorder sink;
    private final GameState gameState;
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    public GameRecorder(Recorder sink, GameState gameState) {
        this.sink = Objects.requireNonNull(sink, "sink");
        this.gameState = Objects.requireNonNull(gameState, "gameState");
    }

    public void record(EventType type, String message) {
        record(type, message, Map.of());
    }

    /**
     * @return false when the sink rejected the event
     */
    public boolean record(EventType type, String message, Map<String, Object> data) {
        GameEvent event = new GameEvent(
                gameState.getGameId(),
                sequence.incrementAndGet(),
                gameState.getRound(),
                gameState.getGamePhase(),
                type,
                message,
                data);
        try {
            sink.record(event);
            return true;
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            log.warn("[record] sink failed: gameId={}, type={}, seq={}", gameState.getGameId(), type,
                    event.sequence(), e);
            return false;
        }
    }

    public void incident(IncidentType incident, String message, Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>(data);
        payload.put("incident", incident.name());
        record(EventType.INCIDENT, message, payload);
    }

    public void fact(HiddenFact fact) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("owner", fact.owner());
        payload.put("text", fact.text());
        payload.put("reliable", fact.reliable());
        record(EventType.PRIVATE_FACT, "private fact", payload);
    }

    public long getFailures() {
        return failures.get();
    }
}
