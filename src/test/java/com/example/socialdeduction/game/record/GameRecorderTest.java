package com.example.socialdeduction.game.record;

import com.example.socialdeduction.game.domain.GamePhase;
import com.example.socialdeduction.game.domain.GameState;
import com.example.socialdeduction.game.domain.knowledge.HiddenFact;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GameRecorderTest {

    private GameState gameState;
    private InMemoryRecorder sink;
    private GameRecorder recorder;

    @BeforeEach
    void setUp() {
        gameState = GameState.builder()
                .gameId("game_1")
                .variant("mafia")
                .startedAt(Instant.EPOCH)
                .build();
        sink = new InMemoryRecorder();
        recorder = new GameRecorder(sink, gameState);
    }

    @Test
    @DisplayName("events are stamped with game id, sequence, round and phase")
    void stampsEvents() {
        // given
        recorder.record(EventType.GAME_STARTED, "started");
        gameState.startRound();
        gameState.enterPhase(GamePhase.NIGHT);

        // when
        recorder.record(EventType.PHASE_STARTED, "night", Map.of("phase", "NIGHT"));

        // then
        assertThat(sink.getEvents()).extracting(GameEvent::sequence).containsExactly(1L, 2L);
        GameEvent night = sink.getEvents().get(1);
        assertThat(night.gameId()).isEqualTo("game_1");
        assertThat(night.round()).isEqualTo(1);
        assertThat(night.phase()).isEqualTo(GamePhase.NIGHT);
        assertThat(night.get("phase")).isEqualTo("NIGHT");
    }

    @Test
    @DisplayName("a failing sink is counted and does not stop the game")
    void failingSink() {
        // given
        GameRecorder failing = new GameRecorder(event -> {
            throw new IllegalStateException("disk full");
        }, gameState);

        // when
        boolean first = failing.record(EventType.GAME_STARTED, "started", Map.of());
        boolean second = failing.record(EventType.WINNER_DECLARED, "ended", Map.of());

        // then
        assertThat(first).isFalse();
        assertThat(second).isFalse();
        assertThat(failing.getFailures()).isEqualTo(2);
    }

    @Test
    @DisplayName("incidents and private facts carry their payload")
    void incidentAndFact() {
        // when
        recorder.incident(IncidentType.DECISION_TIMEOUT, "P1 timed out", Map.of("seat", "P1"));
        recorder.fact(HiddenFact.fabricated("P2", 1, GamePhase.NIGHT, "P3 is evil"));

        // then
        GameEvent incident = sink.ofType(EventType.INCIDENT).get(0);
        assertThat(incident.get("incident")).isEqualTo("DECISION_TIMEOUT");
        assertThat(incident.get("seat")).isEqualTo("P1");
        GameEvent fact = sink.ofType(EventType.PRIVATE_FACT).get(0);
        assertThat(fact.get("owner")).isEqualTo("P2");
        assertThat(fact.get("reliable")).isEqualTo(false);
    }
}
