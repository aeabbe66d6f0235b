package com.example.socialdeduction.game.domain;

import com.example.socialdeduction.game.domain.vote.ElectionTracker;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Optional;

/**
 * Counters and tallies shared by every variant. Only the night engine and the
 * vote resolution mutate it, always on the coordinating thread.
 */
@Getter
@Builder
public class GameState {

    private final String gameId;
    private final String variant;
    private final Instant startedAt;

    @Setter
    @Builder.Default
    private GameStatus status = GameStatus.WAITING;

    @Setter
    @Builder.Default
    private GamePhase gamePhase = GamePhase.SETUP;

    private int round;
    private int day;
    private int night;

    // enacted policies (Secret Hitler)
    private int liberalPolicies;
    private int fascistPolicies;

    // missions and accusations (Paranoia)
    private int missionsSucceeded;
    private int missionsFailed;
    private int accusations;

    @Builder.Default
    private ElectionTracker electionTracker = new ElectionTracker(ElectionTracker.DEFAULT_THRESHOLD);

    private String lastExecuted;
    private int lastExecutedDay;
    private String lastNightDeath;

    private Winner winner;

    // ==================== phase counters ====================

    public void startRound() {
        round++;
    }

    public void enterPhase(GamePhase phase) {
        this.gamePhase = phase;
        switch (phase) {
            case NIGHT -> night++;
            case DAY -> day++;
            default -> {
            }
        }
    }

    // ==================== tallies ====================

    public void enactLiberal() {
        liberalPolicies++;
    }

    public void enactFascist() {
        fascistPolicies++;
    }

    public void recordMission(boolean succeeded) {
        if (succeeded) {
            missionsSucceeded++;
        } else {
            missionsFailed++;
        }
    }

    public void recordAccusation() {
        accusations++;
    }

    public void recordExecution(String playerName) {
        this.lastExecuted = playerName;
        this.lastExecutedDay = day;
    }

    public void recordNightDeath(String playerName) {
        this.lastNightDeath = playerName;
    }

    /**
     * Name of the player executed during the day that immediately preceded the
     * current night, or empty.
     */
    public Optional<String> executedYesterday() {
        if (lastExecuted != null && lastExecutedDay == night - 1 && lastExecutedDay > 0) {
            return Optional.of(lastExecuted);
        }
        return Optional.empty();
    }

    // ==================== winner ====================

    public Optional<Winner> getWinner() {
        return Optional.ofNullable(winner);
    }

    /**
     * Caches the first declared winner. Later calls return the cached value and
     * never replace it.
     */
    public Winner declareWinner(Winner candidate) {
        if (winner == null) {
            winner = candidate;
            gamePhase = GamePhase.TERMINAL;
            status = GameStatus.ENDED;
        }
        return winner;
    }

    public boolean isTerminal() {
        return winner != null;
    }
}
