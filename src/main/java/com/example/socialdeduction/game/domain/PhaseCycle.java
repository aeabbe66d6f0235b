package com.example.socialdeduction.game.domain;

public enum PhaseCycle {
    NIGHT_AND_DAY(GamePhase.NIGHT),
    DAY_ONLY(GamePhase.DAY);

    private final GamePhase firstPhase;

    PhaseCycle(GamePhase firstPhase) {
        this.firstPhase = firstPhase;
    }

    public GamePhase firstPhase() {
        return firstPhase;
    }
}
