package com.example.socialdeduction.game.domain;

public enum Ballot {
    YES("JA"),
    NO("NEIN");

    private final String secretHitlerLabel;

    Ballot(String secretHitlerLabel) {
        this.secretHitlerLabel = secretHitlerLabel;
    }

    public boolean approves() {
        return this == YES;
    }

    public String toJaNein() {
        return secretHitlerLabel;
    }
}
