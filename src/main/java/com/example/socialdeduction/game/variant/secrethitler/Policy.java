package com.example.socialdeduction.game.variant.secrethitler;

public enum Policy {
    LIBERAL,
    FASCIST;

    public static final int LIBERAL_CARDS = 6;
    public static final int FASCIST_CARDS = 11;
}
