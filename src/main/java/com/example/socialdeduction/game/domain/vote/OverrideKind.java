package com.example.socialdeduction.game.domain.vote;

/**
 * Post-vote overrides in application order. An instant win is checked before the
 * others and ends the game regardless of them.
 */
public enum OverrideKind {
    SELF_CANCEL,
    MUTUAL_VETO,
    INSTANT_WIN
}
