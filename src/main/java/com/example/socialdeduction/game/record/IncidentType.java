package com.example.socialdeduction.game.record;

/**
 * Recoverable engine conditions. None of them stops a game; each is logged and
 * recorded as an {@link EventType#INCIDENT} event.
 */
public enum IncidentType {
    ILLEGAL_DECISION, // agent answered outside the legal set, or threw
    DECISION_TIMEOUT, // agent did not answer in time
    EMPTY_ACTOR_SET, // no living holder or no legal target
    DECK_RESHUFFLED, // discard pile returned to the draw pile
    BUDGET_EXCEEDED // round cap or wall clock hit, fallback winner forced
}
