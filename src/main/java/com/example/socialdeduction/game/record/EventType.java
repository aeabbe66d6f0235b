package com.example.socialdeduction.game.record;

public enum EventType {
    GAME_STARTED,
    PHASE_STARTED,
    ACTION_TAKEN,
    PRIVATE_FACT,
    TABLE_TALK,
    NOMINATION,
    VOTE_CAST,
    VOTE_RESOLVED,
    ELIMINATION,
    GOVERNMENT_FORMED,
    GOVERNMENT_FAILED,
    POLICY_ENACTED,
    INCIDENT,
    WINNER_DECLARED
}
