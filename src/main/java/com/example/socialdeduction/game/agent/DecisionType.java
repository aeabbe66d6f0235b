package com.example.socialdeduction.game.agent;

public enum DecisionType {
    // night
    POISON,
    PROTECT,
    KILL,
    INVESTIGATE,
    REVEAL_ON_DEATH,
    CHOOSE_MASTER,
    SABOTAGE,
    // day
    TABLE_TALK,
    NOMINATE,
    VOTE,
    CANCEL_OWN_EXECUTION,
    SLAYER_SHOT,
    TELEPATHY,
    ACCUSE,
    JUDGE,
    TERMINATE_GAME,
    NAME_WINNER,
    // government
    NOMINATE_CHANCELLOR,
    PRESIDENT_DISCARD,
    CHANCELLOR_DISCARD,
    PROPOSE_VETO,
    CONSENT_VETO,
    EXECUTIVE_INVESTIGATE,
    SPECIAL_ELECTION,
    EXECUTE,
    // cards
    PLAY_CARDS,
    CHALLENGE
}
