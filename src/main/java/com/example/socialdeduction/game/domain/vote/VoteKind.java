package com.example.socialdeduction.game.domain.vote;

public enum VoteKind {
    EXECUTION, // nominee dies on a pass
    ELECTION, // president + chancellor government
    ACCUSATION // treason hearing
}
