package com.example.socialdeduction.game.domain;

public enum GamePhase {
    SETUP, // role assignment, night-0 knowledge
    NIGHT, // private actions
    DAY, // table talk, nomination, vote
    TERMINAL // winner declared
}
