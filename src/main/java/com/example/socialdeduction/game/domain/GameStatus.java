package com.example.socialdeduction.game.domain;

public enum GameStatus {
    WAITING, // created, roles assigned
    IN_PROGRESS, // phases running
    ENDED // winner declared
}
