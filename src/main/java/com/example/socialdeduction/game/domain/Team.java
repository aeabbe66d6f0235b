package com.example.socialdeduction.game.domain;

import lombok.Getter;

@Getter
public enum Team {
    GOOD("Good"),
    EVIL("Evil"),
    TOWN("Town"),
    MAFIA("Mafia"),
    LIBERAL("Liberals"),
    FASCIST("Fascists"),
    LOYALIST("Loyal Troubleshooters"),
    TRAITOR("Secret Society"),
    SOLO("Solo");

    private final String displayName;

    Team(String displayName) {
        this.displayName = displayName;
    }
}
