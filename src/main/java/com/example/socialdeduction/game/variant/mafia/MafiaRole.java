package com.example.socialdeduction.game.variant.mafia;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import lombok.Getter;

@Getter
public enum MafiaRole implements Role {
    MAFIA(Team.MAFIA, "Mafia"),
    DOCTOR(Team.TOWN, "Doctor"),
    DETECTIVE(Team.TOWN, "Detective"),
    TOWNSPERSON(Team.TOWN, "Townsperson");

    private final Team team;
    private final String displayName;

    MafiaRole(Team team, String displayName) {
        this.team = team;
        this.displayName = displayName;
    }
}
