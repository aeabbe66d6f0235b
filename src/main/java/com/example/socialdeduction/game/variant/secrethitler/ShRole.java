package com.example.socialdeduction.game.variant.secrethitler;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import lombok.Getter;

@Getter
public enum ShRole implements Role {
    LIBERAL(Team.LIBERAL, "Liberal"),
    FASCIST(Team.FASCIST, "Fascist"),
    HITLER(Team.FASCIST, "Hitler");

    private final Team team;
    private final String displayName;

    ShRole(Team team, String displayName) {
        this.team = team;
        this.displayName = displayName;
    }
}
