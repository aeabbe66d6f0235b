package com.example.socialdeduction.game.variant.liar;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import lombok.Getter;

@Getter
public enum LiarRole implements Role {
    GAMBLER(Team.SOLO, "Gambler");

    private final Team team;
    private final String displayName;

    LiarRole(Team team, String displayName) {
        this.team = team;
        this.displayName = displayName;
    }
}
