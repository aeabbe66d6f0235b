package com.example.socialdeduction.game.variant.paranoia;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import lombok.Getter;

@Getter
public enum ParanoiaRole implements Role {
    TROUBLESHOOTER(Team.LOYALIST, "Troubleshooter"),
    MUTANT(Team.LOYALIST, "Mutant Troubleshooter"),
    TRAITOR(Team.TRAITOR, "Secret Society Traitor");

    private final Team team;
    private final String displayName;

    ParanoiaRole(Team team, String displayName) {
        this.team = team;
        this.displayName = displayName;
    }
}
