package com.example.socialdeduction.game.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

@Getter
@Builder
public class GamePlayer {

    private final String name;
    private final int seat;
    private final Role role;

    @Builder.Default
    private boolean alive = true;

    // one-shot ability spent (Slayer shot, Mutant telepathy)
    private boolean abilityUsed;

    // Butler's current master, chosen each night
    @Setter
    private String master;

    public Team getTeam() {
        return role.getTeam();
    }

    public boolean hasRole(Role other) {
        return Objects.equals(role, other);
    }

    /**
     * @return false when the player was already dead
     */
    public boolean eliminate() {
        if (!alive) {
            return false;
        }
        alive = false;
        return true;
    }

    public void useAbility() {
        if (abilityUsed) {
            throw new IllegalStateException(name + " already used their ability");
        }
        abilityUsed = true;
    }

    @Override
    public String toString() {
        return name + "(" + role.getDisplayName() + (alive ? "" : ", dead") + ")";
    }
}
