package com.example.socialdeduction.game.variant.paranoia;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.global.random.RandomSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One traitor per three players (at least one), one mutant, the rest plain
 * troubleshooters.
 */
public class ParanoiaRoleTable implements RoleTable {

    @Override
    public int getMinPlayers() {
        return 4;
    }

    @Override
    public int getMaxPlayers() {
        return 8;
    }

    public static int traitorCount(int playerCount) {
        return Math.max(1, playerCount / 3);
    }

    @Override
    public Map<Team, Integer> teamCounts(int playerCount) {
        int traitors = traitorCount(playerCount);
        return Map.of(Team.TRAITOR, traitors, Team.LOYALIST, playerCount - traitors);
    }

    @Override
    public Map<Role, Integer> requiredRoleCounts(int playerCount) {
        return Map.of(ParanoiaRole.TRAITOR, traitorCount(playerCount), ParanoiaRole.MUTANT, 1);
    }

    @Override
    public List<Role> draw(int playerCount, RandomSource random) {
        List<Role> roles = new ArrayList<>();
        for (int i = 0; i < traitorCount(playerCount); i++) {
            roles.add(ParanoiaRole.TRAITOR);
        }
        roles.add(ParanoiaRole.MUTANT);
        while (roles.size() < playerCount) {
            roles.add(ParanoiaRole.TROUBLESHOOTER);
        }
        return roles;
    }
}
