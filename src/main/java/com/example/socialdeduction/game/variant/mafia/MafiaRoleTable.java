package com.example.socialdeduction.game.variant.mafia;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.global.random.RandomSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One mafia per four players (at least one), one doctor, one detective, the rest
 * townspeople.
 */
public class MafiaRoleTable implements RoleTable {

    private static final int MIN_PLAYERS = 4;
    private static final int MAX_PLAYERS = 16;

    @Override
    public int getMinPlayers() {
        return MIN_PLAYERS;
    }

    @Override
    public int getMaxPlayers() {
        return MAX_PLAYERS;
    }

    public static int mafiaCount(int playerCount) {
        return Math.max(1, playerCount / 4);
    }

    @Override
    public Map<Team, Integer> teamCounts(int playerCount) {
        int mafia = mafiaCount(playerCount);
        return Map.of(Team.MAFIA, mafia, Team.TOWN, playerCount - mafia);
    }

    @Override
    public Map<Role, Integer> requiredRoleCounts(int playerCount) {
        return Map.of(MafiaRole.MAFIA, mafiaCount(playerCount), MafiaRole.DOCTOR, 1, MafiaRole.DETECTIVE, 1);
    }

    @Override
    public List<Role> draw(int playerCount, RandomSource random) {
        List<Role> roles = new ArrayList<>();
        for (int i = 0; i < mafiaCount(playerCount); i++) {
            roles.add(MafiaRole.MAFIA);
        }
        roles.add(MafiaRole.DOCTOR);
        roles.add(MafiaRole.DETECTIVE);
        while (roles.size() < playerCount) {
            roles.add(MafiaRole.TOWNSPERSON);
        }
        return roles;
    }
}
