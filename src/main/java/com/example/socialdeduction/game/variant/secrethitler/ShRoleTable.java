package com.example.socialdeduction.game.variant.secrethitler;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.global.random.RandomSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Official counts: liberals / fascists (Hitler excluded) for 5-10 players, plus
 * one Hitler.
 */
public class ShRoleTable implements RoleTable {

    private static final Map<Integer, int[]> COUNTS = Map.of(
            5, new int[]{3, 1},
            6, new int[]{4, 1},
            7, new int[]{4, 2},
            8, new int[]{5, 2},
            9, new int[]{5, 3},
            10, new int[]{6, 3});

    @Override
    public int getMinPlayers() {
        return 5;
    }

    @Override
    public int getMaxPlayers() {
        return 10;
    }

    @Override
    public Map<Team, Integer> teamCounts(int playerCount) {
        int[] counts = countsFor(playerCount);
        return Map.of(Team.LIBERAL, counts[0], Team.FASCIST, counts[1] + 1);
    }

    @Override
    public Map<Role, Integer> requiredRoleCounts(int playerCount) {
        return Map.of(ShRole.HITLER, 1);
    }

    @Override
    public List<Role> draw(int playerCount, RandomSource random) {
        int[] counts = countsFor(playerCount);
        List<Role> roles = new ArrayList<>(Collections.nCopies(counts[0], ShRole.LIBERAL));
        roles.addAll(Collections.nCopies(counts[1], ShRole.FASCIST));
        roles.add(ShRole.HITLER);
        return roles;
    }

    private static int[] countsFor(int playerCount) {
        int[] counts = COUNTS.get(playerCount);
        if (counts == null) {
            throw new IllegalArgumentException("Secret Hitler supports 5-10 players, got " + playerCount);
        }
        return counts;
    }
}
