package com.example.socialdeduction.game.variant.liar;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.global.random.RandomSource;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Everyone plays for themselves.
 */
public class LiarRoleTable implements RoleTable {

    private static final int MIN_PLAYERS = 2;
    private static final int MAX_PLAYERS = 4;

    @Override
    public int getMinPlayers() {
        return MIN_PLAYERS;
    }

    @Override
    public int getMaxPlayers() {
        return MAX_PLAYERS;
    }

    @Override
    public Map<Team, Integer> teamCounts(int playerCount) {
        return Map.of(Team.SOLO, playerCount);
    }

    @Override
    public List<Role> draw(int playerCount, RandomSource random) {
        return Collections.nCopies(playerCount, LiarRole.GAMBLER);
    }
}
