package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.global.error.ErrorCode;
import com.example.socialdeduction.global.random.RandomSource;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Component
public class RoleAssigner {

    /**
     * Seats the players in the given order and deals them a shuffled draw from the
     * role table, or the explicit roles when given.
     */
    public List<GamePlayer> assignRoles(RoleTable table, List<String> names, List<Role> explicitRoles,
                                        RandomSource random) {
        int playerCount = names.size();
        List<Role> roles;
        if (explicitRoles == null) {
            roles = new ArrayList<>(table.draw(playerCount, random));
            random.shuffle(roles);
        } else {
            roles = List.copyOf(explicitRoles);
        }
        checkCounts(table, playerCount, roles);

        List<GamePlayer> players = new ArrayList<>(playerCount);
        for (int i = 0; i < playerCount; i++) {
            players.add(GamePlayer.builder()
                    .name(names.get(i))
                    .seat(i)
                    .role(roles.get(i))
                    .build());
        }
        return players;
    }

    private void checkCounts(RoleTable table, int playerCount, List<Role> roles) {
        if (roles.size() != playerCount) {
            throw ErrorCode.ROLE_COUNT_MISMATCH.commonException(roles.size() + " roles for " + playerCount + " players");
        }
        Map<Team, Integer> actual = new EnumMap<>(Team.class);
        roles.forEach(role -> actual.merge(role.getTeam(), 1, Integer::sum));
        Map<Team, Integer> expected = new EnumMap<>(Team.class);
        table.teamCounts(playerCount).forEach((team, count) -> {
            if (count > 0) {
                expected.put(team, count);
            }
        });
        if (!actual.equals(expected)) {
            throw ErrorCode.ROLE_COUNT_MISMATCH.commonException("expected " + expected + ", got " + actual);
        }

        Map<Role, Integer> dealt = new HashMap<>();
        roles.forEach(role -> dealt.merge(role, 1, Integer::sum));
        table.requiredRoleCounts(playerCount).forEach((role, count) -> {
            int dealtCount = dealt.getOrDefault(role, 0);
            if (dealtCount != count) {
                throw ErrorCode.ROLE_COUNT_MISMATCH.commonException("expected " + count + " x " + role.getDisplayName()
                        + ", got " + dealtCount);
            }
        });
        table.rosterProblem(playerCount, roles).ifPresent(problem -> {
            throw ErrorCode.ROLE_COUNT_MISMATCH.commonException(problem);
        });
    }
}
