package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.variant.botc.BotcRole.Category;
import com.example.socialdeduction.global.random.RandomSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Townsfolk / outsider / minion / demon counts for 5-9 players.
 */
public class BotcRoleTable implements RoleTable {

    private static final Map<Integer, int[]> COUNTS = Map.of(
            5, new int[]{3, 0, 1, 1},
            6, new int[]{3, 1, 1, 1},
            7, new int[]{5, 0, 1, 1},
            8, new int[]{5, 1, 1, 1},
            9, new int[]{5, 2, 1, 1});

    @Override
    public int getMinPlayers() {
        return 5;
    }

    @Override
    public int getMaxPlayers() {
        return 9;
    }

    public Map<Category, Integer> categoryCounts(int playerCount) {
        int[] counts = COUNTS.get(playerCount);
        if (counts == null) {
            throw new IllegalArgumentException("no BotC table for " + playerCount + " players");
        }
        Map<Category, Integer> byCategory = new EnumMap<>(Category.class);
        byCategory.put(Category.TOWNSFOLK, counts[0]);
        byCategory.put(Category.OUTSIDER, counts[1]);
        byCategory.put(Category.MINION, counts[2]);
        byCategory.put(Category.DEMON, counts[3]);
        return byCategory;
    }

    @Override
    public Map<Team, Integer> teamCounts(int playerCount) {
        Map<Team, Integer> teams = new EnumMap<>(Team.class);
        categoryCounts(playerCount).forEach((category, count) -> teams.merge(category.getTeam(), count, Integer::sum));
        return teams;
    }

    /**
     * The Imp and the Poisoner are the only demon and minion.
     */
    @Override
    public Map<Role, Integer> requiredRoleCounts(int playerCount) {
        return Map.of(BotcRole.IMP, 1, BotcRole.POISONER, 1);
    }

    /**
     * Townsfolk and outsiders must match the table, each character at most once.
     */
    @Override
    public Optional<String> rosterProblem(int playerCount, List<Role> roles) {
        Map<Category, Integer> dealt = new EnumMap<>(Category.class);
        Set<BotcRole> seen = EnumSet.noneOf(BotcRole.class);
        for (Role role : roles) {
            if (!(role instanceof BotcRole)) {
                return Optional.of(role.getDisplayName() + " is not a Clocktower character");
            }
            BotcRole character = (BotcRole) role;
            if (!seen.add(character)) {
                return Optional.of(character.getDisplayName() + " dealt more than once");
            }
            dealt.merge(character.getCategory(), 1, Integer::sum);
        }
        for (Map.Entry<Category, Integer> expected : categoryCounts(playerCount).entrySet()) {
            int actual = dealt.getOrDefault(expected.getKey(), 0);
            if (actual != expected.getValue()) {
                return Optional.of("expected " + expected.getValue() + " " + expected.getKey() + ", got " + actual);
            }
        }
        return Optional.empty();
    }

    @Override
    public List<Role> draw(int playerCount, RandomSource random) {
        List<Role> roles = new ArrayList<>();
        categoryCounts(playerCount).forEach((category, count) -> roles.addAll(random.sample(rolesOf(category), count)));
        return roles;
    }

    private static List<BotcRole> rolesOf(Category category) {
        return Arrays.stream(BotcRole.values())
                .filter(role -> role.getCategory() == category)
                .toList();
    }
}
