package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.global.random.RandomSource;
import lombok.Getter;

import java.util.Arrays;
import java.util.List;

@Getter
public enum BotcRole implements Role {
    IMP(Category.DEMON, "Imp"),
    POISONER(Category.MINION, "Poisoner"),
    MONK(Category.TOWNSFOLK, "Monk"),
    EMPATH(Category.TOWNSFOLK, "Empath"),
    RAVENKEEPER(Category.TOWNSFOLK, "Ravenkeeper"),
    UNDERTAKER(Category.TOWNSFOLK, "Undertaker"),
    SLAYER(Category.TOWNSFOLK, "Slayer"),
    MAYOR(Category.TOWNSFOLK, "Mayor"),
    SOLDIER(Category.TOWNSFOLK, "Soldier"),
    BUTLER(Category.OUTSIDER, "Butler"),
    SAINT(Category.OUTSIDER, "Saint");

    private final Category category;
    private final String displayName;

    BotcRole(Category category, String displayName) {
        this.category = category;
        this.displayName = displayName;
    }

    @Override
    public Team getTeam() {
        return category.getTeam();
    }

    public boolean isEvil() {
        return getTeam() == Team.EVIL;
    }

    /**
     * A uniformly random role other than {@code actual}, for false information.
     */
    public static BotcRole otherThan(Role actual, RandomSource random) {
        List<BotcRole> others = Arrays.stream(values())
                .filter(role -> role != actual)
                .toList();
        return random.pick(others);
    }

    @Getter
    public enum Category {
        TOWNSFOLK(Team.GOOD),
        OUTSIDER(Team.GOOD),
        MINION(Team.EVIL),
        DEMON(Team.EVIL);

        private final Team team;

        Category(Team team) {
            this.team = team;
        }
    }
}
