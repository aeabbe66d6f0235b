package com.example.socialdeduction.game.strategy;

import com.example.socialdeduction.game.domain.Role;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Night powers of one variant, ordered by {@link NightPriority}. Powers sharing a
 * tier keep their registration order.
 */
public class RoleActionFactory {

    private final List<RoleActionStrategy> strategies;

    public RoleActionFactory(List<RoleActionStrategy> strategies) {
        List<RoleActionStrategy> ordered = new ArrayList<>(strategies);
        ordered.sort(Comparator.comparing(RoleActionStrategy::getPriority));
        Set<Role> upfront = new HashSet<>();
        for (RoleActionStrategy strategy : ordered) {
            if (strategy.getDecisionType() != null && !strategy.isReactive() && !upfront.add(strategy.getRole())) {
                throw new IllegalArgumentException("more than one up-front decision for " + strategy.getRole());
            }
        }
        this.strategies = List.copyOf(ordered);
    }

    public static RoleActionFactory none() {
        return new RoleActionFactory(List.of());
    }

    /**
     * All powers in resolution order.
     */
    public List<RoleActionStrategy> getStrategies() {
        return strategies;
    }

    public List<RoleActionStrategy> getStrategies(NightPriority priority) {
        return strategies.stream()
                .filter(strategy -> strategy.getPriority() == priority)
                .toList();
    }

    public List<RoleActionStrategy> getStrategies(Role role) {
        return strategies.stream()
                .filter(strategy -> strategy.getRole().equals(role))
                .toList();
    }

    /**
     * Whether the role has any night power.
     */
    public boolean canActAtNight(Role role) {
        return !getStrategies(role).isEmpty();
    }

    public boolean isEmpty() {
        return strategies.isEmpty();
    }
}
