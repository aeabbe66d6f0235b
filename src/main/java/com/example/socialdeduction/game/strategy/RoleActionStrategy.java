package com.example.socialdeduction.game.strategy;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;

import java.util.List;

/**
 * A role's night power (Strategy Pattern). The night engine asks every alive
 * holder for a target up front, then calls {@link #execute} tier by tier.
 */
public interface RoleActionStrategy {

    Role getRole();

    NightPriority getPriority();

    /**
     * Decision asked of the holder, or null for a passive power that needs no target.
     */
    DecisionType getDecisionType();

    /**
     * Names the holder may target tonight. Empty makes the power a no-op.
     */
    default List<String> legalTargets(NightContext context, GamePlayer actor) {
        return List.of();
    }

    /**
     * Whether the power works tonight at all (the Monk sits out the first night).
     */
    default boolean isActiveOn(NightContext context, GamePlayer actor) {
        return true;
    }

    /**
     * Holders pick individually, then act once on the plurality target.
     */
    default boolean isGroupAction() {
        return false;
    }

    /**
     * Triggered by the holder's own death tonight. Asked during resolution, not up front.
     */
    default boolean isReactive() {
        return false;
    }

    /**
     * @param target the chosen player, or null for passive powers
     */
    NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target);
}
