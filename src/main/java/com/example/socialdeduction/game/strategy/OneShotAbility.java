package com.example.socialdeduction.game.strategy;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.service.GameSession;

/**
 * A once-per-game daytime power. The holder is asked whether to use it; using it
 * spends it even when it has no effect.
 */
public interface OneShotAbility {

    Role getRole();

    DecisionType getDecisionType();

    default boolean isAvailable(GameSession session, GamePlayer holder) {
        return holder.isAlive() && !holder.isAbilityUsed() && holder.hasRole(getRole());
    }

    /**
     * Offers the ability to {@code holder}.
     *
     * @return true when the ability was spent
     */
    boolean offer(GameSession session, GamePlayer holder);
}
