package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.strategy.NightActionResult;
import com.example.socialdeduction.game.strategy.NightContext;
import com.example.socialdeduction.game.strategy.NightPriority;
import com.example.socialdeduction.game.strategy.RoleActionStrategy;

/**
 * Passive: the Soldier is safe from the demon unless poisoned.
 */
public class SoldierAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return BotcRole.SOLDIER;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.PROTECTION;
    }

    @Override
    public DecisionType getDecisionType() {
        return null;
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        boolean shielded = !context.isPoisoned(actor);
        if (shielded) {
            context.protect(actor);
        }
        return NightActionResult.builder()
                .actorRole(BotcRole.SOLDIER)
                .actorName(actor.getName())
                .targetName(actor.getName())
                .message(shielded ? actor.getName() + " stands guard" : actor.getName() + " is poisoned and exposed")
                .success(shielded)
                .build();
    }
}
