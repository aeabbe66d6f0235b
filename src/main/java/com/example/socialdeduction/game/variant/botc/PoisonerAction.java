package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.strategy.NightActionResult;
import com.example.socialdeduction.game.strategy.NightContext;
import com.example.socialdeduction.game.strategy.NightPriority;
import com.example.socialdeduction.game.strategy.RoleActionStrategy;

import java.util.List;

/**
 * Poisons one player for the rest of the night: their power fails and any
 * information they give or are the subject of is false.
 */
public class PoisonerAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return BotcRole.POISONER;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.DISRUPTION;
    }

    @Override
    public DecisionType getDecisionType() {
        return DecisionType.POISON;
    }

    @Override
    public List<String> legalTargets(NightContext context, GamePlayer actor) {
        return context.getPlayers().aliveNamesExcept(actor.getName());
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        context.poison(target);
        return NightActionResult.builder()
                .actorRole(BotcRole.POISONER)
                .actorName(actor.getName())
                .targetName(target.getName())
                .message(actor.getName() + " poisoned " + target.getName())
                .success(true)
                .build();
    }
}
