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
 * Chooses a master for tomorrow's votes. A poisoned Butler serves nobody and
 * votes freely.
 */
public class ButlerAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return BotcRole.BUTLER;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.DESIGNATION;
    }

    @Override
    public DecisionType getDecisionType() {
        return DecisionType.CHOOSE_MASTER;
    }

    @Override
    public List<String> legalTargets(NightContext context, GamePlayer actor) {
        return context.getPlayers().aliveNamesExcept(actor.getName());
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        boolean bound = !context.isPoisoned(actor);
        actor.setMaster(bound ? target.getName() : null);
        context.tell(actor, "Your master until the next night is " + target.getName() + ".", bound);
        return NightActionResult.builder()
                .actorRole(BotcRole.BUTLER)
                .actorName(actor.getName())
                .targetName(target.getName())
                .message(actor.getName() + " chose " + target.getName() + " as master")
                .success(bound)
                .build();
    }
}
