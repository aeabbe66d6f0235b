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
 * Demon kill. The attempt is always recorded; a protected target survives and a
 * poisoned Imp kills nobody.
 */
public class ImpAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return BotcRole.IMP;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.ELIMINATION;
    }

    @Override
    public DecisionType getDecisionType() {
        return DecisionType.KILL;
    }

    @Override
    public List<String> legalTargets(NightContext context, GamePlayer actor) {
        return context.getPlayers().aliveNamesExcept(actor.getName());
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        context.recordAttempt(target);
        String message;
        boolean killed = false;
        if (context.isPoisoned(actor)) {
            message = "The Imp, poisoned, failed to kill " + target.getName();
        } else if (context.isProtected(target)) {
            message = "The Imp attacked " + target.getName() + " but they were protected";
        } else {
            killed = context.kill(target, "demon");
            message = "The Imp killed " + target.getName();
        }
        return NightActionResult.builder()
                .actorRole(BotcRole.IMP)
                .actorName(actor.getName())
                .targetName(target.getName())
                .message(message)
                .success(killed)
                .build();
    }
}
