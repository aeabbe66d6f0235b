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
 * Protects another player from the demon, from the second night on. A poisoned
 * Monk protects nobody.
 */
public class MonkAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return BotcRole.MONK;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.PROTECTION;
    }

    @Override
    public DecisionType getDecisionType() {
        return DecisionType.PROTECT;
    }

    @Override
    public boolean isActiveOn(NightContext context, GamePlayer actor) {
        return context.getNight() > 1;
    }

    @Override
    public List<String> legalTargets(NightContext context, GamePlayer actor) {
        return context.getPlayers().aliveNamesExcept(actor.getName());
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        if (context.isPoisoned(actor)) {
            return NightActionResult.builder()
                    .actorRole(BotcRole.MONK)
                    .actorName(actor.getName())
                    .targetName(target.getName())
                    .message(actor.getName() + " tried to protect " + target.getName() + " while poisoned")
                    .success(false)
                    .build();
        }
        context.protect(target);
        return NightActionResult.builder()
                .actorRole(BotcRole.MONK)
                .actorName(actor.getName())
                .targetName(target.getName())
                .message(actor.getName() + " protects " + target.getName())
                .success(true)
                .build();
    }
}
