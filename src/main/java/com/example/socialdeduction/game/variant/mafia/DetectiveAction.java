package com.example.socialdeduction.game.variant.mafia;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.strategy.NightActionResult;
import com.example.socialdeduction.game.strategy.NightContext;
import com.example.socialdeduction.game.strategy.NightPriority;
import com.example.socialdeduction.game.strategy.RoleActionStrategy;

import java.util.List;

/**
 * Detective learns whether one other player is mafia.
 */
public class DetectiveAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return MafiaRole.DETECTIVE;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.INVESTIGATION;
    }

    @Override
    public DecisionType getDecisionType() {
        return DecisionType.INVESTIGATE;
    }

    @Override
    public List<String> legalTargets(NightContext context, GamePlayer actor) {
        return context.getPlayers().aliveNamesExcept(actor.getName());
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        boolean isMafia = target.hasRole(MafiaRole.MAFIA);
        String resultMessage = String.format("Night %d investigation: %s is %s.",
                context.getNight(), target.getName(), isMafia ? "MAFIA" : "NOT Mafia");
        context.tell(actor, resultMessage, true);

        return NightActionResult.builder()
                .actorRole(MafiaRole.DETECTIVE)
                .actorName(actor.getName())
                .targetName(target.getName())
                .message(actor.getName() + " investigated " + target.getName())
                .success(true)
                .build();
    }
}
