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
 * Doctor protects one alive player (possibly themselves) from tonight's kill.
 */
public class DoctorAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return MafiaRole.DOCTOR;
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
    public List<String> legalTargets(NightContext context, GamePlayer actor) {
        return context.getPlayers().aliveNames();
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        context.protect(target);
        return NightActionResult.builder()
                .actorRole(MafiaRole.DOCTOR)
                .actorName(actor.getName())
                .targetName(target.getName())
                .message(actor.getName() + " protects " + target.getName())
                .success(true)
                .build();
    }
}
