package com.example.socialdeduction.game.variant.mafia;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.strategy.NightActionResult;
import com.example.socialdeduction.game.strategy.NightContext;
import com.example.socialdeduction.game.strategy.NightPriority;
import com.example.socialdeduction.game.strategy.RoleActionStrategy;

import java.util.List;

/**
 * Mafia night kill
 * - every mafia member names a target, the plurality target is attacked
 * - a target under the doctor's protection survives
 */
public class MafiaAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return MafiaRole.MAFIA;
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
        return context.getPlayers().findAllAlivePlayers().stream()
                .filter(player -> player.getTeam() != Team.MAFIA)
                .map(GamePlayer::getName)
                .toList();
    }

    @Override
    public boolean isGroupAction() {
        return true;
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        context.recordAttempt(target);
        boolean killed = !context.isProtected(target) && context.kill(target, "mafia");
        return NightActionResult.builder()
                .actorRole(MafiaRole.MAFIA)
                .actorName(actor.getName())
                .targetName(target.getName())
                .message(killed ? "The mafia killed " + target.getName()
                        : "The mafia attacked " + target.getName() + " but the doctor saved them")
                .success(killed)
                .build();
    }
}
