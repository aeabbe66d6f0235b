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
 * Killed at night, the Ravenkeeper picks any player and learns their role.
 */
public class RavenkeeperAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return BotcRole.RAVENKEEPER;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.DEATH_TRIGGER;
    }

    @Override
    public DecisionType getDecisionType() {
        return DecisionType.REVEAL_ON_DEATH;
    }

    @Override
    public boolean isReactive() {
        return true;
    }

    @Override
    public List<String> legalTargets(NightContext context, GamePlayer actor) {
        return context.getPlayers().getAsList().stream()
                .map(GamePlayer::getName)
                .filter(name -> !name.equals(actor.getName()))
                .toList();
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        boolean reliable = !context.corrupts(actor, target);
        Role shown = reliable ? target.getRole() : BotcRole.otherThan(target.getRole(), context.getRandom());
        context.tell(actor, String.format("Night %d: as you died you learned %s is the %s.",
                context.getNight(), target.getName(), shown.getDisplayName()), reliable);
        return NightActionResult.builder()
                .actorRole(BotcRole.RAVENKEEPER)
                .actorName(actor.getName())
                .targetName(target.getName())
                .message(actor.getName() + " learned a role from beyond the grave")
                .success(reliable)
                .build();
    }
}
