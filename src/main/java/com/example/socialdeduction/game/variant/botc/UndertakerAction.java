package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.strategy.NightActionResult;
import com.example.socialdeduction.game.strategy.NightContext;
import com.example.socialdeduction.game.strategy.NightPriority;
import com.example.socialdeduction.game.strategy.RoleActionStrategy;

import java.util.Optional;

/**
 * Learns the role of the player executed yesterday. Night deaths do not count;
 * a night after a day without execution brings nothing.
 */
public class UndertakerAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return BotcRole.UNDERTAKER;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.RETROSPECTIVE;
    }

    @Override
    public DecisionType getDecisionType() {
        return null;
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        Optional<String> executed = context.getSession().getState().executedYesterday();
        if (executed.isEmpty()) {
            return NightActionResult.noTarget(BotcRole.UNDERTAKER, actor.getName(), "Nobody was executed yesterday");
        }
        GamePlayer corpse = context.getPlayers().findByName(executed.get());
        boolean reliable = !context.corrupts(actor, corpse);
        Role shown = reliable ? corpse.getRole() : BotcRole.otherThan(corpse.getRole(), context.getRandom());
        context.tell(actor, String.format("Night %d: %s, executed yesterday, was the %s.",
                context.getNight(), corpse.getName(), shown.getDisplayName()), reliable);
        return NightActionResult.builder()
                .actorRole(BotcRole.UNDERTAKER)
                .actorName(actor.getName())
                .targetName(corpse.getName())
                .message(actor.getName() + " examined " + corpse.getName())
                .success(reliable)
                .build();
    }
}
