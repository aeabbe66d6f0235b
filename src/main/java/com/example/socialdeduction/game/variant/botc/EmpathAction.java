package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.strategy.NightActionResult;
import com.example.socialdeduction.game.strategy.NightContext;
import com.example.socialdeduction.game.strategy.NightPriority;
import com.example.socialdeduction.game.strategy.RoleActionStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Learns how many of the two nearest living neighbours are evil.
 */
public class EmpathAction implements RoleActionStrategy {

    @Override
    public Role getRole() {
        return BotcRole.EMPATH;
    }

    @Override
    public NightPriority getPriority() {
        return NightPriority.SENSE;
    }

    @Override
    public DecisionType getDecisionType() {
        return null;
    }

    @Override
    public NightActionResult execute(NightContext context, GamePlayer actor, GamePlayer target) {
        List<GamePlayer> neighbours = context.getPlayers().aliveNeighbours(actor);
        int evil = (int) neighbours.stream().filter(player -> player.getTeam() == Team.EVIL).count();
        boolean reliable = !context.corrupts(actor, neighbours.toArray(GamePlayer[]::new));
        int shown = reliable ? evil : wrongCount(context, evil, neighbours.size());
        context.tell(actor, String.format("Night %d: %d of your living neighbours %s evil.",
                context.getNight(), shown, shown == 1 ? "is" : "are"), reliable);
        return NightActionResult.builder()
                .actorRole(BotcRole.EMPATH)
                .actorName(actor.getName())
                .message(actor.getName() + " sensed their neighbours")
                .success(reliable)
                .build();
    }

    private static int wrongCount(NightContext context, int actual, int neighbourCount) {
        List<Integer> wrong = new ArrayList<>();
        for (int count = 0; count <= Math.max(neighbourCount, 1); count++) {
            if (count != actual) {
                wrong.add(count);
            }
        }
        return context.getRandom().pick(wrong);
    }
}
