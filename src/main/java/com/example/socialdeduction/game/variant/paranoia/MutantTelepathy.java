package com.example.socialdeduction.game.variant.paranoia;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.strategy.OneShotAbility;

import java.util.List;
import java.util.Map;

/**
 * Once per game the Mutant reads one mind and learns that player's role.
 */
public class MutantTelepathy implements OneShotAbility {

    @Override
    public Role getRole() {
        return ParanoiaRole.MUTANT;
    }

    @Override
    public DecisionType getDecisionType() {
        return DecisionType.TELEPATHY;
    }

    @Override
    public boolean offer(GameSession session, GamePlayer holder) {
        if (!isAvailable(session, holder)) {
            return false;
        }
        List<String> targets = session.getPlayers().aliveNamesExcept(holder.getName());
        if (targets.isEmpty() || !session.getGateway().confirm(session.agentOf(holder),
                session.contextFor(holder, DecisionType.TELEPATHY), false)) {
            return false;
        }
        String chosen = session.getGateway().choose(session.agentOf(holder),
                session.contextFor(holder, DecisionType.TELEPATHY), targets);
        GamePlayer target = session.getPlayers().findByName(chosen);
        holder.useAbility();
        session.tell(holder.getName(), "Telepathy: " + target.getName() + " is a "
                + target.getRole().getDisplayName() + ".", true);
        session.getRecorder().record(EventType.ACTION_TAKEN, holder.getName() + " used telepathy",
                Map.of("actor", holder.getName(), "role", ParanoiaRole.MUTANT.name(), "target", target.getName()));
        return true;
    }
}
