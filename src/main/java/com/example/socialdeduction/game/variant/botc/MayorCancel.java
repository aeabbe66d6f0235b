package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.vote.OverrideKind;
import com.example.socialdeduction.game.domain.vote.VoteRecord;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.VoteOverride;

import java.util.Map;

/**
 * Once per game the Mayor may call off their own execution. The vote then has no
 * effect at all.
 */
public class MayorCancel implements VoteOverride {

    @Override
    public OverrideKind getKind() {
        return OverrideKind.SELF_CANCEL;
    }

    @Override
    public boolean apply(GameSession session, VoteRecord record) {
        GamePlayer target = session.getPlayers().findAlive(record.getTarget());
        if (target == null || !target.hasRole(BotcRole.MAYOR) || target.isAbilityUsed()) {
            return false;
        }
        boolean cancel = session.getGateway().confirm(session.agentOf(target),
                session.contextFor(target, DecisionType.CANCEL_OWN_EXECUTION, target.getName()), false);
        if (!cancel) {
            return false;
        }
        target.useAbility();
        record.markCancelled();
        session.getRecorder().record(EventType.ACTION_TAKEN, "The Mayor cancelled their own execution",
                Map.of("actor", target.getName(), "role", BotcRole.MAYOR.name(), "override", getKind().name()));
        return true;
    }
}
