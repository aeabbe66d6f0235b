package com.example.socialdeduction.game.variant.secrethitler;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.vote.OverrideKind;
import com.example.socialdeduction.game.domain.vote.VoteRecord;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.VoteOverride;

import java.util.Map;

/**
 * With five fascist policies enacted, the Chancellor may propose to veto the
 * agenda. Only the President's consent makes the veto stand.
 */
public class MutualVeto implements VoteOverride {

    public static final int FASCIST_THRESHOLD = 5;

    @Override
    public OverrideKind getKind() {
        return OverrideKind.MUTUAL_VETO;
    }

    @Override
    public boolean apply(GameSession session, VoteRecord record) {
        if (session.getState().getFascistPolicies() < FASCIST_THRESHOLD) {
            return false;
        }
        GamePlayer chancellor = session.getPlayers().findAlive(record.getTarget());
        GamePlayer president = session.getPlayers().findAlive(record.getProposer());
        if (chancellor == null || president == null) {
            return false;
        }
        boolean proposed = session.getGateway().confirm(session.agentOf(chancellor),
                session.contextFor(chancellor, DecisionType.PROPOSE_VETO, president.getName()), false);
        if (!proposed) {
            return false;
        }
        boolean consented = session.getGateway().confirm(session.agentOf(president),
                session.contextFor(president, DecisionType.CONSENT_VETO, chancellor.getName()), false);
        session.getRecorder().record(EventType.ACTION_TAKEN,
                consented ? "The agenda was vetoed" : "The President refused the veto",
                Map.of("chancellor", chancellor.getName(), "president", president.getName(),
                        "override", getKind().name(), "success", consented));
        if (consented) {
            record.markVetoed();
        }
        return consented;
    }
}
