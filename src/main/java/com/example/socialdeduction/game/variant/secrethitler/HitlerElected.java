package com.example.socialdeduction.game.variant.secrethitler;

import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.domain.vote.OverrideKind;
import com.example.socialdeduction.game.domain.vote.VoteRecord;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.VoteOverride;

/**
 * Hitler elected Chancellor once three fascist policies are enacted: the
 * fascists win on the spot.
 */
public class HitlerElected implements VoteOverride {

    public static final int FASCIST_THRESHOLD = 3;

    @Override
    public OverrideKind getKind() {
        return OverrideKind.INSTANT_WIN;
    }

    @Override
    public boolean apply(GameSession session, VoteRecord record) {
        GamePlayer chancellor = session.getPlayers().findByName(record.getTarget());
        if (chancellor == null || !chancellor.hasRole(ShRole.HITLER)
                || session.getState().getFascistPolicies() < FASCIST_THRESHOLD) {
            return false;
        }
        record.markInstantWin();
        session.declareWinner(Winner.team(Team.FASCIST, "Hitler was elected Chancellor"));
        return true;
    }
}
