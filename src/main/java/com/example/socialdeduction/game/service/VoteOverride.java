package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.domain.vote.OverrideKind;
import com.example.socialdeduction.game.domain.vote.VoteRecord;

/**
 * Rule that may change a passed vote after the tally.
 */
public interface VoteOverride {

    OverrideKind getKind();

    /**
     * Marks the record (cancelled, vetoed, instant win) when the rule applies.
     *
     * @return true when the rule fired
     */
    boolean apply(GameSession session, VoteRecord record);
}
