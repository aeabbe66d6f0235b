package com.example.socialdeduction.game.domain.vote;

import com.example.socialdeduction.game.domain.Ballot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VoteRecordTest {

    @Test
    @DisplayName("a voter can cast exactly one ballot")
    void ballotIsWriteOnce() {
        // given
        VoteRecord record = new VoteRecord(1, VoteKind.EXECUTION, "P1", "P2", 3);
        record.cast("P1", Ballot.YES);

        // when & then
        assertThatThrownBy(() -> record.cast("P1", Ballot.NO))
                .isInstanceOf(IllegalStateException.class);
        assertThat(record.ballotOf("P1")).isEqualTo(Ballot.YES);
    }

    @Test
    @DisplayName("no more ballots than eligible voters")
    void ballotsBoundedByEligibleVoters() {
        // given
        VoteRecord record = new VoteRecord(1, VoteKind.EXECUTION, "P1", "P2", 2);
        record.cast("P1", Ballot.YES);
        record.cast("P2", Ballot.NO);

        // when & then
        assertThatThrownBy(() -> record.cast("P3", Ballot.YES))
                .isInstanceOf(IllegalStateException.class);
        assertThat(record.getBallots()).hasSize(2);
    }

    @Test
    @DisplayName("the tally is finalized once and then frozen")
    void tallyFinalizedOnce() {
        // given
        VoteRecord record = new VoteRecord(2, VoteKind.ELECTION, "P1", "P2", 3);
        record.cast("P1", Ballot.YES);
        record.finalizeTally(false);

        // when & then
        assertThatThrownBy(() -> record.finalizeTally(true)).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> record.cast("P2", Ballot.YES)).isInstanceOf(IllegalStateException.class);
        assertThat(record.isFinalized()).isTrue();
        assertThat(record.isPassed()).isFalse();
    }

    @Test
    @DisplayName("a cancelled or vetoed pass is no longer effective")
    void overridesRemoveEffect() {
        // given
        VoteRecord cancelled = new VoteRecord(1, VoteKind.EXECUTION, "P1", "P2", 1);
        VoteRecord vetoed = new VoteRecord(1, VoteKind.ELECTION, "P1", "P2", 1);
        cancelled.finalizeTally(true);
        vetoed.finalizeTally(true);

        // when
        cancelled.markCancelled();
        vetoed.markVetoed();

        // then
        assertThat(cancelled.isPassed()).isTrue();
        assertThat(cancelled.isEffective()).isFalse();
        assertThat(vetoed.isEffective()).isFalse();
    }
}
