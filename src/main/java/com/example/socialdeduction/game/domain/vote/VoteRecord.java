package com.example.socialdeduction.game.domain.vote;

import com.example.socialdeduction.game.domain.Ballot;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One public decision: who proposed whom, each voter's ballot, and the result.
 * Ballots are written once per voter; the tally is finalized exactly once.
 */
@Getter
public class VoteRecord {

    private final int round;
    private final VoteKind kind;
    private final String proposer;
    private final String target;
    private final int eligibleVoters;

    private final Map<String, Ballot> ballots = new LinkedHashMap<>();

    private Boolean passed;
    private boolean cancelled;
    private boolean vetoed;
    private boolean instantWin;

    public VoteRecord(int round, VoteKind kind, String proposer, String target, int eligibleVoters) {
        this.round = round;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.proposer = proposer;
        this.target = target;
        this.eligibleVoters = eligibleVoters;
    }

    public void cast(String voter, Ballot ballot) {
        Objects.requireNonNull(voter, "voter");
        Objects.requireNonNull(ballot, "ballot");
        if (passed != null) {
            throw new IllegalStateException("tally already finalized for round " + round);
        }
        if (ballots.containsKey(voter)) {
            throw new IllegalStateException(voter + " already voted in round " + round);
        }
        if (ballots.size() >= eligibleVoters) {
            throw new IllegalStateException("more ballots than eligible voters in round " + round);
        }
        ballots.put(voter, ballot);
    }

    public Map<String, Ballot> getBallots() {
        return Collections.unmodifiableMap(ballots);
    }

    public Ballot ballotOf(String voter) {
        return ballots.get(voter);
    }

    public long yesCount() {
        return ballots.values().stream().filter(Ballot::approves).count();
    }

    public void finalizeTally(boolean result) {
        if (passed != null) {
            throw new IllegalStateException("tally already finalized for round " + round);
        }
        passed = result;
    }

    public boolean isFinalized() {
        return passed != null;
    }

    public boolean isPassed() {
        return Boolean.TRUE.equals(passed);
    }

    /**
     * Pass that survived every override: not cancelled, not vetoed.
     */
    public boolean isEffective() {
        return isPassed() && !cancelled && !vetoed;
    }

    public void markCancelled() {
        this.cancelled = true;
    }

    public void markVetoed() {
        this.vetoed = true;
    }

    public void markInstantWin() {
        this.instantWin = true;
    }
}
