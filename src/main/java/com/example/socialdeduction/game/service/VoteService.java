package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.agent.BallotRequest;
import com.example.socialdeduction.game.agent.ChoiceRequest;
import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.Ballot;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.vote.Nomination;
import com.example.socialdeduction.game.domain.vote.OverrideKind;
import com.example.socialdeduction.game.domain.vote.VoteKind;
import com.example.socialdeduction.game.domain.vote.VoteRecord;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.record.IncidentType;
import com.example.socialdeduction.global.random.RandomSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Nominations, ballots and post-vote overrides.
 * - plurality with a uniform random tie-break
 * - strict majority of the eligible voters
 * - dependent voters (a player with a master) vote after everyone else
 */
@Service
@Slf4j
public class VoteService {

    // ================= nomination =================

    /**
     * Every proposer names one of its options at once; the plurality name is
     * nominated and one of the players who proposed it becomes the nominator.
     *
     * @return the nomination, or null when nobody could propose anyone
     */
    public Nomination nominate(GameSession session, List<GamePlayer> proposers, DecisionType type,
                               Function<GamePlayer, List<String>> optionsFor) {
        List<ChoiceRequest> requests = new ArrayList<>();
        for (GamePlayer proposer : proposers) {
            List<String> options = optionsFor.apply(proposer);
            if (proposer.isAlive() && !options.isEmpty()) {
                requests.add(new ChoiceRequest(proposer.getName(), session.agentOf(proposer),
                        session.contextFor(proposer, type), options));
            }
        }
        if (requests.isEmpty()) {
            emptyActors(session, type.name());
            return null;
        }

        Map<String, String> proposals = session.getGateway().chooseAll(requests);
        Map<String, Long> tally = tally(proposals.values());
        List<String> top = getTopVotedPlayers(tally);
        String nominee = top.size() == 1 ? top.get(0) : session.getRandom().pick(top);
        List<String> backers = proposals.entrySet().stream()
                .filter(entry -> entry.getValue().equals(nominee))
                .map(Map.Entry::getKey)
                .toList();
        String nominator = session.getRandom().pick(backers);

        log.debug("[vote] nominated: gameId={}, nominee={}, nominator={}, tally={}",
                session.getGameId(), nominee, nominator, tally);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("nominator", nominator);
        data.put("nominee", nominee);
        data.put("proposals", new LinkedHashMap<>(proposals));
        data.put("tally", tally);
        session.getRecorder().record(EventType.NOMINATION, nominator + " nominated " + nominee, data);
        return new Nomination(nominator, nominee, tally);
    }

    // ================= ballots =================

    /**
     * Collects one ballot from each voter. Independent voters answer together;
     * a voter with a master then follows its master's approval, or keeps its own
     * ballot when the master did not approve.
     */
    public VoteRecord conductVote(GameSession session, VoteKind kind, String proposer, String target,
                                  List<GamePlayer> voters) {
        List<GamePlayer> eligible = voters.stream().filter(GamePlayer::isAlive).toList();
        VoteRecord record = new VoteRecord(session.getState().getRound(), kind, proposer, target, eligible.size());
        if (eligible.isEmpty()) {
            emptyActors(session, kind.name());
            record.finalizeTally(false);
            return record;
        }

        List<GamePlayer> independent = new ArrayList<>();
        List<GamePlayer> dependent = new ArrayList<>();
        for (GamePlayer voter : eligible) {
            (voter.getMaster() != null ? dependent : independent).add(voter);
        }

        List<BallotRequest> requests = independent.stream()
                .map(voter -> new BallotRequest(voter.getName(), session.agentOf(voter),
                        session.contextFor(voter, DecisionType.VOTE, target), Ballot.NO))
                .toList();
        Map<String, Ballot> ballots = session.getGateway().voteAll(requests);
        ballots.forEach((voter, ballot) -> cast(session, record, voter, ballot, false));

        for (GamePlayer voter : dependent) {
            Ballot own = session.getGateway().vote(session.agentOf(voter),
                    session.contextFor(voter, DecisionType.VOTE, target), Ballot.NO);
            Ballot masters = record.ballotOf(voter.getMaster());
            cast(session, record, voter.getName(), masters == Ballot.YES ? Ballot.YES : own, true);
        }

        long yes = record.yesCount();
        record.finalizeTally(isMajority(yes, eligible.size()));

        log.debug("[vote] resolved: gameId={}, kind={}, target={}, yes={}, voters={}, passed={}",
                session.getGameId(), kind, target, yes, eligible.size(), record.isPassed());
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("kind", kind.name());
        data.put("proposer", proposer);
        data.put("target", target);
        data.put("yes", yes);
        data.put("no", eligible.size() - yes);
        data.put("passed", record.isPassed());
        session.getRecorder().record(EventType.VOTE_RESOLVED,
                target + (record.isPassed() ? " passed" : " failed") + " " + yes + "/" + eligible.size(), data);
        return record;
    }

    private void cast(GameSession session, VoteRecord record, String voter, Ballot ballot, boolean dependent) {
        record.cast(voter, ballot);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("voter", voter);
        data.put("ballot", record.getKind() == VoteKind.ELECTION ? ballot.toJaNein() : ballot.name());
        data.put("target", record.getTarget());
        data.put("dependent", dependent);
        session.getRecorder().record(EventType.VOTE_CAST, voter + " votes " + data.get("ballot"), data);
    }

    // ================= overrides =================

    /**
     * Runs the overrides on a passed vote. An instant win is tried first and, when
     * it fires, the remaining overrides are skipped.
     */
    public VoteRecord applyOverrides(GameSession session, VoteRecord record, List<VoteOverride> overrides) {
        if (!record.isPassed() || overrides.isEmpty()) {
            return record;
        }
        List<VoteOverride> ordered = new ArrayList<>(overrides);
        ordered.sort(Comparator.comparing((VoteOverride override) -> override.getKind() != OverrideKind.INSTANT_WIN)
                .thenComparing(VoteOverride::getKind));
        for (VoteOverride override : ordered) {
            if (override.apply(session, record)) {
                log.debug("[vote] override fired: gameId={}, kind={}, target={}",
                        session.getGameId(), override.getKind(), record.getTarget());
                if (override.getKind() == OverrideKind.INSTANT_WIN) {
                    break;
                }
            }
        }
        return record;
    }

    // ================= tally =================

    /**
     * Strict majority: more than half of the eligible voters approve.
     */
    public static boolean isMajority(long yes, int voters) {
        return voters > 0 && 2 * yes > voters;
    }

    /**
     * Names with the highest count, in tally order.
     */
    public static List<String> getTopVotedPlayers(Map<String, Long> counts) {
        if (counts == null || counts.isEmpty()) {
            return new ArrayList<>();
        }
        long max = Collections.max(counts.values());
        return counts.entrySet().stream()
                .filter(e -> e.getValue() == max)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * Most frequent pick; ties are broken uniformly at random.
     */
    public static String plurality(Collection<String> picks, RandomSource random) {
        List<String> top = getTopVotedPlayers(tally(picks));
        if (top.isEmpty()) {
            return null;
        }
        return top.size() == 1 ? top.get(0) : random.pick(top);
    }

    private static Map<String, Long> tally(Collection<String> picks) {
        Map<String, Long> counts = new LinkedHashMap<>();
        picks.forEach(pick -> counts.merge(pick, 1L, Long::sum));
        return counts;
    }

    private void emptyActors(GameSession session, String what) {
        log.debug("[vote] nobody eligible: gameId={}, what={}", session.getGameId(), what);
        session.getRecorder().incident(IncidentType.EMPTY_ACTOR_SET, "nobody eligible for " + what,
                Map.of("what", what));
    }
}
