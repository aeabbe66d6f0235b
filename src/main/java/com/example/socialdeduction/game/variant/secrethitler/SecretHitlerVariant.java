package com.example.socialdeduction.game.variant.secrethitler;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.GameState;
import com.example.socialdeduction.game.domain.PhaseCycle;
import com.example.socialdeduction.game.domain.Players;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.domain.deck.CardDeck;
import com.example.socialdeduction.game.domain.vote.Nomination;
import com.example.socialdeduction.game.domain.vote.VoteKind;
import com.example.socialdeduction.game.domain.vote.VoteRecord;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.record.IncidentType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.TableTalkService;
import com.example.socialdeduction.game.service.VoteOverride;
import com.example.socialdeduction.game.service.VoteService;
import com.example.socialdeduction.game.service.WinEvaluator;
import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.game.variant.WinCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Secret Hitler. Every round is one day: a presidential nomination, table talk,
 * an election, and on success a legislative session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SecretHitlerVariant implements GameVariant {

    public static final String KEY = "secret-hitler";

    public static final int LIBERAL_POLICIES_TO_WIN = 5;
    public static final int FASCIST_POLICIES_TO_WIN = 6;
    private static final int HITLER_KNOWS_ALLIES_MAX_PLAYERS = 6;
    private static final int PRESIDENT_TERM_LIMIT_MAX_ALIVE = 6;
    private static final int POLICIES_PER_SESSION = 3;

    private static final RoleTable ROLE_TABLE = new ShRoleTable();
    private static final List<VoteOverride> ELECTION_OVERRIDES = List.of(new HitlerElected());
    private static final List<VoteOverride> LEGISLATIVE_OVERRIDES = List.of(new MutualVeto());

    private final VoteService voteService;
    private final TableTalkService tableTalkService;
    private final WinEvaluator winEvaluator;

    @Override
    public String getKey() {
        return KEY;
    }

    @Override
    public RoleTable getRoleTable() {
        return ROLE_TABLE;
    }

    @Override
    public PhaseCycle getPhaseCycle() {
        return PhaseCycle.DAY_ONLY;
    }

    /**
     * Shuffles the 17-card policy deck and hands out night-zero knowledge: the
     * fascists know each other and Hitler; Hitler knows the fascists only in
     * games of five or six.
     */
    @Override
    public void setup(GameSession session) {
        List<Policy> cards = new ArrayList<>(Collections.nCopies(Policy.LIBERAL_CARDS, Policy.LIBERAL));
        cards.addAll(Collections.nCopies(Policy.FASCIST_CARDS, Policy.FASCIST));
        Players players = session.getPlayers();
        session.putBoard(SecretHitlerBoard.class,
                new SecretHitlerBoard(new CardDeck<>(cards, session.getRandom()), players.size()));

        List<GamePlayer> fascists = players.getAsList().stream().filter(p -> p.hasRole(ShRole.FASCIST)).toList();
        GamePlayer hitler = players.firstWithRole(ShRole.HITLER).orElseThrow();
        for (GamePlayer fascist : fascists) {
            String others = fascists.stream()
                    .filter(other -> other != fascist)
                    .map(GamePlayer::getName)
                    .collect(Collectors.joining(", "));
            session.tell(fascist.getName(), "Hitler is " + hitler.getName() + "."
                    + (others.isEmpty() ? "" : " Your fellow fascists: " + others + "."), true);
        }
        if (players.size() <= HITLER_KNOWS_ALLIES_MAX_PLAYERS && !fascists.isEmpty()) {
            session.tell(hitler.getName(), "Your fascist ally is " + fascists.get(0).getName() + ".", true);
        }
    }

    // ==================== round ====================

    @Override
    public void runDay(GameSession session) {
        SecretHitlerBoard board = session.getBoard(SecretHitlerBoard.class);
        Players players = session.getPlayers();

        GamePlayer president = board.nextPresident(players);
        List<String> candidates = eligibleChancellors(board, players, president);
        Nomination nomination = voteService.nominate(session, List.of(president),
                DecisionType.NOMINATE_CHANCELLOR, player -> candidates);
        if (nomination == null) {
            return;
        }
        GamePlayer chancellor = players.findByName(nomination.nominee());

        tableTalkService.discuss(session, players.findAllAlivePlayers());

        VoteRecord election = voteService.conductVote(session, VoteKind.ELECTION, president.getName(),
                chancellor.getName(), players.findAllAlivePlayers());
        voteService.applyOverrides(session, election, ELECTION_OVERRIDES);
        if (election.isInstantWin()) {
            return;
        }
        if (!election.isPassed()) {
            session.getRecorder().record(EventType.GOVERNMENT_FAILED,
                    "Government of " + president.getName() + " and " + chancellor.getName() + " failed",
                    government(president, chancellor));
            advanceTracker(session, board);
            return;
        }

        board.markElected(president.getName(), chancellor.getName());
        session.getRecorder().record(EventType.GOVERNMENT_FORMED,
                "President " + president.getName() + ", Chancellor " + chancellor.getName(),
                government(president, chancellor));
        legislate(session, board, election, president, chancellor);
    }

    /**
     * Alive players other than the president, minus the last elected chancellor,
     * and minus the last elected president while six or fewer players live.
     */
    List<String> eligibleChancellors(SecretHitlerBoard board, Players players, GamePlayer president) {
        List<String> eligible = players.aliveNamesExcept(president.getName()).stream()
                .filter(name -> !name.equals(board.getLastElectedChancellor()))
                .filter(name -> players.aliveCount() > PRESIDENT_TERM_LIMIT_MAX_ALIVE
                        || !name.equals(board.getLastElectedPresident()))
                .toList();
        return eligible.isEmpty() ? players.aliveNamesExcept(president.getName()) : eligible;
    }

    // ==================== legislative session ====================

    private void legislate(GameSession session, SecretHitlerBoard board, VoteRecord election,
                           GamePlayer president, GamePlayer chancellor) {
        List<Policy> hand = new ArrayList<>(draw(session, board, POLICIES_PER_SESSION));
        session.tell(president.getName(), "You drew " + hand + ".", true);
        Policy presidentDiscard = chooseDiscard(session, president, DecisionType.PRESIDENT_DISCARD, hand);
        hand.remove(presidentDiscard);
        board.getDeck().discard(presidentDiscard);
        session.tell(chancellor.getName(), "The President passed you " + hand + ".", true);

        voteService.applyOverrides(session, election, LEGISLATIVE_OVERRIDES);
        if (election.isVetoed()) {
            board.getDeck().discardAll(hand);
            advanceTracker(session, board);
            return;
        }

        Policy chancellorDiscard = chooseDiscard(session, chancellor, DecisionType.CHANCELLOR_DISCARD, hand);
        hand.remove(chancellorDiscard);
        board.getDeck().discard(chancellorDiscard);

        Policy enacted = hand.get(0);
        enact(session, enacted, false);
        if (enacted == Policy.FASCIST && winEvaluator.evaluate(session).isEmpty()) {
            usePower(session, board, president);
        }
    }

    /**
     * Asks for a policy to discard; the options are the distinct policies in hand.
     */
    private Policy chooseDiscard(GameSession session, GamePlayer holder, DecisionType type, List<Policy> hand) {
        List<String> options = hand.stream().map(Policy::name).distinct().toList();
        String choice = session.getGateway().choose(session.agentOf(holder),
                session.contextFor(holder, type, hand.toString()), options);
        return Policy.valueOf(choice);
    }

    private void enact(GameSession session, Policy policy, boolean topDeck) {
        GameState state = session.getState();
        if (policy == Policy.LIBERAL) {
            state.enactLiberal();
        } else {
            state.enactFascist();
        }
        state.getElectionTracker().resetOnEnactment();
        log.debug("[round] policy enacted: gameId={}, policy={}, topDeck={}", session.getGameId(), policy, topDeck);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("policy", policy.name());
        data.put("topDeck", topDeck);
        data.put("liberal", state.getLiberalPolicies());
        data.put("fascist", state.getFascistPolicies());
        session.getRecorder().record(EventType.POLICY_ENACTED, policy + " policy enacted"
                + (topDeck ? " from the top of the deck" : ""), data);
    }

    /**
     * A failed election or a veto moves the tracker; on the third failure the top
     * policy is enacted without a power and term limits are lifted.
     */
    private void advanceTracker(GameSession session, SecretHitlerBoard board) {
        if (!session.getState().getElectionTracker().recordFailure()) {
            return;
        }
        Policy top = draw(session, board, 1).get(0);
        enact(session, top, true);
        board.resetTermLimits();
    }

    private List<Policy> draw(GameSession session, SecretHitlerBoard board, int count) {
        CardDeck<Policy> deck = board.getDeck();
        int reshuffles = deck.getReshuffles();
        List<Policy> drawn = deck.draw(count);
        if (deck.getReshuffles() != reshuffles) {
            session.getRecorder().incident(IncidentType.DECK_RESHUFFLED, "policy deck reshuffled",
                    Map.of("drawPile", deck.drawSize()));
        }
        return drawn;
    }

    // ==================== executive powers ====================

    private void usePower(GameSession session, SecretHitlerBoard board, GamePlayer president) {
        ExecutivePower power = ExecutivePower.forFascistPolicy(board.getBoardSize(),
                session.getState().getFascistPolicies());
        if (power == ExecutivePower.NONE) {
            return;
        }
        Players players = session.getPlayers();
        switch (power) {
            case INVESTIGATE_LOYALTY -> {
                List<String> options = players.aliveNamesExcept(president.getName()).stream()
                        .filter(name -> !board.getInvestigated().contains(name))
                        .toList();
                String chosen = session.getGateway().choose(session.agentOf(president),
                        session.contextFor(president, DecisionType.EXECUTIVE_INVESTIGATE), options);
                if (chosen != null) {
                    board.getInvestigated().add(chosen);
                    GamePlayer suspect = players.findByName(chosen);
                    session.tell(president.getName(), chosen + " is a member of the "
                            + suspect.getTeam().getDisplayName() + " party.", true);
                    powerUsed(session, power, president, chosen);
                }
            }
            case SPECIAL_ELECTION -> {
                String chosen = session.getGateway().choose(session.agentOf(president),
                        session.contextFor(president, DecisionType.SPECIAL_ELECTION),
                        players.aliveNamesExcept(president.getName()));
                if (chosen != null) {
                    board.setSpecialPresident(chosen);
                    powerUsed(session, power, president, chosen);
                }
            }
            case POLICY_PEEK -> {
                List<Policy> top = board.getDeck().peek(POLICIES_PER_SESSION);
                session.tell(president.getName(), "The top policies are " + top + ".", true);
                powerUsed(session, power, president, null);
            }
            case EXECUTION -> {
                String chosen = session.getGateway().choose(session.agentOf(president),
                        session.contextFor(president, DecisionType.EXECUTE),
                        players.aliveNamesExcept(president.getName()));
                if (chosen != null) {
                    powerUsed(session, power, president, chosen);
                    session.execute(players.findByName(chosen));
                    winEvaluator.evaluate(session);
                }
            }
            default -> {
            }
        }
    }

    private void powerUsed(GameSession session, ExecutivePower power, GamePlayer president, String target) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actor", president.getName());
        data.put("power", power.name());
        data.put("target", target);
        session.getRecorder().record(EventType.ACTION_TAKEN, president.getName() + " used " + power, data);
    }

    private static Map<String, Object> government(GamePlayer president, GamePlayer chancellor) {
        return Map.of("president", president.getName(), "chancellor", chancellor.getName());
    }

    // ==================== game end ====================

    @Override
    public List<WinCondition> getWinConditions() {
        return List.of(
                session -> session.getPlayers().isRoleAlive(ShRole.HITLER) ? Optional.empty()
                        : Optional.of(Winner.team(Team.LIBERAL, "Hitler was executed")),
                session -> session.getState().getLiberalPolicies() >= LIBERAL_POLICIES_TO_WIN
                        ? Optional.of(Winner.team(Team.LIBERAL, "five liberal policies enacted"))
                        : Optional.empty(),
                session -> session.getState().getFascistPolicies() >= FASCIST_POLICIES_TO_WIN
                        ? Optional.of(Winner.team(Team.FASCIST, "six fascist policies enacted"))
                        : Optional.empty());
    }

    @Override
    public Winner fallbackWinner(GameSession session) {
        GameState state = session.getState();
        return state.getLiberalPolicies() > state.getFascistPolicies()
                ? Winner.team(Team.LIBERAL, "more liberal policies when time ran out")
                : Winner.team(Team.FASCIST, "liberals did not lead when time ran out");
    }

    @Override
    public Map<String, Object> describeBoard(GameSession session) {
        SecretHitlerBoard board = session.getBoard(SecretHitlerBoard.class);
        Map<String, Object> described = new LinkedHashMap<>();
        described.put("liberalPolicies", session.getState().getLiberalPolicies());
        described.put("fascistPolicies", session.getState().getFascistPolicies());
        described.put("electionTracker", session.getState().getElectionTracker().getCount());
        described.put("drawPile", board.getDeck().drawSize());
        if (board.getLastElectedPresident() != null) {
            described.put("lastPresident", board.getLastElectedPresident());
        }
        if (board.getLastElectedChancellor() != null) {
            described.put("lastChancellor", board.getLastElectedChancellor());
        }
        return described;
    }
}
