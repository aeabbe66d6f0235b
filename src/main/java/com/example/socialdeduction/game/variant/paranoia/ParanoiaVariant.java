package com.example.socialdeduction.game.variant.paranoia;

import com.example.socialdeduction.game.agent.ChoiceRequest;
import com.example.socialdeduction.game.agent.DecisionContext;
import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.Ballot;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.GameState;
import com.example.socialdeduction.game.domain.PhaseCycle;
import com.example.socialdeduction.game.domain.Players;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.domain.vote.Nomination;
import com.example.socialdeduction.game.domain.vote.VoteKind;
import com.example.socialdeduction.game.domain.vote.VoteRecord;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.NightReport;
import com.example.socialdeduction.game.service.TableTalkService;
import com.example.socialdeduction.game.service.VoteService;
import com.example.socialdeduction.game.service.WinEvaluator;
import com.example.socialdeduction.game.strategy.OneShotAbility;
import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.game.variant.WinCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Paranoia-style game. Each night the Computer hands out a mission that traitors
 * may secretly sabotage; each day one treason accusation is judged by the
 * Computer, and someone is always executed: the accused when found guilty, the
 * accuser otherwise, or both when the Computer is in that kind of mood. The
 * Computer may also end the game at the close of any day.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ParanoiaVariant implements GameVariant {

    public static final String KEY = "paranoia";
    public static final String COMPUTER_SEAT = "THE_COMPUTER";
    public static final String SABOTAGE = "SABOTAGE";
    public static final String COOPERATE = "COOPERATE";
    public static final int MISSIONS_TO_DECIDE = 3;
    public static final String EXECUTE_ACCUSED = "ACCUSED";
    public static final String EXECUTE_ACCUSER = "ACCUSER";
    public static final String EXECUTE_BOTH = "BOTH";
    public static final int TERMINATION_PERCENT = 5;

    private static final RoleTable ROLE_TABLE = new ParanoiaRoleTable();
    private static final OneShotAbility TELEPATHY = new MutantTelepathy();
    private static final List<String> SENTENCES = List.of(EXECUTE_ACCUSED, EXECUTE_ACCUSER, EXECUTE_BOTH);
    private static final List<String> STANDING_MISSIONS = List.of(
            "Escort a crate of classified cleaning fluid to Sector R.",
            "Inspect the food vats for unauthorized flavor.",
            "Audit the loyalty of the bot maintenance crew.",
            "Recover a lost clearance badge from the reactor corridor.",
            "Test the new happiness dispenser on yourselves.");

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
        return PhaseCycle.NIGHT_AND_DAY;
    }

    @Override
    public List<String> getExtraSeats() {
        return List.of(COMPUTER_SEAT);
    }

    /**
     * Traitors learn their society; the Mutant learns about its power.
     */
    @Override
    public void setup(GameSession session) {
        session.putBoard(ParanoiaBoard.class, new ParanoiaBoard());
        List<GamePlayer> traitors = session.getPlayers().getAsList().stream()
                .filter(player -> player.hasRole(ParanoiaRole.TRAITOR))
                .toList();
        for (GamePlayer traitor : traitors) {
            List<String> society = traitors.stream()
                    .map(GamePlayer::getName)
                    .filter(name -> !name.equals(traitor.getName()))
                    .toList();
            session.tell(traitor.getName(), society.isEmpty() ? "You are the only traitor."
                    : "Your secret society: " + String.join(", ", society) + ".", true);
        }
        session.getPlayers().firstWithRole(ParanoiaRole.MUTANT).ifPresent(mutant -> session.tell(mutant.getName(),
                "You may read one mind, once, during any day.", true));
    }

    // ==================== night: mission ====================

    @Override
    public void afterNight(GameSession session, NightReport report) {
        ParanoiaBoard board = session.getBoard(ParanoiaBoard.class);
        String mission = session.getGateway().talk(session.agentOf(COMPUTER_SEAT), computerContext(session,
                DecisionType.TABLE_TALK, null));
        board.setMission(mission.isEmpty() ? session.getRandom().pick(STANDING_MISSIONS) : mission);
        session.getRecorder().record(EventType.ACTION_TAKEN, "Mission: " + board.getMission(),
                Map.of("actor", COMPUTER_SEAT, "mission", board.getMission()));

        List<ChoiceRequest> requests = new ArrayList<>();
        for (GamePlayer traitor : session.getPlayers().aliveWithRole(ParanoiaRole.TRAITOR)) {
            requests.add(new ChoiceRequest(traitor.getName(), session.agentOf(traitor),
                    session.contextFor(traitor, DecisionType.SABOTAGE, board.getMission()),
                    List.of(SABOTAGE, COOPERATE)));
        }
        long sabotages = session.getGateway().chooseAll(requests).values().stream()
                .filter(SABOTAGE::equals)
                .count();
        boolean succeeded = sabotages == 0;
        session.getState().recordMission(succeeded);

        ComputerMood drift = session.getRandom().pick(Arrays.asList(ComputerMood.values()));
        ComputerMood mood = board.nextMood(succeeded, drift);
        log.debug("[night] mission resolved: gameId={}, succeeded={}, sabotages={}, mood={}",
                session.getGameId(), succeeded, sabotages, mood);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("mission", board.getMission());
        data.put("succeeded", succeeded);
        data.put("sabotages", sabotages);
        data.put("mood", mood.name());
        session.getRecorder().record(EventType.ACTION_TAKEN,
                succeeded ? "MISSION SUCCESS" : "MISSION FAILURE: " + sabotages + " sabotage(s)", data);
    }

    // ==================== day: accusation ====================

    @Override
    public void runDay(GameSession session) {
        Players players = session.getPlayers();
        tableTalkService.discuss(session, players.findAllAlivePlayers());

        for (GamePlayer mutant : players.aliveWithRole(ParanoiaRole.MUTANT)) {
            if (TELEPATHY.offer(session, mutant) && winEvaluator.evaluate(session).isPresent()) {
                return;
            }
        }

        judgeAccusation(session);
        if (winEvaluator.evaluate(session).isEmpty()) {
            considerTermination(session);
        }
    }

    private void judgeAccusation(GameSession session) {
        Players players = session.getPlayers();
        Nomination accusation = voteService.nominate(session, players.findAllAlivePlayers(), DecisionType.ACCUSE,
                player -> players.aliveNamesExcept(player.getName()));
        if (accusation == null) {
            return;
        }
        session.getState().recordAccusation();
        GamePlayer accuser = players.findByName(accusation.nominator());
        GamePlayer accused = players.findByName(accusation.nominee());
        briefComputer(session, accused);

        ParanoiaBoard board = session.getBoard(ParanoiaBoard.class);
        String sentence = session.getGateway().choose(session.agentOf(COMPUTER_SEAT),
                computerContext(session, DecisionType.JUDGE, accused.getName()), SENTENCES,
                board.getMood().convictsByDefault() ? EXECUTE_ACCUSED : EXECUTE_ACCUSER);
        boolean guilty = !EXECUTE_ACCUSER.equals(sentence);

        List<GamePlayer> condemned = new ArrayList<>();
        if (guilty) {
            condemned.add(accused);
        }
        if (!EXECUTE_ACCUSED.equals(sentence)) {
            condemned.add(accuser);
        }

        VoteRecord hearing = new VoteRecord(session.getState().getRound(), VoteKind.ACCUSATION, accuser.getName(),
                accused.getName(), 1);
        hearing.cast(COMPUTER_SEAT, guilty ? Ballot.YES : Ballot.NO);
        hearing.finalizeTally(guilty);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("kind", VoteKind.ACCUSATION.name());
        data.put("proposer", accuser.getName());
        data.put("target", accused.getName());
        data.put("verdict", guilty ? "GUILTY" : "INNOCENT");
        data.put("sentence", sentence);
        data.put("executed", condemned.stream().map(GamePlayer::getName).toList());
        data.put("mood", board.getMood().name());
        data.put("passed", hearing.isPassed());
        session.getRecorder().record(EventType.VOTE_RESOLVED, "The Computer finds " + accused.getName()
                + (guilty ? " GUILTY" : " INNOCENT") + (EXECUTE_BOTH.equals(sentence) ? ", and the accuser too" : ""),
                data);

        for (GamePlayer player : condemned) {
            if (session.execute(player)) {
                board.recordExecution();
            }
        }
    }

    /**
     * Secret intelligence on the accused reaches only the Computer.
     */
    private void briefComputer(GameSession session, GamePlayer accused) {
        if (accused.hasRole(ParanoiaRole.TRAITOR)) {
            session.tell(COMPUTER_SEAT, "Secret intelligence: " + accused.getName()
                    + " may belong to a secret society.", true);
        } else if (accused.hasRole(ParanoiaRole.MUTANT)) {
            session.tell(COMPUTER_SEAT, "Secret intelligence: " + accused.getName()
                    + " may have mutant powers.", true);
        }
    }

    /**
     * At the end of each day the Computer may end the game on a whim and name
     * whoever it likes as the winner. Without an answer it does so
     * {@value #TERMINATION_PERCENT}% of the time.
     */
    private void considerTermination(GameSession session) {
        boolean terminate = session.getGateway().confirm(session.agentOf(COMPUTER_SEAT),
                computerContext(session, DecisionType.TERMINATE_GAME, null),
                () -> session.getRandom().nextInt(100) < TERMINATION_PERCENT);
        if (!terminate) {
            return;
        }
        List<String> candidates = new ArrayList<>(session.getPlayers().aliveNames());
        candidates.add(COMPUTER_SEAT);
        String named = session.getGateway().choose(session.agentOf(COMPUTER_SEAT),
                computerContext(session, DecisionType.NAME_WINNER, null), candidates);
        log.info("[day] the Computer ended the game: gameId={}, named={}", session.getGameId(), named);
        Winner winner = COMPUTER_SEAT.equals(named)
                ? Winner.player("The Computer", "the Computer ended the game in its own favour")
                : Winner.team(session.getPlayers().findByName(named).getTeam(),
                        "the Computer ended the game and favoured " + named);
        session.declareWinner(winner.asForced());
    }

    private DecisionContext computerContext(GameSession session, DecisionType type, String subject) {
        return session.contextForSeat(COMPUTER_SEAT, "The Computer", type, subject);
    }

    // ==================== game end ====================

    @Override
    public List<WinCondition> getWinConditions() {
        return List.of(
                session -> session.getPlayers().countAlive(Team.TRAITOR) == 0
                        ? Optional.of(Winner.team(Team.LOYALIST, "every traitor was terminated"))
                        : Optional.empty(),
                session -> session.getPlayers().countAlive(Team.TRAITOR) >= session.getPlayers().countAlive(Team.LOYALIST)
                        ? Optional.of(Winner.team(Team.TRAITOR, "traitors outnumber the loyal"))
                        : Optional.empty(),
                session -> session.getState().getMissionsFailed() >= MISSIONS_TO_DECIDE
                        ? Optional.of(Winner.team(Team.TRAITOR, "three missions were sabotaged"))
                        : Optional.empty(),
                session -> session.getState().getMissionsSucceeded() >= MISSIONS_TO_DECIDE
                        ? Optional.of(Winner.team(Team.LOYALIST, "three missions succeeded"))
                        : Optional.empty());
    }

    @Override
    public Winner fallbackWinner(GameSession session) {
        GameState state = session.getState();
        return state.getMissionsSucceeded() > state.getMissionsFailed()
                ? Winner.team(Team.LOYALIST, "more missions succeeded when time ran out")
                : Winner.team(Team.TRAITOR, "missions did not succeed in time");
    }

    @Override
    public Map<String, Object> describeBoard(GameSession session) {
        ParanoiaBoard board = session.getBoard(ParanoiaBoard.class);
        Map<String, Object> described = new LinkedHashMap<>();
        described.put("mood", board.getMood().name());
        described.put("mission", board.getMission());
        described.put("missionsSucceeded", session.getState().getMissionsSucceeded());
        described.put("missionsFailed", session.getState().getMissionsFailed());
        described.put("accusations", session.getState().getAccusations());
        return described;
    }
}
