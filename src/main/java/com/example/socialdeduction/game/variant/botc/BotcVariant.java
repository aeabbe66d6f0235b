package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePhase;
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
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.TableTalkService;
import com.example.socialdeduction.game.service.VoteOverride;
import com.example.socialdeduction.game.service.VoteService;
import com.example.socialdeduction.game.service.WinEvaluator;
import com.example.socialdeduction.game.strategy.OneShotAbility;
import com.example.socialdeduction.game.strategy.RoleActionFactory;
import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.game.variant.WinCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blood on the Clocktower, trimmed to one demon, one minion and a fixed script of
 * townsfolk and outsiders.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BotcVariant implements GameVariant {

    public static final String KEY = "botc";

    private static final BotcRoleTable ROLE_TABLE = new BotcRoleTable();
    private static final RoleActionFactory ROLE_ACTIONS = new RoleActionFactory(List.of(
            new PoisonerAction(),
            new MonkAction(),
            new SoldierAction(),
            new ImpAction(),
            new RavenkeeperAction(),
            new UndertakerAction(),
            new EmpathAction(),
            new ButlerAction()));
    private static final OneShotAbility SLAYER_SHOT = new SlayerShot();
    private static final List<VoteOverride> EXECUTION_OVERRIDES = List.of(new MayorCancel());

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
    public RoleActionFactory getRoleActionFactory() {
        return ROLE_ACTIONS;
    }

    /**
     * The demon learns its minions and the minions learn their demon.
     */
    @Override
    public void setup(GameSession session) {
        session.putBoard(BotcBoard.class, new BotcBoard());
        List<GamePlayer> evil = session.getPlayers().getAsList().stream()
                .filter(player -> player.getTeam() == Team.EVIL)
                .toList();
        for (GamePlayer player : evil) {
            for (GamePlayer ally : evil) {
                if (ally != player) {
                    session.tell(player.getName(), "Your evil ally " + ally.getName() + " is the "
                            + ally.getRole().getDisplayName() + ".", true);
                }
            }
        }
    }

    // ==================== day ====================

    @Override
    public void runDay(GameSession session) {
        Players players = session.getPlayers();
        tableTalkService.discuss(session, players.findAllAlivePlayers());

        for (GamePlayer slayer : players.aliveWithRole(BotcRole.SLAYER)) {
            if (SLAYER_SHOT.offer(session, slayer) && winEvaluator.evaluate(session).isPresent()) {
                return;
            }
        }

        List<GamePlayer> alive = players.findAllAlivePlayers();
        Nomination nomination = voteService.nominate(session, alive, DecisionType.NOMINATE,
                player -> players.aliveNamesExcept(player.getName()));
        boolean executed = false;
        if (nomination != null) {
            VoteRecord record = voteService.conductVote(session, VoteKind.EXECUTION, nomination.nominator(),
                    nomination.nominee(), alive);
            voteService.applyOverrides(session, record, EXECUTION_OVERRIDES);
            if (record.isEffective()) {
                executed = session.execute(players.findByName(nomination.nominee()));
            }
        }
        if (!executed) {
            session.getBoard(BotcBoard.class).markQuietDay(session.getState().getDay());
        }
        log.debug("[day] botc day resolved: gameId={}, day={}, executed={}",
                session.getGameId(), session.getState().getDay(), executed);
    }

    // ==================== game end ====================

    @Override
    public List<WinCondition> getWinConditions() {
        return List.of(
                BotcVariant::saintExecuted,
                session -> session.getPlayers().isRoleAlive(BotcRole.IMP) ? Optional.empty()
                        : Optional.of(Winner.team(Team.GOOD, "the demon is dead")),
                session -> session.getPlayers().aliveCount() <= 2
                        ? Optional.of(Winner.team(Team.EVIL, "only two players remain"))
                        : Optional.empty(),
                BotcVariant::mayorWin);
    }

    private static Optional<Winner> saintExecuted(GameSession session) {
        String executed = session.getState().getLastExecuted();
        if (executed != null && session.getPlayers().findByName(executed).hasRole(BotcRole.SAINT)) {
            return Optional.of(Winner.team(Team.EVIL, "the Saint was executed"));
        }
        return Optional.empty();
    }

    /**
     * Three players alive, a living Mayor, and a day that just ended without an execution.
     */
    private static Optional<Winner> mayorWin(GameSession session) {
        GameState state = session.getState();
        boolean quietToday = state.getGamePhase() == GamePhase.DAY
                && session.getBoard(BotcBoard.class).getQuietDay() == state.getDay();
        if (quietToday && session.getPlayers().aliveCount() == 3 && session.getPlayers().isRoleAlive(BotcRole.MAYOR)) {
            return Optional.of(Winner.team(Team.GOOD, "the Mayor held a peaceful final day"));
        }
        return Optional.empty();
    }

    @Override
    public Winner fallbackWinner(GameSession session) {
        return session.getPlayers().isRoleAlive(BotcRole.IMP)
                ? Winner.team(Team.EVIL, "the demon survived until time ran out")
                : Winner.team(Team.GOOD, "the demon is dead");
    }

    @Override
    public Map<String, Object> describeBoard(GameSession session) {
        Map<String, Object> board = new LinkedHashMap<>();
        board.put("day", session.getState().getDay());
        board.put("night", session.getState().getNight());
        board.put("alive", session.getPlayers().aliveCount());
        if (session.getState().getLastExecuted() != null) {
            board.put("lastExecuted", session.getState().getLastExecuted());
        }
        return board;
    }
}
