package com.example.socialdeduction.game.variant.mafia;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.PhaseCycle;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Team;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.domain.vote.Nomination;
import com.example.socialdeduction.game.domain.vote.VoteKind;
import com.example.socialdeduction.game.domain.vote.VoteRecord;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.TableTalkService;
import com.example.socialdeduction.game.service.VoteService;
import com.example.socialdeduction.game.strategy.RoleActionFactory;
import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.game.variant.WinCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classic Mafia: a night kill, then a two-stage day (accusation, final vote).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MafiaVariant implements GameVariant {

    public static final String KEY = "mafia";

    private static final RoleTable ROLE_TABLE = new MafiaRoleTable();
    private static final RoleActionFactory ROLE_ACTIONS = new RoleActionFactory(List.of(
            new MafiaAction(), new DoctorAction(), new DetectiveAction()));

    private final VoteService voteService;
    private final TableTalkService tableTalkService;

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
     * Mafia members learn each other.
     */
    @Override
    public void setup(GameSession session) {
        List<GamePlayer> mafia = session.getPlayers().getAsList().stream()
                .filter(player -> player.hasRole(MafiaRole.MAFIA))
                .toList();
        for (GamePlayer member : mafia) {
            List<String> partners = mafia.stream()
                    .map(GamePlayer::getName)
                    .filter(name -> !name.equals(member.getName()))
                    .toList();
            session.tell(member.getName(), partners.isEmpty() ? "You are the only mafia member."
                    : "Your fellow mafia: " + String.join(", ", partners) + ".", true);
        }
    }

    // ==================== day ====================

    @Override
    public void runDay(GameSession session) {
        List<GamePlayer> alive = session.getPlayers().findAllAlivePlayers();
        tableTalkService.discuss(session, alive);

        Nomination accusation = voteService.nominate(session, alive, DecisionType.ACCUSE,
                player -> session.getPlayers().aliveNamesExcept(player.getName()));
        if (accusation == null) {
            return;
        }
        GamePlayer accused = session.getPlayers().findByName(accusation.nominee());
        List<GamePlayer> jury = alive.stream()
                .filter(player -> !player.getName().equals(accused.getName()))
                .toList();
        VoteRecord verdict = voteService.conductVote(session, VoteKind.EXECUTION, accusation.nominator(),
                accused.getName(), jury);
        if (verdict.isEffective()) {
            session.execute(accused);
            log.debug("[day] executed: gameId={}, player={}", session.getGameId(), accused.getName());
        }
    }

    // ==================== game end ====================

    @Override
    public List<WinCondition> getWinConditions() {
        return List.of(
                session -> session.getPlayers().countAlive(Team.MAFIA) == 0
                        ? Optional.of(Winner.team(Team.TOWN, "all mafia eliminated"))
                        : Optional.empty(),
                session -> session.getPlayers().countAlive(Team.MAFIA) >= session.getPlayers().countAlive(Team.TOWN)
                        ? Optional.of(Winner.team(Team.MAFIA, "mafia reached parity with the town"))
                        : Optional.empty());
    }

    /**
     * Larger team alive; a tie goes to the mafia.
     */
    @Override
    public Winner fallbackWinner(GameSession session) {
        long mafia = session.getPlayers().countAlive(Team.MAFIA);
        long town = session.getPlayers().countAlive(Team.TOWN);
        return town > mafia ? Winner.team(Team.TOWN, "more town alive when time ran out")
                : Winner.team(Team.MAFIA, "mafia held on until time ran out");
    }

    @Override
    public Map<String, Object> describeBoard(GameSession session) {
        return Map.of("day", session.getState().getDay(), "night", session.getState().getNight());
    }
}
