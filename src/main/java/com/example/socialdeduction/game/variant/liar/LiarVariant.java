package com.example.socialdeduction.game.variant.liar;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.PhaseCycle;
import com.example.socialdeduction.game.domain.Players;
import com.example.socialdeduction.game.domain.RoleTable;
import com.example.socialdeduction.game.domain.Winner;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.service.TableTalkService;
import com.example.socialdeduction.game.variant.GameVariant;
import com.example.socialdeduction.game.variant.WinCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Liar's-bar card game. Each day is one hand: everyone alive gets five cards and a
 * target rank is called. Players take turns laying one to three cards face down,
 * claiming they all match the target; the next player may call the bluff. Whoever
 * is wrong pulls the trigger of their own revolver.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiarVariant implements GameVariant {

    public static final String KEY = "liar";
    public static final int HAND_SIZE = 5;
    public static final int MAX_CARDS_PER_PLAY = 3;

    private static final RoleTable ROLE_TABLE = new LiarRoleTable();

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
        return PhaseCycle.DAY_ONLY;
    }

    @Override
    public void setup(GameSession session) {
        LiarBoard board = new LiarBoard();
        List<GamePlayer> seated = session.getPlayers().getAsList();
        board.loadRevolvers(seated.stream().map(GamePlayer::getName).toList(), session.getRandom());
        board.setStarter(seated.get(0).getName());
        session.putBoard(LiarBoard.class, board);
        for (GamePlayer player : seated) {
            session.tell(player.getName(), "Your revolver holds one bullet in " + Revolver.CHAMBERS
                    + " chambers. Every lost challenge is one pull.", true);
        }
    }

    // ==================== one hand per day ====================

    @Override
    public void runDay(GameSession session) {
        Players players = session.getPlayers();
        LiarBoard board = session.getBoard(LiarBoard.class);
        board.deal(players.aliveNames(), HAND_SIZE, session.getRandom());
        for (GamePlayer player : players.findAllAlivePlayers()) {
            session.tell(player.getName(), "Target rank " + board.getTargetRank() + ". Your hand: "
                    + board.handOf(player.getName()), true);
        }
        session.getRecorder().record(EventType.ACTION_TAKEN, "Hand " + board.getHandsPlayed() + " dealt, target "
                + board.getTargetRank(), Map.of("targetRank", board.getTargetRank().name(),
                "handSize", HAND_SIZE));

        tableTalkService.discuss(session, players.findAllAlivePlayers());

        GamePlayer current = firstToPlay(players, board);
        while (true) {
            List<Card> played = playCards(session, board, current);
            GamePlayer challenger = players.nextAliveAfter(current);
            boolean forced = !board.holdsCards(challenger.getName())
                    || (board.holdersOfCards() == 1 && board.holdsCards(challenger.getName()));
            boolean challenged = forced || session.getGateway().confirm(session.agentOf(challenger),
                    session.contextFor(challenger, DecisionType.CHALLENGE,
                            current.getName() + " claims " + played.size() + " x " + board.getTargetRank()), false);
            if (challenged) {
                settleChallenge(session, board, current, challenger, played, forced);
                return;
            }
            current = challenger;
        }
    }

    private GamePlayer firstToPlay(Players players, LiarBoard board) {
        GamePlayer starter = players.findByName(board.getStarter());
        return starter.isAlive() ? starter : players.nextAliveAfter(starter);
    }

    private List<Card> playCards(GameSession session, LiarBoard board, GamePlayer player) {
        List<Card> hand = board.handOf(player.getName());
        List<String> options = new ArrayList<>(hand.size());
        for (int slot = 0; slot < hand.size(); slot++) {
            options.add(slot + ":" + hand.get(slot).name());
        }
        List<String> chosen = session.getGateway().chooseMany(session.agentOf(player),
                session.contextFor(player, DecisionType.PLAY_CARDS, board.getTargetRank().name()),
                options, 1, MAX_CARDS_PER_PLAY);
        List<Integer> slots = chosen.stream()
                .map(label -> Integer.parseInt(label.substring(0, label.indexOf(':'))))
                .toList();
        List<Card> played = board.play(player.getName(), slots);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actor", player.getName());
        data.put("count", played.size());
        data.put("claimed", board.getTargetRank().name());
        data.put("cardsLeft", board.handOf(player.getName()).size());
        session.getRecorder().record(EventType.ACTION_TAKEN, player.getName() + " plays " + played.size()
                + " card(s) as " + board.getTargetRank(), data);
        return played;
    }

    private void settleChallenge(GameSession session, LiarBoard board, GamePlayer player, GamePlayer challenger,
                                 List<Card> played, boolean forced) {
        boolean lied = played.stream().anyMatch(card -> !card.matches(board.getTargetRank()));
        GamePlayer loser = lied ? player : challenger;
        Revolver revolver = board.revolverOf(loser.getName());
        boolean fired = revolver.pullTrigger();
        log.debug("[day] challenge settled: gameId={}, player={}, challenger={}, lied={}, loser={}, fired={}",
                session.getGameId(), player.getName(), challenger.getName(), lied, loser.getName(), fired);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actor", challenger.getName());
        data.put("target", player.getName());
        data.put("revealed", played.stream().map(Card::name).toList());
        data.put("lied", lied);
        data.put("forced", forced);
        data.put("loser", loser.getName());
        data.put("pulls", revolver.getPulls());
        data.put("fired", fired);
        session.getRecorder().record(EventType.ACTION_TAKEN, challenger.getName() + " calls " + player.getName()
                + (lied ? " a liar and is right" : " a liar and is wrong") + "; " + loser.getName()
                + (fired ? " pulls the trigger: BANG" : " pulls the trigger: click"), data);

        if (fired) {
            session.eliminate(loser, "revolver");
        }
        board.setStarter(loser.isAlive() ? loser.getName() : session.getPlayers().nextAliveAfter(loser).getName());
    }

    // ==================== game end ====================

    @Override
    public List<WinCondition> getWinConditions() {
        return List.of(session -> {
            List<GamePlayer> alive = session.getPlayers().findAllAlivePlayers();
            return alive.size() == 1
                    ? Optional.of(Winner.player(alive.get(0).getName(), "last one standing"))
                    : Optional.empty();
        });
    }

    /**
     * Most cards still in hand; ties go to the earlier seat.
     */
    @Override
    public Winner fallbackWinner(GameSession session) {
        LiarBoard board = session.getBoard(LiarBoard.class);
        GamePlayer best = null;
        for (GamePlayer player : session.getPlayers().findAllAlivePlayers()) {
            if (best == null || board.handOf(player.getName()).size() > board.handOf(best.getName()).size()) {
                best = player;
            }
        }
        if (best == null) {
            throw new IllegalStateException("no living player to fall back on");
        }
        return Winner.player(best.getName(), "most cards in hand when time ran out");
    }

    @Override
    public Map<String, Object> describeBoard(GameSession session) {
        LiarBoard board = session.getBoard(LiarBoard.class);
        Map<String, Object> described = new LinkedHashMap<>();
        described.put("hand", board.getHandsPlayed());
        described.put("targetRank", board.getTargetRank() == null ? "none" : board.getTargetRank().name());
        Map<String, Object> cards = new LinkedHashMap<>();
        Map<String, Object> pulls = new LinkedHashMap<>();
        for (GamePlayer player : session.getPlayers().findAllAlivePlayers()) {
            cards.put(player.getName(), board.handOf(player.getName()).size());
            pulls.put(player.getName(), board.revolverOf(player.getName()).getPulls());
        }
        described.put("cardsInHand", cards);
        described.put("triggerPulls", pulls);
        return described;
    }
}
