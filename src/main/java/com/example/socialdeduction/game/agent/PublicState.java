package com.example.socialdeduction.game.agent;

import com.example.socialdeduction.game.domain.GamePhase;

import java.util.List;
import java.util.Map;

/**
 * What every player can see: counters, who is alive, the board, and the most
 * recent table talk.
 */
public record PublicState(
        String variant,
        int round,
        GamePhase phase,
        List<String> alivePlayers,
        List<String> deadPlayers,
        Map<String, Object> board,
        List<String> recentTalk
) {
    public PublicState {
        alivePlayers = List.copyOf(alivePlayers);
        deadPlayers = List.copyOf(deadPlayers);
        board = Map.copyOf(board);
        recentTalk = List.copyOf(recentTalk);
    }
}
