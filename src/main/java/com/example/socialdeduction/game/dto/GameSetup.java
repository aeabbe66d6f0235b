package com.example.socialdeduction.game.dto;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.record.Recorder;

import java.util.List;
import java.util.Map;

/**
 * Input for creating one game.
 *
 * @param variant     registry key of the game
 * @param playerNames seat order
 * @param agents      one agent per player plus one per extra seat of the variant
 * @param roles       explicit roles in seat order, or null to draw from the role table
 * @param seed        seed for every random choice of the game, or null for an unseeded game
 * @param recorder    event sink, or null for the default one
 */
public record GameSetup(
        String variant,
        List<String> playerNames,
        Map<String, Agent> agents,
        List<Role> roles,
        Long seed,
        Recorder recorder) {

    public static GameSetup of(String variant, List<String> playerNames, Map<String, Agent> agents) {
        return new GameSetup(variant, playerNames, agents, null, null, null);
    }

    public GameSetup withSeed(long newSeed) {
        return new GameSetup(variant, playerNames, agents, roles, newSeed, recorder);
    }

    public GameSetup withRoles(List<Role> newRoles) {
        return new GameSetup(variant, playerNames, agents, newRoles, seed, recorder);
    }

    public GameSetup withRecorder(Recorder newRecorder) {
        return new GameSetup(variant, playerNames, agents, roles, seed, newRecorder);
    }
}
