package com.example.socialdeduction.game.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class Players {

    final private List<GamePlayer> players;

    public Players(List<GamePlayer> players) {
        List<GamePlayer> ordered = new ArrayList<>(players);
        ordered.sort(Comparator.comparingInt(GamePlayer::getSeat));
        this.players = ordered;
    }

    /**
     * All players in seat order.
     */
    public List<GamePlayer> getAsList() {
        return Collections.unmodifiableList(players); // read-only view
    }

    /**
     * Finds a player by name, or null.
     */
    public GamePlayer findByName(String name) {
        return players.stream()
                .filter(player -> player.getName().equals(name))
                .findFirst()
                .orElse(null);
    }

    /**
     * Alive player by name, or null when unknown or dead.
     */
    public GamePlayer findAlive(String name) {
        GamePlayer player = findByName(name);
        return player != null && player.isAlive() ? player : null;
    }

    /**
     * Alive players in seat order.
     */
    public List<GamePlayer> findAllAlivePlayers() {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .collect(Collectors.toList());
    }

    public List<String> aliveNames() {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .map(GamePlayer::getName)
                .toList();
    }

    public List<String> aliveNamesExcept(String excluded) {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .map(GamePlayer::getName)
                .filter(name -> !name.equals(excluded))
                .toList();
    }

    public List<String> deadNames() {
        return players.stream()
                .filter(player -> !player.isAlive())
                .map(GamePlayer::getName)
                .toList();
    }

    public List<GamePlayer> aliveWithRole(Role role) {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .filter(player -> player.hasRole(role))
                .toList();
    }

    public Optional<GamePlayer> firstWithRole(Role role) {
        return players.stream()
                .filter(player -> player.hasRole(role))
                .findFirst();
    }

    public boolean isRoleAlive(Role role) {
        return !aliveWithRole(role).isEmpty();
    }

    public long countAlive(Team team) {
        return players.stream()
                .filter(GamePlayer::isAlive)
                .filter(player -> player.getTeam() == team)
                .count();
    }

    public int aliveCount() {
        return (int) players.stream().filter(GamePlayer::isAlive).count();
    }

    /**
     * Closest living player on each side of {@code player} in seat order. Two alive
     * players yield one neighbour, a lone survivor none.
     */
    public List<GamePlayer> aliveNeighbours(GamePlayer player) {
        int index = players.indexOf(player);
        if (index < 0) {
            return List.of();
        }
        int size = players.size();
        GamePlayer left = null;
        for (int step = 1; step < size; step++) {
            GamePlayer candidate = players.get(Math.floorMod(index - step, size));
            if (candidate.isAlive() && candidate != player) {
                left = candidate;
                break;
            }
        }
        GamePlayer right = null;
        for (int step = 1; step < size; step++) {
            GamePlayer candidate = players.get((index + step) % size);
            if (candidate.isAlive() && candidate != player) {
                right = candidate;
                break;
            }
        }
        List<GamePlayer> neighbours = new ArrayList<>(2);
        if (left != null) {
            neighbours.add(left);
        }
        if (right != null && right != left) {
            neighbours.add(right);
        }
        return neighbours;
    }

    /**
     * Next living player after {@code player} in seat order, wrapping around.
     */
    public GamePlayer nextAliveAfter(GamePlayer player) {
        int index = players.indexOf(player);
        int size = players.size();
        for (int step = 1; step <= size; step++) {
            GamePlayer candidate = players.get((index + step) % size);
            if (candidate.isAlive()) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Number of seats, dead included.
     */
    public int size() {
        return players.size();
    }
}
