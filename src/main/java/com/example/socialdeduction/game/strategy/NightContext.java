package com.example.socialdeduction.game.strategy;

import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Players;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.global.random.RandomSource;
import lombok.Getter;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Scratch state of a single night. Poison and protection live here and vanish
 * when the night ends.
 */
public class NightContext {

    @Getter
    private final GameSession session;
    @Getter
    private final int night;

    private final Set<String> poisoned = new HashSet<>();
    private final Set<String> protectedPlayers = new HashSet<>();
    private final List<String> attemptedKills = new ArrayList<>();
    private final Set<String> deaths = new LinkedHashSet<>();
    private final Map<String, String> choices = new LinkedHashMap<>();

    public NightContext(GameSession session) {
        this.session = session;
        this.night = session.getState().getNight();
    }

    public Players getPlayers() {
        return session.getPlayers();
    }

    public RandomSource getRandom() {
        return session.getRandom();
    }

    // ==================== disruption and protection ====================

    public void poison(GamePlayer player) {
        poisoned.add(player.getName());
    }

    public boolean isPoisoned(GamePlayer player) {
        return player != null && poisoned.contains(player.getName());
    }

    public void protect(GamePlayer player) {
        protectedPlayers.add(player.getName());
    }

    public boolean isProtected(GamePlayer player) {
        return protectedPlayers.contains(player.getName());
    }

    /**
     * True when information produced by {@code actor} (or about any of
     * {@code subjects}) must be fabricated tonight.
     */
    public boolean corrupts(GamePlayer actor, GamePlayer... subjects) {
        if (isPoisoned(actor)) {
            return true;
        }
        for (GamePlayer subject : subjects) {
            if (isPoisoned(subject)) {
                return true;
            }
        }
        return false;
    }

    // ==================== kills ====================

    public void recordAttempt(GamePlayer target) {
        attemptedKills.add(target.getName());
    }

    /**
     * @return false when the victim was already dead
     */
    public boolean kill(GamePlayer victim, String cause) {
        if (!session.eliminate(victim, cause)) {
            return false;
        }
        deaths.add(victim.getName());
        session.getState().recordNightDeath(victim.getName());
        return true;
    }

    public boolean diedTonight(GamePlayer player) {
        return deaths.contains(player.getName());
    }

    public List<String> getDeaths() {
        return List.copyOf(deaths);
    }

    public List<String> getAttemptedKills() {
        return List.copyOf(attemptedKills);
    }

    // ==================== decisions and knowledge ====================

    public void putChoices(Map<String, String> gathered) {
        choices.putAll(gathered);
    }

    /**
     * Target the actor picked before resolution began, or null.
     */
    public String choiceOf(GamePlayer actor) {
        return choices.get(actor.getName());
    }

    public void tell(GamePlayer owner, String text, boolean reliable) {
        session.tell(owner.getName(), text, reliable);
    }
}
