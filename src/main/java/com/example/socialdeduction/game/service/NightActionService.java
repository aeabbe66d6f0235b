package com.example.socialdeduction.game.service;

import com.example.socialdeduction.game.agent.ChoiceRequest;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.strategy.NightActionResult;
import com.example.socialdeduction.game.strategy.NightContext;
import com.example.socialdeduction.game.strategy.NightPriority;
import com.example.socialdeduction.game.strategy.RoleActionFactory;
import com.example.socialdeduction.game.strategy.RoleActionStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves a night: gathers every independent choice at once, then runs the
 * powers tier by tier in {@link NightPriority} order.
 */
@Service
@Slf4j
public class NightActionService {

    public NightReport resolveNight(GameSession session) {
        RoleActionFactory factory = session.getVariant().getRoleActionFactory();
        NightContext context = new NightContext(session);
        if (factory.isEmpty()) {
            return NightReport.empty(context.getNight());
        }

        context.putChoices(session.getGateway().chooseAll(gatherRequests(session, factory, context)));

        List<NightActionResult> results = new ArrayList<>();
        for (NightPriority priority : NightPriority.values()) {
            for (RoleActionStrategy strategy : factory.getStrategies(priority)) {
                if (strategy.isGroupAction()) {
                    resolveGroup(session, context, strategy, results);
                } else {
                    resolveEach(session, context, strategy, results);
                }
                if (session.getState().isTerminal()) {
                    break;
                }
            }
        }
        log.debug("[night] resolved: gameId={}, night={}, deaths={}", session.getGameId(), context.getNight(),
                context.getDeaths());
        return new NightReport(context.getNight(), context.getDeaths(), context.getAttemptedKills(), results);
    }

    // ==================== decision gathering ====================

    private List<ChoiceRequest> gatherRequests(GameSession session, RoleActionFactory factory, NightContext context) {
        List<ChoiceRequest> requests = new ArrayList<>();
        for (RoleActionStrategy strategy : factory.getStrategies()) {
            if (strategy.isReactive() || strategy.getDecisionType() == null) {
                continue;
            }
            for (GamePlayer actor : session.getPlayers().aliveWithRole(strategy.getRole())) {
                if (!strategy.isActiveOn(context, actor)) {
                    continue;
                }
                List<String> targets = strategy.legalTargets(context, actor);
                if (targets.isEmpty()) {
                    log.debug("[night] no legal target: gameId={}, actor={}", session.getGameId(), actor.getName());
                    continue;
                }
                requests.add(new ChoiceRequest(actor.getName(), session.agentOf(actor),
                        session.contextFor(actor, strategy.getDecisionType()), targets));
            }
        }
        return requests;
    }

    // ==================== resolution ====================

    private void resolveEach(GameSession session, NightContext context, RoleActionStrategy strategy,
                             List<NightActionResult> results) {
        for (GamePlayer actor : session.getPlayers().getAsList()) {
            if (!actor.hasRole(strategy.getRole()) || !canAct(context, strategy, actor)) {
                continue;
            }
            GamePlayer target = null;
            if (strategy.getDecisionType() != null) {
                String chosen = strategy.isReactive() ? askNow(session, context, strategy, actor)
                        : context.choiceOf(actor);
                if (chosen == null) {
                    continue;
                }
                target = session.getPlayers().findByName(chosen);
            }
            apply(session, context, strategy, actor, target, results);
        }
    }

    /**
     * Every holder proposes; the plurality target is acted on once, by the first
     * holder who proposed it.
     */
    private void resolveGroup(GameSession session, NightContext context, RoleActionStrategy strategy,
                              List<NightActionResult> results) {
        Map<String, String> proposals = new LinkedHashMap<>();
        for (GamePlayer actor : session.getPlayers().aliveWithRole(strategy.getRole())) {
            String chosen = context.choiceOf(actor);
            if (chosen != null) {
                proposals.put(actor.getName(), chosen);
            }
        }
        if (proposals.isEmpty()) {
            return;
        }
        String target = VoteService.plurality(proposals.values(), session.getRandom());
        String actorName = proposals.entrySet().stream()
                .filter(entry -> entry.getValue().equals(target))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow();
        apply(session, context, strategy, session.getPlayers().findByName(actorName),
                session.getPlayers().findByName(target), results);
    }

    private boolean canAct(NightContext context, RoleActionStrategy strategy, GamePlayer actor) {
        if (strategy.isReactive()) {
            return context.diedTonight(actor);
        }
        return actor.isAlive() && strategy.isActiveOn(context, actor);
    }

    private String askNow(GameSession session, NightContext context, RoleActionStrategy strategy, GamePlayer actor) {
        List<String> targets = strategy.legalTargets(context, actor);
        return session.getGateway().choose(session.agentOf(actor),
                session.contextFor(actor, strategy.getDecisionType()), targets);
    }

    private void apply(GameSession session, NightContext context, RoleActionStrategy strategy, GamePlayer actor,
                       GamePlayer target, List<NightActionResult> results) {
        NightActionResult result = strategy.execute(context, actor, target);
        results.add(result);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("priority", strategy.getPriority().name());
        data.put("actor", actor.getName());
        data.put("role", actor.getRole().name());
        data.put("target", target == null ? null : target.getName());
        data.put("success", result.isSuccess());
        session.getRecorder().record(EventType.ACTION_TAKEN, result.getMessage(), data);
    }
}
