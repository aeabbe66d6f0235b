package com.example.socialdeduction.game.variant.botc;

import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.GamePlayer;
import com.example.socialdeduction.game.domain.Role;
import com.example.socialdeduction.game.record.EventType;
import com.example.socialdeduction.game.service.GameSession;
import com.example.socialdeduction.game.strategy.OneShotAbility;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Once per game, by day, the Slayer shoots a player. The demon dies; anyone else
 * shrugs it off.
 */
@Slf4j
public class SlayerShot implements OneShotAbility {

    @Override
    public Role getRole() {
        return BotcRole.SLAYER;
    }

    @Override
    public DecisionType getDecisionType() {
        return DecisionType.SLAYER_SHOT;
    }

    @Override
    public boolean offer(GameSession session, GamePlayer holder) {
        if (!isAvailable(session, holder)) {
            return false;
        }
        boolean shoot = session.getGateway().confirm(session.agentOf(holder),
                session.contextFor(holder, DecisionType.SLAYER_SHOT), false);
        List<String> targets = session.getPlayers().aliveNamesExcept(holder.getName());
        if (!shoot || targets.isEmpty()) {
            return false;
        }
        String chosen = session.getGateway().choose(session.agentOf(holder),
                session.contextFor(holder, DecisionType.SLAYER_SHOT), targets);
        GamePlayer target = session.getPlayers().findByName(chosen);
        holder.useAbility();

        boolean hit = target.hasRole(BotcRole.IMP);
        log.debug("[day] slayer shot: gameId={}, slayer={}, target={}, hit={}",
                session.getGameId(), holder.getName(), target.getName(), hit);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("actor", holder.getName());
        data.put("role", BotcRole.SLAYER.name());
        data.put("target", target.getName());
        data.put("success", hit);
        session.getRecorder().record(EventType.ACTION_TAKEN,
                holder.getName() + " shot " + target.getName() + (hit ? " and slew the demon" : ", nothing happened"),
                data);
        if (hit) {
            session.eliminate(target, "slayer");
        }
        return true;
    }
}
