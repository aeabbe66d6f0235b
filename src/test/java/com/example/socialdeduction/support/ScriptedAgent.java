package com.example.socialdeduction.support;

import com.example.socialdeduction.game.agent.Agent;
import com.example.socialdeduction.game.agent.DecisionContext;
import com.example.socialdeduction.game.agent.DecisionType;
import com.example.socialdeduction.game.domain.Ballot;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Agent with fixed answers per decision type. Unscripted choices take the first
 * option, unscripted votes are NO, unscripted questions are answered no.
 */
public class ScriptedAgent implements Agent {

    private final Map<DecisionType, String> choices = new EnumMap<>(DecisionType.class);
    private final Map<DecisionType, Boolean> confirmations = new EnumMap<>(DecisionType.class);
    private final List<DecisionContext> seen = new CopyOnWriteArrayList<>();
    private Function<DecisionContext, Ballot> ballots = context -> Ballot.NO;
    private String talkLine = "";

    public static ScriptedAgent create() {
        return new ScriptedAgent();
    }

    public ScriptedAgent choosing(DecisionType type, String option) {
        choices.put(type, option);
        return this;
    }

    public ScriptedAgent confirming(DecisionType type, boolean answer) {
        confirmations.put(type, answer);
        return this;
    }

    public ScriptedAgent voting(Ballot ballot) {
        this.ballots = context -> ballot;
        return this;
    }

    public ScriptedAgent voting(Function<DecisionContext, Ballot> ballotFor) {
        this.ballots = ballotFor;
        return this;
    }

    public ScriptedAgent talking(String line) {
        this.talkLine = line;
        return this;
    }

    @Override
    public String choose(DecisionContext context, List<String> options) {
        seen.add(context);
        String scripted = choices.get(context.type());
        return scripted != null && options.contains(scripted) ? scripted : options.get(0);
    }

    @Override
    public List<String> chooseMany(DecisionContext context, List<String> options, int minCount, int maxCount) {
        seen.add(context);
        return new ArrayList<>(options.subList(0, Math.max(minCount, 1)));
    }

    @Override
    public Ballot vote(DecisionContext context) {
        seen.add(context);
        return ballots.apply(context);
    }

    @Override
    public boolean confirm(DecisionContext context) {
        seen.add(context);
        return confirmations.getOrDefault(context.type(), false);
    }

    @Override
    public String talk(DecisionContext context) {
        seen.add(context);
        return talkLine;
    }

    public List<DecisionContext> getSeen() {
        return List.copyOf(seen);
    }

    public List<DecisionContext> seenOf(DecisionType type) {
        return seen.stream().filter(context -> context.type() == type).toList();
    }
}
