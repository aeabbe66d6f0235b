package com.example.socialdeduction.game.agent;

import com.example.socialdeduction.game.domain.Ballot;

import java.util.List;

/**
 * Decision source for one seat. Implementations may be slow (a remote model) and
 * may answer badly; the engine only ever calls them through {@link AgentGateway},
 * which bounds the wait and replaces illegal answers.
 */
public interface Agent {

    /**
     * Picks one of {@code options}.
     */
    String choose(DecisionContext context, List<String> options);

    /**
     * Picks between {@code minCount} and {@code maxCount} distinct entries of
     * {@code options}.
     */
    List<String> chooseMany(DecisionContext context, List<String> options, int minCount, int maxCount);

    Ballot vote(DecisionContext context);

    /**
     * Yes/no question: use a one-shot ability, propose a veto, challenge a play.
     */
    boolean confirm(DecisionContext context);

    default String talk(DecisionContext context) {
        return "";
    }
}
