package com.example.socialdeduction.game.agent;

import com.example.socialdeduction.game.domain.Ballot;
import com.example.socialdeduction.game.record.GameRecorder;
import com.example.socialdeduction.game.record.IncidentType;
import com.example.socialdeduction.global.random.RandomSource;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * The only way the engine talks to agents.
 * <ul>
 *   <li>every call is bounded by the decision timeout;</li>
 *   <li>an answer outside the legal set, an exception or a timeout becomes a
 *       uniformly random legal choice (or the supplied default) and an incident;</li>
 *   <li>independent decisions are submitted together and joined before the
 *       engine continues. Fallbacks are drawn after the join, on the calling
 *       thread, in request order, so a seeded game replays exactly.</li>
 * </ul>
 */
@Slf4j
public class AgentGateway {

    private final ExecutorService executor;
    private final Duration timeout;
    private final RandomSource random;
    private final GameRecorder recorder;

    public AgentGateway(ExecutorService executor, Duration timeout, RandomSource random, GameRecorder recorder) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.random = Objects.requireNonNull(random, "random");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
    }

    // ==================== single decisions ====================

    /**
     * @return a member of {@code options}, or null when there are none
     */
    public String choose(Agent agent, DecisionContext context, List<String> options) {
        if (options.isEmpty()) {
            return null;
        }
        List<String> legal = List.copyOf(options);
        Answer<String> answer = await(context, submit(() -> agent.choose(context, legal)));
        return legalOrFallback(context, legal, answer);
    }

    /**
     * Like {@link #choose(Agent, DecisionContext, List)} but falls back to
     * {@code fallback} instead of a random option.
     */
    public String choose(Agent agent, DecisionContext context, List<String> options, String fallback) {
        if (!options.contains(fallback)) {
            throw new IllegalArgumentException("fallback " + fallback + " is not one of " + options);
        }
        List<String> legal = List.copyOf(options);
        Answer<String> answer = await(context, submit(() -> agent.choose(context, legal)));
        if (answer.delivered() && answer.value() != null && legal.contains(answer.value())) {
            return answer.value();
        }
        if (answer.delivered()) {
            illegal(context, String.valueOf(answer.value()));
        }
        return fallback;
    }

    /**
     * @return between {@code minCount} and {@code maxCount} distinct members of {@code options}
     */
    public List<String> chooseMany(Agent agent, DecisionContext context, List<String> options,
                                   int minCount, int maxCount) {
        if (options.isEmpty() || maxCount <= 0) {
            return List.of();
        }
        int max = Math.min(maxCount, options.size());
        int min = Math.min(Math.max(minCount, 0), max);
        List<String> legal = List.copyOf(options);
        Answer<List<String>> answer = await(context, submit(() -> agent.chooseMany(context, legal, min, max)));
        if (answer.delivered() && isLegalSelection(answer.value(), legal, min, max)) {
            return List.copyOf(answer.value());
        }
        if (answer.delivered()) {
            illegal(context, String.valueOf(answer.value()));
        }
        int count = min + random.nextInt(max - min + 1);
        return random.sample(legal, count);
    }

    public Ballot vote(Agent agent, DecisionContext context, Ballot fallback) {
        Answer<Ballot> answer = await(context, submit(() -> agent.vote(context)));
        return ballotOrFallback(context, answer, fallback);
    }

    public boolean confirm(Agent agent, DecisionContext context, boolean fallback) {
        return confirm(agent, context, () -> fallback);
    }

    /**
     * @param fallback evaluated only when the agent gives no usable answer
     */
    public boolean confirm(Agent agent, DecisionContext context, BooleanSupplier fallback) {
        Answer<Boolean> answer = await(context, submit(() -> agent.confirm(context)));
        if (answer.delivered() && answer.value() != null) {
            return answer.value();
        }
        if (answer.delivered()) {
            illegal(context, "null");
        }
        return fallback.getAsBoolean();
    }

    // ==================== concurrent gathering ====================

    /**
     * Issues all requests at once and joins them. Requests with no legal option
     * are skipped and absent from the result. Each request's timeout starts when
     * a pool thread picks it up, so requests queued behind a full pool are not
     * cut short.
     *
     * @return seat to choice, in request order
     */
    public Map<String, String> chooseAll(List<ChoiceRequest> requests) {
        requireDistinctSeats(requests.stream().map(ChoiceRequest::seat).toList());
        Map<String, Pending<String>> pending = new LinkedHashMap<>();
        for (ChoiceRequest request : requests) {
            if (request.options().isEmpty()) {
                continue;
            }
            pending.put(request.seat(),
                    submit(() -> request.agent().choose(request.context(), request.options()), requests.size()));
        }
        Map<String, String> decisions = new LinkedHashMap<>();
        for (ChoiceRequest request : requests) {
            Pending<String> call = pending.get(request.seat());
            if (call == null) {
                continue;
            }
            Answer<String> answer = await(request.context(), call);
            decisions.put(request.seat(), legalOrFallback(request.context(), request.options(), answer));
        }
        return decisions;
    }

    /**
     * @return seat to ballot, in request order
     */
    public Map<String, Ballot> voteAll(List<BallotRequest> requests) {
        requireDistinctSeats(requests.stream().map(BallotRequest::seat).toList());
        List<Pending<Ballot>> pending = new ArrayList<>(requests.size());
        for (BallotRequest request : requests) {
            pending.add(submit(() -> request.agent().vote(request.context()), requests.size()));
        }
        Map<String, Ballot> ballots = new LinkedHashMap<>();
        for (int i = 0; i < requests.size(); i++) {
            BallotRequest request = requests.get(i);
            Answer<Ballot> answer = await(request.context(), pending.get(i));
            ballots.put(request.seat(), ballotOrFallback(request.context(), answer, request.fallback()));
        }
        return ballots;
    }

    /**
     * Table talk for several speakers at once. A missing line becomes an empty one.
     */
    public Map<String, String> talkAll(Map<String, Agent> agents, Map<String, DecisionContext> contexts) {
        Map<String, Pending<String>> pending = new LinkedHashMap<>();
        agents.forEach((seat, agent) -> pending.put(seat,
                submit(() -> agent.talk(contexts.get(seat)), agents.size())));
        Map<String, String> lines = new LinkedHashMap<>();
        pending.forEach((seat, call) -> {
            Answer<String> answer = await(contexts.get(seat), call);
            lines.put(seat, answer.delivered() && answer.value() != null ? answer.value().strip() : "");
        });
        return lines;
    }

    public String talk(Agent agent, DecisionContext context) {
        Answer<String> answer = await(context, submit(() -> agent.talk(context)));
        return answer.delivered() && answer.value() != null ? answer.value().strip() : "";
    }

    // ==================== internals ====================

    private <T> Pending<T> submit(Callable<T> call) {
        return submit(call, 1);
    }

    /**
     * @param batchSize calls submitted together; a queued call may wait one timeout
     *                  per call of its batch for a free thread
     */
    private <T> Pending<T> submit(Callable<T> call, int batchSize) {
        Pending<T> pending = new Pending<>(System.nanoTime(), timeout.toNanos() * Math.max(1, batchSize));
        try {
            pending.future = executor.submit(() -> {
                pending.markStarted();
                return call.call();
            });
        } catch (RejectedExecutionException e) {
            pending.future = CompletableFuture.failedFuture(e);
        }
        return pending;
    }

    /**
     * Waits for a pool thread within the call's queue allowance, then up to one
     * timeout for the agent itself.
     */
    private <T> Answer<T> await(DecisionContext context, Pending<T> pending) {
        Future<T> future = pending.future;
        try {
            while (true) {
                long remaining = pending.deadline(timeout) - System.nanoTime();
                if (remaining <= 0) {
                    throw new TimeoutException();
                }
                try {
                    return new Answer<>(future.get(remaining, TimeUnit.NANOSECONDS), true);
                } catch (TimeoutException e) {
                    if (pending.deadline(timeout) - System.nanoTime() <= 0) {
                        throw e;
                    }
                    // picked up by a thread while we waited: its own timeout now applies
                }
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[agent] decision timed out: seat={}, type={}", context.self(), context.type());
            recorder.incident(IncidentType.DECISION_TIMEOUT, "decision timed out", details(context));
        } catch (ExecutionException e) {
            log.warn("[agent] decision failed: seat={}, type={}", context.self(), context.type(), e.getCause());
            Map<String, Object> data = details(context);
            data.put("error", String.valueOf(e.getCause()));
            recorder.incident(IncidentType.ILLEGAL_DECISION, "agent failed", data);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("[agent] interrupted while waiting: seat={}, type={}", context.self(), context.type());
        }
        return new Answer<>(null, false);
    }

    private String legalOrFallback(DecisionContext context, List<String> options, Answer<String> answer) {
        if (answer.delivered() && answer.value() != null && options.contains(answer.value())) {
            return answer.value();
        }
        if (answer.delivered()) {
            illegal(context, String.valueOf(answer.value()));
        }
        return random.pick(options);
    }

    private Ballot ballotOrFallback(DecisionContext context, Answer<Ballot> answer, Ballot fallback) {
        if (answer.delivered() && answer.value() != null) {
            return answer.value();
        }
        if (answer.delivered()) {
            illegal(context, "null");
        }
        return fallback;
    }

    private static boolean isLegalSelection(List<String> picked, List<String> legal, int min, int max) {
        if (picked == null || picked.size() < min || picked.size() > max) {
            return false;
        }
        Set<String> distinct = new HashSet<>(picked);
        return distinct.size() == picked.size() && legal.containsAll(distinct);
    }

    private void illegal(DecisionContext context, String answer) {
        log.info("[agent] illegal answer replaced: seat={}, type={}, answer={}",
                context.self(), context.type(), answer);
        Map<String, Object> data = details(context);
        data.put("answer", answer);
        recorder.incident(IncidentType.ILLEGAL_DECISION, "illegal answer replaced", data);
    }

    private static Map<String, Object> details(DecisionContext context) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("seat", context.self());
        data.put("decision", context.type().name());
        return data;
    }

    private static void requireDistinctSeats(List<String> seats) {
        if (new LinkedHashSet<>(seats).size() != seats.size()) {
            throw new IllegalArgumentException("one request per seat per gathering round: " + seats);
        }
    }

    /**
     * A submitted call and the moment a pool thread started it.
     */
    private static final class Pending<T> {

        private final long submittedAt;
        private final long queueAllowance;
        private volatile long startedAt;
        private volatile boolean started;
        private Future<T> future;

        private Pending(long submittedAt, long queueAllowance) {
            this.submittedAt = submittedAt;
            this.queueAllowance = queueAllowance;
        }

        private void markStarted() {
            startedAt = System.nanoTime();
            started = true;
        }

        private long deadline(Duration timeout) {
            return started ? startedAt + timeout.toNanos() : submittedAt + queueAllowance;
        }
    }

    private record Answer<T>(T value, boolean delivered) {
    }
}
