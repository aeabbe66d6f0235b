package com.example.socialdeduction.global.config;

import com.example.socialdeduction.global.random.RandomSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Agent decisions are blocking, slow calls. They run on this pool; the engine
 * itself stays on the calling thread.
 */
@Configuration
public class AgentExecutorConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService agentDecisionExecutor(GameProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "agent-decision-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(properties.decisionThreads(), threadFactory);
    }

    @Bean
    public RandomSource randomSource() {
        return RandomSource.threadLocal();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
