package com.vtrader.config;

import com.vtrader.dispatch.Sleeper;
import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Threads and time sources shared by the realtime components.
 *
 * <p>Every thread created here is a daemon so a pending batch window, request timeout
 * or heartbeat never keeps the JVM alive on shutdown.
 */
@Configuration
public class AsyncConfig {

    @Value("${vtrader.async.scheduler-pool-size:2}")
    private int schedulerPoolSize;

    /**
     * Runs the dispatch drain loop. One thread is enough: the queue guarantees at most
     * one loop is active at a time.
     */
    @Bean("dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("dispatch-");
        executor.setDaemon(true);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    /** Batch window timers and per-caller safety timeouts. */
    @Bean(name = "quoteScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService quoteScheduler() {
        return daemonScheduler("quote-batcher-", schedulerPoolSize);
    }

    /** Keep-alive ticks for push streams. */
    @Bean(name = "heartbeatScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService heartbeatScheduler() {
        return daemonScheduler("realtime-heartbeat-", 1);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.threadSleep();
    }

    private ScheduledExecutorService daemonScheduler(String threadNamePrefix, int poolSize) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory(threadNamePrefix);
        threadFactory.setDaemon(true);
        ScheduledThreadPoolExecutor scheduler = new ScheduledThreadPoolExecutor(poolSize, threadFactory);
        // Settled callers cancel their timeout; drop those tasks instead of letting them pile up.
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
