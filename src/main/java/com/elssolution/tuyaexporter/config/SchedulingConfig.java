package com.elssolution.tuyaexporter.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.*;

@Slf4j
@Configuration
public class SchedulingConfig {

    static final String POLL_THREAD_PREFIX = "tuya-poll-";
    static final String FETCH_THREAD_PREFIX = "tuya-fetch-";

    private final GlobalUncaughtHandler handler;

    public SchedulingConfig(GlobalUncaughtHandler handler) {
        this.handler = handler;
    }

    /** Drives the poll tick. One thread is enough: a tick only dispatches work. */
    @Bean(destroyMethod = "shutdown") // no zombie threads after the context closes
    public ScheduledExecutorService scheduler() {
        ScheduledThreadPoolExecutor ex = new ScheduledThreadPoolExecutor(1, namedDaemon(POLL_THREAD_PREFIX));
        ex.setRemoveOnCancelPolicy(true);
        ex.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        ex.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return ex;
    }

    /** Runs the blocking Tuya calls, one task per device per tick. */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(@Value("${tuya.poll.fetchThreads:4}") int fetchThreads) {
        int n = Math.max(1, fetchThreads);
        log.info("Fetch pool: {} threads", n);
        return Executors.newFixedThreadPool(n, namedDaemon(FETCH_THREAD_PREFIX));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    private ThreadFactory namedDaemon(String prefix) {
        return r -> {
            Thread t = new Thread(r);
            t.setName(prefix + t.getId()); // unique name → easier debugging/logging
            t.setDaemon(true);             // don't block JVM exit; Spring handles clean shutdown
            t.setUncaughtExceptionHandler(handler);
            return t;
        };
    }
}
