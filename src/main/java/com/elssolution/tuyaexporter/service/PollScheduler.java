package com.elssolution.tuyaexporter.service;

import com.elssolution.tuyaexporter.domain.Device;
import com.elssolution.tuyaexporter.domain.FetchError;
import com.elssolution.tuyaexporter.domain.FetchException;
import com.elssolution.tuyaexporter.domain.FetchOutcome;
import com.elssolution.tuyaexporter.domain.Reading;
import com.elssolution.tuyaexporter.integration.tuya.TuyaTelemetryFetcher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;

/**
 * Periodic poll loop.
 *
 * Each tick hands one fetch per device to the fetch pool and returns at once, so ticks
 * never stack behind slow fetches. A device whose previous fetch has not completed is
 * skipped for that tick (at most one in-flight fetch per device). Every fetch outcome,
 * success or failure, ends up as a single {@link MetricStore#update} for that device only.
 */
@Slf4j
@Component
public class PollScheduler {

    private final DeviceRegistry registry;
    private final TuyaTelemetryFetcher fetcher;
    private final MetricStore store;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService fetchExecutor;
    private final Clock clock;

    /** How often we poll Tuya (seconds). */
    private final int periodSeconds;
    /** How long shutdown waits for in-flight fetches before interrupting them (ms). */
    private final long shutdownTimeoutMs;

    private final Map<String, Future<?>> inFlight = new ConcurrentHashMap<>();
    private volatile ScheduledFuture<?> loopHandle;
    private volatile boolean stopping = false;

    public PollScheduler(DeviceRegistry registry,
                         TuyaTelemetryFetcher fetcher,
                         MetricStore store,
                         ScheduledExecutorService scheduler,
                         @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
                         Clock clock,
                         @Value("${tuya.poll.periodSeconds:60}") int periodSeconds,
                         @Value("${tuya.poll.shutdownTimeoutMs:5000}") long shutdownTimeoutMs) {
        this.registry = registry;
        this.fetcher = fetcher;
        this.store = store;
        this.scheduler = scheduler;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        if (periodSeconds < 1) {
            log.warn("poll periodSeconds < 1 ({}). Using 1.", periodSeconds);
            periodSeconds = 1;
        }
        this.periodSeconds = periodSeconds;
        this.shutdownTimeoutMs = Math.max(0, shutdownTimeoutMs);
    }

    // ---- Lifecycle ----
    @PostConstruct
    void startPolling() {
        // first cycle right away so /metrics has data as early as possible
        loopHandle = scheduler.scheduleAtFixedRate(this::tickSafe, 0, periodSeconds, TimeUnit.SECONDS);
        log.info("Tuya polling: every={}s, devices={}", periodSeconds, registry.size());
    }

    @PreDestroy
    public void shutdown() {
        stopping = true;
        ScheduledFuture<?> h = loopHandle;
        if (h != null) h.cancel(false);
        store.seal();

        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(shutdownTimeoutMs, TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = fetchExecutor.shutdownNow();
                log.warn("poll_shutdown: fetches still running after {} ms, interrupted ({} queued dropped)",
                        shutdownTimeoutMs, dropped.size());
            }
        } catch (InterruptedException ie) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Tuya polling stopped");
    }

    // ---- Poll loop ----
    private void tickSafe() {
        try {
            runCycle();
        } catch (Exception e) {
            // an exception escaping here would silently cancel the periodic task
            log.error("poll_cycle_failed: {}", e.toString(), e);
        }
    }

    /**
     * One tick: dispatches a fetch for every device that has none in flight.
     *
     * @return the fetches started by this tick
     */
    synchronized List<Future<?>> runCycle() {
        if (stopping) return List.of();

        List<Future<?>> dispatched = new ArrayList<>(registry.size());
        int skipped = 0;
        for (Device device : registry.list()) {
            Future<?> previous = inFlight.get(device.id());
            if (previous != null && !previous.isDone()) {
                skipped++;
                log.warn("poll_skip device={} — previous fetch still running", device.id());
                continue;
            }
            try {
                Future<?> f = fetchExecutor.submit(() -> pollDevice(device));
                inFlight.put(device.id(), f);
                dispatched.add(f);
            } catch (RejectedExecutionException e) {
                log.debug("poll_rejected device={} (executor shutting down)", device.id());
            }
        }
        log.info("poll_cycle dispatched={} skipped={}", dispatched.size(), skipped);
        return dispatched;
    }

    /** Fetches one device and records the outcome. Never throws. */
    void pollDevice(Device device) {
        FetchOutcome outcome;
        try {
            Reading r = fetcher.fetch(device);
            outcome = FetchOutcome.success(r);
            if (log.isDebugEnabled()) {
                log.debug("poll_ok device={} temp={} hum={} battery={}",
                        device.id(), r.temperatureCelsius(), r.humidityPercent(), r.batteryState());
            }
        } catch (FetchException e) {
            outcome = FetchOutcome.failure(FetchError.of(e, clock.instant()));
            log.warn("poll_failed device={} kind={} msg={}", device.id(), e.getKind(), e.getMessage());
        } catch (RuntimeException e) {
            // anything unexpected from payload handling is a malformed response
            outcome = FetchOutcome.failure(new FetchError(
                    FetchException.Kind.MALFORMED_RESPONSE, e.toString(), clock.instant()));
            log.warn("poll_failed device={} unexpected: {}", device.id(), e.toString(), e);
        }

        if (stopping) {
            log.debug("poll_result_dropped device={} (shutting down)", device.id());
            return;
        }
        store.update(device.id(), outcome);
    }
}
