package com.injuryelo.injury.job;

import com.injuryelo.injury.cache.InjuryCache;
import com.injuryelo.injury.service.InjuryReportService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Optional background refresher. Off by default: reports are refreshed on access.
 *
 * <p>When enabled, each cycle is:
 * <pre>
 *   delay(interval) → league-wide refresh → evict expired entries → repeat
 * </pre>
 * Each cycle is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the next
 * one. A failed cycle is logged and the loop carries on at the same interval.
 */
public class InjuryRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(InjuryRefreshScheduler.class);

    private final InjuryReportService reports;
    private final InjuryCache cache;
    private final Duration interval;

    private final AtomicReference<Disposable> pending = new AtomicReference<>();
    private final AtomicBoolean running = new AtomicBoolean();

    public InjuryRefreshScheduler(InjuryReportService reports, InjuryCache cache, Duration interval) {
        this.reports  = reports;
        this.cache    = cache;
        this.interval = interval;
    }

    /** First cycle runs immediately so the cache is warm before the first prediction. */
    @PostConstruct
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Proactive injury refresh started. intervalSeconds={}", interval.toSeconds());
            scheduleNextCycle(Duration.ZERO);
        }
    }

    @PreDestroy
    public void stop() {
        if (running.compareAndSet(true, false)) {
            Disposable current = pending.getAndSet(null);
            if (current != null) {
                current.dispose();
            }
            log.info("Proactive injury refresh stopped.");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void scheduleNextCycle(Duration delay) {
        if (!running.get()) {
            return;
        }
        Disposable next = Mono.delay(delay)
            .then(reports.refreshAll())
            .subscribe(
                result -> {
                    int evicted = cache.evictExpired();
                    log.info("PROACTIVE_REFRESH succeeded={} teamsUpdated={} evicted={} nextIntervalSeconds={}",
                             result.succeeded(), result.teamsUpdated(), evicted, interval.toSeconds());
                    scheduleNextCycle(interval);
                },
                err -> {
                    log.error("Proactive refresh cycle failed, rescheduling. nextIntervalSeconds={}",
                              interval.toSeconds(), err);
                    scheduleNextCycle(interval);
                }
            );
        pending.set(next);
        if (!running.get()) {
            next.dispose();
        }
    }
}
