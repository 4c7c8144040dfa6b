package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.adapter.CancellationToken;
import com.marketwatch.tracker.scrape.guard.SiteGuardRegistry;
import com.marketwatch.tracker.scrape.model.CycleSummary;
import com.marketwatch.tracker.scrape.model.CycleTrigger;
import com.marketwatch.tracker.scrape.model.SavedSearchCycleOutcome;
import com.marketwatch.tracker.scrape.model.SchedulerState;
import com.marketwatch.tracker.scrape.model.SchedulerStatusResponse;
import com.marketwatch.tracker.scrape.persistence.PersistenceGateway;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fires cycles at a fixed start-to-start interval on a single cycle thread.
 * IDLE -> RUNNING -> IDLE, with CANCELLING reachable from RUNNING. Triggers that arrive
 * while not IDLE are dropped and counted.
 */
@Service
public class CycleSchedulerService {
    private static final Logger log = LoggerFactory.getLogger(CycleSchedulerService.class);

    private final ScrapeCycleService cycleService;
    private final PersistenceGateway gateway;
    private final SiteGuardRegistry guards;
    private final ScraperProperties properties;
    private final Clock clock;
    private final AtomicReference<SchedulerState> state = new AtomicReference<>(SchedulerState.IDLE);
    private final AtomicLong skippedTriggers = new AtomicLong();
    private final AtomicBoolean startupPending = new AtomicBoolean(false);
    private final Map<Long, SavedSearchCycleOutcome> lastOutcomeBySearch = new ConcurrentHashMap<>();
    private final ExecutorService cycleRunner;
    private final Object lifecycleLock = new Object();

    private ScheduledExecutorService timer;
    private volatile boolean started;
    private volatile CancellationToken currentToken;
    private volatile Long currentCycleId;
    private volatile Instant nextTriggerAt;
    private volatile CycleSummary lastCycle;

    public CycleSchedulerService(
        ScrapeCycleService cycleService,
        PersistenceGateway gateway,
        SiteGuardRegistry guards,
        ScraperProperties properties,
        Clock clock
    ) {
        this.cycleService = cycleService;
        this.gateway = gateway;
        this.guards = guards;
        this.properties = properties;
        this.clock = clock;
        this.cycleRunner = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName("scrape-cycle");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (started) {
                return;
            }
            if (!gateway.isReachable()) {
                throw new SchedulerStartupException("Persistence gateway unreachable; scheduler not started");
            }
            long intervalSeconds = properties.getScheduler().getIntervalMinutes() * 60L;
            boolean runNow = properties.getScheduler().isRunOnStartup();
            long initialDelay = runNow ? 0 : intervalSeconds;
            startupPending.set(runNow);
            nextTriggerAt = clock.instant().plusSeconds(initialDelay);
            timer = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable);
                thread.setName("scrape-scheduler");
                thread.setDaemon(true);
                return thread;
            });
            timer.scheduleAtFixedRate(this::onTick, initialDelay, intervalSeconds, TimeUnit.SECONDS);
            started = true;
            log.info("Scheduler started: every {} min, first cycle in {}s", intervalSeconds / 60, initialDelay);
        }
    }

    public void stop() {
        synchronized (lifecycleLock) {
            if (!started) {
                return;
            }
            timer.shutdownNow();
            timer = null;
            started = false;
            nextTriggerAt = null;
            log.info("Scheduler stopped");
        }
        cancelCurrentCycle();
    }

    /**
     * Starts a cycle unless one is already running.
     *
     * @return false when the trigger was dropped
     */
    public boolean trigger(CycleTrigger trigger) {
        CancellationToken token = new CancellationToken();
        if (!state.compareAndSet(SchedulerState.IDLE, SchedulerState.RUNNING)) {
            long skipped = skippedTriggers.incrementAndGet();
            log.warn("Dropping {} trigger: cycle still {} (skipped={})", trigger, state.get(), skipped);
            return false;
        }
        currentToken = token;
        try {
            cycleRunner.execute(() -> runCycle(trigger, token));
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Dropping {} trigger: cycle runner shut down", trigger);
            currentToken = null;
            state.set(SchedulerState.IDLE);
            return false;
        }
    }

    public void triggerNow() {
        if (!trigger(CycleTrigger.MANUAL)) {
            throw new CycleAlreadyRunningException(state.get());
        }
    }

    public boolean cancelCurrentCycle() {
        CancellationToken token = currentToken;
        if (token == null || !state.compareAndSet(SchedulerState.RUNNING, SchedulerState.CANCELLING)) {
            return false;
        }
        log.info("Cancelling scrape cycle {}", currentCycleId);
        token.cancel("cancelled by operator");
        return true;
    }

    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (state.get() != SchedulerState.IDLE) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(20);
        }
        return true;
    }

    public SchedulerState state() {
        return state.get();
    }

    public SchedulerStatusResponse getStatus() {
        return new SchedulerStatusResponse(
            started,
            state.get(),
            currentCycleId,
            skippedTriggers.get(),
            nextTriggerAt,
            lastCycle,
            new TreeMap<>(lastOutcomeBySearch),
            guards.snapshots()
        );
    }

    @PreDestroy
    public void shutdown() {
        stop();
        cancelCurrentCycle();
        cycleRunner.shutdown();
        try {
            if (!cycleRunner.awaitTermination(properties.getScheduler().getShutdownGraceSeconds(), TimeUnit.SECONDS)) {
                log.warn("Scrape cycle did not finish within shutdown grace period");
                cycleRunner.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cycleRunner.shutdownNow();
        }
    }

    private void onTick() {
        CycleTrigger trigger = startupPending.getAndSet(false) ? CycleTrigger.STARTUP : CycleTrigger.SCHEDULED;
        nextTriggerAt = clock.instant().plusSeconds(properties.getScheduler().getIntervalMinutes() * 60L);
        try {
            trigger(trigger);
        } catch (RuntimeException e) {
            log.error("Scheduler tick failed", e);
        }
    }

    private void runCycle(CycleTrigger trigger, CancellationToken token) {
        try {
            CycleSummary summary = cycleService.runCycle(trigger, token, cycleId -> currentCycleId = cycleId);
            lastCycle = summary;
            for (SavedSearchCycleOutcome outcome : summary.searchOutcomes()) {
                lastOutcomeBySearch.put(outcome.savedSearchId(), outcome);
            }
        } catch (RuntimeException e) {
            log.error("Scrape cycle crashed", e);
        } finally {
            currentToken = null;
            currentCycleId = null;
            state.set(SchedulerState.IDLE);
        }
    }
}
