package com.marketwatch.tracker.scrape.service;

import com.marketwatch.tracker.config.ScraperProperties;
import com.marketwatch.tracker.scrape.model.CycleRunMeta;
import com.marketwatch.tracker.scrape.persistence.PersistenceGateway;
import com.marketwatch.tracker.scrape.persistence.ScrapeJdbcRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

@Component
public class SchedulerLifecycleRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SchedulerLifecycleRunner.class);

    private final PersistenceGateway gateway;
    private final ScrapeJdbcRepository repository;
    private final CycleSchedulerService scheduler;
    private final ScraperProperties properties;
    private final Clock clock;

    public SchedulerLifecycleRunner(
        PersistenceGateway gateway,
        ScrapeJdbcRepository repository,
        CycleSchedulerService scheduler,
        ScraperProperties properties,
        Clock clock
    ) {
        this.gateway = gateway;
        this.repository = repository;
        this.scheduler = scheduler;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!gateway.isReachable()) {
            if (properties.getScheduler().isEnabled()) {
                throw new SchedulerStartupException("Persistence gateway unreachable at startup");
            }
            log.warn("Skipping stale cycle cleanup because database is unreachable");
            return;
        }

        List<CycleRunMeta> running = repository.findRunningCycles();
        for (CycleRunMeta cycle : running) {
            repository.abortCycle(cycle.cycleId(), clock.instant(), "aborted_on_startup");
            log.info("Aborted stale scrape cycle {} startedAt={}", cycle.cycleId(), cycle.startedAt());
        }

        if (properties.getScheduler().isEnabled()) {
            scheduler.start();
        } else {
            log.info("Scheduler disabled; cycles run only on manual trigger");
        }
    }
}
