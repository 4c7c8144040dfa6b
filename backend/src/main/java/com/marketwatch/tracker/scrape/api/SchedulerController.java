package com.marketwatch.tracker.scrape.api;

import com.marketwatch.tracker.scrape.model.SchedulerStatusResponse;
import com.marketwatch.tracker.scrape.service.CycleSchedulerService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
public class SchedulerController {
    private final CycleSchedulerService scheduler;

    public SchedulerController(CycleSchedulerService scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    public SchedulerStatusResponse status() {
        return scheduler.getStatus();
    }

    @PostMapping("/trigger")
    public SchedulerStatusResponse trigger() {
        scheduler.triggerNow();
        return scheduler.getStatus();
    }

    @PostMapping("/cancel")
    public SchedulerStatusResponse cancel() {
        scheduler.cancelCurrentCycle();
        return scheduler.getStatus();
    }

    @PostMapping("/start")
    public SchedulerStatusResponse start() {
        scheduler.start();
        return scheduler.getStatus();
    }

    @PostMapping("/stop")
    public SchedulerStatusResponse stop() {
        scheduler.stop();
        return scheduler.getStatus();
    }
}
