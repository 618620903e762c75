package com.mirrorwatch.watch.api;

import com.mirrorwatch.watch.model.CycleSummary;
import com.mirrorwatch.watch.model.WatchStatusResponse;
import com.mirrorwatch.watch.service.WatchScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/watch")
public class WatchController {
    private final WatchScheduler scheduler;

    public WatchController(WatchScheduler scheduler) {
        this.scheduler = scheduler;
    }

    @GetMapping("/status")
    public WatchStatusResponse status() {
        return scheduler.getStatus();
    }

    @PostMapping("/start")
    public WatchStatusResponse start() {
        scheduler.start();
        return scheduler.getStatus();
    }

    @PostMapping("/stop")
    public WatchStatusResponse stop() {
        scheduler.stop();
        return scheduler.getStatus();
    }

    @PostMapping("/run")
    public CycleSummary run() {
        return scheduler.runNow();
    }
}
