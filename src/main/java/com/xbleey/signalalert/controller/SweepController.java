package com.xbleey.signalalert.controller;

import com.xbleey.signalalert.model.SweepReport;
import com.xbleey.signalalert.service.StateSweepScheduler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/sweep")
public class SweepController {

    private final StateSweepScheduler sweepScheduler;

    public SweepController(StateSweepScheduler sweepScheduler) {
        this.sweepScheduler = sweepScheduler;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("paused", sweepScheduler.isPaused());
        response.put("states", sweepScheduler.stateNames());
        response.put("lastRun", sweepScheduler.lastReport().map(SweepController::reportBody).orElse(null));
        return response;
    }

    @PostMapping("/pause")
    public Map<String, Object> pause() {
        sweepScheduler.pause();
        return Map.of("status", "paused");
    }

    @PostMapping("/resume")
    public Map<String, Object> resume() {
        sweepScheduler.resume();
        return Map.of("status", "running");
    }

    @PostMapping("/run")
    public Map<String, Object> run() {
        return reportBody(sweepScheduler.runNow());
    }

    private static Map<String, Object> reportBody(SweepReport report) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ranAt", report.ranAt().toString());
        body.put("totalRemoved", report.totalRemoved());
        body.put("removed", report.removed());
        body.put("remaining", report.remaining());
        return body;
    }
}
