package com.setupbrain.api.controller;

import com.setupbrain.core.engine.BrainCycleRunner;
import com.setupbrain.domain.model.CycleSummary;
import com.setupbrain.recorder.SetupRecorder;
import com.setupbrain.simulator.PaperTradingService;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Brain status and an on-demand cycle trigger.
 *
 * <p>POST /api/brain/cycles answers 409 while a scheduled cycle is running.
 */
@RestController
@RequestMapping("/api/brain")
public class BrainController {

    private static final Logger log = LoggerFactory.getLogger(BrainController.class);

    private final BrainCycleRunner brainCycleRunner;
    private final SetupRecorder setupRecorder;
    private final PaperTradingService paperTradingService;

    public BrainController(
            BrainCycleRunner brainCycleRunner, SetupRecorder setupRecorder, PaperTradingService paperTradingService) {
        this.brainCycleRunner = brainCycleRunner;
        this.setupRecorder = setupRecorder;
        this.paperTradingService = paperTradingService;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("lastCycleNumber", brainCycleRunner.getLastCycleNumber());
        status.put("running", brainCycleRunner.isRunning());
        status.put("paperTradingEnabled", paperTradingService.isEnabled());
        status.put("trackedSetups", setupRecorder.snapshot().size());
        return ResponseEntity.ok(status);
    }

    @PostMapping("/cycles")
    public ResponseEntity<CycleSummary> runCycle() {
        log.info("Manual brain cycle triggered");
        return ResponseEntity.ok(brainCycleRunner.runCycle());
    }
}
