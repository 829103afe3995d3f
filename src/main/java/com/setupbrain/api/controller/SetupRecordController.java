package com.setupbrain.api.controller;

import com.setupbrain.domain.model.SetupRecord;
import com.setupbrain.service.SetupRecordService;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only view of the recorded setups, most recently updated first.
 */
@RestController
@RequestMapping("/api/setups")
public class SetupRecordController {

    private final SetupRecordService setupRecordService;

    public SetupRecordController(SetupRecordService setupRecordService) {
        this.setupRecordService = setupRecordService;
    }

    @GetMapping
    public ResponseEntity<List<SetupRecord>> listSetups(@RequestParam(required = false) String symbol) {
        if (symbol != null && !symbol.isBlank()) {
            return ResponseEntity.ok(setupRecordService.findBySymbol(symbol));
        }
        return ResponseEntity.ok(setupRecordService.findAll());
    }
}
