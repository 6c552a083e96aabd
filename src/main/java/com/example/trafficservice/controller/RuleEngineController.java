package com.example.trafficservice.controller;

import com.example.trafficservice.model.ExchangeProbe;
import com.example.trafficservice.model.RuleDecision;
import com.example.trafficservice.model.RuleSnapshotInfo;
import com.example.trafficservice.service.RuleEngineService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for the active rule snapshot
 */
@RestController
@RequestMapping("/api/rules")
@RequiredArgsConstructor
public class RuleEngineController {

    private final RuleEngineService ruleEngine;

    /**
     * Recompile the snapshot from the current store contents
     */
    @PostMapping("/reload")
    public ResponseEntity<RuleSnapshotInfo> reload() {
        return ResponseEntity.ok(ruleEngine.reload().info());
    }

    @GetMapping("/snapshot")
    public ResponseEntity<RuleSnapshotInfo> getSnapshot() {
        return ResponseEntity.ok(ruleEngine.snapshot().info());
    }

    /**
     * Test whether an exchange would be kept, and why, without processing anything
     */
    @PostMapping("/evaluate")
    public ResponseEntity<RuleDecision> evaluate(@Valid @RequestBody ExchangeProbe probe) {
        return ResponseEntity.ok(ruleEngine.explain(probe));
    }
}
