package com.example.trafficservice.controller;

import com.example.trafficservice.model.HostRule;
import com.example.trafficservice.service.RuleStoreService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for managing host rules. Once any host rule is enabled, only exchanges to matching
 * hosts are kept.
 */
@RestController
@RequestMapping("/api/filters/hosts")
@RequiredArgsConstructor
public class HostRuleController {

    private final RuleStoreService ruleStore;

    @GetMapping
    public ResponseEntity<List<HostRule>> getAllRules() {
        return ResponseEntity.ok(ruleStore.listHostRules());
    }

    @GetMapping("/{ruleId}")
    public ResponseEntity<HostRule> getRule(@PathVariable String ruleId) {
        return ResponseEntity.ok(ruleStore.getHostRule(ruleId));
    }

    @PostMapping
    public ResponseEntity<HostRule> addRule(@Valid @RequestBody HostRule rule) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ruleStore.addHostRule(rule));
    }

    @PutMapping("/{ruleId}")
    public ResponseEntity<HostRule> updateRule(@PathVariable String ruleId, @Valid @RequestBody HostRule rule) {
        return ResponseEntity.ok(ruleStore.updateHostRule(ruleId, rule));
    }

    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(@PathVariable String ruleId) {
        ruleStore.deleteHostRule(ruleId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{ruleId}/toggle")
    public ResponseEntity<HostRule> toggleRule(@PathVariable String ruleId, @RequestParam boolean enabled) {
        return ResponseEntity.ok(ruleStore.toggleHostRule(ruleId, enabled));
    }
}
