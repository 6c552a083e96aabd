package com.example.trafficservice.controller;

import com.example.trafficservice.model.FilterRule;
import com.example.trafficservice.model.Preset;
import com.example.trafficservice.model.PresetSummary;
import com.example.trafficservice.service.RuleStoreService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for managing filter rules and applying rule presets
 */
@RestController
@RequestMapping("/api/filters")
@RequiredArgsConstructor
@Slf4j
public class FilterRuleController {

    private final RuleStoreService ruleStore;

    /**
     * Get all filter rules, in evaluation order
     */
    @GetMapping
    public ResponseEntity<List<FilterRule>> getAllRules() {
        return ResponseEntity.ok(ruleStore.listFilterRules());
    }

    @GetMapping("/{ruleId}")
    public ResponseEntity<FilterRule> getRule(@PathVariable String ruleId) {
        return ResponseEntity.ok(ruleStore.getFilterRule(ruleId));
    }

    /**
     * Add a filter rule; the id is generated when missing
     */
    @PostMapping
    public ResponseEntity<FilterRule> addRule(@Valid @RequestBody FilterRule rule) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ruleStore.addFilterRule(rule));
    }

    @PutMapping("/{ruleId}")
    public ResponseEntity<FilterRule> updateRule(@PathVariable String ruleId, @Valid @RequestBody FilterRule rule) {
        return ResponseEntity.ok(ruleStore.updateFilterRule(ruleId, rule));
    }

    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(@PathVariable String ruleId) {
        ruleStore.deleteFilterRule(ruleId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{ruleId}/toggle")
    public ResponseEntity<FilterRule> toggleRule(@PathVariable String ruleId, @RequestParam boolean enabled) {
        return ResponseEntity.ok(ruleStore.toggleFilterRule(ruleId, enabled));
    }

    /**
     * List the bundled presets
     */
    @GetMapping("/presets")
    public ResponseEntity<List<PresetSummary>> getPresets() {
        return ResponseEntity.ok(ruleStore.listPresets());
    }

    @GetMapping("/presets/{presetId}")
    public ResponseEntity<Preset> getPreset(@PathVariable String presetId) {
        return ResponseEntity.ok(ruleStore.getPreset(presetId));
    }

    /**
     * Merge a preset's rules into the filter rules
     */
    @PostMapping("/presets/{presetId}/apply")
    public ResponseEntity<List<FilterRule>> applyPreset(@PathVariable String presetId) {
        List<FilterRule> applied = ruleStore.applyPreset(presetId);
        log.info("Preset {} applied through API", presetId);
        return ResponseEntity.ok(applied);
    }

    /**
     * Get rule store statistics
     */
    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStatistics() {
        return ResponseEntity.ok(ruleStore.getStatistics());
    }
}
