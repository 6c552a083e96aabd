package com.example.trafficservice.service;

import com.example.trafficservice.exception.NotFoundException;
import com.example.trafficservice.exception.RuleValidationException;
import com.example.trafficservice.model.FilterRule;
import com.example.trafficservice.model.HostRule;
import com.example.trafficservice.model.Preset;
import com.example.trafficservice.model.PresetSummary;
import com.example.trafficservice.model.RuleState;
import com.example.trafficservice.rule.PresetCatalog;
import com.example.trafficservice.rule.RuleValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Service owning the filter rules and host rules.
 *
 * <p>Mutations are serialized. Each one validates its input, builds the complete next state,
 * persists it and only then makes it current, so a failure at any step leaves the store
 * exactly as it was. Rules handed out are copies.</p>
 */
@Service
@Slf4j
public class RuleStoreService {

    private final PresetCatalog presetCatalog;
    private final RuleFileStorage storage;
    private final ApplicationEventPublisher eventPublisher;

    private final Object mutationLock = new Object();

    private volatile Rules current = new Rules(new LinkedHashMap<>(), new LinkedHashMap<>());

    @Autowired
    public RuleStoreService(PresetCatalog presetCatalog, RuleFileStorage storage,
                            ApplicationEventPublisher eventPublisher) {
        this.presetCatalog = presetCatalog;
        this.storage = storage;
        this.eventPublisher = eventPublisher;
    }

    @PostConstruct
    public void init() {
        storage.load().ifPresent(state -> {
            Map<String, FilterRule> filters = new LinkedHashMap<>();
            for (FilterRule rule : state.getFilterRules()) {
                RuleValidator.validate(rule);
                filters.put(rule.getId(), copy(rule));
            }
            Map<String, HostRule> hosts = new LinkedHashMap<>();
            for (HostRule rule : state.getHostRules()) {
                RuleValidator.validate(rule);
                hosts.put(rule.getId(), copy(rule));
            }
            current = new Rules(filters, hosts);
        });
        log.info("Rule store initialized with {} filter rules and {} host rules",
            current.filters.size(), current.hosts.size());
    }

    // ==================== Filter Rules ====================

    public List<FilterRule> listFilterRules() {
        return current.filters.values().stream().map(RuleStoreService::copy).collect(Collectors.toList());
    }

    public FilterRule getFilterRule(String ruleId) {
        FilterRule rule = current.filters.get(ruleId);
        if (rule == null) {
            throw NotFoundException.filterRule(ruleId);
        }
        return copy(rule);
    }

    /**
     * Add a filter rule. A missing id is generated.
     */
    public FilterRule addFilterRule(FilterRule rule) {
        RuleValidator.validate(rule);
        FilterRule stored = copy(rule);
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }

        mutate("added filter rule " + stored.getId(), next -> {
            if (next.filters.containsKey(stored.getId())) {
                throw RuleValidationException.duplicate("Filter rule", stored.getId());
            }
            next.filters.put(stored.getId(), stored);
        });
        log.info("Added filter rule {} ({} on {})", stored.getId(), stored.getPattern(), stored.getType());
        return copy(stored);
    }

    /**
     * Replace a filter rule, keeping its position.
     */
    public FilterRule updateFilterRule(String ruleId, FilterRule rule) {
        RuleValidator.validate(rule);
        FilterRule stored = copy(rule);
        stored.setId(ruleId);

        mutate("updated filter rule " + ruleId, next -> {
            if (!next.filters.containsKey(ruleId)) {
                throw NotFoundException.filterRule(ruleId);
            }
            next.filters.put(ruleId, stored);
        });
        log.info("Updated filter rule {}", ruleId);
        return copy(stored);
    }

    public void deleteFilterRule(String ruleId) {
        mutate("deleted filter rule " + ruleId, next -> {
            if (next.filters.remove(ruleId) == null) {
                throw NotFoundException.filterRule(ruleId);
            }
        });
        log.info("Deleted filter rule {}", ruleId);
    }

    public FilterRule toggleFilterRule(String ruleId, boolean enabled) {
        FilterRule[] toggled = new FilterRule[1];
        mutate((enabled ? "enabled" : "disabled") + " filter rule " + ruleId, next -> {
            FilterRule existing = next.filters.get(ruleId);
            if (existing == null) {
                throw NotFoundException.filterRule(ruleId);
            }
            toggled[0] = existing.toBuilder().enabled(enabled).build();
            next.filters.put(ruleId, toggled[0]);
        });
        log.info("Filter rule {} {}", ruleId, enabled ? "enabled" : "disabled");
        return copy(toggled[0]);
    }

    // ==================== Host Rules ====================

    public List<HostRule> listHostRules() {
        return current.hosts.values().stream().map(RuleStoreService::copy).collect(Collectors.toList());
    }

    public HostRule getHostRule(String ruleId) {
        HostRule rule = current.hosts.get(ruleId);
        if (rule == null) {
            throw NotFoundException.hostRule(ruleId);
        }
        return copy(rule);
    }

    public HostRule addHostRule(HostRule rule) {
        RuleValidator.validate(rule);
        HostRule stored = copy(rule);
        if (stored.getId() == null || stored.getId().isBlank()) {
            stored.setId(UUID.randomUUID().toString());
        }

        mutate("added host rule " + stored.getId(), next -> {
            if (next.hosts.containsKey(stored.getId())) {
                throw RuleValidationException.duplicate("Host rule", stored.getId());
            }
            rejectDuplicateHost(next, stored);
            next.hosts.put(stored.getId(), stored);
        });
        log.info("Added host rule {} ({}, subdomains: {})",
            stored.getId(), stored.getHost(), stored.isIncludeSubdomains());
        return copy(stored);
    }

    public HostRule updateHostRule(String ruleId, HostRule rule) {
        RuleValidator.validate(rule);
        HostRule stored = copy(rule);
        stored.setId(ruleId);

        mutate("updated host rule " + ruleId, next -> {
            if (!next.hosts.containsKey(ruleId)) {
                throw NotFoundException.hostRule(ruleId);
            }
            rejectDuplicateHost(next, stored);
            next.hosts.put(ruleId, stored);
        });
        log.info("Updated host rule {}", ruleId);
        return copy(stored);
    }

    public void deleteHostRule(String ruleId) {
        mutate("deleted host rule " + ruleId, next -> {
            if (next.hosts.remove(ruleId) == null) {
                throw NotFoundException.hostRule(ruleId);
            }
        });
        log.info("Deleted host rule {}", ruleId);
    }

    public HostRule toggleHostRule(String ruleId, boolean enabled) {
        HostRule[] toggled = new HostRule[1];
        mutate((enabled ? "enabled" : "disabled") + " host rule " + ruleId, next -> {
            HostRule existing = next.hosts.get(ruleId);
            if (existing == null) {
                throw NotFoundException.hostRule(ruleId);
            }
            toggled[0] = existing.toBuilder().enabled(enabled).build();
            next.hosts.put(ruleId, toggled[0]);
        });
        log.info("Host rule {} {}", ruleId, enabled ? "enabled" : "disabled");
        return copy(toggled[0]);
    }

    // ==================== Presets ====================

    public List<PresetSummary> listPresets() {
        return presetCatalog.list();
    }

    public Preset getPreset(String presetId) {
        return presetCatalog.get(presetId);
    }

    /**
     * Merge a preset into the filter rules: rules sharing an id with an existing rule replace it
     * in place, the rest are appended in preset order. All or nothing.
     *
     * @return the preset's rules as stored
     */
    public List<FilterRule> applyPreset(String presetId) {
        Preset preset = presetCatalog.get(presetId);
        preset.getRules().forEach(RuleValidator::validate);

        int[] replaced = new int[1];
        mutate("applied preset " + presetId, next -> {
            for (FilterRule rule : preset.getRules()) {
                if (next.filters.put(rule.getId(), copy(rule)) != null) {
                    replaced[0]++;
                }
            }
        });
        log.info("Applied preset {}: {} rules, {} replaced, {} added",
            presetId, preset.getRules().size(), replaced[0], preset.getRules().size() - replaced[0]);
        return preset.getRules().stream().map(RuleStoreService::copy).collect(Collectors.toList());
    }

    // ==================== Snapshot & Statistics ====================

    /**
     * Consistent copy of both rule collections as of the last committed mutation.
     */
    public RuleState currentState() {
        Rules rules = current;
        return new RuleState(
            rules.filters.values().stream().map(RuleStoreService::copy).collect(Collectors.toList()),
            rules.hosts.values().stream().map(RuleStoreService::copy).collect(Collectors.toList()));
    }

    public Map<String, Object> getStatistics() {
        Rules rules = current;
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("totalFilterRules", rules.filters.size());
        stats.put("enabledFilterRules", rules.filters.values().stream().filter(FilterRule::isEnabled).count());
        stats.put("totalHostRules", rules.hosts.size());
        stats.put("enabledHostRules", rules.hosts.values().stream().filter(HostRule::isEnabled).count());
        stats.put("presetsAvailable", presetCatalog.list().size());
        stats.put("persistent", storage.isEnabled());
        return stats;
    }

    // ==================== Internals ====================

    private void mutate(String change, Consumer<Rules> mutation) {
        synchronized (mutationLock) {
            Rules next = current.copy();
            mutation.accept(next);
            storage.save(next.toState());
            current = next;
        }
        eventPublisher.publishEvent(new RulesChangedEvent(this, change));
    }

    private static void rejectDuplicateHost(Rules rules, HostRule candidate) {
        boolean taken = rules.hosts.values().stream()
            .anyMatch(existing -> !existing.getId().equals(candidate.getId())
                && existing.getHost().equalsIgnoreCase(candidate.getHost()));
        if (taken) {
            throw RuleValidationException.duplicate("Host", candidate.getHost());
        }
    }

    private static FilterRule copy(FilterRule rule) {
        return rule.toBuilder().build();
    }

    private static HostRule copy(HostRule rule) {
        return rule.toBuilder().build();
    }

    /**
     * Both collections in insertion order. Never modified once published as {@link #current}.
     */
    private static final class Rules {
        private final LinkedHashMap<String, FilterRule> filters;
        private final LinkedHashMap<String, HostRule> hosts;

        private Rules(Map<String, FilterRule> filters, Map<String, HostRule> hosts) {
            this.filters = new LinkedHashMap<>(filters);
            this.hosts = new LinkedHashMap<>(hosts);
        }

        private Rules copy() {
            return new Rules(filters, hosts);
        }

        private RuleState toState() {
            return new RuleState(new ArrayList<>(filters.values()), new ArrayList<>(hosts.values()));
        }
    }
}
