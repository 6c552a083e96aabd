package com.example.trafficservice.rule;

import com.example.trafficservice.model.FilterRule;
import com.example.trafficservice.model.HostRule;
import com.example.trafficservice.model.RawExchange;
import com.example.trafficservice.model.RuleDecision;
import com.example.trafficservice.model.RuleSnapshotInfo;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Immutable, fully compiled view of the rules at one point in time.
 *
 * <p>Enabled filter rules are a deny-list walked in insertion order. Enabled host rules are an
 * allow-list; with none enabled every host passes.</p>
 */
public final class RuleSnapshot {

    private final long version;
    private final Instant loadedAt;
    private final List<CompiledFilterRule> filterRules;
    private final List<HostMatcher> hostRules;
    private final int totalFilterRules;
    private final int totalHostRules;

    private RuleSnapshot(long version, Instant loadedAt, List<CompiledFilterRule> filterRules,
                         List<HostMatcher> hostRules, int totalFilterRules, int totalHostRules) {
        this.version = version;
        this.loadedAt = loadedAt;
        this.filterRules = filterRules;
        this.hostRules = hostRules;
        this.totalFilterRules = totalFilterRules;
        this.totalHostRules = totalHostRules;
    }

    /**
     * Compile every enabled rule. Throws before anything is returned if a pattern or host is invalid.
     */
    public static RuleSnapshot compile(long version, List<FilterRule> filterRules, List<HostRule> hostRules) {
        List<CompiledFilterRule> compiledFilters = filterRules.stream()
            .filter(FilterRule::isEnabled)
            .map(CompiledFilterRule::new)
            .collect(Collectors.toUnmodifiableList());
        List<HostMatcher> compiledHosts = hostRules.stream()
            .filter(HostRule::isEnabled)
            .map(rule -> {
                RuleValidator.validate(rule);
                return new HostMatcher(rule);
            })
            .collect(Collectors.toUnmodifiableList());
        return new RuleSnapshot(version, Instant.now(), compiledFilters, compiledHosts,
                                filterRules.size(), hostRules.size());
    }

    public static RuleSnapshot empty() {
        return new RuleSnapshot(0, Instant.now(), List.of(), List.of(), 0, 0);
    }

    public boolean evaluate(RawExchange exchange) {
        return explain(ExchangeAttributes.of(exchange)).isIncluded();
    }

    public RuleDecision explain(RawExchange exchange) {
        return explain(ExchangeAttributes.of(exchange));
    }

    public RuleDecision explain(ExchangeAttributes attributes) {
        for (CompiledFilterRule rule : filterRules) {
            if (rule.matches(attributes)) {
                return RuleDecision.exclude(RuleDecision.Reason.MATCHED_FILTER_RULE, rule.getId(), version);
            }
        }

        if (hostRules.isEmpty()) {
            return RuleDecision.include(RuleDecision.Reason.NO_MATCHING_RULE, null, version);
        }
        for (HostMatcher hostRule : hostRules) {
            if (hostRule.matches(attributes.getHost())) {
                return RuleDecision.include(RuleDecision.Reason.MATCHED_HOST_RULE, hostRule.getId(), version);
            }
        }
        return RuleDecision.exclude(RuleDecision.Reason.HOST_NOT_ALLOWED, null, version);
    }

    public long getVersion() {
        return version;
    }

    public RuleSnapshotInfo info() {
        return new RuleSnapshotInfo(version, loadedAt, filterRules.size(), hostRules.size(),
                                    totalFilterRules, totalHostRules);
    }
}
