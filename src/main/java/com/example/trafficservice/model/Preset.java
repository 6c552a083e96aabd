package com.example.trafficservice.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Named, immutable bundle of filter rules applied to the store in one step.
 */
@Value
@Builder
public class Preset {

    String id;
    String name;
    String description;
    @Singular
    List<FilterRule> rules;

    /**
     * Deep copy; the rules are mutable beans.
     */
    public Preset copy() {
        PresetBuilder copy = Preset.builder().id(id).name(name).description(description);
        rules.forEach(rule -> copy.rule(rule.toBuilder().build()));
        return copy.build();
    }

    public PresetSummary toSummary() {
        return new PresetSummary(id, name, description, rules.size());
    }
}
