package com.example.trafficservice.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Persisted content of the rule store, in insertion order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RuleState {
    private List<FilterRule> filterRules = new ArrayList<>();
    private List<HostRule> hostRules = new ArrayList<>();
}
