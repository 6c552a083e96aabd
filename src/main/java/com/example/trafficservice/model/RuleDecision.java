package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of evaluating one exchange, with the rule responsible for an exclusion.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RuleDecision {

    public enum Reason {
        NO_MATCHING_RULE,
        MATCHED_HOST_RULE,
        MATCHED_FILTER_RULE,
        HOST_NOT_ALLOWED
    }

    private boolean included;

    private Reason reason;

    /**
     * Filter or host rule id behind the decision, if any.
     */
    private String ruleId;

    private long snapshotVersion;

    public static RuleDecision include(Reason reason, String ruleId, long snapshotVersion) {
        return new RuleDecision(true, reason, ruleId, snapshotVersion);
    }

    public static RuleDecision exclude(Reason reason, String ruleId, long snapshotVersion) {
        return new RuleDecision(false, reason, ruleId, snapshotVersion);
    }
}
