package com.example.trafficservice.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Deny-list rule: an exchange whose attribute matches {@link #pattern} is excluded.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FilterRule {

    /**
     * Unique across the store. Generated when absent on creation.
     */
    private String id;

    /**
     * Regular expression searched (not fully matched) in the attribute, case-sensitive.
     */
    @NotBlank(message = "Rule pattern cannot be blank")
    private String pattern;

    @NotNull(message = "Rule type is required")
    private FilterRuleType type;

    @Builder.Default
    private boolean enabled = true;

    private String description;
}
