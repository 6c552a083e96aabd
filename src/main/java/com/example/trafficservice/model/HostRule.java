package com.example.trafficservice.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Allow-list rule over the exchange host. Once any host rule is enabled, only exchanges whose
 * host matches an enabled rule survive.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class HostRule {

    private String id;

    @NotBlank(message = "Host cannot be blank")
    private String host;

    @Builder.Default
    private boolean enabled = true;

    private String description;

    /**
     * When set, {@code api.example.com} also matches {@code v2.api.example.com}.
     */
    @Builder.Default
    private boolean includeSubdomains = false;
}
