package com.example.trafficservice.model;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exchange description submitted for a dry-run rule evaluation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExchangeProbe {

    @NotBlank(message = "Method is required")
    private String method;

    @NotBlank(message = "URL is required")
    private String url;

    private String contentType;

    @Builder.Default
    private Map<String, String> headers = new LinkedHashMap<>();
}
