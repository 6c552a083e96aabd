package com.example.trafficservice.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of the model builder: endpoints in first-seen order plus any schema conflicts found.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiCatalogue {

    @Builder.Default
    private List<ApiDefinition> apis = new ArrayList<>();

    @Builder.Default
    private List<Diagnostic> diagnostics = new ArrayList<>();

    @JsonIgnore
    public boolean isEmpty() {
        return apis == null || apis.isEmpty();
    }

    public static ApiCatalogue empty() {
        return new ApiCatalogue();
    }
}
