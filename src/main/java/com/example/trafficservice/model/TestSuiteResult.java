package com.example.trafficservice.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TestSuiteResult {

    @Builder.Default
    private List<TestCase> testCases = new ArrayList<>();

    /**
     * Markdown documentation of the same catalogue.
     */
    private String documentation;
}
