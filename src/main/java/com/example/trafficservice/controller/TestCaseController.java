package com.example.trafficservice.controller;

import com.example.trafficservice.model.ApiCatalogue;
import com.example.trafficservice.model.TestSuiteResult;
import com.example.trafficservice.service.CapturePipelineService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API turning an endpoint catalogue (as returned by {@code /api/captures/parse}) into test
 * cases and documentation
 */
@RestController
@RequestMapping("/api/tests")
@RequiredArgsConstructor
public class TestCaseController {

    static final MediaType TEXT_MARKDOWN = MediaType.parseMediaType("text/markdown;charset=UTF-8");

    private final CapturePipelineService pipelineService;

    @PostMapping("/generate")
    public ResponseEntity<TestSuiteResult> generate(@RequestBody ApiCatalogue catalogue) {
        return ResponseEntity.ok(pipelineService.generateTests(catalogue));
    }

    @PostMapping(value = "/docs", produces = "text/markdown")
    public ResponseEntity<String> documentation(@RequestBody ApiCatalogue catalogue) {
        return ResponseEntity.ok()
            .contentType(TEXT_MARKDOWN)
            .body(pipelineService.renderDocumentation(catalogue.getApis()));
    }

    @PostMapping("/openapi")
    public ResponseEntity<JsonNode> openApi(@RequestBody ApiCatalogue catalogue,
                                            @RequestParam(defaultValue = "Captured API") String title) {
        return ResponseEntity.ok(pipelineService.renderOpenApi(catalogue.getApis(), title));
    }
}
