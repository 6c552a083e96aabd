package com.example.trafficservice.integration;

import com.example.trafficservice.model.AnalysisStatus;
import com.example.trafficservice.model.ApiDefinition;
import com.example.trafficservice.model.CaptureAnalysis;
import com.example.trafficservice.model.CaptureJob;
import com.example.trafficservice.model.ExchangeProbe;
import com.example.trafficservice.model.FilterRule;
import com.example.trafficservice.model.JobStatus;
import com.example.trafficservice.model.RuleDecision;
import com.example.trafficservice.model.TestCase;
import com.example.trafficservice.model.TestSuiteResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.io.ClassPathResource;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class TrafficServiceIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    private String baseUrl;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port;
        ResponseEntity<FilterRule[]> applied = restTemplate.postForEntity(
            baseUrl + "/api/filters/presets/common-noise/apply", null, FilterRule[].class);
        assertThat(applied.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    private HttpEntity<MultiValueMap<String, Object>> upload(String fixture) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ClassPathResource("captures/" + fixture));
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return new HttpEntity<>(body, headers);
    }

    @Test
    void shouldParseCaptureAndGenerateTests() {
        // When
        ResponseEntity<CaptureAnalysis> parsed = restTemplate.postForEntity(
            baseUrl + "/api/captures/parse", upload("users.har"), CaptureAnalysis.class);

        // Then
        assertThat(parsed.getStatusCode()).isEqualTo(HttpStatus.OK);
        CaptureAnalysis analysis = parsed.getBody();
        assertThat(analysis).isNotNull();
        assertThat(analysis.getStatus()).isEqualTo(AnalysisStatus.COMPLETE);
        assertThat(analysis.getTotalEntries()).isEqualTo(6);
        assertThat(analysis.getExcludedExchanges()).isEqualTo(2);
        assertThat(analysis.getApis()).extracting(ApiDefinition::getKey)
            .containsExactly("GET /users/{id}", "POST /users", "GET /static/app.css");

        // When
        ResponseEntity<TestSuiteResult> generated = restTemplate.postForEntity(
            baseUrl + "/api/tests/generate", analysis.toCatalogue(), TestSuiteResult.class);

        // Then
        assertThat(generated.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(generated.getBody()).isNotNull();
        assertThat(generated.getBody().getTestCases()).extracting(TestCase::getId)
            .containsExactly("tc-get-users-id", "tc-post-users", "tc-get-static-app-css");
        assertThat(generated.getBody().getTestCases().get(0).getRequest().getPath()).isEqualTo("/users/7");
        assertThat(generated.getBody().getDocumentation()).contains("## POST /users");

        // When
        ResponseEntity<JsonNode> openApi = restTemplate.postForEntity(
            baseUrl + "/api/tests/openapi?title=Users", analysis.toCatalogue(), JsonNode.class);

        // Then
        assertThat(openApi.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(openApi.getBody().at("/info/title").asText()).isEqualTo("Users");
        assertThat(openApi.getBody().at("/paths/~1users~1{id}/get").isMissingNode()).isFalse();
    }

    @Test
    void shouldRejectMalformedCapture() {
        ResponseEntity<Map> response = restTemplate.postForEntity(
            baseUrl + "/api/captures/parse", upload("not-a-har.json"), Map.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody()).containsEntry("code", "MALFORMED_CAPTURE");
    }

    @Test
    void shouldRunCaptureAsBackgroundJob() throws Exception {
        // When
        ResponseEntity<CaptureJob> submitted = restTemplate.postForEntity(
            baseUrl + "/api/captures/jobs", upload("broken-entries.har"), CaptureJob.class);

        // Then
        assertThat(submitted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        String jobId = submitted.getBody().getJobId();

        CaptureJob job = submitted.getBody();
        for (int attempt = 0; attempt < 50 && !job.getStatus().isTerminal(); attempt++) {
            Thread.sleep(100);
            job = restTemplate.getForObject(baseUrl + "/api/captures/jobs/" + jobId, CaptureJob.class);
        }
        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getResult().getStatus()).isEqualTo(AnalysisStatus.PARTIAL);
        assertThat(job.getResult().getSkippedEntries()).isEqualTo(2);
    }

    @Test
    void shouldExplainRuleDecision() {
        // Given
        ExchangeProbe probe = ExchangeProbe.builder().method("OPTIONS").url("https://api.example.com/users").build();

        // When
        ResponseEntity<RuleDecision> response = restTemplate.postForEntity(
            baseUrl + "/api/rules/evaluate", probe, RuleDecision.class);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().isIncluded()).isFalse();
        assertThat(response.getBody().getRuleId()).isEqualTo("noise-options");
    }

    @Test
    void shouldRejectInvalidRulePattern() {
        // Given
        Map<String, Object> rule = Map.of("type", "url", "pattern", "([unclosed");

        // When
        ResponseEntity<Map> response = restTemplate.postForEntity(baseUrl + "/api/filters", rule, Map.class);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).containsEntry("code", "INVALID_PATTERN");
    }
}
