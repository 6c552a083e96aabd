package com.example.trafficservice.controller;

import com.example.trafficservice.TestCatalogues;
import com.example.trafficservice.model.ApiCatalogue;
import com.example.trafficservice.model.TestCase;
import com.example.trafficservice.model.TestSuiteResult;
import com.example.trafficservice.service.CapturePipelineService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TestCaseController.class)
class TestCaseControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private CapturePipelineService pipelineService;

    @Test
    void shouldGenerateTestsFromCatalogue() throws Exception {
        // Given
        TestSuiteResult suite = TestSuiteResult.builder()
            .testCases(List.of(TestCase.builder().id("tc-get-users-id").name("GET /users/{id}").build()))
            .documentation("# API Documentation\n")
            .build();
        when(pipelineService.generateTests(any(ApiCatalogue.class))).thenReturn(suite);

        // When/Then
        mockMvc.perform(post("/api/tests/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(TestCatalogues.users())))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.testCases[0].id").value("tc-get-users-id"))
            .andExpect(jsonPath("$.documentation").value("# API Documentation\n"));

        verify(pipelineService).generateTests(argThat(catalogue -> catalogue.getApis().size() == 4
            && catalogue.getApis().get(0).getKey().equals("GET /users/{id}")));
    }

    @Test
    void shouldRenderMarkdown() throws Exception {
        // Given
        when(pipelineService.renderDocumentation(anyList())).thenReturn("# API Documentation\n");

        // When/Then
        mockMvc.perform(post("/api/tests/docs")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(TestCatalogues.users())))
            .andExpect(status().isOk())
            .andExpect(content().contentTypeCompatibleWith("text/markdown"))
            .andExpect(content().string("# API Documentation\n"));
    }

    @Test
    void shouldRenderOpenApiWithTitle() throws Exception {
        // Given
        when(pipelineService.renderOpenApi(anyList(), eq("Users API")))
            .thenReturn(JsonNodeFactory.instance.objectNode().put("openapi", "3.0.3"));

        // When/Then
        mockMvc.perform(post("/api/tests/openapi")
                .param("title", "Users API")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"apis\":[]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.openapi").value("3.0.3"));
    }

    @Test
    void shouldRejectMissingBody() throws Exception {
        mockMvc.perform(post("/api/tests/generate").contentType(MediaType.APPLICATION_JSON))
            .andExpect(status().isBadRequest());
    }
}
