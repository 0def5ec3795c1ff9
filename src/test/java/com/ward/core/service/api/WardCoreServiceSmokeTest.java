package com.ward.core.service.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ward.core.service.api.dto.NavigationEventRequest;
import com.ward.core.service.api.dto.SpanIngestRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Smoke tests for Ward Core Service.
 *
 * Tests basic functionality of all endpoints.
 */
@SpringBootTest
@AutoConfigureMockMvc
class WardCoreServiceSmokeTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void contextLoads() {
        // Context loads successfully
    }

    @Test
    void healthEndpointWorks() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").exists())
                .andExpect(jsonPath("$.components.sessionPipeline.details.workerRunning").value(true));
    }

    @Test
    void swaggerUiAvailable() throws Exception {
        mockMvc.perform(get("/swagger-ui.html"))
                .andExpect(status().is3xxRedirection());
    }

    @Test
    void listSessionsReturnsArray() throws Exception {
        mockMvc.perform(get("/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    void ingestSpans_validAndInvalid_returns202WithCounts() throws Exception {
        SpanIngestRequest request = SpanIngestRequest.builder()
                .spans(List.of(
                        SpanIngestRequest.SpanDto.builder()
                                .id("smoke-1")
                                .traceId("trace-smoke")
                                .name("GET /smoke")
                                .origin("server")
                                .startTime(0.0)
                                .endTime(12.5)
                                .sessionId("nav_smoke")
                                .build(),
                        SpanIngestRequest.SpanDto.builder()
                                .id("smoke-2")
                                .name("missing trace id")
                                .origin("server")
                                .startTime(0.0)
                                .endTime(1.0)
                                .build(),
                        SpanIngestRequest.SpanDto.builder()
                                .id("smoke-3")
                                .traceId("trace-smoke")
                                .name("bad origin")
                                .origin("edge")
                                .startTime(0.0)
                                .endTime(1.0)
                                .build()
                ))
                .build();

        mockMvc.perform(post("/ingest/spans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.accepted").value(1))
                .andExpect(jsonPath("$.data.skipped").value(2))
                .andExpect(jsonPath("$.data.batchId").exists());
    }

    @Test
    void ingestSpans_nullEntry_isSkippedAndRestKept() throws Exception {
        SpanIngestRequest request = SpanIngestRequest.builder()
                .spans(Arrays.asList(
                        null,
                        SpanIngestRequest.SpanDto.builder()
                                .id("smoke-null-1")
                                .traceId("trace-smoke")
                                .name("GET /smoke")
                                .origin("server")
                                .startTime(0.0)
                                .endTime(5.0)
                                .sessionId("nav_smoke_null")
                                .build()))
                .build();

        mockMvc.perform(post("/ingest/spans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.data.accepted").value(1))
                .andExpect(jsonPath("$.data.skipped").value(1));
    }

    @Test
    void ingestSpans_missingSpans_returns400() throws Exception {
        mockMvc.perform(post("/ingest/spans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of())))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void ingestSpans_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/ingest/spans")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"spans\": ["))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void ingestNavigation_unknownType_returns400() throws Exception {
        NavigationEventRequest request = NavigationEventRequest.builder()
                .sessionId("nav_smoke_bad")
                .navigationType("teleport")
                .timing(NavigationEventRequest.TimingDto.builder().navigationStart(0.0).build())
                .build();

        mockMvc.perform(post("/ingest/navigation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void ingestNavigation_missingTiming_returns400() throws Exception {
        NavigationEventRequest request = NavigationEventRequest.builder()
                .sessionId("nav_smoke_bad")
                .navigationType("initial")
                .build();

        mockMvc.perform(post("/ingest/navigation")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void getSession_notFound_returns404() throws Exception {
        mockMvc.perform(get("/sessions/nav_does_not_exist"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("NOT_FOUND"));
    }

    @Test
    void getIssues_unknownSeverity_returns400() throws Exception {
        mockMvc.perform(get("/sessions/nav_any/issues").param("minSeverity", "catastrophic"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void slowResourcesReturnsArray() throws Exception {
        mockMvc.perform(get("/resources/slow").param("thresholdMs", "250"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isArray());
    }

    @Test
    void slowResources_nonNumericThreshold_returns400() throws Exception {
        mockMvc.perform(get("/resources/slow").param("thresholdMs", "abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("INVALID_ARGUMENT"))
                .andExpect(jsonPath("$.error.details").value("abc"));
    }

    @Test
    void sessionStreamStartsAsync() throws Exception {
        mockMvc.perform(get("/sessions/stream").accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(request().asyncStarted());
    }
}
