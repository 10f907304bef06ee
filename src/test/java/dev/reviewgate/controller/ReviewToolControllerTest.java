package dev.reviewgate.controller;

import dev.reviewgate.dto.request.ToolRequest;
import dev.reviewgate.dto.response.ToolResponse;
import dev.reviewgate.service.ReviewToolService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web slice for the tool endpoint: routing, request binding and error mapping.
 */
@WebMvcTest(ReviewToolController.class)
class ReviewToolControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ReviewToolService toolService;

    @Nested
    @DisplayName("POST /tools/{operation}")
    class Invoke {

        @Test
        @DisplayName("binds arguments and returns the tool response")
        void invokesOperation() throws Exception {
            when(toolService.invoke(eq("get_pull_request"), any()))
                    .thenReturn(ToolResponse.ok("get_pull_request", "PR #42: Add cart", null));

            mockMvc.perform(post("/tools/get_pull_request")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"repositoryId\": \"repo\", \"pullRequestId\": 42, \"confirm\": true}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.operation").value("get_pull_request"))
                    .andExpect(jsonPath("$.success").value(true))
                    .andExpect(jsonPath("$.message").value("PR #42: Add cart"))
                    .andExpect(jsonPath("$.data").doesNotExist());

            ArgumentCaptor<ToolRequest> captor = ArgumentCaptor.forClass(ToolRequest.class);
            verify(toolService).invoke(eq("get_pull_request"), captor.capture());
            assertThat(captor.getValue().repositoryId()).isEqualTo("repo");
            assertThat(captor.getValue().pullRequestId()).isEqualTo(42);
            assertThat(captor.getValue().confirmed()).isTrue();
        }

        @Test
        @DisplayName("operation failures are still 200 with success=false")
        void operationFailure() throws Exception {
            when(toolService.invoke(eq("set_pr_vote"), any()))
                    .thenReturn(ToolResponse.error("set_pr_vote", "Error: Unknown vote 'sure'"));

            mockMvc.perform(post("/tools/set_pr_vote")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"vote\": \"sure\"}"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.success").value(false));
        }

        @Test
        @DisplayName("malformed JSON is a 400 problem detail")
        void malformedJson() throws Exception {
            mockMvc.perform(post("/tools/run_review")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"pullRequestId\": "))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.type").value("https://reviewgate.dev/errors/bad-request"))
                    .andExpect(jsonPath("$.timestamp").exists());

            verify(toolService, never()).invoke(any(), any());
        }
    }

    @Nested
    @DisplayName("resilience errors")
    class Resilience {

        @Test
        @DisplayName("rate limiting maps to 429")
        void rateLimited() throws Exception {
            when(toolService.invoke(eq("run_review"), any()))
                    .thenThrow(RequestNotPermitted.createRequestNotPermitted(RateLimiter.ofDefaults("review-agent")));

            mockMvc.perform(post("/tools/run_review").contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isTooManyRequests())
                    .andExpect(jsonPath("$.title").value("Rate Limited"));
        }

        @Test
        @DisplayName("an open circuit maps to 503")
        void circuitOpen() throws Exception {
            when(toolService.invoke(eq("run_review"), any()))
                    .thenThrow(CallNotPermittedException.createCallNotPermittedException(CircuitBreaker.ofDefaults("azure-devops")));

            mockMvc.perform(post("/tools/run_review").contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isServiceUnavailable());
        }

        @Test
        @DisplayName("unexpected errors map to 500 without internal details")
        void unexpected() throws Exception {
            when(toolService.invoke(eq("run_review"), any())).thenThrow(new IllegalStateException("db password is x"));

            mockMvc.perform(post("/tools/run_review").contentType(MediaType.APPLICATION_JSON).content("{}"))
                    .andExpect(status().isInternalServerError())
                    .andExpect(jsonPath("$.detail").value("An unexpected error occurred. Please try again later."));
        }
    }

    @Test
    @DisplayName("GET /tools lists the available operations")
    void listsOperations() throws Exception {
        when(toolService.operationNames()).thenReturn(new LinkedHashSet<>(List.of("list_pull_requests", "run_review")));

        mockMvc.perform(get("/tools"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("list_pull_requests"))
                .andExpect(jsonPath("$[1]").value("run_review"));
    }
}
