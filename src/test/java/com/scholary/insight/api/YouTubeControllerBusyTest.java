package com.scholary.insight.api;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.insight.service.VideoInsightOrchestrator;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

/** Ask requests against a saturated answer executor. */
@WebMvcTest(YouTubeController.class)
class YouTubeControllerBusyTest {

  @Autowired private MockMvc mockMvc;

  @MockBean private VideoInsightOrchestrator orchestrator;

  @TestConfiguration
  static class RejectingExecutorConfig {

    @Bean(name = "taskExecutor")
    Executor taskExecutor() {
      return task -> {
        throw new RejectedExecutionException("queue full");
      };
    }
  }

  @Test
  void ask_shouldReturnServiceUnavailableWhenExecutorIsFull() throws Exception {
    mockMvc
        .perform(
            post("/api/youtube/ask")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"videoId\":\"dQw4w9WgXcQ\",\"question\":\"Why?\"}"))
        .andExpect(status().isServiceUnavailable())
        .andExpect(jsonPath("$.code").value("BUSY"));

    verifyNoInteractions(orchestrator);
  }
}
