package com.example.draft.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.draft.api.response.QueueResponse;
import com.example.draft.service.QueueService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(QueueController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class QueueControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private QueueService queueService;

  @Test
  void appendReturnsQueue() throws Exception {
    when(queueService.append("user-1", "p-001"))
        .thenReturn(new QueueResponse("user-1", List.of("p-001")));

    mockMvc
        .perform(
            post("/v1/queue")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"player_id\":\"p-001\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.user_id").value("user-1"))
        .andExpect(jsonPath("$.player_ids[0]").value("p-001"));
  }

  @Test
  void moveToUsesBodyIndex() throws Exception {
    when(queueService.moveTo("user-1", "p-003", 0))
        .thenReturn(new QueueResponse("user-1", List.of("p-003", "p-001")));

    mockMvc
        .perform(
            put("/v1/queue/p-003/position")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"index\":0}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.player_ids[0]").value("p-003"));
  }

  @Test
  void moveToRejectsNegativeIndex() throws Exception {
    mockMvc
        .perform(
            put("/v1/queue/p-003/position")
                .header("X-User-Id", "user-1")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"index\":-1}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("DRAFT_VALIDATION_ERROR"));
  }

  @Test
  void unknownPlayerReturns400() throws Exception {
    when(queueService.moveToTop("user-1", "p-999"))
        .thenThrow(new InvalidDraftRequestException("player is not in queue: p-999"));

    mockMvc
        .perform(post("/v1/queue/p-999/top").header("X-User-Id", "user-1"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("DRAFT_BAD_REQUEST"));
  }

  @Test
  void removeAndClear() throws Exception {
    when(queueService.remove("user-1", "p-001")).thenReturn(new QueueResponse("user-1", List.of()));
    when(queueService.clear("user-1")).thenReturn(new QueueResponse("user-1", List.of()));
    when(queueService.getQueue("user-1")).thenReturn(new QueueResponse("user-1", List.of()));

    mockMvc
        .perform(delete("/v1/queue/p-001").header("X-User-Id", "user-1"))
        .andExpect(status().isOk());
    mockMvc.perform(delete("/v1/queue").header("X-User-Id", "user-1")).andExpect(status().isOk());
    mockMvc
        .perform(get("/v1/queue").header("X-User-Id", "user-1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.player_ids").isEmpty());

    verify(queueService).remove("user-1", "p-001");
    verify(queueService).clear("user-1");
  }
}
