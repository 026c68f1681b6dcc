package io.linkup.matchmaking.api;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import io.linkup.matchmaking.service.PresenceService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(PresenceController.class)
@AutoConfigureMockMvc(addFilters = false)
@Import(ApiExceptionHandler.class)
class PresenceControllerTest {

  @Autowired private MockMvc mockMvc;

  @MockitoBean private PresenceService presenceService;

  @Test
  void connectRegistersSession() throws Exception {
    mockMvc
        .perform(put("/v1/presence/sessions/s-1").header("X-User-Id", "user-a"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.session_id").value("s-1"))
        .andExpect(jsonPath("$.status").value("ONLINE"));

    verify(presenceService).connect("user-a", "s-1");
  }

  @Test
  void disconnectOfCurrentSessionReportsOffline() throws Exception {
    when(presenceService.disconnect("user-a", "s-1")).thenReturn(true);

    mockMvc
        .perform(delete("/v1/presence/sessions/s-1").header("X-User-Id", "user-a"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("OFFLINE"));
  }

  @Test
  void disconnectOfReplacedSessionReportsStale() throws Exception {
    when(presenceService.disconnect("user-a", "s-old")).thenReturn(false);

    mockMvc
        .perform(delete("/v1/presence/sessions/s-old").header("X-User-Id", "user-a"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.status").value("STALE"));
  }
}
