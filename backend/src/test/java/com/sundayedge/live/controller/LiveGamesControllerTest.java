package com.sundayedge.live.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.GameState;
import com.sundayedge.live.model.ReconciliationReport;
import com.sundayedge.live.service.GameRegistry;
import com.sundayedge.live.service.ScheduleWindowService;
import com.sundayedge.live.service.UpdateScheduler;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class LiveGamesControllerTest {
  @Mock private GameRegistry gameRegistry;
  @Mock private ScheduleWindowService scheduleWindowService;
  @Mock private UpdateScheduler updateScheduler;

  private MockMvc mockMvc;

  @BeforeEach
  void setUp() {
    mockMvc =
        MockMvcBuilders.standaloneSetup(
                new LiveGamesController(gameRegistry, scheduleWindowService, updateScheduler))
            .build();
  }

  @Test
  void listsGamesByState() throws Exception {
    Game game = new Game("wk1-kc-buf", "wk1", "Kansas City Chiefs", "Buffalo Bills", null, null, null, 55);
    game.setState(GameState.LIVE);
    when(gameRegistry.listByState(GameState.LIVE)).thenReturn(List.of(game));

    mockMvc
        .perform(get("/api/games").param("state", "live"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].id").value("wk1-kc-buf"))
        .andExpect(jsonPath("$[0].state").value("LIVE"));
  }

  @Test
  void unknownGameIsNotFound() throws Exception {
    when(gameRegistry.findById("nope")).thenReturn(Optional.empty());

    mockMvc.perform(get("/api/games/nope")).andExpect(status().isNotFound());
  }

  @Test
  void scheduleLoadFailureIsReported() throws Exception {
    when(scheduleWindowService.loadWindow("wk1"))
        .thenThrow(new UncheckedIOException("Failed to read schedule", new IOException("bad")));

    mockMvc
        .perform(post("/api/schedule/load").param("window", "wk1"))
        .andExpect(jsonPath("$.status").value("FAILED"))
        .andExpect(jsonPath("$.message").value("Failed to read schedule"));
  }

  @Test
  void triggerReportsCoalescedRequest() throws Exception {
    when(updateScheduler.triggerNow()).thenReturn(Optional.empty());

    mockMvc
        .perform(post("/api/reconcile/trigger"))
        .andExpect(jsonPath("$.status").value("COALESCED"));
  }

  @Test
  void triggerReturnsCycleReport() throws Exception {
    ReconciliationReport report = new ReconciliationReport(3, "now");
    report.setFetched(2);
    when(updateScheduler.triggerNow()).thenReturn(Optional.of(report));

    mockMvc
        .perform(post("/api/reconcile/trigger"))
        .andExpect(jsonPath("$.status").value("OK"))
        .andExpect(jsonPath("$.report.cycle").value(3))
        .andExpect(jsonPath("$.report.fetched").value(2));
  }
}
