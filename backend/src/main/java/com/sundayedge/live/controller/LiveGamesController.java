package com.sundayedge.live.controller;

import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.GameState;
import com.sundayedge.live.model.ReconciliationReport;
import com.sundayedge.live.model.SchedulerStatus;
import com.sundayedge.live.service.GameRegistry;
import com.sundayedge.live.service.ScheduleWindowService;
import com.sundayedge.live.service.UpdateScheduler;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@CrossOrigin(origins = "http://localhost:5173")
public class LiveGamesController {
  private final GameRegistry gameRegistry;
  private final ScheduleWindowService scheduleWindowService;
  private final UpdateScheduler updateScheduler;

  public LiveGamesController(
      GameRegistry gameRegistry,
      ScheduleWindowService scheduleWindowService,
      UpdateScheduler updateScheduler) {
    this.gameRegistry = gameRegistry;
    this.scheduleWindowService = scheduleWindowService;
    this.updateScheduler = updateScheduler;
  }

  @GetMapping("/api/games")
  public List<Game> games(@RequestParam(name = "state", required = false) String state) {
    if (state == null || state.isBlank()) {
      return gameRegistry.listAll();
    }
    return gameRegistry.listByState(GameState.valueOf(state.trim().toUpperCase(Locale.ROOT)));
  }

  @GetMapping("/api/games/{id}")
  public ResponseEntity<Game> game(@PathVariable("id") String id) {
    return gameRegistry
        .findById(id)
        .map(ResponseEntity::ok)
        .orElseGet(() -> ResponseEntity.notFound().build());
  }

  @PostMapping("/api/schedule/load")
  public Map<String, Object> loadSchedule(@RequestParam(name = "window") String window) {
    try {
      List<Game> games = scheduleWindowService.loadWindow(window);
      return Map.of("status", "OK", "window", window, "gameCount", games.size());
    } catch (IllegalArgumentException | UncheckedIOException ex) {
      return Map.of("status", "FAILED", "message", String.valueOf(ex.getMessage()));
    }
  }

  @PostMapping("/api/reconcile/trigger")
  public Map<String, Object> triggerReconcile() {
    Optional<ReconciliationReport> report = updateScheduler.triggerNow();
    if (report.isEmpty()) {
      return Map.of("status", "COALESCED", "message", "A cycle is already running");
    }
    if (report.get().isFailed()) {
      return Map.of(
          "status", "FAILED",
          "message", String.valueOf(report.get().getFailureMessage()),
          "report", report.get());
    }
    return Map.of("status", "OK", "report", report.get());
  }

  @PostMapping("/api/scheduler/start")
  public SchedulerStatus startScheduler() {
    updateScheduler.start();
    return updateScheduler.getStatus();
  }

  @PostMapping("/api/scheduler/stop")
  public SchedulerStatus stopScheduler() {
    updateScheduler.stop();
    return updateScheduler.getStatus();
  }

  @GetMapping("/api/scheduler/status")
  public SchedulerStatus schedulerStatus() {
    return updateScheduler.getStatus();
  }
}
