package com.sundayedge.live.service;

import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.ScheduledGame;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
public class ScheduleWindowService {
  private static final Logger LOGGER = LoggerFactory.getLogger(ScheduleWindowService.class);

  private final ScheduleLoader scheduleLoader;
  private final GameRegistry gameRegistry;
  private final PredictionLedger predictionLedger;
  private final UpdateScheduler updateScheduler;
  private final String initialWindow;

  public ScheduleWindowService(
      ScheduleLoader scheduleLoader,
      GameRegistry gameRegistry,
      PredictionLedger predictionLedger,
      UpdateScheduler updateScheduler,
      @Value("${sundayedge.schedule.initial-window:}") String initialWindow) {
    this.scheduleLoader = scheduleLoader;
    this.gameRegistry = gameRegistry;
    this.predictionLedger = predictionLedger;
    this.updateScheduler = updateScheduler;
    this.initialWindow = initialWindow;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void loadInitialWindow() {
    if (initialWindow == null || initialWindow.isBlank()) {
      return;
    }
    loadWindow(initialWindow.trim());
  }

  /**
   * Swaps in a new schedule window between reconciliation cycles. Games with pending predictions
   * are never discarded; they move into the new window until graded.
   */
  public List<Game> loadWindow(String windowId) {
    if (windowId == null || windowId.isBlank()) {
      throw new IllegalArgumentException("Window id is required");
    }
    List<ScheduledGame> scheduled = scheduleLoader.load(windowId);
    List<Game> games =
        updateScheduler.runExclusive(
            () -> {
              Set<String> retained = new LinkedHashSet<>();
              for (Game game : gameRegistry.listAll()) {
                if (predictionLedger.hasPendingPredictions(game.getId())) {
                  retained.add(game.getId());
                }
              }
              return gameRegistry.loadWindow(windowId, scheduled, retained);
            });
    updateScheduler.onWindowLoaded(windowId);
    LOGGER.info("[SCHEDULE] window {} active with {} games", windowId, games.size());
    return games;
  }
}
