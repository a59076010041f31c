package com.sundayedge.live.service;

import com.sundayedge.live.model.ExternalGameEvent;
import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.GameState;
import com.sundayedge.live.model.ScheduledGame;
import com.sundayedge.live.model.UpsertResult;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

@Component
public class GameRegistry {
  private static final Logger LOGGER = LoggerFactory.getLogger(GameRegistry.class);
  private static final int MIN_LIVE_PROBABILITY = 5;
  private static final int MAX_LIVE_PROBABILITY = 95;
  private static final int OVERTIME_PERIOD = 5;

  private final ApplicationEventPublisher eventPublisher;
  private final int defaultBaselineHomeWinProbability;
  private final Map<String, Game> games = new LinkedHashMap<>();
  private final Set<String> pendingFinalizations = new LinkedHashSet<>();
  private String windowId;

  public GameRegistry(
      ApplicationEventPublisher eventPublisher,
      @Value("${sundayedge.registry.baseline-home-win-probability:55}")
          int defaultBaselineHomeWinProbability) {
    this.eventPublisher = eventPublisher;
    this.defaultBaselineHomeWinProbability =
        clamp(defaultBaselineHomeWinProbability, MIN_LIVE_PROBABILITY, MAX_LIVE_PROBABILITY);
  }

  /**
   * Replaces the current schedule window. Games whose id reappears in the new window keep their
   * state, and games listed in {@code retainedIds} are carried over even when the new window does
   * not name them; every other game of the old window is discarded.
   */
  public synchronized List<Game> loadWindow(
      String windowId, List<ScheduledGame> scheduled, Set<String> retainedIds) {
    Map<String, Game> next = new LinkedHashMap<>();
    int index = 0;
    for (ScheduledGame entry : scheduled) {
      index++;
      if (entry == null || isBlank(entry.getHomeTeam()) || isBlank(entry.getAwayTeam())) {
        LOGGER.warn("[REGISTRY] skipping schedule entry {} of window {}: missing teams", index, windowId);
        continue;
      }
      String key;
      if (isBlank(entry.getId())) {
        key = String.valueOf(index);
        LOGGER.warn(
            "[REGISTRY] schedule entry {} of window {} has no id, using its position", index, windowId);
      } else {
        key = entry.getId().trim();
      }
      String gameId = windowId + "-" + key;
      if (next.containsKey(gameId)) {
        LOGGER.warn("[REGISTRY] duplicate game id {} in window {}, keeping first", gameId, windowId);
        continue;
      }
      Game existing = games.get(gameId);
      if (existing != null) {
        next.put(gameId, existing);
        continue;
      }
      int baseline =
          entry.getBaselineHomeWinProbability() == null
              ? defaultBaselineHomeWinProbability
              : clamp(entry.getBaselineHomeWinProbability(), MIN_LIVE_PROBABILITY, MAX_LIVE_PROBABILITY);
      Game game =
          new Game(
              gameId,
              windowId,
              entry.getHomeTeam().trim(),
              entry.getAwayTeam().trim(),
              entry.getKickoffTime(),
              entry.getVenue(),
              entry.getBroadcast(),
              baseline);
      game.setLastUpdated(Instant.now().toString());
      applyWinProbability(game);
      next.put(gameId, game);
    }

    for (String retainedId : retainedIds) {
      Game retained = games.get(retainedId);
      if (retained != null && !next.containsKey(retainedId)) {
        LOGGER.info(
            "[REGISTRY] carrying game {} ({} @ {}) into window {}: predictions still pending",
            retainedId,
            retained.getAwayTeam(),
            retained.getHomeTeam(),
            windowId);
        next.put(retainedId, retained);
      }
    }

    int discarded = 0;
    for (String oldId : games.keySet()) {
      if (!next.containsKey(oldId)) {
        discarded++;
      }
    }
    pendingFinalizations.retainAll(next.keySet());
    games.clear();
    games.putAll(next);
    this.windowId = windowId;
    LOGGER.info(
        "[REGISTRY] window={} loaded games={} discarded={}", windowId, games.size(), discarded);
    return listAll();
  }

  public synchronized UpsertResult upsertFromExternal(String matchedId, ExternalGameEvent snapshot) {
    Game game = games.get(matchedId);
    if (game == null) {
      LOGGER.warn("[REGISTRY] update for unknown game {} ignored", matchedId);
      return UpsertResult.unknownGame(matchedId);
    }
    GameState previous = game.getState();
    if (previous == GameState.FINAL) {
      LOGGER.debug("[REGISTRY] game {} is final, snapshot {} ignored", matchedId, snapshot);
      return UpsertResult.ignoredFinal(matchedId);
    }

    GameState reported = classifyStatus(snapshot.getStatusText());
    GameState target = reported;
    if (reported.isBefore(previous)) {
      LOGGER.warn(
          "[REGISTRY] game {} reported {} while {}, state kept",
          matchedId,
          reported,
          previous);
      target = previous;
    }

    int homeScore = snapshot.getHomeScore() == null ? game.getHomeScore() : snapshot.getHomeScore();
    int awayScore = snapshot.getAwayScore() == null ? game.getAwayScore() : snapshot.getAwayScore();
    String scoreRejection = null;
    if (homeScore < 0 || awayScore < 0) {
      scoreRejection = "negative score " + awayScore + "-" + homeScore;
    } else if (previous == GameState.LIVE
        && (homeScore < game.getHomeScore() || awayScore < game.getAwayScore())) {
      scoreRejection =
          "regressive score "
              + awayScore
              + "-"
              + homeScore
              + " below held "
              + game.getAwayScore()
              + "-"
              + game.getHomeScore();
    }

    String now = Instant.now().toString();
    if (scoreRejection != null) {
      LOGGER.warn(
          "[REGISTRY] data-quality: game {} ({} @ {}) {}; score and state kept",
          matchedId,
          game.getAwayTeam(),
          game.getHomeTeam(),
          scoreRejection);
      applyDisplayFields(game, snapshot);
      game.setLastUpdated(now);
      applyWinProbability(game);
      return UpsertResult.scoreRejected(matchedId, previous, scoreRejection);
    }

    game.setHomeScore(homeScore);
    game.setAwayScore(awayScore);
    applyDisplayFields(game, snapshot);
    game.setState(target);
    game.setLastUpdated(now);
    boolean finalized = target == GameState.FINAL;
    if (finalized) {
      game.setFinalizedAt(now);
      pendingFinalizations.add(matchedId);
      LOGGER.info(
          "[REGISTRY] game {} final: {} {} - {} {}",
          matchedId,
          game.getAwayTeam(),
          awayScore,
          homeScore,
          game.getHomeTeam());
    } else if (target != previous) {
      LOGGER.info("[REGISTRY] game {} {} -> {}", matchedId, previous, target);
    }
    applyWinProbability(game);
    return UpsertResult.applied(matchedId, previous, target, finalized);
  }

  /**
   * Publishes a {@link GameFinalizedEvent} for every game that turned final since the last call.
   * Runs outside the registry lock so listeners may read the registry. A game whose listener
   * fails stays queued for the next call.
   *
   * @return the ids whose finalization was handled
   */
  public List<String> publishPendingFinalizations() {
    List<String> finalized;
    synchronized (this) {
      finalized = new ArrayList<>(pendingFinalizations);
      pendingFinalizations.clear();
    }
    List<String> published = new ArrayList<>();
    for (String gameId : finalized) {
      try {
        eventPublisher.publishEvent(new GameFinalizedEvent(gameId));
        published.add(gameId);
      } catch (RuntimeException ex) {
        LOGGER.warn("[REGISTRY] finalization of game {} not handled, retrying next cycle", gameId, ex);
        requeueFinalization(gameId);
      }
    }
    return published;
  }

  public synchronized boolean hasPendingFinalizations() {
    return !pendingFinalizations.isEmpty();
  }

  private synchronized void requeueFinalization(String gameId) {
    if (games.containsKey(gameId)) {
      pendingFinalizations.add(gameId);
    }
  }

  public synchronized Optional<Game> recomputeWinProbability(String gameId) {
    Game game = games.get(gameId);
    if (game == null) {
      return Optional.empty();
    }
    applyWinProbability(game);
    return Optional.of(game.copy());
  }

  public synchronized Optional<Game> findById(String gameId) {
    Game game = games.get(gameId);
    return game == null ? Optional.empty() : Optional.of(game.copy());
  }

  public synchronized List<Game> listAll() {
    List<Game> result = new ArrayList<>();
    for (Game game : games.values()) {
      result.add(game.copy());
    }
    return result;
  }

  public synchronized List<Game> listByState(GameState state) {
    List<Game> result = new ArrayList<>();
    for (Game game : games.values()) {
      if (game.getState() == state) {
        result.add(game.copy());
      }
    }
    return result;
  }

  public synchronized boolean allFinal() {
    if (games.isEmpty()) {
      return false;
    }
    return games.values().stream().allMatch(game -> game.getState() == GameState.FINAL);
  }

  public synchronized String getWindowId() {
    return windowId;
  }

  static GameState classifyStatus(String statusText) {
    if (statusText == null) {
      return GameState.SCHEDULED;
    }
    String status = statusText.toLowerCase(Locale.ROOT);
    if (status.contains("final")) {
      return GameState.FINAL;
    }
    if (status.contains("progress") || status.contains("halftime") || status.contains("end of")) {
      return GameState.LIVE;
    }
    return GameState.SCHEDULED;
  }

  private void applyDisplayFields(Game game, ExternalGameEvent snapshot) {
    if (snapshot.getPeriod() != null && snapshot.getPeriod() >= 0) {
      game.setPeriod(snapshot.getPeriod());
    }
    if (snapshot.getOvertime() != null) {
      game.setOvertime(snapshot.getOvertime());
    }
    if (snapshot.getClock() != null && !snapshot.getClock().isBlank()) {
      game.setClock(snapshot.getClock());
    }
  }

  private void applyWinProbability(Game game) {
    if (game.getState() == GameState.FINAL) {
      int home;
      if (game.getHomeScore() > game.getAwayScore()) {
        home = 100;
      } else if (game.getHomeScore() < game.getAwayScore()) {
        home = 0;
      } else {
        home = 50;
      }
      game.setHomeWinProbability(home);
      game.setAwayWinProbability(100 - home);
      game.setConfidenceLabel("Final");
      return;
    }

    int differential = game.getHomeScore() - game.getAwayScore();
    double raw = game.getBaselineHomeWinProbability() + differential * periodWeight(game);
    int home = clamp((int) Math.round(raw), MIN_LIVE_PROBABILITY, MAX_LIVE_PROBABILITY);
    game.setHomeWinProbability(home);
    game.setAwayWinProbability(100 - home);
    game.setConfidenceLabel(confidenceLabel(home));
  }

  // A point is worth more the later it is scored.
  private double periodWeight(Game game) {
    int period = game.getPeriod() == null ? 1 : Math.max(1, game.getPeriod());
    if (game.isOvertime()) {
      period = OVERTIME_PERIOD;
    }
    return 2.0d + Math.min(period, OVERTIME_PERIOD) * 0.75d;
  }

  private String confidenceLabel(int homeWinProbability) {
    int margin = Math.abs(homeWinProbability - 50);
    if (margin >= 30) {
      return "High";
    }
    if (margin >= 15) {
      return "Medium";
    }
    return "Low";
  }

  private static int clamp(int value, int min, int max) {
    return Math.max(min, Math.min(max, value));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
