package com.sundayedge.live.service;

import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.GameState;
import com.sundayedge.live.model.LedgerStatistics;
import com.sundayedge.live.model.Prediction;
import com.sundayedge.live.model.PredictionKind;
import com.sundayedge.live.model.PredictionPayload;
import com.sundayedge.live.model.PredictionStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

@Service
public class PredictionLedger {
  private static final Logger LOGGER = LoggerFactory.getLogger(PredictionLedger.class);

  private final GameRegistry gameRegistry;
  private final PredictionStore store;
  private final Map<PredictionKind, GradingRule> rules = new EnumMap<>(PredictionKind.class);
  private final Map<String, Prediction> predictions = new LinkedHashMap<>();
  private StatisticsAccumulator statistics;
  private long gradedSequence;

  public PredictionLedger(
      GameRegistry gameRegistry, PredictionStore store, List<GradingRule> gradingRules) {
    this.gameRegistry = gameRegistry;
    this.store = store;
    for (GradingRule rule : gradingRules) {
      rules.put(rule.kind(), rule);
    }
    for (Prediction prediction : store.loadAll()) {
      predictions.put(prediction.getId(), prediction);
      gradedSequence = Math.max(gradedSequence, prediction.getGradedSequence());
    }
    this.statistics = StatisticsAccumulator.fromScratch(predictions.values());
    LOGGER.info(
        "[LEDGER] loaded predictions={} rules={}", predictions.size(), rules.keySet());
  }

  public synchronized void registerRule(GradingRule rule) {
    GradingRule previous = rules.put(rule.kind(), rule);
    if (previous != null) {
      LOGGER.info("[LEDGER] grading rule for {} replaced", rule.kind());
    }
  }

  public synchronized Prediction createPrediction(
      String gameId, PredictionKind kind, PredictionPayload payload) {
    if (gameId == null || gameId.isBlank()) {
      throw new IllegalArgumentException("Game id is required");
    }
    if (kind == null) {
      throw new IllegalArgumentException("Prediction kind is required");
    }
    String id = Prediction.idFor(gameId, kind);
    Prediction existing = predictions.get(id);
    Optional<Game> tracked = gameRegistry.findById(gameId);
    if (existing != null) {
      LOGGER.debug("[LEDGER] prediction {} already recorded, create ignored", id);
      if (existing.getStatus() == PredictionStatus.PENDING
          && !existing.isNeedsReview()
          && tracked.isPresent()
          && tracked.get().getState() == GameState.FINAL) {
        return gradeAfterCreate(existing, tracked.get());
      }
      return existing.copy();
    }
    Game game = tracked.orElseThrow(() -> new IllegalArgumentException("Unknown game: " + gameId));

    PredictionPayload resolved = payload == null ? new PredictionPayload() : payload;
    Prediction prediction = new Prediction();
    prediction.setId(id);
    prediction.setGameId(gameId);
    prediction.setKind(kind);
    prediction.setHomeTeam(game.getHomeTeam());
    prediction.setAwayTeam(game.getAwayTeam());
    prediction.setPick(resolved.getPick() == null ? null : resolved.getPick().trim());
    prediction.setLine(resolved.getLine());
    prediction.setConfidence(Math.max(0, Math.min(100, resolved.getConfidence())));
    prediction.setContext(resolved.getContext() == null ? "" : resolved.getContext());
    prediction.setPlayer(resolved.getPlayer());
    prediction.setStat(resolved.getStat());
    prediction.setStatus(PredictionStatus.PENDING);
    prediction.setCreatedAt(Instant.now().toString());

    store.save(prediction);
    predictions.put(id, prediction);
    statistics.onCreated(prediction);
    LOGGER.info(
        "[LEDGER] recorded {} pick=\"{}\" line={} confidence={} for game {}",
        kind,
        prediction.getPick(),
        prediction.getLine(),
        prediction.getConfidence(),
        gameId);

    if (game.getState() == GameState.FINAL) {
      return gradeAfterCreate(prediction, game);
    }
    return prediction.copy();
  }

  @EventListener
  public void handleGameFinalized(GameFinalizedEvent event) {
    onGameFinalized(event.getGameId());
  }

  /**
   * Grades every pending prediction of a final game. Already graded predictions are left as they
   * are, so repeated calls change nothing.
   *
   * @return the number of predictions graded by this call
   * @throws LedgerStoreException when a grade could not be persisted; that prediction stays
   *     PENDING and a later call grades it
   */
  public synchronized int onGameFinalized(String gameId) {
    Optional<Game> game = gameRegistry.findById(gameId);
    if (game.isEmpty() || game.get().getState() != GameState.FINAL) {
      LOGGER.warn("[LEDGER] finalization for game {} ignored: game not final", gameId);
      return 0;
    }
    int graded = 0;
    int failed = 0;
    LedgerStoreException failure = null;
    for (Prediction prediction : new ArrayList<>(predictions.values())) {
      if (!gameId.equals(prediction.getGameId())
          || prediction.getStatus() != PredictionStatus.PENDING) {
        continue;
      }
      try {
        if (grade(prediction, game.get())) {
          graded++;
        }
      } catch (LedgerStoreException ex) {
        failed++;
        failure = ex;
        LOGGER.warn("[LEDGER] prediction {} left pending: {}", prediction.getId(), ex.getMessage());
      }
    }
    if (graded > 0) {
      LOGGER.info("[LEDGER] game {} graded predictions={}", gameId, graded);
    }
    if (failure != null) {
      throw new LedgerStoreException(
          "Grading of game " + gameId + " incomplete, " + failed + " predictions not persisted",
          failure);
    }
    return graded;
  }

  /** Operator resolution of a flagged prediction once its game is final. */
  public synchronized Prediction resolveManually(String predictionId, PredictionStatus status) {
    Prediction prediction = predictions.get(predictionId);
    if (prediction == null) {
      throw new IllegalArgumentException("Unknown prediction: " + predictionId);
    }
    if (status == null || !status.isTerminal()) {
      throw new IllegalArgumentException("Resolution must be WIN, LOSS or PUSH");
    }
    if (prediction.getStatus().isTerminal()) {
      LOGGER.info(
          "[LEDGER] prediction {} already {}, manual resolution ignored",
          predictionId,
          prediction.getStatus());
      return prediction.copy();
    }
    Game game =
        gameRegistry
            .findById(prediction.getGameId())
            .filter(found -> found.getState() == GameState.FINAL)
            .orElseThrow(
                () ->
                    new IllegalArgumentException(
                        "Game " + prediction.getGameId() + " is not final"));
    Prediction resolved = applyGrade(prediction, status, game);
    LOGGER.info("[LEDGER] prediction {} resolved manually as {}", predictionId, status);
    return resolved.copy();
  }

  public synchronized LedgerStatistics getStatistics() {
    return statistics.snapshot();
  }

  /** Rebuilds the statistics from every recorded prediction and replaces the cached counters. */
  public synchronized LedgerStatistics recalculateStatistics() {
    StatisticsAccumulator rebuilt = StatisticsAccumulator.fromScratch(predictions.values());
    LedgerStatistics recomputed = rebuilt.snapshot();
    if (!recomputed.equals(statistics.snapshot())) {
      LOGGER.warn("[LEDGER] cached statistics diverged from full recomputation, replaced");
    }
    statistics = rebuilt;
    return recomputed;
  }

  public synchronized boolean hasPendingPredictions(String gameId) {
    return predictions.values().stream()
        .anyMatch(
            prediction ->
                gameId.equals(prediction.getGameId())
                    && prediction.getStatus() == PredictionStatus.PENDING);
  }

  public synchronized List<Prediction> listPredictions(String gameId) {
    List<Prediction> result = new ArrayList<>();
    for (Prediction prediction : predictions.values()) {
      if (gameId == null || gameId.equals(prediction.getGameId())) {
        result.add(prediction.copy());
      }
    }
    return result;
  }

  public synchronized List<Prediction> listFlagged() {
    List<Prediction> result = new ArrayList<>();
    for (Prediction prediction : predictions.values()) {
      if (prediction.isNeedsReview()) {
        result.add(prediction.copy());
      }
    }
    return result;
  }

  public synchronized Optional<Prediction> findById(String predictionId) {
    Prediction prediction = predictions.get(predictionId);
    return prediction == null ? Optional.empty() : Optional.of(prediction.copy());
  }

  // The prediction is recorded either way; a failed grade write is retried on the next create call.
  private Prediction gradeAfterCreate(Prediction prediction, Game game) {
    try {
      grade(prediction, game);
    } catch (LedgerStoreException ex) {
      LOGGER.warn("[LEDGER] prediction {} recorded but not graded: {}", prediction.getId(), ex.getMessage());
    }
    return predictions.get(prediction.getId()).copy();
  }

  private boolean grade(Prediction prediction, Game game) {
    GradingRule rule = rules.get(prediction.getKind());
    if (rule == null) {
      flag(prediction, "No grading rule registered for " + prediction.getKind());
      return false;
    }
    Optional<PredictionStatus> outcome = rule.grade(prediction, game);
    if (outcome.isEmpty() || !outcome.get().isTerminal()) {
      flag(
          prediction,
          "Pick \"" + prediction.getPick() + "\" could not be graded by the "
              + prediction.getKind() + " rule");
      return false;
    }
    applyGrade(prediction, outcome.get(), game);
    return true;
  }

  // Memory and counters change only once the store accepted the new record.
  private Prediction applyGrade(Prediction prediction, PredictionStatus status, Game game) {
    Prediction graded = prediction.copy();
    graded.setStatus(status);
    graded.setGradedAt(Instant.now().toString());
    graded.setGradedSequence(gradedSequence + 1);
    graded.setFinalHomeScore(game.getHomeScore());
    graded.setFinalAwayScore(game.getAwayScore());
    graded.setNeedsReview(false);
    graded.setReviewReason(null);
    store.save(graded);

    gradedSequence++;
    predictions.put(graded.getId(), graded);
    if (prediction.isNeedsReview()) {
      statistics.onFlagChanged(false);
    }
    statistics.onGraded(graded);
    LOGGER.info(
        "[LEDGER] prediction {} graded {} at {}-{}",
        graded.getId(),
        status,
        game.getAwayScore(),
        game.getHomeScore());
    return graded;
  }

  private void flag(Prediction prediction, String reason) {
    if (prediction.isNeedsReview()) {
      return;
    }
    Prediction flagged = prediction.copy();
    flagged.setNeedsReview(true);
    flagged.setReviewReason(reason);
    store.save(flagged);

    predictions.put(flagged.getId(), flagged);
    statistics.onFlagChanged(true);
    LOGGER.warn("[LEDGER] prediction {} left pending for review: {}", flagged.getId(), reason);
  }
}
