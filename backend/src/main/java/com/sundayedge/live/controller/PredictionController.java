package com.sundayedge.live.controller;

import com.sundayedge.live.model.LedgerStatistics;
import com.sundayedge.live.model.Prediction;
import com.sundayedge.live.model.PredictionRequest;
import com.sundayedge.live.model.PredictionStatus;
import com.sundayedge.live.service.LedgerStoreException;
import com.sundayedge.live.service.PredictionLedger;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@CrossOrigin(origins = "http://localhost:5173")
public class PredictionController {
  private final PredictionLedger predictionLedger;

  public PredictionController(PredictionLedger predictionLedger) {
    this.predictionLedger = predictionLedger;
  }

  @PostMapping("/api/predictions")
  public Map<String, Object> createPrediction(@RequestBody PredictionRequest request) {
    if (request == null) {
      return Map.of("status", "FAILED", "message", "No prediction submitted");
    }
    try {
      Prediction prediction =
          predictionLedger.createPrediction(
              request.getGameId(), request.getKind(), request.getPayload());
      return Map.of("status", "OK", "prediction", prediction);
    } catch (IllegalArgumentException | LedgerStoreException ex) {
      return Map.of("status", "FAILED", "message", String.valueOf(ex.getMessage()));
    }
  }

  @GetMapping("/api/predictions")
  public List<Prediction> predictions(
      @RequestParam(name = "gameId", required = false) String gameId) {
    return predictionLedger.listPredictions(gameId == null || gameId.isBlank() ? null : gameId);
  }

  @GetMapping("/api/predictions/review")
  public List<Prediction> flaggedPredictions() {
    return predictionLedger.listFlagged();
  }

  @PostMapping("/api/predictions/{id}/resolve")
  public Map<String, Object> resolve(
      @PathVariable("id") String id, @RequestParam(name = "status") String status) {
    try {
      PredictionStatus resolved = PredictionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
      Prediction prediction = predictionLedger.resolveManually(id, resolved);
      return Map.of("status", "OK", "prediction", prediction);
    } catch (IllegalArgumentException | LedgerStoreException ex) {
      return Map.of("status", "FAILED", "message", String.valueOf(ex.getMessage()));
    }
  }

  @GetMapping("/api/predictions/statistics")
  public LedgerStatistics statistics() {
    return predictionLedger.getStatistics();
  }

  @PostMapping("/api/predictions/statistics/recalculate")
  public LedgerStatistics recalculateStatistics() {
    return predictionLedger.recalculateStatistics();
  }
}
