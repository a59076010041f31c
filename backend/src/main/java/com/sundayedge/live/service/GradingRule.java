package com.sundayedge.live.service;

import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.Prediction;
import com.sundayedge.live.model.PredictionKind;
import com.sundayedge.live.model.PredictionStatus;
import java.util.Optional;

public interface GradingRule {
  PredictionKind kind();

  /**
   * Grades a prediction against its final game. An empty result means the pick could not be
   * resolved; the ledger then keeps the prediction pending and flags it for review.
   */
  Optional<PredictionStatus> grade(Prediction prediction, Game finalGame);
}
