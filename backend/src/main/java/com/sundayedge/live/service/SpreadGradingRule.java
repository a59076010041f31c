package com.sundayedge.live.service;

import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.Prediction;
import com.sundayedge.live.model.PredictionKind;
import com.sundayedge.live.model.PredictionStatus;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Picked side's score plus the line against the opponent's score; level is a push. */
@Component
public class SpreadGradingRule implements GradingRule {

  @Override
  public PredictionKind kind() {
    return PredictionKind.SPREAD;
  }

  @Override
  public Optional<PredictionStatus> grade(Prediction prediction, Game finalGame) {
    PickedSide side = PickedSide.resolve(prediction.getPick(), finalGame);
    if (side == null || prediction.getLine() == null) {
      return Optional.empty();
    }
    double adjusted = side.score(finalGame) + prediction.getLine();
    int opponent = side.opponentScore(finalGame);
    if (adjusted > opponent) {
      return Optional.of(PredictionStatus.WIN);
    }
    if (adjusted < opponent) {
      return Optional.of(PredictionStatus.LOSS);
    }
    return Optional.of(PredictionStatus.PUSH);
  }
}
