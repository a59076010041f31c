package com.sundayedge.live.service;

import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.Prediction;
import com.sundayedge.live.model.PredictionKind;
import com.sundayedge.live.model.PredictionStatus;
import java.util.Optional;
import org.springframework.stereotype.Component;

/** Picked side must outscore the opponent; a tie loses. */
@Component
public class MoneylineGradingRule implements GradingRule {

  @Override
  public PredictionKind kind() {
    return PredictionKind.MONEYLINE;
  }

  @Override
  public Optional<PredictionStatus> grade(Prediction prediction, Game finalGame) {
    PickedSide side = PickedSide.resolve(prediction.getPick(), finalGame);
    if (side == null) {
      return Optional.empty();
    }
    return Optional.of(
        side.score(finalGame) > side.opponentScore(finalGame)
            ? PredictionStatus.WIN
            : PredictionStatus.LOSS);
  }
}
