package com.sundayedge.live.service;

import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.Prediction;
import com.sundayedge.live.model.PredictionKind;
import com.sundayedge.live.model.PredictionStatus;
import java.util.Locale;
import java.util.Optional;
import org.springframework.stereotype.Component;

@Component
public class OverUnderGradingRule implements GradingRule {

  @Override
  public PredictionKind kind() {
    return PredictionKind.OVER_UNDER;
  }

  @Override
  public Optional<PredictionStatus> grade(Prediction prediction, Game finalGame) {
    if (prediction.getLine() == null || prediction.getPick() == null) {
      return Optional.empty();
    }
    String pick = prediction.getPick().trim().toUpperCase(Locale.ROOT);
    boolean over;
    if ("OVER".equals(pick)) {
      over = true;
    } else if ("UNDER".equals(pick)) {
      over = false;
    } else {
      return Optional.empty();
    }

    double total = finalGame.getHomeScore() + finalGame.getAwayScore();
    double line = prediction.getLine();
    if (total == line) {
      return Optional.of(PredictionStatus.PUSH);
    }
    boolean wentOver = total > line;
    return Optional.of(wentOver == over ? PredictionStatus.WIN : PredictionStatus.LOSS);
  }
}
