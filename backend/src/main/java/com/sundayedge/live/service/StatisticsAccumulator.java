package com.sundayedge.live.service;

import com.sundayedge.live.model.ConfidenceBand;
import com.sundayedge.live.model.LedgerStatistics;
import com.sundayedge.live.model.LedgerStatistics.OutcomeCounts;
import com.sundayedge.live.model.Prediction;
import com.sundayedge.live.model.PredictionKind;
import com.sundayedge.live.model.PredictionStatus;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Running ledger counters, fed one mutation at a time or rebuilt from the full set. */
final class StatisticsAccumulator {
  private final OutcomeCounts overall = new OutcomeCounts();
  private final Map<PredictionKind, OutcomeCounts> byKind = new EnumMap<>(PredictionKind.class);
  private final Map<ConfidenceBand, OutcomeCounts> byConfidence =
      new EnumMap<>(ConfidenceBand.class);
  private PredictionStatus streakStatus;
  private int streakLength;
  private int longestWinStreak;
  private int longestLossStreak;
  private int flagged;

  StatisticsAccumulator() {
    for (PredictionKind kind : PredictionKind.values()) {
      byKind.put(kind, new OutcomeCounts());
    }
    for (ConfidenceBand band : ConfidenceBand.values()) {
      byConfidence.put(band, new OutcomeCounts());
    }
  }

  static StatisticsAccumulator fromScratch(Collection<Prediction> predictions) {
    StatisticsAccumulator accumulator = new StatisticsAccumulator();
    List<Prediction> graded = new ArrayList<>();
    for (Prediction prediction : predictions) {
      accumulator.count(prediction, prediction.getStatus());
      if (prediction.isNeedsReview()) {
        accumulator.flagged++;
      }
      if (prediction.getStatus().isTerminal()) {
        graded.add(prediction);
      }
    }
    graded.sort(Comparator.comparingLong(Prediction::getGradedSequence));
    for (Prediction prediction : graded) {
      accumulator.extendStreak(prediction.getStatus());
    }
    return accumulator;
  }

  void onCreated(Prediction prediction) {
    count(prediction, PredictionStatus.PENDING);
  }

  void onGraded(Prediction prediction) {
    PredictionStatus status = prediction.getStatus();
    overall.move(PredictionStatus.PENDING, status);
    byKind.get(prediction.getKind()).move(PredictionStatus.PENDING, status);
    byConfidence.get(prediction.getConfidenceBand()).move(PredictionStatus.PENDING, status);
    extendStreak(status);
  }

  void onFlagChanged(boolean flaggedNow) {
    flagged += flaggedNow ? 1 : -1;
  }

  LedgerStatistics snapshot() {
    Map<PredictionKind, OutcomeCounts> kinds = new LinkedHashMap<>();
    byKind.forEach((kind, counts) -> kinds.put(kind, counts.copy()));
    Map<ConfidenceBand, OutcomeCounts> bands = new LinkedHashMap<>();
    byConfidence.forEach((band, counts) -> bands.put(band, counts.copy()));
    return new LedgerStatistics(
        overall.copy(),
        kinds,
        bands,
        streakStatus,
        streakLength,
        longestWinStreak,
        longestLossStreak,
        flagged);
  }

  private void count(Prediction prediction, PredictionStatus status) {
    overall.add(status);
    byKind.get(prediction.getKind()).add(status);
    byConfidence.get(prediction.getConfidenceBand()).add(status);
  }

  // Pushes neither extend nor break a streak.
  private void extendStreak(PredictionStatus status) {
    if (status != PredictionStatus.WIN && status != PredictionStatus.LOSS) {
      return;
    }
    if (status == streakStatus) {
      streakLength++;
    } else {
      streakStatus = status;
      streakLength = 1;
    }
    if (status == PredictionStatus.WIN) {
      longestWinStreak = Math.max(longestWinStreak, streakLength);
    } else {
      longestLossStreak = Math.max(longestLossStreak, streakLength);
    }
  }
}
