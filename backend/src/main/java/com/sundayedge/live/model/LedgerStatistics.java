package com.sundayedge.live.model;

import java.util.Map;
import java.util.Objects;

public class LedgerStatistics {
  private OutcomeCounts overall;
  private Map<PredictionKind, OutcomeCounts> byKind;
  private Map<ConfidenceBand, OutcomeCounts> byConfidence;
  private PredictionStatus currentStreakStatus;
  private int currentStreakLength;
  private int longestWinStreak;
  private int longestLossStreak;
  private int flaggedForReview;

  public LedgerStatistics() {}

  public LedgerStatistics(
      OutcomeCounts overall,
      Map<PredictionKind, OutcomeCounts> byKind,
      Map<ConfidenceBand, OutcomeCounts> byConfidence,
      PredictionStatus currentStreakStatus,
      int currentStreakLength,
      int longestWinStreak,
      int longestLossStreak,
      int flaggedForReview) {
    this.overall = overall;
    this.byKind = byKind;
    this.byConfidence = byConfidence;
    this.currentStreakStatus = currentStreakStatus;
    this.currentStreakLength = currentStreakLength;
    this.longestWinStreak = longestWinStreak;
    this.longestLossStreak = longestLossStreak;
    this.flaggedForReview = flaggedForReview;
  }

  public OutcomeCounts getOverall() {
    return overall;
  }

  public void setOverall(OutcomeCounts overall) {
    this.overall = overall;
  }

  public Map<PredictionKind, OutcomeCounts> getByKind() {
    return byKind;
  }

  public void setByKind(Map<PredictionKind, OutcomeCounts> byKind) {
    this.byKind = byKind;
  }

  public Map<ConfidenceBand, OutcomeCounts> getByConfidence() {
    return byConfidence;
  }

  public void setByConfidence(Map<ConfidenceBand, OutcomeCounts> byConfidence) {
    this.byConfidence = byConfidence;
  }

  public PredictionStatus getCurrentStreakStatus() {
    return currentStreakStatus;
  }

  public void setCurrentStreakStatus(PredictionStatus currentStreakStatus) {
    this.currentStreakStatus = currentStreakStatus;
  }

  public int getCurrentStreakLength() {
    return currentStreakLength;
  }

  public void setCurrentStreakLength(int currentStreakLength) {
    this.currentStreakLength = currentStreakLength;
  }

  public int getLongestWinStreak() {
    return longestWinStreak;
  }

  public void setLongestWinStreak(int longestWinStreak) {
    this.longestWinStreak = longestWinStreak;
  }

  public int getLongestLossStreak() {
    return longestLossStreak;
  }

  public void setLongestLossStreak(int longestLossStreak) {
    this.longestLossStreak = longestLossStreak;
  }

  public int getFlaggedForReview() {
    return flaggedForReview;
  }

  public void setFlaggedForReview(int flaggedForReview) {
    this.flaggedForReview = flaggedForReview;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LedgerStatistics)) {
      return false;
    }
    LedgerStatistics that = (LedgerStatistics) o;
    return currentStreakLength == that.currentStreakLength
        && longestWinStreak == that.longestWinStreak
        && longestLossStreak == that.longestLossStreak
        && flaggedForReview == that.flaggedForReview
        && currentStreakStatus == that.currentStreakStatus
        && Objects.equals(overall, that.overall)
        && Objects.equals(byKind, that.byKind)
        && Objects.equals(byConfidence, that.byConfidence);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        overall,
        byKind,
        byConfidence,
        currentStreakStatus,
        currentStreakLength,
        longestWinStreak,
        longestLossStreak,
        flaggedForReview);
  }

  public static class OutcomeCounts {
    private int total;
    private int wins;
    private int losses;
    private int pushes;
    private int pending;

    public OutcomeCounts() {}

    public OutcomeCounts(int total, int wins, int losses, int pushes, int pending) {
      this.total = total;
      this.wins = wins;
      this.losses = losses;
      this.pushes = pushes;
      this.pending = pending;
    }

    public OutcomeCounts copy() {
      return new OutcomeCounts(total, wins, losses, pushes, pending);
    }

    public void add(PredictionStatus status) {
      total++;
      adjust(status, 1);
    }

    public void move(PredictionStatus from, PredictionStatus to) {
      adjust(from, -1);
      adjust(to, 1);
    }

    private void adjust(PredictionStatus status, int delta) {
      switch (status) {
        case WIN:
          wins += delta;
          break;
        case LOSS:
          losses += delta;
          break;
        case PUSH:
          pushes += delta;
          break;
        default:
          pending += delta;
          break;
      }
    }

    /** Wins over decided predictions; pushes and pending ones are left out. */
    public double getWinRate() {
      int decided = wins + losses;
      if (decided == 0) {
        return 0d;
      }
      return Math.round((double) wins / decided * 10000d) / 100d;
    }

    public int getTotal() {
      return total;
    }

    public void setTotal(int total) {
      this.total = total;
    }

    public int getWins() {
      return wins;
    }

    public void setWins(int wins) {
      this.wins = wins;
    }

    public int getLosses() {
      return losses;
    }

    public void setLosses(int losses) {
      this.losses = losses;
    }

    public int getPushes() {
      return pushes;
    }

    public void setPushes(int pushes) {
      this.pushes = pushes;
    }

    public int getPending() {
      return pending;
    }

    public void setPending(int pending) {
      this.pending = pending;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (!(o instanceof OutcomeCounts)) {
        return false;
      }
      OutcomeCounts that = (OutcomeCounts) o;
      return total == that.total
          && wins == that.wins
          && losses == that.losses
          && pushes == that.pushes
          && pending == that.pending;
    }

    @Override
    public int hashCode() {
      return Objects.hash(total, wins, losses, pushes, pending);
    }
  }
}
