package com.sundayedge.live.model;

import java.util.ArrayList;
import java.util.List;

public class ReconciliationReport {
  private long cycle;
  private String startedAt;
  private String finishedAt;
  private boolean failed;
  private String failureMessage;
  private int fetched;
  private int matchedExact;
  private int matchedPartial;
  private int skippedUnmatched;
  private int skippedAmbiguous;
  private int skippedMalformed;
  private List<String> rejectedUpdates = new ArrayList<>();
  private List<String> finalizedGameIds = new ArrayList<>();

  public ReconciliationReport() {}

  public ReconciliationReport(long cycle, String startedAt) {
    this.cycle = cycle;
    this.startedAt = startedAt;
  }

  public void markFailed(String message, String finishedAt) {
    this.failed = true;
    this.failureMessage = message;
    this.finishedAt = finishedAt;
  }

  public void recordMatch(MatchResult.Kind kind) {
    switch (kind) {
      case EXACT:
        matchedExact++;
        break;
      case PARTIAL:
        matchedPartial++;
        break;
      case AMBIGUOUS:
        skippedAmbiguous++;
        break;
      default:
        skippedUnmatched++;
        break;
    }
  }

  public void recordMalformed() {
    skippedMalformed++;
  }

  public void recordRejected(String gameId, String reason) {
    rejectedUpdates.add(gameId + ": " + reason);
  }

  public int getMatched() {
    return matchedExact + matchedPartial;
  }

  public long getCycle() {
    return cycle;
  }

  public void setCycle(long cycle) {
    this.cycle = cycle;
  }

  public String getStartedAt() {
    return startedAt;
  }

  public void setStartedAt(String startedAt) {
    this.startedAt = startedAt;
  }

  public String getFinishedAt() {
    return finishedAt;
  }

  public void setFinishedAt(String finishedAt) {
    this.finishedAt = finishedAt;
  }

  public boolean isFailed() {
    return failed;
  }

  public void setFailed(boolean failed) {
    this.failed = failed;
  }

  public String getFailureMessage() {
    return failureMessage;
  }

  public void setFailureMessage(String failureMessage) {
    this.failureMessage = failureMessage;
  }

  public int getFetched() {
    return fetched;
  }

  public void setFetched(int fetched) {
    this.fetched = fetched;
  }

  public int getMatchedExact() {
    return matchedExact;
  }

  public void setMatchedExact(int matchedExact) {
    this.matchedExact = matchedExact;
  }

  public int getMatchedPartial() {
    return matchedPartial;
  }

  public void setMatchedPartial(int matchedPartial) {
    this.matchedPartial = matchedPartial;
  }

  public int getSkippedUnmatched() {
    return skippedUnmatched;
  }

  public void setSkippedUnmatched(int skippedUnmatched) {
    this.skippedUnmatched = skippedUnmatched;
  }

  public int getSkippedAmbiguous() {
    return skippedAmbiguous;
  }

  public void setSkippedAmbiguous(int skippedAmbiguous) {
    this.skippedAmbiguous = skippedAmbiguous;
  }

  public int getSkippedMalformed() {
    return skippedMalformed;
  }

  public void setSkippedMalformed(int skippedMalformed) {
    this.skippedMalformed = skippedMalformed;
  }

  public List<String> getRejectedUpdates() {
    return rejectedUpdates;
  }

  public void setRejectedUpdates(List<String> rejectedUpdates) {
    this.rejectedUpdates = rejectedUpdates;
  }

  public List<String> getFinalizedGameIds() {
    return finalizedGameIds;
  }

  public void setFinalizedGameIds(List<String> finalizedGameIds) {
    this.finalizedGameIds = finalizedGameIds;
  }
}
