package com.sundayedge.live.model;

public class SchedulerStatus {
  private final SchedulerState state;
  private final boolean cycleInFlight;
  private final boolean rerunPending;
  private final boolean windowComplete;
  private final long completedCycles;
  private final ReconciliationReport lastReport;

  public SchedulerStatus(
      SchedulerState state,
      boolean cycleInFlight,
      boolean rerunPending,
      boolean windowComplete,
      long completedCycles,
      ReconciliationReport lastReport) {
    this.state = state;
    this.cycleInFlight = cycleInFlight;
    this.rerunPending = rerunPending;
    this.windowComplete = windowComplete;
    this.completedCycles = completedCycles;
    this.lastReport = lastReport;
  }

  public SchedulerState getState() {
    return state;
  }

  public boolean isCycleInFlight() {
    return cycleInFlight;
  }

  public boolean isRerunPending() {
    return rerunPending;
  }

  public boolean isWindowComplete() {
    return windowComplete;
  }

  public long getCompletedCycles() {
    return completedCycles;
  }

  public ReconciliationReport getLastReport() {
    return lastReport;
  }
}
