package com.sundayedge.live.service;

import com.sundayedge.live.model.ReconciliationReport;
import com.sundayedge.live.model.SchedulerState;
import com.sundayedge.live.model.SchedulerStatus;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Drives reconciliation cycles one at a time. A tick or manual trigger that arrives while a cycle
 * is in flight is folded into a single follow-up run instead of running concurrently.
 */
@Service
public class UpdateScheduler {
  private static final Logger LOGGER = LoggerFactory.getLogger(UpdateScheduler.class);

  private final FeedReconciler feedReconciler;
  private final GameRegistry gameRegistry;
  private final boolean autoStart;
  private final ReentrantLock cycleLock = new ReentrantLock();
  private final AtomicBoolean manualPending = new AtomicBoolean(false);
  private final AtomicBoolean tickPending = new AtomicBoolean(false);
  private final AtomicBoolean cycleRunning = new AtomicBoolean(false);
  private final AtomicBoolean windowComplete = new AtomicBoolean(false);
  private final AtomicReference<SchedulerState> state;
  private final AtomicReference<ReconciliationReport> lastReport = new AtomicReference<>();
  private final AtomicLong completedCycles = new AtomicLong();

  public UpdateScheduler(
      FeedReconciler feedReconciler,
      GameRegistry gameRegistry,
      @Value("${sundayedge.scheduler.auto-start:true}") boolean autoStart) {
    this.feedReconciler = feedReconciler;
    this.gameRegistry = gameRegistry;
    this.autoStart = autoStart;
    this.state = new AtomicReference<>(autoStart ? SchedulerState.RUNNING : SchedulerState.IDLE);
  }

  @Scheduled(
      fixedDelayString = "${sundayedge.scheduler.poll-interval-ms:30000}",
      initialDelayString = "${sundayedge.scheduler.initial-delay-ms:10000}")
  public void tick() {
    if (state.get() != SchedulerState.RUNNING) {
      return;
    }
    tickPending.set(true);
    runPendingCycles("tick");
  }

  /**
   * Runs a reconciliation cycle now, whatever the scheduler state.
   *
   * @return the report of the last cycle run by this call, or empty when the request was coalesced
   *     into a cycle already in flight
   */
  public Optional<ReconciliationReport> triggerNow() {
    manualPending.set(true);
    return runPendingCycles("manual");
  }

  public void start() {
    SchedulerState previous = state.getAndSet(SchedulerState.RUNNING);
    if (previous != SchedulerState.RUNNING) {
      LOGGER.info("[SCHEDULER] IDLE -> RUNNING");
    }
  }

  /**
   * Stops future ticks and drops a tick queued behind the running cycle. A cycle already in flight
   * runs to completion, and a queued manual trigger still runs.
   */
  public void stop() {
    SchedulerState previous = state.getAndSet(SchedulerState.IDLE);
    tickPending.set(false);
    if (previous != SchedulerState.IDLE) {
      LOGGER.info(
          "[SCHEDULER] RUNNING -> IDLE{}",
          cycleRunning.get() ? " (in-flight cycle will complete)" : "");
    }
  }

  public void onWindowLoaded(String windowId) {
    windowComplete.set(false);
    if (autoStart) {
      start();
    }
    LOGGER.info("[SCHEDULER] window {} loaded, state={}", windowId, state.get());
  }

  /**
   * Runs {@code action} with no reconciliation cycle in flight, waiting for a running one. Requests
   * that arrived meanwhile run right after it.
   */
  public <T> T runExclusive(Supplier<T> action) {
    T result;
    cycleLock.lock();
    try {
      result = action.get();
    } finally {
      cycleLock.unlock();
    }
    runPendingCycles("deferred");
    return result;
  }

  public SchedulerStatus getStatus() {
    return new SchedulerStatus(
        state.get(),
        cycleRunning.get(),
        manualPending.get() || tickPending.get(),
        windowComplete.get(),
        completedCycles.get(),
        lastReport.get());
  }

  public SchedulerState getState() {
    return state.get();
  }

  private Optional<ReconciliationReport> runPendingCycles(String source) {
    ReconciliationReport last = null;
    while (hasRunnableRequest()) {
      if (!cycleLock.tryLock()) {
        LOGGER.info("[SCHEDULER] cycle in flight, {} request coalesced", source);
        return Optional.ofNullable(last);
      }
      try {
        boolean manual = manualPending.getAndSet(false);
        boolean tick = tickPending.getAndSet(false);
        if (manual || (tick && state.get() == SchedulerState.RUNNING)) {
          last = runCycle(manual ? "manual" : "tick");
        }
      } finally {
        cycleLock.unlock();
      }
    }
    return Optional.ofNullable(last);
  }

  // Queued ticks only count while polling is on.
  private boolean hasRunnableRequest() {
    return manualPending.get() || (tickPending.get() && state.get() == SchedulerState.RUNNING);
  }

  private ReconciliationReport runCycle(String source) {
    ReconciliationReport report;
    cycleRunning.set(true);
    try {
      report = feedReconciler.reconcile();
    } finally {
      cycleRunning.set(false);
    }
    lastReport.set(report);
    completedCycles.incrementAndGet();
    LOGGER.debug("[SCHEDULER] {} cycle {} done failed={}", source, report.getCycle(), report.isFailed());
    if (report.isFailed() || !gameRegistry.allFinal() || gameRegistry.hasPendingFinalizations()) {
      return report;
    }
    windowComplete.set(true);
    if (state.compareAndSet(SchedulerState.RUNNING, SchedulerState.IDLE)) {
      tickPending.set(false);
      LOGGER.info(
          "[SCHEDULER] all games of window {} final, polling stopped until a new window loads",
          gameRegistry.getWindowId());
    }
    return report;
  }
}
