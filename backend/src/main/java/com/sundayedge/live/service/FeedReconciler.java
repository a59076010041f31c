package com.sundayedge.live.service;

import com.sundayedge.live.model.ExternalGameEvent;
import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.MatchResult;
import com.sundayedge.live.model.ReconciliationReport;
import com.sundayedge.live.model.UpsertResult;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class FeedReconciler {
  private static final Logger LOGGER = LoggerFactory.getLogger(FeedReconciler.class);

  private final ScoreboardFeed scoreboardFeed;
  private final GameRegistry gameRegistry;
  private final TeamLabelMatcher matcher;
  private final AtomicLong cycleCounter = new AtomicLong();

  public FeedReconciler(
      ScoreboardFeed scoreboardFeed, GameRegistry gameRegistry, TeamLabelMatcher matcher) {
    this.scoreboardFeed = scoreboardFeed;
    this.gameRegistry = gameRegistry;
    this.matcher = matcher;
  }

  /**
   * Runs one reconciliation cycle. Every matched update of the batch is applied before any
   * finalization is published, and a failed fetch leaves the registry untouched.
   */
  public ReconciliationReport reconcile() {
    long cycle = cycleCounter.incrementAndGet();
    ReconciliationReport report = new ReconciliationReport(cycle, Instant.now().toString());

    List<ExternalGameEvent> events;
    try {
      events = scoreboardFeed.fetchSnapshot();
    } catch (FeedUnavailableException ex) {
      LOGGER.warn("[RECONCILE] cycle={} feed unavailable: {}", cycle, ex.getMessage());
      report.markFailed(ex.getMessage(), Instant.now().toString());
      return report;
    } catch (RuntimeException ex) {
      LOGGER.warn("[RECONCILE] cycle={} feed fetch failed", cycle, ex);
      report.markFailed("Feed fetch failed: " + ex.getMessage(), Instant.now().toString());
      return report;
    }
    if (events == null) {
      report.markFailed("Feed returned no batch", Instant.now().toString());
      return report;
    }

    report.setFetched(events.size());
    List<Game> candidates = gameRegistry.listAll();
    for (ExternalGameEvent event : events) {
      if (event == null) {
        report.recordMalformed();
        continue;
      }
      try {
        reconcileEvent(cycle, event, candidates, report);
      } catch (RuntimeException ex) {
        LOGGER.warn("[RECONCILE] cycle={} outcome=skipped-malformed event={}", cycle, event, ex);
        report.recordMalformed();
      }
    }

    report.setFinalizedGameIds(gameRegistry.publishPendingFinalizations());
    report.setFinishedAt(Instant.now().toString());
    LOGGER.info(
        "[RECONCILE] cycle={} fetched={} matched={} unmatched={} ambiguous={} malformed={} rejected={} finalized={}",
        cycle,
        report.getFetched(),
        report.getMatched(),
        report.getSkippedUnmatched(),
        report.getSkippedAmbiguous(),
        report.getSkippedMalformed(),
        report.getRejectedUpdates().size(),
        report.getFinalizedGameIds().size());
    return report;
  }

  private void reconcileEvent(
      long cycle, ExternalGameEvent event, List<Game> candidates, ReconciliationReport report) {
    MatchResult match = matcher.match(event, candidates);
    report.recordMatch(match.getKind());
    switch (match.getKind()) {
      case AMBIGUOUS:
        LOGGER.warn(
            "[RECONCILE] cycle={} outcome=skipped-ambiguous home=\"{}\" away=\"{}\" candidates={}",
            cycle,
            event.getHomeTeamLabel(),
            event.getAwayTeamLabel(),
            match.getCandidateIds());
        return;
      case NONE:
        LOGGER.info(
            "[RECONCILE] cycle={} outcome=skipped-unmatched home=\"{}\" away=\"{}\"",
            cycle,
            event.getHomeTeamLabel(),
            event.getAwayTeamLabel());
        return;
      default:
        break;
    }

    UpsertResult result = gameRegistry.upsertFromExternal(match.getGameId(), event);
    LOGGER.info(
        "[RECONCILE] cycle={} outcome=matched match={} gameId={} home=\"{}\" away=\"{}\" update={} state={}",
        cycle,
        match.getKind(),
        match.getGameId(),
        event.getHomeTeamLabel(),
        event.getAwayTeamLabel(),
        result.getOutcome(),
        result.getNewState());
    if (result.isRejected()) {
      report.recordRejected(result.getGameId(), result.getReason());
    }
  }
}
