package com.sundayedge.live.service;

import com.sundayedge.live.model.ExternalGameEvent;
import java.util.List;

public interface ScoreboardFeed {
  /**
   * Fetches the current batch of game snapshots.
   *
   * @throws FeedUnavailableException when the feed cannot be reached, times out or returns a body
   *     that cannot be parsed; partial batches are never returned
   */
  List<ExternalGameEvent> fetchSnapshot();
}
