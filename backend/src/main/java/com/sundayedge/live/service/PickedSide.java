package com.sundayedge.live.service;

import com.sundayedge.live.model.Game;

enum PickedSide {
  HOME,
  AWAY;

  int score(Game game) {
    return this == HOME ? game.getHomeScore() : game.getAwayScore();
  }

  int opponentScore(Game game) {
    return this == HOME ? game.getAwayScore() : game.getHomeScore();
  }

  /** Resolves a team pick to a side, or null when it names neither or both teams. */
  static PickedSide resolve(String pick, Game game) {
    if (pick == null || pick.isBlank()) {
      return null;
    }
    String normalized = TeamLabelMatcher.normalizeName(pick);
    if (normalized.equals(TeamLabelMatcher.normalizeName(game.getHomeTeam()))) {
      return HOME;
    }
    if (normalized.equals(TeamLabelMatcher.normalizeName(game.getAwayTeam()))) {
      return AWAY;
    }
    if ("home".equals(normalized)) {
      return HOME;
    }
    if ("away".equals(normalized)) {
      return AWAY;
    }
    boolean home = TeamLabelMatcher.labelsRelated(pick, game.getHomeTeam());
    boolean away = TeamLabelMatcher.labelsRelated(pick, game.getAwayTeam());
    if (home == away) {
      return null;
    }
    return home ? HOME : AWAY;
  }
}
