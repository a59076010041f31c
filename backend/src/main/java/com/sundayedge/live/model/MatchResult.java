package com.sundayedge.live.model;

import java.util.List;

public final class MatchResult {
  public enum Kind {
    EXACT,
    PARTIAL,
    AMBIGUOUS,
    NONE
  }

  private final Kind kind;
  private final String gameId;
  private final List<String> candidateIds;

  private MatchResult(Kind kind, String gameId, List<String> candidateIds) {
    this.kind = kind;
    this.gameId = gameId;
    this.candidateIds = candidateIds;
  }

  public static MatchResult exact(String gameId) {
    return new MatchResult(Kind.EXACT, gameId, List.of(gameId));
  }

  public static MatchResult partial(String gameId) {
    return new MatchResult(Kind.PARTIAL, gameId, List.of(gameId));
  }

  public static MatchResult ambiguous(List<String> candidateIds) {
    return new MatchResult(Kind.AMBIGUOUS, null, List.copyOf(candidateIds));
  }

  public static MatchResult none() {
    return new MatchResult(Kind.NONE, null, List.of());
  }

  public Kind getKind() {
    return kind;
  }

  public boolean isMatched() {
    return kind == Kind.EXACT || kind == Kind.PARTIAL;
  }

  public String getGameId() {
    return gameId;
  }

  public List<String> getCandidateIds() {
    return candidateIds;
  }
}
