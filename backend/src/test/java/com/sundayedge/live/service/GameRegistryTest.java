package com.sundayedge.live.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.sundayedge.live.model.ExternalGameEvent;
import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.GameState;
import com.sundayedge.live.model.ScheduledGame;
import com.sundayedge.live.model.UpsertResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GameRegistryTest {
  private final List<Object> published = new ArrayList<>();
  private GameRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new GameRegistry(published::add, 55);
    registry.loadWindow(
        "wk1",
        List.of(
            new ScheduledGame("kc-buf", "Kansas City Chiefs", "Buffalo Bills", "2025-09-07T20:20:00Z"),
            new ScheduledGame("phi-dal", "Philadelphia Eagles", "Dallas Cowboys", "2025-09-04T00:20:00Z")),
        Set.of());
  }

  @Test
  void loadWindowBuildsScheduledGamesWithBaselineProbability() {
    List<Game> games = registry.listAll();

    assertThat(games).extracting(Game::getId).containsExactly("wk1-kc-buf", "wk1-phi-dal");
    Game game = games.get(0);
    assertThat(game.getState()).isEqualTo(GameState.SCHEDULED);
    assertThat(game.getHomeScore()).isZero();
    assertThat(game.getAwayScore()).isZero();
    assertThat(game.getHomeWinProbability()).isEqualTo(55);
    assertThat(game.getAwayWinProbability()).isEqualTo(45);
    assertThat(registry.getWindowId()).isEqualTo("wk1");
  }

  @Test
  void regressiveScoreWhileLiveIsRejectedAndHeldScoreKept() {
    registry.upsertFromExternal(
        "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", 14, 7, "In Progress"));

    UpsertResult result =
        registry.upsertFromExternal(
            "wk1-kc-buf",
            new ExternalGameEvent(
                "Kansas City Chiefs", "Buffalo Bills", 10, 7, "Final", 4, false, "0:00"));

    assertThat(result.getOutcome()).isEqualTo(UpsertResult.Outcome.SCORE_REJECTED);
    Game game = registry.findById("wk1-kc-buf").orElseThrow();
    assertThat(game.getHomeScore()).isEqualTo(14);
    assertThat(game.getAwayScore()).isEqualTo(7);
    assertThat(game.getState()).isEqualTo(GameState.LIVE);
    assertThat(game.getPeriod()).isEqualTo(4);
    assertThat(registry.publishPendingFinalizations()).isEmpty();
  }

  @Test
  void negativeScoreIsRejectedEvenBeforeKickoff() {
    UpsertResult result =
        registry.upsertFromExternal(
            "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", -3, 0, "In Progress"));

    assertThat(result.isRejected()).isTrue();
    assertThat(registry.findById("wk1-kc-buf").orElseThrow().getState())
        .isEqualTo(GameState.SCHEDULED);
  }

  @Test
  void finalGameIsFrozen() {
    registry.upsertFromExternal(
        "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", 24, 14, "Final"));

    UpsertResult result =
        registry.upsertFromExternal(
            "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", 31, 14, "In Progress"));

    assertThat(result.getOutcome()).isEqualTo(UpsertResult.Outcome.IGNORED_FINAL);
    Game game = registry.findById("wk1-kc-buf").orElseThrow();
    assertThat(game.getHomeScore()).isEqualTo(24);
    assertThat(game.getState()).isEqualTo(GameState.FINAL);
    assertThat(game.getFinalizedAt()).isNotNull();
    assertThat(game.getHomeWinProbability()).isEqualTo(100);
    assertThat(game.getConfidenceLabel()).isEqualTo("Final");
  }

  @Test
  void stateNeverMovesBackward() {
    registry.upsertFromExternal(
        "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", 3, 0, "In Progress"));

    UpsertResult result =
        registry.upsertFromExternal(
            "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", 3, 0, "Scheduled"));

    assertThat(result.getNewState()).isEqualTo(GameState.LIVE);
    assertThat(registry.findById("wk1-kc-buf").orElseThrow().getState()).isEqualTo(GameState.LIVE);
  }

  @Test
  void finalizationIsPublishedOnlyWhenDrained() {
    UpsertResult result =
        registry.upsertFromExternal(
            "wk1-phi-dal", ExternalGameEvent.of("Philadelphia Eagles", "Dallas Cowboys", 20, 20, "Final"));

    assertThat(result.isFinalized()).isTrue();
    assertThat(published).isEmpty();
    assertThat(registry.publishPendingFinalizations()).containsExactly("wk1-phi-dal");
    assertThat(published).hasSize(1);
    assertThat(((GameFinalizedEvent) published.get(0)).getGameId()).isEqualTo("wk1-phi-dal");
    assertThat(registry.publishPendingFinalizations()).isEmpty();
    assertThat(registry.findById("wk1-phi-dal").orElseThrow().getHomeWinProbability()).isEqualTo(50);
  }

  @Test
  void failedFinalizationListenerKeepsGameQueued() {
    List<String> handled = new ArrayList<>();
    boolean[] failing = {true};
    GameRegistry flaky =
        new GameRegistry(
            event -> {
              String gameId = ((GameFinalizedEvent) event).getGameId();
              if (failing[0] && gameId.equals("wk1-kc-buf")) {
                throw new LedgerStoreException("disk full");
              }
              handled.add(gameId);
            },
            55);
    flaky.loadWindow(
        "wk1",
        List.of(
            new ScheduledGame("kc-buf", "Kansas City Chiefs", "Buffalo Bills", null),
            new ScheduledGame("phi-dal", "Philadelphia Eagles", "Dallas Cowboys", null)),
        Set.of());
    flaky.upsertFromExternal(
        "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", 24, 14, "Final"));
    flaky.upsertFromExternal(
        "wk1-phi-dal", ExternalGameEvent.of("Philadelphia Eagles", "Dallas Cowboys", 20, 17, "Final"));

    assertThat(flaky.publishPendingFinalizations()).containsExactly("wk1-phi-dal");
    assertThat(flaky.hasPendingFinalizations()).isTrue();

    failing[0] = false;
    assertThat(flaky.publishPendingFinalizations()).containsExactly("wk1-kc-buf");
    assertThat(flaky.hasPendingFinalizations()).isFalse();
    assertThat(handled).containsExactly("wk1-phi-dal", "wk1-kc-buf");
  }

  @Test
  void absentFieldsKeepHeldValues() {
    registry.upsertFromExternal(
        "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", 7, 3, "In Progress"));

    registry.upsertFromExternal(
        "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", null, 10, "In Progress"));

    Game game = registry.findById("wk1-kc-buf").orElseThrow();
    assertThat(game.getHomeScore()).isEqualTo(7);
    assertThat(game.getAwayScore()).isEqualTo(10);
  }

  @Test
  void unknownGameIsReportedAndNothingIsCreated() {
    UpsertResult result =
        registry.upsertFromExternal(
            "wk1-nope", ExternalGameEvent.of("Detroit Lions", "Green Bay Packers", 7, 0, "In Progress"));

    assertThat(result.getOutcome()).isEqualTo(UpsertResult.Outcome.UNKNOWN_GAME);
    assertThat(registry.listAll()).hasSize(2);
  }

  @Test
  void winProbabilityFollowsScoreAndPeriodWithinBounds() {
    registry.upsertFromExternal(
        "wk1-kc-buf",
        new ExternalGameEvent("Kansas City Chiefs", "Buffalo Bills", 7, 0, "In Progress", 1, false, "10:00"));
    Game early = registry.findById("wk1-kc-buf").orElseThrow();
    assertThat(early.getHomeWinProbability()).isEqualTo(74);

    registry.upsertFromExternal(
        "wk1-kc-buf",
        new ExternalGameEvent("Kansas City Chiefs", "Buffalo Bills", 35, 0, "In Progress", 4, false, "2:00"));
    Game late = registry.findById("wk1-kc-buf").orElseThrow();
    assertThat(late.getHomeWinProbability()).isEqualTo(95);
    assertThat(late.getAwayWinProbability()).isEqualTo(5);
    assertThat(late.getConfidenceLabel()).isEqualTo("High");
  }

  @Test
  void classifiesStatusText() {
    assertThat(GameRegistry.classifyStatus("Final/OT")).isEqualTo(GameState.FINAL);
    assertThat(GameRegistry.classifyStatus("In Progress")).isEqualTo(GameState.LIVE);
    assertThat(GameRegistry.classifyStatus("Halftime")).isEqualTo(GameState.LIVE);
    assertThat(GameRegistry.classifyStatus("End of 3rd Quarter")).isEqualTo(GameState.LIVE);
    assertThat(GameRegistry.classifyStatus("Scheduled")).isEqualTo(GameState.SCHEDULED);
    assertThat(GameRegistry.classifyStatus(null)).isEqualTo(GameState.SCHEDULED);
  }

  @Test
  void reloadKeepsSameGamesAndCarriesRetainedOnes() {
    registry.upsertFromExternal(
        "wk1-kc-buf", ExternalGameEvent.of("Kansas City Chiefs", "Buffalo Bills", 3, 0, "In Progress"));

    List<Game> games =
        registry.loadWindow(
            "wk1",
            List.of(new ScheduledGame("kc-buf", "Kansas City Chiefs", "Buffalo Bills", null)),
            Set.of());
    assertThat(games).extracting(Game::getId).containsExactly("wk1-kc-buf");
    assertThat(games.get(0).getHomeScore()).isEqualTo(3);

    games =
        registry.loadWindow(
            "wk2",
            List.of(new ScheduledGame(null, "Detroit Lions", "Green Bay Packers", null)),
            Set.of("wk1-kc-buf"));
    assertThat(games).extracting(Game::getId).containsExactly("wk2-1", "wk1-kc-buf");
    assertThat(registry.allFinal()).isFalse();
  }

  @Test
  void allFinalIsFalseForEmptyWindow() {
    registry.loadWindow("empty", List.of(), Set.of());

    assertThat(registry.allFinal()).isFalse();
  }

  @Test
  void scoresNeverDecreaseOverRandomSnapshotSequences() {
    Random random = new Random(20250907L);
    String[] statuses = {"Scheduled", "In Progress", "Halftime", "In Progress", "Final"};
    for (int run = 0; run < 200; run++) {
      GameRegistry fresh = new GameRegistry(event -> {}, 55);
      fresh.loadWindow(
          "r", List.of(new ScheduledGame("g", "Home Team", "Away Team", null)), Set.of());
      int home = 0;
      int away = 0;
      GameState state = GameState.SCHEDULED;
      for (int step = 0; step < 25; step++) {
        ExternalGameEvent snapshot =
            ExternalGameEvent.of(
                "Home Team",
                "Away Team",
                random.nextInt(50) - 3,
                random.nextInt(50) - 3,
                statuses[random.nextInt(statuses.length)]);
        fresh.upsertFromExternal("r-g", snapshot);
        Game game = fresh.findById("r-g").orElseThrow();
        if (state == GameState.LIVE) {
          assertThat(game.getHomeScore()).isGreaterThanOrEqualTo(home);
          assertThat(game.getAwayScore()).isGreaterThanOrEqualTo(away);
        }
        if (state == GameState.FINAL) {
          assertThat(game.getHomeScore()).isEqualTo(home);
          assertThat(game.getAwayScore()).isEqualTo(away);
        }
        assertThat(game.getState().isBefore(state)).isFalse();
        assertThat(game.getHomeScore()).isNotNegative();
        assertThat(game.getAwayScore()).isNotNegative();
        home = game.getHomeScore();
        away = game.getAwayScore();
        state = game.getState();
      }
    }
  }
}
