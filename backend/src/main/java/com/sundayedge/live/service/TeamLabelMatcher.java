package com.sundayedge.live.service;

import com.sundayedge.live.model.ExternalGameEvent;
import com.sundayedge.live.model.Game;
import com.sundayedge.live.model.MatchResult;
import java.text.Normalizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Pairs feed events with tracked games by team labels. An exact pairing wins over partial ones;
 * more than one candidate at the deciding level is reported as ambiguous and never guessed.
 */
@Component
public class TeamLabelMatcher {

  public MatchResult match(ExternalGameEvent event, Collection<Game> games) {
    String home = normalizeName(event.getHomeTeamLabel());
    String away = normalizeName(event.getAwayTeamLabel());
    if (home.isBlank() || away.isBlank()) {
      return MatchResult.none();
    }

    List<String> exact = new ArrayList<>();
    List<String> partial = new ArrayList<>();
    for (Game game : games) {
      String gameHome = normalizeName(game.getHomeTeam());
      String gameAway = normalizeName(game.getAwayTeam());
      if (home.equals(gameHome) && away.equals(gameAway)) {
        exact.add(game.getId());
      } else if (related(home, gameHome) && related(away, gameAway)) {
        partial.add(game.getId());
      }
    }

    if (exact.size() == 1) {
      return MatchResult.exact(exact.get(0));
    }
    if (exact.size() > 1) {
      return MatchResult.ambiguous(exact);
    }
    if (partial.size() == 1) {
      return MatchResult.partial(partial.get(0));
    }
    if (partial.size() > 1) {
      return MatchResult.ambiguous(partial);
    }
    return MatchResult.none();
  }

  /** True when two team labels name the same side: equal, or one contained in the other. */
  public static boolean labelsRelated(String left, String right) {
    return related(normalizeName(left), normalizeName(right));
  }

  private static boolean related(String left, String right) {
    if (left.isBlank() || right.isBlank()) {
      return false;
    }
    return left.equals(right) || left.contains(right) || right.contains(left);
  }

  public static String normalizeName(String input) {
    if (input == null) {
      return "";
    }
    String noAccents =
        Normalizer.normalize(input, Normalizer.Form.NFD)
            .replaceAll("\\p{InCombiningDiacriticalMarks}+", "");
    String normalized = noAccents.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", " ").trim();
    normalized = normalized.replaceAll("\\bthe\\b", " ");
    return normalized.replaceAll("\\s{2,}", " ").trim();
  }
}
