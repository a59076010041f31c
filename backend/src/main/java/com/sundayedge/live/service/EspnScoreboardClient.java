package com.sundayedge.live.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sundayedge.live.model.ExternalGameEvent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Service
public class EspnScoreboardClient implements ScoreboardFeed {
  private static final Logger LOGGER = LoggerFactory.getLogger(EspnScoreboardClient.class);
  private static final int REGULATION_PERIODS = 4;

  private final RestTemplate restTemplate;
  private final ObjectMapper objectMapper;
  private final String scoreboardUrl;

  public EspnScoreboardClient(
      RestTemplateBuilder restTemplateBuilder,
      ObjectMapper objectMapper,
      @Value("${sundayedge.feed.scoreboard-url:https://site.api.espn.com/apis/site/v2/sports/football/nfl/scoreboard}")
          String scoreboardUrl,
      @Value("${sundayedge.feed.connect-timeout-ms:5000}") long connectTimeoutMs,
      @Value("${sundayedge.feed.read-timeout-ms:10000}") long readTimeoutMs) {
    this.restTemplate =
        restTemplateBuilder
            .setConnectTimeout(Duration.ofMillis(connectTimeoutMs))
            .setReadTimeout(Duration.ofMillis(readTimeoutMs))
            .build();
    this.objectMapper = objectMapper;
    this.scoreboardUrl = scoreboardUrl;
  }

  @Override
  public List<ExternalGameEvent> fetchSnapshot() {
    String body;
    try {
      HttpHeaders headers = new HttpHeaders();
      headers.setAccept(List.of(MediaType.APPLICATION_JSON));
      HttpEntity<Void> request = new HttpEntity<>(headers);
      ResponseEntity<String> entity =
          restTemplate.exchange(scoreboardUrl, HttpMethod.GET, request, String.class);
      body = entity.getBody();
    } catch (HttpStatusCodeException ex) {
      throw new FeedUnavailableException(
          "Scoreboard returned HTTP " + ex.getStatusCode().value(), ex);
    } catch (ResourceAccessException ex) {
      throw new FeedUnavailableException("Scoreboard unreachable or timed out: " + ex.getMessage(), ex);
    } catch (RestClientException ex) {
      throw new FeedUnavailableException("Scoreboard request failed: " + ex.getMessage(), ex);
    }
    if (body == null || body.isBlank()) {
      throw new FeedUnavailableException("Scoreboard returned an empty body");
    }
    List<ExternalGameEvent> events = parse(body);
    LOGGER.debug("[FEED] fetched scoreboard events count={}", events.size());
    return events;
  }

  List<ExternalGameEvent> parse(String body) {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new FeedUnavailableException("Scoreboard body is not valid JSON", ex);
    }
    JsonNode eventsNode = root == null ? null : root.path("events");
    if (eventsNode == null || !eventsNode.isArray()) {
      throw new FeedUnavailableException("Scoreboard body has no events array");
    }

    List<ExternalGameEvent> events = new ArrayList<>();
    for (JsonNode event : eventsNode) {
      ExternalGameEvent parsed = parseEvent(event);
      if (parsed != null) {
        events.add(parsed);
      }
    }
    return events;
  }

  private ExternalGameEvent parseEvent(JsonNode event) {
    JsonNode competition = event.path("competitions").path(0);
    JsonNode home = null;
    JsonNode away = null;
    for (JsonNode competitor : competition.path("competitors")) {
      String side = competitor.path("homeAway").asText("");
      if ("home".equalsIgnoreCase(side)) {
        home = competitor;
      } else if ("away".equalsIgnoreCase(side)) {
        away = competitor;
      }
    }
    if (home == null || away == null) {
      LOGGER.debug("[FEED] event {} has no home/away competitors, skipped", event.path("id").asText(""));
      return null;
    }
    String homeLabel = teamLabel(home);
    String awayLabel = teamLabel(away);
    if (homeLabel.isBlank() || awayLabel.isBlank()) {
      return null;
    }

    JsonNode status = competition.path("status");
    if (status.isMissingNode()) {
      status = event.path("status");
    }
    JsonNode type = status.path("type");
    String statusText = type.path("description").asText("").trim();
    if (statusText.isBlank()) {
      statusText = type.path("name").asText("").trim();
    }
    Integer period = status.has("period") ? parseInt(status.path("period").asText("")) : null;
    String detail = type.path("shortDetail").asText("").toUpperCase(Locale.ROOT);
    Boolean overtime =
        period == null && detail.isBlank()
            ? null
            : (period != null && period > REGULATION_PERIODS) || detail.contains("OT");
    String clock = status.path("displayClock").asText("").trim();

    return new ExternalGameEvent(
        homeLabel,
        awayLabel,
        parseInt(home.path("score").asText("")),
        parseInt(away.path("score").asText("")),
        statusText.isBlank() ? null : statusText,
        period,
        overtime,
        clock.isBlank() ? null : clock);
  }

  private String teamLabel(JsonNode competitor) {
    JsonNode team = competitor.path("team");
    String label = team.path("displayName").asText("").trim();
    if (label.isBlank()) {
      label = team.path("name").asText("").trim();
    }
    return label;
  }

  private Integer parseInt(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ignored) {
      return null;
    }
  }
}
