package com.sundayedge.live.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sundayedge.live.model.ExternalGameEvent;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;

class EspnScoreboardClientTest {
  private final EspnScoreboardClient client =
      new EspnScoreboardClient(
          new RestTemplateBuilder(), new ObjectMapper(), "http://localhost/scoreboard", 1000, 1000);

  @Test
  void parsesCompetitorsStatusAndClock() {
    String body =
        "{\"events\":[{\"id\":\"401\",\"competitions\":[{"
            + "\"competitors\":["
            + "{\"homeAway\":\"home\",\"score\":\"24\",\"team\":{\"displayName\":\"Kansas City Chiefs\"}},"
            + "{\"homeAway\":\"away\",\"score\":\"17\",\"team\":{\"displayName\":\"Buffalo Bills\"}}],"
            + "\"status\":{\"period\":5,\"displayClock\":\"3:12\","
            + "\"type\":{\"description\":\"In Progress\",\"shortDetail\":\"3:12 - OT\"}}}]},"
            + "{\"id\":\"402\",\"competitions\":[{\"competitors\":[]}]}]}";

    List<ExternalGameEvent> events = client.parse(body);

    assertThat(events).hasSize(1);
    ExternalGameEvent event = events.get(0);
    assertThat(event.getHomeTeamLabel()).isEqualTo("Kansas City Chiefs");
    assertThat(event.getAwayTeamLabel()).isEqualTo("Buffalo Bills");
    assertThat(event.getHomeScore()).isEqualTo(24);
    assertThat(event.getAwayScore()).isEqualTo(17);
    assertThat(event.getStatusText()).isEqualTo("In Progress");
    assertThat(event.getPeriod()).isEqualTo(5);
    assertThat(event.getOvertime()).isTrue();
    assertThat(event.getClock()).isEqualTo("3:12");
  }

  @Test
  void missingScoreIsAbsentNotZero() {
    String body =
        "{\"events\":[{\"competitions\":[{\"competitors\":["
            + "{\"homeAway\":\"home\",\"team\":{\"name\":\"Eagles\"}},"
            + "{\"homeAway\":\"away\",\"score\":\"\",\"team\":{\"name\":\"Cowboys\"}}]}],"
            + "\"status\":{\"type\":{\"name\":\"STATUS_SCHEDULED\"}}}]}";

    ExternalGameEvent event = client.parse(body).get(0);

    assertThat(event.getHomeTeamLabel()).isEqualTo("Eagles");
    assertThat(event.getHomeScore()).isNull();
    assertThat(event.getAwayScore()).isNull();
    assertThat(event.getStatusText()).isEqualTo("STATUS_SCHEDULED");
    assertThat(event.getOvertime()).isNull();
  }

  @Test
  void invalidBodyIsFeedFailure() {
    assertThatThrownBy(() -> client.parse("<html>")).isInstanceOf(FeedUnavailableException.class);
    assertThatThrownBy(() -> client.parse("{\"leagues\":[]}"))
        .isInstanceOf(FeedUnavailableException.class);
  }
}
