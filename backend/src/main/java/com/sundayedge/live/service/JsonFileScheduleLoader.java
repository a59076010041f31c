package com.sundayedge.live.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sundayedge.live.model.ScheduledGame;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class JsonFileScheduleLoader implements ScheduleLoader {
  private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileScheduleLoader.class);

  private final ObjectMapper objectMapper;
  private final Path dataDir;

  public JsonFileScheduleLoader(
      ObjectMapper objectMapper, @Value("${sundayedge.data.dir:backend/data}") String dataDir) {
    this.objectMapper = objectMapper;
    this.dataDir = DataPathResolver.resolve(dataDir);
  }

  @Override
  public List<ScheduledGame> load(String windowId) {
    Path file = dataDir.resolve("schedule-" + windowId + ".json");
    if (!Files.exists(file)) {
      file = dataDir.resolve("schedule.json");
    }
    if (!Files.exists(file)) {
      LOGGER.warn("[SCHEDULE] no schedule file for window {} in {}", windowId, dataDir);
      return List.of();
    }
    try {
      List<ScheduledGame> games =
          objectMapper.readValue(file.toFile(), new TypeReference<List<ScheduledGame>>() {});
      LOGGER.info("[SCHEDULE] window={} file={} games={}", windowId, file.getFileName(), games.size());
      return games;
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to read schedule " + file, ex);
    }
  }
}
