package com.sundayedge.live.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sundayedge.live.model.Prediction;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** One JSON document per line, rewritten in full on every save. */
@Component
public class JsonlPredictionStore implements PredictionStore {
  private static final Logger LOGGER = LoggerFactory.getLogger(JsonlPredictionStore.class);

  private final ObjectMapper objectMapper;
  private final Path dataDir;
  private final Path predictionsFile;
  private final Map<String, Prediction> records = new LinkedHashMap<>();
  private boolean loaded;

  public JsonlPredictionStore(
      ObjectMapper objectMapper, @Value("${sundayedge.data.dir:backend/data}") String dataDir) {
    this.objectMapper = objectMapper;
    this.dataDir = DataPathResolver.resolve(dataDir);
    this.predictionsFile = this.dataDir.resolve("predictions.jsonl");
  }

  @Override
  public synchronized List<Prediction> loadAll() {
    records.clear();
    if (Files.exists(predictionsFile)) {
      List<String> lines;
      try {
        lines = Files.readAllLines(predictionsFile, StandardCharsets.UTF_8);
      } catch (IOException ex) {
        throw new LedgerStoreException("Failed to read " + predictionsFile, ex);
      }
      int lineNumber = 0;
      for (String line : lines) {
        lineNumber++;
        if (line == null || line.isBlank()) {
          continue;
        }
        Prediction prediction;
        try {
          prediction = objectMapper.readValue(line, Prediction.class);
        } catch (JsonProcessingException ex) {
          throw new LedgerStoreException(
              "Corrupted prediction record at " + predictionsFile + ":" + lineNumber, ex);
        }
        if (prediction.getId() == null
            || prediction.getGameId() == null
            || prediction.getKind() == null
            || prediction.getStatus() == null) {
          throw new LedgerStoreException(
              "Incomplete prediction record at " + predictionsFile + ":" + lineNumber);
        }
        if (records.put(prediction.getId(), prediction) != null) {
          throw new LedgerStoreException(
              "Duplicate prediction id " + prediction.getId() + " at " + predictionsFile + ":" + lineNumber);
        }
      }
    }
    loaded = true;
    LOGGER.info("[STORE] loaded {} predictions from {}", records.size(), predictionsFile);
    List<Prediction> result = new ArrayList<>();
    for (Prediction prediction : records.values()) {
      result.add(prediction.copy());
    }
    return result;
  }

  @Override
  public synchronized void save(Prediction prediction) {
    if (!loaded) {
      loadAll();
    }
    Prediction previous = records.put(prediction.getId(), prediction.copy());
    try {
      Files.createDirectories(dataDir);
      List<String> lines = new ArrayList<>();
      for (Prediction record : records.values()) {
        lines.add(objectMapper.writeValueAsString(record));
      }
      Files.write(predictionsFile, lines, StandardCharsets.UTF_8);
    } catch (IOException ex) {
      if (previous == null) {
        records.remove(prediction.getId());
      } else {
        records.put(prediction.getId(), previous);
      }
      throw new LedgerStoreException("Failed to write " + predictionsFile, ex);
    }
  }

  Path getPredictionsFile() {
    return predictionsFile;
  }
}
