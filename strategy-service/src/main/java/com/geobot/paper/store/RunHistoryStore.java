package com.geobot.paper.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.geobot.paper.runner.RunSummary;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Rolling JSON array of the most recent run summaries. Failures are logged, never thrown.
 */
@Slf4j
public class RunHistoryStore {

  private final Path file;
  private final int limit;
  private final ObjectMapper objectMapper;

  public RunHistoryStore(Path file, int limit, ObjectMapper objectMapper) {
    this.file = file;
    this.limit = Math.max(1, limit);
    this.objectMapper = objectMapper.copy()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(SerializationFeature.INDENT_OUTPUT);
  }

  public synchronized void append(RunSummary summary) {
    try {
      ArrayNode history = read();
      history.add(objectMapper.valueToTree(summary));
      while (history.size() > limit) {
        history.remove(0);
      }
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writeValue(file.toFile(), history);
    } catch (IOException | IllegalArgumentException e) {
      log.warn("Failed to save run history {}: {}", file, e.toString());
    }
  }

  public synchronized ArrayNode read() throws IOException {
    if (!Files.exists(file)) {
      return objectMapper.createArrayNode();
    }
    JsonNode parsed = objectMapper.readTree(file.toFile());
    if (parsed instanceof ArrayNode arr) {
      return arr;
    }
    log.warn("Run history {} is not a JSON array, starting over", file);
    return objectMapper.createArrayNode();
  }
}
