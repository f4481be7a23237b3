package com.geobot.paper.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.geobot.paper.ledger.Portfolio;
import com.geobot.paper.ledger.PortfolioStore;
import com.geobot.paper.ledger.PortfolioStoreException;
import com.geobot.paper.strategy.model.Strategy;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;

/**
 * One pretty-printed JSON file per portfolio key under a base directory.
 *
 * Saves go through a temp file in the same directory followed by an atomic move, so a crash never
 * leaves a half-written portfolio behind.
 */
@Slf4j
public class JsonPortfolioStore implements PortfolioStore {

  private final Path dir;
  private final ObjectMapper objectMapper;
  private final Clock clock;

  public JsonPortfolioStore(Path dir, ObjectMapper objectMapper, Clock clock) {
    this.dir = dir;
    this.objectMapper = objectMapper.copy()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(SerializationFeature.INDENT_OUTPUT);
    this.clock = clock;
  }

  @Override
  public Portfolio load(String key, Strategy strategy) {
    Path file = resolve(key);
    if (!Files.exists(file)) {
      log.info("No portfolio at {}, starting {} with ${}", file, strategy.id(), strategy.bankroll());
      return Portfolio.fresh(strategy, clock.instant());
    }
    try {
      Portfolio portfolio = objectMapper.readValue(file.toFile(), Portfolio.class);
      if (portfolio == null) {
        throw new PortfolioStoreException("Empty portfolio file " + file, null);
      }
      return portfolio;
    } catch (IOException e) {
      throw new PortfolioStoreException("Failed reading portfolio " + file, e);
    }
  }

  @Override
  public void save(String key, Portfolio portfolio) {
    Path file = resolve(key);
    try {
      Path parent = file.getParent();
      Files.createDirectories(parent);
      Path tmp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
      try {
        objectMapper.writeValue(tmp.toFile(), portfolio);
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException e) {
      throw new PortfolioStoreException("Failed writing portfolio " + file, e);
    }
  }

  Path resolve(String key) {
    Path file = dir.resolve(key).normalize();
    if (!file.startsWith(dir.normalize())) {
      throw new PortfolioStoreException("Portfolio key escapes store directory: " + key, null);
    }
    return file;
  }
}
