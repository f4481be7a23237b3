package com.geobot.paper.runner;

import com.geobot.paper.config.GeobotProperties;
import com.geobot.paper.strategy.UnknownStrategyException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic paper-trading run of {@code geobot.run.default-target}. Off unless
 * {@code geobot.run.schedule-enabled=true}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaperTradingScheduler {

  private final @NonNull PaperTradingRunner runner;
  private final @NonNull GeobotProperties properties;

  private final AtomicBoolean running = new AtomicBoolean();

  @Scheduled(
      initialDelayString = "${geobot.run.poll-interval-millis:3600000}",
      fixedDelayString = "${geobot.run.poll-interval-millis:3600000}"
  )
  public void tick() {
    if (!properties.run().scheduleEnabled()) {
      return;
    }
    if (!running.compareAndSet(false, true)) {
      log.warn("Previous paper trading run still in progress, skipping tick");
      return;
    }
    try {
      runner.run(properties.run().defaultTarget());
    } catch (UnknownStrategyException e) {
      log.error("Scheduled paper trading run has no valid target: {}", e.getMessage());
    } catch (Exception e) {
      log.warn("Scheduled paper trading run failed: {}", e.toString());
    } finally {
      running.set(false);
    }
  }
}
