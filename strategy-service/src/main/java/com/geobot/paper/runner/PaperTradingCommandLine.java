package com.geobot.paper.runner;

import com.geobot.paper.config.GeobotProperties;
import com.geobot.paper.strategy.UnknownStrategyException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Runs {@code geobot.run.on-startup} once after the context is up, e.g.
 * {@code --geobot.run.on-startup=tier1}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PaperTradingCommandLine implements ApplicationRunner {

  private final @NonNull PaperTradingRunner runner;
  private final @NonNull GeobotProperties properties;

  @Override
  public void run(ApplicationArguments args) {
    String target = properties.run().onStartup();
    if (target == null || target.isBlank()) {
      return;
    }
    try {
      RunSummary summary = runner.run(target);
      log.info("Startup run target={} strategies={} failures={}", summary.target(), summary.results().size(),
          summary.failures());
    } catch (UnknownStrategyException e) {
      log.error("Startup run skipped: {}", e.getMessage());
    }
  }
}
