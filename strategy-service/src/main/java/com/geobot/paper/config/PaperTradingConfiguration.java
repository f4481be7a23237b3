package com.geobot.paper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobot.paper.classify.KeywordMarketClassifier;
import com.geobot.paper.classify.MarketClassifier;
import com.geobot.paper.ledger.PortfolioStore;
import com.geobot.paper.ledger.ResolutionOracle;
import com.geobot.paper.market.MarketSource;
import com.geobot.paper.market.TokenResolver;
import com.geobot.paper.notify.NoopNotificationSink;
import com.geobot.paper.notify.NotificationSink;
import com.geobot.paper.notify.TelegramNotificationSink;
import com.geobot.paper.polymarket.gamma.GammaResolutionOracle;
import com.geobot.paper.polymarket.gamma.GammaTokenResolver;
import com.geobot.paper.runner.PaperTradingRunner;
import com.geobot.paper.selection.ConstrainedSelector;
import com.geobot.paper.selection.MarketEnricher;
import com.geobot.paper.selection.SizingResolver;
import com.geobot.paper.selection.StrategyEvaluator;
import com.geobot.paper.store.JsonPortfolioStore;
import com.geobot.paper.store.RunHistoryStore;
import com.geobot.paper.strategy.StrategyCatalog;
import com.geobot.paper.strategy.model.AdaptiveSizing;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the paper-trading pipeline: catalog, enrichment, selection and the Gamma and Telegram clients.
 */
@Slf4j
@Configuration
public class PaperTradingConfiguration {

  private static final Duration GAMMA_CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration GAMMA_READ_TIMEOUT = Duration.ofSeconds(30);
  private static final Duration TELEGRAM_TIMEOUT = Duration.ofSeconds(10);

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public StrategyCatalog strategyCatalog(GeobotProperties properties) {
    return StrategyCatalog.from(properties);
  }

  @Bean
  public MarketClassifier marketClassifier() {
    return new KeywordMarketClassifier();
  }

  @Bean
  public TokenResolver tokenResolver(ObjectMapper objectMapper) {
    return new GammaTokenResolver(objectMapper);
  }

  @Bean
  public ResolutionOracle resolutionOracle(ObjectMapper objectMapper) {
    return new GammaResolutionOracle(objectMapper);
  }

  @Bean
  public MarketEnricher marketEnricher(
      GeobotProperties properties,
      MarketClassifier classifier,
      TokenResolver tokenResolver,
      ObjectMapper objectMapper
  ) {
    double bufferHours = properties.enrichment().bufferHours();
    log.info("Market enricher configured: buffer={}h", bufferHours);
    return new MarketEnricher(classifier, tokenResolver, objectMapper, MarketEnricher.bufferOfHours(bufferHours));
  }

  @Bean
  public SizingResolver sizingResolver(GeobotProperties properties) {
    AdaptiveSizing sizing = AdaptiveSizing.from(properties.sizing());
    log.info("Adaptive sizing: {}", sizing);
    return new SizingResolver(sizing);
  }

  @Bean
  public StrategyEvaluator strategyEvaluator(SizingResolver sizingResolver) {
    return new StrategyEvaluator(new ConstrainedSelector(sizingResolver));
  }

  @Bean
  public RestClient polymarketGammaApiRestClient(RestClient.Builder builder, GeobotProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(GAMMA_CONNECT_TIMEOUT);
    requestFactory.setReadTimeout(GAMMA_READ_TIMEOUT);
    return builder.clone()
        .baseUrl(properties.gamma().baseUrl())
        .requestFactory(requestFactory)
        .build();
  }

  @Bean
  public RestClient telegramRestClient(RestClient.Builder builder, GeobotProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(TELEGRAM_TIMEOUT);
    requestFactory.setReadTimeout(TELEGRAM_TIMEOUT);
    return builder.clone()
        .baseUrl(properties.telegram().baseUrl())
        .requestFactory(requestFactory)
        .build();
  }

  @Bean
  public NotificationSink notificationSink(
      GeobotProperties properties,
      @Qualifier("telegramRestClient") RestClient telegramRestClient
  ) {
    GeobotProperties.Telegram telegram = properties.telegram();
    if (!telegram.configured()) {
      log.info("Telegram notifications disabled (enabled={}, token/chat set={})",
          telegram.enabled(), telegram.botToken() != null && telegram.chatId() != null);
      return new NoopNotificationSink();
    }
    log.info("Telegram notifications enabled for chat {}", telegram.chatId());
    return new TelegramNotificationSink(telegramRestClient, telegram.botToken(), telegram.chatId());
  }

  @Bean
  public PortfolioStore portfolioStore(GeobotProperties properties, ObjectMapper objectMapper, Clock clock) {
    Path dir = Path.of(properties.portfolio().dir());
    log.info("Portfolio store: {}", dir.toAbsolutePath());
    return new JsonPortfolioStore(dir, objectMapper, clock);
  }

  @Bean
  public RunHistoryStore runHistoryStore(GeobotProperties properties, ObjectMapper objectMapper) {
    GeobotProperties.Portfolio portfolio = properties.portfolio();
    return new RunHistoryStore(Path.of(portfolio.historyFile()), portfolio.historyLimit(), objectMapper);
  }

  @Bean
  public PaperTradingRunner paperTradingRunner(
      GeobotProperties properties,
      StrategyCatalog catalog,
      MarketSource marketSource,
      MarketEnricher enricher,
      StrategyEvaluator evaluator,
      ResolutionOracle resolutionOracle,
      PortfolioStore portfolioStore,
      NotificationSink notificationSink,
      RunHistoryStore runHistoryStore,
      MeterRegistry meterRegistry,
      ObjectMapper objectMapper,
      Clock clock
  ) {
    GeobotProperties.Run run = properties.run();
    log.info("Paper trading runner: defaultTarget={} parallelism={} scheduleEnabled={} pollInterval={}ms",
        run.defaultTarget(), run.parallelism(), run.scheduleEnabled(), run.pollIntervalMillis());
    return new PaperTradingRunner(
        catalog,
        marketSource,
        enricher,
        evaluator,
        resolutionOracle,
        portfolioStore,
        notificationSink,
        runHistoryStore,
        meterRegistry,
        objectMapper,
        clock,
        run.defaultTarget(),
        run.parallelism()
    );
  }
}
