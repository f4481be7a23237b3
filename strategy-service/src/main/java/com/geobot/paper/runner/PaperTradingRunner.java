package com.geobot.paper.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobot.paper.ledger.Portfolio;
import com.geobot.paper.ledger.PortfolioStore;
import com.geobot.paper.ledger.PortfolioStoreException;
import com.geobot.paper.ledger.Position;
import com.geobot.paper.ledger.PositionLedger;
import com.geobot.paper.ledger.PositionStatus;
import com.geobot.paper.ledger.ResolutionOracle;
import com.geobot.paper.ledger.ResolutionOutcome;
import com.geobot.paper.market.MarketSource;
import com.geobot.paper.notify.NotificationSink;
import com.geobot.paper.polymarket.gamma.PolymarketMarketParser;
import com.geobot.paper.selection.AcceptedTrade;
import com.geobot.paper.selection.Candidate;
import com.geobot.paper.selection.MarketEnricher;
import com.geobot.paper.selection.StrategyEvaluator;
import com.geobot.paper.store.RunHistoryStore;
import com.geobot.paper.strategy.StrategyCatalog;
import com.geobot.paper.strategy.model.Strategy;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * One paper-trading pass over a strategy or group.
 *
 * The market feed is fetched and enriched once per run and shared read-only by every strategy.
 * Each strategy then loads its portfolio, marks and settles open positions, selects new trades and
 * saves. A failure in one strategy is reported in its result and does not stop the others.
 */
@Slf4j
public class PaperTradingRunner {

  private static final DateTimeFormatter SUMMARY_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
      .withZone(ZoneOffset.UTC);

  private final StrategyCatalog catalog;
  private final MarketSource marketSource;
  private final MarketEnricher enricher;
  private final StrategyEvaluator evaluator;
  private final ResolutionOracle resolutionOracle;
  private final PortfolioStore portfolioStore;
  private final NotificationSink notificationSink;
  private final RunHistoryStore runHistory;
  private final MeterRegistry meterRegistry;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final String defaultTarget;
  private final int parallelism;

  public PaperTradingRunner(
      StrategyCatalog catalog,
      MarketSource marketSource,
      MarketEnricher enricher,
      StrategyEvaluator evaluator,
      ResolutionOracle resolutionOracle,
      PortfolioStore portfolioStore,
      NotificationSink notificationSink,
      RunHistoryStore runHistory,
      MeterRegistry meterRegistry,
      ObjectMapper objectMapper,
      Clock clock,
      String defaultTarget,
      int parallelism
  ) {
    this.catalog = catalog;
    this.marketSource = marketSource;
    this.enricher = enricher;
    this.evaluator = evaluator;
    this.resolutionOracle = resolutionOracle;
    this.portfolioStore = portfolioStore;
    this.notificationSink = notificationSink;
    this.runHistory = runHistory;
    this.meterRegistry = meterRegistry;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.defaultTarget = defaultTarget;
    this.parallelism = Math.max(1, parallelism);
  }

  /**
   * Run a strategy id or group name; blank runs the default target.
   *
   * @throws com.geobot.paper.strategy.UnknownStrategyException before any market is fetched
   */
  public RunSummary run(String target) {
    String resolvedTarget = target == null || target.isBlank() ? defaultTarget : target.trim();
    List<Strategy> strategies = catalog.resolve(resolvedTarget);
    Instant now = clock.instant();
    meterRegistry.counter("geobot.run.count").increment();
    log.info("Paper trading run target={} strategies={}", resolvedTarget, strategies.stream().map(Strategy::id).toList());

    List<JsonNode> markets = marketSource.fetchOpenMarkets();
    meterRegistry.counter("geobot.markets.fetched").increment(markets.size());
    Map<String, JsonNode> feed = index(markets);
    List<Candidate> pool = enricher.enrichAll(markets, now);
    meterRegistry.counter("geobot.candidates.enriched").increment(pool.size());
    log.info("Fetched {} markets, {} candidates after enrichment", markets.size(), pool.size());

    MarketLookup lookup = new MarketLookup(feed);
    List<StrategyRunResult> results = runStrategies(strategies, pool, lookup, now);

    Instant finished = clock.instant();
    RunSummary summary = new RunSummary(resolvedTarget, now, finished, markets.size(), pool.size(), results);
    if (!results.isEmpty()) {
      sendSummary(summary);
    }
    if (runHistory != null) {
      runHistory.append(summary);
    }
    log.info("Paper trading run target={} complete in {}s, {} failed", resolvedTarget,
        Duration.between(now, finished).toSeconds(), summary.failures());
    return summary;
  }

  private List<StrategyRunResult> runStrategies(List<Strategy> strategies, List<Candidate> pool, MarketLookup lookup,
                                                Instant now) {
    if (parallelism == 1 || strategies.size() <= 1) {
      List<StrategyRunResult> results = new ArrayList<>(strategies.size());
      for (Strategy strategy : strategies) {
        results.add(runStrategy(strategy, pool, lookup, now));
      }
      return results;
    }

    ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, strategies.size()));
    try {
      List<Future<StrategyRunResult>> futures = new ArrayList<>(strategies.size());
      for (Strategy strategy : strategies) {
        futures.add(executor.submit(() -> runStrategy(strategy, pool, lookup, now)));
      }
      List<StrategyRunResult> results = new ArrayList<>(strategies.size());
      for (int i = 0; i < futures.size(); i++) {
        String id = strategies.get(i).id();
        try {
          results.add(futures.get(i).get());
        } catch (ExecutionException e) {
          log.error("strategy={} run failed: {}", id, e.getCause() == null ? e.toString() : e.getCause().toString());
          results.add(StrategyRunResult.failed(id, String.valueOf(e.getCause())));
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          results.add(StrategyRunResult.failed(id, "interrupted"));
        }
      }
      return results;
    } finally {
      executor.shutdownNow();
    }
  }

  StrategyRunResult runStrategy(Strategy strategy, List<Candidate> pool, MarketLookup lookup, Instant now) {
    String id = strategy.id();
    try {
      Portfolio portfolio = portfolioStore.load(strategy.portfolioKey(), strategy);
      PositionLedger ledger = new PositionLedger(portfolio);
      log.debug("strategy={} loaded bankroll=${} open={}", id, ledger.bankrollCurrent(), ledger.openPositions().size());

      markToMarket(ledger, lookup);
      int resolved = settleResolved(strategy, ledger, lookup, now);

      StrategyEvaluator.Evaluation evaluation = evaluator.evaluate(pool, strategy, ledger.selectionState());
      List<AcceptedTrade> accepted = evaluation.selection().accepted();
      for (AcceptedTrade trade : accepted) {
        Position p = ledger.open(trade, strategy, now);
        log.info("strategy={} PAPER BUY {} @ {} ${} {}", id, p.betSide(),
            "%.2f".formatted(p.entryPrice()), p.stakeUsd(), abbreviate(p.question()));
      }
      if (!accepted.isEmpty()) {
        meterRegistry.counter("geobot.trades.opened", "strategy", id).increment(accepted.size());
      }
      if (evaluation.selection().cashExhausted()) {
        log.info("strategy={} cash exhausted after {} new trades", id, accepted.size());
      }

      portfolioStore.save(strategy.portfolioKey(), ledger.snapshot(now));

      int open = ledger.openPositions().size();
      log.info("strategy={} bankroll=${} open={} eligible={} opened={} resolved={} skipped={}", id,
          ledger.bankrollCurrent(), open, evaluation.eligible(), accepted.size(), resolved,
          evaluation.selection().skipped());
      return StrategyRunResult.ok(id, ledger.bankrollCurrent(), open, evaluation.eligible(), accepted.size(), resolved);
    } catch (PortfolioStoreException e) {
      log.error("strategy={} skipped, portfolio store failed: {}", id, e.toString());
      meterRegistry.counter("geobot.strategy.failures", "strategy", id).increment();
      return StrategyRunResult.failed(id, e.getMessage());
    } catch (RuntimeException e) {
      log.error("strategy={} run failed", id, e);
      meterRegistry.counter("geobot.strategy.failures", "strategy", id).increment();
      return StrategyRunResult.failed(id, e.toString());
    }
  }

  private void markToMarket(PositionLedger ledger, MarketLookup lookup) {
    for (Position p : ledger.openPositions()) {
      JsonNode market = lookup.feed().get(p.marketId());
      if (market == null) {
        continue;
      }
      OptionalDouble priceYes = PolymarketMarketParser.yesPrice(market, objectMapper);
      if (priceYes.isPresent()) {
        ledger.markToMarket(p.marketId(), priceYes.getAsDouble());
      }
    }
  }

  private int settleResolved(Strategy strategy, PositionLedger ledger, MarketLookup lookup, Instant now) {
    int settled = 0;
    for (Position p : ledger.openPositions()) {
      Optional<ResolutionOutcome> outcome;
      try {
        outcome = lookup.find(p.marketId()).flatMap(resolutionOracle::resolve);
      } catch (RuntimeException e) {
        log.warn("strategy={} resolution lookup failed market={}: {}", strategy.id(), p.marketId(), e.toString());
        continue;
      }
      if (outcome.isEmpty()) {
        continue;
      }
      Optional<Position> closed = ledger.settle(p.marketId(), outcome.get(), now);
      if (closed.isPresent()) {
        settled++;
        Position c = closed.get();
        String result = c.status() == PositionStatus.RESOLVED_WIN ? "win" : "loss";
        meterRegistry.counter("geobot.positions.resolved", "strategy", strategy.id(), "result", result).increment();
        log.info("strategy={} RESOLVED {} {} pnl=${} {}", strategy.id(), result.toUpperCase(Locale.ROOT),
            outcome.get(), c.realizedPnl(), abbreviate(c.question()));
      }
    }
    return settled;
  }

  /**
   * Close open positions whose question contains {@code query} in every strategy of the catalog.
   * Strategies whose portfolio cannot be read are skipped.
   */
  public List<ManualCloseResult> closeManually(String query) {
    List<ManualCloseResult> results = new ArrayList<>();
    for (Strategy strategy : catalog.strategies()) {
      try {
        ManualCloseResult result = closeManually(strategy, query);
        if (!result.closed().isEmpty()) {
          results.add(result);
        }
      } catch (PortfolioStoreException e) {
        log.warn("strategy={} manual close skipped: {}", strategy.id(), e.toString());
      }
    }
    return results;
  }

  public ManualCloseResult closeManually(String strategyId, String query) {
    return closeManually(catalog.strategy(strategyId), query);
  }

  private ManualCloseResult closeManually(Strategy strategy, String query) {
    Portfolio portfolio = portfolioStore.load(strategy.portfolioKey(), strategy);
    PositionLedger ledger = new PositionLedger(portfolio);
    Instant now = clock.instant();
    List<Position> closed = ledger.closeManually(query, now);
    if (!closed.isEmpty()) {
      portfolioStore.save(strategy.portfolioKey(), ledger.snapshot(now));
      log.info("strategy={} manually closed {} position(s) matching '{}', bankroll=${}", strategy.id(),
          closed.size(), query, ledger.bankrollCurrent());
    }
    return new ManualCloseResult(strategy.id(), closed, ledger.bankrollCurrent());
  }

  public PortfolioReport report(String strategyId) {
    Strategy strategy = catalog.strategy(strategyId);
    Portfolio portfolio = portfolioStore.load(strategy.portfolioKey(), strategy);
    return PortfolioReport.of(strategy, portfolio);
  }

  private void sendSummary(RunSummary summary) {
    try {
      notificationSink.send(formatSummary(summary));
    } catch (RuntimeException e) {
      log.warn("Run summary notification failed: {}", e.toString());
    }
  }

  String formatSummary(RunSummary summary) {
    List<String> lines = new ArrayList<>();
    lines.add("📊 <b>Paper Trading Update</b>");
    lines.add("Date: " + SUMMARY_DATE.format(summary.startedAt()));
    lines.add("");
    for (StrategyRunResult r : summary.results()) {
      if (r.success()) {
        lines.add(String.format(Locale.ROOT, "<b>%s</b>: $%.0f (%d pos, %d new)",
            r.strategyId(), r.bankroll(), r.openPositions(), r.opened()));
      } else {
        lines.add("<b>" + r.strategyId() + "</b>: ❌ Error");
      }
    }
    return String.join("\n", lines);
  }

  private static Map<String, JsonNode> index(List<JsonNode> markets) {
    Map<String, JsonNode> byId = new HashMap<>();
    for (JsonNode m : markets) {
      String id = PolymarketMarketParser.marketId(m);
      if (id != null) {
        byId.putIfAbsent(id, m);
      }
    }
    return byId;
  }

  private static String abbreviate(String question) {
    if (question == null) {
      return "";
    }
    return question.length() <= 50 ? question : question.substring(0, 50) + "...";
  }

  /**
   * Markets by id: the run's feed first, then single lookups for markets that left the feed.
   * Lookups are shared by all strategies of the run.
   */
  final class MarketLookup {

    private final Map<String, JsonNode> feed;
    private final Map<String, Optional<JsonNode>> fetched = new ConcurrentHashMap<>();

    MarketLookup(Map<String, JsonNode> feed) {
      this.feed = feed;
    }

    Map<String, JsonNode> feed() {
      return feed;
    }

    Optional<JsonNode> find(String marketId) {
      JsonNode inFeed = feed.get(marketId);
      if (inFeed != null) {
        return Optional.of(inFeed);
      }
      Optional<JsonNode> cached = fetched.get(marketId);
      if (cached != null) {
        return cached;
      }
      // remote call stays outside the map
      Optional<JsonNode> market = marketSource.fetchMarket(marketId);
      Optional<JsonNode> raced = fetched.putIfAbsent(marketId, market);
      return raced != null ? raced : market;
    }
  }
}
