package com.geobot.paper.runner;

import com.geobot.paper.ledger.ExposureSummary;
import com.geobot.paper.ledger.Portfolio;
import com.geobot.paper.ledger.Position;
import com.geobot.paper.ledger.PositionLedger;
import com.geobot.paper.strategy.model.Strategy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of one strategy's portfolio: bankroll, P&L, win/loss record and open exposure.
 *
 * @param winRate wins over settled positions, null until something has settled
 * @param exposureByCluster open stake per cluster, largest first
 */
public record PortfolioReport(
    String strategyId,
    String name,
    BigDecimal bankrollInitial,
    BigDecimal bankrollCurrent,
    BigDecimal totalPnl,
    int totalTrades,
    int wins,
    int losses,
    Double winRate,
    BigDecimal exposureTotal,
    Map<String, BigDecimal> exposureByCluster,
    BigDecimal unrealizedPnl,
    List<Position> openPositions,
    Instant createdAt,
    Instant lastUpdated
) {

  public static PortfolioReport of(Strategy strategy, Portfolio portfolio) {
    PositionLedger ledger = new PositionLedger(portfolio);
    Portfolio current = ledger.snapshot(portfolio.lastUpdated());
    ExposureSummary exposure = ledger.exposure();
    Map<String, BigDecimal> byCluster = new LinkedHashMap<>();
    exposure.byCluster().entrySet().stream()
        .sorted(Map.Entry.<String, BigDecimal>comparingByValue(Comparator.reverseOrder())
            .thenComparing(Map.Entry.<String, BigDecimal>comparingByKey()))
        .forEach(e -> byCluster.put(e.getKey(), e.getValue()));
    List<Position> open = ledger.openPositions();
    BigDecimal unrealized = open.stream().map(Position::unrealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    int settled = current.wins() + current.losses();
    return new PortfolioReport(
        strategy.id(),
        strategy.name(),
        current.bankrollInitial(),
        current.bankrollCurrent(),
        current.totalPnl(),
        current.totalTrades(),
        current.wins(),
        current.losses(),
        settled == 0 ? null : (double) current.wins() / settled,
        exposure.total(),
        byCluster,
        unrealized,
        open,
        current.createdAt(),
        current.lastUpdated()
    );
  }
}
