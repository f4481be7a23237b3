package com.geobot.paper.ledger;

import com.geobot.paper.strategy.model.Strategy;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Persisted ledger state of one strategy. Open and closed positions share {@code positions} in
 * insertion order.
 */
public record Portfolio(
    String strategyId,
    BigDecimal bankrollInitial,
    BigDecimal bankrollCurrent,
    double entryCostRate,
    List<Position> positions,
    int totalTrades,
    int wins,
    int losses,
    BigDecimal totalPnl,
    Instant createdAt,
    Instant lastUpdated
) {

  public Portfolio {
    positions = positions == null ? List.of() : List.copyOf(positions);
    if (totalPnl == null) {
      totalPnl = BigDecimal.ZERO;
    }
    if (bankrollCurrent == null) {
      bankrollCurrent = bankrollInitial;
    }
  }

  public static Portfolio fresh(Strategy strategy, Instant now) {
    return new Portfolio(
        strategy.id(),
        strategy.bankroll(),
        strategy.bankroll(),
        strategy.entryCostRate(),
        List.of(),
        0,
        0,
        0,
        BigDecimal.ZERO,
        now,
        now
    );
  }

  public List<Position> openPositions() {
    return positions.stream().filter(Position::isOpen).toList();
  }
}
