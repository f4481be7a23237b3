package com.geobot.paper.ledger;

import com.geobot.paper.selection.AcceptedTrade;
import com.geobot.paper.selection.SelectionState;
import com.geobot.paper.strategy.model.Strategy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Working copy of one strategy's portfolio for the duration of a run.
 *
 * Not thread-safe; each strategy run owns its ledger exclusively. Exposure is recomputed from open
 * positions with the same rules the selector uses to fold its simulated state.
 */
@Slf4j
public class PositionLedger {

  static final BigDecimal MANUAL_CLOSE_LOSS_FRACTION = new BigDecimal("0.5");

  private final String strategyId;
  private final BigDecimal bankrollInitial;
  private final double entryCostRate;
  private final Instant createdAt;
  private final List<Position> positions;
  private int totalTrades;
  private int wins;
  private int losses;
  private BigDecimal totalPnl;

  public PositionLedger(Portfolio portfolio) {
    this.strategyId = portfolio.strategyId();
    this.bankrollInitial = portfolio.bankrollInitial();
    this.entryCostRate = portfolio.entryCostRate();
    this.createdAt = portfolio.createdAt();
    this.positions = new ArrayList<>(portfolio.positions());
    this.totalTrades = Math.max(portfolio.totalTrades(), this.positions.size());
    recomputeStats();
  }

  public ExposureSummary exposure() {
    BigDecimal total = BigDecimal.ZERO;
    Map<String, BigDecimal> byCluster = new HashMap<>();
    for (Position p : positions) {
      if (p.isOpen()) {
        total = total.add(p.stakeUsd());
        byCluster.merge(p.cluster(), p.stakeUsd(), BigDecimal::add);
      }
    }
    return new ExposureSummary(total, byCluster);
  }

  public Set<String> openMarketIds() {
    Set<String> ids = new LinkedHashSet<>();
    for (Position p : positions) {
      if (p.isOpen()) {
        ids.add(p.marketId());
      }
    }
    return ids;
  }

  public Map<String, Integer> openCountByEvent() {
    Map<String, Integer> counts = new HashMap<>();
    for (Position p : positions) {
      if (p.isOpen()) {
        counts.merge(p.eventKey() == null ? "" : p.eventKey(), 1, Integer::sum);
      }
    }
    return counts;
  }

  public BigDecimal bankrollCurrent() {
    return bankrollInitial.add(totalPnl);
  }

  public BigDecimal cashAvailable() {
    return bankrollCurrent().subtract(exposure().total());
  }

  /**
   * Starting point for the selector, derived from the open positions.
   */
  public SelectionState selectionState() {
    ExposureSummary exposure = exposure();
    return new SelectionState(
        bankrollCurrent().subtract(exposure.total()),
        exposure.total(),
        exposure.byCluster(),
        openMarketIds(),
        openCountByEvent()
    );
  }

  public List<Position> openPositions() {
    return positions.stream().filter(Position::isOpen).toList();
  }

  public List<Position> positions() {
    return List.copyOf(positions);
  }

  public Position open(AcceptedTrade trade, Strategy strategy, Instant now) {
    Position position = Position.open(trade, strategy, now);
    positions.add(position);
    totalTrades++;
    log.debug("strategy={} opened {} @ {} stake={} market={}", strategyId, position.betSide(),
        position.entryPrice(), position.stakeUsd(), position.marketId());
    return position;
  }

  /**
   * Update the mark of every open position on the market. Returns the number of positions touched.
   */
  public int markToMarket(String marketId, double priceYes) {
    int updated = 0;
    for (int i = 0; i < positions.size(); i++) {
      Position p = positions.get(i);
      if (p.isOpen() && p.marketId().equals(marketId)) {
        positions.set(i, p.markToMarket(priceYes));
        updated++;
      }
    }
    return updated;
  }

  /**
   * Settle the open position on the market, if any, and refresh win/loss counters.
   */
  public Optional<Position> settle(String marketId, ResolutionOutcome outcome, Instant now) {
    for (int i = 0; i < positions.size(); i++) {
      Position p = positions.get(i);
      if (p.isOpen() && p.marketId().equals(marketId)) {
        Position settled = p.settle(outcome, now);
        positions.set(i, settled);
        recomputeStats();
        return Optional.of(settled);
      }
    }
    return Optional.empty();
  }

  /**
   * Close every open position whose question contains {@code query} (case-insensitive), booking
   * half the stake as a loss.
   */
  public List<Position> closeManually(String query, Instant now) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    String needle = query.trim().toLowerCase(Locale.ROOT);
    List<Position> closed = new ArrayList<>();
    for (int i = 0; i < positions.size(); i++) {
      Position p = positions.get(i);
      if (p.isOpen() && p.question() != null && p.question().toLowerCase(Locale.ROOT).contains(needle)) {
        Position c = p.closeManually(p.stakeUsd().multiply(MANUAL_CLOSE_LOSS_FRACTION).negate(), now);
        positions.set(i, c);
        closed.add(c);
      }
    }
    if (!closed.isEmpty()) {
      recomputeStats();
    }
    return closed;
  }

  public Portfolio snapshot(Instant now) {
    return new Portfolio(
        strategyId,
        bankrollInitial,
        bankrollCurrent(),
        entryCostRate,
        positions,
        totalTrades,
        wins,
        losses,
        totalPnl,
        createdAt == null ? now : createdAt,
        now
    );
  }

  private void recomputeStats() {
    int w = 0;
    int l = 0;
    BigDecimal pnl = BigDecimal.ZERO;
    for (Position p : positions) {
      if (p.status() == PositionStatus.RESOLVED_WIN) {
        w++;
      } else if (p.status() == PositionStatus.RESOLVED_LOSS) {
        l++;
      }
      if (!p.isOpen() && p.realizedPnl() != null) {
        pnl = pnl.add(p.realizedPnl());
      }
    }
    this.wins = w;
    this.losses = l;
    this.totalPnl = pnl;
  }
}
