package com.geobot.paper.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.geobot.paper.selection.AcceptedTrade;
import com.geobot.paper.selection.Candidate;
import com.geobot.paper.strategy.model.BetSide;
import com.geobot.paper.strategy.model.Strategy;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * One paper position. Transitions return a new instance; closed positions stay in the portfolio.
 *
 * {@code entryPrice} and {@code markPrice} are prices of the side held, not YES prices.
 */
public record Position(
    String marketId,
    String question,
    String tokenId,
    BetSide betSide,
    double entryPrice,
    Double markPrice,
    Double priceYesCurrent,
    BigDecimal stakeUsd,
    BigDecimal shares,
    PositionStatus status,
    double entryCostRate,
    String eventKey,
    String cluster,
    Instant expectedClose,
    Instant openedAt,
    Instant closedAt,
    BigDecimal realizedPnl
) {

  static final int SHARE_SCALE = 6;

  /**
   * Buy {@code trade.stake()} of the strategy's side. The entry cost is taken off the stake before
   * converting to shares.
   */
  public static Position open(AcceptedTrade trade, Strategy strategy, Instant now) {
    Candidate c = trade.candidate();
    BetSide side = strategy.betSide();
    double entryPrice = c.entryPrice(side);
    BigDecimal invested = trade.stake().multiply(BigDecimal.valueOf(1.0 - strategy.entryCostRate()));
    BigDecimal shares = invested.divide(BigDecimal.valueOf(entryPrice), SHARE_SCALE, RoundingMode.HALF_UP);
    return new Position(
        c.marketId(),
        c.question(),
        c.tokenFor(side),
        side,
        entryPrice,
        entryPrice,
        c.priceYes(),
        trade.stake(),
        shares,
        PositionStatus.OPEN,
        strategy.entryCostRate(),
        c.eventKey(),
        c.cluster(),
        c.endTime(),
        now,
        null,
        null
    );
  }

  @JsonIgnore
  public boolean isOpen() {
    return status.isOpen();
  }

  public Position markToMarket(double priceYes) {
    return new Position(marketId, question, tokenId, betSide, entryPrice, betSide.priceFromYes(priceYes), priceYes,
        stakeUsd, shares, status, entryCostRate, eventKey, cluster, expectedClose, openedAt, closedAt, realizedPnl);
  }

  /**
   * A winning share pays 1; a losing position forfeits the stake.
   */
  public Position settle(ResolutionOutcome outcome, Instant now) {
    boolean won = outcome.winsFor(betSide);
    BigDecimal pnl = won ? shares.subtract(stakeUsd) : stakeUsd.negate();
    double mark = won ? 1.0 : 0.0;
    double priceYes = outcome == ResolutionOutcome.YES ? 1.0 : 0.0;
    return new Position(marketId, question, tokenId, betSide, entryPrice, mark, priceYes,
        stakeUsd, shares, won ? PositionStatus.RESOLVED_WIN : PositionStatus.RESOLVED_LOSS,
        entryCostRate, eventKey, cluster, expectedClose, openedAt, now, pnl);
  }

  public Position closeManually(BigDecimal pnl, Instant now) {
    return new Position(marketId, question, tokenId, betSide, entryPrice, markPrice, priceYesCurrent,
        stakeUsd, shares, PositionStatus.MANUALLY_CLOSED, entryCostRate, eventKey, cluster, expectedClose,
        openedAt, now, pnl);
  }

  /**
   * Mark-to-market P&L of an open position; realized P&L once closed.
   */
  public BigDecimal unrealizedPnl() {
    if (!isOpen()) {
      return realizedPnl == null ? BigDecimal.ZERO : realizedPnl;
    }
    double mark = markPrice == null ? entryPrice : markPrice;
    return shares.multiply(BigDecimal.valueOf(mark)).subtract(stakeUsd);
  }
}
