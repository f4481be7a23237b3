package com.geobot.paper.runner;

import java.math.BigDecimal;

/**
 * Outcome of one strategy within a run.
 *
 * @param eligible candidates that passed the strategy's filter
 * @param opened positions opened this run
 * @param resolved positions settled this run
 * @param error failure description, null on success
 */
public record StrategyRunResult(
    String strategyId,
    boolean success,
    BigDecimal bankroll,
    int openPositions,
    int eligible,
    int opened,
    int resolved,
    String error
) {

  public static StrategyRunResult ok(String strategyId, BigDecimal bankroll, int openPositions, int eligible,
                                     int opened, int resolved) {
    return new StrategyRunResult(strategyId, true, bankroll, openPositions, eligible, opened, resolved, null);
  }

  public static StrategyRunResult failed(String strategyId, String error) {
    return new StrategyRunResult(strategyId, false, null, 0, 0, 0, 0, error);
  }
}
