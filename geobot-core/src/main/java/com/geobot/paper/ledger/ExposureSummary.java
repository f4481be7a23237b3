package com.geobot.paper.ledger;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Stake of open positions, in total and per cluster.
 */
public record ExposureSummary(BigDecimal total, Map<String, BigDecimal> byCluster) {

  public ExposureSummary {
    byCluster = Map.copyOf(byCluster);
  }
}
