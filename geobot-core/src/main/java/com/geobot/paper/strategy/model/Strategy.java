package com.geobot.paper.strategy.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable parameter set of one paper-trading strategy.
 *
 * Exposure caps are fractions of {@code bankroll}. A null {@code deadlineMaxDays} means no upper
 * deadline; an empty {@code clusterFilter} admits every cluster.
 */
@Builder(toBuilder=true)
public record Strategy(
    String id,
    String name,
    String description,
    BetSide betSide,
    ZoneSpec zones,
    double minVolume,
    double maxVolume,
    SizingMode sizing,
    BigDecimal betSize,
    PriorityPolicy priority,
    double deadlineMinDays,
    Double deadlineMaxDays,
    int eventCap,
    boolean excludeSeries,
    BigDecimal bankroll,
    double maxTotalExposurePct,
    double maxClusterExposurePct,
    double entryCostRate,
    Set<String> clusterFilter,
    String portfolioKey
) {

  public Strategy {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(betSide, "betSide");
    Objects.requireNonNull(zones, "zones");
    Objects.requireNonNull(sizing, "sizing");
    Objects.requireNonNull(betSize, "betSize");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(bankroll, "bankroll");
    if (name == null || name.isBlank()) {
      name = id;
    }
    if (description == null) {
      description = "";
    }
    clusterFilter = clusterFilter == null ? Set.of() : Set.copyOf(clusterFilter);
    if (portfolioKey == null || portfolioKey.isBlank()) {
      portfolioKey = "portfolio_" + id + ".json";
    }
    if (eventCap < 1) {
      throw new IllegalArgumentException("strategy " + id + ": eventCap must be >= 1");
    }
    if (minVolume > maxVolume) {
      throw new IllegalArgumentException("strategy " + id + ": minVolume > maxVolume");
    }
  }

  /**
   * Builder preset with the catalog-wide defaults: NO side, fixed $25 stakes, 90% / 30% exposure
   * caps, 0.5% entry cost, at least 3 days to close and at most 3 open positions per event.
   */
  public static StrategyBuilder defaults(String id, ZoneSpec zones) {
    return builder()
        .id(id)
        .betSide(BetSide.NO)
        .zones(zones)
        .minVolume(0)
        .maxVolume(Double.POSITIVE_INFINITY)
        .sizing(SizingMode.FIXED)
        .betSize(BigDecimal.valueOf(25))
        .priority(PriorityPolicy.PRICE_HIGH)
        .deadlineMinDays(3)
        .eventCap(3)
        .bankroll(BigDecimal.valueOf(1000))
        .maxTotalExposurePct(0.90)
        .maxClusterExposurePct(0.30)
        .entryCostRate(0.005);
  }

  public BigDecimal maxTotalExposure() {
    return bankroll.multiply(BigDecimal.valueOf(maxTotalExposurePct));
  }

  public BigDecimal maxClusterExposure() {
    return bankroll.multiply(BigDecimal.valueOf(maxClusterExposurePct));
  }
}
