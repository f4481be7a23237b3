package com.geobot.paper.strategy.model;

import com.geobot.paper.config.GeobotProperties;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Three-tier stake schedule keyed on market volume.
 */
public record AdaptiveSizing(
    double lowVolumeThreshold,
    double midVolumeThreshold,
    BigDecimal smallBetUsd,
    BigDecimal mediumBetUsd,
    BigDecimal largeBetUsd
) {

  public AdaptiveSizing {
    Objects.requireNonNull(smallBetUsd, "smallBetUsd");
    Objects.requireNonNull(mediumBetUsd, "mediumBetUsd");
    Objects.requireNonNull(largeBetUsd, "largeBetUsd");
    if (lowVolumeThreshold > midVolumeThreshold) {
      throw new IllegalArgumentException("low volume threshold must not exceed mid volume threshold");
    }
  }

  public static AdaptiveSizing defaults() {
    return new AdaptiveSizing(5_000, 50_000, BigDecimal.valueOf(5), BigDecimal.valueOf(10), BigDecimal.valueOf(25));
  }

  public static AdaptiveSizing from(GeobotProperties.Sizing sizing) {
    return new AdaptiveSizing(
        sizing.lowVolumeThreshold(),
        sizing.midVolumeThreshold(),
        sizing.smallBetUsd(),
        sizing.mediumBetUsd(),
        sizing.largeBetUsd()
    );
  }

  public BigDecimal betSize(double volume) {
    if (volume < lowVolumeThreshold) {
      return smallBetUsd;
    }
    if (volume < midVolumeThreshold) {
      return mediumBetUsd;
    }
    return largeBetUsd;
  }
}
