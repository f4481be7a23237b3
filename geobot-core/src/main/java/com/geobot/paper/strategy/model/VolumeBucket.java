package com.geobot.paper.strategy.model;

/**
 * Price band applying to markets whose volume falls in {@code [volMin, volMax)}.
 */
public record VolumeBucket(double volMin, double volMax, PriceRange range) {

  public VolumeBucket {
    if (range == null) {
      throw new IllegalArgumentException("volume bucket requires a price range");
    }
    if (volMin > volMax) {
      throw new IllegalArgumentException("volume bucket min %s > max %s".formatted(volMin, volMax));
    }
  }

  public boolean matches(double volume) {
    return volMin <= volume && volume < volMax;
  }
}
