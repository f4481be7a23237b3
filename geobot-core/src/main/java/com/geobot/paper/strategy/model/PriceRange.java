package com.geobot.paper.strategy.model;

/**
 * Inclusive YES-price band.
 */
public record PriceRange(double min, double max) {

  public PriceRange {
    if (min > max) {
      throw new IllegalArgumentException("price range min %s > max %s".formatted(min, max));
    }
  }

  public boolean contains(double priceYes) {
    return priceYes >= min && priceYes <= max;
  }

  @Override
  public String toString() {
    return "%.0f-%.0f%%".formatted(min * 100, max * 100);
  }
}
