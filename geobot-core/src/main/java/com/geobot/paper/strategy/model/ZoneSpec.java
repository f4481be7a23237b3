package com.geobot.paper.strategy.model;

import java.util.List;

/**
 * Either one price range for every volume, or an ordered list of volume buckets.
 * Buckets may leave gaps; a volume that lands in a gap has no zone.
 */
public record ZoneSpec(PriceRange single, List<VolumeBucket> buckets) {

  public ZoneSpec {
    buckets = buckets == null ? List.of() : List.copyOf(buckets);
    if (single == null && buckets.isEmpty()) {
      throw new IllegalArgumentException("zone spec needs a price range or at least one volume bucket");
    }
    if (single != null && !buckets.isEmpty()) {
      throw new IllegalArgumentException("zone spec cannot carry both a price range and volume buckets");
    }
  }

  public static ZoneSpec single(double priceYesMin, double priceYesMax) {
    return new ZoneSpec(new PriceRange(priceYesMin, priceYesMax), List.of());
  }

  public static ZoneSpec buckets(List<VolumeBucket> buckets) {
    return new ZoneSpec(null, buckets);
  }

  public boolean bucketed() {
    return single == null;
  }

  /**
   * Envelope of every configured price band, for display.
   */
  public PriceRange outerBounds() {
    if (single != null) {
      return single;
    }
    double min = buckets.stream().mapToDouble(b -> b.range().min()).min().orElse(0.0);
    double max = buckets.stream().mapToDouble(b -> b.range().max()).max().orElse(1.0);
    return new PriceRange(min, max);
  }

  public String describe() {
    return bucketed() ? buckets.size() + "-bucket" : single.toString();
  }
}
