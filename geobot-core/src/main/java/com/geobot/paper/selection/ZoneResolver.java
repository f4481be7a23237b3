package com.geobot.paper.selection;

import com.geobot.paper.strategy.model.PriceRange;
import com.geobot.paper.strategy.model.VolumeBucket;
import com.geobot.paper.strategy.model.ZoneSpec;

import java.util.Optional;

public final class ZoneResolver {

  private ZoneResolver() {
  }

  /**
   * Price band for a market of the given volume. Buckets are scanned in order and the first
   * {@code [volMin, volMax)} match wins; empty when the volume falls in a gap.
   */
  public static Optional<PriceRange> resolve(ZoneSpec zones, double volume) {
    if (!zones.bucketed()) {
      return Optional.of(zones.single());
    }
    for (VolumeBucket bucket : zones.buckets()) {
      if (bucket.matches(volume)) {
        return Optional.of(bucket.range());
      }
    }
    return Optional.empty();
  }
}
