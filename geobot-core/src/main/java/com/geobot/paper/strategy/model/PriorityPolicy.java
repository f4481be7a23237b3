package com.geobot.paper.strategy.model;

import java.util.Locale;
import java.util.Optional;

public enum PriorityPolicy {
  /**
   * Highest YES price first.
   */
  PRICE_HIGH("price_high"),
  /**
   * Lowest volume first.
   */
  VOLUME_LOW("volume_low"),
  /**
   * Lowest composite of capped volume, capped days to close and NO price.
   */
  ROTATION("rotation"),
  /**
   * Keep the input order.
   */
  UNRANKED("unranked");

  private final String id;

  PriorityPolicy(String id) {
    this.id = id;
  }

  public String getId() {
    return id;
  }

  /**
   * Resolve a configured policy name. Unknown or blank names fall back to {@link #UNRANKED}.
   */
  public static PriorityPolicy fromId(String id) {
    return lookup(id).orElse(UNRANKED);
  }

  public static Optional<PriorityPolicy> lookup(String id) {
    if (id == null || id.isBlank()) {
      return Optional.empty();
    }
    String normalized = id.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (PriorityPolicy policy : values()) {
      if (policy.id.equals(normalized)) {
        return Optional.of(policy);
      }
    }
    return Optional.empty();
  }
}
