package com.geobot.paper.selection;

import com.geobot.paper.strategy.model.PriorityPolicy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders filtered candidates by a strategy's priority policy. Sorting is stable.
 */
public final class PriorityRanker {

  static final double ROTATION_VOLUME_UNIT = 5_000.0;
  static final double ROTATION_CAP = 100.0;

  private PriorityRanker() {
  }

  public static List<Candidate> rank(List<Candidate> candidates, PriorityPolicy policy) {
    List<Candidate> ranked = new ArrayList<>(candidates);
    Comparator<Candidate> order = comparator(policy);
    if (order != null) {
      ranked.sort(order);
    }
    return ranked;
  }

  private static Comparator<Candidate> comparator(PriorityPolicy policy) {
    return switch (policy) {
      case PRICE_HIGH -> Comparator.comparingDouble(Candidate::priceYes).reversed();
      case VOLUME_LOW -> Comparator.comparingDouble(Candidate::volume);
      case ROTATION -> Comparator.comparingDouble(PriorityRanker::rotationScore);
      case UNRANKED -> null;
    };
  }

  /**
   * Lower is better: capped volume in units of 5k, plus capped days to close, plus the NO price in cents.
   */
  public static double rotationScore(Candidate c) {
    return Math.min(c.volume() / ROTATION_VOLUME_UNIT, ROTATION_CAP)
        + Math.min(c.daysToClose(), ROTATION_CAP)
        + (1.0 - c.priceYes()) * 100.0;
  }
}
