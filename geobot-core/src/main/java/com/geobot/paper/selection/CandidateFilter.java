package com.geobot.paper.selection;

import com.geobot.paper.strategy.model.PriceRange;
import com.geobot.paper.strategy.model.Strategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Strategy-specific screening of the shared candidate pool. Stateless; safe to share across threads.
 */
public final class CandidateFilter {

  private CandidateFilter() {
  }

  /**
   * Candidates passing every rule for the strategy, in pool order.
   */
  public static List<Candidate> filter(List<Candidate> pool, Strategy strategy) {
    List<Candidate> out = new ArrayList<>();
    for (Candidate c : pool) {
      if (accepts(c, strategy)) {
        out.add(c);
      }
    }
    return out;
  }

  public static boolean accepts(Candidate candidate, Strategy strategy) {
    return failedRules(candidate, strategy).isEmpty();
  }

  /**
   * Every rule the candidate fails, empty when it passes.
   */
  public static List<FilterRule> failedRules(Candidate c, Strategy strategy) {
    List<FilterRule> failed = new ArrayList<>(2);
    if (c.volume() < strategy.minVolume() || c.volume() > strategy.maxVolume()) {
      failed.add(FilterRule.VOLUME_OUT_OF_RANGE);
    }
    if (c.daysToClose() < strategy.deadlineMinDays()) {
      failed.add(FilterRule.DEADLINE_TOO_SOON);
    }
    if (strategy.deadlineMaxDays() != null && c.daysToClose() > strategy.deadlineMaxDays()) {
      failed.add(FilterRule.DEADLINE_TOO_FAR);
    }
    if (strategy.excludeSeries() && c.series()) {
      failed.add(FilterRule.SERIES_EXCLUDED);
    }
    Optional<PriceRange> zone = ZoneResolver.resolve(strategy.zones(), c.volume());
    if (zone.isEmpty()) {
      failed.add(FilterRule.DEAD_ZONE);
    } else if (!zone.get().contains(c.priceYes())) {
      failed.add(FilterRule.PRICE_OUTSIDE_ZONE);
    }
    if (!strategy.clusterFilter().isEmpty() && !strategy.clusterFilter().contains(c.cluster())) {
      failed.add(FilterRule.CLUSTER_NOT_ALLOWED);
    }
    if (c.tokenFor(strategy.betSide()).isBlank()) {
      failed.add(FilterRule.MISSING_TOKEN);
    }
    return failed;
  }
}
