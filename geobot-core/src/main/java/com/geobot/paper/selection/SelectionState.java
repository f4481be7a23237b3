package com.geobot.paper.selection;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Simulated budget and exposure carried through one selection scan.
 * Every accept returns a new state; instances are never modified.
 */
public record SelectionState(
    BigDecimal cash,
    BigDecimal totalExposure,
    Map<String, BigDecimal> clusterExposure,
    Set<String> heldMarketIds,
    Map<String, Integer> openByEvent
) {

  public SelectionState {
    Objects.requireNonNull(cash, "cash");
    Objects.requireNonNull(totalExposure, "totalExposure");
    clusterExposure = clusterExposure == null ? Map.of() : Map.copyOf(clusterExposure);
    heldMarketIds = heldMarketIds == null ? Set.of() : Set.copyOf(heldMarketIds);
    openByEvent = openByEvent == null ? Map.of() : Map.copyOf(openByEvent);
  }

  public static SelectionState empty(BigDecimal cash) {
    return new SelectionState(cash, BigDecimal.ZERO, Map.of(), Set.of(), Map.of());
  }

  public boolean holds(String marketId) {
    return heldMarketIds.contains(marketId);
  }

  public int openForEvent(String eventKey) {
    return openByEvent.getOrDefault(eventKey, 0);
  }

  public BigDecimal exposureFor(String cluster) {
    return clusterExposure.getOrDefault(cluster, BigDecimal.ZERO);
  }

  public SelectionState accept(Candidate candidate, BigDecimal stake) {
    Map<String, BigDecimal> clusters = new HashMap<>(clusterExposure);
    clusters.merge(candidate.cluster(), stake, BigDecimal::add);
    Set<String> held = new HashSet<>(heldMarketIds);
    held.add(candidate.marketId());
    Map<String, Integer> events = new HashMap<>(openByEvent);
    events.merge(candidate.eventKey(), 1, Integer::sum);
    return new SelectionState(cash.subtract(stake), totalExposure.add(stake), clusters, held, events);
  }
}
