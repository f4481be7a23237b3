package com.geobot.paper.selection;

import java.util.List;
import java.util.Map;

/**
 * @param accepted trades in acceptance order
 * @param finalState simulated state after the last accepted trade
 * @param cashExhausted true when the scan stopped early because cash ran below the next stake
 * @param skipped candidates passed over, by reason
 */
public record SelectionResult(
    List<AcceptedTrade> accepted,
    SelectionState finalState,
    boolean cashExhausted,
    Map<SkipReason, Integer> skipped
) {

  public SelectionResult {
    accepted = List.copyOf(accepted);
    skipped = Map.copyOf(skipped);
  }
}
