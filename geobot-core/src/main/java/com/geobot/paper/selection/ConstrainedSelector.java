package com.geobot.paper.selection;

import com.geobot.paper.strategy.model.Strategy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Greedy single pass over ranked candidates under cash, exposure and event-count limits.
 *
 * Per candidate, in order: skip if already held; skip if its event is at the cap; size it; stop
 * the whole scan if cash is below the stake; skip if total or cluster exposure would exceed its
 * cap; otherwise accept. Decisions are never revisited.
 */
@Slf4j
@RequiredArgsConstructor
public class ConstrainedSelector {

  private final @NonNull SizingResolver sizingResolver;

  public SelectionResult select(List<Candidate> ranked, Strategy strategy, SelectionState initial) {
    BigDecimal maxTotal = strategy.maxTotalExposure();
    BigDecimal maxCluster = strategy.maxClusterExposure();

    SelectionState state = initial;
    List<AcceptedTrade> accepted = new ArrayList<>();
    Map<SkipReason, Integer> skipped = new EnumMap<>(SkipReason.class);
    boolean cashExhausted = false;

    for (Candidate c : ranked) {
      if (state.holds(c.marketId())) {
        skipped.merge(SkipReason.ALREADY_HELD, 1, Integer::sum);
        continue;
      }
      if (state.openForEvent(c.eventKey()) >= strategy.eventCap()) {
        skipped.merge(SkipReason.EVENT_CAP, 1, Integer::sum);
        continue;
      }
      BigDecimal stake = sizingResolver.betSize(strategy, c.volume());
      if (state.cash().compareTo(stake) < 0) {
        cashExhausted = true;
        log.debug("strategy={} cash {} below stake {}, stopping scan", strategy.id(), state.cash(), stake);
        break;
      }
      if (state.totalExposure().add(stake).compareTo(maxTotal) > 0) {
        skipped.merge(SkipReason.TOTAL_EXPOSURE_CAP, 1, Integer::sum);
        continue;
      }
      if (state.exposureFor(c.cluster()).add(stake).compareTo(maxCluster) > 0) {
        skipped.merge(SkipReason.CLUSTER_EXPOSURE_CAP, 1, Integer::sum);
        continue;
      }
      state = state.accept(c, stake);
      accepted.add(new AcceptedTrade(c, stake));
    }

    return new SelectionResult(accepted, state, cashExhausted, skipped);
  }
}
