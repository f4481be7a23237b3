package com.geobot.paper.selection;

import com.geobot.paper.strategy.model.Strategy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * Filter, rank and select for one strategy against the shared candidate pool.
 */
@RequiredArgsConstructor
public class StrategyEvaluator {

  private final @NonNull ConstrainedSelector selector;

  public Evaluation evaluate(List<Candidate> pool, Strategy strategy, SelectionState state) {
    List<Candidate> eligible = CandidateFilter.filter(pool, strategy);
    List<Candidate> ranked = PriorityRanker.rank(eligible, strategy.priority());
    return new Evaluation(eligible.size(), selector.select(ranked, strategy, state));
  }

  public record Evaluation(int eligible, SelectionResult selection) {
  }
}
