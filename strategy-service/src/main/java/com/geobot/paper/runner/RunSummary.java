package com.geobot.paper.runner;

import java.time.Instant;
import java.util.List;

public record RunSummary(
    String target,
    Instant startedAt,
    Instant finishedAt,
    int marketsFetched,
    int candidates,
    List<StrategyRunResult> results
) {

  public RunSummary {
    results = results == null ? List.of() : List.copyOf(results);
  }

  public long failures() {
    return results.stream().filter(r -> !r.success()).count();
  }
}
