package com.geobot.paper.selection;

import com.geobot.paper.strategy.model.AdaptiveSizing;
import com.geobot.paper.strategy.model.SizingMode;
import com.geobot.paper.strategy.model.Strategy;
import com.geobot.paper.strategy.model.ZoneSpec;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.geobot.paper.selection.CandidateFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;

class ConstrainedSelectorTest {

  private final ConstrainedSelector selector = new ConstrainedSelector(new SizingResolver(AdaptiveSizing.defaults()));

  private final Strategy strategy = Strategy.defaults("sel", ZoneSpec.single(0.0, 1.0))
      .bankroll(BigDecimal.valueOf(1000))
      .betSize(BigDecimal.valueOf(25))
      .maxTotalExposurePct(0.90)
      .maxClusterExposurePct(0.30)
      .eventCap(3)
      .build();

  @Test
  void alreadyHeldMarketIsSkipped() {
    SelectionState state = new SelectionState(BigDecimal.valueOf(1000), BigDecimal.ZERO, Map.of(), Set.of("a"), Map.of());

    SelectionResult result = selector.select(List.of(candidate("a", 0.5, 1_000, 10), candidate("b", 0.5, 1_000, 10)), strategy, state);

    assertThat(result.accepted()).extracting(t -> t.candidate().marketId()).containsExactly("b");
    assertThat(result.skipped()).containsEntry(SkipReason.ALREADY_HELD, 1);
  }

  @Test
  void duplicateMarketInSameScanIsAcceptedOnce() {
    Candidate a = candidate("a", 0.5, 1_000, 10);

    SelectionResult result = selector.select(List.of(a, a), strategy, SelectionState.empty(BigDecimal.valueOf(1000)));

    assertThat(result.accepted()).hasSize(1);
    assertThat(result.finalState().heldMarketIds()).containsExactly("a");
  }

  @Test
  void eventCapCountsExistingOpenPositions() {
    SelectionState state = new SelectionState(BigDecimal.valueOf(1000), BigDecimal.valueOf(50),
        Map.of("ukraine", BigDecimal.valueOf(50)), Set.of("x", "y"), Map.of("election", 2));
    List<Candidate> ranked = List.of(
        candidate("a", 0.5, 1_000, 10, "mideast", "election"),
        candidate("b", 0.5, 1_000, 10, "mideast", "election"),
        candidate("c", 0.5, 1_000, 10, "mideast", "other-event")
    );

    SelectionResult result = selector.select(ranked, strategy, state);

    assertThat(result.accepted()).extracting(t -> t.candidate().marketId()).containsExactly("a", "c");
    assertThat(result.finalState().openForEvent("election")).isEqualTo(3);
    assertThat(result.skipped()).containsEntry(SkipReason.EVENT_CAP, 1);
  }

  @Test
  void clusterCapSkipsButScanContinues() {
    // 30% of 1000 = 300: twelve $25 trades fit in one cluster
    List<Candidate> ranked = new ArrayList<>();
    for (int i = 0; i < 14; i++) {
      ranked.add(candidate("u" + i, 0.5, 1_000, 10, "ukraine", "e" + i));
    }
    ranked.add(candidate("m0", 0.5, 1_000, 10, "mideast", "m0"));

    SelectionResult result = selector.select(ranked, strategy, SelectionState.empty(BigDecimal.valueOf(1000)));

    assertThat(result.finalState().exposureFor("ukraine")).isEqualByComparingTo("300");
    assertThat(result.accepted()).hasSize(13);
    assertThat(result.accepted().get(12).candidate().marketId()).isEqualTo("m0");
    assertThat(result.skipped()).containsEntry(SkipReason.CLUSTER_EXPOSURE_CAP, 2);
    assertThat(result.cashExhausted()).isFalse();
  }

  @Test
  void cashExhaustionStopsTheScan() {
    // $60 covers two $25 stakes; the $5 stake at the end is never reached
    Strategy adaptive = strategy.toBuilder().sizing(SizingMode.ADAPTIVE).maxClusterExposurePct(1.0).build();
    List<Candidate> ranked = List.of(
        candidate("a", 0.5, 60_000, 10),
        candidate("b", 0.5, 60_000, 10),
        candidate("c", 0.5, 60_000, 10),
        candidate("d", 0.5, 1_000, 10)
    );

    SelectionResult result = selector.select(ranked, adaptive, SelectionState.empty(BigDecimal.valueOf(60)));

    assertThat(result.accepted()).extracting(t -> t.candidate().marketId()).containsExactly("a", "b");
    assertThat(result.cashExhausted()).isTrue();
    assertThat(result.finalState().cash()).isEqualByComparingTo("10");
  }

  @Test
  void acceptedTradesRespectEveryCap() {
    Strategy tight = strategy.toBuilder()
        .sizing(SizingMode.ADAPTIVE)
        .bankroll(BigDecimal.valueOf(500))
        .maxTotalExposurePct(0.6)
        .maxClusterExposurePct(0.25)
        .eventCap(2)
        .build();
    String[] clusters = {"ukraine", "mideast", "china", "latam"};
    List<Candidate> ranked = new ArrayList<>();
    for (int i = 0; i < 80; i++) {
      double volume = (i * 7_919) % 120_000;
      ranked.add(candidate("m" + (i % 60), 0.5, volume, 10, clusters[i % clusters.length], "ev" + (i % 9)));
    }

    SelectionResult result = selector.select(ranked, tight, SelectionState.empty(BigDecimal.valueOf(500)));

    BigDecimal total = BigDecimal.ZERO;
    Map<String, BigDecimal> byCluster = new HashMap<>();
    Map<String, Integer> byEvent = new HashMap<>();
    Set<String> seen = new HashSet<>();
    for (AcceptedTrade t : result.accepted()) {
      total = total.add(t.stake());
      byCluster.merge(t.candidate().cluster(), t.stake(), BigDecimal::add);
      byEvent.merge(t.candidate().eventKey(), 1, Integer::sum);
      assertThat(seen.add(t.candidate().marketId())).isTrue();
    }
    assertThat(result.accepted()).isNotEmpty();
    assertThat(total).isLessThanOrEqualTo(new BigDecimal("300"));
    byCluster.values().forEach(v -> assertThat(v).isLessThanOrEqualTo(new BigDecimal("125")));
    byEvent.values().forEach(n -> assertThat(n).isLessThanOrEqualTo(2));
    assertThat(result.finalState().totalExposure()).isEqualByComparingTo(total);
  }
}
