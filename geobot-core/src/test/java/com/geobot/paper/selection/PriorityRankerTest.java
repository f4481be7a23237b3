package com.geobot.paper.selection;

import com.geobot.paper.strategy.model.PriorityPolicy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.geobot.paper.selection.CandidateFixtures.candidate;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PriorityRankerTest {

  // price rises as volume falls
  private final List<Candidate> pool = List.of(
      candidate("a", 0.45, 80_000, 30),
      candidate("b", 0.75, 2_000, 10),
      candidate("c", 0.60, 20_000, 5),
      candidate("d", 0.50, 40_000, 90)
  );

  @Test
  void priceHighSortsByYesPriceDescending() {
    assertThat(PriorityRanker.rank(pool, PriorityPolicy.PRICE_HIGH))
        .extracting(Candidate::marketId)
        .containsExactly("b", "c", "d", "a");
  }

  @Test
  void volumeLowSortsByVolumeAscending() {
    assertThat(PriorityRanker.rank(pool, PriorityPolicy.VOLUME_LOW))
        .extracting(Candidate::marketId)
        .containsExactly("b", "c", "d", "a");
  }

  @Test
  void priceHighAndVolumeLowReverseEachOtherWhenPriceTracksVolume() {
    List<Candidate> correlated = List.of(
        candidate("a", 0.45, 2_000, 30),
        candidate("b", 0.75, 80_000, 10),
        candidate("c", 0.60, 20_000, 5)
    );

    List<Candidate> byPrice = PriorityRanker.rank(correlated, PriorityPolicy.PRICE_HIGH);
    List<Candidate> byVolume = new ArrayList<>(PriorityRanker.rank(correlated, PriorityPolicy.VOLUME_LOW));
    Collections.reverse(byVolume);

    assertThat(byPrice).containsExactlyElementsOf(byVolume);
  }

  @Test
  void rotationPrefersLowVolumeShortDeadlineHighPrice() {
    // a: 16 + 30 + 55 = 101, b: 0.4 + 10 + 25 = 35.4, c: 4 + 5 + 40 = 49, d: 8 + 90 + 50 = 148
    assertThat(PriorityRanker.rotationScore(pool.get(1))).isCloseTo(35.4, within(1e-9));
    assertThat(PriorityRanker.rank(pool, PriorityPolicy.ROTATION))
        .extracting(Candidate::marketId)
        .containsExactly("b", "c", "a", "d");
  }

  @Test
  void rotationCapsVolumeAndDeadlineTerms() {
    Candidate huge = candidate("huge", 0.50, 10_000_000, 5_000);

    assertThat(PriorityRanker.rotationScore(huge)).isCloseTo(100 + 100 + 50, within(1e-9));
  }

  @Test
  void rotationScoreIsNonNegative() {
    for (Candidate c : pool) {
      assertThat(PriorityRanker.rotationScore(c)).isGreaterThanOrEqualTo(0.0);
    }
  }

  @Test
  void unrankedKeepsInputOrder() {
    assertThat(PriorityRanker.rank(pool, PriorityPolicy.UNRANKED)).containsExactlyElementsOf(pool);
    assertThat(PriorityRanker.rank(pool, PriorityPolicy.fromId("most_exciting"))).containsExactlyElementsOf(pool);
  }

  @Test
  void tiesKeepInputOrder() {
    List<Candidate> ties = List.of(
        candidate("x", 0.50, 1_000, 10),
        candidate("y", 0.50, 1_000, 10),
        candidate("z", 0.50, 1_000, 10)
    );

    assertThat(PriorityRanker.rank(ties, PriorityPolicy.PRICE_HIGH))
        .extracting(Candidate::marketId)
        .containsExactly("x", "y", "z");
  }
}
