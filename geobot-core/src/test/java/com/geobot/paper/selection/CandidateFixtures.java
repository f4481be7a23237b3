package com.geobot.paper.selection;

import java.time.Duration;
import java.time.Instant;

public final class CandidateFixtures {

  public static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

  private CandidateFixtures() {
  }

  public static Candidate candidate(String id, double priceYes, double volume, double daysToClose) {
    return candidate(id, priceYes, volume, daysToClose, "ukraine", "event-" + id);
  }

  public static Candidate candidate(String id, double priceYes, double volume, double daysToClose,
                                    String cluster, String eventKey) {
    return new Candidate(
        id,
        "Question " + id,
        priceYes,
        volume,
        cluster,
        daysToClose,
        NOW.minus(Duration.ofDays(30)),
        NOW.plusSeconds(Math.round(daysToClose * 86_400)),
        "yes-" + id,
        "no-" + id,
        eventKey,
        StructureTag.NONE,
        null
    );
  }

  public static Candidate series(Candidate c) {
    return new Candidate(c.marketId(), c.question(), c.priceYes(), c.volume(), c.cluster(), c.daysToClose(),
        c.startTime(), c.endTime(), c.yesTokenId(), c.noTokenId(), c.eventKey(), StructureTag.SERIES, c.source());
  }

  public static Candidate withoutNoToken(Candidate c) {
    return new Candidate(c.marketId(), c.question(), c.priceYes(), c.volume(), c.cluster(), c.daysToClose(),
        c.startTime(), c.endTime(), c.yesTokenId(), "", c.eventKey(), c.structure(), c.source());
  }
}
