package com.geobot.paper.selection;

import com.fasterxml.jackson.databind.JsonNode;
import com.geobot.paper.strategy.model.BetSide;

import java.time.Instant;
import java.util.Objects;

/**
 * A market that passed topical, temporal and price screening for the current run.
 *
 * Shared read-only by every strategy evaluated in the run. {@code eventKey} may be empty, in which
 * case all such markets count against one event bucket.
 */
public record Candidate(
    String marketId,
    String question,
    double priceYes,
    double volume,
    String cluster,
    double daysToClose,
    Instant startTime,
    Instant endTime,
    String yesTokenId,
    String noTokenId,
    String eventKey,
    StructureTag structure,
    JsonNode source
) {

  public Candidate {
    Objects.requireNonNull(marketId, "marketId");
    Objects.requireNonNull(startTime, "startTime");
    Objects.requireNonNull(endTime, "endTime");
    question = question == null ? "" : question;
    cluster = cluster == null ? "other" : cluster;
    yesTokenId = yesTokenId == null ? "" : yesTokenId;
    noTokenId = noTokenId == null ? "" : noTokenId;
    eventKey = eventKey == null ? "" : eventKey;
    structure = structure == null ? StructureTag.NONE : structure;
  }

  public String tokenFor(BetSide side) {
    return side == BetSide.YES ? yesTokenId : noTokenId;
  }

  public double entryPrice(BetSide side) {
    return side.priceFromYes(priceYes);
  }

  public boolean series() {
    return structure == StructureTag.SERIES;
  }
}
