package com.geobot.paper.ledger;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

public interface ResolutionOracle {

  /**
   * Winning side when the market has resolved, empty while it is open or undecidable.
   */
  Optional<ResolutionOutcome> resolve(JsonNode market);
}
