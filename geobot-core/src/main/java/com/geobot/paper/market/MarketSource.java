package com.geobot.paper.market;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Raw market records as served by the exchange.
 */
public interface MarketSource {

  /**
   * All currently open markets.
   */
  List<JsonNode> fetchOpenMarkets();

  /**
   * A single market by id, including closed markets no longer returned by {@link #fetchOpenMarkets()}.
   */
  Optional<JsonNode> fetchMarket(String marketId);
}
