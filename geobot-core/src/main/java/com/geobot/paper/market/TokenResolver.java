package com.geobot.paper.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.geobot.paper.polymarket.gamma.YesNoTokens;

public interface TokenResolver {

  /**
   * Instrument ids for both sides of a market; blank ids when the record carries none.
   */
  YesNoTokens resolve(JsonNode market);
}
