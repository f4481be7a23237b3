package com.geobot.paper.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobot.paper.market.TokenResolver;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class GammaTokenResolver implements TokenResolver {

  private final @NonNull ObjectMapper objectMapper;

  @Override
  public YesNoTokens resolve(JsonNode market) {
    return PolymarketMarketParser.yesNoTokens(market, objectMapper).orElseGet(YesNoTokens::none);
  }
}
