package com.geobot.paper.polymarket.gamma;

import com.geobot.paper.strategy.model.BetSide;

public record YesNoTokens(String yesTokenId, String noTokenId) {

  public static YesNoTokens none() {
    return new YesNoTokens("", "");
  }

  public String tokenFor(BetSide side) {
    return side == BetSide.YES ? yesTokenId : noTokenId;
  }
}
