package com.geobot.paper.ledger;

import com.geobot.paper.strategy.model.BetSide;

/**
 * Side that won a resolved binary market.
 */
public enum ResolutionOutcome {
  YES,
  NO;

  public boolean winsFor(BetSide side) {
    return (this == YES) == (side == BetSide.YES);
  }
}
