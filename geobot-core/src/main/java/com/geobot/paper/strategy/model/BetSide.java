package com.geobot.paper.strategy.model;

/**
 * Side of a binary market a strategy always buys.
 */
public enum BetSide {
  YES,
  NO;

  /**
   * Price of this side given the YES price of the market.
   */
  public double priceFromYes(double priceYes) {
    return this == YES ? priceYes : 1.0 - priceYes;
  }
}
