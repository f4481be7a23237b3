package com.geobot.paper.strategy.model;

public enum SizingMode {
  /**
   * Flat stake per trade, taken from the strategy's {@code betSize}.
   */
  FIXED,
  /**
   * Stake picked from the shared three-tier volume schedule.
   */
  ADAPTIVE
}
