package com.geobot.paper.ledger;

import com.geobot.paper.strategy.model.Strategy;

public interface PortfolioStore {

  /**
   * Load the portfolio stored under {@code key}, or a fresh one for the strategy when none exists.
   *
   * @throws PortfolioStoreException when a stored portfolio exists but cannot be read
   */
  Portfolio load(String key, Strategy strategy);

  /**
   * @throws PortfolioStoreException when the portfolio cannot be written
   */
  void save(String key, Portfolio portfolio);
}
