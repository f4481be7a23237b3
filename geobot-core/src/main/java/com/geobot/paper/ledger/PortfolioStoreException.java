package com.geobot.paper.ledger;

public class PortfolioStoreException extends RuntimeException {

  public PortfolioStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
