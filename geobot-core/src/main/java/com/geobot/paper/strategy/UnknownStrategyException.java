package com.geobot.paper.strategy;

import java.util.Collection;

/**
 * Thrown when a strategy id, group id or run target is not in the catalog.
 */
public class UnknownStrategyException extends RuntimeException {

  private final String target;

  public UnknownStrategyException(String kind, String target, Collection<String> available) {
    super("Unknown %s: %s. Available: %s".formatted(kind, target, available));
    this.target = target;
  }

  public String getTarget() {
    return target;
  }
}
