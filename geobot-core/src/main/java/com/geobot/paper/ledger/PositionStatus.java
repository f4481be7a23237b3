package com.geobot.paper.ledger;

public enum PositionStatus {
  OPEN,
  RESOLVED_WIN,
  RESOLVED_LOSS,
  MANUALLY_CLOSED;

  public boolean isOpen() {
    return this == OPEN;
  }
}
