package com.geobot.paper.runner;

import com.geobot.paper.ledger.Position;

import java.math.BigDecimal;
import java.util.List;

public record ManualCloseResult(String strategyId, List<Position> closed, BigDecimal bankroll) {

  public ManualCloseResult {
    closed = List.copyOf(closed);
  }
}
