package com.geobot.paper.selection;

import com.geobot.paper.strategy.model.AdaptiveSizing;
import com.geobot.paper.strategy.model.SizingMode;
import com.geobot.paper.strategy.model.Strategy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;

@RequiredArgsConstructor
public class SizingResolver {

  private final @NonNull AdaptiveSizing adaptiveSizing;

  public BigDecimal betSize(Strategy strategy, double volume) {
    if (strategy.sizing() == SizingMode.ADAPTIVE) {
      return adaptiveSizing.betSize(volume);
    }
    return strategy.betSize();
  }
}
