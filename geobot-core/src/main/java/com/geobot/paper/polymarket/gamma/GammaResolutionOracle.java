package com.geobot.paper.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobot.paper.ledger.ResolutionOracle;
import com.geobot.paper.ledger.ResolutionOutcome;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reads the winning side off a Gamma market record.
 *
 * Only closed or resolved markets are decided. The explicit {@code outcome} field is tried first,
 * then the free-text {@code resolution} field, then settled outcome prices (one side at 0.99 or above while
 * the other is at 0.01 or below), mapped through the outcome labels.
 */
@RequiredArgsConstructor
public class GammaResolutionOracle implements ResolutionOracle {

  static final double SETTLED_HIGH = 0.99;
  static final double SETTLED_LOW = 0.01;
  private static final Set<String> YES_VALUES = Set.of("yes", "1", "true");
  private static final Set<String> NO_VALUES = Set.of("no", "0", "false");
  private static final Pattern YES_WORD = Pattern.compile("\\byes\\b");
  private static final Pattern NO_WORD = Pattern.compile("\\bno\\b");

  private final @NonNull ObjectMapper objectMapper;

  @Override
  public Optional<ResolutionOutcome> resolve(JsonNode market) {
    if (market == null || market.isNull()) {
      return Optional.empty();
    }
    if (!PolymarketMarketParser.flag(market, "closed") && !PolymarketMarketParser.flag(market, "resolved")) {
      return Optional.empty();
    }

    String outcome = PolymarketMarketParser.text(market, "outcome");
    if (outcome != null) {
      String o = outcome.toLowerCase(Locale.ROOT);
      if (YES_VALUES.contains(o)) {
        return Optional.of(ResolutionOutcome.YES);
      }
      if (NO_VALUES.contains(o)) {
        return Optional.of(ResolutionOutcome.NO);
      }
    }

    String resolution = PolymarketMarketParser.text(market, "resolution");
    if (resolution != null) {
      String r = resolution.toLowerCase(Locale.ROOT);
      if (YES_WORD.matcher(r).find()) {
        return Optional.of(ResolutionOutcome.YES);
      }
      if (NO_WORD.matcher(r).find()) {
        return Optional.of(ResolutionOutcome.NO);
      }
    }

    return fromSettledPrices(market);
  }

  private Optional<ResolutionOutcome> fromSettledPrices(JsonNode market) {
    List<String> prices = PolymarketMarketParser.outcomePrices(market, objectMapper);
    if (prices.size() < 2) {
      return Optional.empty();
    }
    OptionalDouble p0 = PolymarketMarketParser.parseDouble(prices.get(0));
    OptionalDouble p1 = PolymarketMarketParser.parseDouble(prices.get(1));
    if (p0.isEmpty() || p1.isEmpty()) {
      return Optional.empty();
    }
    List<String> outcomes = PolymarketMarketParser.outcomes(market, objectMapper);
    if (p0.getAsDouble() >= SETTLED_HIGH && p1.getAsDouble() <= SETTLED_LOW) {
      if (outcomes.isEmpty()) {
        return Optional.of(ResolutionOutcome.YES);
      }
      return Optional.of("yes".equalsIgnoreCase(outcomes.get(0)) ? ResolutionOutcome.YES : ResolutionOutcome.NO);
    }
    if (p1.getAsDouble() >= SETTLED_HIGH && p0.getAsDouble() <= SETTLED_LOW) {
      if (outcomes.size() < 2) {
        return Optional.of(ResolutionOutcome.NO);
      }
      return Optional.of("no".equalsIgnoreCase(outcomes.get(1)) ? ResolutionOutcome.NO : ResolutionOutcome.YES);
    }
    return Optional.empty();
  }
}
