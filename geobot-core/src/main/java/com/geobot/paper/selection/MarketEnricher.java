package com.geobot.paper.selection;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobot.paper.classify.MarketClassification;
import com.geobot.paper.classify.MarketClassifier;
import com.geobot.paper.market.TokenResolver;
import com.geobot.paper.polymarket.gamma.PolymarketMarketParser;
import com.geobot.paper.polymarket.gamma.YesNoTokens;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns raw market records into {@link Candidate}s.
 *
 * Checks run in a fixed order and stop at the first failure: classification, timestamps, the
 * open/close buffer, then the YES price. Output depends only on the record and {@code now}.
 */
@Slf4j
public class MarketEnricher {

  static final int MAX_QUESTION_LENGTH = 100;
  private static final double SECONDS_PER_DAY = 86_400.0;

  private final MarketClassifier classifier;
  private final TokenResolver tokenResolver;
  private final ObjectMapper objectMapper;
  private final Duration buffer;

  public MarketEnricher(MarketClassifier classifier, TokenResolver tokenResolver, ObjectMapper objectMapper, Duration buffer) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.tokenResolver = Objects.requireNonNull(tokenResolver, "tokenResolver");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.buffer = Objects.requireNonNull(buffer, "buffer");
  }

  public static Duration bufferOfHours(double hours) {
    return Duration.ofMillis(Math.round(hours * 3_600_000.0));
  }

  public EnrichmentResult enrich(JsonNode market, Instant now) {
    String question = PolymarketMarketParser.question(market);
    MarketClassification classification = classifier.classify(question);
    if (!classification.geopolitical()) {
      return EnrichmentResult.rejected(RejectReason.NOT_GEOPOLITICAL);
    }

    Optional<Instant> start = PolymarketMarketParser.startTime(market);
    Optional<Instant> end = PolymarketMarketParser.endTime(market);
    if (start.isEmpty() || end.isEmpty()) {
      return EnrichmentResult.rejected(RejectReason.MISSING_TIMESTAMPS);
    }
    if (Duration.between(start.get(), now).compareTo(buffer) < 0) {
      return EnrichmentResult.rejected(RejectReason.TOO_SOON_AFTER_OPEN);
    }
    if (Duration.between(now, end.get()).compareTo(buffer) < 0) {
      return EnrichmentResult.rejected(RejectReason.TOO_CLOSE_TO_END);
    }

    OptionalDouble priceYes = PolymarketMarketParser.yesPrice(market, objectMapper);
    if (priceYes.isEmpty() || !(priceYes.getAsDouble() > 0.0 && priceYes.getAsDouble() < 1.0)) {
      return EnrichmentResult.rejected(RejectReason.INVALID_PRICE);
    }

    String marketId = PolymarketMarketParser.marketId(market);
    if (marketId == null) {
      return EnrichmentResult.rejected(RejectReason.MISSING_ID);
    }

    String groupTitle = PolymarketMarketParser.text(market, "groupItemTitle");
    String slug = PolymarketMarketParser.text(market, "slug");
    String eventKey = groupTitle != null ? groupTitle : slug != null ? slug : "";
    YesNoTokens tokens = tokenResolver.resolve(market);
    double daysToClose = Duration.between(now, end.get()).toMillis() / 1000.0 / SECONDS_PER_DAY;

    return EnrichmentResult.accepted(new Candidate(
        marketId,
        truncate(question),
        priceYes.getAsDouble(),
        PolymarketMarketParser.volume(market),
        classification.cluster(),
        daysToClose,
        start.get(),
        end.get(),
        tokens.yesTokenId(),
        tokens.noTokenId(),
        eventKey,
        groupTitle != null ? StructureTag.SERIES : StructureTag.NONE,
        market
    ));
  }

  /**
   * Enrich a whole feed. Rejected records are dropped and counted per reason at debug level.
   */
  public List<Candidate> enrichAll(List<JsonNode> markets, Instant now) {
    List<Candidate> out = new ArrayList<>();
    Map<RejectReason, Integer> rejected = new EnumMap<>(RejectReason.class);
    for (JsonNode market : markets) {
      if (market == null || market.isNull()) {
        continue;
      }
      EnrichmentResult result = enrich(market, now);
      if (result.isAccepted()) {
        out.add(result.candidate());
      } else {
        rejected.merge(result.rejectReason(), 1, Integer::sum);
      }
    }
    log.debug("enriched {} of {} markets, rejected={}", out.size(), markets.size(), rejected);
    return List.copyOf(out);
  }

  private static String truncate(String question) {
    return question.length() <= MAX_QUESTION_LENGTH ? question : question.substring(0, MAX_QUESTION_LENGTH);
  }
}
