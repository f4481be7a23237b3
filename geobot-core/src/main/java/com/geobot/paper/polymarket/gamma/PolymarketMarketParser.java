package com.geobot.paper.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;

/**
 * Field access for Gamma market records.
 *
 * Gamma serves several list fields ({@code outcomes}, {@code outcomePrices}, {@code clobTokenIds})
 * either as JSON arrays or as JSON-encoded strings; every reader here accepts both.
 */
public final class PolymarketMarketParser {

  private static final long EPOCH_MILLIS_THRESHOLD = 100_000_000_000L;

  private PolymarketMarketParser() {
  }

  public static List<JsonNode> extractMarkets(JsonNode root) {
    if (root == null || root.isNull() || !root.isArray()) {
      return List.of();
    }
    List<JsonNode> out = new ArrayList<>();
    for (JsonNode n : root) {
      if (n == null || n.isNull()) {
        continue;
      }
      JsonNode markets = n.get("markets");
      if (markets != null && markets.isArray()) {
        for (JsonNode m : markets) {
          if (m != null && !m.isNull()) {
            out.add(m);
          }
        }
      } else {
        out.add(n);
      }
    }
    return out;
  }

  public static String marketId(JsonNode market) {
    String id = text(market, "id");
    if (id == null) {
      id = text(market, "conditionId");
    }
    return id;
  }

  public static String question(JsonNode market) {
    String q = text(market, "question");
    return q == null ? "" : q;
  }

  public static String text(JsonNode node, String field) {
    if (node == null) {
      return null;
    }
    JsonNode v = node.get(field);
    if (v == null || v.isNull()) {
      return null;
    }
    String s = v.asText("").trim();
    return s.isEmpty() ? null : s;
  }

  public static List<String> stringList(JsonNode market, String field, ObjectMapper objectMapper) {
    JsonNode v = market == null ? null : market.get(field);
    if (v == null || v.isNull()) {
      return List.of();
    }
    JsonNode arr = v;
    if (v.isTextual()) {
      String raw = v.asText("").trim();
      if (raw.isEmpty()) {
        return List.of();
      }
      try {
        arr = objectMapper.readTree(raw);
      } catch (Exception e) {
        return List.of();
      }
    }
    if (arr == null || !arr.isArray()) {
      return List.of();
    }
    List<String> out = new ArrayList<>(arr.size());
    for (JsonNode n : arr) {
      out.add(n == null || n.isNull() ? "" : n.asText("").trim());
    }
    return out;
  }

  public static List<String> outcomes(JsonNode market, ObjectMapper objectMapper) {
    return stringList(market, "outcomes", objectMapper);
  }

  public static List<String> outcomePrices(JsonNode market, ObjectMapper objectMapper) {
    return stringList(market, "outcomePrices", objectMapper);
  }

  public static Optional<YesNoTokens> yesNoTokens(JsonNode market, ObjectMapper objectMapper) {
    List<String> tokenIds = stringList(market, "clobTokenIds", objectMapper);
    if (tokenIds.size() < 2) {
      return Optional.empty();
    }
    List<String> outcomes = outcomes(market, objectMapper);
    String yes = null;
    String no = null;
    for (int i = 0; i < outcomes.size() && i < tokenIds.size(); i++) {
      String label = outcomes.get(i).toLowerCase(Locale.ROOT);
      if ("yes".equals(label)) {
        yes = tokenIds.get(i);
      } else if ("no".equals(label)) {
        no = tokenIds.get(i);
      }
    }
    if (yes == null || no == null) {
      yes = tokenIds.get(0);
      no = tokenIds.get(1);
    }
    if (yes.isBlank() || no.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new YesNoTokens(yes, no));
  }

  /**
   * YES price: the price at the outcome labelled "Yes", else the first price of the market.
   */
  public static OptionalDouble yesPrice(JsonNode market, ObjectMapper objectMapper) {
    List<String> prices = outcomePrices(market, objectMapper);
    if (prices.isEmpty()) {
      return OptionalDouble.empty();
    }
    List<String> outcomes = outcomes(market, objectMapper);
    for (int i = 0; i < outcomes.size() && i < prices.size(); i++) {
      if ("yes".equalsIgnoreCase(outcomes.get(i))) {
        return parseDouble(prices.get(i));
      }
    }
    return parseDouble(prices.get(0));
  }

  /**
   * Traded volume, from {@code volume} then {@code volumeNum}; zero when neither parses.
   */
  public static double volume(JsonNode market) {
    for (String field : List.of("volume", "volumeNum")) {
      JsonNode v = market == null ? null : market.get(field);
      if (v == null || v.isNull()) {
        continue;
      }
      OptionalDouble parsed = v.isNumber() ? OptionalDouble.of(v.asDouble()) : parseDouble(v.asText(""));
      if (parsed.isPresent() && Double.isFinite(parsed.getAsDouble()) && parsed.getAsDouble() >= 0) {
        return parsed.getAsDouble();
      }
    }
    return 0.0;
  }

  public static Optional<Instant> startTime(JsonNode market) {
    Optional<Instant> start = timestamp(market, "startDate");
    return start.isPresent() ? start : timestamp(market, "createdAt");
  }

  public static Optional<Instant> endTime(JsonNode market) {
    return timestamp(market, "endDate");
  }

  public static Optional<Instant> timestamp(JsonNode market, String field) {
    JsonNode v = market == null ? null : market.get(field);
    if (v == null || v.isNull()) {
      return Optional.empty();
    }
    if (v.isNumber()) {
      return Optional.of(fromEpoch(v.asDouble()));
    }
    return parseInstant(v.asText(""));
  }

  static Optional<Instant> parseInstant(String raw) {
    String s = raw == null ? "" : raw.trim();
    if (s.isEmpty()) {
      return Optional.empty();
    }
    return tryParse(s, v -> OffsetDateTime.parse(v).toInstant())
        .or(() -> tryParse(s, v -> LocalDateTime.parse(v).toInstant(ZoneOffset.UTC)))
        .or(() -> tryParse(s, v -> LocalDate.parse(v).atStartOfDay(ZoneOffset.UTC).toInstant()))
        .or(() -> epochInstant(s));
  }

  private static Optional<Instant> epochInstant(String raw) {
    OptionalDouble epoch = parseDouble(raw);
    if (epoch.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(fromEpoch(epoch.getAsDouble()));
  }

  private static Optional<Instant> tryParse(String raw, Function<String, Instant> parser) {
    try {
      return Optional.of(parser.apply(raw));
    } catch (DateTimeParseException e) {
      return Optional.empty();
    }
  }

  private static Instant fromEpoch(double value) {
    if (Math.abs(value) >= EPOCH_MILLIS_THRESHOLD) {
      return Instant.ofEpochMilli((long) value);
    }
    return Instant.ofEpochMilli(Math.round(value * 1000.0));
  }

  public static boolean flag(JsonNode market, String field) {
    JsonNode v = market == null ? null : market.get(field);
    if (v == null || v.isNull()) {
      return false;
    }
    if (v.isBoolean()) {
      return v.booleanValue();
    }
    return "true".equalsIgnoreCase(v.asText("").trim());
  }

  public static OptionalDouble parseDouble(String raw) {
    if (raw == null || raw.isBlank()) {
      return OptionalDouble.empty();
    }
    try {
      double d = Double.parseDouble(raw.trim());
      return Double.isNaN(d) ? OptionalDouble.empty() : OptionalDouble.of(d);
    } catch (NumberFormatException e) {
      return OptionalDouble.empty();
    }
  }
}
