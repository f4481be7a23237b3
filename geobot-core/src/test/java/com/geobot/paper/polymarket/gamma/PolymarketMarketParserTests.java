package com.geobot.paper.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobot.paper.strategy.model.BetSide;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PolymarketMarketParserTests {

  private final ObjectMapper objectMapper = new ObjectMapper();

  private JsonNode json(String raw) throws Exception {
    return objectMapper.readTree(raw);
  }

  @Test
  void extractMarketsFlattensEventsAndKeepsPlainMarkets() throws Exception {
    JsonNode root = json("""
        [
          {"id": "event-1", "markets": [{"id": "m1"}, null, {"id": "m2"}]},
          {"id": "m3"},
          null
        ]
        """);

    List<JsonNode> markets = PolymarketMarketParser.extractMarkets(root);

    assertThat(markets).extracting(PolymarketMarketParser::marketId).containsExactly("m1", "m2", "m3");
    assertThat(PolymarketMarketParser.extractMarkets(json("{\"id\": \"x\"}"))).isEmpty();
  }

  @Test
  void marketIdFallsBackToConditionId() throws Exception {
    assertThat(PolymarketMarketParser.marketId(json("{\"conditionId\": \"0xabc\"}"))).isEqualTo("0xabc");
    assertThat(PolymarketMarketParser.marketId(json("{\"id\": \"  \"}"))).isNull();
  }

  @Test
  void tokensAreReadFromEncodedStringsOrArrays() throws Exception {
    JsonNode encoded = json("""
        {"outcomes": "[\\"Yes\\", \\"No\\"]", "clobTokenIds": "[\\"111\\", \\"222\\"]"}
        """);
    JsonNode arrays = json("""
        {"outcomes": ["No", "Yes"], "clobTokenIds": ["222", "111"]}
        """);

    assertThat(PolymarketMarketParser.yesNoTokens(encoded, objectMapper)).contains(new YesNoTokens("111", "222"));
    assertThat(PolymarketMarketParser.yesNoTokens(arrays, objectMapper)).contains(new YesNoTokens("111", "222"));
  }

  @Test
  void tokensFallBackToPositionWhenLabelsAreNotYesNo() throws Exception {
    JsonNode market = json("""
        {"outcomes": ["Trump", "Harris"], "clobTokenIds": ["1", "2"]}
        """);

    YesNoTokens tokens = PolymarketMarketParser.yesNoTokens(market, objectMapper).orElseThrow();

    assertThat(tokens.tokenFor(BetSide.YES)).isEqualTo("1");
    assertThat(tokens.tokenFor(BetSide.NO)).isEqualTo("2");
  }

  @Test
  void missingOrMalformedTokensResolveToNothing() throws Exception {
    assertThat(PolymarketMarketParser.yesNoTokens(json("{\"clobTokenIds\": \"[\\\"1\\\"]\"}"), objectMapper)).isEmpty();
    assertThat(PolymarketMarketParser.yesNoTokens(json("{\"clobTokenIds\": \"not json\"}"), objectMapper)).isEmpty();
    assertThat(new GammaTokenResolver(objectMapper).resolve(json("{}"))).isEqualTo(YesNoTokens.none());
  }

  @Test
  void yesPriceFollowsTheYesLabel() throws Exception {
    JsonNode labelled = json("""
        {"outcomes": ["No", "Yes"], "outcomePrices": ["0.3", "0.7"]}
        """);
    JsonNode unlabelled = json("""
        {"outcomePrices": "[\\"0.45\\", \\"0.55\\"]"}
        """);

    assertThat(PolymarketMarketParser.yesPrice(labelled, objectMapper)).hasValue(0.7);
    assertThat(PolymarketMarketParser.yesPrice(unlabelled, objectMapper)).hasValue(0.45);
    assertThat(PolymarketMarketParser.yesPrice(json("{}"), objectMapper)).isEmpty();
  }

  @Test
  void volumeFallsBackToVolumeNumThenZero() throws Exception {
    assertThat(PolymarketMarketParser.volume(json("{\"volume\": \"1234.5\"}"))).isEqualTo(1234.5);
    assertThat(PolymarketMarketParser.volume(json("{\"volume\": \"\", \"volumeNum\": 99}"))).isEqualTo(99.0);
    assertThat(PolymarketMarketParser.volume(json("{\"volume\": -5}"))).isZero();
    assertThat(PolymarketMarketParser.volume(json("{}"))).isZero();
  }

  @Test
  void timestampsAcceptIsoDatesAndEpochs() throws Exception {
    Instant expected = Instant.parse("2025-03-31T12:00:00Z");

    assertThat(PolymarketMarketParser.parseInstant("2025-03-31T12:00:00Z")).contains(expected);
    assertThat(PolymarketMarketParser.parseInstant("2025-03-31T14:00:00+02:00")).contains(expected);
    assertThat(PolymarketMarketParser.parseInstant("2025-03-31T12:00:00")).contains(expected);
    assertThat(PolymarketMarketParser.parseInstant("2025-03-31")).contains(Instant.parse("2025-03-31T00:00:00Z"));
    assertThat(PolymarketMarketParser.parseInstant(String.valueOf(expected.getEpochSecond()))).contains(expected);
    assertThat(PolymarketMarketParser.parseInstant(String.valueOf(expected.toEpochMilli()))).contains(expected);
    assertThat(PolymarketMarketParser.parseInstant("end of March")).isEmpty();
    assertThat(PolymarketMarketParser.parseInstant(" ")).isEmpty();
  }

  @Test
  void startTimeFallsBackToCreatedAt() throws Exception {
    JsonNode market = json("{\"createdAt\": 1740830400}");

    assertThat(PolymarketMarketParser.startTime(market)).contains(Instant.ofEpochSecond(1740830400L));
    assertThat(PolymarketMarketParser.endTime(market)).isEmpty();
  }

  @Test
  void flagsAcceptBooleansAndStrings() throws Exception {
    JsonNode market = json("{\"closed\": true, \"resolved\": \"TRUE\", \"active\": \"no\"}");

    assertThat(PolymarketMarketParser.flag(market, "closed")).isTrue();
    assertThat(PolymarketMarketParser.flag(market, "resolved")).isTrue();
    assertThat(PolymarketMarketParser.flag(market, "active")).isFalse();
    assertThat(PolymarketMarketParser.flag(market, "archived")).isFalse();
  }
}
