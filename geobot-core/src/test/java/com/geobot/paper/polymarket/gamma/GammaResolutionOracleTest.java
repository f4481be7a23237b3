package com.geobot.paper.polymarket.gamma;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobot.paper.ledger.ResolutionOutcome;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class GammaResolutionOracleTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final GammaResolutionOracle oracle = new GammaResolutionOracle(objectMapper);

  private Optional<ResolutionOutcome> resolve(String raw) throws Exception {
    return oracle.resolve(objectMapper.readTree(raw));
  }

  @Test
  void openMarketIsUndecided() throws Exception {
    assertThat(resolve("{\"closed\": false, \"outcome\": \"Yes\", \"outcomePrices\": [\"1\", \"0\"]}")).isEmpty();
  }

  @Test
  void explicitOutcomeWins() throws Exception {
    assertThat(resolve("{\"closed\": true, \"outcome\": \"Yes\", \"outcomePrices\": [\"0\", \"1\"]}"))
        .contains(ResolutionOutcome.YES);
    assertThat(resolve("{\"resolved\": true, \"outcome\": \"0\"}")).contains(ResolutionOutcome.NO);
  }

  @Test
  void resolutionTextIsUsedWhenOutcomeIsAbsent() throws Exception {
    assertThat(resolve("{\"closed\": true, \"resolution\": \"Resolved YES\"}")).contains(ResolutionOutcome.YES);
    assertThat(resolve("{\"closed\": true, \"resolution\": \"no\"}")).contains(ResolutionOutcome.NO);
  }

  @Test
  void resolutionTextMatchesWholeWordsOnly() throws Exception {
    assertThat(resolve("{\"closed\": true, \"resolution\": \"unknown\"}")).isEmpty();
    assertThat(resolve("{\"closed\": true, \"resolution\": \"cannot determine\"}")).isEmpty();
    assertThat(resolve("{\"closed\": true, \"resolution\": \"Eyes only\"}")).isEmpty();
    assertThat(resolve("""
        {"closed": true, "resolution": "unknown", "outcomes": ["Yes", "No"], "outcomePrices": ["1", "0"]}
        """)).contains(ResolutionOutcome.YES);
  }

  @Test
  void settledPricesAreMappedThroughLabels() throws Exception {
    assertThat(resolve("""
        {"closed": true, "outcomes": ["Yes", "No"], "outcomePrices": ["0", "1"]}
        """)).contains(ResolutionOutcome.NO);
    assertThat(resolve("""
        {"closed": true, "outcomes": "[\\"No\\", \\"Yes\\"]", "outcomePrices": "[\\"0.995\\", \\"0.005\\"]"}
        """)).contains(ResolutionOutcome.NO);
    assertThat(resolve("""
        {"closed": true, "outcomePrices": ["1", "0"]}
        """)).contains(ResolutionOutcome.YES);
  }

  @Test
  void closedButUnsettledMarketIsUndecided() throws Exception {
    assertThat(resolve("""
        {"closed": true, "outcomes": ["Yes", "No"], "outcomePrices": ["0.6", "0.4"]}
        """)).isEmpty();
    assertThat(oracle.resolve(null)).isEmpty();
  }
}
