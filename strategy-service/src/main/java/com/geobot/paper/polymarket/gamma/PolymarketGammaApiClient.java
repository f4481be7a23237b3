package com.geobot.paper.polymarket.gamma;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geobot.paper.config.GeobotProperties;
import com.geobot.paper.market.MarketSource;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Gamma REST client for the open-market feed and single-market lookups.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PolymarketGammaApiClient implements MarketSource {

  private final @NonNull @Qualifier("polymarketGammaApiRestClient") RestClient polymarketGammaApiRestClient;
  private final @NonNull ObjectMapper objectMapper;
  private final @NonNull GeobotProperties properties;

  /**
   * Page through {@code /markets?closed=false} until a short page or {@code geobot.gamma.max-markets}.
   * A failed page ends paging; markets collected so far are returned.
   */
  @Override
  public List<JsonNode> fetchOpenMarkets() {
    int pageLimit = properties.gamma().pageLimit();
    int maxMarkets = properties.gamma().maxMarkets();
    List<JsonNode> markets = new ArrayList<>();
    int offset = 0;
    while (markets.size() < maxMarkets) {
      List<JsonNode> page;
      try {
        page = fetchPage(pageLimit, offset);
      } catch (RestClientException e) {
        log.warn("Gamma /markets page failed offset={} collected={}: {}", offset, markets.size(), e.toString());
        break;
      }
      if (page.isEmpty()) {
        break;
      }
      for (JsonNode m : page) {
        if (markets.size() >= maxMarkets) {
          break;
        }
        markets.add(m);
      }
      offset += page.size();
      if (page.size() < pageLimit) {
        break;
      }
    }
    log.debug("Gamma feed returned {} open markets", markets.size());
    return markets;
  }

  private List<JsonNode> fetchPage(int limit, int offset) {
    String body = polymarketGammaApiRestClient.get()
        .uri(uriBuilder -> uriBuilder
            .path("/markets")
            .queryParam("closed", false)
            .queryParam("limit", limit)
            .queryParam("offset", offset)
            .build())
        .retrieve()
        .body(String.class);
    if (body == null || body.isBlank()) {
      return List.of();
    }
    return PolymarketMarketParser.extractMarkets(parse(body, "/markets offset=" + offset));
  }

  @Override
  public Optional<JsonNode> fetchMarket(String marketId) {
    if (marketId == null || marketId.isBlank()) {
      return Optional.empty();
    }
    try {
      String body = polymarketGammaApiRestClient.get()
          .uri("/markets/{id}", marketId)
          .retrieve()
          .body(String.class);
      if (body == null || body.isBlank()) {
        return Optional.empty();
      }
      JsonNode parsed = parse(body, "/markets/" + marketId);
      if (parsed.isArray()) {
        parsed = parsed.isEmpty() ? null : parsed.get(0);
      }
      return parsed == null || parsed.isNull() || parsed.isMissingNode() ? Optional.empty() : Optional.of(parsed);
    } catch (RestClientException e) {
      log.warn("Gamma market lookup failed id={}: {}", marketId, e.toString());
      return Optional.empty();
    }
  }

  private JsonNode parse(String body, String path) {
    try {
      return objectMapper.readTree(body);
    } catch (Exception e) {
      throw new RestClientException("Failed parsing gamma response path=%s".formatted(path), e);
    }
  }
}
