package com.geobot.paper.config;

import com.geobot.paper.strategy.model.BetSide;
import com.geobot.paper.strategy.model.SizingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="geobot")
public record GeobotProperties(
    @Valid Gamma gamma,
    @Valid Enrichment enrichment,
    @Valid Sizing sizing,
    @Valid Portfolio portfolio,
    @Valid Telegram telegram,
    @Valid Run run,
    List<@Valid StrategyProperties> strategies,
    Map<String, List<String>> groups
) {

  public GeobotProperties {
    if (gamma == null) {
      gamma = new Gamma(null, null, null);
    }
    if (enrichment == null) {
      enrichment = new Enrichment(null);
    }
    if (sizing == null) {
      sizing = new Sizing(null, null, null, null, null);
    }
    if (portfolio == null) {
      portfolio = new Portfolio(null, null, null);
    }
    if (telegram == null) {
      telegram = new Telegram(null, null, null, null);
    }
    if (run == null) {
      run = new Run(null, null, null, null, null);
    }
    strategies = strategies == null ? List.of() : strategies.stream().filter(Objects::nonNull).toList();
    groups = sanitizeGroups(groups);
  }

  private static Map<String, List<String>> sanitizeGroups(Map<String, List<String>> groups) {
    if (groups == null || groups.isEmpty()) {
      return Map.of();
    }
    Map<String, List<String>> out = new LinkedHashMap<>();
    groups.forEach((name, members) -> out.put(name, sanitizeStringList(members)));
    return out;
  }

  private static List<String> sanitizeStringList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  public record Gamma(
      String baseUrl,
      @Min(1) Integer pageLimit,
      /**
       * Upper bound on markets pulled per run; paging stops once reached.
       */
      @Min(1) Integer maxMarkets
  ) {
    public Gamma {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://gamma-api.polymarket.com";
      }
      if (pageLimit == null) {
        pageLimit = 100;
      }
      if (maxMarkets == null) {
        maxMarkets = 5000;
      }
    }
  }

  public record Enrichment(
      /**
       * Minimum hours since a market opened, and minimum hours left before it ends.
       */
      @NotNull @PositiveOrZero Double bufferHours
  ) {
    public Enrichment {
      if (bufferHours == null) {
        bufferHours = 48.0;
      }
    }
  }

  /**
   * Volume schedule shared by every strategy running in {@link SizingMode#ADAPTIVE} mode.
   */
  public record Sizing(
      @PositiveOrZero Double lowVolumeThreshold,
      @PositiveOrZero Double midVolumeThreshold,
      @Positive BigDecimal smallBetUsd,
      @Positive BigDecimal mediumBetUsd,
      @Positive BigDecimal largeBetUsd
  ) {
    public Sizing {
      if (lowVolumeThreshold == null) {
        lowVolumeThreshold = 5_000.0;
      }
      if (midVolumeThreshold == null) {
        midVolumeThreshold = 50_000.0;
      }
      if (smallBetUsd == null) {
        smallBetUsd = BigDecimal.valueOf(5);
      }
      if (mediumBetUsd == null) {
        mediumBetUsd = BigDecimal.valueOf(10);
      }
      if (largeBetUsd == null) {
        largeBetUsd = BigDecimal.valueOf(25);
      }
    }
  }

  public record Portfolio(
      String dir,
      String historyFile,
      @Min(1) Integer historyLimit
  ) {
    public Portfolio {
      if (dir == null || dir.isBlank()) {
        dir = "portfolios";
      }
      if (historyFile == null || historyFile.isBlank()) {
        historyFile = "bot_history.json";
      }
      if (historyLimit == null) {
        historyLimit = 100;
      }
    }
  }

  public record Telegram(
      Boolean enabled,
      String botToken,
      String chatId,
      String baseUrl
  ) {
    public Telegram {
      if (enabled == null) {
        enabled = false;
      }
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "https://api.telegram.org";
      }
    }

    public boolean configured() {
      return enabled && botToken != null && !botToken.isBlank() && chatId != null && !chatId.isBlank();
    }
  }

  public record Run(
      @NotBlank String defaultTarget,
      @Min(1) Integer parallelism,
      Boolean scheduleEnabled,
      @Min(1000) Long pollIntervalMillis,
      /**
       * Target (strategy or group) to run once after startup. Blank disables the startup run.
       */
      String onStartup
  ) {
    public Run {
      if (defaultTarget == null || defaultTarget.isBlank()) {
        defaultTarget = "standard";
      }
      if (parallelism == null) {
        parallelism = 1;
      }
      if (scheduleEnabled == null) {
        scheduleEnabled = false;
      }
      if (pollIntervalMillis == null) {
        pollIntervalMillis = 3_600_000L;
      }
    }
  }

  /**
   * One strategy as written in configuration. Missing keys take the catalog-wide defaults.
   */
  public record StrategyProperties(
      @NotBlank String id,
      String name,
      String description,
      BetSide betSide,
      Double priceYesMin,
      Double priceYesMax,
      List<@Valid ZoneProperties> zones,
      @PositiveOrZero Double minVolume,
      Double maxVolume,
      SizingMode sizing,
      @Positive BigDecimal betSize,
      String priority,
      Double deadlineMin,
      Double deadlineMax,
      @Min(1) Integer eventCap,
      Boolean excludeSeries,
      @Positive BigDecimal bankroll,
      @DecimalMin("0.0") @DecimalMax("1.0") Double maxTotalExposurePct,
      @DecimalMin("0.0") @DecimalMax("1.0") Double maxClusterExposurePct,
      @DecimalMin("0.0") @DecimalMax("1.0") Double entryCostRate,
      List<String> clusterFilter,
      String portfolioFile
  ) {
    public StrategyProperties {
      if (name == null || name.isBlank()) {
        name = id;
      }
      if (description == null) {
        description = "";
      }
      if (betSide == null) {
        betSide = BetSide.NO;
      }
      zones = zones == null ? List.of() : zones.stream().filter(Objects::nonNull).toList();
      if (minVolume == null) {
        minVolume = 0.0;
      }
      if (maxVolume == null) {
        maxVolume = Double.POSITIVE_INFINITY;
      }
      if (sizing == null) {
        sizing = SizingMode.FIXED;
      }
      if (betSize == null) {
        betSize = BigDecimal.valueOf(25);
      }
      if (priority == null || priority.isBlank()) {
        priority = "price_high";
      }
      if (deadlineMin == null) {
        deadlineMin = 3.0;
      }
      if (eventCap == null) {
        eventCap = 3;
      }
      if (excludeSeries == null) {
        excludeSeries = false;
      }
      if (bankroll == null) {
        bankroll = BigDecimal.valueOf(1000);
      }
      if (maxTotalExposurePct == null) {
        maxTotalExposurePct = 0.90;
      }
      if (maxClusterExposurePct == null) {
        maxClusterExposurePct = 0.30;
      }
      if (entryCostRate == null) {
        entryCostRate = 0.005;
      }
      clusterFilter = sanitizeStringList(clusterFilter);
      if (portfolioFile == null || portfolioFile.isBlank()) {
        portfolioFile = "portfolio_" + id + ".json";
      }
    }
  }

  public record ZoneProperties(
      @PositiveOrZero Double volMin,
      Double volMax,
      @NotNull Double priceYesMin,
      @NotNull Double priceYesMax
  ) {
    public ZoneProperties {
      if (volMin == null) {
        volMin = 0.0;
      }
      if (volMax == null) {
        volMax = Double.POSITIVE_INFINITY;
      }
    }
  }
}
