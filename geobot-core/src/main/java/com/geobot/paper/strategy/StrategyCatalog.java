package com.geobot.paper.strategy;

import com.geobot.paper.config.GeobotProperties;
import com.geobot.paper.strategy.model.PriceRange;
import com.geobot.paper.strategy.model.PriorityPolicy;
import com.geobot.paper.strategy.model.Strategy;
import com.geobot.paper.strategy.model.VolumeBucket;
import com.geobot.paper.strategy.model.ZoneSpec;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Strategies and named groups, fixed at construction.
 *
 * Insertion order is preserved, so {@link #strategyIds()} and group members come back in the
 * order they were configured.
 */
@Slf4j
public final class StrategyCatalog {

  private final Map<String, Strategy> strategies;
  private final Map<String, List<String>> groups;

  public StrategyCatalog(Map<String, Strategy> strategies, Map<String, List<String>> groups) {
    this.strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
    Map<String, List<String>> copy = new LinkedHashMap<>();
    groups.forEach((name, members) -> {
      for (String member : members) {
        if (!this.strategies.containsKey(member)) {
          throw new IllegalArgumentException("group " + name + " references unknown strategy " + member);
        }
      }
      copy.put(name, List.copyOf(members));
    });
    this.groups = Collections.unmodifiableMap(copy);
  }

  public static StrategyCatalog from(GeobotProperties properties) {
    Map<String, Strategy> strategies = new LinkedHashMap<>();
    for (GeobotProperties.StrategyProperties p : properties.strategies()) {
      if (strategies.containsKey(p.id())) {
        throw new IllegalArgumentException("duplicate strategy id " + p.id());
      }
      strategies.put(p.id(), toStrategy(p));
    }
    StrategyCatalog catalog = new StrategyCatalog(strategies, properties.groups());
    log.info("Strategy catalog loaded: {} strategies, {} groups", strategies.size(), properties.groups().size());
    return catalog;
  }

  static Strategy toStrategy(GeobotProperties.StrategyProperties p) {
    PriorityPolicy priority = PriorityPolicy.lookup(p.priority()).orElseGet(() -> {
      log.warn("Strategy {} has unknown priority '{}', candidates will keep feed order", p.id(), p.priority());
      return PriorityPolicy.UNRANKED;
    });
    return Strategy.builder()
        .id(p.id())
        .name(p.name())
        .description(p.description())
        .betSide(p.betSide())
        .zones(toZoneSpec(p))
        .minVolume(p.minVolume())
        .maxVolume(p.maxVolume())
        .sizing(p.sizing())
        .betSize(p.betSize())
        .priority(priority)
        .deadlineMinDays(p.deadlineMin())
        .deadlineMaxDays(p.deadlineMax())
        .eventCap(p.eventCap())
        .excludeSeries(p.excludeSeries())
        .bankroll(p.bankroll())
        .maxTotalExposurePct(p.maxTotalExposurePct())
        .maxClusterExposurePct(p.maxClusterExposurePct())
        .entryCostRate(p.entryCostRate())
        .clusterFilter(Set.copyOf(p.clusterFilter()))
        .portfolioKey(p.portfolioFile())
        .build();
  }

  private static ZoneSpec toZoneSpec(GeobotProperties.StrategyProperties p) {
    if (!p.zones().isEmpty()) {
      List<VolumeBucket> buckets = new ArrayList<>(p.zones().size());
      for (GeobotProperties.ZoneProperties z : p.zones()) {
        buckets.add(new VolumeBucket(z.volMin(), z.volMax(), new PriceRange(z.priceYesMin(), z.priceYesMax())));
      }
      return ZoneSpec.buckets(buckets);
    }
    if (p.priceYesMin() == null || p.priceYesMax() == null) {
      throw new IllegalArgumentException("strategy " + p.id() + " needs price-yes-min/max or zones");
    }
    return ZoneSpec.single(p.priceYesMin(), p.priceYesMax());
  }

  public Strategy strategy(String id) {
    Strategy strategy = id == null ? null : strategies.get(id);
    if (strategy == null) {
      throw new UnknownStrategyException("strategy", id, strategies.keySet());
    }
    return strategy;
  }

  public List<Strategy> group(String name) {
    List<String> members = name == null ? null : groups.get(name);
    if (members == null) {
      throw new UnknownStrategyException("group", name, groups.keySet());
    }
    return members.stream().map(strategies::get).toList();
  }

  /**
   * Resolve a run target: a group name wins over a strategy id of the same name.
   */
  public List<Strategy> resolve(String target) {
    if (target != null && groups.containsKey(target)) {
      return group(target);
    }
    if (target != null && strategies.containsKey(target)) {
      return List.of(strategies.get(target));
    }
    List<String> available = new ArrayList<>(groups.keySet());
    available.addAll(strategies.keySet());
    throw new UnknownStrategyException("strategy or group", target, available);
  }

  public boolean contains(String strategyId) {
    return strategies.containsKey(strategyId);
  }

  public List<String> strategyIds() {
    return List.copyOf(strategies.keySet());
  }

  public List<Strategy> strategies() {
    return List.copyOf(strategies.values());
  }

  public Map<String, List<String>> groups() {
    return groups;
  }
}
