package com.geobot.paper.config;

import com.geobot.paper.strategy.StrategyCatalog;
import com.geobot.paper.strategy.model.BetSide;
import com.geobot.paper.strategy.model.PriorityPolicy;
import com.geobot.paper.strategy.model.SizingMode;
import com.geobot.paper.strategy.model.Strategy;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Loads the shipped application.yml and strategies.yml.
 */
class StrategyCatalogYamlTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withInitializer(new ConfigDataApplicationContextInitializer())
      .withUserConfiguration(CatalogConfig.class);

  @Test
  void shippedCatalogBindsEveryStrategyAndGroup() {
    runner.run(context -> {
      assertThat(context).hasNotFailed();
      GeobotProperties properties = context.getBean(GeobotProperties.class);
      StrategyCatalog catalog = StrategyCatalog.from(properties);

      assertThat(catalog.strategyIds()).hasSize(25).startsWith("conservative", "balanced", "aggressive", "volume_sweet");
      assertThat(catalog.resolve("all")).hasSize(25);
      assertThat(catalog.resolve("new")).hasSize(20).extracting(Strategy::id).doesNotContain("test_live");
      assertThat(catalog.resolve(properties.run().defaultTarget())).extracting(Strategy::id)
          .containsExactly("conservative", "balanced", "aggressive", "volume_sweet");
      assertThat(catalog.strategies()).extracting(Strategy::betSide).containsOnly(BetSide.NO);
      assertThat(catalog.strategies()).extracting(Strategy::priority).doesNotContain(PriorityPolicy.UNRANKED);
    });
  }

  @Test
  void shippedStrategiesKeepTheirParameters() {
    runner.run(context -> {
      StrategyCatalog catalog = StrategyCatalog.from(context.getBean(GeobotProperties.class));

      Strategy skip = catalog.strategy("t3_mb_4bucket_skip");
      assertThat(skip.zones().bucketed()).isTrue();
      assertThat(skip.zones().buckets()).hasSize(3);
      assertThat(skip.zones().buckets().get(2).volMax()).isEqualTo(Double.POSITIVE_INFINITY);
      assertThat(skip.sizing()).isEqualTo(SizingMode.ADAPTIVE);

      Strategy dl60 = catalog.strategy("t4_cstr_dl60");
      assertThat(dl60.bankroll()).isEqualByComparingTo("500");
      assertThat(dl60.betSize()).isEqualByComparingTo("50");
      assertThat(dl60.deadlineMaxDays()).isEqualTo(60.0);

      Strategy conservative = catalog.strategy("t5_deploy_conservative");
      assertThat(conservative.eventCap()).isEqualTo(2);

      Strategy live = catalog.strategy("test_live");
      assertThat(live.bankroll()).isEqualByComparingTo("4");
      assertThat(live.maxTotalExposure()).isEqualByComparingTo("4");
      assertThat(live.entryCostRate()).isEqualTo(0.03);

      assertThat(catalog.strategy("t5_deploy_balanced").priority()).isEqualTo(PriorityPolicy.ROTATION);
      assertThat(catalog.strategy("t2_noseries").excludeSeries()).isTrue();
    });
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(GeobotProperties.class)
  static class CatalogConfig {
  }
}
