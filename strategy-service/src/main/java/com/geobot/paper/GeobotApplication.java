package com.geobot.paper;

import com.geobot.paper.config.GeobotProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(GeobotProperties.class)
public class GeobotApplication {

  public static void main(String[] args) {
    SpringApplication.run(GeobotApplication.class, args);
  }
}
