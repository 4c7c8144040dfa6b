package com.marketwatch.tracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class MarketWatchTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(MarketWatchTrackerApplication.class, args);
  }
}
