package com.beobachter.paper.service;

import com.beobachter.paper.config.PaperTradingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(PaperTradingProperties.class)
public class PaperTraderApplication {

  public static void main(String[] args) {
    SpringApplication.run(PaperTraderApplication.class, args);
  }
}
