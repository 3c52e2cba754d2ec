package com.openness.crawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class OpennessCrawlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(OpennessCrawlerApplication.class, args);
  }
}
