package com.keywordscraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class KeywordScraperApplication {

  public static void main(String[] args) {
    SpringApplication.run(KeywordScraperApplication.class, args);
  }
}
