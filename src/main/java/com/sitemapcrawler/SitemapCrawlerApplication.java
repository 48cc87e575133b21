package com.sitemapcrawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SitemapCrawlerApplication {

  public static void main(String[] args) {
    SpringApplication.run(SitemapCrawlerApplication.class, args);
  }
}
