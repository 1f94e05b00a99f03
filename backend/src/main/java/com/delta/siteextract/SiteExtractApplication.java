package com.delta.siteextract;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SiteExtractApplication {

  public static void main(String[] args) {
    SpringApplication.run(SiteExtractApplication.class, args);
  }
}
