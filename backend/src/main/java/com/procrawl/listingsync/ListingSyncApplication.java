package com.procrawl.listingsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ListingSyncApplication {

  public static void main(String[] args) {
    SpringApplication.run(ListingSyncApplication.class, args);
  }
}
