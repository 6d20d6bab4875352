package com.autoping.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AutoPingApplication {

  public static void main(String[] args) {
    SpringApplication.run(AutoPingApplication.class, args);
  }
}
