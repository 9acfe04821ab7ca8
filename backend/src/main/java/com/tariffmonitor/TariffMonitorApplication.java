package com.tariffmonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TariffMonitorApplication {

  public static void main(String[] args) {
    SpringApplication.run(TariffMonitorApplication.class, args);
  }
}
