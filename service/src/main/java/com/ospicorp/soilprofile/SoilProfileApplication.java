package com.ospicorp.soilprofile;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SoilProfileApplication {

  public static void main(String[] args) {
    SpringApplication.run(SoilProfileApplication.class, args);
  }
}
