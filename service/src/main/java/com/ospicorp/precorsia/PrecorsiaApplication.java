package com.ospicorp.precorsia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PrecorsiaApplication {

  public static void main(String[] args) {
    SpringApplication.run(PrecorsiaApplication.class, args);
  }
}
