package com.standcapacity.planner;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class PlannerApplication {
  // Main entrypoint: boots Spring; the planning run itself starts from PlanningCommandLineRunner.
  public static void main(String[] args) {
    SpringApplication.run(PlannerApplication.class, args);
  }
}
