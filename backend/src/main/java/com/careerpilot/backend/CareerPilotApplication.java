package com.careerpilot.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CareerPilotApplication {

  public static void main(String[] args) {
    SpringApplication.run(CareerPilotApplication.class, args);
  }
}
