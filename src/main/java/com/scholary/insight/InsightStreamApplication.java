package com.scholary.insight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class InsightStreamApplication {

  public static void main(String[] args) {
    SpringApplication.run(InsightStreamApplication.class, args);
  }
}
