package com.flamingo.ai.dealflow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the deal and financing fact pipeline. */
@SpringBootApplication
public class DealflowApplication {

  public static void main(String[] args) {
    SpringApplication.run(DealflowApplication.class, args);
  }
}
