package com.flamingo.ai.lifedigest;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the digest worker and search backend. */
@SpringBootApplication
public class LifeDigestApplication {

  public static void main(String[] args) {
    SpringApplication.run(LifeDigestApplication.class, args);
  }
}
