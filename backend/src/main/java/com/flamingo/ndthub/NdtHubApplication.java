package com.flamingo.ndthub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point of the NDT document hub. */
@SpringBootApplication
public class NdtHubApplication {

  public static void main(String[] args) {
    SpringApplication.run(NdtHubApplication.class, args);
  }
}
