package com.wellbridge.ai;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WellBridgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(WellBridgeApplication.class, args);
  }
}
