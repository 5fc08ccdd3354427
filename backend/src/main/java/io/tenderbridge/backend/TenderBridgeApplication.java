package io.tenderbridge.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TenderBridgeApplication {

  public static void main(String[] args) {
    SpringApplication.run(TenderBridgeApplication.class, args);
  }
}
