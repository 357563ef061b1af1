package io.waveswap.bridgebackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BridgeBackendApplication {
  public static void main(String[] args) {
    SpringApplication.run(BridgeBackendApplication.class, args);
  }
}
