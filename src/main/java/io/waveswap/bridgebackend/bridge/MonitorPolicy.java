package io.waveswap.bridgebackend.bridge;

import java.time.Duration;

public record MonitorPolicy(Duration pollInterval, int maxAttempts) {

  public MonitorPolicy {
    if (pollInterval == null || pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be zero or positive");
    }
    if (maxAttempts <= 0) throw new IllegalArgumentException("maxAttempts must be positive");
  }

  public static MonitorPolicy from(BridgeProperties.Monitor monitor) {
    return new MonitorPolicy(Duration.ofMillis(Math.max(0L, monitor.getPollIntervalMs())), monitor.getMaxAttempts());
  }
}
