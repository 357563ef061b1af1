package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ProviderStatus;

/**
 * Outcome of one monitoring run. {@code TIMED_OUT} means the monitor stopped watching; the transfer
 * itself may still complete.
 */
public record MonitorResult(Outcome outcome, int attempts, ProviderStatus lastStatus) {

  public enum Outcome {
    COMPLETED,
    FAILED,
    TIMED_OUT,
    CANCELLED
  }

  public String providerMessage() {
    if (lastStatus == null) return null;
    if (lastStatus.message() != null && !lastStatus.message().isBlank()) return lastStatus.message();
    return lastStatus.rawStatus();
  }
}
