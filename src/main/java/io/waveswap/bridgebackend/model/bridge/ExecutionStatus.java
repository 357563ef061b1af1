package io.waveswap.bridgebackend.model.bridge;

public enum ExecutionStatus {
  INITIALIZING,
  VALIDATING,
  DEPOSITING,
  PROCESSING,
  COMPLETED,
  FAILED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }
}
