package io.waveswap.bridgebackend.model.bridge;

public enum QuoteStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
