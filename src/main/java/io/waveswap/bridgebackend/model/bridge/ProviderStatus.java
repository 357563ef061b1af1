package io.waveswap.bridgebackend.model.bridge;

/** One normalized answer from a provider status endpoint. */
public record ProviderStatus(State state, String rawStatus, String message, String completionTransactionRef) {

  public enum State {
    PENDING,
    COMPLETED,
    FAILED
  }

  public static ProviderStatus pending(String rawStatus) {
    return new ProviderStatus(State.PENDING, rawStatus, null, null);
  }

  public static ProviderStatus completed(String rawStatus, String completionTransactionRef) {
    return new ProviderStatus(State.COMPLETED, rawStatus, null, completionTransactionRef);
  }

  public static ProviderStatus failed(String rawStatus, String message) {
    return new ProviderStatus(State.FAILED, rawStatus, message, null);
  }
}
