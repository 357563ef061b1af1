package io.waveswap.bridgebackend.model.bridge;

/** Per-provider capability flags of one token. In the built-in catalog {@code starkgate} follows the chain. */
public record BridgeSupport(boolean nearIntents, boolean starkgate, boolean defuse) {

  public static BridgeSupport none() {
    return new BridgeSupport(false, false, false);
  }

  public boolean supports(ProviderId provider) {
    return switch (provider) {
      case NEAR_INTENTS -> nearIntents;
      case STARKGATE -> starkgate;
      case DEFUSE -> defuse;
    };
  }
}
