package io.waveswap.bridgebackend.model.bridge;

import java.util.Locale;
import java.util.Optional;

public enum ChainId {
  SOLANA("solana"),
  NEAR("near"),
  ZCASH("zec"),
  STARKNET("starknet");

  private final String key;

  ChainId(String key) {
    this.key = key;
  }

  /** Short lowercase key used by provider APIs and asset identifiers. */
  public String key() {
    return key;
  }

  /** Solana and StarkNet are joined by the native lock/relay bridge. */
  public boolean hasNativeBridge() {
    return this == SOLANA || this == STARKNET;
  }

  public static Optional<ChainId> parse(String raw) {
    if (raw == null || raw.isBlank()) return Optional.empty();
    String v = raw.trim().toLowerCase(Locale.ROOT);
    for (ChainId c : values()) {
      if (c.key.equals(v) || c.name().toLowerCase(Locale.ROOT).equals(v)) return Optional.of(c);
    }
    return Optional.empty();
  }
}
