package io.waveswap.bridgebackend.model.bridge;

import java.util.Locale;
import java.util.Optional;

/** Independent bridging backends the engine can route through. */
public enum ProviderId {
  /** Intents-based settlement network (1Click API). */
  NEAR_INTENTS("nearIntents", "3-6 minutes", 6),
  /** Native lock/relay bridge between Solana and StarkNet. */
  STARKGATE("starkgate", "4-8 minutes", 8),
  /** Generic cross-chain settlement protocol (solver relay). */
  DEFUSE("defuse", "3-5 minutes", 5);

  private final String key;
  private final String estimatedTime;
  private final int estimatedMaxMinutes;

  ProviderId(String key, String estimatedTime, int estimatedMaxMinutes) {
    this.key = key;
    this.estimatedTime = estimatedTime;
    this.estimatedMaxMinutes = estimatedMaxMinutes;
  }

  public String key() {
    return key;
  }

  public String estimatedTime() {
    return estimatedTime;
  }

  /** Upper bound of {@link #estimatedTime()}, used for the execution's estimated completion. */
  public int estimatedMaxMinutes() {
    return estimatedMaxMinutes;
  }

  public static Optional<ProviderId> parse(String raw) {
    if (raw == null || raw.isBlank()) return Optional.empty();
    String v = raw.trim();
    for (ProviderId p : values()) {
      if (p.key.equalsIgnoreCase(v) || p.name().equalsIgnoreCase(v.toUpperCase(Locale.ROOT))) {
        return Optional.of(p);
      }
    }
    return Optional.empty();
  }
}
