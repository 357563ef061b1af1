package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ChainId;
import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/** Per-chain address formats. Built-in defaults, overridable through {@code app.bridge.address-patterns}. */
@Component
public class AddressFormatTable {
  private static final Logger log = LoggerFactory.getLogger(AddressFormatTable.class);

  static final Map<ChainId, String> DEFAULT_PATTERNS =
      Map.of(
          ChainId.SOLANA, "^[1-9A-HJ-NP-Za-km-z]{44}$",
          ChainId.NEAR, "^(?:[a-z0-9._-]+\\.near|[a-f0-9]{64})$",
          ChainId.ZCASH, "^[tu][1-3A-HJ-NP-Za-km-z]{33,94}$",
          ChainId.STARKNET, "^0x[a-fA-F0-9]{63,64}$");

  private final Map<ChainId, Pattern> patterns = new EnumMap<>(ChainId.class);

  @Autowired
  public AddressFormatTable(BridgeProperties properties) {
    this(properties.getAddressPatterns());
  }

  AddressFormatTable(Map<String, String> overrides) {
    for (ChainId chain : ChainId.values()) {
      patterns.put(chain, Pattern.compile(DEFAULT_PATTERNS.get(chain)));
    }
    if (overrides == null) return;
    overrides.forEach(
        (rawChain, regex) -> {
          ChainId chain =
              ChainId.parse(rawChain)
                  .orElseThrow(() -> new IllegalStateException("unknown chain in address-patterns: " + rawChain));
          try {
            patterns.put(chain, Pattern.compile(regex));
            log.info("address pattern override: chain={} pattern={}", chain, regex);
          } catch (PatternSyntaxException e) {
            throw new IllegalStateException("invalid address pattern for " + chain + ": " + regex, e);
          }
        });
  }

  public boolean isValid(ChainId chain, String address) {
    if (chain == null || address == null || address.isBlank()) return false;
    return patterns.get(chain).matcher(address.trim()).matches();
  }

  public String patternFor(ChainId chain) {
    return patterns.get(chain).pattern();
  }
}
