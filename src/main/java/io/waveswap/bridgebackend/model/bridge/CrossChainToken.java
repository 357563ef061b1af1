package io.waveswap.bridgebackend.model.bridge;

import java.util.Objects;

/**
 * A fungible asset on one chain. Identity is (chain, address); every other field is descriptive.
 */
public record CrossChainToken(
    String symbol,
    String name,
    String address,
    int decimals,
    ChainId chain,
    String assetId,
    BridgeSupport bridgeSupport) {

  public CrossChainToken {
    if (chain == null) throw new IllegalArgumentException("token chain is required");
    if (decimals < 0 || decimals > 36) {
      throw new IllegalArgumentException("token decimals out of range: " + decimals);
    }
    address = address == null ? "" : address.trim();
    bridgeSupport = bridgeSupport == null ? BridgeSupport.none() : bridgeSupport;
  }

  public boolean supports(ProviderId provider) {
    return bridgeSupport.supports(provider);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CrossChainToken other)) return false;
    return chain == other.chain && address.equals(other.address);
  }

  @Override
  public int hashCode() {
    return Objects.hash(chain, address);
  }
}
