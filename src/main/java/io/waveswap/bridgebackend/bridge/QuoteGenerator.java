package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import io.waveswap.bridgebackend.model.bridge.ProviderId;

/**
 * Produces a normalized, time-bounded quote from one provider. Implementations hold no mutable state
 * and may be called concurrently for different routes.
 */
public interface QuoteGenerator {

  ProviderId provider();

  /**
   * @param amount decimal string in human units of {@code originToken}
   * @throws BridgeException {@code INVALID_ROUTE}, {@code INVALID_AMOUNT}, {@code QUOTE_PROVIDER_UNAVAILABLE},
   *     {@code INSUFFICIENT_LIQUIDITY} or {@code QUOTE_REJECTED}
   */
  BridgeQuote generateQuote(
      CrossChainToken originToken, CrossChainToken destinationToken, String amount, BridgeOptions options);
}
