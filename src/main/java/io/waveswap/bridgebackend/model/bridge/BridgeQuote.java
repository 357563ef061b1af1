package io.waveswap.bridgebackend.model.bridge;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Time-bounded, priced offer for one route. Immutable once returned by a quote generator; executions
 * hold it by reference only.
 *
 * <p>{@code fromAmount}, {@code toAmount} and {@code feeAmount} are decimal strings in human units.
 * {@code fromAmountBaseUnits} is the same input amount scaled by the origin token's decimals, which is
 * what every provider call receives. {@code providerQuoteRef} is the provider-issued quote handle (quote
 * id, quote hash) needed again at execution time.
 */
public record BridgeQuote(
    String id,
    CrossChainToken originToken,
    CrossChainToken destinationToken,
    String fromAmount,
    String fromAmountBaseUnits,
    String toAmount,
    String rate,
    ProviderId provider,
    String providerQuoteRef,
    String feeAmount,
    BigDecimal feePercentage,
    ChainId depositChain,
    ChainId destinationChain,
    String depositAddress,
    String destinationAddress,
    String refundAddress,
    BigDecimal slippageTolerance,
    String estimatedTime,
    Instant expiresAt,
    QuoteStatus status) {

  public boolean isExpired(Instant now) {
    return expiresAt == null || expiresAt.isBefore(now);
  }
}
