package io.waveswap.bridgebackend.bridge.provider;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Provider answer after payload normalization. Amounts are integer base units: {@code amountOut} of the
 * destination token, {@code feeBaseUnits} of the origin token.
 */
public record ProviderQuote(
    String providerQuoteRef,
    BigInteger amountOut,
    BigInteger feeBaseUnits,
    BigDecimal feePercentage,
    String depositAddress) {}
