package io.waveswap.bridgebackend.bridge.provider;

import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.bridge.BridgeProperties;
import io.waveswap.bridgebackend.bridge.QuoteGenerator;
import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import io.waveswap.bridgebackend.model.bridge.QuoteStatus;
import io.waveswap.bridgebackend.model.bridge.Route;
import io.waveswap.bridgebackend.util.TokenAmounts;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared quote pipeline: route check, option defaults, base-unit scaling, one provider call,
 * normalization into a {@link BridgeQuote}. Subclasses only translate the provider payload.
 */
public abstract class AbstractQuoteGenerator implements QuoteGenerator {
  private static final Logger log = LoggerFactory.getLogger(AbstractQuoteGenerator.class);

  protected final BridgeProperties properties;
  protected final Clock clock;

  protected AbstractQuoteGenerator(BridgeProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  @Override
  public BridgeQuote generateQuote(
      CrossChainToken originToken, CrossChainToken destinationToken, String amount, BridgeOptions options) {
    if (originToken == null || destinationToken == null) {
      throw new BridgeException(BridgeErrorCode.TOKEN_NOT_SUPPORTED, "origin and destination tokens are required");
    }
    Route route = new Route(originToken, destinationToken);
    BridgeOptions opts =
        (options == null ? BridgeOptions.defaults() : options)
            .resolve(properties.getQuote().getDefaultSlippageBps(), properties.getQuote().getDefaultDeadlineSeconds());
    BigInteger baseUnits = TokenAmounts.toBaseUnits(amount, originToken.decimals());

    ProviderQuote providerQuote = requestQuote(route, baseUnits, opts);
    if (providerQuote.amountOut() == null || providerQuote.amountOut().signum() <= 0) {
      throw new BridgeException(
          BridgeErrorCode.INSUFFICIENT_LIQUIDITY,
          provider().key() + " returned no output for " + amount + " " + originToken.symbol());
    }

    String fromAmount = TokenAmounts.fromBaseUnits(baseUnits, originToken.decimals());
    String toAmount = TokenAmounts.fromBaseUnits(providerQuote.amountOut(), destinationToken.decimals());
    BigInteger fee = providerQuote.feeBaseUnits() == null ? BigInteger.ZERO : providerQuote.feeBaseUnits();
    Instant expiresAt = clock.instant().plusSeconds(opts.deadlineSeconds());

    BridgeQuote quote =
        new BridgeQuote(
            UUID.randomUUID().toString(),
            originToken,
            destinationToken,
            fromAmount,
            baseUnits.toString(),
            toAmount,
            TokenAmounts.rate(fromAmount, toAmount),
            provider(),
            providerQuote.providerQuoteRef(),
            TokenAmounts.fromBaseUnits(fee, originToken.decimals()),
            providerQuote.feePercentage() == null ? BigDecimal.ZERO : providerQuote.feePercentage(),
            route.originChain(),
            route.destinationChain(),
            providerQuote.depositAddress(),
            opts.recipientAddress(),
            opts.refundAddress(),
            TokenAmounts.bpsToPercent(opts.slippageBps()),
            provider().estimatedTime(),
            expiresAt,
            QuoteStatus.PENDING);
    log.info(
        "bridge quote: provider={} route={}->{} from={} {} to={} {} expiresAt={}",
        provider(),
        route.originChain(),
        route.destinationChain(),
        fromAmount,
        originToken.symbol(),
        toAmount,
        destinationToken.symbol(),
        expiresAt);
    return quote;
  }

  /**
   * One provider round trip.
   *
   * @param amountBaseUnits input amount already scaled by the origin token's decimals
   */
  protected abstract ProviderQuote requestQuote(Route route, BigInteger amountBaseUnits, BridgeOptions options);
}
