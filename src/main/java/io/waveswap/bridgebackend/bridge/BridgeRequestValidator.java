package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import io.waveswap.bridgebackend.model.bridge.Route;
import io.waveswap.bridgebackend.util.TokenAmounts;
import java.math.BigInteger;
import org.springframework.stereotype.Component;

/**
 * Pre-flight checks run before any provider is contacted. Every method is a pure function of its
 * arguments and the static registry: no I/O, same verdict on every call.
 */
@Component
public class BridgeRequestValidator {
  private final CapabilityRegistry registry;
  private final AddressFormatTable addressFormats;

  public BridgeRequestValidator(CapabilityRegistry registry, AddressFormatTable addressFormats) {
    this.registry = registry;
    this.addressFormats = addressFormats;
  }

  public record ValidatedRequest(Route route, BigInteger amountBaseUnits, BridgeOptions options) {}

  public ValidatedRequest validate(
      CrossChainToken originToken, CrossChainToken destinationToken, String amount, BridgeOptions options) {
    Route route = validateRoute(originToken, destinationToken);
    BigInteger baseUnits = validateAmount(amount, originToken);
    BridgeOptions opts = options == null ? BridgeOptions.defaults() : options;
    if (opts.recipientAddress() != null && !opts.recipientAddress().isBlank()) {
      validateAddress(route.destinationChain(), opts.recipientAddress(), "recipientAddress");
    }
    if (opts.refundAddress() != null && !opts.refundAddress().isBlank()) {
      validateAddress(route.originChain(), opts.refundAddress(), "refundAddress");
    }
    return new ValidatedRequest(route, baseUnits, opts);
  }

  public Route validateRoute(CrossChainToken originToken, CrossChainToken destinationToken) {
    if (originToken == null || destinationToken == null) {
      throw new BridgeException(BridgeErrorCode.TOKEN_NOT_SUPPORTED, "origin and destination tokens are required");
    }
    if (originToken.address().isBlank() || destinationToken.address().isBlank()) {
      throw new BridgeException(BridgeErrorCode.TOKEN_NOT_SUPPORTED, "token address must not be empty");
    }
    Route route = new Route(originToken, destinationToken);
    if (registry.providersFor(route).isEmpty()) {
      throw new BridgeException(
          BridgeErrorCode.NO_PROVIDER_FOR_ROUTE,
          "route " + route.originChain() + " -> " + route.destinationChain() + " is not supported for "
              + originToken.symbol() + " -> " + destinationToken.symbol());
    }
    return route;
  }

  public BigInteger validateAmount(String amount, CrossChainToken token) {
    return TokenAmounts.toBaseUnits(amount, token.decimals());
  }

  public void validateAddress(ChainId chain, String address, String field) {
    if (!addressFormats.isValid(chain, address)) {
      throw new BridgeException(
          BridgeErrorCode.INVALID_ADDRESS_FORMAT,
          field + " is not a valid " + chain + " address: " + address);
    }
  }

  public boolean isValidAddress(ChainId chain, String address) {
    return addressFormats.isValid(chain, address);
  }

  public String addressPattern(ChainId chain) {
    return addressFormats.patternFor(chain);
  }
}
