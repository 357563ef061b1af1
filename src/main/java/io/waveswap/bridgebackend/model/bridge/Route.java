package io.waveswap.bridgebackend.model.bridge;

import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import java.util.Objects;

public record Route(CrossChainToken originToken, CrossChainToken destinationToken) {

  public Route {
    Objects.requireNonNull(originToken, "originToken");
    Objects.requireNonNull(destinationToken, "destinationToken");
    if (originToken.chain() == destinationToken.chain()) {
      throw new BridgeException(
          BridgeErrorCode.INVALID_ROUTE,
          "origin and destination are both on " + originToken.chain() + "; same-chain transfers are not bridged");
    }
  }

  public ChainId originChain() {
    return originToken.chain();
  }

  public ChainId destinationChain() {
    return destinationToken.chain();
  }
}
