package io.waveswap.bridgebackend.bridge.dto;

import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

public final class BridgeDtos {
  private BridgeDtos() {}

  public record QuoteRequest(
      @NotBlank String originChain,
      @NotBlank String originToken,
      @NotBlank String destinationChain,
      @NotBlank String destinationToken,
      @NotBlank String amount,
      Integer slippageBps,
      Integer deadlineSeconds,
      String recipientAddress,
      String refundAddress) {}

  /** The wallet has already broadcast the deposit; {@code depositTransactionRef} is its hash. */
  public record ExecuteRequest(
      @NotBlank String quoteId,
      @NotBlank String fromAddress,
      @NotBlank String depositTransactionRef,
      String recipientAddress) {}

  public record RouteResponse(
      ChainId originChain,
      String originToken,
      ChainId destinationChain,
      String destinationToken,
      List<ProviderId> providers,
      ProviderId selectedProvider,
      String estimatedTime) {}

  public record AddressValidationResponse(ChainId chain, String address, boolean valid, String pattern) {}
}
