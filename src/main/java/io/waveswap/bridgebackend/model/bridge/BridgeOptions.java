package io.waveswap.bridgebackend.model.bridge;

import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;

/** Per-request quote options. Null fields fall back to configured defaults via {@link #resolve}. */
public record BridgeOptions(
    Integer slippageBps, Integer deadlineSeconds, String recipientAddress, String refundAddress) {

  public static BridgeOptions defaults() {
    return new BridgeOptions(null, null, null, null);
  }

  public BridgeOptions resolve(int defaultSlippageBps, int defaultDeadlineSeconds) {
    int slippage = slippageBps == null ? defaultSlippageBps : slippageBps;
    int deadline = deadlineSeconds == null ? defaultDeadlineSeconds : deadlineSeconds;
    if (slippage < 0 || slippage > 10_000) {
      throw new BridgeException(
          BridgeErrorCode.INVALID_QUOTE, "slippageBps must be between 0 and 10000, got " + slippage);
    }
    if (deadline <= 0) {
      throw new BridgeException(
          BridgeErrorCode.INVALID_QUOTE, "deadlineSeconds must be positive, got " + deadline);
    }
    return new BridgeOptions(slippage, deadline, blankToNull(recipientAddress), blankToNull(refundAddress));
  }

  private static String blankToNull(String v) {
    return v == null || v.isBlank() ? null : v.trim();
  }
}
