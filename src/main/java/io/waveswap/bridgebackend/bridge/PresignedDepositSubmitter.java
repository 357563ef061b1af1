package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import java.math.BigInteger;

/**
 * Deposit collaborator for HTTP callers whose wallet has already signed and broadcast the deposit. It
 * hands back the reference the wallet reported.
 */
public final class PresignedDepositSubmitter implements DepositSubmitter {
  private final String transactionRef;

  public PresignedDepositSubmitter(String transactionRef) {
    this.transactionRef = transactionRef == null ? "" : transactionRef.trim();
  }

  @Override
  public String submitDeposit(
      ChainId chain, String fromAddress, String toAddress, BigInteger amountBaseUnits, CrossChainToken token) {
    if (transactionRef.isBlank()) {
      throw new IllegalStateException("wallet did not report a deposit transaction for " + chain);
    }
    return transactionRef;
  }
}
