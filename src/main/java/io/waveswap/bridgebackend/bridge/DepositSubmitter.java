package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import java.math.BigInteger;

/**
 * Chain signing/transaction collaborator supplied by wallet integration code. Signs and broadcasts the
 * origin-chain deposit and returns the chain's transaction reference. Any exception it throws is
 * reported verbatim as the execution error.
 */
@FunctionalInterface
public interface DepositSubmitter {

  String submitDeposit(
      ChainId chain, String fromAddress, String toAddress, BigInteger amountBaseUnits, CrossChainToken token);
}
