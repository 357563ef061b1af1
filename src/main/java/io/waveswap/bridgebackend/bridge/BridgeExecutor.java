package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;

/**
 * Provider-specific half of an execution. The state machine owns validation, the deposit call and the
 * monitoring hand-off; an executor contributes the step texts, the settlement/relay sub-steps and the
 * read-only status query.
 *
 * <p>{@link #totalSteps()} must equal validation + deposit + the number of {@code tracker.step} calls made
 * by {@link #process} + the monitoring step.
 */
public interface BridgeExecutor {

  ProviderId provider();

  int totalSteps();

  String depositStepDescription(BridgeQuote quote);

  /**
   * Submits the deposit reference to the provider's settlement endpoint.
   *
   * @return the reference the status monitor polls with
   */
  String process(BridgeQuote quote, String depositTransactionRef, ExecutionContext context, StepTracker tracker);

  String monitorStepDescription(BridgeQuote quote);

  /** One read-only status query; transport failures surface as exceptions. */
  ProviderStatus queryStatus(String reference);
}
