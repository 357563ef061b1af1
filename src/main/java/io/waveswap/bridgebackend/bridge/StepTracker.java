package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.BridgeExecution;
import io.waveswap.bridgebackend.model.bridge.ExecutionSnapshot;
import io.waveswap.bridgebackend.model.bridge.ExecutionStatus;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Mutates one execution and publishes a snapshot after each change. */
public final class StepTracker {
  private static final Logger log = LoggerFactory.getLogger(StepTracker.class);

  private final BridgeExecution execution;
  private final Consumer<ExecutionSnapshot> listener;
  private String stagedCompletionRef;

  public StepTracker(BridgeExecution execution, Consumer<ExecutionSnapshot> listener) {
    this.execution = execution;
    this.listener = listener == null ? snapshot -> {} : listener;
  }

  public BridgeExecution execution() {
    return execution;
  }

  public void step(String description) {
    execution.advance(description);
    log.info(
        "bridge step: quoteId={} provider={} step={}/{} text='{}'",
        execution.getQuote().id(),
        execution.getQuote().provider(),
        execution.getCurrentStep(),
        execution.getTotalSteps(),
        description);
    publish();
  }

  public void transition(ExecutionStatus status) {
    execution.transitionTo(status);
    publish();
  }

  public void recordDeposit(String transactionRef) {
    execution.setDepositTransactionRef(transactionRef);
    publish();
  }

  /**
   * Holds a destination-chain transaction reported before monitoring. It becomes the execution's
   * completion reference only once the provider confirms completion.
   */
  public void stageCompletion(String transactionRef) {
    if (transactionRef == null || transactionRef.isBlank()) return;
    stagedCompletionRef = transactionRef;
  }

  public String stagedCompletion() {
    return stagedCompletionRef;
  }

  public void publish() {
    ExecutionSnapshot snapshot = execution.snapshot();
    try {
      listener.accept(snapshot);
    } catch (RuntimeException e) {
      // listener failures never affect the execution outcome
      log.warn("snapshot listener failed: quoteId={} status={}", snapshot.quoteId(), snapshot.status(), e);
    }
  }
}
