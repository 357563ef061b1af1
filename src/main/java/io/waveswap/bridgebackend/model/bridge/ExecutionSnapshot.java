package io.waveswap.bridgebackend.model.bridge;

import java.time.Instant;
import java.util.List;

/** Immutable view of a {@link BridgeExecution} at one point in time, for progress display. */
public record ExecutionSnapshot(
    String quoteId,
    ProviderId provider,
    ExecutionStatus status,
    int currentStep,
    int totalSteps,
    List<String> steps,
    String depositTransactionRef,
    String completionTransactionRef,
    String errorCode,
    String error,
    Instant estimatedCompletion,
    boolean terminal) {

  public String latestStep() {
    return steps.isEmpty() ? null : steps.get(steps.size() - 1);
  }
}
