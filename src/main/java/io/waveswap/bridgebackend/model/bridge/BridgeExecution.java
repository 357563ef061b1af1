package io.waveswap.bridgebackend.model.bridge;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One attempt to fulfil a {@link BridgeQuote}. Owned by the task that created it; not thread-safe.
 *
 * <p>{@code totalSteps} is fixed at creation. {@code currentStep} only moves forward and never passes
 * {@code totalSteps}. Once the status is terminal no further transitions are accepted.
 */
public class BridgeExecution {
  private final BridgeQuote quote;
  private final int totalSteps;
  private final List<String> steps = new ArrayList<>();

  private ExecutionStatus status = ExecutionStatus.INITIALIZING;
  private int currentStep;
  private String depositTransactionRef;
  private String completionTransactionRef;
  private String errorCode;
  private String error;
  private Instant estimatedCompletion;

  public BridgeExecution(BridgeQuote quote, int totalSteps) {
    if (quote == null) throw new IllegalArgumentException("quote is required");
    if (totalSteps <= 0) throw new IllegalArgumentException("totalSteps must be positive");
    this.quote = quote;
    this.totalSteps = totalSteps;
  }

  public void transitionTo(ExecutionStatus next) {
    if (status.isTerminal()) {
      throw new IllegalStateException("execution for quote " + quote.id() + " already " + status);
    }
    this.status = next;
  }

  /** Appends a step description and advances the step counter. */
  public void advance(String description) {
    if (currentStep >= totalSteps) {
      throw new IllegalStateException(
          "step budget exhausted for quote " + quote.id() + " (" + totalSteps + " steps)");
    }
    steps.add(description);
    currentStep++;
  }

  public void fail(String errorCode, String error) {
    transitionTo(ExecutionStatus.FAILED);
    this.errorCode = errorCode;
    this.error = error == null || error.isBlank() ? "Unknown error" : error;
  }

  public void complete() {
    transitionTo(ExecutionStatus.COMPLETED);
  }

  public ExecutionSnapshot snapshot() {
    return new ExecutionSnapshot(
        quote.id(),
        quote.provider(),
        status,
        currentStep,
        totalSteps,
        List.copyOf(steps),
        depositTransactionRef,
        completionTransactionRef,
        errorCode,
        error,
        estimatedCompletion,
        status.isTerminal());
  }

  public BridgeQuote getQuote() {
    return quote;
  }

  public ExecutionStatus getStatus() {
    return status;
  }

  public int getCurrentStep() {
    return currentStep;
  }

  public int getTotalSteps() {
    return totalSteps;
  }

  public List<String> getSteps() {
    return List.copyOf(steps);
  }

  public String getDepositTransactionRef() {
    return depositTransactionRef;
  }

  public void setDepositTransactionRef(String depositTransactionRef) {
    this.depositTransactionRef = depositTransactionRef;
  }

  public String getCompletionTransactionRef() {
    return completionTransactionRef;
  }

  public void setCompletionTransactionRef(String completionTransactionRef) {
    this.completionTransactionRef = completionTransactionRef;
  }

  public String getErrorCode() {
    return errorCode;
  }

  public String getError() {
    return error;
  }

  public Instant getEstimatedCompletion() {
    return estimatedCompletion;
  }

  public void setEstimatedCompletion(Instant estimatedCompletion) {
    this.estimatedCompletion = estimatedCompletion;
  }
}
