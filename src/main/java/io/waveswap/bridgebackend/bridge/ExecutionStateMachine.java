package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.BridgeExecution;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ExecutionStatus;
import io.waveswap.bridgebackend.util.TokenAmounts;
import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Drives one quote through VALIDATING, DEPOSITING and PROCESSING to COMPLETED or FAILED.
 *
 * <p>Failures never escape as exceptions: the returned execution carries the error code, the message,
 * the step log up to the failure and any transaction references already recorded. The deposit step is
 * never retried; a failed deposit needs a fresh quote and a fresh execution.
 */
@Component
public class ExecutionStateMachine {
  private static final Logger log = LoggerFactory.getLogger(ExecutionStateMachine.class);

  private final BridgeProviderRouter router;
  private final StatusMonitor monitor;
  private final BridgeMetrics metrics;
  private final BridgeProperties properties;
  private final Clock clock;

  public ExecutionStateMachine(
      BridgeProviderRouter router,
      StatusMonitor monitor,
      BridgeMetrics metrics,
      BridgeProperties properties,
      Clock clock) {
    this.router = router;
    this.monitor = monitor;
    this.metrics = metrics;
    this.properties = properties;
    this.clock = clock;
  }

  public BridgeExecution executeBridge(BridgeQuote quote, ExecutionContext context) {
    BridgeExecutor executor = router.executor(quote.provider());
    BridgeExecution execution = new BridgeExecution(quote, executor.totalSteps());
    StepTracker tracker = new StepTracker(execution, context.listener());
    log.info(
        "bridge execution start: quoteId={} provider={} totalSteps={} route={}->{}",
        quote.id(),
        quote.provider(),
        executor.totalSteps(),
        quote.depositChain(),
        quote.destinationChain());
    tracker.publish();

    try {
      tracker.transition(ExecutionStatus.VALIDATING);
      validateQuote(quote, context);
      tracker.step("Validating bridge parameters");

      tracker.transition(ExecutionStatus.DEPOSITING);
      tracker.step(executor.depositStepDescription(quote));
      String depositRef = deposit(quote, context);
      execution.setEstimatedCompletion(
          clock.instant().plus(Duration.ofMinutes(quote.provider().estimatedMaxMinutes())));
      tracker.recordDeposit(depositRef);
      log.info("bridge deposit recorded: quoteId={} provider={} depositRef={}", quote.id(), quote.provider(), depositRef);

      tracker.transition(ExecutionStatus.PROCESSING);
      String monitorRef = process(executor, quote, depositRef, context, tracker);
      tracker.step(executor.monitorStepDescription(quote));

      MonitorPolicy policy =
          context.monitorPolicy() != null ? context.monitorPolicy() : MonitorPolicy.from(properties.getMonitor());
      MonitorResult result = monitor.monitor(monitorRef, executor, policy);
      finish(execution, tracker, result);
    } catch (BridgeException e) {
      fail(tracker, e.getCode().name(), e.getMessage());
    } catch (RuntimeException e) {
      log.warn("bridge execution aborted: quoteId={} provider={}", quote.id(), quote.provider(), e);
      fail(tracker, BridgeErrorCode.SETTLEMENT_FAILED.name(), e.getMessage());
    }

    if (execution.getStatus() == ExecutionStatus.COMPLETED) {
      metrics.executionCompleted(quote.provider());
    } else {
      metrics.executionFailed(quote.provider(), execution.getErrorCode());
    }
    log.info(
        "bridge execution finished: quoteId={} provider={} status={} step={}/{} errorCode={} error={}",
        quote.id(),
        quote.provider(),
        execution.getStatus(),
        execution.getCurrentStep(),
        execution.getTotalSteps(),
        execution.getErrorCode(),
        execution.getError());
    return execution;
  }

  void validateQuote(BridgeQuote quote, ExecutionContext context) {
    Instant now = clock.instant();
    if (quote.isExpired(now)) {
      throw new BridgeException(
          BridgeErrorCode.QUOTE_EXPIRED, "Quote " + quote.id() + " expired at " + quote.expiresAt() + "; request a new quote");
    }
    if (quote.originToken() == null
        || quote.destinationToken() == null
        || quote.originToken().address().isBlank()
        || quote.destinationToken().address().isBlank()) {
      throw new BridgeException(BridgeErrorCode.INVALID_QUOTE, "Invalid token addresses in quote " + quote.id());
    }
    if (!TokenAmounts.isPositive(quote.fromAmount())) {
      throw new BridgeException(BridgeErrorCode.INVALID_AMOUNT, "Invalid from amount in quote " + quote.id());
    }
    if (quote.depositAddress() == null || quote.depositAddress().isBlank()) {
      throw new BridgeException(BridgeErrorCode.INVALID_QUOTE, "Quote " + quote.id() + " has no deposit target");
    }
    // the recipient is fixed at quote time; providers route funds to the quoted one
    String recipient = context.recipientAddress();
    if (recipient != null && !recipient.isBlank() && !sameAddress(recipient.trim(), quote.destinationAddress())) {
      throw new BridgeException(
          BridgeErrorCode.INVALID_QUOTE,
          "Quote " + quote.id() + " was not issued for recipient " + recipient + "; request a new quote");
    }
  }

  private static boolean sameAddress(String a, String b) {
    if (b == null) return false;
    return a.startsWith("0x") ? a.equalsIgnoreCase(b) : a.equals(b);
  }

  private String deposit(BridgeQuote quote, ExecutionContext context) {
    BigInteger amount = TokenAmounts.toBaseUnits(quote.fromAmount(), quote.originToken().decimals());
    String ref;
    try {
      ref =
          context
              .depositSubmitter()
              .submitDeposit(quote.depositChain(), context.fromAddress(), quote.depositAddress(), amount, quote.originToken());
    } catch (RuntimeException e) {
      throw new BridgeException(BridgeErrorCode.DEPOSIT_FAILED, e.getMessage(), e);
    }
    if (ref == null || ref.isBlank()) {
      throw new BridgeException(BridgeErrorCode.DEPOSIT_FAILED, "deposit returned no transaction reference");
    }
    return ref;
  }

  private static String process(
      BridgeExecutor executor, BridgeQuote quote, String depositRef, ExecutionContext context, StepTracker tracker) {
    try {
      return executor.process(quote, depositRef, context, tracker);
    } catch (BridgeException e) {
      throw new BridgeException(BridgeErrorCode.SETTLEMENT_FAILED, e.getMessage(), e.getDetails(), e);
    }
  }

  private void finish(BridgeExecution execution, StepTracker tracker, MonitorResult result) {
    switch (result.outcome()) {
      case COMPLETED -> {
        String completionRef = tracker.stagedCompletion();
        if (completionRef == null && result.lastStatus() != null) {
          completionRef = result.lastStatus().completionTransactionRef();
        }
        execution.setCompletionTransactionRef(completionRef);
        execution.complete();
        tracker.publish();
      }
      case FAILED -> fail(tracker, BridgeErrorCode.SETTLEMENT_FAILED.name(), "Bridge execution failed: " + result.providerMessage());
      case TIMED_OUT -> {
        metrics.monitorTimeout(execution.getQuote().provider());
        fail(
            tracker,
            BridgeErrorCode.BRIDGE_MONITORING_TIMEOUT.name(),
            "Bridge monitoring timeout after "
                + result.attempts()
                + " status checks; the transfer may still complete, check the chain explorer");
      }
      case CANCELLED -> fail(tracker, BridgeErrorCode.MONITORING_CANCELLED.name(), "Monitoring stopped before a terminal status");
    }
  }

  private static void fail(StepTracker tracker, String code, String message) {
    BridgeExecution execution = tracker.execution();
    if (execution.getStatus().isTerminal()) return;
    execution.fail(code, message);
    tracker.publish();
  }
}
