package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ExecutionSnapshot;
import java.util.function.Consumer;

/**
 * Caller-supplied collaborators for one execution.
 *
 * @param listener receives a snapshot after every state change; may be a no-op
 * @param monitorPolicy overrides the configured polling constants when non-null
 */
public record ExecutionContext(
    String fromAddress,
    String recipientAddress,
    DepositSubmitter depositSubmitter,
    Consumer<ExecutionSnapshot> listener,
    MonitorPolicy monitorPolicy) {

  public ExecutionContext {
    if (depositSubmitter == null) throw new IllegalArgumentException("depositSubmitter is required");
    listener = listener == null ? snapshot -> {} : listener;
  }

  public static ExecutionContext of(String fromAddress, DepositSubmitter depositSubmitter) {
    return new ExecutionContext(fromAddress, null, depositSubmitter, null, null);
  }

  public ExecutionContext withListener(Consumer<ExecutionSnapshot> next) {
    return new ExecutionContext(fromAddress, recipientAddress, depositSubmitter, next, monitorPolicy);
  }

  public ExecutionContext withMonitorPolicy(MonitorPolicy next) {
    return new ExecutionContext(fromAddress, recipientAddress, depositSubmitter, listener, next);
  }
}
