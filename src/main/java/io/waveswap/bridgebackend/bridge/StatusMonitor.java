package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Polls a provider status endpoint until it reports a terminal state or the attempt budget runs out.
 * Runs on the caller's thread; interrupting that thread stops observation without touching the transfer.
 */
@Component
public class StatusMonitor {
  private static final Logger log = LoggerFactory.getLogger(StatusMonitor.class);

  private final BridgeProviderRouter router;
  private final BridgeProperties properties;

  public StatusMonitor(BridgeProviderRouter router, BridgeProperties properties) {
    this.router = router;
    this.properties = properties;
  }

  public MonitorResult monitor(String reference, ProviderId provider) {
    return monitor(reference, router.executor(provider), MonitorPolicy.from(properties.getMonitor()));
  }

  public MonitorResult monitor(String reference, BridgeExecutor executor, MonitorPolicy policy) {
    ProviderStatus last = null;
    int max = policy.maxAttempts();
    for (int attempt = 1; attempt <= max; attempt++) {
      if (Thread.currentThread().isInterrupted()) {
        log.info("monitoring cancelled: provider={} reference={} attempts={}", executor.provider(), reference, attempt - 1);
        return new MonitorResult(MonitorResult.Outcome.CANCELLED, attempt - 1, last);
      }
      try {
        ProviderStatus status = executor.queryStatus(reference);
        if (status != null) {
          last = status;
          if (status.state() == ProviderStatus.State.COMPLETED) {
            log.info("bridge completed: provider={} reference={} attempts={}", executor.provider(), reference, attempt);
            return new MonitorResult(MonitorResult.Outcome.COMPLETED, attempt, status);
          }
          if (status.state() == ProviderStatus.State.FAILED) {
            log.info(
                "bridge failed: provider={} reference={} attempts={} status={} message={}",
                executor.provider(),
                reference,
                attempt,
                status.rawStatus(),
                status.message());
            return new MonitorResult(MonitorResult.Outcome.FAILED, attempt, status);
          }
        }
        if (log.isDebugEnabled()) {
          log.debug(
              "bridge pending: provider={} reference={} attempt={}/{} status={}",
              executor.provider(),
              reference,
              attempt,
              max,
              status == null ? null : status.rawStatus());
        }
      } catch (RuntimeException e) {
        log.warn(
            "status query failed, treating as pending: provider={} reference={} attempt={}/{} error={}",
            executor.provider(),
            reference,
            attempt,
            max,
            e.getMessage());
      }
      if (attempt < max && !sleep(policy)) {
        log.info("monitoring cancelled: provider={} reference={} attempts={}", executor.provider(), reference, attempt);
        return new MonitorResult(MonitorResult.Outcome.CANCELLED, attempt, last);
      }
    }
    log.warn("monitoring timed out: provider={} reference={} attempts={}", executor.provider(), reference, max);
    return new MonitorResult(MonitorResult.Outcome.TIMED_OUT, max, last);
  }

  private static boolean sleep(MonitorPolicy policy) {
    long ms = policy.pollInterval().toMillis();
    if (ms <= 0) return true;
    try {
      TimeUnit.MILLISECONDS.sleep(ms);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
