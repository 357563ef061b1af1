package io.waveswap.bridgebackend.bridge;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StatusMonitorTest {
  private BridgeExecutor executor;
  private StatusMonitor monitor;

  @BeforeEach
  void setUp() {
    executor = mock(BridgeExecutor.class);
    when(executor.provider()).thenReturn(ProviderId.NEAR_INTENTS);
    BridgeProviderRouter router = new BridgeProviderRouter(List.of(), List.of(executor));
    monitor = new StatusMonitor(router, BridgeFixtures.properties());
  }

  @Test
  void defaultsAreThreeSecondsAndFortyAttempts() {
    BridgeProperties defaults = new BridgeProperties();
    assertEquals(3000, defaults.getMonitor().getPollIntervalMs());
    assertEquals(40, defaults.getMonitor().getMaxAttempts());
  }

  @Test
  void stopsAfterExactlyFortyPendingAttempts() {
    when(executor.queryStatus("ref")).thenReturn(ProviderStatus.pending("PROCESSING"));

    MonitorResult result = monitor.monitor("ref", ProviderId.NEAR_INTENTS);

    assertEquals(MonitorResult.Outcome.TIMED_OUT, result.outcome());
    assertEquals(40, result.attempts());
    verify(executor, times(40)).queryStatus("ref");
  }

  @Test
  void honoursPerCallPolicy() {
    when(executor.queryStatus("ref")).thenReturn(ProviderStatus.pending("PENDING_DEPOSIT"));

    MonitorResult result = monitor.monitor("ref", executor, new MonitorPolicy(Duration.ZERO, 5));

    assertEquals(MonitorResult.Outcome.TIMED_OUT, result.outcome());
    verify(executor, times(5)).queryStatus("ref");
  }

  @Test
  void returnsOnFirstTerminalStatus() {
    when(executor.queryStatus("ref"))
        .thenReturn(
            ProviderStatus.pending("PROCESSING"),
            ProviderStatus.pending("PROCESSING"),
            ProviderStatus.completed("SUCCESS", "dest-tx"));

    MonitorResult result = monitor.monitor("ref", ProviderId.NEAR_INTENTS);

    assertEquals(MonitorResult.Outcome.COMPLETED, result.outcome());
    assertEquals(3, result.attempts());
    assertEquals("dest-tx", result.lastStatus().completionTransactionRef());
    verify(executor, times(3)).queryStatus("ref");
  }

  @Test
  void failedStatusEndsMonitoring() {
    when(executor.queryStatus("ref")).thenReturn(ProviderStatus.failed("REFUNDED", "refunded to origin"));

    MonitorResult result = monitor.monitor("ref", ProviderId.NEAR_INTENTS);

    assertEquals(MonitorResult.Outcome.FAILED, result.outcome());
    assertEquals("refunded to origin", result.providerMessage());
  }

  @Test
  void transportErrorsCountAsPendingAttempts() {
    when(executor.queryStatus("ref"))
        .thenThrow(new BridgeException(BridgeErrorCode.QUOTE_PROVIDER_UNAVAILABLE, "502"))
        .thenReturn(ProviderStatus.completed("SUCCESS", null));

    MonitorResult result = monitor.monitor("ref", ProviderId.NEAR_INTENTS);

    assertEquals(MonitorResult.Outcome.COMPLETED, result.outcome());
    assertEquals(2, result.attempts());
  }

  @Test
  void interruptedCallerStopsWithoutQuerying() {
    Thread.currentThread().interrupt();
    try {
      MonitorResult result = monitor.monitor("ref", ProviderId.NEAR_INTENTS);
      assertEquals(MonitorResult.Outcome.CANCELLED, result.outcome());
      assertEquals(0, result.attempts());
    } finally {
      assertTrue(Thread.interrupted());
    }
    verify(executor, never()).queryStatus(anyString());
  }
}
