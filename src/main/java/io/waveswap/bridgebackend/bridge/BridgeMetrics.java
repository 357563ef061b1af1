package io.waveswap.bridgebackend.bridge;

import io.micrometer.core.instrument.MeterRegistry;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import org.springframework.stereotype.Component;

@Component
public class BridgeMetrics {
  private final MeterRegistry meterRegistry;
  private final BridgeProperties properties;

  public BridgeMetrics(MeterRegistry meterRegistry, BridgeProperties properties) {
    this.meterRegistry = meterRegistry;
    this.properties = properties;
  }

  public void quoteIssued(ProviderId provider) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("bridge.quote.issued", "provider", provider.key()).increment();
  }

  public void quoteFailed(ProviderId provider, BridgeErrorCode code) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry
        .counter("bridge.quote.failed", "provider", provider == null ? "none" : provider.key(), "code", code.name())
        .increment();
  }

  public void executionCompleted(ProviderId provider) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("bridge.execution.completed", "provider", provider.key()).increment();
  }

  public void executionFailed(ProviderId provider, String code) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry
        .counter("bridge.execution.failed", "provider", provider.key(), "code", code == null ? "UNKNOWN" : code)
        .increment();
  }

  public void monitorTimeout(ProviderId provider) {
    if (!properties.isMetricsEnabled()) return;
    meterRegistry.counter("bridge.monitor.timeout", "provider", provider.key()).increment();
  }
}
