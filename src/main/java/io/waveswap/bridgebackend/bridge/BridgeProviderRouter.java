package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ProviderId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/** Immutable provider id to implementation table, built once at startup. */
@Component
public class BridgeProviderRouter {
  private final Map<ProviderId, QuoteGenerator> generators;
  private final Map<ProviderId, BridgeExecutor> executors;

  public BridgeProviderRouter(List<QuoteGenerator> generators, List<BridgeExecutor> executors) {
    this.generators =
        generators.stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    QuoteGenerator::provider,
                    Function.identity(),
                    (left, right) -> {
                      throw new IllegalStateException("Multiple quote generators for provider: " + left.provider());
                    }));
    this.executors =
        executors.stream()
            .collect(
                Collectors.toUnmodifiableMap(
                    BridgeExecutor::provider,
                    Function.identity(),
                    (left, right) -> {
                      throw new IllegalStateException("Multiple executors for provider: " + left.provider());
                    }));
  }

  public QuoteGenerator generator(ProviderId provider) {
    return Optional.ofNullable(generators.get(provider))
        .orElseThrow(
            () -> new BridgeException(BridgeErrorCode.NO_PROVIDER_FOR_ROUTE, "no quote generator for " + provider));
  }

  public BridgeExecutor executor(ProviderId provider) {
    return Optional.ofNullable(executors.get(provider))
        .orElseThrow(
            () -> new BridgeException(BridgeErrorCode.NO_PROVIDER_FOR_ROUTE, "no executor for " + provider));
  }
}
