package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.Route;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class ProviderSelector {
  private final CapabilityRegistry registry;

  public ProviderSelector(CapabilityRegistry registry) {
    this.registry = registry;
  }

  public ProviderId selectProvider(Route route) {
    return registry
        .preferredProvider(route)
        .orElseThrow(
            () ->
                new BridgeException(
                    BridgeErrorCode.NO_PROVIDER_FOR_ROUTE,
                    "no bridge provider for "
                        + route.originToken().symbol()
                        + " on "
                        + route.originChain()
                        + " -> "
                        + route.destinationToken().symbol()
                        + " on "
                        + route.destinationChain(),
                    Map.of("originChain", route.originChain().name(), "destinationChain", route.destinationChain().name()),
                    null));
  }
}
