package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.Route;
import io.waveswap.bridgebackend.util.BridgeTokenCatalog;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Read-only table of which tokens each provider can service and which providers can service a route.
 * Pure lookups over static data; safe to share between threads.
 *
 * <p>Precedence: a Solana/StarkNet route always goes to the native bridge regardless of token flags;
 * otherwise NEAR Intents when both tokens declare it; otherwise the generic settlement protocol when
 * both declare it; otherwise nothing.
 */
@Component
public class CapabilityRegistry {
  private final List<CrossChainToken> tokens;

  public CapabilityRegistry() {
    this(BridgeTokenCatalog.TOKENS);
  }

  public CapabilityRegistry(List<CrossChainToken> tokens) {
    this.tokens = List.copyOf(tokens);
  }

  public List<CrossChainToken> tokens() {
    return tokens;
  }

  public List<CrossChainToken> tokens(ChainId chain) {
    if (chain == null) return tokens;
    return tokens.stream().filter(t -> t.chain() == chain).toList();
  }

  public Optional<CrossChainToken> findToken(ChainId chain, String address) {
    if (chain == null || address == null || address.isBlank()) return Optional.empty();
    String needle = address.trim();
    boolean hex = needle.toLowerCase(Locale.ROOT).startsWith("0x");
    return tokens.stream()
        .filter(t -> t.chain() == chain)
        .filter(t -> hex ? t.address().equalsIgnoreCase(needle) : t.address().equals(needle))
        .findFirst();
  }

  public boolean isNativeBridgeRoute(Route route) {
    return route.originChain().hasNativeBridge() && route.destinationChain().hasNativeBridge();
  }

  public boolean isSupported(CrossChainToken token, ProviderId provider) {
    if (token == null || provider == null) return false;
    if (provider == ProviderId.STARKGATE) return token.chain().hasNativeBridge();
    return token.supports(provider);
  }

  /** Every provider able to service the route, in precedence order. */
  public Set<ProviderId> providersFor(Route route) {
    Set<ProviderId> out = new LinkedHashSet<>();
    if (isNativeBridgeRoute(route)) out.add(ProviderId.STARKGATE);
    for (ProviderId p : List.of(ProviderId.NEAR_INTENTS, ProviderId.DEFUSE)) {
      if (isSupported(route.originToken(), p) && isSupported(route.destinationToken(), p)) out.add(p);
    }
    return Collections.unmodifiableSet(out);
  }

  public Optional<ProviderId> preferredProvider(Route route) {
    return providersFor(route).stream().findFirst();
  }
}
