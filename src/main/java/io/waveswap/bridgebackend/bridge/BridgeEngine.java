package io.waveswap.bridgebackend.bridge;

import io.waveswap.bridgebackend.bridge.BridgeRequestValidator.ValidatedRequest;
import io.waveswap.bridgebackend.bridge.dto.BridgeDtos;
import io.waveswap.bridgebackend.model.bridge.BridgeExecution;
import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import io.waveswap.bridgebackend.model.bridge.Route;
import io.waveswap.bridgebackend.service.QuoteStore;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for callers: validate, select, quote, store, execute. Stateless apart from the quote store;
 * concurrent requests share nothing mutable.
 */
@Service
public class BridgeEngine {
  private static final Logger log = LoggerFactory.getLogger(BridgeEngine.class);

  private final CapabilityRegistry registry;
  private final BridgeRequestValidator validator;
  private final ProviderSelector selector;
  private final BridgeProviderRouter router;
  private final ExecutionStateMachine stateMachine;
  private final QuoteStore quoteStore;
  private final BridgeMetrics metrics;
  private final BridgeProperties properties;

  public BridgeEngine(
      CapabilityRegistry registry,
      BridgeRequestValidator validator,
      ProviderSelector selector,
      BridgeProviderRouter router,
      ExecutionStateMachine stateMachine,
      QuoteStore quoteStore,
      BridgeMetrics metrics,
      BridgeProperties properties) {
    this.registry = registry;
    this.validator = validator;
    this.selector = selector;
    this.router = router;
    this.stateMachine = stateMachine;
    this.quoteStore = quoteStore;
    this.metrics = metrics;
    this.properties = properties;
  }

  public BridgeQuote quote(
      CrossChainToken originToken, CrossChainToken destinationToken, String amount, BridgeOptions options) {
    requireEnabled();
    ProviderId provider = null;
    try {
      BridgeOptions resolved =
          (options == null ? BridgeOptions.defaults() : options)
              .resolve(properties.getQuote().getDefaultSlippageBps(), properties.getQuote().getDefaultDeadlineSeconds());
      ValidatedRequest request = validator.validate(originToken, destinationToken, amount, resolved);
      provider = selector.selectProvider(request.route());
      BridgeQuote quote = router.generator(provider).generateQuote(originToken, destinationToken, amount, request.options());
      quoteStore.save(quote, resolved.deadlineSeconds() + properties.getQuote().getStoreTtlPaddingSeconds());
      metrics.quoteIssued(provider);
      log.info("bridge quote issued: quoteId={} provider={} toAmount={}", quote.id(), provider, quote.toAmount());
      return quote;
    } catch (BridgeException e) {
      metrics.quoteFailed(provider, e.getCode());
      log.info("bridge quote refused: provider={} code={} message={}", provider, e.getCode(), e.getMessage());
      throw provider == null ? e : e.with("provider", provider.key());
    }
  }

  public BridgeExecution execute(BridgeQuote quote, ExecutionContext context) {
    requireEnabled();
    return stateMachine.executeBridge(quote, context);
  }

  public BridgeExecution executeStored(String quoteId, ExecutionContext context) {
    return execute(requireQuote(quoteId), context);
  }

  public BridgeQuote requireQuote(String quoteId) {
    return quoteStore
        .find(quoteId)
        .orElseThrow(
            () ->
                new BridgeException(BridgeErrorCode.QUOTE_NOT_FOUND, "quote " + quoteId + " not found or expired")
                    .with("quoteId", quoteId));
  }

  /** One read-only status query, outside any execution. */
  public ProviderStatus status(ProviderId provider, String reference) {
    if (reference == null || reference.isBlank()) {
      throw new IllegalArgumentException("reference is required");
    }
    return router.executor(provider).queryStatus(reference.trim());
  }

  public BridgeDtos.RouteResponse route(CrossChainToken originToken, CrossChainToken destinationToken) {
    Route route = new Route(originToken, destinationToken);
    List<ProviderId> providers = List.copyOf(registry.providersFor(route));
    ProviderId selected = providers.isEmpty() ? null : providers.get(0);
    return new BridgeDtos.RouteResponse(
        route.originChain(),
        originToken.symbol(),
        route.destinationChain(),
        destinationToken.symbol(),
        providers,
        selected,
        selected == null ? null : selected.estimatedTime());
  }

  public List<CrossChainToken> tokens(ChainId chain) {
    return registry.tokens(chain);
  }

  public BridgeDtos.AddressValidationResponse validateAddress(ChainId chain, String address) {
    return new BridgeDtos.AddressValidationResponse(
        chain, address, validator.isValidAddress(chain, address), validator.addressPattern(chain));
  }

  public ChainId resolveChain(String raw) {
    return ChainId.parse(raw)
        .orElseThrow(() -> new BridgeException(BridgeErrorCode.INVALID_ROUTE, "unsupported chain: " + raw));
  }

  public ProviderId resolveProvider(String raw) {
    return ProviderId.parse(raw)
        .orElseThrow(() -> new BridgeException(BridgeErrorCode.NO_PROVIDER_FOR_ROUTE, "unknown provider: " + raw));
  }

  public CrossChainToken resolveToken(ChainId chain, String address) {
    return registry
        .findToken(chain, address)
        .orElseThrow(
            () ->
                new BridgeException(
                    BridgeErrorCode.TOKEN_NOT_SUPPORTED, "token " + address + " on " + chain + " is not supported"));
  }

  private void requireEnabled() {
    if (!properties.isEnabled()) {
      throw new BridgeException(BridgeErrorCode.BRIDGE_DISABLED, "bridging is disabled");
    }
  }
}
