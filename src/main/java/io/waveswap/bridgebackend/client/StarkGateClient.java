package io.waveswap.bridgebackend.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.bridge.BridgeProperties;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import java.net.URI;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

/**
 * Lock/relay API of the native Solana/StarkNet bridge.
 *
 * <ul>
 *   <li>{@code POST /v1/quote} - fee, output amount and lock (escrow) address
 *   <li>{@code POST /v1/relay} - hands a confirmed lock transaction to the relayer, returns {@code relayId}
 *   <li>{@code POST /v1/execute} - mints/releases on the destination chain, returns {@code transactionHash}
 *   <li>{@code GET /v1/status/{relayId}} - {@code pending|completed|failed}
 * </ul>
 */
@Component
public class StarkGateClient {
  private static final Logger log = LoggerFactory.getLogger(StarkGateClient.class);

  private final WebClient webClient;
  private final ObjectMapper mapper = new ObjectMapper();
  private final String baseUrl;
  private final Duration timeout;
  private final int maxRetries;
  private final long retryBackoffMs;

  public StarkGateClient(WebClient webClient, BridgeProperties properties) {
    this.webClient = webClient;
    this.baseUrl = ProviderHttpErrors.normalizeBaseUrl(properties.getStarkgate().getApiBaseUrl());
    this.timeout = Duration.ofMillis(Math.max(1000L, properties.getStarkgate().getTimeoutMs()));
    this.maxRetries = properties.getQuote().getMaxRetries();
    this.retryBackoffMs = properties.getQuote().getRetryBackoffMs();
  }

  public ObjectNode newObject() {
    return mapper.createObjectNode();
  }

  public JsonNode quote(ObjectNode request) {
    try {
      JsonNode root =
          post("/v1/quote", request)
              .retryWhen(ProviderHttpErrors.quoteRetry(maxRetries, retryBackoffMs))
              .block();
      if (root == null || !root.isObject()) {
        throw ProviderHttpErrors.rejected(ProviderId.STARKGATE, "quote", "empty response");
      }
      if (root.hasNonNull("error")) {
        throw ProviderHttpErrors.rejected(ProviderId.STARKGATE, "quote", root.path("error").asText());
      }
      return root;
    } catch (BridgeException e) {
      throw e;
    } catch (Exception e) {
      log.warn("StarkGate quote failed: error={}", e.getMessage());
      throw ProviderHttpErrors.classify(e, ProviderId.STARKGATE, "quote");
    }
  }

  public String relay(String quoteId, String lockTransactionRef) {
    ObjectNode body = mapper.createObjectNode().put("quoteId", quoteId).put("lockTxHash", lockTransactionRef);
    JsonNode root = submit("/v1/relay", body, "relay");
    String relayId = root.path("relayId").asText("");
    if (relayId.isBlank()) {
      throw new BridgeException(BridgeErrorCode.SETTLEMENT_FAILED, "StarkGate relay returned no relayId for " + lockTransactionRef);
    }
    return relayId;
  }

  public String executeOnDestination(String relayId) {
    JsonNode root = submit("/v1/execute", mapper.createObjectNode().put("relayId", relayId), "execute");
    String tx = root.path("transactionHash").asText("");
    if (tx.isBlank()) {
      throw new BridgeException(BridgeErrorCode.SETTLEMENT_FAILED, "StarkGate execute returned no transactionHash for " + relayId);
    }
    return tx;
  }

  public JsonNode status(String relayId) {
    requireConfigured("status");
    URI uri = UriComponentsBuilder.fromUriString(baseUrl + "/v1/status/{id}").buildAndExpand(relayId).encode().toUri();
    try {
      JsonNode root = webClient.get().uri(uri).retrieve().bodyToMono(JsonNode.class).timeout(timeout).block();
      return root == null ? mapper.createObjectNode() : root;
    } catch (Exception e) {
      throw ProviderHttpErrors.classify(e, ProviderId.STARKGATE, "status");
    }
  }

  private JsonNode submit(String path, ObjectNode body, String operation) {
    try {
      JsonNode root = post(path, body).block();
      return root == null ? mapper.createObjectNode() : root;
    } catch (BridgeException e) {
      throw e;
    } catch (Exception e) {
      log.warn("StarkGate {} failed: body={} error={}", operation, body, e.getMessage());
      throw ProviderHttpErrors.classify(e, ProviderId.STARKGATE, operation);
    }
  }

  private Mono<JsonNode> post(String path, ObjectNode body) {
    requireConfigured(path);
    return webClient
        .post()
        .uri(URI.create(baseUrl + path))
        .contentType(MediaType.APPLICATION_JSON)
        .bodyValue(body)
        .retrieve()
        .bodyToMono(JsonNode.class)
        .timeout(timeout);
  }

  private void requireConfigured(String operation) {
    if (baseUrl.isBlank()) {
      throw new BridgeException(
          BridgeErrorCode.QUOTE_PROVIDER_UNAVAILABLE, "app.bridge.starkgate.api-base-url not set (" + operation + ")");
    }
  }
}
