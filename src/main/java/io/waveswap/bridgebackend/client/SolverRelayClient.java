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
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** JSON-RPC client for the generic settlement protocol's solver relay. */
@Component
public class SolverRelayClient {
  private static final Logger log = LoggerFactory.getLogger(SolverRelayClient.class);

  private final WebClient webClient;
  private final ObjectMapper mapper = new ObjectMapper();
  private final String relayUrl;
  private final Duration timeout;
  private final int maxRetries;
  private final long retryBackoffMs;

  public SolverRelayClient(WebClient webClient, BridgeProperties properties) {
    this.webClient = webClient;
    this.relayUrl = ProviderHttpErrors.normalizeBaseUrl(properties.getDefuse().getSolverRelayUrl());
    this.timeout = Duration.ofMillis(Math.max(1000L, properties.getDefuse().getTimeoutMs()));
    this.maxRetries = properties.getQuote().getMaxRetries();
    this.retryBackoffMs = properties.getQuote().getRetryBackoffMs();
  }

  /** Returns the relay's quote list; never empty. */
  public JsonNode quote(String assetIn, String assetOut, String exactAmountIn, long minDeadlineMs) {
    ObjectNode params =
        mapper
            .createObjectNode()
            .put("defuse_asset_identifier_in", assetIn)
            .put("defuse_asset_identifier_out", assetOut)
            .put("exact_amount_in", exactAmountIn)
            .put("min_deadline_ms", minDeadlineMs);
    JsonNode result = call("quote", params, true);
    if (result == null || !result.isArray() || result.isEmpty()) {
      throw ProviderHttpErrors.rejected(ProviderId.DEFUSE, "quote", "no quotes available for " + assetIn + " -> " + assetOut);
    }
    return result;
  }

  /** Publishes the intent bound to {@code quoteHash}; returns the intent hash. */
  public String publishIntent(String quoteHash, String depositTransactionRef, String signerId) {
    ObjectNode params = mapper.createObjectNode();
    params.putArray("quote_hashes").add(quoteHash);
    params.put("deposit_tx", depositTransactionRef);
    if (signerId != null && !signerId.isBlank()) params.put("signer_id", signerId);
    JsonNode result = call("publish_intent", params, false);
    if (result == null || !"OK".equalsIgnoreCase(result.path("status").asText())) {
      String reason = result == null ? "no result" : result.path("reason").asText(result.toString());
      throw new BridgeException(BridgeErrorCode.SETTLEMENT_FAILED, "solver relay refused intent: " + reason);
    }
    return result.path("intent_hash").asText("");
  }

  public JsonNode getStatus(String intentHash) {
    return call("get_status", mapper.createObjectNode().put("intent_hash", intentHash), false);
  }

  JsonNode call(String method, ObjectNode params, boolean retryable) {
    if (relayUrl.isBlank()) {
      throw new BridgeException(
          BridgeErrorCode.QUOTE_PROVIDER_UNAVAILABLE, "app.bridge.defuse.solver-relay-url not set (" + method + ")");
    }
    ObjectNode body = mapper.createObjectNode();
    body.put("id", UUID.randomUUID().toString());
    body.put("jsonrpc", "2.0");
    body.put("method", method);
    body.putArray("params").add(params);

    try {
      Mono<JsonNode> request =
          webClient
              .post()
              .uri(URI.create(relayUrl))
              .contentType(MediaType.APPLICATION_JSON)
              .bodyValue(body)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout);
      if (retryable) request = request.retryWhen(ProviderHttpErrors.quoteRetry(maxRetries, retryBackoffMs));
      JsonNode root = request.block();
      if (root == null) {
        throw ProviderHttpErrors.rejected(ProviderId.DEFUSE, method, "empty response");
      }
      if (root.hasNonNull("error")) {
        JsonNode err = root.path("error");
        String message = err.path("message").asText(err.toString());
        throw ProviderHttpErrors.rejected(ProviderId.DEFUSE, method, message);
      }
      return root.path("result");
    } catch (BridgeException e) {
      throw e;
    } catch (Exception e) {
      log.warn("solver relay {} failed: url={} error={}", method, relayUrl, e.getMessage());
      throw ProviderHttpErrors.classify(e, ProviderId.DEFUSE, method);
    }
  }
}
