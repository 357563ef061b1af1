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
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;

/** 1Click API of the NEAR Intents network: {@code /quote}, {@code /deposit/submit}, {@code /status}. */
@Component
public class NearIntentsClient {
  private static final Logger log = LoggerFactory.getLogger(NearIntentsClient.class);

  private final WebClient webClient;
  private final ObjectMapper mapper = new ObjectMapper();
  private final String baseUrl;
  private final String jwt;
  private final Duration timeout;
  private final int maxRetries;
  private final long retryBackoffMs;

  public NearIntentsClient(WebClient webClient, BridgeProperties properties) {
    this.webClient = webClient;
    this.baseUrl = ProviderHttpErrors.normalizeBaseUrl(properties.getNearIntents().getApiBaseUrl());
    this.jwt = properties.getNearIntents().getJwt() == null ? "" : properties.getNearIntents().getJwt().trim();
    this.timeout = Duration.ofMillis(Math.max(1000L, properties.getNearIntents().getTimeoutMs()));
    this.maxRetries = properties.getQuote().getMaxRetries();
    this.retryBackoffMs = properties.getQuote().getRetryBackoffMs();
  }

  public ObjectNode newObject() {
    return mapper.createObjectNode();
  }

  public JsonNode quote(ObjectNode request) {
    requireConfigured("quote");
    URI uri = URI.create(baseUrl + "/quote");
    try {
      JsonNode root =
          webClient
              .post()
              .uri(uri)
              .headers(this::applyHeaders)
              .bodyValue(request)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout)
              .retryWhen(ProviderHttpErrors.quoteRetry(maxRetries, retryBackoffMs))
              .block();
      if (root == null || !root.isObject()) {
        throw ProviderHttpErrors.rejected(ProviderId.NEAR_INTENTS, "quote", "empty response");
      }
      return root;
    } catch (BridgeException e) {
      throw e;
    } catch (Exception e) {
      log.warn("1Click quote failed: uri={} error={}", uri, e.getMessage());
      throw ProviderHttpErrors.classify(e, ProviderId.NEAR_INTENTS, "quote");
    }
  }

  public void submitDeposit(String txHash, String depositAddress) {
    requireConfigured("deposit/submit");
    ObjectNode body = mapper.createObjectNode().put("txHash", txHash).put("depositAddress", depositAddress);
    URI uri = URI.create(baseUrl + "/deposit/submit");
    try {
      webClient
          .post()
          .uri(uri)
          .headers(this::applyHeaders)
          .bodyValue(body)
          .retrieve()
          .toBodilessEntity()
          .timeout(timeout)
          .block();
    } catch (Exception e) {
      log.warn("1Click deposit submit failed: depositAddress={} txHash={} error={}", depositAddress, txHash, e.getMessage());
      throw ProviderHttpErrors.classify(e, ProviderId.NEAR_INTENTS, "deposit/submit");
    }
  }

  public JsonNode status(String depositAddress) {
    requireConfigured("status");
    URI uri =
        UriComponentsBuilder.fromUriString(baseUrl + "/status")
            .queryParam("depositAddress", depositAddress)
            .build()
            .encode()
            .toUri();
    try {
      JsonNode root =
          webClient
              .get()
              .uri(uri)
              .headers(this::applyHeaders)
              .retrieve()
              .bodyToMono(JsonNode.class)
              .timeout(timeout)
              .block();
      return root == null ? mapper.createObjectNode() : root;
    } catch (Exception e) {
      throw ProviderHttpErrors.classify(e, ProviderId.NEAR_INTENTS, "status");
    }
  }

  private void applyHeaders(HttpHeaders h) {
    h.setContentType(MediaType.APPLICATION_JSON);
    if (!jwt.isBlank()) h.setBearerAuth(jwt);
  }

  private void requireConfigured(String operation) {
    if (baseUrl.isBlank()) {
      throw new BridgeException(
          BridgeErrorCode.QUOTE_PROVIDER_UNAVAILABLE, "app.bridge.near-intents.api-base-url not set (" + operation + ")");
    }
  }
}
