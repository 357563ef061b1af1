package io.waveswap.bridgebackend.client;

import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.util.retry.Retry;

/** Maps provider HTTP failures onto the bridge error taxonomy. */
public final class ProviderHttpErrors {
  private ProviderHttpErrors() {}

  public static boolean isTransient(Throwable error) {
    Throwable e = Exceptions.unwrap(error);
    if (e instanceof WebClientResponseException r) return r.getStatusCode().is5xxServerError();
    return e instanceof WebClientRequestException || e instanceof TimeoutException;
  }

  /** Bounded exponential backoff for read-only quote calls. Never use for submissions. */
  public static Retry quoteRetry(int maxRetries, long backoffMs) {
    return Retry.backoff(Math.max(0, maxRetries), Duration.ofMillis(Math.max(1L, backoffMs)))
        .filter(ProviderHttpErrors::isTransient)
        .onRetryExhaustedThrow((spec, signal) -> signal.failure());
  }

  public static BridgeException classify(Throwable error, ProviderId provider, String operation) {
    Throwable e = Exceptions.unwrap(error);
    if (e instanceof BridgeException b) return b;
    Map<String, Object> details = Map.of("provider", provider.key(), "operation", operation);
    if (e instanceof WebClientResponseException r) {
      String body = r.getResponseBodyAsString();
      if (r.getStatusCode().is4xxClientError()) {
        BridgeErrorCode code = mentionsLiquidity(body) ? BridgeErrorCode.INSUFFICIENT_LIQUIDITY : BridgeErrorCode.QUOTE_REJECTED;
        return new BridgeException(
            code, provider.key() + " " + operation + " rejected (HTTP " + r.getStatusCode().value() + "): " + body, details, e);
      }
      return new BridgeException(
          BridgeErrorCode.QUOTE_PROVIDER_UNAVAILABLE,
          provider.key() + " " + operation + " failed (HTTP " + r.getStatusCode().value() + ")",
          details,
          e);
    }
    return new BridgeException(
        BridgeErrorCode.QUOTE_PROVIDER_UNAVAILABLE,
        provider.key() + " " + operation + " unavailable: " + e.getMessage(),
        details,
        e);
  }

  /** Business-level rejection carried in a 200 response (JSON-RPC error, empty quote list). */
  public static BridgeException rejected(ProviderId provider, String operation, String message) {
    BridgeErrorCode code = mentionsLiquidity(message) ? BridgeErrorCode.INSUFFICIENT_LIQUIDITY : BridgeErrorCode.QUOTE_REJECTED;
    return new BridgeException(
        code,
        provider.key() + " " + operation + " rejected: " + message,
        Map.of("provider", provider.key(), "operation", operation),
        null);
  }

  static boolean mentionsLiquidity(String text) {
    if (text == null) return false;
    String v = text.toLowerCase(Locale.ROOT);
    return v.contains("liquidity") || v.contains("too low") || v.contains("insufficient") || v.contains("no quotes");
  }

  static String normalizeBaseUrl(String value) {
    if (value == null) return "";
    String trimmed = value.trim();
    while (trimmed.endsWith("/")) trimmed = trimmed.substring(0, trimmed.length() - 1);
    return trimmed;
  }
}
