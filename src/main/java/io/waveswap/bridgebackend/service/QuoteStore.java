package io.waveswap.bridgebackend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Issued quotes, keyed by quote id, kept until shortly after their deadline. Quotes are immutable, so
 * entries are written once and never updated.
 */
@Service
public class QuoteStore {
  private static final Logger log = LoggerFactory.getLogger(QuoteStore.class);
  private static final String PREFIX_QUOTE = "bridge:quote:";

  private final StringRedisTemplate redis;
  private final ObjectMapper objectMapper;

  public QuoteStore(StringRedisTemplate redis, ObjectMapper objectMapper) {
    this.redis = redis;
    this.objectMapper = objectMapper;
  }

  public void save(BridgeQuote quote, long ttlSeconds) {
    String raw;
    try {
      raw = objectMapper.writeValueAsString(quote);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("cannot serialize quote " + quote.id(), e);
    }
    redis.opsForValue().set(PREFIX_QUOTE + quote.id(), raw, Duration.ofSeconds(Math.max(1, ttlSeconds)));
  }

  public Optional<BridgeQuote> find(String quoteId) {
    if (quoteId == null || quoteId.isBlank()) return Optional.empty();
    String raw = redis.opsForValue().get(PREFIX_QUOTE + quoteId.trim());
    if (raw == null || raw.isBlank()) return Optional.empty();
    try {
      return Optional.of(objectMapper.readValue(raw, BridgeQuote.class));
    } catch (JsonProcessingException e) {
      log.warn("stored quote unreadable: quoteId={} error={}", quoteId, e.getMessage());
      return Optional.empty();
    }
  }
}
