package io.waveswap.bridgebackend.bridge.provider;

import static io.waveswap.bridgebackend.bridge.BridgeFixtures.NOW;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.USDC_SOLANA;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.WNEAR;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.bridge.BridgeFixtures;
import io.waveswap.bridgebackend.client.SolverRelayClient;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class DefuseQuoteGeneratorTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private SolverRelayClient client;
  private DefuseQuoteGenerator generator;

  @BeforeEach
  void setUp() {
    client = mock(SolverRelayClient.class);
    generator = new DefuseQuoteGenerator(client, BridgeFixtures.properties(), Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void picksBestSolverOfferLessProtocolFee() throws Exception {
    when(client.quote(anyString(), anyString(), anyString(), anyLong()))
        .thenReturn(
            mapper.readTree(
                "[{\"quote_hash\":\"h1\",\"amount_out\":\"1000000\"},"
                    + "{\"quote_hash\":\"h2\",\"amount_out\":\"2000000\"},"
                    + "{\"quote_hash\":\"\",\"amount_out\":\"9000000\"}]"));

    BridgeQuote quote = generator.generateQuote(WNEAR, USDC_SOLANA, "2", null);

    verify(client)
        .quote("nep141:wrap.near", USDC_SOLANA.assetId(), "2000000000000000000000000", 1_200_000L);
    assertEquals("h2", quote.providerQuoteRef());
    assertEquals("1.998", quote.toAmount());
    assertEquals("0.002", quote.feeAmount());
    assertEquals(0, new BigDecimal("0.1").compareTo(quote.feePercentage()));
    assertEquals("intents.near", quote.depositAddress());
    assertEquals("3-5 minutes", quote.estimatedTime());
  }

  @Test
  void noPositiveOfferIsInsufficientLiquidity() throws Exception {
    when(client.quote(anyString(), anyString(), anyString(), anyLong()))
        .thenReturn(mapper.readTree("[{\"quote_hash\":\"h1\",\"amount_out\":\"0\"}]"));

    BridgeException e = assertThrows(BridgeException.class, () -> generator.generateQuote(WNEAR, USDC_SOLANA, "1", null));
    assertEquals(BridgeErrorCode.INSUFFICIENT_LIQUIDITY, e.getCode());
  }
}
