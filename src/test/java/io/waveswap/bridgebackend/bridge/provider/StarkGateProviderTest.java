package io.waveswap.bridgebackend.bridge.provider;

import static io.waveswap.bridgebackend.bridge.BridgeFixtures.NOW;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.SOL_SOLANA;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.SOL_STARKNET;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.STARKNET_ADDRESS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.bridge.BridgeFixtures;
import io.waveswap.bridgebackend.bridge.ExecutionContext;
import io.waveswap.bridgebackend.bridge.PresignedDepositSubmitter;
import io.waveswap.bridgebackend.bridge.StepTracker;
import io.waveswap.bridgebackend.client.StarkGateClient;
import io.waveswap.bridgebackend.model.bridge.BridgeExecution;
import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class StarkGateProviderTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private StarkGateClient client;

  @BeforeEach
  void setUp() {
    client = mock(StarkGateClient.class);
    when(client.newObject()).thenAnswer(inv -> mapper.createObjectNode());
  }

  @Test
  void quoteCarriesLockAddressAndRelayQuoteId() throws Exception {
    when(client.quote(any()))
        .thenReturn(
            mapper.readTree(
                "{\"quoteId\":\"sg-1\",\"amountOut\":\"1497000000\",\"bridgeFee\":\"3000000\",\"depositAddress\":\"Lock1111\"}"));
    StarkGateQuoteGenerator generator =
        new StarkGateQuoteGenerator(client, BridgeFixtures.properties(), Clock.fixed(NOW, ZoneOffset.UTC));

    BridgeQuote quote =
        generator.generateQuote(SOL_SOLANA, SOL_STARKNET, "1.5", new BridgeOptions(null, null, STARKNET_ADDRESS, null));

    ArgumentCaptor<ObjectNode> request = ArgumentCaptor.forClass(ObjectNode.class);
    verify(client).quote(request.capture());
    assertEquals("1500000000", request.getValue().path("amount").asText());
    assertEquals("solana", request.getValue().path("fromChain").asText());
    assertEquals("starknet", request.getValue().path("toChain").asText());
    assertEquals(STARKNET_ADDRESS, request.getValue().path("recipient").asText());
    assertEquals("sg-1", quote.providerQuoteRef());
    assertEquals("Lock1111", quote.depositAddress());
    assertEquals("1.497", quote.toAmount());
    assertEquals("0.003", quote.feeAmount());
    assertEquals(0, new BigDecimal("0.2").compareTo(quote.feePercentage()));
    assertEquals("4-8 minutes", quote.estimatedTime());
  }

  @Test
  void quoteWithoutDepositAddressIsRejected() throws Exception {
    when(client.quote(any())).thenReturn(mapper.readTree("{\"quoteId\":\"sg-1\",\"amountOut\":\"1\"}"));
    StarkGateQuoteGenerator generator =
        new StarkGateQuoteGenerator(client, BridgeFixtures.properties(), Clock.fixed(NOW, ZoneOffset.UTC));

    BridgeException e =
        assertThrows(BridgeException.class, () -> generator.generateQuote(SOL_SOLANA, SOL_STARKNET, "1", null));
    assertEquals(BridgeErrorCode.QUOTE_REJECTED, e.getCode());
  }

  @Test
  void processRelaysThenExecutesOnDestination() {
    when(client.relay("provider-ref-1", "lock-tx")).thenReturn("relay-9");
    when(client.executeOnDestination("relay-9")).thenReturn("0xstarktx");
    StarkGateExecutor executor = new StarkGateExecutor(client);
    BridgeQuote quote =
        BridgeFixtures.quote(executor.provider(), NOW.plusSeconds(60), SOL_SOLANA, SOL_STARKNET);
    BridgeExecution execution = new BridgeExecution(quote, executor.totalSteps());
    StepTracker tracker = new StepTracker(execution, null);
    tracker.step("Validating bridge parameters");
    tracker.step(executor.depositStepDescription(quote));

    String monitorRef =
        executor.process(quote, "lock-tx", ExecutionContext.of("from", new PresignedDepositSubmitter("lock-tx")), tracker);
    tracker.step(executor.monitorStepDescription(quote));

    assertEquals("relay-9", monitorRef);
    assertEquals("0xstarktx", tracker.stagedCompletion());
    assertNull(execution.getCompletionTransactionRef());
    assertEquals(5, execution.getCurrentStep());
    assertEquals(
        List.of(
            "Validating bridge parameters",
            "Locking 1.5 SOL on Solana via StarkGate",
            "Relaying to StarkNet",
            "Executing on StarkNet",
            "Confirming completion on StarkNet"),
        execution.getSteps());
  }

  @Test
  void statusVocabulary() throws Exception {
    ProviderStatus done =
        StarkGateExecutor.toStatus(mapper.readTree("{\"status\":\"COMPLETED\",\"transactionHash\":\"0xabc\"}"));
    assertEquals(ProviderStatus.State.COMPLETED, done.state());
    assertEquals("0xabc", done.completionTransactionRef());

    ProviderStatus failed = StarkGateExecutor.toStatus(mapper.readTree("{\"status\":\"failed\",\"message\":\"reverted\"}"));
    assertEquals(ProviderStatus.State.FAILED, failed.state());
    assertEquals("reverted", failed.message());

    ProviderStatus pending = StarkGateExecutor.toStatus(mapper.readTree("{}"));
    assertEquals(ProviderStatus.State.PENDING, pending.state());
    assertNull(pending.completionTransactionRef());
  }
}
