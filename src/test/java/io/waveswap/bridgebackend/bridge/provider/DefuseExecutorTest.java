package io.waveswap.bridgebackend.bridge.provider;

import static io.waveswap.bridgebackend.bridge.BridgeFixtures.NOW;
import static io.waveswap.bridgebackend.bridge.BridgeFixtures.SOLANA_ADDRESS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.waveswap.bridgebackend.bridge.BridgeFixtures;
import io.waveswap.bridgebackend.bridge.ExecutionContext;
import io.waveswap.bridgebackend.bridge.PresignedDepositSubmitter;
import io.waveswap.bridgebackend.bridge.StepTracker;
import io.waveswap.bridgebackend.client.SolverRelayClient;
import io.waveswap.bridgebackend.model.bridge.BridgeExecution;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import org.junit.jupiter.api.Test;

class DefuseExecutorTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void monitorsIntentHashOrFallsBackToQuoteHash() {
    SolverRelayClient client = mock(SolverRelayClient.class);
    DefuseExecutor executor = new DefuseExecutor(client);
    BridgeQuote quote = BridgeFixtures.quote(ProviderId.DEFUSE, NOW.plusSeconds(60));
    ExecutionContext context = ExecutionContext.of(SOLANA_ADDRESS, new PresignedDepositSubmitter("tx"));

    when(client.publishIntent("provider-ref-1", "tx", SOLANA_ADDRESS)).thenReturn("intent-1");
    StepTracker tracker = new StepTracker(new BridgeExecution(quote, executor.totalSteps()), null);
    assertEquals("intent-1", executor.process(quote, "tx", context, tracker));

    when(client.publishIntent("provider-ref-1", "tx", SOLANA_ADDRESS)).thenReturn("");
    tracker = new StepTracker(new BridgeExecution(quote, executor.totalSteps()), null);
    assertEquals("provider-ref-1", executor.process(quote, "tx", context, tracker));
    assertEquals("Publishing intent to solver relay", tracker.execution().getSteps().get(0));
  }

  @Test
  void statusVocabulary() throws Exception {
    ProviderStatus settled =
        DefuseExecutor.toStatus(mapper.readTree("{\"status\":\"SETTLED\",\"data\":{\"hash\":\"near-hash\"}}"));
    assertEquals(ProviderStatus.State.COMPLETED, settled.state());
    assertEquals("near-hash", settled.completionTransactionRef());
    assertEquals(
        ProviderStatus.State.FAILED,
        DefuseExecutor.toStatus(mapper.readTree("{\"status\":\"NOT_FOUND_OR_NOT_VALID\"}")).state());
    assertEquals(
        ProviderStatus.State.PENDING, DefuseExecutor.toStatus(mapper.readTree("{\"status\":\"TX_BROADCASTED\"}")).state());
    assertEquals(ProviderStatus.State.PENDING, DefuseExecutor.toStatus(null).state());
  }
}
