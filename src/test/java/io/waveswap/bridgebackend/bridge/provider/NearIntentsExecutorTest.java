package io.waveswap.bridgebackend.bridge.provider;

import static io.waveswap.bridgebackend.bridge.BridgeFixtures.NOW;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.waveswap.bridgebackend.bridge.BridgeFixtures;
import io.waveswap.bridgebackend.bridge.ExecutionContext;
import io.waveswap.bridgebackend.bridge.PresignedDepositSubmitter;
import io.waveswap.bridgebackend.bridge.StepTracker;
import io.waveswap.bridgebackend.client.NearIntentsClient;
import io.waveswap.bridgebackend.model.bridge.BridgeExecution;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import org.junit.jupiter.api.Test;

class NearIntentsExecutorTest {
  private final ObjectMapper mapper = new ObjectMapper();

  @Test
  void submitsDepositAndMonitorsByDepositAddress() {
    NearIntentsClient client = mock(NearIntentsClient.class);
    NearIntentsExecutor executor = new NearIntentsExecutor(client);
    BridgeQuote quote = BridgeFixtures.quote(ProviderId.NEAR_INTENTS, NOW.plusSeconds(60));
    BridgeExecution execution = new BridgeExecution(quote, executor.totalSteps());
    StepTracker tracker = new StepTracker(execution, null);

    String ref =
        executor.process(quote, "sol-tx", ExecutionContext.of("from", new PresignedDepositSubmitter("sol-tx")), tracker);

    verify(client).submitDeposit("sol-tx", "deposit-target-1");
    assertEquals("deposit-target-1", ref);
    assertEquals(1, execution.getCurrentStep());
    assertEquals("Submitting deposit to NEAR Intents", execution.getSteps().get(0));
  }

  @Test
  void statusVocabulary() throws Exception {
    ProviderStatus success =
        NearIntentsExecutor.toStatus(
            mapper.readTree(
                "{\"status\":\"SUCCESS\",\"swapDetails\":{\"destinationChainTxHashes\":[{\"hash\":\"near-tx\"}]}}"));
    assertEquals(ProviderStatus.State.COMPLETED, success.state());
    assertEquals("near-tx", success.completionTransactionRef());

    assertEquals(ProviderStatus.State.FAILED, NearIntentsExecutor.toStatus(mapper.readTree("{\"status\":\"REFUNDED\"}")).state());
    assertEquals(ProviderStatus.State.FAILED, NearIntentsExecutor.toStatus(mapper.readTree("{\"status\":\"FAILED\"}")).state());
    for (String pending : new String[] {"PENDING_DEPOSIT", "KNOWN_DEPOSIT_TX", "PROCESSING", "INCOMPLETE_DEPOSIT"}) {
      assertEquals(
          ProviderStatus.State.PENDING,
          NearIntentsExecutor.toStatus(mapper.readTree("{\"status\":\"" + pending + "\"}")).state());
    }
    assertNull(NearIntentsExecutor.toStatus(mapper.readTree("{\"status\":\"SUCCESS\"}")).completionTransactionRef());
  }
}
