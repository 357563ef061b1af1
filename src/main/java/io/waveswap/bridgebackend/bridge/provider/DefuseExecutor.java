package io.waveswap.bridgebackend.bridge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.waveswap.bridgebackend.bridge.BridgeExecutor;
import io.waveswap.bridgebackend.bridge.ExecutionContext;
import io.waveswap.bridgebackend.bridge.StepTracker;
import io.waveswap.bridgebackend.client.SolverRelayClient;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import org.springframework.stereotype.Component;

@Component
public class DefuseExecutor implements BridgeExecutor {
  private final SolverRelayClient client;

  public DefuseExecutor(SolverRelayClient client) {
    this.client = client;
  }

  @Override
  public ProviderId provider() {
    return ProviderId.DEFUSE;
  }

  @Override
  public int totalSteps() {
    return 4;
  }

  @Override
  public String depositStepDescription(BridgeQuote quote) {
    return "Depositing " + quote.fromAmount() + " " + quote.originToken().symbol() + " to " + quote.depositAddress();
  }

  /** Publishes the intent; the intent hash (or the quote hash when the relay echoes none) is polled. */
  @Override
  public String process(BridgeQuote quote, String depositTransactionRef, ExecutionContext context, StepTracker tracker) {
    tracker.step("Publishing intent to solver relay");
    String intentHash = client.publishIntent(quote.providerQuoteRef(), depositTransactionRef, context.fromAddress());
    return intentHash == null || intentHash.isBlank() ? quote.providerQuoteRef() : intentHash;
  }

  @Override
  public String monitorStepDescription(BridgeQuote quote) {
    return "Monitoring intent execution";
  }

  @Override
  public ProviderStatus queryStatus(String intentHash) {
    return toStatus(client.getStatus(intentHash));
  }

  static ProviderStatus toStatus(JsonNode result) {
    String raw = result == null ? "" : result.path("status").asText("");
    return switch (raw) {
      case "SETTLED" -> {
        String hash = result.path("data").path("hash").asText("");
        yield ProviderStatus.completed(raw, hash.isBlank() ? null : hash);
      }
      case "NOT_FOUND_OR_NOT_VALID" -> ProviderStatus.failed(raw, "intent not found or no longer valid");
      default -> ProviderStatus.pending(raw);
    };
  }
}
