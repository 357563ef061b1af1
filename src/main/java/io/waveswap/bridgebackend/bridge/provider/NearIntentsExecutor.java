package io.waveswap.bridgebackend.bridge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.waveswap.bridgebackend.bridge.BridgeExecutor;
import io.waveswap.bridgebackend.bridge.ExecutionContext;
import io.waveswap.bridgebackend.bridge.StepTracker;
import io.waveswap.bridgebackend.client.NearIntentsClient;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import java.util.Locale;
import org.springframework.stereotype.Component;

/** Deposit to the quote's deposit address, notify 1Click, then poll {@code /status} by deposit address. */
@Component
public class NearIntentsExecutor implements BridgeExecutor {
  private final NearIntentsClient client;

  public NearIntentsExecutor(NearIntentsClient client) {
    this.client = client;
  }

  @Override
  public ProviderId provider() {
    return ProviderId.NEAR_INTENTS;
  }

  @Override
  public int totalSteps() {
    return 4;
  }

  @Override
  public String depositStepDescription(BridgeQuote quote) {
    return "Depositing " + quote.fromAmount() + " " + quote.originToken().symbol() + " to NEAR Intents";
  }

  @Override
  public String process(BridgeQuote quote, String depositTransactionRef, ExecutionContext context, StepTracker tracker) {
    tracker.step("Submitting deposit to NEAR Intents");
    client.submitDeposit(depositTransactionRef, quote.depositAddress());
    return quote.depositAddress();
  }

  @Override
  public String monitorStepDescription(BridgeQuote quote) {
    return "Waiting for settlement on " + quote.destinationChain().key();
  }

  @Override
  public ProviderStatus queryStatus(String depositAddress) {
    return toStatus(client.status(depositAddress));
  }

  static ProviderStatus toStatus(JsonNode root) {
    String raw = root.path("status").asText("").toUpperCase(Locale.ROOT);
    return switch (raw) {
      case "SUCCESS" -> ProviderStatus.completed(raw, destinationTxHash(root));
      case "FAILED", "REFUNDED" ->
          ProviderStatus.failed(raw, root.path("message").asText("NEAR Intents reported " + raw));
      default -> ProviderStatus.pending(raw);
    };
  }

  private static String destinationTxHash(JsonNode root) {
    JsonNode hashes = root.path("swapDetails").path("destinationChainTxHashes");
    if (!hashes.isArray() || hashes.isEmpty()) return null;
    String hash = hashes.get(0).path("hash").asText("");
    return hash.isBlank() ? null : hash;
  }
}
