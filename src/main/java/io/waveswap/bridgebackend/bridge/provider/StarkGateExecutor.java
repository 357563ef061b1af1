package io.waveswap.bridgebackend.bridge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.waveswap.bridgebackend.bridge.BridgeExecutor;
import io.waveswap.bridgebackend.bridge.ExecutionContext;
import io.waveswap.bridgebackend.bridge.StepTracker;
import io.waveswap.bridgebackend.client.StarkGateClient;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Lock on the origin chain, relay the lock proof, execute on the destination chain, then confirm.
 * The destination execution already yields the completion transaction; it is recorded once monitoring
 * confirms it.
 */
@Component
public class StarkGateExecutor implements BridgeExecutor {
  private final StarkGateClient client;

  public StarkGateExecutor(StarkGateClient client) {
    this.client = client;
  }

  @Override
  public ProviderId provider() {
    return ProviderId.STARKGATE;
  }

  @Override
  public int totalSteps() {
    return 5;
  }

  @Override
  public String depositStepDescription(BridgeQuote quote) {
    return "Locking " + quote.fromAmount() + " " + quote.originToken().symbol() + " on " + display(quote.depositChain())
        + " via StarkGate";
  }

  @Override
  public String process(BridgeQuote quote, String depositTransactionRef, ExecutionContext context, StepTracker tracker) {
    String destination = display(quote.destinationChain());
    tracker.step("Relaying to " + destination);
    String relayId = client.relay(quote.providerQuoteRef(), depositTransactionRef);
    tracker.step("Executing on " + destination);
    tracker.stageCompletion(client.executeOnDestination(relayId));
    return relayId;
  }

  @Override
  public String monitorStepDescription(BridgeQuote quote) {
    return "Confirming completion on " + display(quote.destinationChain());
  }

  @Override
  public ProviderStatus queryStatus(String relayId) {
    return toStatus(client.status(relayId));
  }

  static ProviderStatus toStatus(JsonNode root) {
    String raw = root.path("status").asText("").toLowerCase(Locale.ROOT);
    return switch (raw) {
      case "completed" -> ProviderStatus.completed(raw, blankToNull(root.path("transactionHash").asText("")));
      case "failed" -> ProviderStatus.failed(raw, root.path("message").asText("StarkGate relay failed"));
      default -> ProviderStatus.pending(raw);
    };
  }

  private static String display(ChainId chain) {
    return switch (chain) {
      case SOLANA -> "Solana";
      case STARKNET -> "StarkNet";
      case NEAR -> "NEAR";
      case ZCASH -> "Zcash";
    };
  }

  private static String blankToNull(String v) {
    return v == null || v.isBlank() ? null : v;
  }
}
