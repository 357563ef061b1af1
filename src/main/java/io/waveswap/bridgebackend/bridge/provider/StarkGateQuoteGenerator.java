package io.waveswap.bridgebackend.bridge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.bridge.BridgeProperties;
import io.waveswap.bridgebackend.client.StarkGateClient;
import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.Route;
import io.waveswap.bridgebackend.util.TokenAmounts;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import org.springframework.stereotype.Component;

@Component
public class StarkGateQuoteGenerator extends AbstractQuoteGenerator {
  private final StarkGateClient client;

  public StarkGateQuoteGenerator(StarkGateClient client, BridgeProperties properties, Clock clock) {
    super(properties, clock);
    this.client = client;
  }

  @Override
  public ProviderId provider() {
    return ProviderId.STARKGATE;
  }

  @Override
  protected ProviderQuote requestQuote(Route route, BigInteger amountBaseUnits, BridgeOptions options) {
    ObjectNode req = client.newObject();
    req.put("fromChain", route.originChain().key());
    req.put("toChain", route.destinationChain().key());
    req.put("fromToken", route.originToken().address());
    req.put("toToken", route.destinationToken().address());
    req.put("amount", amountBaseUnits.toString());
    if (options.recipientAddress() != null) req.put("recipient", options.recipientAddress());

    JsonNode root = client.quote(req);
    String quoteId = root.path("quoteId").asText("");
    String depositAddress = root.path("depositAddress").asText("");
    if (quoteId.isBlank() || depositAddress.isBlank()) {
      throw new BridgeException(BridgeErrorCode.QUOTE_REJECTED, "StarkGate quote is missing quoteId or depositAddress");
    }
    BigInteger amountOut = TokenAmounts.parseBaseUnits(root.path("amountOut").asText(null));
    BigInteger fee = TokenAmounts.parseBaseUnits(root.path("bridgeFee").asText(null));
    BigDecimal feePercentage =
        fee.signum() == 0
            ? BigDecimal.ZERO
            : new BigDecimal(fee).movePointRight(2).divide(new BigDecimal(amountBaseUnits), 4, RoundingMode.HALF_UP).stripTrailingZeros();
    return new ProviderQuote(quoteId, amountOut, fee, feePercentage, depositAddress);
  }
}
