package io.waveswap.bridgebackend.bridge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.bridge.BridgeProperties;
import io.waveswap.bridgebackend.client.NearIntentsClient;
import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.Route;
import io.waveswap.bridgebackend.util.BridgeTokenCatalog;
import io.waveswap.bridgebackend.util.TokenAmounts;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

@Component
public class NearIntentsQuoteGenerator extends AbstractQuoteGenerator {
  private final NearIntentsClient client;

  public NearIntentsQuoteGenerator(NearIntentsClient client, BridgeProperties properties, Clock clock) {
    super(properties, clock);
    this.client = client;
  }

  @Override
  public ProviderId provider() {
    return ProviderId.NEAR_INTENTS;
  }

  @Override
  protected ProviderQuote requestQuote(Route route, BigInteger amountBaseUnits, BridgeOptions options) {
    if (options.recipientAddress() == null || options.refundAddress() == null) {
      throw new BridgeException(
          BridgeErrorCode.INVALID_ADDRESS_FORMAT, "NEAR Intents quotes need both recipientAddress and refundAddress");
    }
    ObjectNode req = client.newObject();
    req.put("dry", false);
    req.put("swapType", "EXACT_INPUT");
    req.put("slippageTolerance", options.slippageBps());
    req.put("originAsset", BridgeTokenCatalog.assetIdFor(route.originToken()));
    req.put("depositType", "ORIGIN_CHAIN");
    req.put("destinationAsset", BridgeTokenCatalog.assetIdFor(route.destinationToken()));
    req.put("amount", amountBaseUnits.toString());
    req.put("refundTo", options.refundAddress());
    req.put("refundType", "ORIGIN_CHAIN");
    req.put("recipient", options.recipientAddress());
    req.put("recipientType", "DESTINATION_CHAIN");
    req.put(
        "deadline",
        DateTimeFormatter.ISO_INSTANT.format(clock.instant().plusSeconds(options.deadlineSeconds())));

    JsonNode root = client.quote(req);
    JsonNode quote = root.path("quote");
    String depositAddress = quote.path("depositAddress").asText("");
    if (depositAddress.isBlank()) {
      throw new BridgeException(BridgeErrorCode.QUOTE_REJECTED, "NEAR Intents quote has no depositAddress");
    }
    BigInteger amountOut = TokenAmounts.parseBaseUnits(quote.path("amountOut").asText(null));

    BigDecimal feePercentage = feePercentage(quote);
    BigInteger fee =
        new BigDecimal(amountBaseUnits).multiply(feePercentage).movePointLeft(2).setScale(0, RoundingMode.DOWN).toBigInteger();
    String ref = root.path("correlationId").asText(depositAddress);
    return new ProviderQuote(ref, amountOut, fee, feePercentage, depositAddress);
  }

  /** Spread between the USD values in and out, as a percentage; zero when either is missing. */
  static BigDecimal feePercentage(JsonNode quote) {
    BigDecimal in = decimal(quote.path("amountInUsd").asText(""));
    BigDecimal out = decimal(quote.path("amountOutUsd").asText(""));
    if (in == null || out == null || in.signum() <= 0 || out.compareTo(in) >= 0) return BigDecimal.ZERO;
    return in.subtract(out).movePointRight(2).divide(in, 4, RoundingMode.HALF_UP).stripTrailingZeros();
  }

  private static BigDecimal decimal(String raw) {
    if (raw == null || raw.isBlank()) return null;
    try {
      return new BigDecimal(raw.trim());
    } catch (NumberFormatException e) {
      return null;
    }
  }
}
