package io.waveswap.bridgebackend.bridge.provider;

import com.fasterxml.jackson.databind.JsonNode;
import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.bridge.BridgeProperties;
import io.waveswap.bridgebackend.client.SolverRelayClient;
import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.ProviderId;
import io.waveswap.bridgebackend.model.bridge.Route;
import io.waveswap.bridgebackend.util.BridgeTokenCatalog;
import io.waveswap.bridgebackend.util.TokenAmounts;
import java.math.BigInteger;
import java.time.Clock;
import org.springframework.stereotype.Component;

/**
 * Best solver offer from the relay, less the protocol fee. Deposits go to the verifier contract, so the
 * quote's deposit address is that contract's account.
 */
@Component
public class DefuseQuoteGenerator extends AbstractQuoteGenerator {
  private final SolverRelayClient client;

  public DefuseQuoteGenerator(SolverRelayClient client, BridgeProperties properties, Clock clock) {
    super(properties, clock);
    this.client = client;
  }

  @Override
  public ProviderId provider() {
    return ProviderId.DEFUSE;
  }

  @Override
  protected ProviderQuote requestQuote(Route route, BigInteger amountBaseUnits, BridgeOptions options) {
    JsonNode offers =
        client.quote(
            BridgeTokenCatalog.assetIdFor(route.originToken()),
            BridgeTokenCatalog.assetIdFor(route.destinationToken()),
            amountBaseUnits.toString(),
            options.deadlineSeconds() * 1000L);

    JsonNode best = null;
    BigInteger bestOut = BigInteger.ZERO;
    for (JsonNode offer : offers) {
      BigInteger out = TokenAmounts.parseBaseUnits(offer.path("amount_out").asText(null));
      if (out.compareTo(bestOut) > 0 && !offer.path("quote_hash").asText("").isBlank()) {
        best = offer;
        bestOut = out;
      }
    }
    if (best == null) {
      throw new BridgeException(
          BridgeErrorCode.INSUFFICIENT_LIQUIDITY, "no solver offered a positive amount for " + route.originToken().symbol());
    }

    int feeBps = properties.getDefuse().getFeeBps();
    BigInteger amountOut = bestOut.subtract(TokenAmounts.basisPointsOf(bestOut, feeBps));
    return new ProviderQuote(
        best.path("quote_hash").asText(),
        amountOut,
        TokenAmounts.basisPointsOf(amountBaseUnits, feeBps),
        TokenAmounts.bpsToPercent(feeBps),
        properties.getDefuse().getVerifierContract());
  }
}
