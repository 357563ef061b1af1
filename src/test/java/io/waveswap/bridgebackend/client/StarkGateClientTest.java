package io.waveswap.bridgebackend.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.waveswap.bridgebackend.bridge.BridgeErrorCode;
import io.waveswap.bridgebackend.bridge.BridgeException;
import io.waveswap.bridgebackend.bridge.BridgeFixtures;
import io.waveswap.bridgebackend.bridge.BridgeProperties;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class StarkGateClientTest {

  private static StarkGateClient client(StubExchange exchange) {
    BridgeProperties properties = BridgeFixtures.properties();
    properties.getStarkgate().setApiBaseUrl("https://starkgate.test");
    return new StarkGateClient(exchange.webClient(), properties);
  }

  @Test
  void relayAndExecuteReturnTheirReferences() {
    StubExchange exchange =
        new StubExchange()
            .respond(HttpStatus.OK, "{\"relayId\":\"relay-1\"}")
            .respond(HttpStatus.OK, "{\"transactionHash\":\"0xabc\"}");
    StarkGateClient client = client(exchange);

    assertEquals("relay-1", client.relay("sg-1", "lock-tx"));
    assertEquals("0xabc", client.executeOnDestination("relay-1"));
    assertEquals("https://starkgate.test/v1/relay", exchange.requests().get(0).url().toString());
    assertEquals("https://starkgate.test/v1/execute", exchange.requests().get(1).url().toString());
  }

  @Test
  void relayWithoutIdIsSettlementFailure() {
    StubExchange exchange = new StubExchange().respond(HttpStatus.OK, "{}");

    BridgeException e = assertThrows(BridgeException.class, () -> client(exchange).relay("sg-1", "lock-tx"));

    assertEquals(BridgeErrorCode.SETTLEMENT_FAILED, e.getCode());
  }

  @Test
  void statusPathCarriesRelayId() {
    StubExchange exchange = new StubExchange().respond(HttpStatus.OK, "{\"status\":\"pending\"}");

    assertEquals("pending", client(exchange).status("relay-1").path("status").asText());
    assertEquals("https://starkgate.test/v1/status/relay-1", exchange.requests().get(0).url().toString());
  }

  @Test
  void unconfiguredBaseUrlIsProviderUnavailable() {
    BridgeProperties properties = BridgeFixtures.properties();
    properties.getStarkgate().setApiBaseUrl(" ");
    StarkGateClient client = new StarkGateClient(new StubExchange().webClient(), properties);

    BridgeException e = assertThrows(BridgeException.class, () -> client.status("relay-1"));
    assertEquals(BridgeErrorCode.QUOTE_PROVIDER_UNAVAILABLE, e.getCode());
  }
}
