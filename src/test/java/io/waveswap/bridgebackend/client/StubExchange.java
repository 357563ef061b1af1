package io.waveswap.bridgebackend.client;

import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Scripted responses for provider clients; the last response repeats once the script runs out. */
final class StubExchange implements ExchangeFunction {
  private record Scripted(HttpStatus status, String json) {}

  private final List<Scripted> script = new ArrayList<>();
  private final List<ClientRequest> requests = new ArrayList<>();

  StubExchange respond(HttpStatus status, String json) {
    script.add(new Scripted(status, json));
    return this;
  }

  @Override
  public Mono<ClientResponse> exchange(ClientRequest request) {
    requests.add(request);
    Scripted next = script.get(Math.min(requests.size(), script.size()) - 1);
    return Mono.just(
        ClientResponse.create(next.status())
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(next.json())
            .build());
  }

  List<ClientRequest> requests() {
    return requests;
  }

  WebClient webClient() {
    return WebClient.builder().exchangeFunction(this).build();
  }
}
