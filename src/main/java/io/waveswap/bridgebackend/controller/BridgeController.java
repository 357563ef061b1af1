package io.waveswap.bridgebackend.controller;

import io.waveswap.bridgebackend.bridge.BridgeEngine;
import io.waveswap.bridgebackend.bridge.ExecutionContext;
import io.waveswap.bridgebackend.bridge.PresignedDepositSubmitter;
import io.waveswap.bridgebackend.bridge.dto.BridgeDtos;
import io.waveswap.bridgebackend.model.bridge.BridgeOptions;
import io.waveswap.bridgebackend.model.bridge.BridgeQuote;
import io.waveswap.bridgebackend.model.bridge.ChainId;
import io.waveswap.bridgebackend.model.bridge.CrossChainToken;
import io.waveswap.bridgebackend.model.bridge.ExecutionSnapshot;
import io.waveswap.bridgebackend.model.bridge.ProviderStatus;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@Validated
@RequestMapping(path = "/api/v1/bridge")
public class BridgeController {
  private final BridgeEngine engine;

  public BridgeController(BridgeEngine engine) {
    this.engine = engine;
  }

  @GetMapping(path = "/tokens", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<List<CrossChainToken>> tokens(@RequestParam(value = "chain", required = false) String chain) {
    return Mono.fromCallable(() -> engine.tokens(chain == null || chain.isBlank() ? null : engine.resolveChain(chain)));
  }

  @GetMapping(path = "/routes", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<BridgeDtos.RouteResponse> route(
      @RequestParam("originChain") String originChain,
      @RequestParam("originToken") String originToken,
      @RequestParam("destinationChain") String destinationChain,
      @RequestParam("destinationToken") String destinationToken) {
    return Mono.fromCallable(
        () ->
            engine.route(
                token(originChain, originToken), token(destinationChain, destinationToken)));
  }

  @GetMapping(path = "/address/validate", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<BridgeDtos.AddressValidationResponse> validateAddress(
      @RequestParam("chain") String chain, @RequestParam("address") String address) {
    return Mono.fromCallable(() -> engine.validateAddress(engine.resolveChain(chain), address));
  }

  @PostMapping(path = "/quote", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<BridgeQuote> quote(@Valid @RequestBody BridgeDtos.QuoteRequest request) {
    return Mono.fromCallable(
            () ->
                engine.quote(
                    token(request.originChain(), request.originToken()),
                    token(request.destinationChain(), request.destinationToken()),
                    request.amount(),
                    new BridgeOptions(
                        request.slippageBps(),
                        request.deadlineSeconds(),
                        request.recipientAddress(),
                        request.refundAddress())))
        .subscribeOn(Schedulers.boundedElastic());
  }

  @GetMapping(path = "/quote/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<BridgeQuote> storedQuote(@PathVariable("id") String id) {
    return Mono.fromCallable(() -> engine.requireQuote(id)).subscribeOn(Schedulers.boundedElastic());
  }

  /**
   * Runs the stored quote to a terminal state, streaming a snapshot after every change. The last event
   * is terminal; failures arrive as a FAILED snapshot, not as an HTTP error.
   */
  @PostMapping(path = "/execute", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<ExecutionSnapshot> execute(@Valid @RequestBody BridgeDtos.ExecuteRequest request) {
    return Mono.fromCallable(() -> engine.requireQuote(request.quoteId()))
        .subscribeOn(Schedulers.boundedElastic())
        .flatMapMany(
            quote ->
                Flux.<ExecutionSnapshot>create(
                        sink -> {
                          ExecutionContext context =
                              new ExecutionContext(
                                  request.fromAddress(),
                                  request.recipientAddress(),
                                  new PresignedDepositSubmitter(request.depositTransactionRef()),
                                  sink::next,
                                  null);
                          WorkerCancellation cancellation = new WorkerCancellation(Thread.currentThread());
                          sink.onCancel(cancellation::cancel);
                          try {
                            engine.execute(quote, context);
                            sink.complete();
                          } catch (RuntimeException e) {
                            sink.error(e);
                          } finally {
                            cancellation.finished();
                          }
                        })
                    .subscribeOn(Schedulers.boundedElastic()));
  }

  @GetMapping(path = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
  public Mono<ProviderStatus> status(
      @RequestParam("provider") String provider, @RequestParam("reference") String reference) {
    return Mono.fromCallable(() -> engine.status(engine.resolveProvider(provider), reference))
        .subscribeOn(Schedulers.boundedElastic());
  }

  private CrossChainToken token(String chain, String address) {
    ChainId chainId = engine.resolveChain(chain);
    return engine.resolveToken(chainId, address);
  }

  /**
   * Interrupts the thread running an execution when the subscriber goes away, which ends status
   * monitoring with MONITORING_CANCELLED. The deposit already made on chain is not affected.
   */
  private static final class WorkerCancellation {
    private final Thread worker;
    private boolean running = true;
    private boolean interrupted;

    WorkerCancellation(Thread worker) {
      this.worker = worker;
    }

    synchronized void cancel() {
      if (!running) return;
      interrupted = true;
      worker.interrupt();
    }

    /** Called on the worker thread; clears our interrupt before the thread returns to the pool. */
    synchronized void finished() {
      running = false;
      if (interrupted) Thread.interrupted();
    }
  }
}
