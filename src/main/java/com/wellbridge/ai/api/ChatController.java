package com.wellbridge.ai.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/chat")
public class ChatController {

  private static final Logger log = LoggerFactory.getLogger(ChatController.class);

  private final ChatTurnService turnService;
  private final Executor turnWorkerPool;
  private final ObjectMapper mapper;

  public ChatController(
      ChatTurnService turnService,
      @Qualifier("turnWorkerPool") Executor turnWorkerPool,
      ObjectMapper mapper) {
    this.turnService = turnService;
    this.turnWorkerPool = turnWorkerPool;
    this.mapper = mapper;
  }

  /**
   * Streams one turn as SSE. The turn runs on the worker pool and is not cancelled when the
   * client disconnects, so both history writes still happen.
   */
  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<String> chatStream(@AuthenticationPrincipal Jwt jwt, @RequestBody ChatRequest req) {
    if (req == null || !StringUtils.hasText(req.message())) {
      throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "Message cannot be empty.");
    }
    if (!StringUtils.hasText(req.sessionId())) {
      throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "Session id is required.");
    }
    TenantContext tenant = TenantContextResolver.resolve(jwt);

    Map<String, String> mdc = MDC.getCopyOfContextMap();
    CompletableFuture<TurnResponse> turn;
    try {
      turn = CompletableFuture.supplyAsync(() -> {
        if (mdc != null) {
          MDC.setContextMap(mdc);
        }
        try {
          return turnService.handle(tenant, req.sessionId(), req.message());
        } finally {
          MDC.clear();
        }
      }, turnWorkerPool);
    } catch (RejectedExecutionException e) {
      log.warn("Turn worker pool saturated, rejecting session={}", req.sessionId());
      throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Too many concurrent turns, retry shortly.", e);
    }

    return Mono.fromFuture(turn, true)
        .flatMapMany(response -> Flux.fromIterable(StreamEvent.sequence(response)))
        .onErrorResume(e -> {
          log.error("Turn failed session={}", req.sessionId(), e);
          return Flux.just(StreamEvent.error());
        })
        .map(this::encode);
  }

  private String encode(StreamEvent event) {
    try {
      return mapper.writeValueAsString(event);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to encode stream event " + event.type(), e);
    }
  }
}
