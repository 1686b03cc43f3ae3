package com.zeronote.sync.adapter;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.error.AuthenticationFailureException;
import com.zeronote.error.TransportFailureException;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.sync.Heartbeat;
import com.zeronote.sync.PullResponse;
import com.zeronote.sync.PushRequest;
import com.zeronote.sync.PushResponse;
import com.zeronote.sync.SyncAdapter;
import com.zeronote.sync.SyncHint;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

/**
 * Talks to the ZeroNote server over HTTP. Only ciphertext and metadata cross the wire.
 *
 * <p>A 401 or 403 surfaces as {@link AuthenticationFailureException}; every other failure,
 * including an unreachable host, as {@link TransportFailureException}.
 */
public class RemoteSyncAdapter implements SyncAdapter {

    private static final Logger log = LoggerFactory.getLogger(RemoteSyncAdapter.class);

    static final String PULL = "/api/sync/pull";
    static final String PUSH = "/api/sync/push";
    static final String HEARTBEAT = "/api/sync/heartbeat";
    static final String EVENTS = "/api/sync/events";

    private final WebClient webClient;

    public RemoteSyncAdapter(WebClient webClient) {
        this.webClient = webClient;
    }

    public static RemoteSyncAdapter create(String baseUrl, String token, ObjectMapper mapper) {
        return create(baseUrl, () -> token, mapper);
    }

    /** The token is read on every request, so a sign-in after construction takes effect at once. */
    public static RemoteSyncAdapter create(String baseUrl, Supplier<String> token, ObjectMapper mapper) {
        return new RemoteSyncAdapter(builder(mapper)
                .baseUrl(baseUrl)
                .filter(bearer(token))
                .build());
    }

    /** Adds the current bearer token, when there is one, to each request. */
    public static ExchangeFilterFunction bearer(Supplier<String> token) {
        return (request, next) -> {
            String current = token.get();
            if (current == null || current.isBlank()) {
                return next.exchange(request);
            }
            return next.exchange(ClientRequest.from(request)
                    .headers(headers -> headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + current))
                    .build());
        };
    }

    /** WebClient builder wired with the shared JSON settings. */
    public static WebClient.Builder builder(ObjectMapper mapper) {
        return WebClient.builder().codecs(codecs -> {
            codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper, MediaType.APPLICATION_JSON));
            codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper, MediaType.APPLICATION_JSON));
            codecs.defaultCodecs().maxInMemorySize(16 * 1024 * 1024);
        });
    }

    @Override
    public String name() {
        return "server";
    }

    @Override
    public Mono<Boolean> testConnection() {
        return webClient.post()
                .uri(HEARTBEAT)
                .retrieve()
                .onStatus(HttpStatusCode::isError, RemoteSyncAdapter::toFailure)
                .bodyToMono(Heartbeat.class)
                .map(heartbeat -> true)
                .onErrorResume(e -> {
                    log.debug("Server connection test failed: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<PullResponse> pullChanges(long sinceVersion) {
        return webClient.get()
                .uri(uri -> uri.path(PULL).queryParam("since", sinceVersion).build())
                .retrieve()
                .onStatus(HttpStatusCode::isError, RemoteSyncAdapter::toFailure)
                .bodyToMono(PullResponse.class)
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable);
    }

    @Override
    public Mono<PushResponse> pushChanges(String deviceId, List<Note> notes, List<Folder> folders) {
        return webClient.post()
                .uri(PUSH)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new PushRequest(deviceId, notes, folders))
                .retrieve()
                .onStatus(HttpStatusCode::isError, RemoteSyncAdapter::toFailure)
                .bodyToMono(PushResponse.class)
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable);
    }

    /** Server-sent hints; reconnects with backoff when the stream drops. */
    @Override
    public Flux<SyncHint> hints() {
        return webClient.get()
                .uri(EVENTS)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .retrieve()
                .onStatus(HttpStatusCode::isError, RemoteSyncAdapter::toFailure)
                .bodyToFlux(new ParameterizedTypeReference<ServerSentEvent<SyncHint>>() {})
                .filter(event -> event.data() != null)
                .map(ServerSentEvent::data)
                .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofSeconds(1))
                        .maxBackoff(Duration.ofMinutes(1))
                        .filter(e -> !(e instanceof AuthenticationFailureException)));
    }

    static Mono<? extends Throwable> toFailure(ClientResponse response) {
        HttpStatusCode status = response.statusCode();
        if (status.value() == HttpStatus.UNAUTHORIZED.value() || status.value() == HttpStatus.FORBIDDEN.value()) {
            return response.releaseBody()
                    .then(Mono.just(new AuthenticationFailureException("Server rejected credentials (" + status.value() + ")")));
        }
        return response.releaseBody()
                .then(Mono.just(new TransportFailureException("Server answered " + status.value())));
    }

    static Throwable unreachable(WebClientRequestException e) {
        return new TransportFailureException("Server unreachable: " + e.getMessage(), e);
    }
}
