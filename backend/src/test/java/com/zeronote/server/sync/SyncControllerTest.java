package com.zeronote.server.sync;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.EntityType;
import com.zeronote.model.Note;
import com.zeronote.server.ServerFixtures;
import com.zeronote.server.account.AccountService;
import com.zeronote.server.web.UnauthorizedException;
import com.zeronote.sync.EntityPushResult;
import com.zeronote.sync.Heartbeat;
import com.zeronote.sync.PullResponse;
import com.zeronote.sync.PushOutcome;
import com.zeronote.sync.PushRequest;
import com.zeronote.sync.PushResponse;
import com.zeronote.sync.PushStatus;
import com.zeronote.sync.SyncHint;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@WebFluxTest(SyncController.class)
class SyncControllerTest {

    private static final String BEARER = "Bearer token-123";

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private SyncService syncService;

    @MockitoBean
    private AccountService accountService;

    @BeforeEach
    void signedIn() {
        when(accountService.requireUser(BEARER)).thenReturn(Mono.just("ada"));
        when(accountService.requireUser(isNull()))
                .thenReturn(Mono.error(new UnauthorizedException("Missing bearer token")));
    }

    // ── GET /api/sync/pull ────────────────────────────────────────────────────

    @Test
    void pull_withoutTokenShouldReturn401() {
        webTestClient.get().uri("/api/sync/pull?since=0")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Missing bearer token");

        verifyNoInteractions(syncService);
    }

    @Test
    void pull_shouldReturnChangesAndCursor() {
        Note note = ServerFixtures.note("n1", "hello", 3, 1_000);
        when(syncService.pull("ada", 5L)).thenReturn(Mono.just(new PullResponse(List.of(note), List.of(), 9, null)));

        webTestClient.get().uri("/api/sync/pull?since=5")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.currentSyncVersion").isEqualTo(9)
                .jsonPath("$.notes[0].id").isEqualTo("n1")
                .jsonPath("$.notes[0].encryptedDEK.type").isEqualTo("wrapped")
                .jsonPath("$.folders").isEmpty();
    }

    @Test
    void pull_nonNumericCursorShouldReturn400() {
        webTestClient.get().uri("/api/sync/pull?since=yesterday")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isBadRequest();
    }

    // ── POST /api/sync/push ───────────────────────────────────────────────────

    @Test
    void push_shouldReturnPerEntityOutcomes() {
        PushResponse response = new PushResponse(
                EntityPushResult.of(List.of(PushOutcome.<Note>applied("n1", PushStatus.CREATED, 1, 1))),
                EntityPushResult.empty());
        when(syncService.push(eq("ada"), any(PushRequest.class))).thenReturn(Mono.just(response));

        webTestClient.post().uri("/api/sync/push")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new PushRequest("laptop", List.of(ServerFixtures.note("n1", "hello", 0, 1_000)), List.of()))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.notes.created").isEqualTo(1)
                .jsonPath("$.notes.outcomes[0].status").isEqualTo("CREATED")
                .jsonPath("$.notes.outcomes[0].syncVersion").isEqualTo(1)
                .jsonPath("$.folders.created").isEqualTo(0);
    }

    @Test
    void push_oversizedBatchShouldReturn400() {
        when(syncService.push(eq("ada"), any(PushRequest.class)))
                .thenReturn(Mono.error(new ValidationFailureException("Push of 900 entities exceeds the limit of 500")));

        webTestClient.post().uri("/api/sync/push")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new PushRequest("laptop", List.of(), List.of()))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400);
    }

    // ── Heartbeat and events ──────────────────────────────────────────────────

    @Test
    void heartbeat_shouldReportServerSequence() {
        when(syncService.heartbeat("ada")).thenReturn(Mono.just(new Heartbeat(123L, 42L)));

        webTestClient.post().uri("/api/sync/heartbeat")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.serverTime").isEqualTo(123)
                .jsonPath("$.currentSyncVersion").isEqualTo(42);
    }

    @Test
    void events_shouldStreamHints() {
        when(syncService.hints("ada")).thenReturn(Flux.just(
                new SyncHint(EntityType.FOLDER, "f1", 1),
                new SyncHint(EntityType.NOTE, "n1", 4)));

        Flux<SyncHint> hints = webTestClient.get().uri("/api/sync/events")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(SyncHint.class)
                .getResponseBody();

        StepVerifier.create(hints)
                .expectNext(new SyncHint(EntityType.FOLDER, "f1", 1))
                .expectNext(new SyncHint(EntityType.NOTE, "n1", 4))
                .verifyComplete();
    }
}
