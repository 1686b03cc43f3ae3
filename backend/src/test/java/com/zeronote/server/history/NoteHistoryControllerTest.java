package com.zeronote.server.history;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import com.zeronote.error.ValidationFailureException;
import com.zeronote.model.NoteVersion;
import com.zeronote.server.ServerFixtures;
import com.zeronote.server.account.AccountService;
import com.zeronote.server.sync.SyncService;
import com.zeronote.sync.PushOutcome;
import com.zeronote.sync.PushStatus;
import com.zeronote.server.web.NotFoundException;

import static org.mockito.Mockito.when;

@WebFluxTest(NoteHistoryController.class)
class NoteHistoryControllerTest {

    private static final String BEARER = "Bearer token-123";

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private NoteHistoryService historyService;

    @MockitoBean
    private SyncService syncService;

    @MockitoBean
    private AccountService accountService;

    @BeforeEach
    void signedIn() {
        when(accountService.requireUser(BEARER)).thenReturn(Mono.just("ada"));
    }

    private NoteVersion buildVersion(String id, long syncVersion) {
        return new NoteVersion(id, "n1", ServerFixtures.blob("title"), ServerFixtures.blob("body"),
                ServerFixtures.wrapped((byte) 1), "dek-1", "epoch-1", 64, syncVersion, syncVersion * 1_000);
    }

    @Test
    void list_defaultsToFullRetention() {
        when(historyService.list("ada", "n1", NoteVersion.CAPACITY))
                .thenReturn(Flux.just(buildVersion("v2", 2), buildVersion("v1", 1)));

        webTestClient.get().uri("/api/notes/n1/versions")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.length()").isEqualTo(2)
                .jsonPath("$[0].id").isEqualTo("v2")
                .jsonPath("$[0].encryptedContent.type").isEqualTo("encrypted");
    }

    @Test
    void list_limitAboveRetentionShouldReturn400() {
        when(historyService.list("ada", "n1", 51))
                .thenReturn(Flux.error(new ValidationFailureException("Limit must be between 1 and 50")));

        webTestClient.get().uri("/api/notes/n1/versions?limit=51")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("Limit must be between 1 and 50");
    }

    @Test
    void get_unknownVersionShouldReturn404() {
        when(historyService.get("ada", "n1", "missing"))
                .thenReturn(Mono.error(new NotFoundException("Unknown version: missing")));

        webTestClient.get().uri("/api/notes/n1/versions/missing")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void get_shouldReturnTheVersion() {
        when(historyService.get("ada", "n1", "v7")).thenReturn(Mono.just(buildVersion("v7", 7)));

        webTestClient.get().uri("/api/notes/n1/versions/v7")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.syncVersion").isEqualTo(7)
                .jsonPath("$.encryptedDek.type").isEqualTo("wrapped");
    }

    @Test
    void restore_shouldReturnTheNewWrite() {
        when(syncService.restore("ada", "n1", "v7"))
                .thenReturn(Mono.just(PushOutcome.applied("n1", PushStatus.UPDATED, 9, 41)));

        webTestClient.post().uri("/api/notes/n1/versions/v7/restore")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("UPDATED")
                .jsonPath("$.syncVersion").isEqualTo(9);
    }

    @Test
    void restore_underAnotherDekShouldReturn409() {
        when(syncService.restore("ada", "n1", "v1"))
                .thenReturn(Mono.error(new IllegalStateException("Version v1 was encrypted under a key the note no longer uses")));

        webTestClient.post().uri("/api/notes/n1/versions/v1/restore")
                .header(HttpHeaders.AUTHORIZATION, BEARER)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.error").isEqualTo("Version v1 was encrypted under a key the note no longer uses");
    }
}
