package com.zeronote.server.sync;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.UUID;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.testcontainers.junit.jupiter.Testcontainers;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import com.zeronote.ZeroNoteDevice;

import com.zeronote.account.AccountKeyring;
import com.zeronote.account.KeySession;
import com.zeronote.account.PasswordRotation;
import com.zeronote.account.Registration;
import com.zeronote.crypto.AesGcm;
import com.zeronote.crypto.KeyDerivation;
import com.zeronote.crypto.KeyWrap;
import com.zeronote.json.ZeroNoteJson;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.model.NoteVersion;
import com.zeronote.notebook.NoteView;
import com.zeronote.notebook.NotebookService;
import com.zeronote.protection.LockoutPolicy;
import com.zeronote.protection.SecondaryPassword;
import com.zeronote.recovery.RecoveryPhrases;
import com.zeronote.server.CassandraContainerInitializer;
import com.zeronote.server.ServerFixtures;
import com.zeronote.server.account.AuthResponse;
import com.zeronote.server.account.LoginRequest;
import com.zeronote.server.account.SignUpRequest;
import com.zeronote.server.history.NoteHistoryService;
import com.zeronote.store.InMemoryLocalStore;
import com.zeronote.sync.JsonFileSyncConfigStore;
import com.zeronote.sync.PullResponse;
import com.zeronote.sync.PushOutcome;
import com.zeronote.sync.PushResponse;
import com.zeronote.sync.SyncConfig;
import com.zeronote.sync.SyncResult;
import com.zeronote.sync.SyncTarget;
import com.zeronote.sync.adapter.NoteHistoryClient;
import com.zeronote.sync.adapter.RemoteSyncAdapter;
import com.zeronote.sync.arbiter.EntityLedger;
import com.zeronote.sync.arbiter.SequenceCounter;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the Cassandra ledger and the HTTP surface against a real Cassandra container.
 * Skipped when Docker is unavailable.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ContextConfiguration(initializers = CassandraContainerInitializer.class)
@Testcontainers(disabledWithoutDocker = true)
class ServerSyncIntegrationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private LedgerFactory ledgers;

    @Autowired
    private NoteHistoryService historyService;

    private final KeyDerivation keyDerivation = new KeyDerivation(ServerFixtures.MIN_ITERATIONS);
    private final AesGcm aesGcm = new AesGcm();
    private final KeyWrap keyWrap = new KeyWrap();
    private final AccountKeyring keyring =
            new AccountKeyring(keyDerivation, aesGcm, keyWrap, new RecoveryPhrases(keyDerivation));

    // ── Helpers ───────────────────────────────────────────────────────────────

    private static String freshOwner() {
        return "it-" + UUID.randomUUID();
    }

    private NotebookService buildNotebook(InMemoryLocalStore<Note> notes) {
        return new NotebookService(notes, new InMemoryLocalStore<Folder>(), keyring,
                new PasswordRotation(aesGcm, keyWrap), new SecondaryPassword(keyDerivation, aesGcm, keyWrap),
                new LockoutPolicy(Clock.systemUTC()), keyWrap, Clock.systemUTC());
    }

    private AuthResponse signUpAndLogin(String username, Registration registration) {
        SignUpRequest signUp = new SignUpRequest();
        signUp.username = username;
        signUp.loginHash = registration.loginHash();
        signUp.accountKeys = registration.keys();
        webTestClient.post().uri("/api/account/signup")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(signUp)
                .exchange()
                .expectStatus().isCreated();

        LoginRequest login = new LoginRequest();
        login.username = username;
        login.loginHash = registration.loginHash();
        return webTestClient.post().uri("/api/account/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(login)
                .exchange()
                .expectStatus().isOk()
                .expectBody(AuthResponse.class)
                .returnResult()
                .getResponseBody();
    }

    // ── Ledger ────────────────────────────────────────────────────────────────

    @Test
    void ledgerWritesAreCompareAndSet() {
        EntityLedger<Note> notes = ledgers.notes(freshOwner());
        Note first = ServerFixtures.note("n1", "v1", 1, 1_000);
        first.setChangeSeq(1);

        StepVerifier.create(notes.insertIfAbsent(first)).expectNext(true).verifyComplete();
        StepVerifier.create(notes.insertIfAbsent(first)).expectNext(false).verifyComplete();

        Note second = ServerFixtures.note("n1", "v2", 2, 2_000);
        second.setChangeSeq(2);
        StepVerifier.create(notes.replaceIfVersion(second, 5)).expectNext(false).verifyComplete();
        StepVerifier.create(notes.replaceIfVersion(second, 1)).expectNext(true).verifyComplete();

        StepVerifier.create(notes.find("n1"))
                .assertNext(stored -> {
                    assertEquals(2, stored.getSyncVersion());
                    assertEquals(ServerFixtures.blob("v2"), stored.getEncryptedContent());
                })
                .verifyComplete();
        StepVerifier.create(notes.changedSince(1)).expectNextCount(1).verifyComplete();
        StepVerifier.create(notes.changedSince(2)).verifyComplete();
    }

    @Test
    void sequenceStartsAtOneAndAdvances() {
        SequenceCounter sequence = ledgers.sequence(freshOwner());

        StepVerifier.create(sequence.current()).expectNext(0L).verifyComplete();
        StepVerifier.create(sequence.next()).expectNext(1L).verifyComplete();
        StepVerifier.create(sequence.next()).expectNext(2L).verifyComplete();
        StepVerifier.create(sequence.current()).expectNext(2L).verifyComplete();
    }

    // ── Device to device over HTTP ────────────────────────────────────────────

    @Test
    void noteWrittenOnOneDeviceDecryptsOnAnother() {
        String username = freshOwner();
        Registration registration = keyring.register("correct horse battery staple");
        AuthResponse auth = signUpAndLogin(username, registration);
        assertNotNull(auth);

        InMemoryLocalStore<Note> laptopNotes = new InMemoryLocalStore<>();
        NoteView written = buildNotebook(laptopNotes).createNote(registration.session(), "A", "hello", null);

        RemoteSyncAdapter remote = RemoteSyncAdapter.create("http://localhost:" + port, auth.token, ZeroNoteJson.newMapper());
        PushResponse pushed = remote.pushChanges("laptop", laptopNotes.getAll(), List.of()).block();
        assertNotNull(pushed);
        assertEquals(1, pushed.notes().created());

        PullResponse pulled = remote.pullChanges(0).block();
        assertNotNull(pulled);
        assertEquals(1, pulled.notes().size());
        assertEquals(registration.keys().keyEpoch(), pulled.keyEpoch());

        InMemoryLocalStore<Note> phoneNotes = new InMemoryLocalStore<>();
        phoneNotes.putAll(pulled.notes());
        KeySession phoneSession = keyring.unlock("correct horse battery staple", auth.accountKeys);
        NoteView read = buildNotebook(phoneNotes).readNote(phoneSession, written.id());

        assertEquals("A", read.title());
        assertEquals("hello", read.content());
        StepVerifier.create(historyService.list(username, written.id(), 50))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void passwordChangedOnOneDeviceReachesAnotherThroughTheServer(@TempDir Path dir) {
        String username = freshOwner();
        configure(dir.resolve("laptop"), "laptop", username);
        configure(dir.resolve("phone"), "phone", username);

        try (ZeroNoteDevice laptop = device(dir.resolve("laptop"));
             ZeroNoteDevice phone = device(dir.resolve("phone"))) {
            laptop.register("old password");
            NoteView before = laptop.notebook().createNote(laptop.session(), "A", "before", null);
            sync(laptop);
            KeySession stale = phone.signIn("old password");
            sync(phone);

            laptop.changePassword("old password", "new password");
            sync(laptop);

            NoteView late = phone.notebook().createNote(stale, "B", "written with the old keys", null);
            SyncResult refused = sync(phone);
            assertEquals(1, refused.stats().staleKeys(), "The server only takes entities under the current keys");

            phone.unlock("new password");
            sync(phone);
            sync(laptop);

            assertEquals("written with the old keys",
                    laptop.notebook().readNote(laptop.session(), late.id()).content());
            assertEquals("before", phone.notebook().readNote(phone.session(), before.id()).content());
        }
    }

    @Test
    void versionFromBeforeAPasswordChangeIsRestoredForEveryDevice(@TempDir Path dir) {
        String username = freshOwner();
        configure(dir.resolve("laptop"), "laptop", username);
        configure(dir.resolve("phone"), "phone", username);

        try (ZeroNoteDevice laptop = device(dir.resolve("laptop"));
             ZeroNoteDevice phone = device(dir.resolve("phone"))) {
            laptop.register("old password");
            NoteView note = laptop.notebook().createNote(laptop.session(), "Plan", "first draft", null);
            sync(laptop);
            laptop.notebook().updateNote(laptop.session(), note.id(), "Plan", "second draft", null);
            sync(laptop);
            laptop.changePassword("old password", "new password");
            sync(laptop);

            NoteHistoryClient history = laptop.noteHistory().orElseThrow();
            List<NoteVersion> versions = history.list(note.id(), NoteVersion.CAPACITY).block();
            NoteVersion firstDraft = versions.stream()
                    .filter(version -> version.syncVersion() == 1)
                    .findFirst()
                    .orElseThrow();
            assertNotEquals(laptop.accountKeys().orElseThrow().keyEpoch(), firstDraft.keyEpoch(),
                    "The version predates the password change");

            PushOutcome<Note> restored = history.restore(note.id(), firstDraft.id()).block();
            assertEquals(versions.get(0).syncVersion() + 1, restored.syncVersion());

            sync(laptop);
            assertEquals("first draft", laptop.notebook().readNote(laptop.session(), note.id()).content());
            phone.signIn("new password");
            sync(phone);
            assertEquals("first draft", phone.notebook().readNote(phone.session(), note.id()).content());
        }
    }

    private ZeroNoteDevice device(Path dataDir) {
        return new ZeroNoteDevice(dataDir, keyDerivation, Duration.ofSeconds(2), VirtualTimeScheduler.create(),
                Clock.systemUTC());
    }

    private void configure(Path dataDir, String deviceId, String username) {
        new JsonFileSyncConfigStore(dataDir.resolve("sync-config.json"), ZeroNoteJson.newMapper())
                .save(new SyncConfig(SyncTarget.SERVER, 0, deviceId, 0, "http://localhost:" + port, null, username));
    }

    private static SyncResult sync(ZeroNoteDevice device) {
        SyncResult result = device.syncEngine().orElseThrow().synchronize().block();
        assertNotNull(result);
        assertTrue(result.success(), () -> "Sync failed: " + result.error());
        return result;
    }
}
