package com.zeronote;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.account.AccountKeyStore;
import com.zeronote.account.AccountKeyring;
import com.zeronote.account.AccountKeys;
import com.zeronote.account.JsonFileAccountKeyStore;
import com.zeronote.account.KeyDirectory;
import com.zeronote.account.KeySession;
import com.zeronote.account.PasswordRotation;
import com.zeronote.account.Registration;
import com.zeronote.account.Rekey;
import com.zeronote.crypto.AesGcm;
import com.zeronote.crypto.KeyDerivation;
import com.zeronote.crypto.KeyWrap;
import com.zeronote.error.AuthenticationFailureException;
import com.zeronote.error.SessionExpiredException;
import com.zeronote.error.TransportFailureException;
import com.zeronote.error.ValidationFailureException;
import com.zeronote.json.ZeroNoteJson;
import com.zeronote.model.Folder;
import com.zeronote.model.Note;
import com.zeronote.notebook.NotebookService;
import com.zeronote.protection.LockoutPolicy;
import com.zeronote.protection.SecondaryPassword;
import com.zeronote.recovery.RecoveryPhrases;
import com.zeronote.store.JsonFileLocalStore;
import com.zeronote.store.LocalStore;
import com.zeronote.sync.DebouncedFlush;
import com.zeronote.sync.JsonFileSyncConfigStore;
import com.zeronote.sync.SyncAdapter;
import com.zeronote.sync.SyncConfig;
import com.zeronote.sync.SyncConfigStore;
import com.zeronote.sync.SyncEngine;
import com.zeronote.sync.SyncHintListener;
import com.zeronote.sync.SyncScheduler;
import com.zeronote.sync.SyncTarget;
import com.zeronote.sync.adapter.AccountClient;
import com.zeronote.sync.adapter.NoteHistoryClient;
import com.zeronote.sync.adapter.SyncAdapters;

import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * One device's wiring, rooted at a data directory:
 *
 * <pre>
 *   notes.json, folders.json   local stores
 *   sync-config.json           {@link SyncConfig}, including the server token
 *   account-keys.json          the account's key bundle as last seen by this device
 * </pre>
 *
 * When the config names a sync target, edits schedule a debounced push, a periodic cycle runs
 * every {@code intervalMinutes}, and server hints trigger extra cycles.
 *
 * <p>The key bundle also lives on the remote. Unlocking prefers the remote copy, so a password
 * changed on another device takes effect here at the next unlock; every password change or
 * recovery made here is published before any entity is rewrapped.
 */
public class ZeroNoteDevice implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ZeroNoteDevice.class);

    public static final Duration DEFAULT_QUIET_PERIOD = Duration.ofSeconds(2);

    private final AccountKeyring keyring;
    private final RecoveryPhrases recoveryPhrases;
    private final NotebookService notebook;
    private final SyncConfigStore configStore;
    private final AccountKeyStore keyStore;
    private final KeyDirectory directory;
    private final NoteHistoryClient history;
    private final SyncEngine engine;
    private final SyncScheduler scheduler;
    private final DebouncedFlush flush;
    private final SyncHintListener hintListener;

    private volatile KeySession session;

    public ZeroNoteDevice(Path dataDir) {
        this(dataDir, new KeyDerivation(), DEFAULT_QUIET_PERIOD, Schedulers.parallel(), Clock.systemUTC());
    }

    public ZeroNoteDevice(Path dataDir, KeyDerivation keyDerivation, Duration quietPeriod, Scheduler timer,
                          Clock clock) {
        ObjectMapper mapper = ZeroNoteJson.newMapper();
        AesGcm aesGcm = new AesGcm();
        KeyWrap keyWrap = new KeyWrap();

        LocalStore<Note> notes = new JsonFileLocalStore<>(dataDir.resolve("notes.json"), Note.class, mapper);
        LocalStore<Folder> folders = new JsonFileLocalStore<>(dataDir.resolve("folders.json"), Folder.class, mapper);
        this.configStore = new JsonFileSyncConfigStore(dataDir.resolve("sync-config.json"), mapper);
        this.keyStore = new JsonFileAccountKeyStore(dataDir.resolve("account-keys.json"), mapper);

        this.recoveryPhrases = new RecoveryPhrases(keyDerivation);
        this.keyring = new AccountKeyring(keyDerivation, aesGcm, keyWrap, recoveryPhrases);
        this.notebook = new NotebookService(notes, folders, keyring, new PasswordRotation(aesGcm, keyWrap),
                new SecondaryPassword(keyDerivation, aesGcm, keyWrap), new LockoutPolicy(clock), keyWrap, clock);

        SyncConfig config = configStore.load();
        if (config.target() == SyncTarget.NONE) {
            this.directory = null;
            this.history = null;
            this.engine = null;
            this.scheduler = null;
            this.flush = null;
            this.hintListener = null;
            return;
        }
        Supplier<String> token = () -> configStore.load().credentials();
        Consumer<String> tokenSink = issued -> configStore.save(configStore.load().withCredentials(issued));
        SyncAdapter adapter = SyncAdapters.create(config, mapper, token);
        this.directory = SyncAdapters.keyDirectory(config, adapter, mapper, token, tokenSink).orElse(null);
        this.history = SyncAdapters.history(config, mapper, token).orElse(null);
        this.engine = new SyncEngine(adapter, notes, folders, configStore);
        this.engine.setKeyEpochListener(this::remoteKeyEpoch);
        this.scheduler = config.intervalMinutes() > 0 ? SyncScheduler.forConfig(engine, config, timer) : null;
        this.flush = new DebouncedFlush(quietPeriod, timer, engine::synchronize);
        this.hintListener = new SyncHintListener(adapter, engine);
        notebook.setChangeListener(flush::markDirty);
        log.info("Device {} syncing with {}", config.deviceId(), adapter.name());
    }

    public void start() {
        if (scheduler != null) {
            scheduler.start();
        }
        if (hintListener != null) {
            hintListener.start();
        }
    }

    /**
     * Creates a new account on this device and, when syncing, on the remote. The returned
     * recovery key is the only copy; the session stays open on the device.
     */
    public Registration register(String password) {
        Registration registration = keyring.register(password);
        try {
            if (directory != null) {
                directory.register(registration).block();
            }
        } catch (RuntimeException e) {
            registration.session().close();
            throw e;
        }
        keyStore.save(registration.keys());
        adopt(registration.session());
        return registration;
    }

    /**
     * Opens the account with the newest key bundle available, then moves any entity still under
     * a retired key onto it.
     *
     * @throws AuthenticationFailureException if the password does not open the bundle
     */
    public KeySession unlock(String password) {
        return open(password, latestKeys());
    }

    /**
     * Signs in to the configured server account, which also hands this device the key bundle,
     * then unlocks it. For a fresh device that has never seen the account.
     */
    public KeySession signIn(String password) {
        AccountClient client = accountClient();
        AccountClient.Prelogin prelogin = client.prelogin().block();
        AccountKeys keys = client.login(keyring.loginHash(password, prelogin.salt(), prelogin.iterations())).block();
        log.info("Signed in to the server as {}", client.username());
        return open(password, keys);
    }

    /**
     * Rekeys the account under {@code newPassword}. The new bundle is published first; if the
     * remote refuses it (another device changed the password meanwhile) nothing local changes.
     */
    public KeySession changePassword(String oldPassword, String newPassword) {
        return apply(keyring.changePassword(oldPassword, newPassword, latestKeys()));
    }

    /** Same as {@link #changePassword} but proven with the recovery phrase instead of the old password. */
    public KeySession recover(List<String> recoveryWords, String newPassword) {
        AccountKeys keys = directory instanceof AccountClient client
                ? client.recoveryKeys(recoveryPhrases.hash(recoveryWords)).block()
                : latestKeys();
        return apply(keyring.recover(recoveryWords, newPassword, keys));
    }

    /** The open account session. */
    public KeySession session() {
        KeySession current = session;
        if (current == null || current.isClosed()) {
            throw new SessionExpiredException("Device is locked");
        }
        return current;
    }

    public Optional<AccountKeys> accountKeys() {
        return keyStore.load();
    }

    /** Closes the account session; notes stay on disk, encrypted. */
    public void lock() {
        adopt(null);
    }

    public AccountKeyring keyring() {
        return keyring;
    }

    public NotebookService notebook() {
        return notebook;
    }

    public SyncConfig syncConfig() {
        return configStore.load();
    }

    public Optional<SyncEngine> syncEngine() {
        return Optional.ofNullable(engine);
    }

    /** Retained note versions, when this device syncs with a server. */
    public Optional<NoteHistoryClient> noteHistory() {
        return Optional.ofNullable(history);
    }

    @Override
    public void close() {
        if (scheduler != null) {
            scheduler.close();
        }
        if (hintListener != null) {
            hintListener.close();
        }
        if (flush != null) {
            flush.close();
        }
        lock();
    }

    private KeySession open(String password, AccountKeys keys) {
        KeySession unlocked = keyring.unlock(password, keys);
        keyStore.save(keys);
        notebook.rewrapRetired(unlocked, keys);
        adopt(unlocked);
        return unlocked;
    }

    private KeySession apply(Rekey rekey) {
        try {
            if (directory != null) {
                directory.publish(rekey).block();
            }
        } catch (RuntimeException e) {
            rekey.previous().close();
            rekey.current().close();
            throw e;
        }
        keyStore.save(rekey.keys());
        notebook.applyRekey(rekey);
        adopt(rekey.current());
        return rekey.current();
    }

    // The remote's copy wins; the local one covers an unreachable remote.
    private AccountKeys latestKeys() {
        Optional<AccountKeys> remote = directory == null
                ? Optional.empty()
                : directory.fetch()
                        .onErrorResume(e -> e instanceof TransportFailureException
                                || e instanceof AuthenticationFailureException, e -> {
                            log.warn("Key bundle not fetched from the remote, using the local copy: {}", e.getMessage());
                            return Mono.empty();
                        })
                        .blockOptional();
        return remote.or(keyStore::load)
                .orElseThrow(() -> new ValidationFailureException("No account on this device"));
    }

    private AccountClient accountClient() {
        if (directory instanceof AccountClient client) {
            return client;
        }
        throw new ValidationFailureException("Sign-in needs a server sync target with an account name");
    }

    private void adopt(KeySession next) {
        KeySession previous = session;
        session = next;
        if (previous != null && previous != next && !previous.isClosed()) {
            previous.close();
        }
    }

    // Runs inside a sync cycle, after the pull is merged and before dirty entities are pushed.
    private void remoteKeyEpoch(String remoteEpoch) {
        KeySession current = session;
        if (current == null || current.isClosed()) {
            return;
        }
        if (remoteEpoch.equals(current.keyEpoch())) {
            keyStore.load().ifPresent(keys -> notebook.rewrapRetired(current, keys));
        } else {
            log.warn("Account keys changed on another device (epoch {}); edits stay local until the next unlock",
                    remoteEpoch);
        }
    }
}
