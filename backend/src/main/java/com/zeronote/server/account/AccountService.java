package com.zeronote.server.account;

import java.io.UncheckedIOException;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.cassandra.core.InsertOptions;
import org.springframework.data.cassandra.core.ReactiveCassandraOperations;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.account.AccountKeys;
import com.zeronote.crypto.Digests;
import com.zeronote.error.ValidationFailureException;
import com.zeronote.server.config.ZeroNoteProperties;
import com.zeronote.server.sync.KeyEpochSource;
import com.zeronote.server.web.NotFoundException;
import com.zeronote.server.web.UnauthorizedException;

import reactor.core.publisher.Mono;

/**
 * Zero-Knowledge Account Service.
 *
 * Login philosophy:
 *   - The client derives its login hash from the master key with HKDF; the password and the
 *     keys that open notes never leave the device.
 *   - We store SHA-256 of that login hash and compare in constant time.
 *   - On success we hand back the key bundle; the client unlocks it locally.
 *
 * Recovery works the same way with the recovery phrase hash standing in for the login hash.
 * The phrase itself is fixed for the life of the account, so every key bundle the server
 * accepts must carry the hash it was registered with.
 */
@Service
public class AccountService implements KeyEpochSource {

    private static final Logger log = LoggerFactory.getLogger(AccountService.class);

    private static final String BEARER = "Bearer ";
    private static final int MIN_SALT_BYTES = 16;

    private final AccountRepository accountRepository;
    private final ReactiveCassandraOperations operations;
    private final ObjectMapper objectMapper;
    private final ZeroNoteProperties properties;

    // token -> username. In-memory: restarting the server signs every device out.
    private final ConcurrentHashMap<String, String> activeSessions = new ConcurrentHashMap<>();

    public AccountService(AccountRepository accountRepository, ReactiveCassandraOperations operations,
                          ObjectMapper objectMapper, ZeroNoteProperties properties) {
        this.accountRepository = accountRepository;
        this.operations = operations;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /** Inserts with IF NOT EXISTS, so two sign-ups racing for one username cannot both win. */
    public Mono<Void> signUp(SignUpRequest request) {
        return Mono.fromCallable(() -> newAccount(request))
                .flatMap(account -> operations.insert(account, InsertOptions.builder().withIfNotExists().build())
                        .flatMap(result -> result.wasApplied()
                                ? Mono.just(account)
                                : Mono.<UserAccount>error(
                                        new IllegalStateException("Username already taken: " + account.username))))
                .doOnNext(saved -> log.info("Registered account {}", saved.username))
                .then();
    }

    public Mono<PreloginResponse> prelogin(String username) {
        return accountRepository.findById(username)
                .switchIfEmpty(Mono.error(new NotFoundException("Unknown account: " + username)))
                .map(account -> {
                    AccountKeys keys = readKeys(account);
                    return new PreloginResponse(keys.salt(), keys.iterations());
                });
    }

    public Mono<AuthResponse> login(String username, String providedHash) {
        return accountRepository.findById(username)
                .switchIfEmpty(Mono.error(new UnauthorizedException("Invalid credentials")))
                .flatMap(account -> {
                    if (providedHash == null || !Digests.constantTimeEquals(account.loginHash, Digests.sha256Hex(providedHash))) {
                        log.info("Failed login for {}", username);
                        return Mono.error(new UnauthorizedException("Invalid credentials"));
                    }
                    return Mono.just(openSession(account));
                });
    }

    public Mono<Void> logout(String authorization) {
        return Mono.fromRunnable(() -> {
            if (authorization != null) {
                activeSessions.remove(stripBearer(authorization));
            }
        });
    }

    /** Resolves a bearer header to its username, or fails with {@link UnauthorizedException}. */
    public Mono<String> requireUser(String authorization) {
        return Mono.defer(() -> {
            if (authorization == null || authorization.isBlank()) {
                return Mono.error(new UnauthorizedException("Missing bearer token"));
            }
            String username = activeSessions.get(stripBearer(authorization));
            return username == null
                    ? Mono.error(new UnauthorizedException("Session expired"))
                    : Mono.just(username);
        });
    }

    /** The bundle as stored, so a device that changed nothing can learn of a password change made elsewhere. */
    public Mono<AccountKeys> currentKeys(String authorization) {
        return requireUser(authorization)
                .flatMap(username -> accountRepository.findById(username))
                .switchIfEmpty(Mono.error(new UnauthorizedException("Session expired")))
                .map(this::readKeys);
    }

    @Override
    public Mono<String> keyEpoch(String owner) {
        return accountRepository.findById(owner)
                .filter(account -> account.accountKeys != null)
                .map(account -> readKeys(account).keyEpoch());
    }

    /** Password change: the caller proves the current password and uploads the rewrapped bundle. */
    public Mono<Void> updateKeys(String authorization, KeyUpdateRequest request) {
        return requireUser(authorization)
                .flatMap(username -> accountRepository.findById(username))
                .switchIfEmpty(Mono.error(new UnauthorizedException("Session expired")))
                .flatMap(account -> {
                    if (request.currentLoginHash == null
                            || !Digests.constantTimeEquals(account.loginHash, Digests.sha256Hex(request.currentLoginHash))) {
                        return Mono.error(new UnauthorizedException("Invalid credentials"));
                    }
                    replaceCredentials(account, request.newLoginHash, request.accountKeys);
                    return accountRepository.save(account);
                })
                .doOnNext(saved -> log.info("Replaced key bundle for {}", saved.username))
                .then();
    }

    /** Hands the key bundle to whoever holds the recovery phrase, so they can unwrap the master key. */
    public Mono<AccountKeys> recoverKeys(RecoveryRequest request) {
        return findForRecovery(request.username, request.recoveryKeyHash)
                .map(this::readKeys);
    }

    /** Completes recovery: sets a new password and signs out every existing session. */
    public Mono<AuthResponse> resetWithRecovery(RecoveryResetRequest request) {
        return findForRecovery(request.username, request.recoveryKeyHash)
                .flatMap(account -> {
                    replaceCredentials(account, request.newLoginHash, request.accountKeys);
                    return accountRepository.save(account);
                })
                .map(saved -> {
                    activeSessions.values().removeIf(saved.username::equals);
                    log.info("Reset password for {} with the recovery phrase", saved.username);
                    return openSession(saved);
                });
    }

    private Mono<UserAccount> findForRecovery(String username, String recoveryKeyHash) {
        return accountRepository.findById(username == null ? "" : username)
                .filter(account -> Digests.constantTimeEquals(account.recoveryKeyHash, recoveryKeyHash))
                .switchIfEmpty(Mono.defer(() -> {
                    log.info("Failed recovery attempt for {}", username);
                    return Mono.error(new UnauthorizedException("Invalid recovery phrase"));
                }));
    }

    private UserAccount newAccount(SignUpRequest request) {
        if (request.username == null || request.username.isBlank()) {
            throw new ValidationFailureException("Username is required");
        }
        UserAccount account = new UserAccount();
        account.username = request.username;
        account.recoveryKeyHash = request.accountKeys == null ? null : request.accountKeys.recoveryKeyHash();
        replaceCredentials(account, request.loginHash, request.accountKeys);
        account.createdAt = System.currentTimeMillis();
        return account;
    }

    private void replaceCredentials(UserAccount account, String loginHash, AccountKeys keys) {
        if (loginHash == null || loginHash.isBlank()) {
            throw new ValidationFailureException("Login hash is required");
        }
        checkKeys(keys);
        if (!Digests.constantTimeEquals(account.recoveryKeyHash, keys.recoveryKeyHash())) {
            throw new ValidationFailureException("Key bundle belongs to a different recovery phrase");
        }
        account.loginHash = Digests.sha256Hex(loginHash);
        account.accountKeys = writeKeys(keys);
    }

    private void checkKeys(AccountKeys keys) {
        if (keys == null || keys.salt() == null || keys.keyCheck() == null
                || keys.masterKeyRecoveryWrap() == null || keys.recoveryKekWrap() == null
                || keys.recoveryKeyHash() == null || keys.recoveryKeyHash().isBlank()) {
            throw new ValidationFailureException("Incomplete key bundle");
        }
        if (keys.retiredKeys().stream().anyMatch(retired -> retired.keyEpoch() == null || retired.masterKeyWrap() == null)) {
            throw new ValidationFailureException("Incomplete retired key");
        }
        if (keys.salt().length < MIN_SALT_BYTES) {
            throw new ValidationFailureException("Password salt is too short");
        }
        if (keys.iterations() < properties.crypto().minIterations()) {
            throw new ValidationFailureException(
                    "Key derivation needs at least " + properties.crypto().minIterations() + " iterations");
        }
    }

    private AuthResponse openSession(UserAccount account) {
        String token = UUID.randomUUID().toString();
        activeSessions.put(token, account.username);

        AuthResponse response = new AuthResponse();
        response.token = token;
        response.accountKeys = readKeys(account);
        return response;
    }

    private AccountKeys readKeys(UserAccount account) {
        try {
            return objectMapper.readValue(account.accountKeys, AccountKeys.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Stored key bundle for " + account.username + " is unreadable", e);
        }
    }

    private String writeKeys(AccountKeys keys) {
        try {
            return objectMapper.writeValueAsString(keys);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String stripBearer(String authorization) {
        return authorization.replace(BEARER, "");
    }
}
