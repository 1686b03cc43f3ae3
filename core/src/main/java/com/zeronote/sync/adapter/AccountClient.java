package com.zeronote.sync.adapter;

import java.util.function.Consumer;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zeronote.account.AccountKeys;
import com.zeronote.account.KeyDirectory;
import com.zeronote.account.Registration;
import com.zeronote.account.Rekey;
import com.zeronote.error.ValidationFailureException;

import reactor.core.publisher.Mono;

/**
 * The server's account endpoints for one username. Only login verifiers and the opaque key
 * bundle are sent; the password and the recovery phrase stay on the device.
 *
 * <p>Every call that opens a server session hands the new token to {@code tokenSink}, which is
 * where the device keeps it for the sync adapter.
 */
public class AccountClient implements KeyDirectory {

    private static final Logger log = LoggerFactory.getLogger(AccountClient.class);

    static final String SIGNUP = "/api/account/signup";
    static final String PRELOGIN = "/api/account/{username}/prelogin";
    static final String LOGIN = "/api/account/login";
    static final String KEYS = "/api/account/keys";
    static final String RECOVERY = "/api/account/recovery";
    static final String RECOVERY_RESET = "/api/account/recovery/reset";

    private final WebClient webClient;
    private final String username;
    private final Consumer<String> tokenSink;

    public AccountClient(WebClient webClient, String username, Consumer<String> tokenSink) {
        if (username == null || username.isBlank()) {
            throw new ValidationFailureException("Server sync needs an account name");
        }
        this.webClient = webClient;
        this.username = username;
        this.tokenSink = tokenSink;
    }

    public static AccountClient create(String baseUrl, String username, Supplier<String> token,
                                       Consumer<String> tokenSink, ObjectMapper mapper) {
        return new AccountClient(RemoteSyncAdapter.builder(mapper)
                .baseUrl(baseUrl)
                .filter(RemoteSyncAdapter.bearer(token))
                .build(), username, tokenSink);
    }

    public String username() {
        return username;
    }

    /** KDF parameters needed to turn the password into a login verifier. */
    public Mono<Prelogin> prelogin() {
        return webClient.get()
                .uri(PRELOGIN, username)
                .retrieve()
                .onStatus(HttpStatusCode::isError, AccountClient::toFailure)
                .bodyToMono(Prelogin.class)
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable);
    }

    /** Opens a server session and returns the key bundle to unlock locally. */
    public Mono<AccountKeys> login(String loginHash) {
        return webClient.post()
                .uri(LOGIN)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new LoginBody(username, loginHash))
                .retrieve()
                .onStatus(HttpStatusCode::isError, AccountClient::toFailure)
                .bodyToMono(SessionReply.class)
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable)
                .map(this::adopt);
    }

    /** The key bundle, for a device that lost the password but holds the recovery phrase. */
    public Mono<AccountKeys> recoveryKeys(String recoveryKeyHash) {
        return webClient.post()
                .uri(RECOVERY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new RecoveryBody(username, recoveryKeyHash))
                .retrieve()
                .onStatus(HttpStatusCode::isError, AccountClient::toFailure)
                .bodyToMono(AccountKeys.class)
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable);
    }

    @Override
    public Mono<AccountKeys> fetch() {
        return webClient.get()
                .uri(KEYS)
                .retrieve()
                .onStatus(HttpStatusCode::isError, AccountClient::toFailure)
                .bodyToMono(AccountKeys.class)
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable);
    }

    /** Signs up, then logs in so the device holds a token straight away. */
    @Override
    public Mono<Void> register(Registration registration) {
        return webClient.post()
                .uri(SIGNUP)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new SignUpBody(username, registration.loginHash(), registration.keys()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, AccountClient::toFailure)
                .toBodilessEntity()
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable)
                .doOnNext(created -> log.info("Registered {} on the server", username))
                .then(login(registration.loginHash()))
                .then();
    }

    /**
     * A password change proves the old verifier with the current session; a recovery proves the
     * phrase hash and opens a fresh session. The server refuses the first if the account's
     * password already changed elsewhere.
     */
    @Override
    public Mono<Void> publish(Rekey rekey) {
        if (rekey.viaRecovery()) {
            return webClient.post()
                    .uri(RECOVERY_RESET)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new RecoveryResetBody(username, rekey.keys().recoveryKeyHash(), rekey.loginHash(),
                            rekey.keys()))
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, AccountClient::toFailure)
                    .bodyToMono(SessionReply.class)
                    .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable)
                    .map(this::adopt)
                    .then();
        }
        return webClient.put()
                .uri(KEYS)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new KeyUpdateBody(rekey.previousLoginHash(), rekey.loginHash(), rekey.keys()))
                .retrieve()
                .onStatus(HttpStatusCode::isError, AccountClient::toFailure)
                .toBodilessEntity()
                .onErrorMap(WebClientRequestException.class, RemoteSyncAdapter::unreachable)
                .doOnNext(updated -> log.info("Published key bundle epoch {} for {}", rekey.keys().keyEpoch(), username))
                .then();
    }

    private AccountKeys adopt(SessionReply reply) {
        tokenSink.accept(reply.token());
        return reply.accountKeys();
    }

    private static Mono<? extends Throwable> toFailure(ClientResponse response) {
        if (response.statusCode().value() == HttpStatus.CONFLICT.value()) {
            return response.releaseBody()
                    .then(Mono.just(new ValidationFailureException("Account name is already taken")));
        }
        return RemoteSyncAdapter.toFailure(response);
    }

    /** KDF parameters for the account password. */
    public record Prelogin(byte[] salt, int iterations) {
    }

    record SessionReply(String token, AccountKeys accountKeys) {
    }

    record LoginBody(String username, String loginHash) {
    }

    record SignUpBody(String username, String loginHash, AccountKeys accountKeys) {
    }

    record RecoveryBody(String username, String recoveryKeyHash) {
    }

    record RecoveryResetBody(String username, String recoveryKeyHash, String newLoginHash, AccountKeys accountKeys) {
    }

    record KeyUpdateBody(String currentLoginHash, String newLoginHash, AccountKeys accountKeys) {
    }
}
