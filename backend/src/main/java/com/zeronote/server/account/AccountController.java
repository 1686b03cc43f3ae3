package com.zeronote.server.account;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import com.zeronote.account.AccountKeys;

import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/account")
public class AccountController {

    private final AccountService accountService;

    public AccountController(AccountService accountService) {
        this.accountService = accountService;
    }

    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<Void> signUp(@RequestBody SignUpRequest request) {
        return accountService.signUp(request);
    }

    /** KDF parameters only; the client needs them to compute the login hash. */
    @GetMapping("/{username}/prelogin")
    public Mono<PreloginResponse> prelogin(@PathVariable String username) {
        return accountService.prelogin(username);
    }

    @PostMapping("/login")
    public Mono<AuthResponse> login(@RequestBody LoginRequest login) {
        return accountService.login(login.username, login.loginHash);
    }

    @PostMapping("/logout")
    public Mono<Void> logout(@RequestHeader(value = "Authorization", required = false) String token) {
        return accountService.logout(token);
    }

    @GetMapping("/keys")
    public Mono<AccountKeys> keys(@RequestHeader(value = "Authorization", required = false) String token) {
        return accountService.currentKeys(token);
    }

    @PutMapping("/keys")
    public Mono<Void> updateKeys(@RequestHeader(value = "Authorization", required = false) String token,
                                 @RequestBody KeyUpdateRequest request) {
        return accountService.updateKeys(token, request);
    }

    @PostMapping("/recovery")
    public Mono<AccountKeys> recover(@RequestBody RecoveryRequest request) {
        return accountService.recoverKeys(request);
    }

    @PostMapping("/recovery/reset")
    public Mono<AuthResponse> resetWithRecovery(@RequestBody RecoveryResetRequest request) {
        return accountService.resetWithRecovery(request);
    }
}
