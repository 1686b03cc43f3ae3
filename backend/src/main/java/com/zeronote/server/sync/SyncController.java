package com.zeronote.server.sync;

import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.zeronote.server.account.AccountService;
import com.zeronote.sync.Heartbeat;
import com.zeronote.sync.PullResponse;
import com.zeronote.sync.PushRequest;
import com.zeronote.sync.PushResponse;
import com.zeronote.sync.SyncHint;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/sync")
public class SyncController {

    private static final String AUTHORIZATION = "Authorization";

    private final SyncService syncService;
    private final AccountService accountService;

    public SyncController(SyncService syncService, AccountService accountService) {
        this.syncService = syncService;
        this.accountService = accountService;
    }

    @GetMapping("/pull")
    public Mono<PullResponse> pull(@RequestHeader(value = AUTHORIZATION, required = false) String token,
                                   @RequestParam(defaultValue = "0") long since) {
        return accountService.requireUser(token)
                .flatMap(owner -> syncService.pull(owner, since));
    }

    @PostMapping("/push")
    public Mono<PushResponse> push(@RequestHeader(value = AUTHORIZATION, required = false) String token,
                                   @RequestBody PushRequest request) {
        return accountService.requireUser(token)
                .flatMap(owner -> syncService.push(owner, request));
    }

    @PostMapping("/heartbeat")
    public Mono<Heartbeat> heartbeat(@RequestHeader(value = AUTHORIZATION, required = false) String token) {
        return accountService.requireUser(token)
                .flatMap(syncService::heartbeat);
    }

    /** Wake-up hints only. Devices still pull to learn what changed. */
    @GetMapping(path = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<SyncHint>> events(@RequestHeader(value = AUTHORIZATION, required = false) String token) {
        return accountService.requireUser(token)
                .flatMapMany(syncService::hints)
                .map(hint -> ServerSentEvent.builder(hint).event("sync").build());
    }
}
