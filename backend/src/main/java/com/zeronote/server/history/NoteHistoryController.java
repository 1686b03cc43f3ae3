package com.zeronote.server.history;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.zeronote.model.Note;
import com.zeronote.model.NoteVersion;
import com.zeronote.server.account.AccountService;
import com.zeronote.server.sync.SyncService;
import com.zeronote.sync.PushOutcome;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/notes/{noteId}/versions")
public class NoteHistoryController {

    private final NoteHistoryService historyService;
    private final SyncService syncService;
    private final AccountService accountService;

    public NoteHistoryController(NoteHistoryService historyService, SyncService syncService,
                                 AccountService accountService) {
        this.historyService = historyService;
        this.syncService = syncService;
        this.accountService = accountService;
    }

    @GetMapping
    public Flux<NoteVersion> list(@RequestHeader(value = "Authorization", required = false) String token,
                                  @PathVariable String noteId,
                                  @RequestParam(defaultValue = "" + NoteVersion.CAPACITY) int limit) {
        return accountService.requireUser(token)
                .flatMapMany(owner -> historyService.list(owner, noteId, limit));
    }

    @GetMapping("/{versionId}")
    public Mono<NoteVersion> get(@RequestHeader(value = "Authorization", required = false) String token,
                                 @PathVariable String noteId,
                                 @PathVariable String versionId) {
        return accountService.requireUser(token)
                .flatMap(owner -> historyService.get(owner, noteId, versionId));
    }

    /** Restores the version as a new write; devices pick it up on their next pull. */
    @PostMapping("/{versionId}/restore")
    public Mono<PushOutcome<Note>> restore(@RequestHeader(value = "Authorization", required = false) String token,
                                           @PathVariable String noteId,
                                           @PathVariable String versionId) {
        return accountService.requireUser(token)
                .flatMap(owner -> syncService.restore(owner, noteId, versionId));
    }
}
