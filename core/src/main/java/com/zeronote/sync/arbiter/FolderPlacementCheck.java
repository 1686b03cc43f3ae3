package com.zeronote.sync.arbiter;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import reactor.core.publisher.Mono;

import com.zeronote.model.Folder;
import com.zeronote.protection.FolderTree;

/**
 * Rejects a pushed folder that would nest deeper than {@link FolderTree#MAX_DEPTH} or sit inside
 * its own subtree. A parent the ledger does not know yet is treated as a root, so batch order
 * does not matter.
 */
public class FolderPlacementCheck implements PlacementCheck<Folder> {

    private final EntityLedger<Folder> ledger;

    public FolderPlacementCheck(EntityLedger<Folder> ledger) {
        this.ledger = ledger;
    }

    @Override
    public Mono<Void> check(Folder folder) {
        if (folder.isDeleted()) {
            return Mono.empty();
        }
        return ledger.changedSince(0)
                .filter(stored -> !stored.getId().equals(folder.getId()))
                .collectList()
                .flatMap(stored -> Mono.fromRunnable(() -> {
                    List<Folder> candidate = Stream.concat(stored.stream(), Stream.of(folder))
                            .collect(Collectors.toList());
                    FolderTree tree = FolderTree.of(candidate);
                    String parentId = tree.contains(folder.getParentId()) ? folder.getParentId() : null;
                    tree.checkPlacement(folder.getId(), parentId);
                }));
    }
}
