package com.libragraph.checkpoint.core.service;

import com.libragraph.checkpoint.core.checkout.ReplacedFileList;
import com.libragraph.checkpoint.core.checkpoint.BookMetadata;
import com.libragraph.checkpoint.core.checkpoint.Checkpoint;
import com.libragraph.checkpoint.core.checkpoint.CheckpointId;
import com.libragraph.checkpoint.core.checkpoint.CheckpointSummary;
import com.libragraph.checkpoint.core.checkpoint.WorkingTree;
import com.libragraph.checkpoint.core.compare.DiffResult;
import com.libragraph.checkpoint.core.concurrent.CancellationToken;
import com.libragraph.checkpoint.core.repository.BookIdentity;
import com.libragraph.checkpoint.core.repository.RepositoryId;
import com.libragraph.checkpoint.core.repository.RepositoryManager;
import com.libragraph.checkpoint.core.repository.RepositorySummary;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Asynchronous facade for editor code. Every operation touches the filesystem,
 * so each one runs on the default worker pool; the caller's thread only
 * subscribes.
 */
@ApplicationScoped
public class CheckpointService {

    @Inject
    RepositoryManager repositoryManager;

    /**
     * Snapshots {@code tree} into the repository of {@code book}.
     */
    public Uni<CheckpointId> save(BookIdentity book, WorkingTree tree, String description,
                                  BookMetadata metadata, CancellationToken cancellation) {
        return blocking(() -> repositoryManager.openOrCreate(book)
                .writeCheckpoint(tree, description, metadata, cancellation));
    }

    public Multi<CheckpointSummary> checkpoints(BookIdentity book) {
        return Multi.createFrom().deferred(() -> repositoryManager.openOrCreate(book).log().list())
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    public Uni<Checkpoint> checkpoint(BookIdentity book, CheckpointId id) {
        return blocking(() -> repositoryManager.openOrCreate(book).log().get(id));
    }

    /**
     * Compares the current working tree with checkpoint {@code id}.
     */
    public Uni<DiffResult> compare(BookIdentity book, WorkingTree tree, CheckpointId id) {
        return blocking(() -> repositoryManager.openOrCreate(book).compare(tree.snapshot(), id));
    }

    public Uni<DiffResult> compareLatest(BookIdentity book, WorkingTree tree) {
        return blocking(() -> repositoryManager.openOrCreate(book).compareLatest(tree.snapshot()));
    }

    /**
     * Replaces {@code tree} with checkpoint {@code id}. Callers confirm with the user first.
     */
    public Uni<ReplacedFileList> restore(BookIdentity book, CheckpointId id, WorkingTree tree,
                                         CancellationToken cancellation) {
        return blocking(() -> repositoryManager.openOrCreate(book).checkout(id, tree, cancellation));
    }

    public Multi<RepositorySummary> repositories() {
        return repositoryManager.list()
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    public Uni<Boolean> remove(RepositoryId id) {
        return blocking(() -> repositoryManager.remove(id));
    }

    public Uni<Integer> remove(Collection<RepositoryId> ids) {
        return blocking(() -> repositoryManager.remove(ids));
    }

    public Uni<Integer> removeAll() {
        return blocking(repositoryManager::removeAll);
    }

    private static <T> Uni<T> blocking(Supplier<T> work) {
        return Uni.createFrom().item(work)
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }
}
