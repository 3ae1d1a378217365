package com.libragraph.checkpoint.core.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.checkpoint.core.concurrent.LockPolicy;
import com.libragraph.checkpoint.core.concurrent.RepositoryLock;
import com.libragraph.checkpoint.core.storage.DurableFiles;
import com.libragraph.checkpoint.core.storage.StorageException;
import io.smallrye.mutiny.Multi;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Owns the store root: one directory per repository, named by its {@link RepositoryId}.
 *
 * <p>Removal renames a repository directory to a hidden trash name before deleting
 * it, so a repository disappears from {@link #list()} in one step even if the
 * recursive delete is interrupted. Trash left by a crash is swept by
 * {@link #cleanTrash()}.
 */
@ApplicationScoped
public class RepositoryManager {

    private static final Logger log = Logger.getLogger(RepositoryManager.class);

    static final String TRASH_PREFIX = ".trash-";

    @ConfigProperty(name = "checkpoint.store.root", defaultValue = "${user.home}/.book-checkpoints")
    String storeRootPath;

    @ConfigProperty(name = "checkpoint.lock.max-attempts", defaultValue = "50")
    int lockMaxAttempts;

    @ConfigProperty(name = "checkpoint.lock.retry-delay-ms", defaultValue = "100")
    long lockRetryDelayMs;

    @Inject
    ObjectMapper objectMapper;

    private Path storeRoot;
    private LockPolicy lockPolicy;

    RepositoryManager() {
    }

    public RepositoryManager(Path storeRoot, ObjectMapper objectMapper, LockPolicy lockPolicy) {
        this.storeRoot = Objects.requireNonNull(storeRoot, "storeRoot cannot be null")
                .toAbsolutePath().normalize();
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.lockPolicy = Objects.requireNonNull(lockPolicy, "lockPolicy cannot be null");
    }

    public Path storeRoot() {
        if (storeRoot == null) {
            storeRoot = Path.of(storeRootPath).toAbsolutePath().normalize();
        }
        return storeRoot;
    }

    LockPolicy lockPolicy() {
        if (lockPolicy == null) {
            lockPolicy = new LockPolicy(lockMaxAttempts, Duration.ofMillis(lockRetryDelayMs));
        }
        return lockPolicy;
    }

    /**
     * Summaries of every repository in the store, ordered by repository id.
     * Each subscription rescans the store root.
     */
    public Multi<RepositorySummary> list() {
        return Multi.createFrom().items(() -> directoryIds().stream())
                .map(this::open)
                .filter(Repository::exists)
                .map(Repository::summary);
    }

    /**
     * Returns the repository of {@code identity}. Nothing is written to disk until
     * its first checkpoint.
     */
    public Repository openOrCreate(BookIdentity identity) {
        Objects.requireNonNull(identity, "identity cannot be null");
        RepositoryId id = identity.repositoryId();
        Repository repository = new Repository(id, identity, directoryOf(id), objectMapper, lockPolicy());
        log.debugf("Opened repository %s for %s", id, identity.key());
        return repository;
    }

    /**
     * Finds an existing repository by id.
     */
    public Optional<Repository> find(RepositoryId id) {
        Objects.requireNonNull(id, "id cannot be null");
        if (!Files.isDirectory(directoryOf(id))) {
            return Optional.empty();
        }
        Repository repository = open(id);
        return repository.exists() ? Optional.of(repository) : Optional.empty();
    }

    /**
     * Ids of every repository in the store that holds at least one checkpoint.
     */
    public List<RepositoryId> repositoryIds() {
        return directoryIds().stream()
                .filter(id -> open(id).exists())
                .toList();
    }

    /**
     * Ids of every repository-named directory under the store root, including
     * leftovers of a first write that never published.
     */
    List<RepositoryId> directoryIds() {
        if (!Files.isDirectory(storeRoot())) {
            return List.of();
        }
        List<RepositoryId> ids = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(storeRoot(), Files::isDirectory)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (RepositoryId.isValid(name)) {
                    ids.add(new RepositoryId(name));
                } else if (!name.startsWith(".")) {
                    log.debugf("Ignoring unexpected entry in store root: %s", entry);
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list store root " + storeRoot(), e);
        }
        ids.sort((a, b) -> a.value().compareTo(b.value()));
        return ids;
    }

    /**
     * Removes one repository and all its checkpoints.
     *
     * @return true if it held at least one checkpoint
     * @throws NothingSelectedException if {@code id} is null
     */
    public boolean remove(RepositoryId id) {
        if (id == null) {
            throw new NothingSelectedException("No repository selected");
        }
        return delete(id);
    }

    /**
     * Removes every selected repository. Ids that no longer exist are skipped.
     *
     * @return number of repositories actually removed
     * @throws NothingSelectedException if the selection is null or empty
     */
    public int remove(Collection<RepositoryId> ids) {
        if (ids == null || ids.isEmpty()) {
            throw new NothingSelectedException("No repositories selected");
        }
        Set<RepositoryId> unique = new LinkedHashSet<>(ids);
        int removed = 0;
        for (RepositoryId id : unique) {
            if (id != null && delete(id)) {
                removed++;
            }
        }
        log.infof("Removed %d of %d selected repositories", removed, unique.size());
        return removed;
    }

    /**
     * Removes every repository in the store.
     *
     * @throws NothingSelectedException if the store holds no repositories
     */
    public int removeAll() {
        List<RepositoryId> ids = repositoryIds();
        if (ids.isEmpty()) {
            throw new NothingSelectedException("No repositories to remove");
        }
        return remove(ids);
    }

    /**
     * Deletes trash directories left behind by interrupted removals.
     *
     * @return number of trash directories deleted
     */
    public int cleanTrash() {
        if (!Files.isDirectory(storeRoot())) {
            return 0;
        }
        int cleaned = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(storeRoot(), TRASH_PREFIX + "*")) {
            for (Path entry : entries) {
                DurableFiles.deleteRecursively(entry);
                log.infof("Deleted leftover trash %s", entry);
                cleaned++;
            }
        } catch (IOException e) {
            throw new StorageException("Failed to clean trash under " + storeRoot(), e);
        }
        return cleaned;
    }

    Path directoryOf(RepositoryId id) {
        return storeRoot().resolve(id.value());
    }

    private Repository open(RepositoryId id) {
        return new Repository(id, null, directoryOf(id), objectMapper, lockPolicy());
    }

    private boolean delete(RepositoryId id) {
        Path dir = directoryOf(id);
        if (!Files.isDirectory(dir)) {
            log.debugf("Repository %s already absent, skipping", id);
            return false;
        }
        Path trash = storeRoot().resolve(TRASH_PREFIX + id.value() + "-" + UUID.randomUUID());
        RepositoryLock lock = new RepositoryLock(dir.resolve(Repository.LOCK_FILE), lockPolicy());
        boolean existed;
        try (RepositoryLock.Handle ignored = lock.acquire()) {
            if (!Files.isDirectory(dir)) {
                return false;
            }
            existed = open(id).exists();
            DurableFiles.moveAtomically(dir, trash, false);
            DurableFiles.syncDirectory(storeRoot());
        } catch (IOException e) {
            throw new StorageException("Failed to remove repository " + id, e);
        }
        try {
            DurableFiles.deleteRecursively(trash);
        } catch (IOException e) {
            log.warnf("Repository %s removed but %s could not be deleted yet: %s",
                    id, trash, e.getMessage());
        }
        if (existed) {
            log.infof("Removed repository %s", id);
        } else {
            log.debugf("Removed empty directory of repository %s", id);
        }
        return existed;
    }
}
