package com.libragraph.checkpoint.core.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.checkpoint.core.checkout.CheckoutJournal;
import com.libragraph.checkpoint.core.concurrent.RepositoryLock;
import com.libragraph.checkpoint.core.storage.StorageException;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Finishes or rolls back checkout swaps cut short by a crash, and deletes trash
 * from interrupted repository removals.
 */
@ApplicationScoped
public class InterruptedCheckoutRecovery {

    private static final Logger log = Logger.getLogger(InterruptedCheckoutRecovery.class);

    @Inject
    RepositoryManager repositoryManager;

    @Inject
    ObjectMapper objectMapper;

    @ConfigProperty(name = "checkpoint.recovery.on-startup", defaultValue = "true")
    boolean recoverOnStartup;

    void onStart(@Observes StartupEvent event) {
        if (!recoverOnStartup) {
            log.debug("Startup recovery disabled");
            return;
        }
        recover();
    }

    /**
     * Runs recovery over the whole store.
     *
     * @return number of repositories whose checkout journal was resolved
     */
    public int recover() {
        int recovered = 0;
        for (RepositoryId id : repositoryManager.directoryIds()) {
            Path dir = repositoryManager.directoryOf(id);
            Path journal = dir.resolve(Repository.JOURNAL_FILE);
            if (!Files.exists(journal)) {
                continue;
            }
            // A held lock means a live checkout owns the journal; leave it alone
            RepositoryLock lock = new RepositoryLock(dir.resolve(Repository.LOCK_FILE),
                    repositoryManager.lockPolicy());
            try (RepositoryLock.Handle handle = lock.tryAcquire()) {
                if (handle == null) {
                    log.debugf("Repository %s is locked, skipping checkout recovery", id);
                    continue;
                }
                if (CheckoutJournal.recover(journal, objectMapper) != CheckoutJournal.Outcome.NONE) {
                    recovered++;
                }
            } catch (IOException | StorageException e) {
                log.errorf(e, "Could not recover interrupted checkout in repository %s", id);
            }
        }
        int trash = repositoryManager.cleanTrash();
        if (recovered > 0 || trash > 0) {
            log.infof("Startup recovery: %d checkouts resolved, %d trash directories deleted",
                    recovered, trash);
        }
        return recovered;
    }
}
