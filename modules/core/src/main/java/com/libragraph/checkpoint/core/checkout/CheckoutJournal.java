package com.libragraph.checkpoint.core.checkout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.libragraph.checkpoint.core.storage.DurableFiles;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Records an in-flight checkout, from the start of staging through the
 * working-tree swap, so a crash anywhere in between can be resolved on the next start.
 *
 * <p>The swap is: working to backup, then staged to working. On recovery the
 * surviving directories tell how far it got:
 * <ul>
 *   <li>staged still present: the new tree never went live, restore the backup</li>
 *   <li>staged gone, working present: the swap finished, drop the backup</li>
 * </ul>
 */
public record CheckoutJournal(long checkpoint, String working, String staged, String backup) {

    private static final Logger log = Logger.getLogger(CheckoutJournal.class);

    public enum Outcome { NONE, ROLLED_BACK, COMPLETED }

    Path workingPath() {
        return Path.of(working);
    }

    Path stagedPath() {
        return Path.of(staged);
    }

    Path backupPath() {
        return Path.of(backup);
    }

    void write(Path journalFile, ObjectMapper mapper) throws IOException {
        DurableFiles.replace(journalFile, mapper.writeValueAsBytes(this));
    }

    /**
     * Resolves an interrupted swap, if {@code journalFile} exists, and deletes the journal.
     */
    public static Outcome recover(Path journalFile, ObjectMapper mapper) throws IOException {
        if (!Files.exists(journalFile)) {
            return Outcome.NONE;
        }
        CheckoutJournal journal = mapper.readValue(journalFile.toFile(), CheckoutJournal.class);
        Path working = journal.workingPath();
        Path staged = journal.stagedPath();
        Path backup = journal.backupPath();

        Outcome outcome;
        if (Files.exists(staged)) {
            if (!Files.exists(working) && Files.exists(backup)) {
                DurableFiles.moveAtomically(backup, working, false);
            }
            DurableFiles.deleteRecursively(staged);
            outcome = Outcome.ROLLED_BACK;
        } else if (Files.exists(working)) {
            DurableFiles.deleteRecursively(backup);
            outcome = Outcome.COMPLETED;
        } else {
            // Neither staged nor working: put back whatever the backup holds
            if (Files.exists(backup)) {
                DurableFiles.moveAtomically(backup, working, false);
            }
            outcome = Outcome.ROLLED_BACK;
        }
        Files.deleteIfExists(journalFile);
        log.warnf("Recovered interrupted checkout of checkpoint #%d into %s: %s",
                journal.checkpoint(), working, outcome);
        return outcome;
    }
}
