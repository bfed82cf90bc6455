// file: persistence/src/main/java/io/docvault/persistence/OperationRun.java
package io.docvault.persistence;

import java.util.logging.Logger;

/**
 * Phase bookkeeping for one load / compaction / delta run.
 */
final class OperationRun {
    private static final Logger log = Logger.getLogger(OperationRun.class.getName());

    private final String operation;
    private final String target;
    private volatile Phase phase = Phase.OPENING;

    OperationRun(String operation, String databaseName, String storeName) {
        this.operation = operation;
        this.target = databaseName + "/" + storeName;
    }

    Phase phase() {
        return phase;
    }

    void enter(Phase next) {
        Phase prev = phase;
        phase = next;
        log.fine(() -> this + ": " + prev + " -> " + next);
    }

    /**
     * Mark the run failed and map {@code error} into the persistence taxonomy.
     * Errors that already belong to it pass through unchanged; anything else is
     * reported as a transaction failure in the phase the run had reached.
     */
    PersistenceException fail(Throwable error) {
        Throwable cause = AsyncSteps.unwrap(error);
        Phase at = phase;
        if (at != Phase.FAILED) {
            enter(Phase.FAILED);
        }
        if (cause instanceof PersistenceException) {
            return (PersistenceException) cause;
        }
        return new TransactionException(operation + " of " + target + " failed during " + at, at, cause);
    }

    @Override
    public String toString() {
        return operation + "[" + target + "]";
    }
}
