// file: core/src/main/java/io/docvault/core/BufferedExecutor.java
package io.docvault.core;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executor that holds back tasks until the collection is loaded.
 * <p>
 * Lifecycle:
 *  - Created "not ready": execute() queues tasks in submission order.
 *  - processBuffer(): flips to "ready" and drains the queue in order.
 *  - Once ready, execute() runs tasks immediately on the calling thread.
 * <p>
 * A task that throws is logged and does not prevent the remaining queued
 * tasks from running.
 */
public final class BufferedExecutor implements Executor {
    private static final Logger log = Logger.getLogger(BufferedExecutor.class.getName());

    private final Deque<Runnable> buffer = new ArrayDeque<>();
    private boolean ready;

    public BufferedExecutor() {
        this(false);
    }

    public BufferedExecutor(boolean ready) {
        this.ready = ready;
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "task");
        synchronized (this) {
            if (!ready) {
                buffer.addLast(task);
                return;
            }
        }
        runSafely(task);
    }

    /** Mark the executor ready and run every buffered task, oldest first. */
    public void processBuffer() {
        while (true) {
            Runnable next;
            synchronized (this) {
                ready = true;
                next = buffer.pollFirst();
            }
            if (next == null) {
                return;
            }
            runSafely(next);
        }
    }

    public synchronized boolean isReady() {
        return ready;
    }

    public synchronized int pending() {
        return buffer.size();
    }

    private static void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "buffered task failed", e);
        }
    }
}
