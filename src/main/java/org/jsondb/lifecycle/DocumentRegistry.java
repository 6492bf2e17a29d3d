package org.jsondb.lifecycle;

import org.jsondb.document.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Set of live documents that are flushed when the JVM shuts down.
 * <p>
 * <b>Design notes:</b>
 * <ul>
 *     <li>Membership is weak: a registered document that becomes unreachable simply drops out.
 *     Callers own their documents and release them with {@link Document#close()}.</li>
 *     <li>The member set is guarded by a {@link ReentrantLock}; saves run outside the lock.</li>
 *     <li>The shutdown hook runs on normal exit, {@link System#exit}, SIGINT and SIGTERM.
 *     It cannot run on SIGKILL or power loss; the atomic rename leaves the old file intact then.</li>
 *     <li>Failures during {@link #flushAll()} are logged and discarded so every member gets its attempt.</li>
 * </ul>
 */
public final class DocumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    private static final DocumentRegistry GLOBAL = new DocumentRegistry();

    private final ReentrantLock lock = new ReentrantLock();
    private final Set<Document> members = Collections.newSetFromMap(new WeakHashMap<>());
    private final AtomicBoolean hookInstalled = new AtomicBoolean(false);

    /** @return the process-wide registry used by {@link Document#open} */
    public static DocumentRegistry global() {
        return GLOBAL;
    }

    public void register(Document doc) {
        lock.lock();
        try {
            members.add(doc);
        } finally {
            lock.unlock();
        }
    }

    public void unregister(Document doc) {
        lock.lock();
        try {
            members.remove(doc);
        } finally {
            lock.unlock();
        }
    }

    public boolean isRegistered(Document doc) {
        lock.lock();
        try {
            return members.contains(doc);
        } finally {
            lock.unlock();
        }
    }

    /** @return number of members still reachable */
    public int size() {
        lock.lock();
        try {
            return members.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Saves every registered document. A document whose save is already in progress is skipped.
     *
     * @return number of documents whose save failed or was skipped
     */
    public int flushAll() {
        List<Document> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(members);
        } finally {
            lock.unlock();
        }

        int failed = 0;
        int flushed = 0;
        for (Document doc : snapshot) {
            if (doc.isSaving()) {
                log.warn("Skipping {}: a save is already in progress", doc.path());
                failed++;
                continue;
            }
            if (!doc.isDirty()) {
                continue;
            }
            try {
                doc.save();
                flushed++;
            } catch (Exception | StackOverflowError e) {
                log.warn("Failed to flush {}: {}", doc.path(), e.getMessage(), e);
                failed++;
            }
        }
        log.info("Flushed {} of {} registered document(s), {} failed", flushed, snapshot.size(), failed);
        return failed;
    }

    /**
     * Registers a JVM shutdown hook that calls {@link #flushAll()}. Installs at most once.
     * <p>
     * The hook does not change the exit status: it is whatever the JVM reports, the
     * {@code System.exit} argument or 0 on normal exit, and 130 after SIGINT or 143 after SIGTERM.
     */
    public void installShutdownHook() {
        if (hookInstalled.compareAndSet(false, true)) {
            Runtime.getRuntime().addShutdownHook(new Thread(this::flushAll, "jsondb-shutdown-flush"));
            log.debug("Shutdown hook installed");
        }
    }

    public boolean isShutdownHookInstalled() {
        return hookInstalled.get();
    }
}
