package org.jsondb;

import org.jsondb.interfaces.SnapshotStore;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Test store that keeps the text in memory and counts writes.
 */
class InMemorySnapshotStore implements SnapshotStore {

    String text;
    int writes;
    boolean failWrites;
    Runnable duringWrite = () -> {};

    InMemorySnapshotStore() {}

    InMemorySnapshotStore(String initial) {
        this.text = initial;
    }

    @Override
    public String load() {
        return text;
    }

    @Override
    public void save(String text) throws PersistenceException {
        duringWrite.run();
        if (failWrites) {
            throw new PersistenceException(Path.of("mem.json"), Path.of("mem.json.tmp"), new IOException("disk full"));
        }
        this.text = text;
        writes++;
    }
}
