package org.jsondb.interfaces;

import org.jsondb.PersistenceException;

import java.io.IOException;

/**
 * Backing storage for a single document's serialized text.
 */
public interface SnapshotStore {

    /**
     * Reads the stored text.
     *
     * @return the stored text, or {@code null} if nothing has been stored yet
     * @throws IOException if the storage exists but cannot be read
     */
    String load() throws IOException;

    /**
     * Replaces the stored text as a whole.
     * Readers must never observe a partially written state.
     *
     * @param text serialized document
     * @throws PersistenceException if the write or the replace failed
     */
    void save(String text) throws PersistenceException;
}
