package org.jsondb.interfaces;

import com.google.gson.JsonElement;

/**
 * Common view of tracked mappings and sequences.
 */
public interface JsonContainer {

    /** @return number of entries or elements */
    int size();

    default boolean isEmpty() {
        return size() == 0;
    }

    /**
     * Returns the listener this container reports mutations to.
     */
    ModificationListener owner();

    /**
     * Deep-copies this container into a detached Gson tree.
     *
     * @return a fresh {@link JsonElement}; later mutations of this container do not affect it
     * @throws org.jsondb.JsonDbException.SerializationException if a value has no JSON form
     */
    JsonElement toJsonElement();
}
