package org.jsondb.interfaces;

/**
 * Receives change notifications from tracked containers.
 * This is the only capability a container holds on its owning document.
 */
public interface ModificationListener {

    /**
     * Called after every mutation anywhere in the tree.
     */
    void markModified();
}
