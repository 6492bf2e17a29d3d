package org.jsondb.document;

import org.jsondb.container.TrackedList;
import org.jsondb.container.TrackedMap;

/**
 * What a document's root currently is. Once it leaves {@link #UNINITIALIZED} it never changes.
 */
public enum RootKind {
    /** The file did not exist and nothing has been written yet. */
    UNINITIALIZED("uninitialized"),
    MAPPING("mapping"),
    SEQUENCE("sequence"),
    /** The file holds a bare string, number, boolean or null; only rendering is supported. */
    SCALAR("scalar");

    private final String label;

    RootKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    static RootKind of(Object root) {
        if (root instanceof TrackedMap) return MAPPING;
        if (root instanceof TrackedList) return SEQUENCE;
        return SCALAR;
    }
}
