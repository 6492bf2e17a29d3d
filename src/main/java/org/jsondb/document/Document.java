package org.jsondb.document;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jsondb.JsonDbException.KindMismatchException;
import org.jsondb.JsonDbException.LoadParseException;
import org.jsondb.JsonDbException.NotFoundException;
import org.jsondb.PersistenceException;
import org.jsondb.config.JsonDbOptions;
import org.jsondb.container.JsonValues;
import org.jsondb.container.TrackedList;
import org.jsondb.container.TrackedMap;
import org.jsondb.container.Tracking;
import org.jsondb.interfaces.ModificationListener;
import org.jsondb.interfaces.SnapshotStore;
import org.jsondb.lifecycle.DocumentRegistry;
import org.jsondb.persistence.FileSnapshotStore;
import org.jsondb.persistence.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A JSON file loaded into a mutable, change-tracked tree.
 * <p>
 * The root is a mapping or a sequence. Which one is fixed when an existing file is
 * loaded, or by the first write to a new document: mapping operations ({@link #set},
 * {@link #getOrInsert}, ...) make it a mapping, sequence operations ({@link #append}, ...)
 * make it a sequence. Using the other kind afterwards fails with {@link KindMismatchException}.
 * <p>
 * Every mutation anywhere in the tree marks the document dirty. {@link #save()} writes the
 * whole tree through its {@link SnapshotStore}; {@link #close()} saves and leaves the
 * {@link DocumentRegistry}. Documents that are still registered at JVM shutdown are saved by
 * the registry's shutdown hook.
 * <pre>{@code
 * try (Document doc = Document.open(Path.of("state.json"))) {
 *     doc.getOrInsertList("events").append("started");
 * }
 * }</pre>
 * <b>Notes:</b>
 * <ul>
 *     <li>Not thread-safe. Two documents on the same path overwrite each other, last writer wins.</li>
 *     <li>A save already in flight when the shutdown hook runs is left to finish; the hook skips that document.</li>
 * </ul>
 */
public final class Document implements ModificationListener, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Document.class);

    private final Path path;
    private final SnapshotStore store;
    private final DocumentRegistry registry;
    private final AtomicBoolean saving = new AtomicBoolean(false);

    private RootKind kind = RootKind.UNINITIALIZED;
    // TrackedMap, TrackedList, or a scalar for SCALAR roots
    private Object root;
    private volatile boolean dirty;
    private String lastPersistedSnapshot;
    private boolean closed;

    private Document(Path path, SnapshotStore store, DocumentRegistry registry) {
        this.path = path;
        this.store = store;
        this.registry = registry;
    }

    /**
     * Opens {@code path} with options taken from system properties.
     *
     * @see #open(Path, JsonDbOptions)
     */
    public static Document open(Path path) throws IOException {
        return open(path, JsonDbOptions.fromSystemProperties());
    }

    /**
     * Opens {@code path}, loading it if it exists, and registers the document with
     * {@link DocumentRegistry#global()}.
     *
     * @throws LoadParseException if the file is not valid UTF-8 JSON
     * @throws IOException        if the file exists but cannot be read
     */
    public static Document open(Path path, JsonDbOptions options) throws IOException {
        DocumentRegistry registry = DocumentRegistry.global();
        if (options.shutdownHook()) {
            registry.installShutdownHook();
        }
        return open(path, new FileSnapshotStore(path, options.fsync()), registry);
    }

    /**
     * Opens a document over an explicit store and registry.
     *
     * @param path     path reported by {@link #path()} and in errors
     * @param store    where the text is read from and written to
     * @param registry registry the new document joins
     */
    public static Document open(Path path, SnapshotStore store, DocumentRegistry registry) throws IOException {
        Document doc = new Document(path, store, registry);
        doc.load();
        registry.register(doc);
        return doc;
    }

    private void load() throws IOException {
        String text;
        try {
            text = store.load();
        } catch (CharacterCodingException e) {
            throw new LoadParseException(path, e);
        }
        if (text == null) {
            log.debug("{} does not exist yet, root is uninitialized", path);
            return;
        }
        JsonElement parsed;
        try {
            parsed = JsonCodec.parse(text);
        } catch (IOException e) {
            throw new LoadParseException(path, e);
        }
        root = Tracking.fromElement(this, parsed);
        kind = RootKind.of(root);
        lastPersistedSnapshot = JsonCodec.write(JsonValues.toElement(root));
        log.debug("Loaded {} as {}", path, kind.label());
    }

    public Path path() {
        return path;
    }

    public RootKind kind() {
        return kind;
    }

    /**
     * @return the root mapping or sequence, the scalar of a {@link RootKind#SCALAR} document,
     *         or {@code null} while uninitialized
     */
    public Object root() {
        return root;
    }

    public boolean isDirty() {
        return dirty;
    }

    /** @return whether a write is in progress */
    public boolean isSaving() {
        return saving.get();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void markModified() {
        dirty = true;
    }

    /**
     * Makes the root a mapping if it is still uninitialized (marking the document dirty).
     *
     * @return the root mapping
     * @throws KindMismatchException if the root is a sequence or a scalar
     */
    public TrackedMap ensureMapping() {
        if (kind == RootKind.UNINITIALIZED) {
            root = Tracking.wrap(this, new LinkedHashMap<String, Object>());
            kind = RootKind.MAPPING;
            markModified();
        } else if (kind != RootKind.MAPPING) {
            throw new KindMismatchException(RootKind.MAPPING.label(), kind.label());
        }
        return (TrackedMap) root;
    }

    /**
     * Makes the root a sequence if it is still uninitialized (marking the document dirty).
     *
     * @return the root sequence
     * @throws KindMismatchException if the root is a mapping or a scalar
     */
    public TrackedList ensureSequence() {
        if (kind == RootKind.UNINITIALIZED) {
            root = Tracking.wrap(this, List.of());
            kind = RootKind.SEQUENCE;
            markModified();
        } else if (kind != RootKind.SEQUENCE) {
            throw new KindMismatchException(RootKind.SEQUENCE.label(), kind.label());
        }
        return (TrackedList) root;
    }

    // ---- mapping operations ----

    /**
     * Pure lookup on the root mapping. An uninitialized document stays uninitialized.
     *
     * @throws NotFoundException if {@code key} is absent
     */
    public Object get(String key) {
        if (kind == RootKind.UNINITIALIZED) throw new NotFoundException(key);
        return ensureMapping().get(key);
    }

    public TrackedMap getMap(String key) {
        if (kind == RootKind.UNINITIALIZED) throw new NotFoundException(key);
        return ensureMapping().getMap(key);
    }

    public TrackedList getList(String key) {
        if (kind == RootKind.UNINITIALIZED) throw new NotFoundException(key);
        return ensureMapping().getList(key);
    }

    /**
     * Side-effecting read on the root mapping; see {@link TrackedMap#getOrInsert}.
     * A missing key gets {@code defaultValue} inserted and the document becomes dirty.
     */
    public Object getOrInsert(String key, Object defaultValue) {
        return ensureMapping().getOrInsert(key, defaultValue);
    }

    public TrackedMap getOrInsertMap(String key) {
        return ensureMapping().getOrInsertMap(key);
    }

    public TrackedList getOrInsertList(String key) {
        return ensureMapping().getOrInsertList(key);
    }

    public void set(String key, Object value) {
        ensureMapping().set(key, value);
    }

    /**
     * @return the removed value
     * @throws NotFoundException if {@code key} is absent
     */
    public Object delete(String key) {
        if (kind == RootKind.UNINITIALIZED) throw new NotFoundException(key);
        return ensureMapping().delete(key);
    }

    /**
     * @return whether the root mapping has {@code key}; {@code false} while uninitialized
     */
    public boolean contains(String key) {
        if (kind == RootKind.UNINITIALIZED) return false;
        return ensureMapping().contains(key);
    }

    // ---- sequence operations ----

    public void append(Object value) {
        ensureSequence().append(value);
    }

    public void extend(Collection<?> values) {
        ensureSequence().extend(values);
    }

    /**
     * Same as {@link #extend}.
     *
     * @return this document
     */
    public Document concatInPlace(Collection<?> values) {
        ensureSequence().concatInPlace(values);
        return this;
    }

    // ---- persistence ----

    /**
     * Writes the tree if it changed since the last load or save.
     * <p>
     * Nothing happens when the document is clean, uninitialized or scalar. If the
     * serialized tree equals the last persisted text the document is marked clean without
     * writing. On failure the exception propagates, the target file is unchanged and the
     * document stays dirty, so the save can be retried.
     *
     * @throws PersistenceException if the temporary file or the replace failed
     * @throws org.jsondb.JsonDbException.SerializationException if a value in the tree has no JSON form
     */
    public void save() throws PersistenceException {
        if (!dirty || (kind != RootKind.MAPPING && kind != RootKind.SEQUENCE)) {
            return;
        }
        String text = JsonCodec.write(JsonValues.toElement(root));
        if (text.equals(lastPersistedSnapshot)) {
            dirty = false;
            log.debug("{} unchanged since last save, nothing written", path);
            return;
        }
        saving.set(true);
        try {
            store.save(text);
        } finally {
            saving.set(false);
        }
        lastPersistedSnapshot = text;
        dirty = false;
    }

    /**
     * Saves if dirty and leaves the registry. Calling it again does nothing.
     * If the save fails the document stays open and registered.
     */
    @Override
    public void close() throws PersistenceException {
        if (closed) {
            return;
        }
        save();
        closed = true;
        registry.unregister(this);
    }

    /**
     * @return a detached copy of the tree; {@code {}} while uninitialized
     */
    public JsonElement toJsonElement() {
        if (kind == RootKind.UNINITIALIZED) {
            return new JsonObject();
        }
        return JsonValues.toElement(root);
    }

    /**
     * @return the tree in the on-disk format
     */
    public String toJson() {
        return JsonCodec.write(toJsonElement());
    }

    @Override
    public String toString() {
        if (root instanceof TrackedMap || root instanceof TrackedList) {
            return root.toString();
        }
        return toJsonElement().toString();
    }
}
