package org.jsondb.container;

import com.google.gson.JsonElement;
import org.jsondb.JsonDbException.KeyTypeException;
import org.jsondb.JsonDbException.KindMismatchException;
import org.jsondb.JsonDbException.NotFoundException;
import org.jsondb.JsonDbException.SerializationException;
import org.jsondb.interfaces.JsonContainer;
import org.jsondb.interfaces.ModificationListener;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Set;

/**
 * A JSON object that reports every mutation to its owner.
 * <p>
 * Keys keep insertion order. Values stored through this class are wrapped with
 * {@link Tracking#wrap}, so nested mappings and sequences report to the same owner.
 */
public final class TrackedMap implements JsonContainer {

    private final ModificationListener owner;
    private final LinkedHashMap<String, Object> entries = new LinkedHashMap<>();

    TrackedMap(ModificationListener owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    @Override
    public ModificationListener owner() {
        return owner;
    }

    LinkedHashMap<String, Object> entries() {
        return entries;
    }

    /**
     * Pure lookup.
     *
     * @throws NotFoundException if {@code key} is absent
     */
    public Object get(String key) {
        if (!entries.containsKey(key)) {
            throw new NotFoundException(key);
        }
        return entries.get(key);
    }

    /**
     * Pure lookup of a nested mapping.
     *
     * @throws NotFoundException     if {@code key} is absent
     * @throws KindMismatchException if the value is not a mapping
     */
    public TrackedMap getMap(String key) {
        return asMap(get(key));
    }

    /**
     * Pure lookup of a nested sequence.
     *
     * @throws NotFoundException     if {@code key} is absent
     * @throws KindMismatchException if the value is not a sequence
     */
    public TrackedList getList(String key) {
        return TrackedList.asList(get(key));
    }

    /**
     * Side-effecting read. If {@code key} is present its value is returned. Otherwise
     * {@code defaultValue} is wrapped, inserted under {@code key}, the owner is marked
     * modified, and the inserted value is returned, so a mutation chained onto it is tracked:
     * <pre>{@code
     * ((TrackedList) map.getOrInsert("tags", new ArrayList<>())).append("new");
     * }</pre>
     * Use {@link #get(String)} for a lookup that never changes the map.
     */
    public Object getOrInsert(String key, Object defaultValue) {
        if (entries.containsKey(key)) {
            return entries.get(key);
        }
        Object wrapped = Tracking.wrap(owner, defaultValue);
        entries.put(key, wrapped);
        owner.markModified();
        return wrapped;
    }

    /**
     * {@link #getOrInsert} with an empty mapping as the default.
     *
     * @throws KindMismatchException if the existing value is not a mapping
     */
    public TrackedMap getOrInsertMap(String key) {
        return asMap(getOrInsert(key, new LinkedHashMap<String, Object>()));
    }

    /**
     * {@link #getOrInsert} with an empty sequence as the default.
     *
     * @throws KindMismatchException if the existing value is not a sequence
     */
    public TrackedList getOrInsertList(String key) {
        return TrackedList.asList(getOrInsert(key, Collections.emptyList()));
    }

    /**
     * @throws KeyTypeException if {@code key} is null
     */
    public void set(String key, Object value) {
        if (key == null) {
            throw new KeyTypeException(null);
        }
        entries.put(key, Tracking.wrap(owner, value));
        owner.markModified();
    }

    /**
     * Removes {@code key}.
     *
     * @return the removed value
     * @throws NotFoundException if {@code key} is absent
     */
    public Object delete(String key) {
        if (!entries.containsKey(key)) {
            throw new NotFoundException(key);
        }
        Object removed = entries.remove(key);
        owner.markModified();
        return removed;
    }

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    /** @return read-only view of the keys in insertion order */
    public Set<String> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public JsonElement toJsonElement() {
        return JsonValues.toElement(this);
    }

    @Override
    public String toString() {
        try {
            return toJsonElement().toString();
        } catch (SerializationException e) {
            return "TrackedMap{size=" + size() + ", " + e.getMessage() + "}";
        }
    }

    static TrackedMap asMap(Object value) {
        if (value instanceof TrackedMap) return (TrackedMap) value;
        throw new KindMismatchException("mapping", JsonValues.kindOf(value));
    }
}
