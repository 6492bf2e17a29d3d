package org.jsondb.container;

import com.google.gson.JsonElement;
import org.jsondb.JsonDbException.IndexException;
import org.jsondb.JsonDbException.KindMismatchException;
import org.jsondb.JsonDbException.SerializationException;
import org.jsondb.interfaces.JsonContainer;
import org.jsondb.interfaces.ModificationListener;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A JSON array that reports every mutation to its owner.
 * Indexes run from {@code 0} to {@code size() - 1}; anything else fails with {@link IndexException}.
 */
public final class TrackedList implements JsonContainer {

    private final ModificationListener owner;
    private final ArrayList<Object> elements = new ArrayList<>();

    TrackedList(ModificationListener owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    @Override
    public ModificationListener owner() {
        return owner;
    }

    ArrayList<Object> elements() {
        return elements;
    }

    public Object get(int index) {
        checkIndex(index);
        return elements.get(index);
    }

    public TrackedMap getMap(int index) {
        return TrackedMap.asMap(get(index));
    }

    public TrackedList getList(int index) {
        return asList(get(index));
    }

    public void append(Object value) {
        elements.add(Tracking.wrap(owner, value));
        owner.markModified();
    }

    /**
     * Appends every value in iteration order. Values are wrapped before any is added,
     * so a rejected value leaves the list unchanged.
     */
    public void extend(Collection<?> values) {
        List<Object> wrapped = new ArrayList<>(values.size());
        for (Object v : values) {
            wrapped.add(Tracking.wrap(owner, v));
        }
        elements.addAll(wrapped);
        owner.markModified();
    }

    /**
     * In-place concatenation; same as {@link #extend}.
     *
     * @return this list
     */
    public TrackedList concatInPlace(Collection<?> values) {
        extend(values);
        return this;
    }

    public void setAt(int index, Object value) {
        checkIndex(index);
        elements.set(index, Tracking.wrap(owner, value));
        owner.markModified();
    }

    /**
     * @return the removed value
     */
    public Object deleteAt(int index) {
        checkIndex(index);
        Object removed = elements.remove(index);
        owner.markModified();
        return removed;
    }

    @Override
    public int size() {
        return elements.size();
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
            return "TrackedList{size=" + size() + ", " + e.getMessage() + "}";
        }
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= elements.size()) {
            throw new IndexException(index, elements.size());
        }
    }

    static TrackedList asList(Object value) {
        if (value instanceof TrackedList) return (TrackedList) value;
        throw new KindMismatchException("sequence", JsonValues.kindOf(value));
    }
}
