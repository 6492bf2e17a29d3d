package org.jsondb.container;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.jsondb.JsonDbException.KeyTypeException;
import org.jsondb.interfaces.ModificationListener;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

/**
 * Brings values into a document's tree.
 * <p>
 * Every mapping or sequence that enters a tree is turned into a {@link TrackedMap} or
 * {@link TrackedList} bound to that tree's owner, recursively. Containers already bound
 * to the same owner are kept as they are; containers of another owner are copied.
 * Scalars pass through, and so do unknown objects: those are rejected when the tree is saved.
 */
public final class Tracking {

    private Tracking() {}

    /**
     * @param owner listener every new container reports to
     * @param value raw or tracked value
     * @return the value as it must be stored in a tree owned by {@code owner}
     * @throws KeyTypeException if a mapping has a non-string key
     */
    public static Object wrap(ModificationListener owner, Object value) {
        if (value instanceof TrackedMap) {
            TrackedMap map = (TrackedMap) value;
            return map.owner() == owner ? map : mapOf(owner, map.entries());
        }
        if (value instanceof TrackedList) {
            TrackedList list = (TrackedList) value;
            return list.owner() == owner ? list : listOf(owner, list.elements());
        }
        if (value instanceof Map) return mapOf(owner, (Map<?, ?>) value);
        if (value instanceof Collection) return listOf(owner, (Collection<?>) value);
        if (value instanceof Object[]) return listOf(owner, Arrays.asList((Object[]) value));
        if (value instanceof JsonElement) return fromElement(owner, (JsonElement) value);
        return value;
    }

    /**
     * Builds a tracked tree out of a parsed Gson tree.
     */
    public static Object fromElement(ModificationListener owner, JsonElement element) {
        if (element == null || element.isJsonNull()) return null;
        if (element.isJsonPrimitive()) return JsonValues.fromPrimitive((JsonPrimitive) element);
        if (element.isJsonObject()) {
            TrackedMap map = new TrackedMap(owner);
            for (Map.Entry<String, JsonElement> e : ((JsonObject) element).entrySet()) {
                map.entries().put(e.getKey(), fromElement(owner, e.getValue()));
            }
            return map;
        }
        TrackedList list = new TrackedList(owner);
        for (JsonElement e : (JsonArray) element) {
            list.elements().add(fromElement(owner, e));
        }
        return list;
    }

    private static TrackedMap mapOf(ModificationListener owner, Map<?, ?> source) {
        TrackedMap map = new TrackedMap(owner);
        for (Map.Entry<?, ?> e : source.entrySet()) {
            if (!(e.getKey() instanceof String)) {
                throw new KeyTypeException(e.getKey());
            }
            map.entries().put((String) e.getKey(), wrap(owner, e.getValue()));
        }
        return map;
    }

    private static TrackedList listOf(ModificationListener owner, Collection<?> source) {
        TrackedList list = new TrackedList(owner);
        for (Object o : source) {
            list.elements().add(wrap(owner, o));
        }
        return list;
    }
}
