package org.jsondb.container;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.jsondb.JsonDbException.SerializationException;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Conversions between the in-memory value domain and Gson trees.
 * <p>
 * In memory a value is {@code null}, a {@link Boolean}, a {@link Number}, a {@link String},
 * a {@link TrackedMap} or a {@link TrackedList}.
 */
public final class JsonValues {

    private static final Pattern INTEGRAL = Pattern.compile("-?\\d+");

    private JsonValues() {}

    /**
     * Converts a Gson scalar into its Java value.
     */
    static Object fromPrimitive(JsonPrimitive primitive) {
        if (primitive.isBoolean()) return primitive.getAsBoolean();
        if (primitive.isNumber()) return normalizeNumber(primitive.getAsNumber());
        return primitive.getAsString();
    }

    /**
     * Turns a parsed number into a {@link Long}, {@link BigInteger}, {@link Double} or {@link BigDecimal},
     * whichever holds it exactly.
     */
    public static Number normalizeNumber(Number number) {
        String text = number.toString();
        if (INTEGRAL.matcher(text).matches()) {
            try {
                return Long.parseLong(text);
            } catch (NumberFormatException e) {
                return new BigInteger(text);
            }
        }
        BigDecimal exact = new BigDecimal(text);
        double d = exact.doubleValue();
        if (Double.isFinite(d) && BigDecimal.valueOf(d).compareTo(exact) == 0) {
            return d;
        }
        return exact;
    }

    /**
     * Converts an in-memory value into a detached Gson tree.
     *
     * @throws SerializationException if the value, or anything below it, has no JSON form
     */
    public static JsonElement toElement(Object value) {
        return toElement(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    // path holds the containers between the root and the current value
    private static JsonElement toElement(Object value, Set<Object> path) {
        if (value == null) return JsonNull.INSTANCE;
        if (value instanceof TrackedMap || value instanceof TrackedList) {
            if (!path.add(value)) {
                throw new SerializationException("Circular reference detected", value);
            }
            try {
                return value instanceof TrackedMap
                        ? mapElement((TrackedMap) value, path)
                        : listElement((TrackedList) value, path);
            } finally {
                path.remove(value);
            }
        }
        if (value instanceof String) return new JsonPrimitive((String) value);
        if (value instanceof Boolean) return new JsonPrimitive((Boolean) value);
        if (value instanceof Character) return new JsonPrimitive((Character) value);
        if (value instanceof Number) {
            Number n = (Number) value;
            if ((n instanceof Double || n instanceof Float) && !Double.isFinite(n.doubleValue())) {
                throw new SerializationException("JSON has no representation for " + n, value);
            }
            return new JsonPrimitive(n);
        }
        throw new SerializationException(
                "Value of type " + value.getClass().getName() + " is not JSON serializable", value);
    }

    private static JsonObject mapElement(TrackedMap map, Set<Object> path) {
        JsonObject object = new JsonObject();
        for (Map.Entry<String, Object> e : map.entries().entrySet()) {
            object.add(e.getKey(), toElement(e.getValue(), path));
        }
        return object;
    }

    private static JsonArray listElement(TrackedList list, Set<Object> path) {
        JsonArray array = new JsonArray(list.size());
        for (Object e : list.elements()) {
            array.add(toElement(e, path));
        }
        return array;
    }

    /**
     * Names the JSON kind of a value, for error messages.
     */
    public static String kindOf(Object value) {
        if (value == null) return "null";
        if (value instanceof TrackedMap) return "mapping";
        if (value instanceof TrackedList) return "sequence";
        if (value instanceof String || value instanceof Character) return "string";
        if (value instanceof Number) return "number";
        if (value instanceof Boolean) return "boolean";
        return value.getClass().getSimpleName();
    }
}
