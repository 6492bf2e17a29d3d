package org.jsondb.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.Strictness;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;

import java.io.IOException;
import java.io.StringReader;

/**
 * Gson-backed reading and printing of whole JSON documents.
 * <p>
 * Output is pretty printed with a two-space indent, object members in insertion order
 * and no trailing newline. Input is parsed strictly: comments, unquoted names,
 * {@code NaN} and trailing content are rejected.
 */
public final class JsonCodec {

    private static final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .serializeNulls()
            .disableHtmlEscaping()
            .create();

    private static final TypeAdapter<JsonElement> ELEMENTS = gson.getAdapter(JsonElement.class);

    private JsonCodec() {}

    /**
     * Parses one complete JSON document.
     *
     * @param text document text
     * @return the parsed tree; a top-level scalar is allowed
     * @throws IOException if the text is not a single valid JSON value
     */
    public static JsonElement parse(String text) throws IOException {
        JsonReader reader = new JsonReader(new StringReader(text));
        reader.setStrictness(Strictness.STRICT);
        JsonElement element = ELEMENTS.read(reader);
        if (reader.peek() != JsonToken.END_DOCUMENT) {
            throw new MalformedJsonException("Unexpected content after the top-level value at " + reader.getPath());
        }
        return element;
    }

    /**
     * Prints a tree in the on-disk format.
     *
     * @param element tree to print
     * @return pretty printed JSON text
     */
    public static String write(JsonElement element) {
        return gson.toJson(element);
    }
}
