package org.jsondb;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.jsondb.persistence.JsonCodec;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class JsonCodecTest {

    @Test
    void writesTwoSpaceIndentInInsertionOrder() {
        JsonObject o = new JsonObject();
        o.addProperty("z", 1);
        o.addProperty("a", "x");
        JsonArray arr = new JsonArray();
        arr.add(true);
        o.add("list", arr);

        assertEquals("{\n  \"z\": 1,\n  \"a\": \"x\",\n  \"list\": [\n    true\n  ]\n}", JsonCodec.write(o));
    }

    @Test
    void writesEmptyContainersCompactly() {
        assertEquals("{}", JsonCodec.write(new JsonObject()));
        assertEquals("[]", JsonCodec.write(new JsonArray()));
    }

    @Test
    void doesNotEscapeHtml() {
        JsonObject o = new JsonObject();
        o.addProperty("k", "<a href='x'>");
        assertTrue(JsonCodec.write(o).contains("<a href='x'>"));
    }

    @Test
    void parsesAnyTopLevelValue() throws IOException {
        assertTrue(JsonCodec.parse("{\"a\": [1, 2]}").isJsonObject());
        assertTrue(JsonCodec.parse("[]").isJsonArray());
        assertEquals(42, JsonCodec.parse(" 42 ").getAsInt());
        assertTrue(JsonCodec.parse("null").isJsonNull());
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IOException.class, () -> JsonCodec.parse(""));
        assertThrows(IOException.class, () -> JsonCodec.parse("{not json"));
        assertThrows(IOException.class, () -> JsonCodec.parse("{a: 1}"));
        assertThrows(IOException.class, () -> JsonCodec.parse("[1] [2]"));
        assertThrows(IOException.class, () -> JsonCodec.parse("[NaN]"));
    }

    @Test
    void parseThenWriteIsStable() throws IOException {
        String text = "{\n  \"a\": {\n    \"b\": [\n      1,\n      null\n    ]\n  }\n}";
        JsonElement e = JsonCodec.parse(text);
        assertEquals(text, JsonCodec.write(e));
    }
}
