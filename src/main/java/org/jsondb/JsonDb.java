package org.jsondb;

import org.jsondb.config.JsonDbOptions;
import org.jsondb.document.Document;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point: opens a file-backed JSON document.
 * <pre>{@code
 * try (Document db = JsonDb.open("settings.json")) {
 *     db.set("theme", "dark");
 * }
 * }</pre>
 */
public final class JsonDb {

    private JsonDb() {}

    /**
     * Opens {@code path}, creating the document in memory if the file does not exist.
     * Options come from system properties, see {@link JsonDbOptions}.
     */
    public static Document open(Path path) throws IOException {
        return Document.open(path);
    }

    public static Document open(String path) throws IOException {
        return open(Path.of(path));
    }

    public static Document open(Path path, JsonDbOptions options) throws IOException {
        return Document.open(path, options);
    }
}
