package org.jsondb;

import java.nio.file.Path;

/**
 * Base exception for document and container misuse.
 * I/O failures during a save are reported separately by {@link PersistenceException}.
 */
public class JsonDbException extends RuntimeException {

    public JsonDbException(String message) {
        super(message);
    }

    public JsonDbException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when an existing file does not contain valid JSON.
     * No document is produced.
     */
    public static class LoadParseException extends JsonDbException {
        private final Path path;

        public LoadParseException(Path path, Throwable cause) {
            super(String.format("Malformed JSON in %s: %s", path, cause.getMessage()), cause);
            this.path = path;
        }

        public Path getPath() {
            return path;
        }
    }

    /**
     * Thrown when an operation needs a mapping but finds a sequence, or the other way round.
     */
    public static class KindMismatchException extends JsonDbException {
        private final String expected;
        private final String actual;

        public KindMismatchException(String expected, String actual) {
            super(String.format("Expected %s but found %s", expected, actual));
            this.expected = expected;
            this.actual = actual;
        }

        public String getExpected() {
            return expected;
        }

        public String getActual() {
            return actual;
        }
    }

    /**
     * Thrown when a mapping key is not a string.
     */
    public static class KeyTypeException extends JsonDbException {
        private final Object key;

        public KeyTypeException(Object key) {
            super(String.format("Mapping keys must be strings, got %s",
                    key == null ? "null" : key.getClass().getName()));
            this.key = key;
        }

        public Object getKey() {
            return key;
        }
    }

    public static class NotFoundException extends JsonDbException {
        private final String key;

        public NotFoundException(String key) {
            super(String.format("Key not found: \"%s\"", key));
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }

    public static class IndexException extends JsonDbException {
        private final int index;
        private final int size;

        public IndexException(int index, int size) {
            super(String.format("Index %d out of range for size %d", index, size));
            this.index = index;
            this.size = size;
        }

        public int getIndex() {
            return index;
        }

        public int getSize() {
            return size;
        }
    }

    /**
     * Thrown at save time for a value that has no JSON representation.
     */
    public static class SerializationException extends JsonDbException {
        private final Object value;

        public SerializationException(String message, Object value) {
            super(message);
            this.value = value;
        }

        public Object getValue() {
            return value;
        }
    }
}
