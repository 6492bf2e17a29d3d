package org.jsondb.config;

/**
 * Settings applied to documents opened through {@link org.jsondb.JsonDb}.
 * <p>
 * Values are read from system properties, for example {@code -Djsondb.fsync=false}:
 * <ul>
 *     <li>{@code jsondb.fsync}: force the temporary file to disk before the rename (default {@code true}).</li>
 *     <li>{@code jsondb.shutdownHook}: flush registered documents when the JVM shuts down (default {@code true}).</li>
 * </ul>
 *
 * @param fsync        sync the temporary file before replacing the target
 * @param shutdownHook install the registry's shutdown hook on first registration
 */
public record JsonDbOptions(boolean fsync, boolean shutdownHook) {

    public static final String FSYNC_PROPERTY = "jsondb.fsync";
    public static final String SHUTDOWN_HOOK_PROPERTY = "jsondb.shutdownHook";

    /** @return built-in defaults, ignoring system properties */
    public static JsonDbOptions defaults() {
        return new JsonDbOptions(true, true);
    }

    /** @return options resolved from the current system properties */
    public static JsonDbOptions fromSystemProperties() {
        return new JsonDbOptions(
                flag(FSYNC_PROPERTY, true),
                flag(SHUTDOWN_HOOK_PROPERTY, true));
    }

    public JsonDbOptions withFsync(boolean fsync) {
        return new JsonDbOptions(fsync, shutdownHook);
    }

    public JsonDbOptions withShutdownHook(boolean shutdownHook) {
        return new JsonDbOptions(fsync, shutdownHook);
    }

    private static boolean flag(String name, boolean fallback) {
        String raw = System.getProperty(name);
        if (raw == null || raw.isBlank()) return fallback;
        return Boolean.parseBoolean(raw.trim());
    }
}
