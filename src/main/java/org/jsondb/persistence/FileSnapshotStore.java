package org.jsondb.persistence;

import org.jsondb.PersistenceException;
import org.jsondb.interfaces.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;

/**
 * FileSnapshotStore keeps one document's text in a single file.
 * <p>
 * A save never writes the target directly:
 * <ol>
 *     <li>the text goes to {@code <file>.tmp} in the same directory,</li>
 *     <li>the temporary file is flushed (and synced when enabled) and closed,</li>
 *     <li>it is moved over the target with {@link StandardCopyOption#ATOMIC_MOVE}.</li>
 * </ol>
 * The temporary file must share the target's directory so the move stays on one file system.
 * A failure before step 3 leaves the target byte-identical; the temporary file is kept.
 * No locking is done: one writer per path is assumed.
 */
public class FileSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FileSnapshotStore.class);

    private static final String TEMP_SUFFIX = ".tmp";

    private final Path file;
    private final boolean fsync;

    /**
     * @param file  target file
     * @param fsync force the temporary file to disk before the move
     */
    public FileSnapshotStore(Path file, boolean fsync) {
        this.file = file;
        this.fsync = fsync;
    }

    public Path file() {
        return file;
    }

    /** @return the {@code <file>.tmp} sibling used while saving */
    public Path tempFile() {
        return file.resolveSibling(file.getFileName() + TEMP_SUFFIX);
    }

    /**
     * Reads the file as UTF-8.
     *
     * @return file content, or {@code null} if the file does not exist
     */
    @Override
    public String load() throws IOException {
        if (!Files.exists(file)) {
            return null;
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }

    @Override
    public void save(String text) throws PersistenceException {
        Path tmp = tempFile();
        try {
            Path dir = file.toAbsolutePath().getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            writeTemp(tmp, text);
            replace(tmp, file);
        } catch (IOException e) {
            throw new PersistenceException(file, tmp, e);
        }
        log.debug("Saved {} ({} chars)", file, text.length());
    }

    private void writeTemp(Path tmp, String text) throws IOException {
        try (FileChannel channel = FileChannel.open(tmp,
                StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            OutputStream os = Channels.newOutputStream(channel);
            os.write(text.getBytes(StandardCharsets.UTF_8));
            os.flush();
            if (fsync) channel.force(true);
        }
    }

    /**
     * Atomically substitutes {@code tmp} for {@code target}.
     */
    protected void replace(Path tmp, Path target) throws IOException {
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
