package io.trellis.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellis.core.exception.PersistenceException;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import org.jboss.logging.Logger;

/// A JSON document on disk that is always replaced as a whole.
///
/// Writes go to a temporary file in the same directory which is then moved over
/// the target, so a reader never sees a half-written document. Writes through
/// one instance are serialized by a lock; each store owns exactly one instance
/// per file.
///
/// @implNote Falls back to a plain replacing move on file systems without
/// atomic rename.
public final class JsonFile {

    private static final Logger LOG = Logger.getLogger(JsonFile.class);

    private final Path path;
    private final ObjectMapper mapper;
    private final ReentrantLock writeLock = new ReentrantLock();

    /// @param path target file, not null
    /// @param mapper mapper used for reading and writing, not null
    public JsonFile(Path path, ObjectMapper mapper) {
        this.path = Objects.requireNonNull(path, "path must not be null").toAbsolutePath();
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    public Path path() {
        return path;
    }

    /// Reads the document.
    ///
    /// @return the parsed tree, or empty if the file does not exist or has no content
    /// @throws PersistenceException if the file cannot be read or is not valid JSON
    public Optional<JsonNode> read() throws PersistenceException {
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            JsonNode root = mapper.readTree(path.toFile());
            return root == null || root.isMissingNode() ? Optional.empty() : Optional.of(root);
        } catch (IOException e) {
            throw new PersistenceException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    /// Replaces the document with the given value, creating parent directories.
    ///
    /// @param value tree or bindable value to write, not null
    /// @throws PersistenceException if the file cannot be written
    public void write(Object value) throws PersistenceException {
        Objects.requireNonNull(value, "value must not be null");
        writeLock.lock();
        Path temp = null;
        try {
            Path directory = path.getParent();
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, path.getFileName().toString() + ".", ".tmp");
            mapper.writeValue(temp.toFile(), value);
            moveIntoPlace(temp);
            LOG.debugv("Wrote {0}", path);
        } catch (IOException e) {
            deleteQuietly(temp, e);
            throw new PersistenceException("Failed to write " + path + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private void moveIntoPlace(Path temp) throws IOException {
        try {
            Files.move(
                    temp,
                    path,
                    StandardCopyOption.ATOMIC_MOVE,
                    StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp, IOException failure) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
