package io.trellis.core.registry;

import io.trellis.core.exception.PersistenceException;
import java.nio.file.Path;
import java.util.Optional;

/// Persistence backend for the {@link ServerRegistry}.
///
/// Implementations replace the whole document on every save. The registry
/// never touches files directly.
///
/// @see io.trellis.core.registry.ServerRegistry
public interface RegistryStore {

    /// Reads the persisted registry.
    ///
    /// A missing document is not an error and yields an empty snapshot.
    ///
    /// @return the stored servers and sets, never null
    /// @throws PersistenceException if the document exists but cannot be read or parsed
    RegistrySnapshot load();

    /// Replaces the persisted registry.
    ///
    /// @param snapshot everything to write, not null
    /// @throws PersistenceException if writing fails
    void save(RegistrySnapshot snapshot);

    /// Returns the file backing this store, if any.
    ///
    /// Used by {@link RegistryWatcher} to observe external edits.
    ///
    /// @return file location, or empty for non-file stores
    default Optional<Path> location() {
        return Optional.empty();
    }
}
