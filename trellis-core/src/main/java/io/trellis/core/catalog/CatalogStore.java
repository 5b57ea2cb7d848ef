package io.trellis.core.catalog;

import io.trellis.core.exception.PersistenceException;
import java.util.List;
import java.util.Map;

/// Persistence backend for the {@link ToolCatalog}.
///
/// The whole mapping is written on every save.
public interface CatalogStore {

    /// Reads the cached tool lists.
    ///
    /// @return server name to tool list, never null (empty if nothing is stored)
    /// @throws PersistenceException if the document exists but cannot be read or parsed
    Map<String, List<ToolDescriptor>> load();

    /// Replaces the cached tool lists.
    ///
    /// @param catalog server name to tool list, not null
    /// @throws PersistenceException if writing fails
    void save(Map<String, List<ToolDescriptor>> catalog);
}
