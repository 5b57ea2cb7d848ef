package io.trellis.core.catalog;

import io.trellis.core.exception.PersistenceException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Offline index of every server's last-known tool list.
///
/// Entries are replaced wholesale whenever a live listing succeeds, so a
/// server that drops a tool never keeps a stale copy. The catalog answers
/// "what tools exist" without any live connection and never opens one itself.
///
/// ### Thread Safety
/// @implNote Thread-safe. Mutations and the save that follows them run under
/// the instance monitor, so overlapping updates for different servers are
/// written one after the other and none is lost.
///
/// @see ToolSearcher for the ranking used by {@link #search(String, int)}
public class ToolCatalog {

    private static final Logger logger = Logger.getLogger(ToolCatalog.class.getName());

    private final CatalogStore store;
    private final Map<String, List<ToolDescriptor>> entries = new LinkedHashMap<>();

    /// Creates a catalog and loads its content from the store.
    ///
    /// @param store persistence backend, not null
    public ToolCatalog(CatalogStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        try {
            store.load().forEach((server, tools) -> entries.put(server, List.copyOf(tools)));
            logger.fine("Loaded tool catalog with " + entries.size() + " servers");
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Could not load tool catalog, starting empty", e);
        }
    }

    /// Replaces the cached tools of one server and persists the catalog.
    ///
    /// @param serverName the server, not null
    /// @param tools the complete current tool list, not null
    public synchronized void updateServer(String serverName, List<ToolDescriptor> tools) {
        Objects.requireNonNull(serverName, "serverName must not be null");
        Objects.requireNonNull(tools, "tools must not be null");
        entries.put(serverName, List.copyOf(tools));
        persist();
    }

    /// Returns the cached tools of one server.
    ///
    /// @param serverName the server, not null
    /// @return cached tools, empty if the server was never indexed
    public synchronized List<ToolDescriptor> getTools(String serverName) {
        Objects.requireNonNull(serverName, "serverName must not be null");
        return entries.getOrDefault(serverName, List.of());
    }

    /// Returns whether a server has a non-empty cached entry.
    ///
    /// @param serverName the server, not null
    /// @return true if at least one tool is cached
    public boolean hasTools(String serverName) {
        return !getTools(serverName).isEmpty();
    }

    /// Returns every cached entry.
    ///
    /// @return immutable snapshot in insertion order, never null
    public synchronized Map<String, List<ToolDescriptor>> getAllTools() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    /// Drops the cached entry of one server and persists the catalog.
    ///
    /// @param serverName the server, not null
    /// @return true if an entry existed
    public synchronized boolean removeServer(String serverName) {
        Objects.requireNonNull(serverName, "serverName must not be null");
        if (entries.remove(serverName) == null) {
            return false;
        }
        persist();
        return true;
    }

    /// Ranks every cached tool against the query.
    ///
    /// @param query free-text query, may be null
    /// @param maxResults maximum number of hits
    /// @return hits tagged with source `catalog`, never null
    public List<SearchHit> search(String query, int maxResults) {
        return new ToolSearcher(getAllTools(), SearchHit.Source.CATALOG).search(query, maxResults);
    }

    private void persist() {
        try {
            store.save(new LinkedHashMap<>(entries));
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Could not save tool catalog, keeping in-memory state", e);
        }
    }
}
