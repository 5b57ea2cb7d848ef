package io.trellis.core.registry;

import io.trellis.core.exception.PersistenceException;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Owns the configured servers and the named sets that group them.
///
/// Every mutation is written through to the {@link RegistryStore} immediately.
/// Store failures never propagate: a failed load leaves the registry empty and
/// a failed save keeps the in-memory state, both with a logged warning.
///
/// ### Set resolution
/// {@link #getSet(String)} returns the direct members followed by the members
/// of every included set, in first-seen order without duplicates. Each set is
/// visited at most once per resolution, so `include_sets` cycles terminate.
///
/// ### Thread Safety
/// @implNote Thread-safe. All state is guarded by the instance monitor; reads
/// return immutable snapshots.
///
/// ### Usage
/// {@snippet :
/// ServerRegistry registry = new ServerRegistry(store);
/// registry.upsertServer(ServerDefinition.builder("weather").command("weather-mcp").build());
/// registry.upsertSet("travel", List.of("weather", "maps"), "Trip planning", List.of());
/// List<String> members = registry.getSet("travel").orElseThrow();
/// }
///
/// @see RegistryStore for persistence
/// @see RegistryWatcher for reloading on external edits
public class ServerRegistry {

    private static final Logger logger = Logger.getLogger(ServerRegistry.class.getName());

    private final RegistryStore store;
    private final Map<String, ServerDefinition> servers = new LinkedHashMap<>();
    private final Map<String, ServerSet> sets = new LinkedHashMap<>();

    /// Creates a registry and loads its initial content from the store.
    ///
    /// @param store persistence backend, not null
    public ServerRegistry(RegistryStore store) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        reload();
    }

    /// Replaces the in-memory content with what the store currently holds.
    ///
    /// @apiNote **Side effects**: discards unsaved in-memory state
    public synchronized void reload() {
        servers.clear();
        sets.clear();
        try {
            RegistrySnapshot snapshot = store.load();
            servers.putAll(snapshot.servers());
            sets.putAll(snapshot.sets());
            logger.fine(
                    "Loaded " + servers.size() + " servers and " + sets.size() + " sets");
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Could not load server registry, starting empty", e);
        }
    }

    // ========== Servers ==========

    /// Adds or replaces a server definition.
    ///
    /// @param definition the definition to store, not null
    /// @return true if the stored value changed, false for a no-op write
    public synchronized boolean upsertServer(ServerDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        if (definition.equals(servers.get(definition.name()))) {
            return false;
        }
        servers.put(definition.name(), definition);
        persist();
        return true;
    }

    /// Removes a server and drops it from every set's direct members.
    ///
    /// @param name server name, not null
    /// @return true if the server existed
    public synchronized boolean removeServer(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (servers.remove(name) == null) {
            return false;
        }
        sets.replaceAll((setName, set) -> set.without(name));
        persist();
        return true;
    }

    /// Looks up a server definition.
    ///
    /// @param name server name, not null
    /// @return the definition, or empty if not configured
    public synchronized Optional<ServerDefinition> getServer(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(servers.get(name));
    }

    /// Returns whether a server with this name is configured.
    ///
    /// @param name server name, may be null
    /// @return true if configured
    public synchronized boolean isConfigured(String name) {
        return name != null && servers.containsKey(name);
    }

    /// Lists configured servers in insertion order.
    ///
    /// @param enabledOnly whether to skip disabled servers
    /// @return immutable snapshot, never null
    public synchronized List<ServerDefinition> listServers(boolean enabledOnly) {
        return servers.values().stream().filter(s -> !enabledOnly || s.enabled()).toList();
    }

    /// Lists all configured servers.
    ///
    /// @return immutable snapshot, never null
    public List<ServerDefinition> listServers() {
        return listServers(false);
    }

    /// Marks a server as enabled.
    ///
    /// @param name server name, not null
    /// @return false if the server is not configured
    public boolean enableServer(String name) {
        return setEnabled(name, true);
    }

    /// Marks a server as disabled. Disabled servers can still be connected explicitly.
    ///
    /// @param name server name, not null
    /// @return false if the server is not configured
    public boolean disableServer(String name) {
        return setEnabled(name, false);
    }

    private synchronized boolean setEnabled(String name, boolean enabled) {
        Objects.requireNonNull(name, "name must not be null");
        ServerDefinition current = servers.get(name);
        if (current == null) {
            return false;
        }
        servers.put(name, current.withEnabled(enabled));
        persist();
        return true;
    }

    /// Returns the server map as currently held.
    ///
    /// @return immutable copy in insertion order, never null
    public synchronized Map<String, ServerDefinition> serverMap() {
        return snapshot().servers();
    }

    // ========== Sets ==========

    /// Creates or replaces a set.
    ///
    /// ### Contracts
    /// - **Precondition**: `name` not blank
    /// - **Precondition**: at least one of `members` or `includeSets` non-empty
    ///
    /// @param name set name, not null
    /// @param members direct members, may be null
    /// @param description purpose of the set, may be null
    /// @param includeSets other sets to compose, may be null
    /// @throws IllegalArgumentException if a precondition is violated
    public synchronized void upsertSet(
            String name, List<String> members, String description, List<String> includeSets) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("set name must not be blank");
        }
        boolean hasServers = members != null && !members.isEmpty();
        boolean hasIncludes = includeSets != null && !includeSets.isEmpty();
        if (!hasServers && !hasIncludes) {
            throw new IllegalArgumentException(
                    "set '" + name + "' needs servers or include_sets");
        }
        sets.put(name, new ServerSet(name, description, members, includeSets));
        persist();
    }

    /// Deletes a set. Sets including it are left untouched.
    ///
    /// @param name set name, not null
    /// @return true if the set existed
    public synchronized boolean removeSet(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (sets.remove(name) == null) {
            return false;
        }
        persist();
        return true;
    }

    /// Resolves a set to its full, de-duplicated membership.
    ///
    /// @param name set name, not null
    /// @return resolved server names in first-seen order, or empty if the set is undefined
    public synchronized Optional<List<String>> getSet(String name) {
        Objects.requireNonNull(name, "name must not be null");
        if (!sets.containsKey(name)) {
            return Optional.empty();
        }
        Set<String> members = new LinkedHashSet<>();
        resolve(name, new HashSet<>(), members);
        return Optional.of(List.copyOf(members));
    }

    private void resolve(String name, Set<String> visited, Set<String> members) {
        if (!visited.add(name)) {
            return;
        }
        ServerSet set = sets.get(name);
        if (set == null) {
            return;
        }
        members.addAll(set.servers());
        for (String included : set.includeSets()) {
            resolve(included, visited, members);
        }
    }

    /// Returns the raw definition of a set without resolving includes.
    ///
    /// @param name set name, not null
    /// @return the stored set, or empty if undefined
    public synchronized Optional<ServerSet> getSetDetails(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(sets.get(name));
    }

    /// Lists every set in normalized form.
    ///
    /// @return immutable copy in insertion order, never null
    public synchronized List<ServerSet> listSets() {
        return List.copyOf(sets.values());
    }

    /// Returns the full persisted view of this registry.
    ///
    /// @return immutable snapshot, never null
    public synchronized RegistrySnapshot snapshot() {
        return new RegistrySnapshot(servers, sets);
    }

    private void persist() {
        try {
            store.save(snapshot());
        } catch (PersistenceException e) {
            logger.log(Level.WARNING, "Could not save server registry, keeping in-memory state", e);
        }
    }
}
