package io.trellis.core.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Immutable view of everything a {@link RegistryStore} persists.
///
/// Both maps keep insertion order so files are rewritten in a stable order.
///
/// @param servers server definitions by name, never null
/// @param sets set definitions by name, never null
public record RegistrySnapshot(Map<String, ServerDefinition> servers, Map<String, ServerSet> sets) {

    /// Compact constructor with defensive copies.
    public RegistrySnapshot {
        Objects.requireNonNull(servers, "servers must not be null");
        Objects.requireNonNull(sets, "sets must not be null");
        servers = Collections.unmodifiableMap(new LinkedHashMap<>(servers));
        sets = Collections.unmodifiableMap(new LinkedHashMap<>(sets));
    }

    /// Returns a snapshot with no servers and no sets.
    ///
    /// @return empty snapshot, never null
    public static RegistrySnapshot empty() {
        return new RegistrySnapshot(Map.of(), Map.of());
    }
}
