package io.trellis.core.catalog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Schema of one tool exposed by a remote server.
///
/// This is both the live result of a `tools/list` round-trip and the unit the
/// {@link ToolCatalog} caches.
///
/// @param name tool name, unique within its server, not null
/// @param description human-readable description, never null (may be empty)
/// @param inputSchema JSON schema of the arguments as nested maps, never null
public record ToolDescriptor(String name, String description, Map<String, Object> inputSchema) {

    /// Compact constructor with validation.
    public ToolDescriptor {
        Objects.requireNonNull(name, "name must not be null");
        description = description != null ? description : "";
        inputSchema =
                inputSchema != null
                        ? Collections.unmodifiableMap(new LinkedHashMap<>(inputSchema))
                        : Map.of();
    }

    /// Creates a descriptor with an empty input schema.
    ///
    /// @param name tool name, not null
    /// @param description description, may be null
    /// @return new descriptor, never null
    public static ToolDescriptor of(String name, String description) {
        return new ToolDescriptor(name, description, Map.of());
    }
}
