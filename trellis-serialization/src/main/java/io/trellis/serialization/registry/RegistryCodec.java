package io.trellis.serialization.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trellis.core.registry.RegistrySnapshot;

/// Converts between one {@link RegistryFormat} layout and a {@link RegistrySnapshot}.
///
/// @see JsonRegistryStore for format sniffing on load
public interface RegistryCodec {

    RegistryFormat format();

    /// Returns whether a document has this codec's structure.
    ///
    /// @param root parsed document, not null
    /// @return true if {@link #read(JsonNode)} should be used for it
    boolean accepts(JsonNode root);

    /// Reads a document this codec accepts. Server entries that cannot be read
    /// are logged and left out.
    ///
    /// @param root parsed document, not null
    /// @return snapshot, never null
    RegistrySnapshot read(JsonNode root);

    /// Writes a snapshot in this codec's layout.
    ///
    /// @param snapshot registry content, not null
    /// @param mapper node factory, not null
    /// @return document root, never null
    ObjectNode write(RegistrySnapshot snapshot, ObjectMapper mapper);
}
