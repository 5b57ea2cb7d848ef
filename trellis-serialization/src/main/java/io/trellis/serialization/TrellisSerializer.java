package io.trellis.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/// Factory for the Jackson mapper shared by the registry and catalog files and
/// by the meta-tool wire layer.
///
/// ### Usage
/// {@snippet :
/// ObjectMapper mapper = TrellisSerializer.createMapper();
/// String json = TrellisSerializer.toJson(Map.of("status", "ok"));
/// }
///
/// @implNote Thread-safe. A new mapper is created per `createMapper()` call;
/// long-lived components create one and keep it.
///
/// @see TrellisJacksonModule for the registered type handlers
public final class TrellisSerializer {

    private TrellisSerializer() {}

    /// Serializes a value to pretty-printed JSON.
    ///
    /// @param value the value to serialize, may be null
    /// @return JSON text, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Object value) {
        try {
            return createMapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize value: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for Trellis files and messages.
    ///
    /// Registers:
    /// - `TrellisJacksonModule` for {@link io.trellis.core.catalog.ToolDescriptor}
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled so files written by newer versions still load
    /// - indented output, since both files are meant to be edited by hand
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new TrellisJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
