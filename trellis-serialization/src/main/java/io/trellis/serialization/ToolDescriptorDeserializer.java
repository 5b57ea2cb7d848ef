package io.trellis.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.trellis.core.catalog.ToolDescriptor;
import java.io.IOException;
import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

/// Reads a `ToolDescriptor` from `{name, description, inputSchema}`.
///
/// `description` and `inputSchema` are optional. `input_schema` is accepted as
/// an alias since some servers and older catalog files use snake case.
///
/// @implNote Package-private. Registered by {@link TrellisJacksonModule}.
/// @see ToolDescriptorSerializer for the inverse operation
class ToolDescriptorDeserializer extends StdDeserializer<ToolDescriptor> {

    @Serial private static final long serialVersionUID = 1870521447106232385L;

    ToolDescriptorDeserializer() {
        super(ToolDescriptor.class);
    }

    @Override
    public ToolDescriptor deserialize(JsonParser p, DeserializationContext ctxt)
            throws IOException {
        JsonNode root = p.readValueAsTree();

        JsonNode name = root.get("name");
        if (name == null || !name.isTextual()) {
            throw JsonMappingException.from(p, "Tool entry has no name");
        }

        JsonNode schema =
                root.has("inputSchema") ? root.get("inputSchema") : root.get("input_schema");
        Map<String, Object> inputSchema = null;
        if (schema != null && schema.isObject()) {
            JavaType mapType =
                    ctxt.getTypeFactory()
                            .constructMapType(LinkedHashMap.class, String.class, Object.class);
            inputSchema = ctxt.readTreeAsValue(schema, mapType);
        }

        return new ToolDescriptor(name.asText(), root.path("description").asText(""), inputSchema);
    }
}
