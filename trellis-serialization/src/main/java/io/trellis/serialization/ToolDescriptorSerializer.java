package io.trellis.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.trellis.core.catalog.ToolDescriptor;
import java.io.IOException;
import java.io.Serial;

/// Writes a `ToolDescriptor` as `{name, description, inputSchema}`, the shape
/// servers return from `tools/list`.
///
/// @implNote Package-private. Registered by {@link TrellisJacksonModule}.
/// @see ToolDescriptorDeserializer for the inverse operation
class ToolDescriptorSerializer extends StdSerializer<ToolDescriptor> {

    @Serial private static final long serialVersionUID = -6042787394218410527L;

    ToolDescriptorSerializer() {
        super(ToolDescriptor.class);
    }

    @Override
    public void serialize(ToolDescriptor tool, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("name", tool.name());
        gen.writeStringField("description", tool.description());
        gen.writeObjectField("inputSchema", tool.inputSchema());
        gen.writeEndObject();
    }
}
