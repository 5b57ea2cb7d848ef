package io.trellis.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.trellis.core.catalog.ToolDescriptor;
import java.io.Serial;

/// Jackson `SimpleModule` registering the Trellis type handlers in one place.
///
/// - `ToolDescriptor`: `ToolDescriptorSerializer` / `ToolDescriptorDeserializer`,
///   fields `name`, `description`, `inputSchema`
///
/// Registry files are not bound through this module: their keys carry the
/// server and set names, so the {@link io.trellis.serialization.registry.RegistryCodec}
/// implementations walk the JSON tree directly.
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see TrellisSerializer for the mapper factory
public class TrellisJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3390719256461950482L;

    public TrellisJacksonModule() {
        super("TrellisJacksonModule");

        addSerializer(ToolDescriptor.class, new ToolDescriptorSerializer());
        addDeserializer(ToolDescriptor.class, new ToolDescriptorDeserializer());
    }
}
