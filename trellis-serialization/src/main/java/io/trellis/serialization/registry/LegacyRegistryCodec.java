package io.trellis.serialization.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trellis.core.registry.RegistrySnapshot;
import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.TransportKind;
import java.util.Map;

/// The flat `{ "servers": ..., "sets": ... }` layout.
///
/// Every entry is the full record including `name`, with all fields written
/// regardless of transport. On read the map key is authoritative for the
/// name. An entry with an empty `type` but a `url` is read as `sse`; a missing
/// `type` means stdio.
public class LegacyRegistryCodec extends AbstractRegistryCodec {

    @Override
    public RegistryFormat format() {
        return RegistryFormat.LEGACY;
    }

    @Override
    public boolean accepts(JsonNode root) {
        return root.has("servers");
    }

    @Override
    public RegistrySnapshot read(JsonNode root) {
        Map<String, ServerDefinition> servers =
                readServers(root.get("servers"), LegacyRegistryCodec::readServer);
        return new RegistrySnapshot(servers, readSets(root.get("sets")));
    }

    private static ServerDefinition readServer(String name, JsonNode config) {
        String type = text(config, "type");
        TransportKind transport =
                type != null && type.isBlank() && text(config, "url") != null
                        ? TransportKind.SSE
                        : transport(name, type);
        return ServerDefinition.builder(name)
                .transport(transport)
                .command(text(config, "command"))
                .args(strings(config.get("args")))
                .env(stringMap(config.get("env")))
                .url(text(config, "url"))
                .headers(stringMap(config.get("headers")))
                .auth(text(config, "auth"))
                .enabled(config.path("enabled").asBoolean(true))
                .build();
    }

    @Override
    public ObjectNode write(RegistrySnapshot snapshot, ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode servers = root.putObject("servers");
        for (ServerDefinition server : snapshot.servers().values()) {
            ObjectNode node = servers.putObject(server.name());
            node.put("name", server.name());
            node.put("type", server.transport().wireName());
            node.put("command", server.command());
            putStrings(node.putArray("args"), server.args());
            putStringMap(node.putObject("env"), server.env());
            node.put("url", server.url());
            putStringMap(node.putObject("headers"), server.headers());
            node.put("auth", server.auth());
            node.put("enabled", server.enabled());
        }
        writeSets(root, snapshot.sets());
        return root;
    }
}
