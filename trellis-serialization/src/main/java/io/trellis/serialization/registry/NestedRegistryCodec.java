package io.trellis.serialization.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trellis.core.registry.RegistrySnapshot;
import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.TransportKind;
import java.util.Map;

/// The `{ "mcp": { "servers": ..., "sets": ... } }` layout.
///
/// Entries are keyed by server name and carry no `name` field. Only the fields
/// of the entry's transport are read and written:
///
/// | type      | Fields written                            |
/// |-----------|-------------------------------------------|
/// | (stdio)   | command, args, env?, enabled              |
/// | sse, http | type, url, headers?, auth?, env?, enabled |
///
/// `type` is omitted for stdio. Optional fields (`?`) are written only when
/// non-empty; `enabled` is always written.
public class NestedRegistryCodec extends AbstractRegistryCodec {

    @Override
    public RegistryFormat format() {
        return RegistryFormat.NESTED;
    }

    @Override
    public boolean accepts(JsonNode root) {
        return root.path("mcp").has("servers");
    }

    @Override
    public RegistrySnapshot read(JsonNode root) {
        JsonNode mcp = root.get("mcp");
        Map<String, ServerDefinition> servers =
                readServers(mcp.get("servers"), NestedRegistryCodec::readServer);
        return new RegistrySnapshot(servers, readSets(mcp.get("sets")));
    }

    private static ServerDefinition readServer(String name, JsonNode config) {
        TransportKind transport = transport(name, text(config, "type"));
        ServerDefinition.Builder builder =
                ServerDefinition.builder(name)
                        .transport(transport)
                        .env(stringMap(config.get("env")))
                        .enabled(config.path("enabled").asBoolean(true));
        if (transport.isRemote()) {
            builder.url(text(config, "url"))
                    .headers(stringMap(config.get("headers")))
                    .auth(text(config, "auth"));
        } else {
            builder.command(text(config, "command")).args(strings(config.get("args")));
        }
        return builder.build();
    }

    @Override
    public ObjectNode write(RegistrySnapshot snapshot, ObjectMapper mapper) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode mcp = root.putObject("mcp");
        ObjectNode servers = mcp.putObject("servers");
        for (ServerDefinition server : snapshot.servers().values()) {
            writeServer(servers.putObject(server.name()), server);
        }
        writeSets(mcp, snapshot.sets());
        return root;
    }

    private static void writeServer(ObjectNode node, ServerDefinition server) {
        if (server.transport().isRemote()) {
            node.put("type", server.transport().wireName());
            node.put("url", server.url());
            if (!server.headers().isEmpty()) {
                putStringMap(node.putObject("headers"), server.headers());
            }
            if (server.hasAuth()) {
                node.put("auth", server.auth());
            }
        } else {
            node.put("command", server.command());
            putStrings(node.putArray("args"), server.args());
        }
        if (!server.env().isEmpty()) {
            putStringMap(node.putObject("env"), server.env());
        }
        node.put("enabled", server.enabled());
    }
}
