package io.trellis.server.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.transport.ServerParameters;
import io.modelcontextprotocol.client.transport.StdioClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.TransportKind;

/// Spawns the server as a subprocess and talks to it over its stdin/stdout.
///
/// The definition's `env` is overlaid on the environment this process
/// inherited; `args` are passed in order.
public class StdioTransportStrategy extends SdkTransportStrategy {

    public StdioTransportStrategy(SdkClientOptions options, ObjectMapper mapper) {
        super(options, mapper);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.STDIO;
    }

    @Override
    protected McpClientTransport createTransport(ServerDefinition definition) {
        if (definition.command().isBlank()) {
            throw new IllegalArgumentException(
                    "Server '" + definition.name() + "' has no command to run");
        }
        ServerParameters parameters =
                ServerParameters.builder(definition.command())
                        .args(definition.args())
                        .env(definition.env())
                        .build();
        return new StdioClientTransport(parameters);
    }
}
