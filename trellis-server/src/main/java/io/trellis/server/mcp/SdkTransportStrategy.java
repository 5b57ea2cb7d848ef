package io.trellis.server.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import io.trellis.core.connection.McpConnection;
import io.trellis.core.connection.McpException;
import io.trellis.core.connection.TransportStrategy;
import io.trellis.core.registry.ServerDefinition;
import java.util.Objects;
import org.jboss.logging.Logger;

/// Base for the transport strategies backed by the MCP Java SDK.
///
/// Subclasses only build the SDK transport for a definition; this class wraps
/// it in a synchronous client, runs the `initialize` handshake and hands back
/// an {@link SdkMcpConnection}. A failed handshake closes the half-open client
/// and surfaces as {@link McpException.ErrorKind#HANDSHAKE_FAILED}.
///
/// @see StdioTransportStrategy
/// @see SseTransportStrategy
/// @see HttpTransportStrategy
public abstract class SdkTransportStrategy implements TransportStrategy {

    private static final Logger LOG = Logger.getLogger(SdkTransportStrategy.class);

    private final SdkClientOptions options;
    private final ObjectMapper mapper;

    protected SdkTransportStrategy(SdkClientOptions options, ObjectMapper mapper) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Builds the SDK transport for a server of this strategy's kind.
    ///
    /// @param definition the server, not null
    /// @return unstarted transport, never null
    /// @throws IllegalArgumentException if the definition lacks a field the transport needs
    protected abstract McpClientTransport createTransport(ServerDefinition definition);

    @Override
    public McpConnection connect(ServerDefinition definition) throws McpException {
        Objects.requireNonNull(definition, "definition must not be null");
        McpClientTransport transport;
        try {
            transport = createTransport(definition);
        } catch (IllegalArgumentException e) {
            throw McpException.handshakeFailed(definition.name(), e);
        }

        McpSyncClient client =
                McpClient.sync(transport)
                        .requestTimeout(options.requestTimeout())
                        .initializationTimeout(options.initializationTimeout())
                        .clientInfo(
                                new McpSchema.Implementation(
                                        options.clientName(), options.clientVersion()))
                        .build();
        try {
            McpSchema.InitializeResult result = client.initialize();
            LOG.debugv(
                    "Handshake with {0} complete, server reports {1}",
                    definition.name(),
                    result != null ? result.serverInfo() : "nothing");
        } catch (RuntimeException e) {
            closeAfterFailure(definition.name(), client);
            throw McpException.handshakeFailed(definition.name(), e);
        }
        return new SdkMcpConnection(definition.name(), client, mapper);
    }

    private static void closeAfterFailure(String serverName, McpSyncClient client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            LOG.debugv(e, "Ignoring close failure after failed handshake with {0}", serverName);
        }
    }
}
