package io.trellis.server.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import io.trellis.core.catalog.ToolDescriptor;
import io.trellis.core.connection.McpConnection;
import io.trellis.core.connection.McpException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/// {@link McpConnection} over an initialized SDK {@link McpSyncClient}.
///
/// `listTools` follows pagination cursors until the server reports no more
/// pages. `callTool` returns the SDK's `CallToolResult` converted to a map
/// as-is, so `content`, `structuredContent` and `isError` reach the caller
/// exactly as the server sent them.
///
/// @implNote Thread-safe to the extent the SDK client is; the closed flag is
/// volatile.
public class SdkMcpConnection implements McpConnection {

    private static final Logger LOG = Logger.getLogger(SdkMcpConnection.class);

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final String serverName;
    private final McpSyncClient client;
    private final ObjectMapper mapper;
    private volatile boolean closed;

    /// @param serverName the server this client talks to, not null
    /// @param client initialized client, not null
    /// @param mapper converts SDK records to maps, not null
    public SdkMcpConnection(String serverName, McpSyncClient client, ObjectMapper mapper) {
        this.serverName = Objects.requireNonNull(serverName, "serverName must not be null");
        this.client = Objects.requireNonNull(client, "client must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    @Override
    public List<ToolDescriptor> listTools() throws McpException {
        List<ToolDescriptor> tools = new ArrayList<>();
        try {
            McpSchema.ListToolsResult page = client.listTools();
            while (true) {
                page.tools().forEach(tool -> tools.add(toDescriptor(tool)));
                String cursor = page.nextCursor();
                if (cursor == null || cursor.isEmpty()) {
                    break;
                }
                page = client.listTools(cursor);
            }
        } catch (RuntimeException e) {
            throw new McpException(
                    McpException.ErrorKind.EXECUTION_FAILED,
                    "Failed to list tools of server '" + serverName + "': " + e.getMessage(),
                    e);
        }
        LOG.debugv("Server {0} lists {1} tools", serverName, tools.size());
        return tools;
    }

    private ToolDescriptor toDescriptor(McpSchema.Tool tool) {
        Map<String, Object> schema =
                tool.inputSchema() != null
                        ? mapper.convertValue(tool.inputSchema(), OBJECT_MAP)
                        : null;
        return new ToolDescriptor(tool.name(), tool.description(), schema);
    }

    @Override
    public Map<String, Object> callTool(String toolName, Map<String, Object> arguments)
            throws McpException {
        Objects.requireNonNull(toolName, "toolName must not be null");
        Objects.requireNonNull(arguments, "arguments must not be null");
        try {
            McpSchema.CallToolResult result =
                    client.callTool(new McpSchema.CallToolRequest(toolName, arguments));
            return mapper.convertValue(result, OBJECT_MAP);
        } catch (RuntimeException e) {
            throw McpException.executionFailed(serverName, toolName, e);
        }
    }

    @Override
    public String serverName() {
        return serverName;
    }

    @Override
    public boolean isConnected() {
        return !closed && client.isInitialized();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (!client.closeGracefully()) {
            LOG.debugv("Graceful close of {0} timed out, forcing", serverName);
            client.close();
        }
    }
}
