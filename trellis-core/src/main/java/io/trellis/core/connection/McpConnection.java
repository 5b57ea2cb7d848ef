package io.trellis.core.connection;

import io.trellis.core.catalog.ToolDescriptor;
import java.util.List;
import java.util.Map;

/// Handle bound to one live session with a remote tool server.
///
/// Obtained from {@link ConnectionManager#getClient(String)}. Implementations
/// wrap a transport (subprocess pipes, an SSE stream or an HTTP channel); the
/// wire encoding is theirs.
///
/// @see TransportStrategy for how connections are opened
public interface McpConnection {

    /// Lists all tools currently exposed by the server (network round-trip).
    ///
    /// @return tool descriptors in server order, never null
    /// @throws McpException if the listing fails
    List<ToolDescriptor> listTools() throws McpException;

    /// Invokes a tool.
    ///
    /// @param toolName the tool to call, not null
    /// @param arguments the merged tool arguments, not null
    /// @return the tool's structured result, unchanged
    /// @throws McpException of kind `EXECUTION_FAILED` if the invocation raises
    Map<String, Object> callTool(String toolName, Map<String, Object> arguments)
            throws McpException;

    /// Returns the server this connection belongs to.
    ///
    /// @return server name, never null
    String serverName();

    /// Returns whether the session is still usable. Local check, no I/O.
    ///
    /// @return true if connected
    boolean isConnected();

    /// Releases the transport: terminates the subprocess or closes the stream.
    void close();
}
