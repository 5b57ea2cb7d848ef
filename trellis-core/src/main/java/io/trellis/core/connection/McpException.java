package io.trellis.core.connection;

import java.io.Serial;
import java.util.Objects;

/// Exception thrown when routing a call to a remote tool server fails.
///
/// Every instance carries an {@link ErrorKind} so callers can tell, for
/// example, a server that is configured but not connected from one that is not
/// configured at all, and answer with the right fix.
///
/// Use the static factories; they fill in the identifying context (server,
/// action or parameter block) that a caller needs to retry correctly.
public class McpException extends RuntimeException {

    @Serial private static final long serialVersionUID = 5486229795475543465L;

    /// Failure categories surfaced to the calling agent.
    public enum ErrorKind {
        /// Server or set name unknown to the registry.
        NOT_CONFIGURED,
        /// Server is configured but has no live session.
        NOT_CONNECTED,
        /// The connect handshake with the remote server failed.
        HANDSHAKE_FAILED,
        /// The server exposes no tool with the requested name.
        ACTION_NOT_FOUND,
        /// A parameter block could not be parsed.
        MALFORMED_PARAMETERS,
        /// The remote tool invocation raised an error.
        EXECUTION_FAILED
    }

    private final ErrorKind kind;
    private final String serverName;
    private final String toolName;
    private final String parameterBlock;

    private McpException(
            ErrorKind kind,
            String message,
            Throwable cause,
            String serverName,
            String toolName,
            String parameterBlock) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.serverName = serverName;
        this.toolName = toolName;
        this.parameterBlock = parameterBlock;
    }

    /// Creates an exception of the given kind with a message only.
    ///
    /// @param kind failure category, not null
    /// @param message the error message
    public McpException(ErrorKind kind, String message) {
        this(kind, message, null, null, null, null);
    }

    /// Creates an exception of the given kind with a message and cause.
    ///
    /// @param kind failure category, not null
    /// @param message the error message
    /// @param cause the underlying cause
    public McpException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, cause, null, null, null);
    }

    /// Returns the failure category.
    ///
    /// @return kind, never null
    public ErrorKind getKind() {
        return kind;
    }

    /// Returns the server involved.
    ///
    /// @return server name, or null if not server-specific
    public String getServerName() {
        return serverName;
    }

    /// Returns the name of the tool involved.
    ///
    /// @return tool name, or null if not tool-specific
    public String getToolName() {
        return toolName;
    }

    /// Returns the parameter block that failed to parse.
    ///
    /// @return block name such as `body_schema`, or null
    public String getParameterBlock() {
        return parameterBlock;
    }

    public static McpException notConfigured(String serverName) {
        return new McpException(
                ErrorKind.NOT_CONFIGURED,
                "Server '" + serverName + "' is not configured",
                null,
                serverName,
                null,
                null);
    }

    public static McpException notConnected(String serverName) {
        return new McpException(
                ErrorKind.NOT_CONNECTED,
                "Server '" + serverName + "' is not connected",
                null,
                serverName,
                null,
                null);
    }

    /// Creates an exception for a failed connect handshake.
    ///
    /// @param serverName the server being connected
    /// @param cause the underlying cause
    /// @return new exception
    public static McpException handshakeFailed(String serverName, Throwable cause) {
        String detail =
                cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : "";
        return new McpException(
                ErrorKind.HANDSHAKE_FAILED,
                "Failed to connect to server '" + serverName + "'" + detail,
                cause,
                serverName,
                null,
                null);
    }

    public static McpException actionNotFound(String serverName, String toolName) {
        return new McpException(
                ErrorKind.ACTION_NOT_FOUND,
                "Action '" + toolName + "' not found on server '" + serverName + "'",
                null,
                serverName,
                toolName,
                null);
    }

    /// Creates an exception for a parameter block that is not valid JSON.
    ///
    /// @param parameterBlock the offending block, e.g. `query_params`
    /// @param cause the parse error
    /// @return new exception
    public static McpException malformedParameters(String parameterBlock, Throwable cause) {
        String detail = cause != null ? cause.getMessage() : "not a JSON object";
        return new McpException(
                ErrorKind.MALFORMED_PARAMETERS,
                "Invalid JSON in " + parameterBlock + ": " + detail,
                cause,
                null,
                null,
                parameterBlock);
    }

    /// Creates an exception for a remote tool invocation failure.
    ///
    /// @param serverName the server that ran the tool
    /// @param toolName the tool that failed
    /// @param cause the underlying cause
    /// @return new exception
    public static McpException executionFailed(
            String serverName, String toolName, Throwable cause) {
        String detail =
                cause != null && cause.getMessage() != null ? cause.getMessage() : "unknown error";
        return new McpException(
                ErrorKind.EXECUTION_FAILED,
                "Tool '" + toolName + "' execution failed: " + detail,
                cause,
                serverName,
                toolName,
                null);
    }
}
