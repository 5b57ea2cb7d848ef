package io.trellis.core.connection;

import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.TransportKind;

/// Opens connections for one {@link TransportKind}.
///
/// The {@link ConnectionManager} holds exactly one strategy per kind and picks
/// it from {@link ServerDefinition#transport()}; nothing else branches on the
/// transport.
///
/// @see McpConnection for the connection interface
public interface TransportStrategy {

    /// Returns the transport this strategy handles.
    ///
    /// @return transport kind, never null
    TransportKind kind();

    /// Opens a connection and completes the protocol handshake.
    ///
    /// Blocking; the connection manager calls it from a background thread.
    ///
    /// @param definition the server to connect to, not null
    /// @return an initialized connection, never null
    /// @throws McpException of kind `HANDSHAKE_FAILED` if the server cannot be reached
    McpConnection connect(ServerDefinition definition) throws McpException;
}
