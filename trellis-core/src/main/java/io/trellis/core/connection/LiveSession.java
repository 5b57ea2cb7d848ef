package io.trellis.core.connection;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

/// One session with one server, from the start of its handshake until it is
/// closed or fails.
///
/// A session is created in {@link ConnectionState#CONNECTING} and settles
/// exactly once: to `CONNECTED` with a connection, to `FAILED`, or to `CLOSED`
/// when it is disconnected first. A connection that arrives after the session
/// was closed is rejected by {@link #complete(McpConnection)} and must be
/// closed by the caller.
///
/// @implNote Thread-safe. State changes run under the instance monitor; the
/// transport itself is closed outside it.
final class LiveSession {

    private final String serverName;
    private final CompletableFuture<McpConnection> ready = new CompletableFuture<>();
    private ConnectionState state = ConnectionState.CONNECTING;
    private McpConnection connection;

    LiveSession(String serverName) {
        this.serverName = Objects.requireNonNull(serverName, "serverName must not be null");
    }

    String serverName() {
        return serverName;
    }

    synchronized ConnectionState state() {
        return state;
    }

    /// Returns the connection if the session is connected.
    ///
    /// @return connection, or null while connecting or after close
    synchronized McpConnection connection() {
        return state == ConnectionState.CONNECTED ? connection : null;
    }

    /// Settles the session as connected.
    ///
    /// @param established the initialized connection, not null
    /// @return false if the session is no longer connecting
    synchronized boolean complete(McpConnection established) {
        if (state != ConnectionState.CONNECTING) {
            return false;
        }
        connection = Objects.requireNonNull(established, "established must not be null");
        state = ConnectionState.CONNECTED;
        ready.complete(established);
        return true;
    }

    synchronized void fail(McpException cause) {
        if (state != ConnectionState.CONNECTING) {
            return;
        }
        state = ConnectionState.FAILED;
        ready.completeExceptionally(cause);
    }

    /// Closes the session and its connection, if any. Idempotent.
    void close() {
        McpConnection toClose;
        synchronized (this) {
            if (state == ConnectionState.CLOSED || state == ConnectionState.FAILED) {
                return;
            }
            state = ConnectionState.CLOSED;
            toClose = connection;
            connection = null;
            ready.completeExceptionally(McpException.notConnected(serverName));
        }
        if (toClose != null) {
            toClose.close();
        }
    }

    /// Blocks until the handshake settles.
    ///
    /// @return the connection
    /// @throws McpException if the handshake failed or the session was closed first
    McpConnection await() throws McpException {
        try {
            return ready.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof McpException mcp) {
                throw mcp;
            }
            throw McpException.handshakeFailed(serverName, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw McpException.handshakeFailed(serverName, e);
        }
    }
}
