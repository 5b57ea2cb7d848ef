package io.trellis.core.connection;

import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.TransportKind;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/// Owns the live sessions, at most one per server name.
///
/// Connecting is always explicit. {@link #connect(ServerDefinition)} returns as
/// soon as the session is registered as `CONNECTING` and runs the handshake on
/// a background thread through the {@link TransportStrategy} registered for
/// the server's transport. Nothing in this class connects on demand: asking
/// for the client of a server that is not connected fails with
/// {@link McpException.ErrorKind#NOT_CONNECTED}.
///
/// ### Lifecycle per name
/// `absent -> CONNECTING -> CONNECTED -> (disconnect) absent`. A failed
/// handshake removes the entry again; a retry starts a fresh session. A server
/// disconnected while its handshake is still running is closed as soon as the
/// handshake returns.
///
/// ### Thread Safety
/// @implNote Thread-safe. Sessions live in a {@link ConcurrentHashMap}; every
/// transition goes through a per-key atomic `compute` or `remove(key, value)`,
/// so two operations on the same name are serialized and operations on
/// different names never block each other.
///
/// ### Usage
/// {@snippet :
/// ConnectionManager manager = new ConnectionManager(List.of(stdio, sse, http));
/// manager.connect(definition);               // returns CONNECTING
/// McpConnection client = manager.getClient("weather"); // once CONNECTED
/// manager.disconnect("weather");
/// }
///
/// @see TransportStrategy for opening connections
public class ConnectionManager implements AutoCloseable {

    private static final Logger logger = Logger.getLogger(ConnectionManager.class.getName());

    private final Map<TransportKind, TransportStrategy> strategies =
            new EnumMap<>(TransportKind.class);
    private final Map<String, LiveSession> sessions = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    /// Creates a manager with its own pool of daemon connect threads.
    ///
    /// @param strategies one strategy per transport kind, not null
    public ConnectionManager(Collection<? extends TransportStrategy> strategies) {
        this(strategies, Executors.newCachedThreadPool(new ConnectThreadFactory()));
    }

    /// Creates a manager running handshakes on the given executor.
    ///
    /// @param strategies one strategy per transport kind, not null
    /// @param executor runs handshakes; shut down by {@link #close()}, not null
    /// @throws IllegalArgumentException if two strategies claim the same kind
    public ConnectionManager(
            Collection<? extends TransportStrategy> strategies, ExecutorService executor) {
        Objects.requireNonNull(strategies, "strategies must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        for (TransportStrategy strategy : strategies) {
            if (this.strategies.putIfAbsent(strategy.kind(), strategy) != null) {
                throw new IllegalArgumentException(
                        "Duplicate transport strategy for " + strategy.kind().wireName());
            }
        }
    }

    /// Starts connecting to a server without waiting for the handshake.
    ///
    /// A no-op if the server is already connecting or connected.
    ///
    /// @param definition the server to connect, not null
    /// @return the state right after the call: `CONNECTING` or `CONNECTED`
    /// @throws McpException of kind `HANDSHAKE_FAILED` if no strategy handles the transport
    public ConnectionState connect(ServerDefinition definition) throws McpException {
        return start(definition).state();
    }

    /// Connects to a server and blocks until the handshake settles.
    ///
    /// Returns the existing connection if the server is already connected, and
    /// joins a handshake already in progress.
    ///
    /// @param definition the server to connect, not null
    /// @return the live connection, never null
    /// @throws McpException of kind `HANDSHAKE_FAILED` if the handshake fails, or
    ///     `NOT_CONNECTED` if the server is disconnected before it completes
    public McpConnection connectAndWait(ServerDefinition definition) throws McpException {
        return start(definition).await();
    }

    private LiveSession start(ServerDefinition definition) {
        Objects.requireNonNull(definition, "definition must not be null");
        String name = definition.name();
        TransportStrategy strategy = strategies.get(definition.transport());
        if (strategy == null) {
            throw McpException.handshakeFailed(
                    name,
                    new IllegalStateException(
                            "No transport registered for " + definition.transport().wireName()));
        }

        LiveSession[] created = new LiveSession[1];
        LiveSession session =
                sessions.compute(
                        name,
                        (key, existing) -> {
                            if (existing != null && existing.state().isActive()) {
                                return existing;
                            }
                            created[0] = new LiveSession(key);
                            return created[0];
                        });

        if (created[0] != null) {
            logger.info(
                    "Connecting to server '" + name + "' over "
                            + definition.transport().wireName());
            try {
                executor.execute(() -> handshake(created[0], definition, strategy));
            } catch (RejectedExecutionException e) {
                sessions.remove(name, created[0]);
                created[0].fail(McpException.handshakeFailed(name, e));
            }
        }
        return session;
    }

    private void handshake(
            LiveSession session, ServerDefinition definition, TransportStrategy strategy) {
        String name = definition.name();
        McpConnection connection;
        try {
            connection = strategy.connect(definition);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to connect to server '" + name + "'", e);
            sessions.remove(name, session);
            session.fail(
                    e instanceof McpException mcp ? mcp : McpException.handshakeFailed(name, e));
            return;
        }

        if (session.complete(connection)) {
            logger.info("Connected to server '" + name + "'");
        } else {
            logger.info("Server '" + name + "' was disconnected while connecting, closing");
            closeConnection(name, connection);
        }
    }

    /// Returns the connection of a connected server.
    ///
    /// @param serverName the server, not null
    /// @return live connection, never null
    /// @throws McpException of kind `NOT_CONNECTED` if the server is absent or still connecting
    public McpConnection getClient(String serverName) throws McpException {
        Objects.requireNonNull(serverName, "serverName must not be null");
        LiveSession session = sessions.get(serverName);
        McpConnection connection = session != null ? session.connection() : null;
        if (connection == null) {
            throw McpException.notConnected(serverName);
        }
        return connection;
    }

    /// Closes the session of one server. Idempotent.
    ///
    /// @param serverName the server, not null
    /// @return true if a session existed
    public boolean disconnect(String serverName) {
        Objects.requireNonNull(serverName, "serverName must not be null");
        LiveSession session = sessions.remove(serverName);
        if (session == null) {
            return false;
        }
        try {
            session.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error closing connection to server '" + serverName + "'", e);
        }
        logger.info("Disconnected server '" + serverName + "'");
        return true;
    }

    /// Closes every session. A failure closing one does not stop the others.
    ///
    /// @return number of sessions closed
    public int disconnectAll() {
        int closed = 0;
        for (String name : List.copyOf(sessions.keySet())) {
            if (disconnect(name)) {
                closed++;
            }
        }
        return closed;
    }

    /// Lists servers that are connecting or connected.
    ///
    /// @return names in alphabetical order, never null
    public List<String> listActive() {
        return sessions.values().stream()
                .filter(s -> s.state().isActive())
                .map(LiveSession::serverName)
                .sorted()
                .toList();
    }

    /// Returns whether a server has a completed handshake.
    ///
    /// @param serverName the server, may be null
    /// @return true only in state `CONNECTED`
    public boolean isLive(String serverName) {
        if (serverName == null) {
            return false;
        }
        LiveSession session = sessions.get(serverName);
        return session != null && session.state() == ConnectionState.CONNECTED;
    }

    /// Returns the current state of a server's session.
    ///
    /// @param serverName the server, not null
    /// @return state, or empty if no session exists
    public Optional<ConnectionState> state(String serverName) {
        Objects.requireNonNull(serverName, "serverName must not be null");
        return Optional.ofNullable(sessions.get(serverName)).map(LiveSession::state);
    }

    /// Disconnects everything and stops the connect threads.
    @Override
    public void close() {
        int closed = disconnectAll();
        executor.shutdownNow();
        logger.fine("Connection manager closed, " + closed + " sessions stopped");
    }

    private static void closeConnection(String name, McpConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Error closing connection to server '" + name + "'", e);
        }
    }

    private static final class ConnectThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "trellis-connect-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
