package io.trellis.server;

import io.trellis.core.catalog.ToolCatalog;
import io.trellis.core.connection.ConnectionManager;
import io.trellis.core.registry.RegistryWatcher;
import io.trellis.core.registry.ServerRegistry;
import io.trellis.server.config.RouterConfig;
import io.trellis.server.dispatch.MetaToolDispatcher;
import io.trellis.server.rpc.MetaToolServer;
import java.io.IOException;
import java.util.Optional;
import org.jboss.logging.Logger;

/// Container holding every router component of one process.
///
/// ### Contracts
/// - **Postcondition**: all getters return the instances passed to the constructor
/// - **Invariant**: component references are immutable after construction
///
/// @apiNote Create instances via {@link TrellisFactory} rather than direct construction.
public final class TrellisEnvironment implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(TrellisEnvironment.class);

    private final RouterConfig config;
    private final ServerRegistry registry;
    private final ToolCatalog catalog;
    private final ConnectionManager connections;
    private final MetaToolDispatcher dispatcher;
    private final MetaToolServer server;
    private final RegistryWatcher watcher;

    /// @param config resolved configuration, not null
    /// @param registry configured servers and sets, not null
    /// @param catalog offline tool index, not null
    /// @param connections live sessions, not null
    /// @param dispatcher meta-tool router, not null
    /// @param server JSON-RPC front end, not null
    /// @param watcher registry file watcher, may be null when watching is off
    public TrellisEnvironment(
            RouterConfig config,
            ServerRegistry registry,
            ToolCatalog catalog,
            ConnectionManager connections,
            MetaToolDispatcher dispatcher,
            MetaToolServer server,
            RegistryWatcher watcher) {
        this.config = config;
        this.registry = registry;
        this.catalog = catalog;
        this.connections = connections;
        this.dispatcher = dispatcher;
        this.server = server;
        this.watcher = watcher;
    }

    public RouterConfig getConfig() {
        return config;
    }

    public ServerRegistry getRegistry() {
        return registry;
    }

    public ToolCatalog getCatalog() {
        return catalog;
    }

    public ConnectionManager getConnections() {
        return connections;
    }

    public MetaToolDispatcher getDispatcher() {
        return dispatcher;
    }

    public MetaToolServer getServer() {
        return server;
    }

    /// Returns the registry file watcher.
    ///
    /// @return the watcher, or empty when watching is off or could not start
    public Optional<RegistryWatcher> getWatcher() {
        return Optional.ofNullable(watcher);
    }

    /// Stops the watcher, disconnects every server and stops the connect threads.
    ///
    /// @apiNote **Side effects**: closes every live session. Idempotent.
    @Override
    public void close() {
        if (watcher != null) {
            try {
                watcher.close();
            } catch (IOException e) {
                LOG.warnv(e, "Could not stop registry watcher");
            }
        }
        connections.close();
    }
}
