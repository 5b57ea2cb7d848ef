package io.trellis.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellis.core.catalog.CatalogStore;
import io.trellis.core.catalog.ToolCatalog;
import io.trellis.core.connection.ConnectionManager;
import io.trellis.core.connection.TransportStrategy;
import io.trellis.core.registry.RegistryStore;
import io.trellis.core.registry.RegistryWatcher;
import io.trellis.core.registry.ServerRegistry;
import io.trellis.serialization.TrellisSerializer;
import io.trellis.serialization.catalog.JsonCatalogStore;
import io.trellis.serialization.registry.JsonRegistryStore;
import io.trellis.server.config.RouterConfig;
import io.trellis.server.dispatch.MetaToolDispatcher;
import io.trellis.server.mcp.HttpTransportStrategy;
import io.trellis.server.mcp.SdkClientOptions;
import io.trellis.server.mcp.SseTransportStrategy;
import io.trellis.server.mcp.StdioTransportStrategy;
import io.trellis.server.rpc.JsonRpc;
import io.trellis.server.rpc.MetaToolServer;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/// Creates and wires a {@link TrellisEnvironment}.
///
/// ### Usage
///
/// **From the process environment**:
/// {@snippet :
/// try (TrellisEnvironment env = TrellisFactory.createEnvironment()) {
///     env.getServer().serve(in, out);
/// }
/// }
///
/// **With replaced stores or transports** (tests, embedding):
/// {@snippet :
/// TrellisEnvironment env = TrellisFactory.builder()
///     .config(RouterConfig.builder().watchRegistry(false).build())
///     .registryStore(new InMemoryRegistryStore())
///     .transportStrategies(List.of(fakeStrategy))
///     .build();
/// }
///
/// @see RouterConfig
public final class TrellisFactory {

    private static final Logger LOG = Logger.getLogger(TrellisFactory.class);

    public static final String SERVER_NAME = "trellis";
    public static final String SERVER_VERSION = "0.1.0";

    private TrellisFactory() {}

    /// Creates an environment from {@link RouterConfig#load()}.
    ///
    /// @return wired environment, never null
    public static TrellisEnvironment createEnvironment() {
        return createEnvironment(RouterConfig.load());
    }

    /// Creates an environment with file-backed stores and the three SDK transports.
    ///
    /// @param config configuration, not null
    /// @return wired environment, never null
    public static TrellisEnvironment createEnvironment(RouterConfig config) {
        return builder().config(config).build();
    }

    /// Returns the default transports: stdio, SSE and streamable HTTP.
    ///
    /// @param options SDK client settings, not null
    /// @param mapper converts SDK results, not null
    /// @return one strategy per transport kind, never null
    public static List<TransportStrategy> defaultTransportStrategies(
            SdkClientOptions options, ObjectMapper mapper) {
        return List.of(
                new StdioTransportStrategy(options, mapper),
                new SseTransportStrategy(options, mapper),
                new HttpTransportStrategy(options, mapper));
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder; every component left unset gets its default.
    public static final class Builder {
        private RouterConfig config;
        private RegistryStore registryStore;
        private CatalogStore catalogStore;
        private List<? extends TransportStrategy> transportStrategies;
        private ObjectMapper mapper;

        private Builder() {}

        public Builder config(RouterConfig config) {
            this.config = Objects.requireNonNull(config, "config must not be null");
            return this;
        }

        public Builder registryStore(RegistryStore registryStore) {
            this.registryStore = registryStore;
            return this;
        }

        public Builder catalogStore(CatalogStore catalogStore) {
            this.catalogStore = catalogStore;
            return this;
        }

        public Builder transportStrategies(List<? extends TransportStrategy> strategies) {
            this.transportStrategies = strategies;
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = mapper;
            return this;
        }

        /// Wires the environment.
        ///
        /// @apiNote **Side effects**: reads the registry and catalog files and,
        /// when watching is on, starts the registry watcher thread
        ///
        /// @return wired environment, never null
        public TrellisEnvironment build() {
            RouterConfig cfg = config != null ? config : RouterConfig.load();
            ObjectMapper om = mapper != null ? mapper : TrellisSerializer.createMapper();

            RegistryStore regStore =
                    registryStore != null
                            ? registryStore
                            : new JsonRegistryStore(
                                    cfg.getRegistryPath(), cfg.getRegistryFormat(), om);
            CatalogStore catStore =
                    catalogStore != null
                            ? catalogStore
                            : new JsonCatalogStore(cfg.getCatalogPath(), om);

            ServerRegistry registry = new ServerRegistry(regStore);
            ToolCatalog catalog = new ToolCatalog(catStore);
            ConnectionManager connections =
                    new ConnectionManager(
                            transportStrategies != null
                                    ? transportStrategies
                                    : defaultTransportStrategies(cfg.toClientOptions(), om));
            MetaToolDispatcher dispatcher =
                    new MetaToolDispatcher(registry, catalog, connections, om);
            MetaToolServer server =
                    new MetaToolServer(dispatcher, new JsonRpc(om), SERVER_NAME, SERVER_VERSION);

            RegistryWatcher watcher =
                    cfg.isWatchRegistry() ? startWatcher(registry, regStore) : null;

            LOG.infov(
                    "Trellis ready with {0} configured servers",
                    registry.listServers().size());
            return new TrellisEnvironment(
                    cfg, registry, catalog, connections, dispatcher, server, watcher);
        }

        private static RegistryWatcher startWatcher(ServerRegistry registry, RegistryStore store) {
            Optional<Path> location = store.location();
            if (location.isEmpty()) {
                LOG.warn("Registry watching requested but the registry store has no file");
                return null;
            }
            Path file = location.get().toAbsolutePath();
            try {
                Files.createDirectories(file.getParent());
                return RegistryWatcher.start(
                        registry,
                        file,
                        servers -> LOG.infov("Registry reloaded with {0} servers", servers.size()));
            } catch (IOException e) {
                LOG.warnv(e, "Could not watch registry file {0}", file);
                return null;
            }
        }
    }
}
