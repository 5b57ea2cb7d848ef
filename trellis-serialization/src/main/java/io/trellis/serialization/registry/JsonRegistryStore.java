package io.trellis.serialization.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellis.core.exception.PersistenceException;
import io.trellis.core.registry.RegistrySnapshot;
import io.trellis.core.registry.RegistryStore;
import io.trellis.serialization.JsonFile;
import io.trellis.serialization.TrellisSerializer;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/// {@link RegistryStore} backed by a JSON file.
///
/// Loading sniffs the layout: an `mcp` object with `servers` is read as
/// {@link RegistryFormat#NESTED}, otherwise a top-level `servers` as
/// {@link RegistryFormat#LEGACY}; anything else is an empty registry. Saving
/// always uses the format this store was created with, so a legacy file is
/// migrated on its first write when the store is configured for nested.
///
/// ### Usage
/// {@snippet :
/// RegistryStore store = new JsonRegistryStore(Path.of("servers.json"), RegistryFormat.NESTED);
/// ServerRegistry registry = new ServerRegistry(store);
/// }
///
/// @implNote Thread-safe. Writes replace the file atomically under a lock.
public class JsonRegistryStore implements RegistryStore {

    private static final Logger LOG = Logger.getLogger(JsonRegistryStore.class);

    private static final List<RegistryCodec> READERS =
            List.of(new NestedRegistryCodec(), new LegacyRegistryCodec());

    private final JsonFile file;
    private final RegistryCodec writer;
    private final ObjectMapper mapper;

    public JsonRegistryStore(Path path, RegistryFormat format) {
        this(path, format, TrellisSerializer.createMapper());
    }

    /// @param path registry file, not null
    /// @param format layout used when saving, not null
    /// @param mapper mapper for reading and writing, not null
    public JsonRegistryStore(Path path, RegistryFormat format, ObjectMapper mapper) {
        Objects.requireNonNull(format, "format must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.file = new JsonFile(path, mapper);
        this.writer = format.codec();
    }

    @Override
    public RegistrySnapshot load() throws PersistenceException {
        Optional<JsonNode> content = file.read();
        if (content.isEmpty()) {
            LOG.debugv("No registry file at {0}, starting empty", file.path());
            return RegistrySnapshot.empty();
        }
        JsonNode root = content.get();
        if (!root.isObject()) {
            throw new PersistenceException(
                    "Registry file " + file.path() + " is not a JSON object");
        }
        for (RegistryCodec codec : READERS) {
            if (codec.accepts(root)) {
                RegistrySnapshot snapshot = codec.read(root);
                LOG.infov(
                        "Loaded {0} servers and {1} sets from {2} ({3} format)",
                        snapshot.servers().size(),
                        snapshot.sets().size(),
                        file.path(),
                        codec.format().configName());
                return snapshot;
            }
        }
        LOG.warnv("Registry file {0} has no servers section, starting empty", file.path());
        return RegistrySnapshot.empty();
    }

    @Override
    public void save(RegistrySnapshot snapshot) throws PersistenceException {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        file.write(writer.write(snapshot, mapper));
    }

    @Override
    public Optional<Path> location() {
        return Optional.of(file.path());
    }

    /// Returns the layout used when saving.
    ///
    /// @return format, never null
    public RegistryFormat format() {
        return writer.format();
    }
}
