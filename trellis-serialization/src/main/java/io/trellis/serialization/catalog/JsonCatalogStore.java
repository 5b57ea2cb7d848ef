package io.trellis.serialization.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellis.core.catalog.CatalogStore;
import io.trellis.core.catalog.ToolDescriptor;
import io.trellis.core.exception.PersistenceException;
import io.trellis.serialization.JsonFile;
import io.trellis.serialization.TrellisSerializer;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jboss.logging.Logger;

/// {@link CatalogStore} backed by a pretty-printed JSON file of the form
/// `{ server_name: [ {name, description, inputSchema}, ... ] }`.
///
/// @implNote Thread-safe. Writes replace the file atomically under a lock.
public class JsonCatalogStore implements CatalogStore {

    private static final Logger LOG = Logger.getLogger(JsonCatalogStore.class);

    private static final TypeReference<LinkedHashMap<String, List<ToolDescriptor>>> CATALOG =
            new TypeReference<>() {};

    private final JsonFile file;
    private final ObjectMapper mapper;

    public JsonCatalogStore(Path path) {
        this(path, TrellisSerializer.createMapper());
    }

    public JsonCatalogStore(Path path, ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.file = new JsonFile(path, mapper);
    }

    @Override
    public Map<String, List<ToolDescriptor>> load() throws PersistenceException {
        Optional<JsonNode> content = file.read();
        if (content.isEmpty()) {
            return Map.of();
        }
        if (!content.get().isObject()) {
            throw new PersistenceException("Catalog file " + file.path() + " is not a JSON object");
        }
        try {
            Map<String, List<ToolDescriptor>> catalog = mapper.convertValue(content.get(), CATALOG);
            LOG.infov("Loaded tool catalog with {0} servers from {1}", catalog.size(), file.path());
            return catalog;
        } catch (IllegalArgumentException e) {
            throw new PersistenceException("Malformed catalog file " + file.path(), e);
        }
    }

    @Override
    public void save(Map<String, List<ToolDescriptor>> catalog) throws PersistenceException {
        Objects.requireNonNull(catalog, "catalog must not be null");
        file.write(catalog);
        LOG.debugv("Saved tool catalog with {0} servers", catalog.size());
    }

    public Path path() {
        return file.path();
    }
}
