package io.trellis.core.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Catalog store kept in memory only (useful for testing).
public final class InMemoryCatalogStore implements CatalogStore {

    private volatile Map<String, List<ToolDescriptor>> content = Map.of();

    @Override
    public Map<String, List<ToolDescriptor>> load() {
        return content;
    }

    @Override
    public synchronized void save(Map<String, List<ToolDescriptor>> catalog) {
        content = new LinkedHashMap<>(catalog);
    }
}
