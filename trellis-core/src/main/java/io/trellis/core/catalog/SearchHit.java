package io.trellis.core.catalog;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One ranked tool returned by {@link ToolSearcher}.
///
/// Catalog searches and live searches produce the same shape so callers can
/// treat them uniformly.
///
/// @param categoryName the server the tool belongs to, not null
/// @param tool the matched tool, not null
/// @param score relevance, higher is better; always positive
/// @param source where the tool list came from, not null
public record SearchHit(String categoryName, ToolDescriptor tool, double score, Source source) {

    /// Origin of the searched tool list.
    public enum Source {
        CATALOG("catalog"),
        LIVE("live");

        private final String label;

        Source(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    /// Compact constructor with validation.
    public SearchHit {
        Objects.requireNonNull(categoryName, "categoryName must not be null");
        Objects.requireNonNull(tool, "tool must not be null");
        Objects.requireNonNull(source, "source must not be null");
    }

    /// Renders this hit as the map returned to the calling agent.
    ///
    /// @return mutable map with `name`, `description`, `category_name`,
    ///     `relevance_score` and `source`, never null
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", tool.name());
        map.put("description", tool.description());
        map.put("category_name", categoryName);
        map.put("relevance_score", Math.round(score * 100.0) / 100.0);
        map.put("source", source.label());
        return map;
    }
}
