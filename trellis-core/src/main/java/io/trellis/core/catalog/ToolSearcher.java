package io.trellis.core.catalog;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/// Ranks tools against a free-text query by name and description relevance.
///
/// Used over the whole {@link ToolCatalog} and over freshly listed tools of a
/// connected server; both paths produce {@link SearchHit}s of the same shape.
///
/// ### Scoring
/// The query and each tool's name and description are lower-cased and split
/// into tokens on non-alphanumeric characters and camelCase boundaries. For
/// every query token:
/// - a name token equal to it adds {@value #NAME_TOKEN_WEIGHT}
/// - a description token equal to it adds {@value #DESCRIPTION_TOKEN_WEIGHT}
/// - otherwise, a case-insensitive substring match adds
///   {@value #NAME_SUBSTRING_WEIGHT} (name) or {@value #DESCRIPTION_SUBSTRING_WEIGHT}
///   (description)
///
/// The whole query appearing inside the tool name adds {@value #PHRASE_WEIGHT}.
/// Tools scoring zero are dropped. Ties keep the original order (servers in map
/// order, tools in list order).
///
/// @implNote The weights are chosen, not tuned against any corpus. For a fixed
/// query, every additional matching term only adds to a tool's score.
public final class ToolSearcher {

    static final double NAME_TOKEN_WEIGHT = 3.0;
    static final double DESCRIPTION_TOKEN_WEIGHT = 1.0;
    static final double NAME_SUBSTRING_WEIGHT = 1.5;
    static final double DESCRIPTION_SUBSTRING_WEIGHT = 0.5;
    static final double PHRASE_WEIGHT = 2.0;

    private static final Pattern CAMEL_BOUNDARY = Pattern.compile("(?<=[a-z0-9])(?=[A-Z])");
    private static final Pattern SEPARATORS = Pattern.compile("[^a-z0-9]+");

    private final Map<String, List<ToolDescriptor>> toolsByServer;
    private final SearchHit.Source source;

    /// Creates a searcher over the given tool lists.
    ///
    /// @param toolsByServer server name to tool list, not null
    /// @param source label attached to every hit, not null
    public ToolSearcher(Map<String, List<ToolDescriptor>> toolsByServer, SearchHit.Source source) {
        Objects.requireNonNull(toolsByServer, "toolsByServer must not be null");
        this.toolsByServer = new LinkedHashMap<>(toolsByServer);
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /// Returns the best matching tools.
    ///
    /// @param query free-text query; null or blank yields no hits
    /// @param maxResults upper bound on hits; non-positive yields no hits
    /// @return hits ordered by descending score, never null
    public List<SearchHit> search(String query, int maxResults) {
        if (query == null || query.isBlank() || maxResults <= 0) {
            return List.of();
        }
        String phrase = query.trim().toLowerCase(Locale.ROOT);
        Set<String> queryTokens = tokenize(query);

        List<SearchHit> hits = new ArrayList<>();
        for (Map.Entry<String, List<ToolDescriptor>> entry : toolsByServer.entrySet()) {
            for (ToolDescriptor tool : entry.getValue()) {
                double score = score(tool, phrase, queryTokens);
                if (score > 0) {
                    hits.add(new SearchHit(entry.getKey(), tool, score, source));
                }
            }
        }

        // List.sort is stable, so equal scores keep their original order
        hits.sort(Comparator.comparingDouble(SearchHit::score).reversed());
        return List.copyOf(hits.size() > maxResults ? hits.subList(0, maxResults) : hits);
    }

    static double score(ToolDescriptor tool, String phrase, Set<String> queryTokens) {
        String name = tool.name().toLowerCase(Locale.ROOT);
        String description = tool.description().toLowerCase(Locale.ROOT);
        Set<String> nameTokens = tokenize(tool.name());
        Set<String> descriptionTokens = tokenize(tool.description());

        double score = 0;
        for (String token : queryTokens) {
            boolean nameHit = nameTokens.contains(token);
            boolean descriptionHit = descriptionTokens.contains(token);
            if (nameHit) {
                score += NAME_TOKEN_WEIGHT;
            } else if (name.contains(token)) {
                score += NAME_SUBSTRING_WEIGHT;
            }
            if (descriptionHit) {
                score += DESCRIPTION_TOKEN_WEIGHT;
            } else if (description.contains(token)) {
                score += DESCRIPTION_SUBSTRING_WEIGHT;
            }
        }
        if (!phrase.isEmpty() && name.contains(phrase)) {
            score += PHRASE_WEIGHT;
        }
        return score;
    }

    /// Splits text into lower-case tokens on separators and camelCase boundaries.
    ///
    /// @param text text to split, may be null
    /// @return distinct tokens in order of appearance, never null
    static Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return tokens;
        }
        String spaced = CAMEL_BOUNDARY.matcher(text).replaceAll(" ");
        for (String token : SEPARATORS.split(spaced.toLowerCase(Locale.ROOT))) {
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
