package io.trellis.core.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ToolSearcherTest {

    private ToolSearcher searcher;

    @BeforeEach
    void setUp() {
        Map<String, List<ToolDescriptor>> tools = new LinkedHashMap<>();
        tools.put(
                "weather",
                List.of(
                        ToolDescriptor.of("get_forecast", "Daily weather forecast for a city"),
                        ToolDescriptor.of("get_alerts", "Severe weather alerts")));
        tools.put(
                "files",
                List.of(
                        ToolDescriptor.of("readFile", "Read a file from disk"),
                        ToolDescriptor.of("write_file", "Write content to a file")));
        searcher = new ToolSearcher(tools, SearchHit.Source.CATALOG);
    }

    @Nested
    class Ranking {

        @Test
        void shouldRankNameMatchAboveDescriptionMatch() {
            List<SearchHit> hits = searcher.search("forecast", 10);

            assertThat(hits).isNotEmpty();
            assertThat(hits.get(0).tool().name()).isEqualTo("get_forecast");
            assertThat(hits.get(0).categoryName()).isEqualTo("weather");
        }

        @Test
        void shouldMatchCamelCaseTokens() {
            List<SearchHit> hits = searcher.search("read file", 10);

            assertThat(hits.get(0).tool().name()).isEqualTo("readFile");
        }

        @Test
        void shouldDropZeroScoreTools() {
            List<SearchHit> hits = searcher.search("forecast", 10);

            assertThat(hits).extracting(h -> h.tool().name()).doesNotContain("write_file");
        }

        @Test
        void shouldKeepOriginalOrderForTies() {
            List<SearchHit> hits = searcher.search("weather", 10);

            assertThat(hits).extracting(h -> h.tool().name())
                    .containsExactly("get_forecast", "get_alerts");
            assertThat(hits.get(0).score()).isEqualTo(hits.get(1).score());
        }

        @Test
        void shouldFallBackToSubstringMatch() {
            List<SearchHit> hits = searcher.search("forec", 10);

            assertThat(hits).extracting(h -> h.tool().name()).containsExactly("get_forecast");
        }

        @Test
        void shouldScoreToolMatchingMoreTermsHigher() {
            ToolDescriptor both = ToolDescriptor.of("get_forecast", "Daily weather forecast");
            ToolDescriptor one = ToolDescriptor.of("get_forecast", "Weather forecast");

            double bothScore =
                    ToolSearcher.score(both, "daily forecast", ToolSearcher.tokenize("daily forecast"));
            double oneScore =
                    ToolSearcher.score(one, "daily forecast", ToolSearcher.tokenize("daily forecast"));

            assertThat(bothScore).isGreaterThan(oneScore);
        }
    }

    @Nested
    class Limits {

        @Test
        void shouldCapResults() {
            assertThat(searcher.search("file", 1)).hasSize(1);
        }

        @Test
        void shouldReturnNothingForNonPositiveLimit() {
            assertThat(searcher.search("file", 0)).isEmpty();
            assertThat(searcher.search("file", -3)).isEmpty();
        }

        @Test
        void shouldReturnNothingForBlankQuery() {
            assertThat(searcher.search("  ", 10)).isEmpty();
            assertThat(searcher.search(null, 10)).isEmpty();
        }
    }

    @Test
    void shouldTokenizeOnSeparatorsAndCamelCase() {
        assertThat(ToolSearcher.tokenize("getHTTPStatus_code-v2"))
                .containsExactly("get", "httpstatus", "code", "v2");
    }

    @Test
    void shouldRenderHitAsMap() {
        SearchHit hit =
                new SearchHit(
                        "weather",
                        ToolDescriptor.of("get_forecast", "Forecast"),
                        4.0 / 3.0,
                        SearchHit.Source.LIVE);

        assertThat(hit.toMap())
                .containsEntry("name", "get_forecast")
                .containsEntry("category_name", "weather")
                .containsEntry("relevance_score", 1.33)
                .containsEntry("source", "live");
    }
}
