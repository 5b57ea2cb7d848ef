package io.trellis.server.rpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellis.server.dispatch.MetaToolDispatcher;
import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MetaToolServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MetaToolDispatcher dispatcher;
    private MetaToolServer server;

    @BeforeEach
    void setUp() {
        dispatcher = mock(MetaToolDispatcher.class);
        server = new MetaToolServer(dispatcher, new JsonRpc(mapper), "trellis", "0.1.0");
    }

    private JsonNode handle(String line) throws Exception {
        String response = server.handle(line);
        assertThat(response).isNotNull().doesNotContain("\n");
        return mapper.readTree(response);
    }

    @Nested
    class Lifecycle {

        @Test
        void shouldEchoRequestedProtocolVersion() throws Exception {
            JsonNode response =
                    handle(
                            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
                                    + "\"params\":{\"protocolVersion\":\"2025-03-26\"}}");

            assertThat(response.path("id").asInt()).isEqualTo(1);
            JsonNode result = response.path("result");
            assertThat(result.path("protocolVersion").asText()).isEqualTo("2025-03-26");
            assertThat(result.path("serverInfo").path("name").asText()).isEqualTo("trellis");
            assertThat(result.path("capabilities").has("tools")).isTrue();
        }

        @Test
        void shouldDefaultProtocolVersion() throws Exception {
            JsonNode response =
                    handle("{\"jsonrpc\":\"2.0\",\"id\":\"a\",\"method\":\"initialize\"}");

            assertThat(response.path("id").asText()).isEqualTo("a");
            assertThat(response.path("result").path("protocolVersion").asText())
                    .isEqualTo(MetaToolServer.DEFAULT_PROTOCOL_VERSION);
        }

        @Test
        void shouldNotAnswerNotifications() {
            String initialized = "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}";
            assertThat(server.handle(initialized)).isNull();
            assertThat(server.handle("{\"jsonrpc\":\"2.0\",\"method\":\"notifications/unknown\"}"))
                    .isNull();
        }

        @Test
        void shouldAnswerPing() throws Exception {
            JsonNode response = handle("{\"jsonrpc\":\"2.0\",\"id\":7,\"method\":\"ping\"}");

            assertThat(response.path("result").isObject()).isTrue();
            assertThat(response.has("error")).isFalse();
        }

        @Test
        void shouldStopServingAfterShutdown() throws Exception {
            String input =
                    "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"ping\"}\n"
                            + "\n"
                            + "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"shutdown\"}\n"
                            + "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"ping\"}\n";
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();

            server.serve(
                    new BufferedReader(new StringReader(input)),
                    new PrintStream(bytes, true, StandardCharsets.UTF_8));

            String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\n");
            assertThat(lines).hasSize(2);
            assertThat(mapper.readTree(lines[1]).path("id").asInt()).isEqualTo(2);
            assertThat(server.isRunning()).isFalse();
        }
    }

    @Nested
    class Tools {

        @Test
        void shouldListMetaTools() throws Exception {
            when(dispatcher.toolDefinitions())
                    .thenReturn(List.of(Map.of("name", "manage_servers")));

            JsonNode response = handle("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}");

            assertThat(response.path("result").path("tools").get(0).path("name").asText())
                    .isEqualTo("manage_servers");
        }

        @Test
        void shouldWrapResultAsJsonTextBlock() throws Exception {
            when(dispatcher.dispatch(eq("search_mcp_catalog"), anyMap()))
                    .thenReturn(Map.of("status", "error", "error", "query is required"));

            JsonNode response =
                    handle(
                            "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\","
                                    + "\"params\":{\"name\":\"search_mcp_catalog\","
                                    + "\"arguments\":{\"max_results\":5}}}");

            JsonNode result = response.path("result");
            assertThat(result.path("isError").asBoolean()).isFalse();
            JsonNode block = result.path("content").get(0);
            assertThat(block.path("type").asText()).isEqualTo("text");
            assertThat(mapper.readTree(block.path("text").asText()).path("error").asText())
                    .isEqualTo("query is required");
            verify(dispatcher).dispatch("search_mcp_catalog", Map.of("max_results", 5));
        }

        @Test
        void shouldPassManageTextThrough() throws Exception {
            when(dispatcher.dispatch(eq("manage_servers"), anyMap())).thenReturn("weather off");

            JsonNode response =
                    handle(
                            "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/call\","
                                    + "\"params\":{\"name\":\"manage_servers\","
                                    + "\"arguments\":{\"disconnect\":\"weather\"}}}");

            assertThat(response.path("result").path("content").get(0).path("text").asText())
                    .isEqualTo("weather off");
        }

        @Test
        void shouldDispatchEmptyArgumentsWhenNoneGiven() throws Exception {
            when(dispatcher.dispatch(eq("manage_servers"), anyMap())).thenReturn("");

            handle(
                    "{\"jsonrpc\":\"2.0\",\"id\":6,\"method\":\"tools/call\","
                            + "\"params\":{\"name\":\"manage_servers\",\"arguments\":\"oops\"}}");

            verify(dispatcher).dispatch("manage_servers", Map.of());
        }

        @Test
        void shouldRejectCallWithoutName() throws Exception {
            JsonNode response =
                    handle(
                            "{\"jsonrpc\":\"2.0\",\"id\":5,"
                                    + "\"method\":\"tools/call\",\"params\":{}}");

            assertThat(response.path("error").path("code").asInt())
                    .isEqualTo(JsonRpc.INVALID_PARAMS);
            verifyNoInteractions(dispatcher);
        }
    }

    @Nested
    class Errors {

        @Test
        void shouldReportParseError() throws Exception {
            JsonNode response = handle("{not json");

            assertThat(response.path("error").path("code").asInt())
                    .isEqualTo(JsonRpc.PARSE_ERROR);
            assertThat(response.path("id").isNull()).isTrue();
        }

        @Test
        void shouldReportInvalidRequest() throws Exception {
            JsonNode response = handle("[1, 2]");

            assertThat(response.path("error").path("code").asInt())
                    .isEqualTo(JsonRpc.INVALID_REQUEST);
        }

        @Test
        void shouldReportUnknownMethod() throws Exception {
            JsonNode response =
                    handle("{\"jsonrpc\":\"2.0\",\"id\":9,\"method\":\"resources/list\"}");

            assertThat(response.path("id").asInt()).isEqualTo(9);
            assertThat(response.path("error").path("code").asInt())
                    .isEqualTo(JsonRpc.METHOD_NOT_FOUND);
            assertThat(response.path("error").path("message").asText())
                    .isEqualTo("Method not found: resources/list");
        }

        @Test
        void shouldReportInternalError() throws Exception {
            when(dispatcher.toolDefinitions())
                    .thenThrow(new IllegalStateException("registry gone"));

            JsonNode response = handle("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"tools/list\"}");

            assertThat(response.path("error").path("code").asInt())
                    .isEqualTo(JsonRpc.INTERNAL_ERROR);
            assertThat(response.path("error").path("message").asText()).isEqualTo("registry gone");
        }
    }
}
