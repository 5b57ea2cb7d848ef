package io.trellis.server.dispatch;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class MetaToolSchemasTest {

    private static Map<String, Object> asMap(Object value) {
        assertThat(value).isInstanceOf(Map.class);
        Map<String, Object> result = new LinkedHashMap<>();
        ((Map<?, ?>) value).forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }

    private static Map<String, Object> inputSchema(List<String> servers, String tool) {
        return MetaToolSchemas.definitions(servers).stream()
                .filter(definition -> tool.equals(definition.get("name")))
                .map(definition -> asMap(definition.get("inputSchema")))
                .findFirst()
                .orElseThrow();
    }

    private static Map<String, Object> property(List<String> servers, String tool, String name) {
        return asMap(asMap(inputSchema(servers, tool).get("properties")).get(name));
    }

    @Test
    void shouldListToolsInFixedOrder() {
        List<Object> names =
                MetaToolSchemas.definitions(List.of("weather")).stream()
                        .map(tool -> tool.get("name"))
                        .toList();

        assertThat(names).containsExactlyElementsOf(MetaToolSchemas.NAMES);
    }

    @Test
    void shouldKeepPropertyOrderAndRequiredFields() {
        Map<String, Object> schema =
                inputSchema(List.of("weather"), MetaToolSchemas.EXECUTE_ACTION);

        assertThat(schema.get("type")).isEqualTo("object");
        assertThat(schema.get("required")).isEqualTo(List.of("server_name", "action_name"));
        assertThat(asMap(schema.get("properties")).keySet())
                .containsExactly(
                        "server_name", "action_name", "path_params", "query_params", "body_schema");
    }

    @Test
    void shouldEnumerateConfiguredServerNames() {
        Map<String, Object> serverName =
                property(
                        List.of("weather", "maps"),
                        MetaToolSchemas.GET_ACTION_DETAILS,
                        "server_name");

        assertThat(serverName.get("enum")).isEqualTo(List.of("weather", "maps"));
    }

    @Test
    void shouldOmitEnumWithoutServers() {
        Map<String, Object> serverName =
                property(List.of(), MetaToolSchemas.GET_ACTION_DETAILS, "server_name");

        assertThat(serverName).containsEntry("type", "string").doesNotContainKey("enum");
    }

    @Test
    void shouldLeaveManageFieldsOptional() {
        Map<String, Object> schema = inputSchema(List.of(), MetaToolSchemas.MANAGE_SERVERS);

        assertThat(schema).doesNotContainKey("required");
        assertThat(asMap(schema.get("properties")))
                .containsKeys("upsert_set", "connect_set_exclusive", "populate_catalog");
    }
}
