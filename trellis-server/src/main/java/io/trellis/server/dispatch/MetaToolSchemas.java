package io.trellis.server.dispatch;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Names and input schemas of the meta-tools the router exposes.
///
/// Server-name parameters carry the configured names as an `enum` so the
/// calling agent can pick from them; with no servers configured the `enum`
/// is left out, since an empty enumeration would reject every value.
public final class MetaToolSchemas {

    public static final String DISCOVER_SERVER_ACTIONS = "discover_server_actions";
    public static final String GET_ACTION_DETAILS = "get_action_details";
    public static final String EXECUTE_ACTION = "execute_action";
    public static final String SEARCH_DOCUMENTATION = "search_documentation";
    public static final String HANDLE_AUTH_FAILURE = "handle_auth_failure";
    public static final String MANAGE_SERVERS = "manage_servers";
    public static final String SEARCH_MCP_CATALOG = "search_mcp_catalog";

    public static final List<String> NAMES =
            List.of(
                    DISCOVER_SERVER_ACTIONS,
                    GET_ACTION_DETAILS,
                    MANAGE_SERVERS,
                    SEARCH_MCP_CATALOG,
                    EXECUTE_ACTION,
                    SEARCH_DOCUMENTATION,
                    HANDLE_AUTH_FAILURE);

    private MetaToolSchemas() {}

    /// Builds the `tools/list` entries.
    ///
    /// @param serverNames configured server names for the enumerations, not null
    /// @return one `{name, description, inputSchema}` map per meta-tool, in {@link #NAMES} order
    public static List<Map<String, Object>> definitions(List<String> serverNames) {
        List<String> servers = List.copyOf(serverNames);
        return List.of(
                tool(
                        DISCOVER_SERVER_ACTIONS,
                        "**PREFERRED STARTING POINT**: Discover available actions from servers"
                                + " based on user query.",
                        schema("user_query")
                                .property(
                                        "user_query",
                                        string("Natural language user query to filter results."))
                                .property(
                                        "server_names",
                                        serverArray(
                                                servers,
                                                "List of server names to discover actions from."
                                                        + " Defaults to every connected server."))
                                .build()),
                tool(
                        GET_ACTION_DETAILS,
                        "Get detailed information about a specific action.",
                        schema("server_name", "action_name")
                                .property(
                                        "server_name",
                                        serverName(servers, "The name of the server"))
                                .property(
                                        "action_name", string("The name of the action/operation"))
                                .build()),
                tool(MANAGE_SERVERS, "Manage MCP server connections and Sets.", manageSchema()),
                tool(
                        SEARCH_MCP_CATALOG,
                        "Search for tools in the offline catalog and discover Sets/Collections.",
                        schema("query")
                                .property("query", string("Search query for tools or collections."))
                                .property(
                                        "max_results",
                                        integer("Maximum results to return. Default 20.", 20))
                                .build()),
                tool(
                        EXECUTE_ACTION,
                        "Execute a specific action with the provided parameters.",
                        schema("server_name", "action_name")
                                .property(
                                        "server_name",
                                        serverName(servers, "The name of the server"))
                                .property(
                                        "action_name",
                                        string("The name of the action/operation to execute"))
                                .property(
                                        "path_params",
                                        string("JSON string containing path parameters"))
                                .property(
                                        "query_params",
                                        string("JSON string containing query parameters"))
                                .property(
                                        "body_schema",
                                        string("JSON string containing request body"))
                                .build()),
                tool(
                        SEARCH_DOCUMENTATION,
                        "Search for server action documentations by keyword matching.",
                        schema("query", "server_name")
                                .property("query", string("Search keywords"))
                                .property(
                                        "server_name",
                                        serverName(servers, "Name of the server to search within."))
                                .property(
                                        "max_results",
                                        bounded(
                                                integer(
                                                        "Number of results to return. Default: 10",
                                                        10)))
                                .build()),
                tool(
                        HANDLE_AUTH_FAILURE,
                        "Handle authentication failures that occur when executing actions.",
                        schema("server_name", "intention")
                                .property(
                                        "server_name",
                                        serverName(servers, "The name of the server"))
                                .property(
                                        "intention",
                                        enumerated(
                                                List.of("get_auth_url", "save_auth_data"),
                                                "Action to take for authentication"))
                                .property("auth_data", object("Authentication data when saving"))
                                .build()));
    }

    private static Map<String, Object> manageSchema() {
        Map<String, Object> upsert = object("Create or update a Set.");
        Map<String, Object> upsertProperties = new LinkedHashMap<>();
        upsertProperties.put("name", Map.of("type", "string"));
        upsertProperties.put("servers", Map.of("type", "array", "items", Map.of("type", "string")));
        upsertProperties.put("description", Map.of("type", "string"));
        Map<String, Object> includes = new LinkedHashMap<>();
        includes.put("type", "array");
        includes.put("items", Map.of("type", "string"));
        includes.put("description", "Other sets to include (composability)");
        upsertProperties.put("include_sets", includes);
        upsert.put("properties", upsertProperties);
        upsert.put("required", List.of("name"));

        return schema()
                .property(
                        "list_configured_mcps",
                        bool("If true, lists all configured servers with their status."))
                .property(
                        "list_sets", bool("If true, lists all configured Sets and their servers."))
                .property("connect", string("Name of the server to connect (turn on)."))
                .property(
                        "connect_set",
                        string("Name of the Set to connect (turn on all servers in set)."))
                .property(
                        "connect_set_exclusive",
                        bool("If true with connect_set, disconnects all other servers first."))
                .property("search_sets", string("Search set descriptions for matching sets."))
                .property("upsert_set", upsert)
                .property("delete_set", string("Name of the Set to delete."))
                .property("disconnect", string("Name of the server to disconnect (turn off)."))
                .property(
                        "disconnect_set",
                        string("Name of the Set to disconnect (turn off all servers in set)."))
                .property("disconnect_all", bool("If true, disconnects all servers."))
                .property(
                        "populate_catalog",
                        bool(
                                "If true, connects to all enabled servers, refreshes catalog"
                                        + " cache, then disconnects. Use when adding new MCPs."))
                .build();
    }

    private static Map<String, Object> tool(
            String name, String description, Map<String, Object> inputSchema) {
        Map<String, Object> tool = new LinkedHashMap<>();
        tool.put("name", name);
        tool.put("description", description);
        tool.put("inputSchema", inputSchema);
        return tool;
    }

    private static ObjectSchema schema(String... required) {
        return new ObjectSchema(List.of(required));
    }

    /// Object schema under construction; properties keep insertion order.
    private static final class ObjectSchema {

        private final List<String> required;
        private final Map<String, Object> properties = new LinkedHashMap<>();

        private ObjectSchema(List<String> required) {
            this.required = required;
        }

        ObjectSchema property(String name, Map<String, Object> property) {
            properties.put(name, property);
            return this;
        }

        Map<String, Object> build() {
            Map<String, Object> schema = new LinkedHashMap<>();
            schema.put("type", "object");
            if (!required.isEmpty()) {
                schema.put("required", required);
            }
            schema.put("properties", properties);
            return schema;
        }
    }

    private static Map<String, Object> typed(String type, String description) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", type);
        property.put("description", description);
        return property;
    }

    private static Map<String, Object> string(String description) {
        return typed("string", description);
    }

    private static Map<String, Object> bool(String description) {
        return typed("boolean", description);
    }

    private static Map<String, Object> object(String description) {
        return typed("object", description);
    }

    private static Map<String, Object> integer(String description, int defaultValue) {
        Map<String, Object> property = typed("integer", description);
        property.put("default", defaultValue);
        return property;
    }

    private static Map<String, Object> bounded(Map<String, Object> property) {
        property.put("minimum", 1);
        property.put("maximum", 50);
        return property;
    }

    private static Map<String, Object> enumerated(List<String> values, String description) {
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "string");
        property.put("enum", values);
        property.put("description", description);
        return property;
    }

    private static Map<String, Object> serverName(List<String> servers, String description) {
        return servers.isEmpty() ? string(description) : enumerated(servers, description);
    }

    private static Map<String, Object> serverArray(List<String> servers, String description) {
        Map<String, Object> items = new LinkedHashMap<>();
        items.put("type", "string");
        if (!servers.isEmpty()) {
            items.put("enum", servers);
        }
        Map<String, Object> property = new LinkedHashMap<>();
        property.put("type", "array");
        property.put("items", items);
        property.put("description", description);
        return property;
    }
}
