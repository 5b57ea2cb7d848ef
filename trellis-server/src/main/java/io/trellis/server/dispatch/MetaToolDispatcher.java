package io.trellis.server.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trellis.core.catalog.SearchHit;
import io.trellis.core.catalog.ToolCatalog;
import io.trellis.core.catalog.ToolDescriptor;
import io.trellis.core.catalog.ToolSearcher;
import io.trellis.core.connection.ConnectionManager;
import io.trellis.core.connection.ConnectionState;
import io.trellis.core.connection.McpConnection;
import io.trellis.core.connection.McpException;
import io.trellis.core.connection.McpException.ErrorKind;
import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.ServerRegistry;
import io.trellis.core.registry.ServerSet;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/// Routes meta-tool calls to the registry, the catalog and the live connections.
///
/// Every public operation returns a plain JSON-compatible value: a map, a list
/// or, for `manage_servers`, text. Failures come back as an {@link ErrorEnvelope}
/// map and never as an exception, so one bad call cannot take the router down.
///
/// ### Contracts
/// - **Explicit connect**: no operation here opens a connection except
///   `manage_servers` `connect`, `connect_set` and `populate_catalog`.
/// - **Live-only execution**: `execute_action` calls a server only when its
///   handshake has completed.
/// - **Catalog freshness**: every successful live listing replaces that
///   server's catalog entry.
///
/// ### Usage
/// {@snippet :
/// MetaToolDispatcher dispatcher = new MetaToolDispatcher(registry, catalog, connections, mapper);
/// Object result = dispatcher.dispatch("execute_action", Map.of(
///         "server_name", "weather",
///         "action_name", "forecast",
///         "query_params", "{\"city\": \"Oslo\"}"));
/// }
///
/// @implNote Not designed for concurrent calls from several agents; the
/// components it delegates to are individually thread-safe.
public class MetaToolDispatcher {

    private static final Logger LOG = Logger.getLogger(MetaToolDispatcher.class);

    static final int DISCOVER_LIMIT = 50;
    static final int DEFAULT_CATALOG_RESULTS = 20;
    static final int DEFAULT_DOCUMENTATION_RESULTS = 10;
    static final int PARAM_VALUE_PREVIEW = 100;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ServerRegistry registry;
    private final ToolCatalog catalog;
    private final ConnectionManager connections;
    private final ObjectMapper mapper;

    /// @param registry configured servers and sets, not null
    /// @param catalog offline tool index, not null
    /// @param connections live sessions, not null
    /// @param mapper parses JSON parameter blocks, not null
    public MetaToolDispatcher(
            ServerRegistry registry,
            ToolCatalog catalog,
            ConnectionManager connections,
            ObjectMapper mapper) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.connections = Objects.requireNonNull(connections, "connections must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
    }

    /// Returns the `tools/list` entries with the currently configured server names.
    ///
    /// @return meta-tool definitions, never null
    public List<Map<String, Object>> toolDefinitions() {
        List<String> names = registry.listServers().stream().map(ServerDefinition::name).toList();
        return MetaToolSchemas.definitions(names);
    }

    /// Runs one meta-tool by name.
    ///
    /// @param tool meta-tool name, not null
    /// @param arguments raw call arguments, may be null
    /// @return the tool's result or an error envelope, never null
    public Object dispatch(String tool, Map<String, Object> arguments) {
        Objects.requireNonNull(tool, "tool must not be null");
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        LOG.debugv("Dispatching meta-tool {0}", tool);
        try {
            return switch (tool) {
                case MetaToolSchemas.DISCOVER_SERVER_ACTIONS ->
                        discoverServerActions(
                                Arguments.text(args, "user_query"),
                                Arguments.strings(args, "server_names"));
                case MetaToolSchemas.GET_ACTION_DETAILS ->
                        getActionDetails(
                                Arguments.text(args, "server_name"),
                                Arguments.text(args, "action_name"));
                case MetaToolSchemas.EXECUTE_ACTION ->
                        executeAction(
                                Arguments.text(args, "server_name"),
                                Arguments.text(args, "action_name"),
                                args.get("path_params"),
                                args.get("query_params"),
                                args.get("body_schema"));
                case MetaToolSchemas.SEARCH_DOCUMENTATION ->
                        searchDocumentation(
                                Arguments.text(args, "query"),
                                Arguments.text(args, "server_name"),
                                Arguments.integer(
                                        args, "max_results", DEFAULT_DOCUMENTATION_RESULTS));
                case MetaToolSchemas.MANAGE_SERVERS ->
                        manageServers(ManageRequest.fromArguments(args));
                case MetaToolSchemas.SEARCH_MCP_CATALOG ->
                        searchMcpCatalog(
                                Arguments.text(args, "query"),
                                Arguments.integer(args, "max_results", DEFAULT_CATALOG_RESULTS));
                case MetaToolSchemas.HANDLE_AUTH_FAILURE ->
                        handleAuthFailure(
                                Arguments.text(args, "server_name"),
                                Arguments.text(args, "intention"),
                                Arguments.object(args, "auth_data"));
                default -> ErrorEnvelope.of("Unknown tool: " + tool).toMap();
            };
        } catch (RuntimeException e) {
            LOG.errorv(e, "Meta-tool {0} failed", tool);
            return ErrorEnvelope.of("Error executing tool '" + tool + "': " + e.getMessage())
                    .traceback(e)
                    .toMap();
        }
    }

    // ========== Discovery ==========

    /// Lists the tools of connected servers, ranked against a query.
    ///
    /// @param userQuery free-text query; null or blank returns full tool lists
    /// @param serverNames servers to list; null or empty means every connected server
    /// @return server name to tool maps, or to an error envelope for that server
    public Map<String, Object> discoverServerActions(String userQuery, List<String> serverNames) {
        List<String> targets =
                serverNames == null || serverNames.isEmpty()
                        ? connections.listActive().stream().filter(connections::isLive).toList()
                        : serverNames;

        Map<String, Object> result = new LinkedHashMap<>();
        for (String server : targets) {
            try {
                List<ToolDescriptor> tools = liveTools(server);
                if (userQuery != null && !userQuery.isBlank()) {
                    tools =
                            new ToolSearcher(Map.of(server, tools), SearchHit.Source.LIVE)
                                    .search(userQuery, DISCOVER_LIMIT).stream()
                                            .map(SearchHit::tool)
                                            .toList();
                }
                result.put(server, tools.stream().map(MetaToolDispatcher::describe).toList());
            } catch (McpException e) {
                result.put(server, unavailable(server, e));
            } catch (RuntimeException e) {
                LOG.warnv(e, "Could not list tools of server {0}", server);
                result.put(
                        server,
                        ErrorEnvelope.of(e.getMessage() != null ? e.getMessage() : e.toString())
                                .with("server_name", server)
                                .toMap());
            }
        }
        return result;
    }

    /// Returns the full definition of one tool on a connected server.
    ///
    /// @param serverName the server, may be null
    /// @param actionName exact tool name, may be null
    /// @return `{name, description, inputSchema}` or an error envelope, never null
    public Map<String, Object> getActionDetails(String serverName, String actionName) {
        if (serverName == null || actionName == null) {
            return ErrorEnvelope.of("server_name and action_name are required").toMap();
        }
        List<ToolDescriptor> tools;
        try {
            tools = liveTools(serverName);
        } catch (McpException e) {
            return unavailable(serverName, e);
        }
        return tools.stream()
                .filter(t -> t.name().equals(actionName))
                .findFirst()
                .map(MetaToolDispatcher::describe)
                .orElseGet(
                        () ->
                                ErrorEnvelope.of(
                                                McpException.actionNotFound(serverName, actionName)
                                                        .getMessage())
                                        .with("server_name", serverName)
                                        .with("action_name", actionName)
                                        .toMap());
    }

    /// Ranks the tools of one connected server against a query.
    ///
    /// @param query free-text query, may be null
    /// @param serverName the server, may be null
    /// @param maxResults upper bound on hits
    /// @return list of hit maps with `source = live`, or an error envelope
    public Object searchDocumentation(String query, String serverName, int maxResults) {
        if (query == null || serverName == null) {
            return ErrorEnvelope.of("query and server_name are required").toMap();
        }
        try {
            List<ToolDescriptor> tools = liveTools(serverName);
            return new ToolSearcher(Map.of(serverName, tools), SearchHit.Source.LIVE)
                    .search(query, maxResults).stream().map(SearchHit::toMap).toList();
        } catch (McpException e) {
            return unavailable(serverName, e);
        }
    }

    /// Searches the offline catalog and the sets.
    ///
    /// @param query free-text query, may be null
    /// @param maxResults upper bound on tool hits
    /// @return `{collections, tools}` or an error envelope, never null
    public Map<String, Object> searchMcpCatalog(String query, int maxResults) {
        if (query == null) {
            return ErrorEnvelope.of("query is required").toMap();
        }
        List<Map<String, Object>> tools = new ArrayList<>();
        for (SearchHit hit : catalog.search(query, maxResults)) {
            Map<String, Object> entry = hit.toMap();
            boolean online = connections.isLive(hit.categoryName());
            entry.put("current_status", online ? "online" : "offline");
            tools.add(entry);
        }

        String needle = query.toLowerCase(Locale.ROOT);
        List<Map<String, Object>> collections = new ArrayList<>();
        for (ServerSet set : registry.listSets()) {
            if (set.name().toLowerCase(Locale.ROOT).contains(needle)
                    || set.description().toLowerCase(Locale.ROOT).contains(needle)) {
                Map<String, Object> collection = new LinkedHashMap<>();
                collection.put("type", "collection");
                collection.put("name", set.name());
                collection.put("description", set.description());
                collection.put("servers", registry.getSet(set.name()).orElse(set.servers()));
                collection.put("status", "available");
                collections.add(collection);
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("collections", collections);
        result.put("tools", tools);
        return result;
    }

    /// Lists a server's tools over its live connection and refreshes its catalog entry.
    private List<ToolDescriptor> liveTools(String serverName) {
        List<ToolDescriptor> tools = connections.getClient(serverName).listTools();
        catalog.updateServer(serverName, tools);
        return tools;
    }

    private Map<String, Object> unavailable(String serverName, McpException failure) {
        if (failure.getKind() != ErrorKind.NOT_CONNECTED) {
            return ErrorEnvelope.of(failure.getMessage()).with("server_name", serverName).toMap();
        }
        if (registry.isConfigured(serverName)) {
            return ErrorEnvelope.of("Server '" + serverName + "' is configured but not connected")
                    .with("fix", "Run: manage_servers.exec {\"connect\": \"" + serverName + "\"}")
                    .toMap();
        }
        return ErrorEnvelope.of(McpException.notConfigured(serverName).getMessage())
                .with(
                        "fix",
                        "Check the registry file or use manage_servers to see available servers")
                .toMap();
    }

    private static Map<String, Object> describe(ToolDescriptor tool) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", tool.name());
        map.put("description", tool.description());
        map.put("inputSchema", tool.inputSchema());
        return map;
    }

    // ========== Execution ==========

    /// Calls one tool on a connected server.
    ///
    /// The parameter blocks are merged into one argument object in the order
    /// path, query, body; later keys overwrite earlier ones. A block may be a
    /// JSON object string or an already parsed map. Null, blank and `{}`
    /// blocks are skipped.
    ///
    /// @param serverName the server, may be null
    /// @param actionName the tool, may be null
    /// @param pathParams path parameter block, may be null
    /// @param queryParams query parameter block, may be null
    /// @param bodySchema body parameter block, may be null
    /// @return the tool result verbatim, or an error envelope
    public Map<String, Object> executeAction(
            String serverName,
            String actionName,
            Object pathParams,
            Object queryParams,
            Object bodySchema) {
        if (serverName == null || actionName == null) {
            return ErrorEnvelope.of("server_name and action_name are required").toMap();
        }
        if (!connections.isLive(serverName)) {
            if (registry.isConfigured(serverName)) {
                return ErrorEnvelope.of(McpException.notConnected(serverName).getMessage())
                        .with(
                                "suggestion",
                                "Connect first with: manage_servers.exec {\"connect\": \""
                                        + serverName + "\"}")
                        .toMap();
            }
            return ErrorEnvelope.of("Server '" + serverName + "' not configured").toMap();
        }

        McpConnection client;
        try {
            client = connections.getClient(serverName);
        } catch (McpException e) {
            return notConnected(serverName);
        }
        if (!client.isConnected()) {
            return notConnected(serverName);
        }

        Map<String, Object> arguments = new LinkedHashMap<>();
        try {
            mergeBlock(arguments, "path_params", pathParams);
            mergeBlock(arguments, "query_params", queryParams);
            mergeBlock(arguments, "body_schema", bodySchema);
        } catch (McpException e) {
            Object value =
                    blockValue(e.getParameterBlock(), pathParams, queryParams, bodySchema);
            String raw = String.valueOf(value);
            return ErrorEnvelope.of(e.getMessage())
                    .with("param_name", e.getParameterBlock())
                    .with(
                            "param_value",
                            raw.length() > PARAM_VALUE_PREVIEW
                                    ? raw.substring(0, PARAM_VALUE_PREVIEW) + "..."
                                    : raw)
                    .toMap();
        }

        try {
            LOG.debugv("Calling {0} on server {1}", actionName, serverName);
            return client.callTool(actionName, arguments);
        } catch (McpException e) {
            LOG.warnv(e, "Tool {0} on server {1} failed", actionName, serverName);
            String message =
                    e.getKind() == ErrorKind.EXECUTION_FAILED
                            ? e.getMessage()
                            : McpException.executionFailed(serverName, actionName, e).getMessage();
            return ErrorEnvelope.of(message)
                    .traceback(e)
                    .with("server_name", serverName)
                    .with("action_name", actionName)
                    .with("suggestion", "Check tool parameters and server logs")
                    .toMap();
        } catch (RuntimeException e) {
            LOG.errorv(e, "Unexpected failure calling {0} on server {1}", actionName, serverName);
            return ErrorEnvelope.of(
                            "Unexpected error executing '" + actionName + "': " + e.getMessage())
                    .traceback(e)
                    .with("server_name", serverName)
                    .with("action_name", actionName)
                    .toMap();
        }
    }

    private static Map<String, Object> notConnected(String serverName) {
        return ErrorEnvelope.of(McpException.notConnected(serverName).getMessage())
                .with("server_name", serverName)
                .with("suggestion", "Try reconnecting the server or check its configuration")
                .toMap();
    }

    private void mergeBlock(Map<String, Object> target, String block, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof Map<?, ?> map) {
            map.forEach((k, v) -> target.put(String.valueOf(k), v));
            return;
        }
        String text = value.toString().trim();
        if (text.isEmpty() || text.equals("{}")) {
            return;
        }
        Map<String, Object> parsed;
        try {
            parsed = mapper.readValue(text, OBJECT_MAP);
        } catch (JsonProcessingException e) {
            throw McpException.malformedParameters(block, e);
        }
        if (parsed != null) {
            target.putAll(parsed);
        }
    }

    private static Object blockValue(
            String block, Object pathParams, Object queryParams, Object bodySchema) {
        if ("path_params".equals(block)) {
            return pathParams;
        }
        return "query_params".equals(block) ? queryParams : bodySchema;
    }

    // ========== Management ==========

    /// Runs every field set in the request, in declaration order.
    ///
    /// A field that fails adds an `error: ...` line and the remaining fields still run.
    ///
    /// @param request the operations to run, not null
    /// @return one or more result lines joined by newlines, never null
    public String manageServers(ManageRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        List<String> out = new ArrayList<>();

        if (request.listConfiguredMcps()) {
            out.add(guarded("list_configured_mcps", this::listConfigured));
        }
        if (request.listSets()) {
            out.add(guarded("list_sets", this::listSets));
        }
        if (request.searchSets() != null) {
            out.add(guarded("search_sets", () -> searchSets(request.searchSets())));
        }
        if (request.upsertSet() != null) {
            out.add(guarded("upsert_set", () -> upsertSet(request.upsertSet())));
        }
        if (request.deleteSet() != null) {
            out.add(guarded("delete_set", () -> deleteSet(request.deleteSet())));
        }
        if (request.connect() != null) {
            out.add(guarded("connect", () -> connectOne(request.connect())));
        }
        if (request.connectSet() != null) {
            out.add(
                    guarded(
                            "connect_set",
                            () -> connectSet(request.connectSet(), request.connectSetExclusive())));
        }
        if (request.disconnect() != null) {
            out.add(
                    guarded(
                            "disconnect",
                            () -> {
                                connections.disconnect(request.disconnect());
                                return request.disconnect() + " off";
                            }));
        }
        if (request.disconnectSet() != null) {
            out.add(guarded("disconnect_set", () -> disconnectSet(request.disconnectSet())));
        }
        if (request.disconnectAll()) {
            out.add(
                    guarded(
                            "disconnect_all",
                            () -> {
                                connections.disconnectAll();
                                return "all disconnected";
                            }));
        }
        if (request.populateCatalog()) {
            out.add(guarded("populate_catalog", this::populateCatalog));
        }
        return String.join("\n", out);
    }

    private static String guarded(String field, Supplier<String> step) {
        try {
            return step.get();
        } catch (RuntimeException e) {
            LOG.warnv(e, "manage_servers {0} failed", field);
            return "error: " + e.getMessage();
        }
    }

    private String listConfigured() {
        List<ServerDefinition> servers = registry.listServers();
        if (servers.isEmpty()) {
            return "No servers configured";
        }
        List<String> lines = new ArrayList<>();
        for (ServerDefinition server : servers) {
            lines.add(server.name() + ", " + (connections.isLive(server.name()) ? "on" : "off"));
        }
        return String.join("\n", lines);
    }

    private String listSets() {
        List<ServerSet> sets = registry.listSets();
        if (sets.isEmpty()) {
            return "No sets configured";
        }
        List<String> lines = new ArrayList<>();
        for (ServerSet set : sets) {
            StringBuilder line = new StringBuilder(header(set));
            if (!set.servers().isEmpty()) {
                line.append("\n  servers: ").append(String.join(", ", set.servers()));
            }
            if (!set.includeSets().isEmpty()) {
                line.append("\n  includes: ").append(String.join(", ", set.includeSets()));
            }
            lines.add(line.toString());
        }
        return String.join("\n", lines);
    }

    private String searchSets(String query) {
        String needle = query.toLowerCase(Locale.ROOT);
        List<String> matches = new ArrayList<>();
        for (ServerSet set : registry.listSets()) {
            if (set.name().toLowerCase(Locale.ROOT).contains(needle)
                    || set.description().toLowerCase(Locale.ROOT).contains(needle)) {
                List<String> members = registry.getSet(set.name()).orElse(set.servers());
                matches.add(header(set) + "\n  " + String.join(", ", members));
            }
        }
        return matches.isEmpty() ? "no sets matching '" + query + "'" : String.join("\n", matches);
    }

    private static String header(ServerSet set) {
        return set.description().isEmpty()
                ? set.name() + ":"
                : set.name() + ": " + set.description();
    }

    private String upsertSet(Object raw) {
        Map<String, Object> data = setObject(raw);
        if (data == null) {
            return "error: upsert_set must be an object";
        }
        String name = Arguments.text(data, "name");
        List<String> servers = Arguments.strings(data, "servers");
        List<String> includes = Arguments.strings(data, "include_sets");
        if (name == null || (servers.isEmpty() && includes.isEmpty())) {
            return "error: missing name, or need servers or include_sets";
        }
        registry.upsertSet(name, servers, Arguments.text(data, "description"), includes);
        return "set '" + name + "' saved";
    }

    /// Reads `upsert_set` given as an object or as JSON object text; null if it is neither.
    private Map<String, Object> setObject(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
            return result;
        }
        if (!(raw instanceof String text) || text.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(text, OBJECT_MAP);
        } catch (JsonProcessingException e) {
            LOG.debugv("upsert_set is not a JSON object: {0}", e.getOriginalMessage());
            return null;
        }
    }

    private String deleteSet(String setName) {
        return registry.removeSet(setName)
                ? "set '" + setName + "' deleted"
                : "error: set '" + setName + "' not found";
    }

    private String connectOne(String serverName) {
        Optional<ServerDefinition> definition = registry.getServer(serverName);
        if (definition.isEmpty()) {
            return "error: " + serverName + " not configured";
        }
        ConnectionState state = connections.connect(definition.get());
        return serverName + (state == ConnectionState.CONNECTED ? " on" : " starting");
    }

    private String connectSet(String setName, boolean exclusive) {
        Optional<List<String>> members = registry.getSet(setName);
        if (members.isEmpty()) {
            return "error: set '" + setName + "' not found";
        }

        List<String> stopped = new ArrayList<>();
        if (exclusive) {
            for (String active : connections.listActive()) {
                if (!members.get().contains(active) && connections.disconnect(active)) {
                    stopped.add(active);
                }
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add("connect_set '" + setName + "'" + (exclusive ? " (exclusive):" : ":"));
        for (String server : members.get()) {
            lines.add(server + ": " + connectMember(server));
        }
        String text = String.join("\n", lines);
        return stopped.isEmpty() ? text : text + "\nstopped: " + String.join(", ", stopped);
    }

    private String connectMember(String serverName) {
        if (connections.isLive(serverName)) {
            return "on";
        }
        Optional<ServerDefinition> definition = registry.getServer(serverName);
        if (definition.isEmpty()) {
            return "not configured";
        }
        try {
            return connections.connect(definition.get()) == ConnectionState.CONNECTED
                    ? "on"
                    : "starting";
        } catch (McpException e) {
            return "error - " + e.getMessage();
        }
    }

    private String disconnectSet(String setName) {
        Optional<List<String>> members = registry.getSet(setName);
        if (members.isEmpty()) {
            return "error: set '" + setName + "' not found";
        }
        members.get().forEach(connections::disconnect);
        return "disconnect_set '" + setName + "': " + members.get().size() + " stopped";
    }

    private String populateCatalog() {
        List<ServerDefinition> enabled = registry.listServers(true);
        List<ServerDefinition> missing =
                enabled.stream().filter(s -> !catalog.hasTools(s.name())).toList();
        if (missing.isEmpty()) {
            return "catalog: " + enabled.size() + "/" + enabled.size()
                    + " cached, nothing to populate";
        }

        List<String> lines = new ArrayList<>();
        int indexed = 0;
        for (ServerDefinition server : missing) {
            String name = server.name();
            boolean preExisting = connections.state(name).isPresent();
            try {
                List<ToolDescriptor> tools = connections.connectAndWait(server).listTools();
                catalog.updateServer(name, tools);
                lines.add(name + ": " + tools.size() + " tools");
                indexed++;
            } catch (RuntimeException e) {
                LOG.warnv(e, "Could not index server {0}", name);
                lines.add(name + ": error - " + e.getMessage());
            } finally {
                if (!preExisting) {
                    connections.disconnect(name);
                }
            }
        }
        int skipped = enabled.size() - missing.size();
        return "catalog: indexed " + indexed + ", skipped " + skipped + "\n"
                + String.join("\n", lines);
    }

    // ========== Authentication ==========

    /// Answers an authentication failure. Nothing is persisted or sent anywhere.
    ///
    /// @param serverName the server, may be null
    /// @param intention `get_auth_url` or `save_auth_data`, may be null
    /// @param authData credentials for `save_auth_data`, may be null
    /// @return instruction or acknowledgement payload, or an error envelope
    public Map<String, Object> handleAuthFailure(
            String serverName, String intention, Map<String, Object> authData) {
        if (serverName == null || intention == null) {
            return ErrorEnvelope.of("server_name and intention are required").toMap();
        }
        Map<String, Object> result = new LinkedHashMap<>();
        switch (intention) {
            case "get_auth_url" -> {
                result.put("server", serverName);
                result.put("message", "Authentication required for server '" + serverName + "'");
                result.put("instructions", "Please provide authentication credentials");
                result.put("required_fields", Map.of("token", "Authentication token or API key"));
            }
            case "save_auth_data" -> {
                if (authData == null || authData.isEmpty()) {
                    return ErrorEnvelope.of(
                                    "auth_data is required when intention is 'save_auth_data'")
                            .toMap();
                }
                LOG.infov("Received authentication data for server {0}", serverName);
                result.put("server", serverName);
                result.put("status", "success");
                result.put("message", "Authentication data saved for server '" + serverName + "'");
            }
            default -> {
                return ErrorEnvelope.of("Invalid intention: '" + intention + "'").toMap();
            }
        }
        return result;
    }
}
