package io.trellis.server.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.trellis.server.dispatch.MetaToolDispatcher;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jboss.logging.Logger;

/// Serves the meta-tools to one calling agent over line-delimited JSON-RPC.
///
/// Reads one message per line and writes one response per request line.
/// Notifications get no response. The loop ends on end of input or after
/// answering `shutdown`.
///
/// ### Methods
/// - `initialize`: echoes the client's protocol version, or
///   {@value #DEFAULT_PROTOCOL_VERSION} when it sends none
/// - `notifications/initialized`, `ping`
/// - `tools/list`: the meta-tool definitions
/// - `tools/call`: one text block holding the meta-tool's result as JSON,
///   or the plain text for `manage_servers`. `isError` is always false; meta-tool
///   failures are reported inside the payload.
/// - `shutdown`
///
/// @implNote Single-threaded. Logs never go to the output stream, which
/// carries only protocol messages.
public class MetaToolServer {

    private static final Logger LOG = Logger.getLogger(MetaToolServer.class);

    public static final String DEFAULT_PROTOCOL_VERSION = "2024-11-05";

    private final MetaToolDispatcher dispatcher;
    private final JsonRpc rpc;
    private final String serverName;
    private final String serverVersion;
    private volatile boolean running;

    /// @param dispatcher executes the meta-tools, not null
    /// @param rpc message codec, not null
    /// @param serverName name reported in `serverInfo`, not null
    /// @param serverVersion version reported in `serverInfo`, not null
    public MetaToolServer(
            MetaToolDispatcher dispatcher, JsonRpc rpc, String serverName, String serverVersion) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.rpc = Objects.requireNonNull(rpc, "rpc must not be null");
        this.serverName = Objects.requireNonNull(serverName, "serverName must not be null");
        this.serverVersion =
                Objects.requireNonNull(serverVersion, "serverVersion must not be null");
    }

    /// Runs the message loop until end of input or `shutdown`.
    ///
    /// @param in incoming messages, one per line, not null
    /// @param out outgoing messages, not null
    /// @throws IOException if reading fails
    public void serve(BufferedReader in, PrintStream out) throws IOException {
        running = true;
        LOG.infov("{0} {1} serving meta-tools", serverName, serverVersion);
        String line;
        while (running && (line = in.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            String response = handle(line);
            if (response != null) {
                out.println(response);
                out.flush();
            }
        }
        running = false;
        LOG.info("Meta-tool server stopped");
    }

    /// Handles one incoming line.
    ///
    /// @param line raw message, not null
    /// @return the response line, or null for notifications
    public String handle(String line) {
        JsonRpc.Request request;
        try {
            request = rpc.parseRequest(line);
        } catch (JsonProcessingException e) {
            LOG.warnv("Unparseable message: {0}", e.getOriginalMessage());
            return rpc.createErrorResponse(null, JsonRpc.PARSE_ERROR, "Parse error");
        } catch (IllegalArgumentException e) {
            return rpc.createErrorResponse(null, JsonRpc.INVALID_REQUEST, e.getMessage());
        }

        LOG.debugv("Received {0}", request.method());
        try {
            Object result = route(request);
            if (request.isNotification()) {
                return null;
            }
            if (result == null) {
                return rpc.createErrorResponse(
                        request.id(),
                        JsonRpc.METHOD_NOT_FOUND,
                        "Method not found: " + request.method());
            }
            return rpc.createResponse(request.id(), result);
        } catch (IllegalArgumentException e) {
            return request.isNotification()
                    ? null
                    : rpc.createErrorResponse(request.id(), JsonRpc.INVALID_PARAMS, e.getMessage());
        } catch (RuntimeException e) {
            LOG.errorv(e, "Error processing {0}", request.method());
            return request.isNotification()
                    ? null
                    : rpc.createErrorResponse(request.id(), JsonRpc.INTERNAL_ERROR, e.getMessage());
        }
    }

    /// Returns whether the loop is running.
    ///
    /// @return true between the start of {@link #serve} and its return
    public boolean isRunning() {
        return running;
    }

    private Object route(JsonRpc.Request request) {
        return switch (request.method()) {
            case "initialize" -> initialize(request.params());
            case "notifications/initialized", "ping" -> Map.of();
            case "tools/list" -> Map.of("tools", dispatcher.toolDefinitions());
            case "tools/call" -> callTool(request.params());
            case "shutdown" -> {
                running = false;
                yield Map.of();
            }
            default -> null;
        };
    }

    private Map<String, Object> initialize(Map<String, Object> params) {
        Object requested = params.get("protocolVersion");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put(
                "protocolVersion",
                requested != null ? requested.toString() : DEFAULT_PROTOCOL_VERSION);
        result.put("capabilities", Map.of("tools", Map.of("listChanged", false)));
        result.put("serverInfo", Map.of("name", serverName, "version", serverVersion));
        return result;
    }

    private Map<String, Object> callTool(Map<String, Object> params) {
        Object name = params.get("name");
        if (name == null || name.toString().isBlank()) {
            throw new IllegalArgumentException("tools/call requires a tool name");
        }
        Map<String, Object> args = new LinkedHashMap<>();
        if (params.get("arguments") instanceof Map<?, ?> arguments) {
            arguments.forEach((k, v) -> args.put(String.valueOf(k), v));
        }

        Object result = dispatcher.dispatch(name.toString(), args);
        String text = result instanceof String s ? s : rpc.toJson(result);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("content", List.of(Map.of("type", "text", "text", text)));
        response.put("isError", false);
        return response;
    }
}
