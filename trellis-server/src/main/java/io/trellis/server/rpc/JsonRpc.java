package io.trellis.server.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.UncheckedIOException;
import java.util.Map;
import java.util.Objects;

/// JSON-RPC 2.0 helper for the line-delimited meta-tool server.
///
/// Every message this class writes is a single line, whatever indentation the
/// shared mapper is configured with, since a newline ends a message on the wire.
///
/// ### Message Types
/// - **Request**: Has `id`, `method`, `params` - expects a response
/// - **Notification**: Has `method`, `params`, no `id` - no response expected
/// - **Response**: Has `id`, `result` or `error`
///
/// @see MetaToolServer for message routing
/// @see <a href="https://www.jsonrpc.org/specification">JSON-RPC 2.0 Spec</a>
public class JsonRpc {

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;

    private static final TypeReference<Map<String, Object>> OBJECT_MAP = new TypeReference<>() {};

    private final ObjectMapper mapper;
    private final ObjectWriter writer;

    public JsonRpc(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.writer = mapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    /// An incoming request or notification.
    ///
    /// @param id request id as sent (string or number), null for notifications
    /// @param method the method to invoke, not null
    /// @param params method parameters, never null (empty when absent)
    public record Request(JsonNode id, String method, Map<String, Object> params) {

        /// Compact constructor with validation.
        public Request {
            Objects.requireNonNull(method, "method must not be null");
            params = params != null ? params : Map.of();
        }

        /// Returns whether no response is expected.
        ///
        /// @return true if the message carried no id
        public boolean isNotification() {
            return id == null;
        }
    }

    /// Parses one incoming message.
    ///
    /// @param json the raw line, not null
    /// @return parsed request, never null
    /// @throws JsonProcessingException if the line is not JSON
    /// @throws IllegalArgumentException if the JSON is not a request object with a method
    public Request parseRequest(String json) throws JsonProcessingException {
        JsonNode node = mapper.readTree(json);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Request must be a JSON object");
        }
        JsonNode method = node.get("method");
        if (method == null || !method.isTextual()) {
            throw new IllegalArgumentException("Request has no method");
        }
        JsonNode id = node.get("id");
        Map<String, Object> params = Map.of();
        JsonNode paramsNode = node.get("params");
        if (paramsNode != null && paramsNode.isObject()) {
            params = mapper.convertValue(paramsNode, OBJECT_MAP);
        }
        return new Request(id == null || id.isNull() ? null : id, method.asText(), params);
    }

    /// Creates a JSON-RPC success response.
    ///
    /// @param id the request ID being responded to, may be null
    /// @param result the result data
    /// @return JSON-RPC response line
    public String createResponse(JsonNode id, Object result) {
        ObjectNode root = envelope(id);
        root.set("result", mapper.valueToTree(result));
        return toJson(root);
    }

    /// Creates a JSON-RPC error response.
    ///
    /// @param id the request ID being responded to, may be null
    /// @param code error code
    /// @param message error message
    /// @return JSON-RPC error response line
    public String createErrorResponse(JsonNode id, int code, String message) {
        ObjectNode root = envelope(id);
        ObjectNode error = root.putObject("error");
        error.put("code", code);
        error.put("message", message);
        return toJson(root);
    }

    /// Serializes a value as compact JSON.
    ///
    /// @param value any Jackson-serializable value
    /// @return single-line JSON text
    public String toJson(Object value) {
        try {
            return writer.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    private ObjectNode envelope(JsonNode id) {
        ObjectNode root = mapper.createObjectNode();
        root.put("jsonrpc", "2.0");
        root.set("id", id != null ? id : NullNode.getInstance());
        return root;
    }
}
