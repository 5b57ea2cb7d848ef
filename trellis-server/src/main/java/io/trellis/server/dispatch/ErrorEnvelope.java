package io.trellis.server.dispatch;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// The failure shape every meta-tool returns:
/// `{status: "error", error: <message>, ...context}`.
///
/// Context fields keep insertion order; null values are left out.
///
/// ### Usage
/// {@snippet :
/// return ErrorEnvelope.of("Server 'weather' is not connected")
///         .with("suggestion", "Connect first")
///         .toMap();
/// }
public final class ErrorEnvelope {

    public static final String STATUS = "status";
    public static final String ERROR = "error";
    public static final String TRACEBACK = "traceback";

    private final Map<String, Object> fields = new LinkedHashMap<>();

    private ErrorEnvelope(String message) {
        fields.put(STATUS, ERROR);
        fields.put(ERROR, Objects.requireNonNull(message, "message must not be null"));
    }

    public static ErrorEnvelope of(String message) {
        return new ErrorEnvelope(message);
    }

    /// Adds a context field.
    ///
    /// @param key field name, not null
    /// @param value field value; null leaves the field out
    /// @return this envelope for chaining, never null
    public ErrorEnvelope with(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        if (value != null) {
            fields.put(key, value);
        }
        return this;
    }

    /// Adds the stack trace of a failure as `traceback`.
    ///
    /// @param failure the failure, not null
    /// @return this envelope for chaining, never null
    public ErrorEnvelope traceback(Throwable failure) {
        StringWriter trace = new StringWriter();
        failure.printStackTrace(new PrintWriter(trace));
        fields.put(TRACEBACK, trace.toString());
        return this;
    }

    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }
}
