package io.trellis.core.registry;

import java.util.Locale;

/// Transport used to reach a configured server.
///
/// Closed set: each constant has exactly one
/// {@link io.trellis.core.connection.TransportStrategy} implementation.
public enum TransportKind {
    STDIO("stdio"),
    SSE("sse"),
    HTTP("http");

    private final String wireName;

    TransportKind(String wireName) {
        this.wireName = wireName;
    }

    /// Returns the name used in configuration files.
    ///
    /// @return lower-case wire name, never null
    public String wireName() {
        return wireName;
    }

    /// Returns whether this transport is addressed by URL rather than by command.
    ///
    /// @return true for `sse` and `http`
    public boolean isRemote() {
        return this != STDIO;
    }

    /// Parses a configuration value.
    ///
    /// Blank or null values resolve to `stdio`, matching how older files omit the type.
    ///
    /// @param value the configured type, may be null
    /// @return the transport kind, never null
    /// @throws IllegalArgumentException if the value names no known transport
    public static TransportKind fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return STDIO;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (TransportKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown transport type: " + value);
    }
}
