package io.trellis.core.registry;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Configuration of one remote tool server.
///
/// Only the fields relevant to {@link #transport()} are used when connecting:
/// - `stdio`: {@link #command()}, {@link #args()}, {@link #env()}
/// - `sse` / `http`: {@link #url()}, {@link #headers()}, {@link #auth()}
///
/// The remaining fields are kept so that files written in the flat layout
/// round-trip unchanged.
///
/// ### Contracts
/// - **Precondition**: `name` must not be null or blank
/// - **Postcondition**: collections are immutable copies; equality is structural
///
/// ### Usage
/// {@snippet :
/// ServerDefinition weather = ServerDefinition.builder("weather")
///     .command("uvx")
///     .args(List.of("weather-mcp"))
///     .build();
/// }
///
/// @param name unique server name, not null
/// @param transport how the server is reached, not null
/// @param command executable for `stdio`, never null (may be empty)
/// @param args ordered command arguments, never null
/// @param env variables overlaid on the inherited process environment, never null
/// @param url endpoint for `sse`/`http`, may be null
/// @param headers extra request headers for `sse`/`http`, never null
/// @param auth bearer token for `sse`/`http`, may be null
/// @param enabled whether bulk operations such as catalog population include this server
public record ServerDefinition(
        String name,
        TransportKind transport,
        String command,
        List<String> args,
        Map<String, String> env,
        String url,
        Map<String, String> headers,
        String auth,
        boolean enabled) {

    /// Compact constructor with validation.
    public ServerDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        transport = transport != null ? transport : TransportKind.STDIO;
        command = command != null ? command : "";
        args = args != null ? List.copyOf(args) : List.of();
        env = env != null ? copyOrdered(env) : Map.of();
        headers = headers != null ? copyOrdered(headers) : Map.of();
    }

    /// Returns a copy of this definition with a different enabled flag.
    ///
    /// @param enabled the new flag
    /// @return new definition, never null
    public ServerDefinition withEnabled(boolean enabled) {
        return new ServerDefinition(
                name, transport, command, args, env, url, headers, auth, enabled);
    }

    /// Returns whether an auth token is configured.
    ///
    /// @return true if {@link #auth()} is non-blank
    public boolean hasAuth() {
        return auth != null && !auth.isBlank();
    }

    /// Creates a builder for the given server name.
    ///
    /// @param name unique server name, not null
    /// @return new builder, never null
    public static Builder builder(String name) {
        return new Builder(name);
    }

    private static Map<String, String> copyOrdered(Map<String, String> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /// Fluent builder for {@link ServerDefinition}.
    public static final class Builder {
        private final String name;
        private TransportKind transport = TransportKind.STDIO;
        private String command = "";
        private List<String> args = List.of();
        private Map<String, String> env = Map.of();
        private String url;
        private Map<String, String> headers = Map.of();
        private String auth;
        private boolean enabled = true;

        private Builder(String name) {
            this.name = name;
        }

        public Builder transport(TransportKind transport) {
            this.transport = transport;
            return this;
        }

        public Builder command(String command) {
            this.command = command;
            return this;
        }

        public Builder args(List<String> args) {
            this.args = args;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env;
            return this;
        }

        /// Sets the endpoint URL. Does not change the transport.
        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder auth(String auth) {
            this.auth = auth;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public ServerDefinition build() {
            return new ServerDefinition(
                    name, transport, command, args, env, url, headers, auth, enabled);
        }
    }
}
