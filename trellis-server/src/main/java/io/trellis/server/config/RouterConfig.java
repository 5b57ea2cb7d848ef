package io.trellis.server.config;

import io.trellis.serialization.registry.RegistryFormat;
import io.trellis.server.mcp.SdkClientOptions;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Configuration options for the Trellis router process.
///
/// Use {@link #load()} to resolve settings from the environment, the
/// {@link Builder} for fluent configuration, or setters for mutable configuration.
///
/// ### Resolution order
/// For each key, the first source that defines it wins:
/// 1. environment variable: the key upper-cased with `.` and `-` replaced by `_`
///    (`trellis.registry.path` becomes `TRELLIS_REGISTRY_PATH`)
/// 2. JVM system property with the key itself
/// 3. `trellis.properties` on the classpath
/// 4. the built-in default
///
/// ### Default Values
/// - `trellis.registry.path`: `~/.config/trellis/servers.json`
/// - `trellis.registry.format`: `nested`
/// - `trellis.catalog.path`: `~/.cache/trellis/tool_catalog.json`
/// - `trellis.mcp.request-timeout`: `60s`
/// - `trellis.mcp.initialization-timeout`: `30s`
/// - `trellis.registry.watch`: `false`
///
/// Durations accept `500ms`, `30s`, `2m`, `1h`, a bare number of seconds, or
/// ISO-8601 (`PT30S`). Paths starting with `~` are resolved against `user.home`.
///
/// @implNote **Not thread-safe**. Configure before passing to
/// {@link io.trellis.server.TrellisFactory}.
public class RouterConfig {

    public static final String REGISTRY_PATH = "trellis.registry.path";
    public static final String REGISTRY_FORMAT = "trellis.registry.format";
    public static final String CATALOG_PATH = "trellis.catalog.path";
    public static final String REQUEST_TIMEOUT = "trellis.mcp.request-timeout";
    public static final String INITIALIZATION_TIMEOUT = "trellis.mcp.initialization-timeout";
    public static final String WATCH_REGISTRY = "trellis.registry.watch";

    static final String PROPERTIES_RESOURCE = "trellis.properties";

    private static final Pattern SIMPLE_DURATION = Pattern.compile("(\\d+)\\s*(ms|s|m|h)?");

    private Path registryPath = expandHome("~/.config/trellis/servers.json");
    private RegistryFormat registryFormat = RegistryFormat.NESTED;
    private Path catalogPath = expandHome("~/.cache/trellis/tool_catalog.json");
    private Duration requestTimeout = SdkClientOptions.DEFAULT_REQUEST_TIMEOUT;
    private Duration initializationTimeout = SdkClientOptions.DEFAULT_INITIALIZATION_TIMEOUT;
    private boolean watchRegistry;

    /// Creates a configuration with default values.
    public RouterConfig() {}

    /// Resolves the configuration from the process environment, system
    /// properties and the classpath.
    ///
    /// @return resolved configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static RouterConfig load() {
        return load(System.getProperties(), System.getenv());
    }

    /// Resolves the configuration from explicit sources plus the classpath.
    ///
    /// @param systemProperties second-priority source, not null
    /// @param environment first-priority source, not null
    /// @return resolved configuration, never null
    /// @throws IllegalArgumentException if a value cannot be parsed
    public static RouterConfig load(Properties systemProperties, Map<String, String> environment) {
        Properties defaults = classpathProperties();
        RouterConfig config = new RouterConfig();

        String value = resolve(REGISTRY_PATH, environment, systemProperties, defaults);
        if (value != null) {
            config.setRegistryPath(expandHome(value));
        }
        value = resolve(REGISTRY_FORMAT, environment, systemProperties, defaults);
        if (value != null) {
            config.setRegistryFormat(RegistryFormat.fromConfigName(value));
        }
        value = resolve(CATALOG_PATH, environment, systemProperties, defaults);
        if (value != null) {
            config.setCatalogPath(expandHome(value));
        }
        value = resolve(REQUEST_TIMEOUT, environment, systemProperties, defaults);
        if (value != null) {
            config.setRequestTimeout(parseDuration(REQUEST_TIMEOUT, value));
        }
        value = resolve(INITIALIZATION_TIMEOUT, environment, systemProperties, defaults);
        if (value != null) {
            config.setInitializationTimeout(parseDuration(INITIALIZATION_TIMEOUT, value));
        }
        value = resolve(WATCH_REGISTRY, environment, systemProperties, defaults);
        if (value != null) {
            config.setWatchRegistry(Boolean.parseBoolean(value.trim()));
        }
        return config;
    }

    static String environmentName(String key) {
        return key.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static String resolve(
            String key,
            Map<String, String> environment,
            Properties systemProperties,
            Properties defaults) {
        String value = environment.get(environmentName(key));
        if (value == null || value.isBlank()) {
            value = systemProperties.getProperty(key);
        }
        if (value == null || value.isBlank()) {
            value = defaults.getProperty(key);
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Properties classpathProperties() {
        Properties properties = new Properties();
        try (InputStream in =
                RouterConfig.class.getClassLoader().getResourceAsStream(PROPERTIES_RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + PROPERTIES_RESOURCE, e);
        }
        return properties;
    }

    /// Parses a duration setting.
    ///
    /// @param key setting name for the error message, not null
    /// @param value text to parse, not null
    /// @return positive duration, never null
    /// @throws IllegalArgumentException if the text is not a positive duration
    static Duration parseDuration(String key, String value) {
        String text = value.trim();
        Duration duration;
        Matcher matcher = SIMPLE_DURATION.matcher(text.toLowerCase(Locale.ROOT));
        if (matcher.matches()) {
            long amount = Long.parseLong(matcher.group(1));
            String unit = matcher.group(2) != null ? matcher.group(2) : "s";
            duration =
                    switch (unit) {
                        case "ms" -> Duration.ofMillis(amount);
                        case "m" -> Duration.ofMinutes(amount);
                        case "h" -> Duration.ofHours(amount);
                        default -> Duration.ofSeconds(amount);
                    };
        } else {
            try {
                duration = Duration.parse(text);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException(
                        "Invalid duration for " + key + ": '" + value + "'", e);
            }
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException(
                    "Duration for " + key + " must be positive: '" + value + "'");
        }
        return duration;
    }

    static Path expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + path.substring(1));
        }
        return Path.of(path);
    }

    public Path getRegistryPath() {
        return registryPath;
    }

    public void setRegistryPath(Path registryPath) {
        this.registryPath = Objects.requireNonNull(registryPath, "registryPath must not be null");
    }

    public RegistryFormat getRegistryFormat() {
        return registryFormat;
    }

    public void setRegistryFormat(RegistryFormat registryFormat) {
        this.registryFormat =
                Objects.requireNonNull(registryFormat, "registryFormat must not be null");
    }

    public Path getCatalogPath() {
        return catalogPath;
    }

    public void setCatalogPath(Path catalogPath) {
        this.catalogPath = Objects.requireNonNull(catalogPath, "catalogPath must not be null");
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout =
                Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    public Duration getInitializationTimeout() {
        return initializationTimeout;
    }

    public void setInitializationTimeout(Duration initializationTimeout) {
        this.initializationTimeout =
                Objects.requireNonNull(
                        initializationTimeout, "initializationTimeout must not be null");
    }

    /// Returns whether external edits of the registry file are picked up while running.
    ///
    /// @return `true` to start a registry watcher
    public boolean isWatchRegistry() {
        return watchRegistry;
    }

    public void setWatchRegistry(boolean watchRegistry) {
        this.watchRegistry = watchRegistry;
    }

    /// Returns the SDK client settings derived from this configuration.
    ///
    /// @return client options with the configured timeouts, never null
    public SdkClientOptions toClientOptions() {
        SdkClientOptions defaults = SdkClientOptions.defaults();
        return new SdkClientOptions(
                defaults.clientName(),
                defaults.clientVersion(),
                requestTimeout,
                initializationTimeout);
    }

    /// Creates a new builder for fluent configuration construction.
    ///
    /// @return a new builder instance, never null
    public static Builder builder() {
        return new Builder();
    }

    /// Fluent builder for {@link RouterConfig}.
    ///
    /// @implNote The builder mutates a single config instance and returns it on {@link #build()}.
    public static class Builder {
        private final RouterConfig config = new RouterConfig();

        public Builder registryPath(Path registryPath) {
            config.setRegistryPath(registryPath);
            return this;
        }

        public Builder registryFormat(RegistryFormat registryFormat) {
            config.setRegistryFormat(registryFormat);
            return this;
        }

        public Builder catalogPath(Path catalogPath) {
            config.setCatalogPath(catalogPath);
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            config.setRequestTimeout(requestTimeout);
            return this;
        }

        public Builder initializationTimeout(Duration initializationTimeout) {
            config.setInitializationTimeout(initializationTimeout);
            return this;
        }

        public Builder watchRegistry(boolean watchRegistry) {
            config.setWatchRegistry(watchRegistry);
            return this;
        }

        public RouterConfig build() {
            return config;
        }
    }
}
