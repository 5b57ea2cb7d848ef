package io.trellis.serialization.registry;

import java.util.Locale;

/// On-disk layouts of the server registry file.
///
/// ```
/// NESTED   { "mcp": { "servers": { name: {...} }, "sets": {...} } }
/// LEGACY   { "servers": { name: { "name": name, ... } }, "sets": {...} }
/// ```
public enum RegistryFormat {
    NESTED("nested"),
    LEGACY("legacy");

    private final String configName;

    RegistryFormat(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    /// Returns a codec for this layout.
    ///
    /// @return new codec, never null
    public RegistryCodec codec() {
        return switch (this) {
            case NESTED -> new NestedRegistryCodec();
            case LEGACY -> new LegacyRegistryCodec();
        };
    }

    /// Parses a configuration value.
    ///
    /// @param value `nested` or `legacy`, case-insensitive; null or blank means nested
    /// @return the format, never null
    /// @throws IllegalArgumentException for any other value
    public static RegistryFormat fromConfigName(String value) {
        if (value == null || value.isBlank()) {
            return NESTED;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RegistryFormat format : values()) {
            if (format.configName.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown registry format: " + value);
    }
}
