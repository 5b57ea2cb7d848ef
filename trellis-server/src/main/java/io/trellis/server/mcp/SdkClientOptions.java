package io.trellis.server.mcp;

import java.time.Duration;
import java.util.Objects;

/// Settings applied to every SDK client the transport strategies build.
///
/// @param clientName name reported to servers during `initialize`, not null
/// @param clientVersion version reported to servers during `initialize`, not null
/// @param requestTimeout per-request timeout; the SDK requires one, not null
/// @param initializationTimeout handshake timeout, not null
public record SdkClientOptions(
        String clientName,
        String clientVersion,
        Duration requestTimeout,
        Duration initializationTimeout) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);
    public static final Duration DEFAULT_INITIALIZATION_TIMEOUT = Duration.ofSeconds(30);

    public SdkClientOptions {
        Objects.requireNonNull(clientName, "clientName must not be null");
        Objects.requireNonNull(clientVersion, "clientVersion must not be null");
        Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
        Objects.requireNonNull(initializationTimeout, "initializationTimeout must not be null");
    }

    public static SdkClientOptions defaults() {
        return new SdkClientOptions(
                "trellis", "0.1.0", DEFAULT_REQUEST_TIMEOUT, DEFAULT_INITIALIZATION_TIMEOUT);
    }
}
