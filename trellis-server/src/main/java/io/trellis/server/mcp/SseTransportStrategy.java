package io.trellis.server.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.TransportKind;
import java.util.Map;

/// Connects to a server over a Server-Sent-Events stream.
///
/// The URL path is the SSE endpoint (default `/sse`). Configured headers and
/// the auth token are added to every request.
public class SseTransportStrategy extends SdkTransportStrategy {

    static final String DEFAULT_ENDPOINT = "/sse";

    public SseTransportStrategy(SdkClientOptions options, ObjectMapper mapper) {
        super(options, mapper);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.SSE;
    }

    @Override
    protected McpClientTransport createTransport(ServerDefinition definition) {
        RemoteEndpoint endpoint = RemoteEndpoint.parse(definition.url(), DEFAULT_ENDPOINT);
        Map<String, String> headers =
                RemoteEndpoint.requestHeaders(definition.headers(), definition.auth());
        return HttpClientSseClientTransport.builder(endpoint.baseUrl())
                .sseEndpoint(endpoint.endpoint())
                .customizeRequest(request -> headers.forEach(request::header))
                .build();
    }
}
