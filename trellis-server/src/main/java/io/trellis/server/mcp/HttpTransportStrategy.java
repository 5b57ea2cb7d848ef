package io.trellis.server.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.client.transport.HttpClientStreamableHttpTransport;
import io.modelcontextprotocol.spec.McpClientTransport;
import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.TransportKind;
import java.util.Map;

/// Connects to a server over streamable HTTP.
///
/// The URL path is the endpoint (default `/mcp`). Configured headers and the
/// auth token are added to every request.
public class HttpTransportStrategy extends SdkTransportStrategy {

    static final String DEFAULT_ENDPOINT = "/mcp";

    public HttpTransportStrategy(SdkClientOptions options, ObjectMapper mapper) {
        super(options, mapper);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.HTTP;
    }

    @Override
    protected McpClientTransport createTransport(ServerDefinition definition) {
        RemoteEndpoint endpoint = RemoteEndpoint.parse(definition.url(), DEFAULT_ENDPOINT);
        Map<String, String> headers =
                RemoteEndpoint.requestHeaders(definition.headers(), definition.auth());
        return HttpClientStreamableHttpTransport.builder(endpoint.baseUrl())
                .endpoint(endpoint.endpoint())
                .resumableStreams(true)
                .openConnectionOnStartup(false)
                .customizeRequest(request -> headers.forEach(request::header))
                .build();
    }
}
