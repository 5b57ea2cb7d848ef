package io.trellis.server.rpc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.IntNode;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class JsonRpcTest {

    private final JsonRpc rpc =
            new JsonRpc(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));

    @Test
    void shouldKeepNumericIdAndParams() throws Exception {
        JsonRpc.Request request =
                rpc.parseRequest(
                        "{\"jsonrpc\":\"2.0\",\"id\":42,\"method\":\"tools/call\","
                                + "\"params\":{\"name\":\"x\"}}");

        assertThat(request.id().isInt()).isTrue();
        assertThat(request.method()).isEqualTo("tools/call");
        assertThat(request.params()).containsEntry("name", "x");
        assertThat(request.isNotification()).isFalse();
    }

    @Test
    void shouldTreatNullIdAsNotification() throws Exception {
        JsonRpc.Request request = rpc.parseRequest("{\"id\":null,\"method\":\"ping\"}");

        assertThat(request.isNotification()).isTrue();
        assertThat(request.params()).isEmpty();
    }

    @Test
    void shouldRejectMessageWithoutMethod() {
        assertThatThrownBy(() -> rpc.parseRequest("{\"id\":1,\"result\":{}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Request has no method");
    }

    @Test
    void shouldWriteSingleLineResponsesWithIndentingMapper() {
        String response =
                rpc.createResponse(IntNode.valueOf(3), Map.of("tools", List.of(Map.of("a", 1))));

        assertThat(response)
                .doesNotContain("\n")
                .isEqualTo("{\"jsonrpc\":\"2.0\",\"id\":3,\"result\":{\"tools\":[{\"a\":1}]}}");
    }

    @Test
    void shouldWriteErrorWithNullId() {
        assertThat(rpc.createErrorResponse(null, JsonRpc.PARSE_ERROR, "Parse error"))
                .isEqualTo(
                        "{\"jsonrpc\":\"2.0\",\"id\":null,"
                                + "\"error\":{\"code\":-32700,\"message\":\"Parse error\"}}");
    }
}
