package io.trellis.core.connection;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.trellis.core.connection.McpException.ErrorKind;
import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.TransportKind;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {

    private TransportStrategy stdio;
    private ConnectionManager manager;

    @BeforeEach
    void setUp() {
        stdio = mock(TransportStrategy.class);
        when(stdio.kind()).thenReturn(TransportKind.STDIO);
        manager = new ConnectionManager(List.of(stdio));
    }

    @AfterEach
    void tearDown() {
        manager.close();
    }

    private static ServerDefinition server(String name) {
        return ServerDefinition.builder(name).command(name + "-mcp").build();
    }

    private static McpConnection connection(String name) {
        McpConnection connection = mock(McpConnection.class);
        when(connection.serverName()).thenReturn(name);
        when(connection.isConnected()).thenReturn(true);
        return connection;
    }

    @Nested
    class Connect {

        @Test
        void shouldReturnConnectedClientAfterHandshake() {
            McpConnection weather = connection("weather");
            when(stdio.connect(any())).thenReturn(weather);

            McpConnection client = manager.connectAndWait(server("weather"));

            assertThat(client).isSameAs(weather);
            assertThat(manager.getClient("weather")).isSameAs(weather);
            assertThat(manager.isLive("weather")).isTrue();
            assertThat(manager.state("weather")).contains(ConnectionState.CONNECTED);
            assertThat(manager.listActive()).containsExactly("weather");
        }

        @Test
        void shouldReportConnectingWithoutWaiting() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            McpConnection weather = connection("weather");
            when(stdio.connect(any()))
                    .thenAnswer(
                            invocation -> {
                                release.await(5, TimeUnit.SECONDS);
                                return weather;
                            });

            ConnectionState state = manager.connect(server("weather"));

            assertThat(state).isEqualTo(ConnectionState.CONNECTING);
            assertThat(manager.isLive("weather")).isFalse();
            assertThat(manager.listActive()).containsExactly("weather");
            assertThatThrownBy(() -> manager.getClient("weather"))
                    .isInstanceOf(McpException.class)
                    .extracting(e -> ((McpException) e).getKind())
                    .isEqualTo(ErrorKind.NOT_CONNECTED);

            release.countDown();
            assertThat(manager.connectAndWait(server("weather"))).isSameAs(weather);
        }

        @Test
        void shouldOpenOneSessionForRepeatedConnects() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            McpConnection weather = connection("weather");
            when(stdio.connect(any()))
                    .thenAnswer(
                            invocation -> {
                                entered.countDown();
                                release.await(5, TimeUnit.SECONDS);
                                return weather;
                            });

            manager.connect(server("weather"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            manager.connect(server("weather"));
            release.countDown();
            manager.connectAndWait(server("weather"));
            manager.connect(server("weather"));

            verify(stdio, times(1)).connect(any());
        }

        @Test
        void shouldRemoveEntryWhenHandshakeFails() {
            McpConnection weather = connection("weather");
            when(stdio.connect(any()))
                    .thenThrow(new IllegalStateException("command not found"))
                    .thenReturn(weather);

            assertThatThrownBy(() -> manager.connectAndWait(server("weather")))
                    .isInstanceOf(McpException.class)
                    .extracting(e -> ((McpException) e).getKind())
                    .isEqualTo(ErrorKind.HANDSHAKE_FAILED);
            assertThat(manager.state("weather")).isEmpty();
            assertThat(manager.listActive()).isEmpty();

            assertThat(manager.connectAndWait(server("weather"))).isSameAs(weather);
        }

        @Test
        void shouldRejectTransportWithoutStrategy() {
            ServerDefinition remote =
                    ServerDefinition.builder("remote")
                            .transport(TransportKind.HTTP)
                            .url("http://localhost:9000/mcp")
                            .build();

            assertThatThrownBy(() -> manager.connect(remote))
                    .isInstanceOf(McpException.class)
                    .extracting(e -> ((McpException) e).getKind())
                    .isEqualTo(ErrorKind.HANDSHAKE_FAILED);
            assertThat(manager.state("remote")).isEmpty();
        }

        @Test
        void shouldRejectDuplicateStrategies() {
            TransportStrategy other = mock(TransportStrategy.class);
            when(other.kind()).thenReturn(TransportKind.STDIO);

            assertThatThrownBy(() -> new ConnectionManager(List.of(stdio, other)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    class Disconnect {

        @Test
        void shouldCloseConnectionAndForgetServer() {
            McpConnection weather = connection("weather");
            when(stdio.connect(any())).thenReturn(weather);
            manager.connectAndWait(server("weather"));

            assertThat(manager.disconnect("weather")).isTrue();

            verify(weather).close();
            assertThat(manager.state("weather")).isEmpty();
            assertThat(manager.disconnect("weather")).isFalse();
        }

        @Test
        void shouldCloseLateConnectionWhenDisconnectedWhileConnecting() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            McpConnection late = connection("slow");
            when(stdio.connect(any()))
                    .thenAnswer(
                            invocation -> {
                                entered.countDown();
                                release.await(5, TimeUnit.SECONDS);
                                return late;
                            });

            manager.connect(server("slow"));
            assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
            manager.disconnect("slow");
            release.countDown();

            verify(late, timeout(5000)).close();
            assertThat(manager.isLive("slow")).isFalse();
            assertThat(manager.listActive()).isEmpty();
        }

        @Test
        void shouldIsolateCloseFailures() {
            McpConnection broken = connection("broken");
            McpConnection healthy = connection("healthy");
            doThrow(new IllegalStateException("pipe closed")).when(broken).close();
            when(stdio.connect(any()))
                    .thenAnswer(
                            invocation ->
                                    invocation.<ServerDefinition>getArgument(0).name().equals("broken")
                                            ? broken
                                            : healthy);
            manager.connectAndWait(server("broken"));
            manager.connectAndWait(server("healthy"));

            int closed = manager.disconnectAll();

            assertThat(closed).isEqualTo(2);
            verify(healthy).close();
            assertThat(manager.listActive()).isEmpty();
        }
    }
}
