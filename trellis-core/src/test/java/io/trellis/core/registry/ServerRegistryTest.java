package io.trellis.core.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.trellis.core.exception.PersistenceException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ServerRegistryTest {

    private InMemoryRegistryStore store;
    private ServerRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistryStore();
        registry = new ServerRegistry(store);
    }

    private static ServerDefinition stdio(String name) {
        return ServerDefinition.builder(name).command(name + "-mcp").build();
    }

    @Nested
    class Servers {

        @Test
        void shouldPersistNewServer() {
            boolean changed = registry.upsertServer(stdio("weather"));

            assertThat(changed).isTrue();
            assertThat(store.load().servers()).containsKey("weather");
            assertThat(registry.getServer("weather")).contains(stdio("weather"));
        }

        @Test
        void shouldSkipWriteForEqualDefinition() {
            registry.upsertServer(stdio("weather"));
            int saves = store.saveCount();

            boolean changed = registry.upsertServer(stdio("weather"));

            assertThat(changed).isFalse();
            assertThat(store.saveCount()).isEqualTo(saves);
        }

        @Test
        void shouldKeepInsertionOrder() {
            registry.upsertServer(stdio("b"));
            registry.upsertServer(stdio("a"));
            registry.upsertServer(stdio("c"));

            assertThat(registry.listServers())
                    .extracting(ServerDefinition::name)
                    .containsExactly("b", "a", "c");
        }

        @Test
        void shouldPurgeRemovedServerFromSets() {
            registry.upsertServer(stdio("x"));
            registry.upsertServer(stdio("y"));
            registry.upsertSet("pair", List.of("x", "y"), "", List.of());

            boolean removed = registry.removeServer("x");

            assertThat(removed).isTrue();
            assertThat(registry.getSetDetails("pair").orElseThrow().servers()).containsExactly("y");
            assertThat(store.load().sets().get("pair").servers()).containsExactly("y");
        }

        @Test
        void shouldReturnFalseWhenRemovingUnknownServer() {
            assertThat(registry.removeServer("ghost")).isFalse();
        }

        @Test
        void shouldToggleEnabledAndPersist() {
            registry.upsertServer(stdio("weather"));

            assertThat(registry.disableServer("weather")).isTrue();
            assertThat(registry.listServers(true)).isEmpty();
            assertThat(store.load().servers().get("weather").enabled()).isFalse();

            assertThat(registry.enableServer("weather")).isTrue();
            assertThat(registry.listServers(true)).hasSize(1);
        }

        @Test
        void shouldNotToggleUnknownServer() {
            assertThat(registry.enableServer("ghost")).isFalse();
            assertThat(registry.disableServer("ghost")).isFalse();
        }

        @Test
        void shouldReportConfiguredNames() {
            registry.upsertServer(stdio("weather"));

            assertThat(registry.isConfigured("weather")).isTrue();
            assertThat(registry.isConfigured("maps")).isFalse();
            assertThat(registry.isConfigured(null)).isFalse();
        }
    }

    @Nested
    class Sets {

        @Test
        void shouldResolveIncludesInFirstSeenOrder() {
            registry.upsertSet("a", List.of("x"), "", List.of("b"));
            registry.upsertSet("b", List.of("y"), "", List.of("a"));

            assertThat(registry.getSet("a")).contains(List.of("x", "y"));
            assertThat(registry.getSet("b")).contains(List.of("y", "x"));
        }

        @Test
        void shouldTerminateOnSelfInclude() {
            registry.upsertSet("loop", List.of("x"), "", List.of("loop"));

            assertThat(registry.getSet("loop")).contains(List.of("x"));
        }

        @Test
        void shouldDeduplicateMembersAcrossIncludes() {
            registry.upsertSet("base", List.of("x", "y"), "", List.of());
            registry.upsertSet("extended", List.of("y", "z"), "", List.of("base"));

            assertThat(registry.getSet("extended")).contains(List.of("y", "z", "x"));
        }

        @Test
        void shouldIgnoreMissingIncludedSet() {
            registry.upsertSet("a", List.of("x"), "", List.of("missing"));

            assertThat(registry.getSet("a")).contains(List.of("x"));
        }

        @Test
        void shouldReturnEmptyForUndefinedSet() {
            assertThat(registry.getSet("nope")).isEmpty();
        }

        @Test
        void shouldRejectSetWithoutMembersOrIncludes() {
            assertThatThrownBy(() -> registry.upsertSet("empty", List.of(), "", List.of()))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.upsertSet(" ", List.of("x"), "", null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(registry.listSets()).isEmpty();
        }

        @Test
        void shouldAllowIncludeOnlySet() {
            registry.upsertSet("base", List.of("x"), "", List.of());
            registry.upsertSet("alias", null, "just base", List.of("base"));

            assertThat(registry.getSet("alias")).contains(List.of("x"));
        }

        @Test
        void shouldLeaveIncludingSetsWhenDeleting() {
            registry.upsertSet("base", List.of("x"), "", List.of());
            registry.upsertSet("top", List.of("y"), "", List.of("base"));

            assertThat(registry.removeSet("base")).isTrue();
            assertThat(registry.getSetDetails("top").orElseThrow().includeSets())
                    .containsExactly("base");
            assertThat(registry.getSet("top")).contains(List.of("y"));
            assertThat(registry.removeSet("base")).isFalse();
        }
    }

    @Nested
    class Degradation {

        @Test
        void shouldStartEmptyWhenLoadFails() {
            RegistryStore failing = mock(RegistryStore.class);
            when(failing.load()).thenThrow(new PersistenceException("corrupt file"));

            ServerRegistry degraded = new ServerRegistry(failing);

            assertThat(degraded.listServers()).isEmpty();
            assertThat(degraded.listSets()).isEmpty();
        }

        @Test
        void shouldKeepInMemoryStateWhenSaveFails() {
            RegistryStore failing = mock(RegistryStore.class);
            when(failing.load()).thenReturn(RegistrySnapshot.empty());
            doThrow(new PersistenceException("disk full")).when(failing).save(any());

            ServerRegistry degraded = new ServerRegistry(failing);
            degraded.upsertServer(stdio("weather"));

            assertThat(degraded.getServer("weather")).isPresent();
        }

        @Test
        void shouldReplaceStateOnReload() {
            registry.upsertServer(stdio("weather"));
            store.save(
                    new RegistrySnapshot(
                            Map.of("maps", stdio("maps")),
                            Map.of("geo", ServerSet.shorthand("geo", List.of("maps")))));

            registry.reload();

            assertThat(registry.serverMap()).containsOnlyKeys("maps");
            assertThat(registry.getSet("geo")).contains(List.of("maps"));
        }
    }
}
