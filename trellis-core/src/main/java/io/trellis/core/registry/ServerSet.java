package io.trellis.core.registry;

import java.util.List;
import java.util.Objects;

/// A named, composable group of servers.
///
/// Members may name servers that are not (or no longer) configured. Included
/// sets are resolved by {@link ServerRegistry#getSet(String)}; this record only
/// holds the direct, unresolved definition.
///
/// @param name unique set name, not null
/// @param description free-text purpose, never null (may be empty)
/// @param servers direct members in declaration order, never null
/// @param includeSets names of other sets composed into this one, never null
public record ServerSet(
        String name, String description, List<String> servers, List<String> includeSets) {

    /// Compact constructor with validation.
    public ServerSet {
        Objects.requireNonNull(name, "name must not be null");
        description = description != null ? description : "";
        servers = servers != null ? List.copyOf(servers) : List.of();
        includeSets = includeSets != null ? List.copyOf(includeSets) : List.of();
    }

    /// Creates a set from the bare list of names older files use.
    ///
    /// @param name set name, not null
    /// @param servers direct members, not null
    /// @return set with empty description and no includes, never null
    public static ServerSet shorthand(String name, List<String> servers) {
        return new ServerSet(name, "", servers, List.of());
    }

    /// Returns a copy without the given server among the direct members.
    ///
    /// @param serverName server to drop, not null
    /// @return this set if the server was not a member, otherwise a new set
    public ServerSet without(String serverName) {
        if (!servers.contains(serverName)) {
            return this;
        }
        List<String> remaining = servers.stream().filter(s -> !s.equals(serverName)).toList();
        return new ServerSet(name, description, remaining, includeSets);
    }
}
