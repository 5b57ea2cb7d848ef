package io.trellis.server.dispatch;

import java.util.Map;

/// Arguments of `manage_servers`. Every field is optional and independent;
/// the dispatcher runs each one that is set, in declaration order.
///
/// @param listConfiguredMcps list configured servers with their on/off state
/// @param listSets list every set
/// @param searchSets set name/description substring to look for, or null
/// @param upsertSet `{name, servers, description, include_sets}` to save, as an object or
///     its JSON text, or null
/// @param deleteSet set to delete, or null
/// @param connect server to connect, or null
/// @param connectSet set whose servers to connect, or null
/// @param connectSetExclusive with `connectSet`, disconnect live servers outside the set first
/// @param disconnect server to disconnect, or null
/// @param disconnectSet set whose servers to disconnect, or null
/// @param disconnectAll disconnect every server
/// @param populateCatalog index enabled servers missing from the catalog
public record ManageRequest(
        boolean listConfiguredMcps,
        boolean listSets,
        String searchSets,
        Object upsertSet,
        String deleteSet,
        String connect,
        String connectSet,
        boolean connectSetExclusive,
        String disconnect,
        String disconnectSet,
        boolean disconnectAll,
        boolean populateCatalog) {

    /// Reads a request from raw meta-tool arguments. Blank strings count as absent.
    ///
    /// @param arguments `manage_servers` arguments, not null
    /// @return request, never null
    public static ManageRequest fromArguments(Map<String, Object> arguments) {
        return new ManageRequest(
                Arguments.flag(arguments, "list_configured_mcps"),
                Arguments.flag(arguments, "list_sets"),
                Arguments.text(arguments, "search_sets"),
                arguments.get("upsert_set"),
                Arguments.text(arguments, "delete_set"),
                Arguments.text(arguments, "connect"),
                Arguments.text(arguments, "connect_set"),
                Arguments.flag(arguments, "connect_set_exclusive"),
                Arguments.text(arguments, "disconnect"),
                Arguments.text(arguments, "disconnect_set"),
                Arguments.flag(arguments, "disconnect_all"),
                Arguments.flag(arguments, "populate_catalog"));
    }
}
