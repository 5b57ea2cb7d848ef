package io.trellis.serialization.registry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trellis.core.exception.PersistenceException;
import io.trellis.core.registry.ServerDefinition;
import io.trellis.core.registry.ServerSet;
import io.trellis.core.registry.TransportKind;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiFunction;
import org.jboss.logging.Logger;

/// Tree helpers shared by both registry layouts. Sets are stored identically
/// in both.
abstract class AbstractRegistryCodec implements RegistryCodec {

    private static final Logger LOG = Logger.getLogger(AbstractRegistryCodec.class);

    /// Reads the `sets` object. A set stored as a bare array of names is read as
    /// a shorthand set.
    static Map<String, ServerSet> readSets(JsonNode setsNode) {
        Map<String, ServerSet> sets = new LinkedHashMap<>();
        if (setsNode == null || !setsNode.isObject()) {
            return sets;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = setsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            if (value.isArray()) {
                sets.put(name, ServerSet.shorthand(name, strings(value)));
            } else if (value.isObject()) {
                sets.put(
                        name,
                        new ServerSet(
                                name,
                                text(value, "description"),
                                strings(value.get("servers")),
                                strings(value.get("include_sets"))));
            } else {
                LOG.warnv("Ignoring set {0}: expected an object or an array", name);
            }
        }
        return sets;
    }

    /// Reads the `servers` object entry by entry. An entry that cannot be read,
    /// such as one with an unknown `type`, is skipped so the others still load.
    static Map<String, ServerDefinition> readServers(
            JsonNode serversNode, BiFunction<String, JsonNode, ServerDefinition> reader) {
        Map<String, ServerDefinition> servers = new LinkedHashMap<>();
        if (serversNode == null || !serversNode.isObject()) {
            return servers;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = serversNode.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            try {
                servers.put(entry.getKey(), reader.apply(entry.getKey(), entry.getValue()));
            } catch (PersistenceException | IllegalArgumentException e) {
                LOG.warnv("Skipping server {0}: {1}", entry.getKey(), e.getMessage());
            }
        }
        return servers;
    }

    static ObjectNode writeSets(ObjectNode parent, Map<String, ServerSet> sets) {
        ObjectNode setsNode = parent.putObject("sets");
        for (ServerSet set : sets.values()) {
            ObjectNode node = setsNode.putObject(set.name());
            node.put("description", set.description());
            putStrings(node.putArray("servers"), set.servers());
            if (!set.includeSets().isEmpty()) {
                putStrings(node.putArray("include_sets"), set.includeSets());
            }
        }
        return setsNode;
    }

    static TransportKind transport(String serverName, String wireName) {
        try {
            return TransportKind.fromWireName(wireName);
        } catch (IllegalArgumentException e) {
            throw new PersistenceException(
                    "Server '" + serverName + "' has unknown type '" + wireName + "'", e);
        }
    }

    /// Returns a text field, or null if it is missing or JSON null.
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(element -> values.add(element.asText()));
        }
        return values;
    }

    static Map<String, String> stringMap(JsonNode node) {
        Map<String, String> values = new LinkedHashMap<>();
        if (node != null && node.isObject()) {
            node.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
        }
        return values;
    }

    static void putStrings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    static void putStringMap(ObjectNode object, Map<String, String> values) {
        values.forEach(object::put);
    }
}
