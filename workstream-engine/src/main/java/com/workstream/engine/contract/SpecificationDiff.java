package com.workstream.engine.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.workstream.core.model.ContractDiff;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Structural comparison of contract specifications.
 *
 * Specifications are flattened into JSON paths ("response.user.id") with a signature
 * per path: the JSON node type, plus the value for schema keywords such as
 * {@code type} and {@code format}. A path that disappears is a removal, a path whose
 * signature changes is a retype.
 *
 * Array elements are addressed by identity so that dropping one element is seen as a
 * removal:
 * <ul>
 *   <li>objects with {@code method} and {@code path}: {@code endpoints[GET /users]}</li>
 *   <li>objects with {@code id} or {@code name}: {@code fields[id=7]}, {@code fields[name=email]}</li>
 *   <li>scalars by value: {@code roles[=admin]}</li>
 *   <li>any other element by position: {@code rows[#0]}</li>
 * </ul>
 */
public final class SpecificationDiff {

    private static final ObjectMapper CANONICAL = new ObjectMapper()
        .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    /**
     * Keywords whose textual value is part of the structure, not documentation.
     */
    static final Set<String> TYPE_KEYWORDS = Set.of("type", "format", "$ref");

    private SpecificationDiff() {
    }

    public static ContractDiff compare(JsonNode previous, JsonNode next) {
        Map<String, String> before = flatten(previous);
        Map<String, String> after = flatten(next);

        Set<String> added = new TreeSet<>();
        Set<String> removed = new TreeSet<>();
        Set<String> retyped = new TreeSet<>();

        for (Map.Entry<String, String> entry : before.entrySet()) {
            String nextSignature = after.get(entry.getKey());
            if (nextSignature == null) {
                removed.add(entry.getKey());
            } else if (!nextSignature.equals(entry.getValue())) {
                retyped.add(entry.getKey());
            }
        }
        for (String path : after.keySet()) {
            if (!before.containsKey(path)) {
                added.add(path);
            }
        }
        return new ContractDiff(added, removed, retyped);
    }

    /**
     * SHA-256 of the specification serialized with sorted object keys,
     * so equal specifications hash equally regardless of field order.
     */
    public static String hash(JsonNode specification) {
        try {
            Object plain = CANONICAL.convertValue(specification, Object.class);
            byte[] canonical = CANONICAL.writeValueAsString(plain).getBytes(StandardCharsets.UTF_8);
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Specification is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    static Map<String, String> flatten(JsonNode node) {
        Map<String, String> paths = new TreeMap<>();
        if (node != null) {
            collect("", node, paths);
        }
        return paths;
    }

    private static void collect(String prefix, JsonNode node, Map<String, String> paths) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String path = prefix.isEmpty() ? field.getKey() : prefix + "." + field.getKey();
                paths.put(path, signature(field.getKey(), field.getValue()));
                collect(path, field.getValue(), paths);
            }
        } else if (node.isArray()) {
            int index = 0;
            for (JsonNode element : node) {
                String path = prefix + "[" + elementKey(element, index++) + "]";
                paths.putIfAbsent(path, signature(null, element));
                collect(path, element, paths);
            }
        }
    }

    private static String signature(String fieldName, JsonNode value) {
        String type = value.getNodeType().name();
        if (fieldName != null && value.isTextual() && TYPE_KEYWORDS.contains(fieldName)) {
            return type + ":" + value.asText();
        }
        return type;
    }

    private static String elementKey(JsonNode element, int index) {
        if (element.isObject()) {
            JsonNode method = element.get("method");
            JsonNode path = element.get("path");
            if (method != null && method.isValueNode() && path != null && path.isValueNode()) {
                return method.asText() + " " + path.asText();
            }
            for (String identity : new String[] {"id", "name"}) {
                JsonNode value = element.get(identity);
                if (value != null && value.isValueNode()) {
                    return identity + "=" + value.asText();
                }
            }
            return "#" + index;
        }
        if (element.isValueNode()) {
            return "=" + element.asText();
        }
        return "#" + index;
    }
}
