package com.github.rudygunawan.gencache.key;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Derives deterministic cache keys of the form {@code "{prefix}_{digest}"} from a namespace prefix
 * and a set of named parameters.
 *
 * <p>Parameters are sorted by name and serialized as a JSON array of {@code [name, value]} pairs,
 * with object properties and map entries in sorted order, so the key does not depend on the order
 * in which the parameters were supplied. The digest is the first 16 hex characters of the SHA-256
 * of that canonical form.
 *
 * <p>A value the mapper cannot serialize is replaced by its {@link String#valueOf(Object)} form.
 * Two distinct objects with the same string form therefore derive the same key. Callers whose
 * parameters are not plain data should pass a stable representation explicitly.
 */
public final class KeyDeriver {

    // 16 hex characters
    private static final int DIGEST_BYTES = 8;

    private final ObjectMapper mapper;

    /**
     * Creates a key deriver that serializes parameters with {@code mapper}. The mapper is copied
     * and configured for canonical output; the caller's instance is not modified.
     *
     * @param mapper the mapper used to turn parameter values into JSON
     */
    public KeyDeriver(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null").copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY, true);
    }

    /**
     * Returns the key for {@code prefix} and {@code params}.
     *
     * @param prefix the namespace, e.g. {@code "intro_page"}
     * @param params the parameters that identify the generated content; may be empty
     * @return a key such as {@code "intro_page_a1b2c3d4e5f60718"}
     * @throws IllegalArgumentException if {@code prefix} is blank
     */
    public String derive(String prefix, Map<String, ?> params) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        if (prefix.isBlank()) {
            throw new IllegalArgumentException("prefix must not be blank");
        }
        return prefix + "_" + digest(canonicalForm(params));
    }

    /**
     * Returns {@code params} as a JSON object with fields in name order. Values the mapper cannot
     * serialize are replaced by their string form. Used both for hashing and for recording the
     * parameters next to a generated entry.
     *
     * @param params the parameters, may be null or empty
     * @return a new object node
     */
    public ObjectNode toParamsNode(Map<String, ?> params) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        if (params != null) {
            for (Map.Entry<String, ?> param : new TreeMap<>(params).entrySet()) {
                node.set(param.getKey(), toNode(param.getValue()));
            }
        }
        return node;
    }

    /**
     * Returns the canonical JSON text hashed for {@code params}.
     */
    String canonicalForm(Map<String, ?> params) {
        ArrayNode pairs = JsonNodeFactory.instance.arrayNode();
        Iterator<Map.Entry<String, JsonNode>> fields = toParamsNode(params).fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            pairs.addArray().add(field.getKey()).add(field.getValue());
        }
        try {
            return mapper.writeValueAsString(pairs);
        } catch (JsonProcessingException e) {
            // Every node in the tree is plain JSON at this point
            throw new IllegalStateException("Failed to serialize key parameters", e);
        }
    }

    private JsonNode toNode(Object value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            return TextNode.valueOf(String.valueOf(value));
        }
    }

    private static String digest(String canonical) {
        byte[] hash;
        try {
            hash = MessageDigest.getInstance("SHA-256").digest(canonical.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        return HexFormat.of().formatHex(hash, 0, DIGEST_BYTES);
    }
}
