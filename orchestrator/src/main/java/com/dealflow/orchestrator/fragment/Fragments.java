package com.dealflow.orchestrator.fragment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Conversions between Jackson trees and {@link Fragment}s, plus typed path
 * lookups used by stages and report synthesis.
 *
 * Lookups never throw: a missing field, a null, or a value of the wrong shape
 * all read as "absent".
 */
public final class Fragments {

    private static final ObjectMapper JSON = new ObjectMapper();

    private Fragments() {}

    // ------------------------------------------------------------------
    // Jackson <-> Fragment
    // ------------------------------------------------------------------

    public static Fragment fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Fragment.NULL;
        }
        if (node.isObject()) {
            Map<String, Fragment> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                fields.put(e.getKey(), fromJson(e.getValue()));
            }
            return new Fragment.Mapping(fields);
        }
        if (node.isArray()) {
            List<Fragment> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromJson(item)));
            return new Fragment.Sequence(items);
        }
        if (node.isBoolean())    return Fragment.scalar(node.booleanValue());
        if (node.isInt())        return Fragment.scalar(node.intValue());
        if (node.isLong())       return Fragment.scalar(node.longValue());
        if (node.isBigInteger()) return Fragment.scalar(node.bigIntegerValue());
        if (node.isNumber())     return Fragment.scalar(node.doubleValue());
        return Fragment.scalar(node.asText());
    }

    public static JsonNode toJson(Fragment fragment) {
        JsonNodeFactory f = JsonNodeFactory.instance;
        if (fragment instanceof Fragment.Mapping m) {
            ObjectNode obj = f.objectNode();
            m.fields().forEach((k, v) -> obj.set(k, toJson(v)));
            return obj;
        }
        if (fragment instanceof Fragment.Sequence s) {
            ArrayNode arr = f.arrayNode();
            s.items().forEach(item -> arr.add(toJson(item)));
            return arr;
        }
        if (fragment instanceof Fragment.Unparsable u) {
            return f.objectNode().put("_raw_text", u.rawText());
        }
        Object v = ((Fragment.Scalar) fragment).value();
        if (v == null)                 return f.nullNode();
        if (v instanceof Boolean b)    return f.booleanNode(b);
        if (v instanceof Integer i)    return f.numberNode(i);
        if (v instanceof Long l)       return f.numberNode(l);
        if (v instanceof BigInteger b) return f.numberNode(b);
        if (v instanceof BigDecimal b) return f.numberNode(b);
        if (v instanceof Number n)     return f.numberNode(n.doubleValue());
        return f.textNode(v.toString());
    }

    /** Compact JSON text for a fragment, used in prompts and log lines. */
    public static String toJsonString(Fragment fragment) {
        try {
            return JSON.writeValueAsString(toJson(fragment));
        } catch (Exception e) {
            throw new IllegalStateException("Fragment could not be serialised", e);
        }
    }

    /**
     * The string identity used to de-duplicate sequence items: the raw value
     * for scalars, compact JSON for everything else.
     */
    public static String identity(Fragment fragment) {
        if (fragment instanceof Fragment.Scalar s) {
            return String.valueOf(s.value());
        }
        return toJsonString(fragment);
    }

    // ------------------------------------------------------------------
    // Path lookups
    // ------------------------------------------------------------------

    public static Optional<Fragment> at(Fragment root, String... path) {
        Fragment current = root;
        for (String key : path) {
            if (!(current instanceof Fragment.Mapping m)) {
                return Optional.empty();
            }
            current = m.get(key);
            if (current == null) {
                return Optional.empty();
            }
        }
        if (current instanceof Fragment.Scalar s && s.isNull()) {
            return Optional.empty();
        }
        return Optional.ofNullable(current);
    }

    public static Optional<String> stringAt(Fragment root, String... path) {
        return at(root, path)
                .filter(Fragment.Scalar.class::isInstance)
                .map(f -> String.valueOf(((Fragment.Scalar) f).value()))
                .filter(s -> !s.isBlank());
    }

    public static Optional<Double> doubleAt(Fragment root, String... path) {
        return at(root, path)
                .filter(Fragment.Scalar.class::isInstance)
                .map(f -> ((Fragment.Scalar) f).value())
                .flatMap(Fragments::toDouble);
    }

    public static Optional<Integer> intAt(Fragment root, String... path) {
        return doubleAt(root, path).map(Double::intValue);
    }

    /** String items of a sequence; non-scalar items are rendered as JSON. */
    public static List<String> stringsAt(Fragment root, String... path) {
        return at(root, path)
                .filter(Fragment.Sequence.class::isInstance)
                .map(f -> ((Fragment.Sequence) f).items().stream()
                        .map(Fragments::identity)
                        .toList())
                .orElse(List.of());
    }

    public static boolean booleanAt(Fragment root, String... path) {
        return at(root, path)
                .filter(Fragment.Scalar.class::isInstance)
                .map(f -> ((Fragment.Scalar) f).value())
                .map(v -> v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString()))
                .orElse(false);
    }

    private static Optional<Double> toDouble(Object value) {
        if (value instanceof Number n) {
            return Optional.of(n.doubleValue());
        }
        try {
            return Optional.of(Double.parseDouble(value.toString().trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
