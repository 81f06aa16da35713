package com.dealflow.orchestrator.fragment;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A tree-shaped piece of structured data produced by one stage (or one batch
 * of a stage) before final aggregation.
 *
 * The variant set is closed: a fragment is a scalar leaf, an ordered sequence,
 * a field mapping, or a response that could not be parsed at all. Mapping field
 * order is preserved so that reports serialise in the order the reasoning
 * service produced them.
 *
 * Every variant serialises to plain JSON through Jackson's {@code @JsonValue}.
 */
public sealed interface Fragment
        permits Fragment.Scalar, Fragment.Sequence, Fragment.Mapping, Fragment.Unparsable {

    /** Shared instance for JSON null. */
    Scalar NULL = new Scalar(null);

    static Scalar scalar(Object value) {
        return value == null ? NULL : new Scalar(value);
    }

    static Sequence sequence(List<? extends Fragment> items) {
        return new Sequence(new ArrayList<Fragment>(items));
    }

    static Mapping mapping(Map<String, ? extends Fragment> fields) {
        return new Mapping(new LinkedHashMap<String, Fragment>(fields));
    }

    static Mapping emptyMapping() {
        return new Mapping(Map.of());
    }

    static Unparsable unparsable(String rawText) {
        return new Unparsable(rawText);
    }

    // ------------------------------------------------------------------
    // Variants
    // ------------------------------------------------------------------

    /**
     * A leaf value: String, Number, Boolean, or null.
     */
    record Scalar(Object value) implements Fragment {

        @JsonValue
        @Override
        public Object value() { return value; }

        public boolean isNull() { return value == null; }
    }

    /**
     * An ordered list of fragments. The list is copied and unmodifiable.
     */
    record Sequence(List<Fragment> items) implements Fragment {

        public Sequence {
            items = Collections.unmodifiableList(new ArrayList<>(items));
        }

        @JsonValue
        @Override
        public List<Fragment> items() { return items; }

        public int size() { return items.size(); }
    }

    /**
     * Named fields in insertion order. The map is copied and unmodifiable.
     */
    record Mapping(Map<String, Fragment> fields) implements Fragment {

        public Mapping {
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @JsonValue
        @Override
        public Map<String, Fragment> fields() { return fields; }

        public Fragment get(String name) { return fields.get(name); }

        public boolean has(String name)  { return fields.containsKey(name); }

        public boolean isEmpty()         { return fields.isEmpty(); }

        /** Returns a copy of this mapping with one field added or replaced. */
        public Mapping with(String name, Fragment value) {
            Map<String, Fragment> copy = new LinkedHashMap<>(fields);
            copy.put(name, value);
            return new Mapping(copy);
        }
    }

    /**
     * Raw text returned by the reasoning service that could not be read as
     * JSON. Carried so it can be logged or inspected; merging ignores it.
     */
    record Unparsable(String rawText) implements Fragment {

        @JsonValue
        public Map<String, Object> asJson() {
            Map<String, Object> json = new LinkedHashMap<>();
            json.put("_raw_text", rawText);
            return json;
        }
    }
}
