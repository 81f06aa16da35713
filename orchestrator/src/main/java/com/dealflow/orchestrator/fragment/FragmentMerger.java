package com.dealflow.orchestrator.fragment;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deep-merges the partial extractions of one logical document into a single
 * record.
 *
 * Extraction sends a long document to the reasoning service in batches, and
 * each batch comes back as its own fragment. Merging folds them left to right:
 *
 * <pre>
 *   accumulator absent or null   → adopt incoming verbatim
 *   Sequence + Sequence          → concatenate, skipping items already present
 *   Mapping  + Mapping           → recurse field by field
 *   anything else                → first-seen value wins
 * </pre>
 *
 * Unparsable fragments are dropped before folding. The merger holds no state
 * and never mutates its inputs.
 */
public final class FragmentMerger {

    public Fragment merge(List<? extends Fragment> fragments) {
        List<Fragment> usable = new ArrayList<>();
        for (Fragment f : fragments) {
            if (f != null && !(f instanceof Fragment.Unparsable)) {
                usable.add(f);
            }
        }

        if (usable.isEmpty()) {
            return Fragment.emptyMapping();
        }
        if (usable.size() == 1) {
            return copy(usable.get(0));
        }

        Fragment acc = copy(usable.get(0));
        for (int i = 1; i < usable.size(); i++) {
            acc = mergeValue(acc, usable.get(i));
        }
        return acc;
    }

    // ------------------------------------------------------------------
    // Fold step
    // ------------------------------------------------------------------

    Fragment mergeValue(Fragment existing, Fragment incoming) {
        if (existing == null || isNull(existing)) {
            return copy(incoming);
        }
        if (existing instanceof Fragment.Sequence a && incoming instanceof Fragment.Sequence b) {
            return concatDistinct(a, b);
        }
        if (existing instanceof Fragment.Mapping a && incoming instanceof Fragment.Mapping b) {
            return mergeMappings(a, b);
        }
        return existing;
    }

    private Fragment.Mapping mergeMappings(Fragment.Mapping base, Fragment.Mapping incoming) {
        Map<String, Fragment> out = new LinkedHashMap<>(base.fields());
        incoming.fields().forEach((key, value) -> out.put(key, mergeValue(out.get(key), value)));
        return new Fragment.Mapping(out);
    }

    private Fragment.Sequence concatDistinct(Fragment.Sequence base, Fragment.Sequence incoming) {
        List<Fragment> out  = new ArrayList<>(base.items());
        Set<String>    seen = new HashSet<>();
        for (Fragment item : base.items()) {
            seen.add(Fragments.identity(item));
        }
        for (Fragment item : incoming.items()) {
            if (seen.add(Fragments.identity(item))) {
                out.add(item);
            }
        }
        return new Fragment.Sequence(out);
    }

    private static boolean isNull(Fragment f) {
        return f instanceof Fragment.Scalar s && s.isNull();
    }

    // Records copy their collections on construction, so rebuilding is a deep copy.
    private static Fragment copy(Fragment f) {
        if (f instanceof Fragment.Mapping m) {
            Map<String, Fragment> fields = new LinkedHashMap<>();
            m.fields().forEach((k, v) -> fields.put(k, copy(v)));
            return new Fragment.Mapping(fields);
        }
        if (f instanceof Fragment.Sequence s) {
            List<Fragment> items = new ArrayList<>(s.size());
            s.items().forEach(item -> items.add(copy(item)));
            return new Fragment.Sequence(items);
        }
        return f;
    }
}
