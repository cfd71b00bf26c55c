package com.ofx.tagtree.convert;

import com.ofx.tagtree.aggregate.Aggregate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Result of converting one aggregate: the constructed object, plus the list-valued children that
 * were converted separately before flattening, keyed by the lower-cased container tag.
 */
public final class ConvertedAggregate {
    private final Aggregate aggregate;
    private final Map<String, List<ConvertedAggregate>> lists;
    private final List<ExtensionElement> extensions;

    public ConvertedAggregate(
            Aggregate aggregate,
            Map<String, List<ConvertedAggregate>> lists,
            List<ExtensionElement> extensions) {
        this.aggregate = Objects.requireNonNull(aggregate, "aggregate");
        Map<String, List<ConvertedAggregate>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<ConvertedAggregate>> entry : lists.entrySet()) {
            copy.put(entry.getKey(), List.copyOf(entry.getValue()));
        }
        this.lists = Collections.unmodifiableMap(copy);
        this.extensions = List.copyOf(extensions);
    }

    public Aggregate getAggregate() {
        return aggregate;
    }

    public String getTag() {
        return aggregate.getTag();
    }

    public Map<String, List<ConvertedAggregate>> getLists() {
        return lists;
    }

    /** Items of one extracted list, e.g. {@code "mfassetclass"}; empty if the list was absent. */
    public List<ConvertedAggregate> getList(String name) {
        return lists.getOrDefault(name, List.of());
    }

    /** Vendor-private elements that were dropped while flattening. */
    public List<ExtensionElement> getExtensions() {
        return extensions;
    }

    @Override
    public String toString() {
        return lists.isEmpty() ? aggregate.toString() : aggregate + " " + lists;
    }
}
