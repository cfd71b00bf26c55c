package com.ofx.tagtree.convert;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Single-level view of a flattened aggregate: lower-case element names mapped to trimmed text, in
 * document order. Private extension elements are not part of the mapping but are kept alongside it.
 */
public final class FlatAttributeMap {
    private final Map<String, String> attributes;
    private final List<ExtensionElement> extensions;

    FlatAttributeMap(Map<String, String> attributes, List<ExtensionElement> extensions) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.extensions = List.copyOf(extensions);
    }

    public String get(String key) {
        return attributes.get(key);
    }

    public boolean containsKey(String key) {
        return attributes.containsKey(key);
    }

    public Set<String> keySet() {
        return attributes.keySet();
    }

    public int size() {
        return attributes.size();
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }

    public Map<String, String> asMap() {
        return attributes;
    }

    /** Dotted leaf elements excluded from the mapping, in document order. */
    public List<ExtensionElement> getExtensions() {
        return extensions;
    }

    /** Copy with one more attribute; the key must not already be present. */
    FlatAttributeMap with(String key, String value, String aggregateTag) throws DuplicateKeyException {
        if (attributes.containsKey(key)) {
            throw new DuplicateKeyException(key, aggregateTag, null);
        }
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(key, Objects.requireNonNull(value, "value"));
        return new FlatAttributeMap(copy, extensions);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof FlatAttributeMap)) {
            return false;
        }
        FlatAttributeMap other = (FlatAttributeMap) obj;
        return attributes.equals(other.attributes) && extensions.equals(other.extensions);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes, extensions);
    }

    @Override
    public String toString() {
        return attributes.toString();
    }
}
