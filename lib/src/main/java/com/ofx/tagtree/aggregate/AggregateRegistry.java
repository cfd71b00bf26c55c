package com.ofx.tagtree.aggregate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/** Immutable mapping from OFX aggregate tag to the type that constructs it. */
public final class AggregateRegistry {
    private final Map<String, AggregateType> types;

    private AggregateRegistry(Map<String, AggregateType> types) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Exact, case-sensitive lookup. */
    public Optional<AggregateType> lookup(String tag) {
        return Optional.ofNullable(types.get(tag));
    }

    public boolean contains(String tag) {
        return types.containsKey(tag);
    }

    public Set<String> getTags() {
        return types.keySet();
    }

    public static final class Builder {
        private final Map<String, AggregateType> types = new LinkedHashMap<>();

        private Builder() {}

        public Builder register(AggregateType type) {
            Objects.requireNonNull(type, "type");
            if (types.putIfAbsent(type.getTag(), type) != null) {
                throw new IllegalArgumentException("Aggregate <" + type.getTag() + "> is already registered");
            }
            return this;
        }

        public Builder registerAll(AggregateRegistry other) {
            for (AggregateType type : other.types.values()) {
                register(type);
            }
            return this;
        }

        public AggregateRegistry build() {
            return new AggregateRegistry(types);
        }
    }
}
