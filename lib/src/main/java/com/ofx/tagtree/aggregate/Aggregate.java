package com.ofx.tagtree.aggregate;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A validated OFX aggregate: its tag and the typed values of its flattened elements. */
public final class Aggregate {
    private final String tag;
    private final Map<String, Object> values;

    public Aggregate(String tag, Map<String, Object> values) {
        this.tag = Objects.requireNonNull(tag, "tag");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String getTag() {
        return tag;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public boolean has(String element) {
        return values.containsKey(element);
    }

    public Object get(String element) {
        return values.get(element);
    }

    public String getString(String element) {
        return (String) values.get(element);
    }

    public BigDecimal getDecimal(String element) {
        return (BigDecimal) values.get(element);
    }

    public Integer getInteger(String element) {
        return (Integer) values.get(element);
    }

    public Boolean getBoolean(String element) {
        return (Boolean) values.get(element);
    }

    public OffsetDateTime getDateTime(String element) {
        return (OffsetDateTime) values.get(element);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Aggregate)) {
            return false;
        }
        Aggregate other = (Aggregate) obj;
        return tag.equals(other.tag) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tag, values);
    }

    @Override
    public String toString() {
        return tag + values;
    }
}
