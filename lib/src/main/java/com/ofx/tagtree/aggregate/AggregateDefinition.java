package com.ofx.tagtree.aggregate;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Declarative {@link AggregateType}: a tag plus the flattened elements it accepts.
 *
 * <p>Currency-bearing definitions automatically accept the synthesized {@code curtype} element.
 */
public final class AggregateDefinition implements AggregateType {
    private static final Logger LOGGER = Logger.getLogger(AggregateDefinition.class.getName());

    public static final String CURTYPE = "curtype";

    private final String tag;
    private final boolean currencyBearing;
    private final List<String> listTags;
    private final Map<String, ElementSpec> elements;

    private AggregateDefinition(Builder builder) {
        this.tag = builder.tag;
        this.currencyBearing = builder.currencyBearing;
        this.listTags = List.copyOf(builder.listTags);
        Map<String, ElementSpec> specs = new LinkedHashMap<>(builder.elements);
        if (currencyBearing) {
            specs.putIfAbsent(CURTYPE, ElementSpec.oneOf(CURTYPE, false, "CURRENCY", "ORIGCURRENCY"));
        }
        this.elements = Collections.unmodifiableMap(specs);
    }

    public static Builder builder(String tag) {
        return new Builder(tag);
    }

    @Override
    public String getTag() {
        return tag;
    }

    @Override
    public boolean isCurrencyBearing() {
        return currencyBearing;
    }

    @Override
    public List<String> getListTags() {
        return listTags;
    }

    public Map<String, ElementSpec> getElements() {
        return elements;
    }

    @Override
    public Aggregate construct(Map<String, String> attributes, boolean strict)
            throws AggregateValidationException {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            ElementSpec spec = elements.get(attribute.getKey());
            if (spec == null) {
                if (strict) {
                    throw new AggregateValidationException(tag, attribute.getKey(), "unknown element");
                }
                LOGGER.log(Level.FINE, "<{0}> ignoring unknown element {1}", new Object[] {tag, attribute.getKey()});
                continue;
            }
            values.put(spec.getName(), spec.convert(tag, attribute.getValue(), strict));
        }
        for (ElementSpec spec : elements.values()) {
            if (spec.isRequired() && !values.containsKey(spec.getName())) {
                if (strict) {
                    throw new AggregateValidationException(tag, spec.getName(), "required element is missing");
                }
                LOGGER.log(
                        Level.WARNING,
                        "<{0}> is missing required element {1}; accepted in lax mode",
                        new Object[] {tag, spec.getName()});
            }
        }
        return new Aggregate(tag, values);
    }

    @Override
    public String toString() {
        return "AggregateDefinition[" + tag + "]";
    }

    public static final class Builder {
        private final String tag;
        private final Map<String, ElementSpec> elements = new LinkedHashMap<>();
        private final List<String> listTags = new ArrayList<>();
        private boolean currencyBearing;

        private Builder(String tag) {
            this.tag = Objects.requireNonNull(tag, "tag");
        }

        public Builder element(ElementSpec spec) {
            if (elements.putIfAbsent(spec.getName(), spec) != null) {
                throw new IllegalArgumentException("<" + tag + "> declares element " + spec.getName() + " twice");
            }
            return this;
        }

        public Builder required(String name, ElementType type) {
            return element(ElementSpec.of(name, type, true));
        }

        public Builder optional(String name, ElementType type) {
            return element(ElementSpec.of(name, type, false));
        }

        /**
         * Copies the elements of a nested aggregate that gets flattened into this one. Elements
         * already declared here keep their existing declaration.
         */
        public Builder include(AggregateDefinition nested) {
            return includeAll(nested.elements.values(), false);
        }

        /** Like {@link #include} but every copied element becomes optional. */
        public Builder includeOptional(AggregateDefinition nested) {
            return includeAll(nested.elements.values(), true);
        }

        private Builder includeAll(Collection<ElementSpec> specs, boolean optional) {
            for (ElementSpec spec : specs) {
                if (CURTYPE.equals(spec.getName()) || elements.containsKey(spec.getName())) {
                    continue;
                }
                element(optional && spec.isRequired() ? ElementSpec.copyOptional(spec) : spec);
            }
            return this;
        }

        public Builder currencyBearing() {
            this.currencyBearing = true;
            return this;
        }

        public Builder listTag(String listTag) {
            listTags.add(Objects.requireNonNull(listTag, "listTag"));
            return this;
        }

        public AggregateDefinition build() {
            return new AggregateDefinition(this);
        }
    }
}
