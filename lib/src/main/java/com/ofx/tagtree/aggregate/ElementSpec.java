package com.ofx.tagtree.aggregate;

import java.time.DateTimeException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/** Declaration of one flattened element accepted by an {@link AggregateDefinition}. */
public final class ElementSpec {
    private static final Logger LOGGER = Logger.getLogger(ElementSpec.class.getName());

    private final String name;
    private final ElementType type;
    private final boolean required;
    private final int maxLength;
    private final Set<String> allowedValues;

    private ElementSpec(String name, ElementType type, boolean required, int maxLength, Set<String> allowedValues) {
        this.name = Objects.requireNonNull(name, "name").toLowerCase(Locale.ROOT);
        this.type = Objects.requireNonNull(type, "type");
        this.required = required;
        this.maxLength = maxLength;
        this.allowedValues = Set.copyOf(allowedValues);
    }

    public static ElementSpec of(String name, ElementType type, boolean required) {
        return new ElementSpec(name, type, required, 0, Set.of());
    }

    public static ElementSpec text(String name, int maxLength, boolean required) {
        return new ElementSpec(name, ElementType.STRING, required, maxLength, Set.of());
    }

    public static ElementSpec oneOf(String name, boolean required, String... values) {
        return new ElementSpec(name, ElementType.STRING, required, 0, Set.of(values));
    }

    static ElementSpec copyOptional(ElementSpec spec) {
        return new ElementSpec(spec.name, spec.type, false, spec.maxLength, spec.allowedValues);
    }

    public String getName() {
        return name;
    }

    public ElementType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    /** 0 means unbounded. */
    public int getMaxLength() {
        return maxLength;
    }

    public Set<String> getAllowedValues() {
        return allowedValues;
    }

    Object convert(String aggregateTag, String text, boolean strict) throws AggregateValidationException {
        if (!allowedValues.isEmpty() && !allowedValues.contains(text)) {
            throw new AggregateValidationException(
                    aggregateTag, name, "'" + text + "' is not one of " + allowedValues);
        }
        if (maxLength > 0 && text.length() > maxLength) {
            if (strict) {
                throw new AggregateValidationException(
                        aggregateTag, name, "length " + text.length() + " exceeds " + maxLength);
            }
            LOGGER.log(
                    Level.FINE,
                    "<{0}> element {1} exceeds {2} characters; accepted in lax mode",
                    new Object[] {aggregateTag, name, maxLength});
        }
        try {
            return type.convert(text);
        } catch (IllegalArgumentException | DateTimeException ex) {
            throw new AggregateValidationException(aggregateTag, name, ex.getMessage());
        }
    }
}
