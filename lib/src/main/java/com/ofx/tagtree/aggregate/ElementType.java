package com.ofx.tagtree.aggregate;

import java.util.regex.Pattern;

/** Value types of OFX data elements and their conversion from element text. */
public enum ElementType {
    STRING {
        @Override
        Object convert(String text) {
            return text;
        }
    },
    DECIMAL {
        @Override
        Object convert(String text) {
            return AmountParser.parse(text);
        }
    },
    INTEGER {
        @Override
        Object convert(String text) {
            return Integer.valueOf(text.startsWith("+") ? text.substring(1) : text);
        }
    },
    BOOLEAN {
        @Override
        Object convert(String text) {
            switch (text) {
                case "Y":
                    return Boolean.TRUE;
                case "N":
                    return Boolean.FALSE;
                default:
                    throw new IllegalArgumentException("Expected Y or N but was '" + text + "'");
            }
        }
    },
    DATETIME {
        @Override
        Object convert(String text) {
            return OfxDateTimeParser.parse(text);
        }
    },
    CURRENCY_CODE {
        @Override
        Object convert(String text) {
            if (!ISO_4217.matcher(text).matches()) {
                throw new IllegalArgumentException("Not an ISO-4217 currency code: '" + text + "'");
            }
            return text;
        }
    };

    private static final Pattern ISO_4217 = Pattern.compile("[A-Z]{3}");

    /**
     * Converts trimmed element text.
     *
     * @throws IllegalArgumentException or {@link java.time.DateTimeException} when the text is not a
     *     valid value of this type
     */
    abstract Object convert(String text);
}
