package com.ofx.tagtree.aggregate;

import java.util.List;
import java.util.Map;

/** Construction capability registered for one OFX aggregate tag. */
public interface AggregateType {

    String getTag();

    /**
     * Whether amounts in this aggregate may be stated in a currency other than the account's
     * default, signalled by a nested {@code CURRENCY} or {@code ORIGCURRENCY} aggregate.
     */
    boolean isCurrencyBearing();

    /**
     * Tags of direct child aggregates that hold repeated items. These are converted item by item and
     * removed before the aggregate is flattened.
     */
    default List<String> getListTags() {
        return List.of();
    }

    /**
     * Validates and converts flattened attributes.
     *
     * @param attributes lower-case element names mapped to trimmed element text
     * @param strict whether to reject unknown elements, missing required elements and over-length text
     */
    Aggregate construct(Map<String, String> attributes, boolean strict) throws AggregateValidationException;
}
