package com.ofx.tagtree.convert;

import com.ofx.tagtree.aggregate.Aggregate;
import com.ofx.tagtree.aggregate.AggregateDefinition;
import com.ofx.tagtree.aggregate.AggregateRegistry;
import com.ofx.tagtree.aggregate.AggregateType;
import com.ofx.tagtree.loader.MaxDepthExceededException;
import com.ofx.tagtree.loader.OfxParseException;
import com.ofx.tagtree.loader.OfxParserOptions;
import com.ofx.tagtree.loader.ast.TagNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Converts parsed OFX aggregates into {@link Aggregate} objects using an {@link AggregateRegistry}.
 *
 * <p>Conversion converts any list-valued children the node's type declares, flattens the rest,
 * resolves the type, records whether amounts came from a {@code CURRENCY} or an {@code ORIGCURRENCY}
 * aggregate, and hands the attributes to the type's constructor. List containers are detached from
 * the tree only after the whole conversion has succeeded, so a failed conversion leaves it untouched.
 */
public final class AggregateConverter {
    private static final Logger LOGGER = Logger.getLogger(AggregateConverter.class.getName());

    static final String CURRENCY = "CURRENCY";
    static final String ORIGCURRENCY = "ORIGCURRENCY";

    private final AggregateRegistry registry;
    private final AttributeFlattener flattener;
    private final OfxParserOptions options;

    public AggregateConverter(AggregateRegistry registry) {
        this(registry, OfxParserOptions.defaults());
    }

    public AggregateConverter(AggregateRegistry registry, OfxParserOptions options) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.options = Objects.requireNonNull(options, "options");
        this.flattener = new AttributeFlattener(options);
    }

    public ConvertedAggregate convert(TagNode node, boolean strict) throws OfxParseException {
        Objects.requireNonNull(node, "node");
        List<Detach> detaches = new ArrayList<>();
        ConvertedAggregate converted = convert(node, strict, 1, detaches);
        for (Detach detach : detaches) {
            detach.parent().removeChild(detach.container());
        }
        return converted;
    }

    /** A list container to remove from its parent once the whole conversion has succeeded. */
    private record Detach(TagNode parent, TagNode container) {}

    private ConvertedAggregate convert(TagNode node, boolean strict, int depth, List<Detach> detaches)
            throws OfxParseException {
        if (depth > options.getMaxDepth()) {
            throw new MaxDepthExceededException(node.getTag(), options.getMaxDepth(), node.getLocation());
        }
        Optional<AggregateType> type = registry.lookup(node.getTag());
        List<String> listTags = type.map(AggregateType::getListTags).orElse(List.of());

        Map<String, TagNode> containers = findContainers(node, listTags);
        Map<String, List<ConvertedAggregate>> lists = new LinkedHashMap<>();
        for (Map.Entry<String, TagNode> container : containers.entrySet()) {
            List<ConvertedAggregate> items = new ArrayList<>();
            for (TagNode item : container.getValue().getChildren()) {
                items.add(convert(item, strict, depth + 1, detaches));
            }
            lists.put(container.getKey(), items);
        }

        FlatAttributeMap attributes = flattener.flatten(node, containers.values());
        AggregateType resolved =
                type.orElseThrow(() -> new UnknownAggregateException(node.getTag(), node.getLocation()));
        if (resolved.isCurrencyBearing()) {
            String currencyType = currencyType(node, containers.values());
            if (currencyType != null) {
                attributes = attributes.with(AggregateDefinition.CURTYPE, currencyType, node.getTag());
            }
        }
        Aggregate aggregate = resolved.construct(attributes.asMap(), strict);

        for (TagNode container : containers.values()) {
            detaches.add(new Detach(node, container));
        }
        for (Map.Entry<String, List<ConvertedAggregate>> list : lists.entrySet()) {
            LOGGER.log(
                    Level.FINE,
                    "Extracted {0} item(s) into list {1} of <{2}>",
                    new Object[] {list.getValue().size(), list.getKey(), node.getTag()});
        }
        return new ConvertedAggregate(aggregate, lists, attributes.getExtensions());
    }

    // Keyed by lower-cased list tag, in declaration order.
    private static Map<String, TagNode> findContainers(TagNode node, List<String> listTags)
            throws DuplicateKeyException {
        Map<String, TagNode> containers = new LinkedHashMap<>();
        for (String listTag : listTags) {
            List<TagNode> found = node.findChildren(listTag);
            if (found.size() > 1) {
                throw new DuplicateKeyException(
                        listTag.toLowerCase(Locale.ROOT), node.getTag(), found.get(1).getLocation());
            }
            if (!found.isEmpty()) {
                containers.put(listTag.toLowerCase(Locale.ROOT), found.get(0));
            }
        }
        return containers;
    }

    /**
     * Flattening reduces both currency aggregates to the same {@code currate}/{@code cursym}
     * elements, so which one was present has to be read from the tree. List containers are not
     * searched.
     */
    private static String currencyType(TagNode node, Collection<TagNode> containers)
            throws AmbiguousCurrencyException {
        TagNode currency = null;
        TagNode origCurrency = null;
        for (TagNode child : node.getChildren()) {
            if (AttributeFlattener.containsInstance(containers, child)) {
                continue;
            }
            currency = currency != null ? currency : findSelfOrDescendant(child, CURRENCY);
            origCurrency = origCurrency != null ? origCurrency : findSelfOrDescendant(child, ORIGCURRENCY);
        }
        if (currency != null && origCurrency != null) {
            throw new AmbiguousCurrencyException(node.getTag(), node.getLocation());
        }
        if (currency != null) {
            return CURRENCY;
        }
        return origCurrency != null ? ORIGCURRENCY : null;
    }

    private static TagNode findSelfOrDescendant(TagNode node, String tag) {
        return node.getTag().equals(tag) ? node : node.findDescendant(tag);
    }
}
