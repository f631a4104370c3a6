package com.locusfilter.core.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Factory that creates {@link ConfiguredFilter} instances from
 * {@link FilterDefinition} configurations.
 *
 * <p>
 * This is the single point of extension when adding new filter types:
 * register the new type string here and create the corresponding filter.
 * </p>
 *
 * @since 1.0.0
 */
public final class FilterFactory {

    private static final Logger LOG = LoggerFactory.getLogger(FilterFactory.class);

    private FilterFactory() {
        // utility class, not instantiable
    }

    /**
     * Create a filter for the given definition.
     *
     * @param definition the filter definition; must not be {@code null}
     * @return an appropriate {@link ConfiguredFilter} instance
     * @throws NullPointerException     if {@code definition} or its type is
     *                                  {@code null}
     * @throws IllegalArgumentException if the filter type is unknown
     */
    public static ConfiguredFilter create(FilterDefinition definition) {
        Objects.requireNonNull(definition, "FilterDefinition must not be null");
        Objects.requireNonNull(definition.getType(), "Filter type must not be null");

        String type = definition.getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case "threshold" -> new ThresholdFilter(definition);
            case "catalog" -> new CatalogMatchFilter(definition);
            case "amplitude" -> new AmplitudeFilter(definition);
            default -> throw new IllegalArgumentException(
                    "Unknown filter type: '" + definition.getType()
                            + "'. Supported types: threshold, catalog, amplitude");
        };
    }

    /**
     * Create filters for every definition in the supplied list.
     *
     * @param definitions filter definitions; must not be {@code null}
     * @return unmodifiable list of filters (one per definition)
     * @throws NullPointerException if {@code definitions} is {@code null}
     */
    public static List<ConfiguredFilter> createAll(List<FilterDefinition> definitions) {
        Objects.requireNonNull(definitions, "Filter definitions must not be null");
        LOG.info("Creating {} filter(s) from configuration", definitions.size());
        List<ConfiguredFilter> filters = definitions.stream()
                .map(FilterFactory::create)
                .toList();
        return Collections.unmodifiableList(filters);
    }
}
