package com.locusfilter.core.filter;

import com.locusfilter.core.context.FilterContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Catalog membership filter.
 *
 * <p>
 * Sends the locus to the configured stream when it has matches in at least
 * one of the listed catalogs. If a property name is configured, the number of
 * listed catalogs with matches is recorded under it whenever that number is
 * positive.
 * </p>
 *
 * @since 1.0.0
 */
public class CatalogMatchFilter implements ConfiguredFilter {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(CatalogMatchFilter.class);

    private final String name;
    private final List<String> catalogs;
    private final String stream;
    private final String property;

    /**
     * @param definition the filter definition
     * @throws NullPointerException     if required fields are {@code null}
     * @throws IllegalArgumentException if no catalog is listed
     */
    public CatalogMatchFilter(FilterDefinition definition) {
        Objects.requireNonNull(definition, "FilterDefinition must not be null");
        this.name = Objects.requireNonNull(definition.getName(), "Filter name must not be null");
        this.catalogs = List.copyOf(Objects.requireNonNull(definition.getCatalogs(),
                "Catalogs must not be null for catalog filter '" + name + "'"));
        this.stream = Objects.requireNonNull(definition.getStream(),
                "Stream must not be null for catalog filter '" + name + "'");
        this.property = definition.getProperty();

        if (catalogs.isEmpty()) {
            throw new IllegalArgumentException(
                    "Catalog filter '" + name + "' must list at least one catalog");
        }
    }

    @Override
    public void run(FilterContext context) {
        Map<String, List<Map<String, Object>>> matches = context.getAstroObjectMatches();

        long matched = catalogs.stream().filter(matches::containsKey).count();
        if (matched == 0) {
            return;
        }

        LOG.debug("Filter [{}] passed on locus {}: {} listed catalog(s) matched",
                name, context.getLocusId(), matched);
        if (property != null && !property.isBlank()) {
            context.setProperty(property, matched);
        }
        context.sendToStream(stream);
    }

    @Override
    public String getName() {
        return name;
    }
}
