package com.locusfilter.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog name to matched catalog entries, as computed upstream.
 *
 * <p>
 * A catalog without matches is never present as a key; empty lists are
 * dropped at construction. Filters test membership on the key set, so this
 * must hold for every instance.
 * </p>
 *
 * @since 1.0.0
 */
public final class CatalogMatchSet implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final CatalogMatchSet EMPTY = new CatalogMatchSet(Map.of());

    private final Map<String, List<Map<String, Object>>> matches;

    /**
     * @param matches catalog name to match records; {@code null} or empty
     *                lists are dropped
     */
    public CatalogMatchSet(Map<String, ? extends List<? extends Map<String, ?>>> matches) {
        Map<String, List<Map<String, Object>>> copy = new LinkedHashMap<>();
        if (matches != null) {
            matches.forEach((catalog, records) -> {
                Objects.requireNonNull(catalog, "Catalog name must not be null");
                if (records == null || records.isEmpty()) {
                    return;
                }
                List<Map<String, Object>> recordCopies = new ArrayList<>(records.size());
                for (Map<String, ?> record : records) {
                    recordCopies.add(Collections.unmodifiableMap(new LinkedHashMap<>(record)));
                }
                copy.put(catalog, Collections.unmodifiableList(recordCopies));
            });
        }
        this.matches = Collections.unmodifiableMap(copy);
    }

    /**
     * @return a match set with no catalogs
     */
    public static CatalogMatchSet empty() {
        return EMPTY;
    }

    /**
     * @return unmodifiable view; no key maps to an empty list
     */
    public Map<String, List<Map<String, Object>>> asMap() {
        return matches;
    }

    public Set<String> getCatalogNames() {
        return matches.keySet();
    }

    public boolean hasMatch(String catalog) {
        return matches.containsKey(catalog);
    }

    public boolean isEmpty() {
        return matches.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CatalogMatchSet that))
            return false;
        return matches.equals(that.matches);
    }

    @Override
    public int hashCode() {
        return matches.hashCode();
    }

    @Override
    public String toString() {
        return "CatalogMatchSet" + matches.keySet();
    }
}
