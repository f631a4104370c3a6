package com.locusfilter.core.config;

import com.locusfilter.core.context.StreamRegistry;
import com.locusfilter.core.filter.FilterDefinition;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Top-level POJO for the filters YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * streams:
 *   - high_snr
 *   - extragalactic
 * filters:
 *   - name: high_snr
 *     type: threshold
 *     field: snr
 *     threshold: 50
 *     stream: high_snr
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading to verify every filter is valid and
 * only refers to declared streams.
 * </p>
 *
 * @since 1.0.0
 */
public class FilterConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<String> streams = new ArrayList<>();

    private List<FilterDefinition> filters = new ArrayList<>();

    /**
     * @return unmodifiable list of declared stream names
     */
    public List<String> getStreams() {
        return Collections.unmodifiableList(streams);
    }

    /**
     * Set the stream names (used by SnakeYAML during deserialization).
     *
     * @param streams the stream names
     */
    public void setStreams(List<String> streams) {
        this.streams = streams != null ? new ArrayList<>(streams) : new ArrayList<>();
    }

    /**
     * @return unmodifiable list of filter definitions
     */
    public List<FilterDefinition> getFilters() {
        return Collections.unmodifiableList(filters);
    }

    /**
     * Set the filter definitions (used by SnakeYAML during deserialization).
     *
     * @param filters the filter definitions
     */
    public void setFilters(List<FilterDefinition> filters) {
        this.filters = filters != null ? new ArrayList<>(filters) : new ArrayList<>();
    }

    /**
     * @return registry of the declared streams
     * @throws IllegalArgumentException if a stream name is blank
     */
    public StreamRegistry getStreamRegistry() {
        return StreamRegistry.of(streams);
    }

    /**
     * Validate every filter in this configuration.
     *
     * <p>
     * Delegates to {@link FilterDefinition#validate()} for each filter, then
     * checks that filter names are unique and that every referenced stream is
     * declared. Collects all errors and throws a single exception if anything
     * is invalid.
     * </p>
     *
     * @throws IllegalStateException if the configuration is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        Set<String> declared = new HashSet<>();
        for (String stream : streams) {
            if (stream == null || stream.isBlank()) {
                errors.add("Stream names must not be blank");
            } else if (!declared.add(stream)) {
                errors.add("Stream '" + stream + "' is declared more than once");
            }
        }

        Set<String> names = new HashSet<>();
        for (int i = 0; i < filters.size(); i++) {
            FilterDefinition definition = Objects.requireNonNull(filters.get(i),
                    "Filter at index " + i + " is null");
            try {
                definition.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
                continue;
            }
            if (!names.add(definition.getName())) {
                errors.add("Filter name '" + definition.getName() + "' is used more than once");
            }
            String stream = definition.getStream();
            if (stream != null && !declared.contains(stream)) {
                errors.add("Filter '" + definition.getName() + "' refers to undeclared stream '"
                        + stream + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Filters configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "FilterConfig{streams=" + streams + ", filters=" + filters + '}';
    }
}
