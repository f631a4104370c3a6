package com.locusfilter.core.context;

import com.locusfilter.core.exception.UnknownStreamException;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * The set of stream names a filter may publish to.
 *
 * @since 1.0.0
 */
public final class StreamRegistry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final Set<String> streamNames;

    private StreamRegistry(Set<String> streamNames) {
        this.streamNames = Collections.unmodifiableSet(streamNames);
    }

    /**
     * @param streamNames valid stream names; must not contain {@code null} or
     *                    blank entries
     * @return new registry
     * @throws IllegalArgumentException if a name is blank
     */
    public static StreamRegistry of(Collection<String> streamNames) {
        Objects.requireNonNull(streamNames, "Stream names must not be null");
        Set<String> names = new TreeSet<>();
        for (String name : streamNames) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Stream name must not be null or blank");
            }
            names.add(name);
        }
        return new StreamRegistry(names);
    }

    public static StreamRegistry of(String... streamNames) {
        return of(Arrays.asList(streamNames));
    }

    public boolean contains(String streamName) {
        return streamName != null && streamNames.contains(streamName);
    }

    /**
     * @param streamName stream to check
     * @return {@code streamName}
     * @throws UnknownStreamException if the stream is not registered
     */
    public String require(String streamName) {
        if (!contains(streamName)) {
            throw new UnknownStreamException(streamName, streamNames);
        }
        return streamName;
    }

    /**
     * @return registered names, sorted
     */
    public Set<String> getStreamNames() {
        return streamNames;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StreamRegistry that))
            return false;
        return streamNames.equals(that.streamNames);
    }

    @Override
    public int hashCode() {
        return streamNames.hashCode();
    }

    @Override
    public String toString() {
        return "StreamRegistry" + streamNames;
    }
}
