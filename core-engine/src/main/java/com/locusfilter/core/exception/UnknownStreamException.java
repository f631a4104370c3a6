package com.locusfilter.core.exception;

import java.util.Collection;

/**
 * Raised when a filter requests a stream that is not in the stream registry.
 *
 * @since 1.0.0
 */
public class UnknownStreamException extends FilterException {

    private static final long serialVersionUID = 1L;

    private final String streamName;

    public UnknownStreamException(String streamName, Collection<String> knownStreams) {
        super("Unknown stream: '" + streamName + "'. Known streams: " + knownStreams);
        this.streamName = streamName;
    }

    public String getStreamName() {
        return streamName;
    }
}
