package com.locusfilter.flink;

import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.source.LocusDataReader;
import org.apache.flink.api.common.serialization.DeserializationSchema;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Flink {@link DeserializationSchema} that converts raw Kafka bytes into
 * {@link LocusData}.
 * <p>
 * Malformed documents are logged and dropped (returns {@code null}), so a
 * single bad record does not crash the pipeline.
 * </p>
 */
public class LocusDataDeserializationSchema implements DeserializationSchema<LocusData> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(LocusDataDeserializationSchema.class);

    private transient LocusDataReader reader;

    @Override
    public LocusData deserialize(byte[] message) throws IOException {
        if (message == null || message.length == 0) {
            return null;
        }
        try {
            return reader().read(message);
        } catch (IOException | IllegalArgumentException e) {
            LOG.warn("Failed to deserialize locus document – skipping: {}", e.getMessage());
            return null;
        }
    }

    @Override
    public boolean isEndOfStream(LocusData nextElement) {
        return false; // unbounded stream
    }

    @Override
    public TypeInformation<LocusData> getProducedType() {
        return TypeInformation.of(LocusData.class);
    }

    private LocusDataReader reader() {
        if (reader == null) {
            reader = new LocusDataReader();
        }
        return reader;
    }
}
