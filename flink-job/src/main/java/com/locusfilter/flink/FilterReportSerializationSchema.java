package com.locusfilter.flink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.locusfilter.core.runner.FilterReport;
import org.apache.flink.api.common.serialization.SerializationSchema;

/**
 * Flink {@link SerializationSchema} that converts {@link FilterReport} → JSON
 * bytes for publishing to the Kafka reports topic.
 */
public class FilterReportSerializationSchema implements SerializationSchema<FilterReport> {

    private static final long serialVersionUID = 1L;

    private transient ObjectMapper mapper;

    @Override
    public byte[] serialize(FilterReport report) {
        try {
            return objectMapper().writeValueAsBytes(report);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report for locus "
                    + report.getLocusId() + " from filter '" + report.getFilterName() + "'", e);
        }
    }

    private ObjectMapper objectMapper() {
        if (mapper == null) {
            mapper = new ObjectMapper();
            mapper.registerModule(new JavaTimeModule());
            mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        }
        return mapper;
    }
}
