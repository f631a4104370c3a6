package com.locusfilter.core.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.locusfilter.core.model.CatalogMatchSet;
import com.locusfilter.core.model.LocusData;
import com.locusfilter.core.model.Measurement;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses a JSON locus document into {@link LocusData}.
 *
 * <p>
 * Expected shape:
 * </p>
 *
 * <pre>
 * {
 *   "locus_id": 1,
 *   "alert_id": 2,                      (optional triggering alert)
 *   "measurements": [
 *     {"alert_id": 1, "mjd": 100.0, "fid": 1, "mag": 18.0},
 *     {"alert_id": 2, "mjd": 101.0, "fid": 2, "mag": 17.5}
 *   ],
 *   "catalog_matches": {"2mass": [{"name": "J0001"}]}
 * }
 * </pre>
 *
 * <p>
 * Measurement fields must be scalars; {@code null} becomes a missing cell.
 * Instances are thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class LocusDataReader {

    static final String LOCUS_ID = "locus_id";
    static final String MEASUREMENTS = "measurements";
    static final String CATALOG_MATCHES = "catalog_matches";

    private final ObjectMapper mapper;

    public LocusDataReader() {
        this(new ObjectMapper());
    }

    public LocusDataReader(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
    }

    /**
     * @param json raw JSON bytes
     * @return parsed locus data
     * @throws IOException              if the bytes are not valid JSON
     * @throws IllegalArgumentException if the document is structurally invalid
     */
    public LocusData read(byte[] json) throws IOException {
        return fromTree(mapper.readTree(json));
    }

    /**
     * @param in JSON stream; not closed by this method
     * @return parsed locus data
     * @throws IOException              if the stream is not valid JSON
     * @throws IllegalArgumentException if the document is structurally invalid
     */
    public LocusData read(InputStream in) throws IOException {
        return fromTree(mapper.readTree(in));
    }

    /**
     * @param root parsed JSON document
     * @return locus data
     * @throws IllegalArgumentException if the document is structurally invalid
     */
    public LocusData fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Locus document must be a JSON object");
        }
        long locusId = requireLong(root, LOCUS_ID, "locus document");

        JsonNode measurementsNode = root.path(MEASUREMENTS);
        if (!measurementsNode.isArray()) {
            throw new IllegalArgumentException(
                    "Locus " + locusId + ": '" + MEASUREMENTS + "' must be an array");
        }
        List<Measurement> measurements = new ArrayList<>(measurementsNode.size());
        for (JsonNode node : measurementsNode) {
            measurements.add(toMeasurement(locusId, node));
        }

        LocusData locus = new LocusData(locusId, measurements, toCatalogMatches(locusId, root.path(CATALOG_MATCHES)));

        JsonNode trigger = root.get(Measurement.ALERT_ID);
        if (trigger != null && !trigger.isNull()) {
            locus = locus.withTriggeringAlert(requireLong(root, Measurement.ALERT_ID, "locus " + locusId));
        }
        return locus;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Measurement toMeasurement(long locusId, JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Locus " + locusId + ": measurement must be an object");
        }
        String where = "measurement of locus " + locusId;
        long alertId = requireLong(node, Measurement.ALERT_ID, where);
        JsonNode mjdNode = node.get(Measurement.MJD);
        if (mjdNode == null || !mjdNode.isNumber()) {
            throw new IllegalArgumentException("'" + Measurement.MJD + "' must be numeric in " + where);
        }

        Map<String, Object> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (Measurement.isReserved(e.getKey())) {
                continue;
            }
            fields.put(e.getKey(), scalar(e.getKey(), e.getValue(), where));
        }
        return new Measurement(alertId, mjdNode.doubleValue(), fields);
    }

    private CatalogMatchSet toCatalogMatches(long locusId, JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return CatalogMatchSet.empty();
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException(
                    "Locus " + locusId + ": '" + CATALOG_MATCHES + "' must be an object");
        }
        Map<String, List<Map<String, Object>>> matches = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            if (!e.getValue().isArray()) {
                throw new IllegalArgumentException("Locus " + locusId + ": matches for catalog '"
                        + e.getKey() + "' must be an array");
            }
            List<Map<String, Object>> records = new ArrayList<>();
            for (JsonNode record : e.getValue()) {
                records.add(mapper.convertValue(record, mapper.getTypeFactory()
                        .constructMapType(LinkedHashMap.class, String.class, Object.class)));
            }
            matches.put(e.getKey(), records);
        }
        return new CatalogMatchSet(matches);
    }

    private static Object scalar(String field, JsonNode value, String where) {
        if (value.isNull()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            return value.longValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        throw new IllegalArgumentException(
                "Field '" + field + "' must be a scalar in " + where + ", got: " + value.getNodeType());
    }

    private static long requireLong(JsonNode node, String field, String where) {
        JsonNode value = node.get(field);
        if (value == null || !value.isIntegralNumber()) {
            throw new IllegalArgumentException("'" + field + "' must be an integer in " + where);
        }
        return value.longValue();
    }
}
