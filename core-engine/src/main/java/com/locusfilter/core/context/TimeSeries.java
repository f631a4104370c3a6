package com.locusfilter.core.context;

import com.locusfilter.core.exception.UnknownFieldException;
import com.locusfilter.core.model.FieldValue;
import com.locusfilter.core.model.Measurement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Columnar projection of a locus history, as returned by
 * {@link FilterContext#getTimeSeries(List, Map)}.
 *
 * <p>
 * The first two columns are always {@value Measurement#ALERT_ID} and
 * {@value Measurement#MJD}. Cells a measurement does not carry hold
 * {@link FieldValue#missing()}; rows are never dropped for that reason.
 * </p>
 *
 * @since 1.0.0
 */
public final class TimeSeries {

    private final List<String> columnNames;
    private final Map<String, Integer> columnIndex;
    private final List<Row> rows;

    TimeSeries(List<String> columnNames, List<List<FieldValue>> cells) {
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < columnNames.size(); i++) {
            index.put(columnNames.get(i), i);
        }
        this.columnIndex = index;
        List<Row> built = new ArrayList<>(cells.size());
        for (List<FieldValue> values : cells) {
            built.add(new Row(values));
        }
        this.rows = Collections.unmodifiableList(built);
    }

    public List<String> getColumnNames() {
        return columnNames;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Row getRow(int index) {
        return rows.get(index);
    }

    public List<Row> getRows() {
        return rows;
    }

    /**
     * @param column column name
     * @return the column's cells in row order
     * @throws UnknownFieldException if the column was not projected
     */
    public List<FieldValue> getColumn(String column) {
        int idx = indexOf(column);
        List<FieldValue> values = new ArrayList<>(rows.size());
        for (Row row : rows) {
            values.add(row.values.get(idx));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * @param column column name
     * @return numeric values in row order, {@code NaN} for missing or
     *         non-numeric cells
     * @throws UnknownFieldException if the column was not projected
     */
    public double[] getNumericColumn(String column) {
        int idx = indexOf(column);
        double[] values = new double[rows.size()];
        for (int i = 0; i < values.length; i++) {
            OptionalDouble d = rows.get(i).values.get(idx).asDouble();
            values[i] = d.isPresent() ? d.getAsDouble() : Double.NaN;
        }
        return values;
    }

    private int indexOf(String column) {
        Integer idx = columnIndex.get(column);
        if (idx == null) {
            throw new UnknownFieldException(column);
        }
        return idx;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(String.join("\t", columnNames));
        for (Row row : rows) {
            sb.append('\n').append(row);
        }
        return sb.toString();
    }

    /**
     * One projected measurement.
     */
    public final class Row {

        private final List<FieldValue> values;

        private Row(List<FieldValue> values) {
            this.values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        /**
         * @param column column name
         * @return the cell, possibly {@link FieldValue#missing()}
         * @throws UnknownFieldException if the column was not projected
         */
        public FieldValue get(String column) {
            return values.get(indexOf(column));
        }

        public long getAlertId() {
            return (Long) values.get(0).getValue();
        }

        public double getMjd() {
            return (Double) values.get(1).getValue();
        }

        /**
         * @return cells in column order
         */
        public List<FieldValue> getValues() {
            return values;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    sb.append('\t');
                }
                sb.append(values.get(i));
            }
            return sb.toString();
        }
    }
}
