package com.optics.model;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Ordered ray-tracing results, one row per configuration, for a fixed zenith angle and
 * source distance.
 */
public class ResultsTable {

    private final double zenithAngle;
    private final double sourceDistance;
    private final boolean singleMirror;
    private final List<ResultRow> rows = new ArrayList<>();

    public ResultsTable(double zenithAngle, double sourceDistance, boolean singleMirror) {
        this.zenithAngle = zenithAngle;
        this.sourceDistance = sourceDistance;
        this.singleMirror = singleMirror;
    }

    public void add(ResultRow row) {
        if (singleMirror != (row.mirrorNumber != null)) {
            throw new IllegalArgumentException("Row mirror number does not match table mode: " + row);
        }
        rows.add(row);
    }

    public List<ResultRow> rows() {
        return Collections.unmodifiableList(rows);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public double getZenithAngle() {
        return zenithAngle;
    }

    public double getSourceDistance() {
        return sourceDistance;
    }

    public boolean isSingleMirror() {
        return singleMirror;
    }

    /** Columns stored for this table, in file order. */
    public List<ResultColumn> columns() {
        List<ResultColumn> columns = new ArrayList<>(Arrays.asList(ResultColumn.values()));
        if (!singleMirror) {
            columns.remove(ResultColumn.MIRROR_NUMBER);
        }
        return columns;
    }

    public ConfigurationKey keyOf(ResultRow row) {
        return new ConfigurationKey(row.offAxisAngle, row.mirrorNumber, zenithAngle, sourceDistance);
    }

    public Optional<ResultRow> get(ConfigurationKey key) {
        return rows.stream().filter(row -> keyOf(row).equals(key)).findFirst();
    }

    public double[] column(ResultColumn column) {
        return rows.stream().mapToDouble(column::valueOf).toArray();
    }

    /**
     * @throws UnknownColumnException if the column is not part of this table
     */
    public double[] column(String name) {
        ResultColumn column = ResultColumn.fromName(name);
        if (!columns().contains(column)) {
            throw new UnknownColumnException(name);
        }
        return column(column);
    }

    /** Mean of a column, NaN cells ignored. */
    public double mean(String name) {
        return StatUtils.mean(finite(column(name)));
    }

    /** Population standard deviation of a column, NaN cells ignored. */
    public double stdDev(String name) {
        return new StandardDeviation(false).evaluate(finite(column(name)));
    }

    private static double[] finite(double[] values) {
        return Arrays.stream(values).filter(v -> !Double.isNaN(v)).toArray();
    }
}
