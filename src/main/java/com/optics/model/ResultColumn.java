package com.optics.model;

import java.util.function.ToDoubleFunction;

/**
 * Columns of the ray-tracing results table.
 * <p>
 * Results files use the short column names ({@code off_axis}, {@code eff_area}, ...). Lookups by
 * name also accept the unit-qualified form ({@code off_axis_angle_deg}, {@code eff_area_cm2}, ...).
 */
public enum ResultColumn {
    OFF_AXIS("off_axis", "off_axis_angle_deg", "deg", row -> row.offAxisAngle),
    D80_CM("d80_cm", "d80_cm", "cm", row -> row.d80Cm),
    D80_DEG("d80_deg", "d80_deg", "deg", row -> row.d80Deg),
    EFF_AREA("eff_area", "eff_area_cm2", "cm2", row -> row.effArea),
    EFF_FLEN("eff_flen", "eff_flen_cm", "cm", row -> row.effFlen),
    MIRROR_NUMBER("mirror_no", "mirror_number", null,
            row -> row.mirrorNumber == null ? Double.NaN : row.mirrorNumber);

    private final String columnName;
    private final String alias;
    private final String unit;
    private final ToDoubleFunction<ResultRow> accessor;

    ResultColumn(String columnName, String alias, String unit, ToDoubleFunction<ResultRow> accessor) {
        this.columnName = columnName;
        this.alias = alias;
        this.unit = unit;
        this.accessor = accessor;
    }

    public String columnName() {
        return columnName;
    }

    /** Unit string, null for dimensionless columns. */
    public String unit() {
        return unit;
    }

    public double valueOf(ResultRow row) {
        return accessor.applyAsDouble(row);
    }

    /**
     * @throws UnknownColumnException if no column has this name
     */
    public static ResultColumn fromName(String name) {
        for (ResultColumn column : values()) {
            if (column.columnName.equals(name) || column.alias.equals(name)) {
                return column;
            }
        }
        throw new UnknownColumnException(name);
    }
}
