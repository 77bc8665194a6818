package com.optics.model;

/**
 * Image quality metrics of one configuration.
 */
public class ResultRow {
    public final double offAxisAngle; // deg
    public final double d80Cm;
    public final double d80Deg;       // NaN when no focal length is known
    public final double effArea;      // cm^2, transmission included
    public final double effFlen;      // cm, NaN on axis
    public final Integer mirrorNumber; // single-mirror mode only

    public ResultRow(double offAxisAngle, double d80Cm, double d80Deg, double effArea, double effFlen,
                     Integer mirrorNumber) {
        this.offAxisAngle = offAxisAngle;
        this.d80Cm = d80Cm;
        this.d80Deg = d80Deg;
        this.effArea = effArea;
        this.effFlen = effFlen;
        this.mirrorNumber = mirrorNumber;
    }

    @Override
    public String toString() {
        return "ResultRow(off_axis=" + offAxisAngle + ", d80_cm=" + d80Cm + ", eff_area=" + effArea
                + (mirrorNumber == null ? "" : ", mirror=" + mirrorNumber) + ")";
    }
}
