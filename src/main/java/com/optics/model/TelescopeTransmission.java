package com.optics.model;

import com.google.common.base.Preconditions;

import java.util.Arrays;

/**
 * Off-axis dependence of the telescope transmission.
 * <p>
 * {@code T(theta) = p0} when {@code p1 == 0}, otherwise
 * {@code T(theta) = p0 / (1 + p2 * (sin(theta) / (p3 * pi / 180))^p4)}.
 */
public final class TelescopeTransmission {

    private static final double DEG_TO_RAD = Math.PI / 180.0;

    private final double[] pars;

    public TelescopeTransmission(double... pars) {
        Preconditions.checkArgument(pars.length == 5 || (pars.length >= 2 && pars[1] == 0),
                "telescope transmission needs 5 parameters, got %s", pars.length);
        this.pars = pars.clone();
    }

    /**
     * Parses the whitespace separated parameter string of the model.
     */
    public static TelescopeTransmission parse(String value) {
        double[] pars = Arrays.stream(value.trim().split("\\s+")).mapToDouble(Double::parseDouble).toArray();
        return new TelescopeTransmission(pars);
    }

    public static TelescopeTransmission constant(double value) {
        return new TelescopeTransmission(value, 0, 0, 0, 0);
    }

    /**
     * @param offAxisAngle off-axis angle in deg
     */
    public double at(double offAxisAngle) {
        if (pars[1] == 0) {
            return pars[0];
        }
        double t = Math.sin(offAxisAngle * DEG_TO_RAD) / (pars[3] * DEG_TO_RAD);
        return pars[0] / (1.0 + pars[2] * Math.pow(t, pars[4]));
    }

    public double[] parameters() {
        return pars.clone();
    }

    @Override
    public String toString() {
        return "TelescopeTransmission" + Arrays.toString(pars);
    }
}
