package com.optics.psf;

import com.google.common.base.Preconditions;

/**
 * Contained light as a function of radius around the image centroid. The arrays are
 * copied on the way in and out.
 */
public final class CumulativeProfile {

    private final double[] radii;     // cm
    private final double[] fractions; // strictly inside each radius

    public CumulativeProfile(double[] radii, double[] fractions) {
        Preconditions.checkArgument(radii.length == fractions.length,
                "radii and fractions must have the same length (%s != %s)", radii.length, fractions.length);
        this.radii = radii.clone();
        this.fractions = fractions.clone();
    }

    public double[] radii() {
        return radii.clone();
    }

    public double[] fractions() {
        return fractions.clone();
    }

    public int size() {
        return radii.length;
    }
}
