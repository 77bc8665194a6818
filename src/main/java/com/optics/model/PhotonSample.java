package com.optics.model;

import com.google.common.base.Preconditions;

/**
 * Photon impact positions (cm) read from one ray-tracing photon list, together with the
 * number of photons thrown and the area they were thrown over.
 * <p>
 * Position arrays are copied on construction and on access.
 */
public final class PhotonSample {

    private final double[] x;
    private final double[] y;
    private final long totalPhotons;
    private final double totalScatteredArea; // cm^2

    public PhotonSample(double[] x, double[] y, long totalPhotons, double totalScatteredArea) {
        Preconditions.checkArgument(x.length == y.length,
                "x and y must have the same length (%s != %s)", x.length, y.length);
        Preconditions.checkArgument(x.length > 0, "photon sample is empty");
        Preconditions.checkArgument(totalPhotons >= x.length,
                "total photons (%s) lower than detected photons (%s)", totalPhotons, x.length);
        this.x = x.clone();
        this.y = y.clone();
        this.totalPhotons = totalPhotons;
        this.totalScatteredArea = totalScatteredArea;
    }

    public double[] x() { return x.clone(); }
    public double[] y() { return y.clone(); }

    public int detectedPhotons() { return x.length; }

    public long totalPhotons() { return totalPhotons; }

    public double totalScatteredArea() { return totalScatteredArea; }

    @Override
    public String toString() {
        return "PhotonSample(" + detectedPhotons() + "/" + totalPhotons + " photons)";
    }
}
