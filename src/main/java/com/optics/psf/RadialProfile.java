package com.optics.psf;

import com.optics.model.PhotonSample;
import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.descriptive.moment.Variance;

import java.util.Arrays;

/**
 * Photon distances from the image centroid, sorted once so that "photons within r"
 * is a binary search.
 */
public final class RadialProfile {

    private final double centroidX;
    private final double centroidY;
    private final double radiusSigma;
    private final double[] sortedRadii;

    private RadialProfile(double centroidX, double centroidY, double radiusSigma, double[] sortedRadii) {
        this.centroidX = centroidX;
        this.centroidY = centroidY;
        this.radiusSigma = radiusSigma;
        this.sortedRadii = sortedRadii;
    }

    public static RadialProfile of(PhotonSample sample) {
        double[] x = sample.x();
        double[] y = sample.y();
        double cx = StatUtils.mean(x);
        double cy = StatUtils.mean(y);

        // population second moments about the centroid
        Variance variance = new Variance(false);
        double sigma = Math.sqrt(variance.evaluate(x, cx) + variance.evaluate(y, cy));

        double[] radii = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            radii[i] = Math.hypot(x[i] - cx, y[i] - cy);
        }
        Arrays.sort(radii);
        return new RadialProfile(cx, cy, sigma, radii);
    }

    /**
     * Number of photons strictly closer to the centroid than {@code radius}.
     */
    public int countWithin(double radius) {
        int lo = 0;
        int hi = sortedRadii.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sortedRadii[mid] < radius) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    public int size() {
        return sortedRadii.length;
    }

    public double maxRadius() {
        return sortedRadii[sortedRadii.length - 1];
    }

    public double centroidX() { return centroidX; }
    public double centroidY() { return centroidY; }
    public double radiusSigma() { return radiusSigma; }
}
