package com.optics.psf;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Tuning constants of the containment radius search. Radii and steps are in units of the
 * radial sigma of the image.
 */
public final class SolverSettings {
    public final int maxIterations;
    /** Convergence when |count - target| < detected / toleranceDivisor. */
    public final double toleranceDivisor;
    public final double initialRadiusFactor;
    public final double coarseScanStep;
    public final double fineScanStep;
    /** Upper end of the coarse scan. */
    public final double scanRangeFactor;

    public SolverSettings(int maxIterations, double toleranceDivisor, double initialRadiusFactor,
                          double coarseScanStep, double fineScanStep, double scanRangeFactor) {
        Preconditions.checkArgument(maxIterations >= 0, "maxIterations must be >= 0");
        Preconditions.checkArgument(toleranceDivisor > 0, "toleranceDivisor must be > 0");
        Preconditions.checkArgument(initialRadiusFactor > 0, "initialRadiusFactor must be > 0");
        Preconditions.checkArgument(coarseScanStep > 0 && fineScanStep > 0, "scan steps must be > 0");
        Preconditions.checkArgument(scanRangeFactor > 0, "scanRangeFactor must be > 0");
        this.maxIterations = maxIterations;
        this.toleranceDivisor = toleranceDivisor;
        this.initialRadiusFactor = initialRadiusFactor;
        this.coarseScanStep = coarseScanStep;
        this.fineScanStep = fineScanStep;
        this.scanRangeFactor = scanRangeFactor;
    }

    public static SolverSettings defaults() {
        return new SolverSettings(1000, 1000.0, 1.5, 0.1, 0.005, 4.0);
    }

    public SolverSettings withMaxIterations(int iterations) {
        return new SolverSettings(iterations, toleranceDivisor, initialRadiusFactor, coarseScanStep,
                fineScanStep, scanRangeFactor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SolverSettings)) return false;
        SolverSettings other = (SolverSettings) o;
        return maxIterations == other.maxIterations
                && Double.compare(toleranceDivisor, other.toleranceDivisor) == 0
                && Double.compare(initialRadiusFactor, other.initialRadiusFactor) == 0
                && Double.compare(coarseScanStep, other.coarseScanStep) == 0
                && Double.compare(fineScanStep, other.fineScanStep) == 0
                && Double.compare(scanRangeFactor, other.scanRangeFactor) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(maxIterations, toleranceDivisor, initialRadiusFactor, coarseScanStep, fineScanStep,
                scanRangeFactor);
    }

    @Override
    public String toString() {
        return String.format("SolverSettings(maxIterations=%d, scan=%.3f/%.3f up to %.1f sigma)",
                maxIterations, coarseScanStep, fineScanStep, scanRangeFactor);
    }
}
