package com.optics.psf;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the diameter of the circle around the centroid that contains a given fraction of
 * the detected photons.
 * <p>
 * A Newton-like update on the radius is tried first. The step is proportional to the
 * difference between the photons inside the current radius and the target number. When it
 * does not converge within the iteration budget, the radius is bracketed by scanning
 * outwards from the centroid with a coarse step and then refined with a fine step.
 */
public class ContainmentRadiusSolver {

    private static final Logger log = LoggerFactory.getLogger(ContainmentRadiusSolver.class);

    private final SolverSettings settings;

    public ContainmentRadiusSolver() {
        this(SolverSettings.defaults());
    }

    public ContainmentRadiusSolver(SolverSettings settings) {
        this.settings = settings;
    }

    public SolverSettings getSettings() {
        return settings;
    }

    /**
     * @param profile  sorted radial distances of the image
     * @param fraction containment fraction in (0, 1]
     * @return containment diameter in cm
     * @throws PsfNotFoundException if no radius could be found
     */
    public double findDiameter(RadialProfile profile, double fraction) {
        Preconditions.checkArgument(fraction > 0 && fraction <= 1, "fraction must be in (0, 1]: %s", fraction);
        log.debug("Finding PSF for fraction = {}", fraction);

        int detected = profile.size();
        if (fraction == 1.0) {
            return 2 * profile.maxRadius();
        }
        double radiusSigma = profile.radiusSigma();
        if (radiusSigma == 0) {
            // every photon sits on the centroid
            return 0.0;
        }

        double target = fraction * detected;
        double tolerance = detected / settings.toleranceDivisor;
        double radius = settings.initialRadiusFactor * radiusSigma;
        int startCount = profile.countWithin(radius);

        if (startCount > 0) {
            double scale = 0.5 * Math.sqrt(radius * radius / startCount);
            double delta = startCount - target;
            int iteration = 0;
            boolean found = false;
            while (!found && iteration < settings.maxIterations) {
                iteration++;
                double dr = -delta * scale / Math.sqrt(target);
                while (radius + dr < 0) {
                    dr *= 0.5;
                }
                radius += dr;
                delta = profile.countWithin(radius) - target;
                found = Math.abs(delta) < tolerance;
            }
            if (found) {
                log.debug("PSF radius {} found after {} iterations", radius, iteration);
                return 2 * radius;
            }
        }

        log.warn("Could not find PSF efficiently (fraction {}) - trying by scanning", fraction);
        return 2 * findRadiusByScanning(profile, target, radiusSigma, fraction);
    }

    private double findRadiusByScanning(RadialProfile profile, double target, double radiusSigma, double fraction) {
        double[] coarse = scan(profile, target, settings.coarseScanStep * radiusSigma, 0,
                settings.scanRangeFactor * radiusSigma);
        if (coarse == null) {
            log.error("Could not find PSF by scanning (fraction {}, radius sigma {})", fraction, radiusSigma);
            throw new PsfNotFoundException(fraction, String.format(
                    "No radius containing %.1f photons within %.2f sigma", target, settings.scanRangeFactor));
        }
        double[] fine = scan(profile, target, settings.fineScanStep * radiusSigma, coarse[0], coarse[1]);
        if (fine == null) {
            fine = coarse;
        }
        return (fine[0] + fine[1]) / 2;
    }

    /**
     * Walks intervals [r0, r0 + step] from {@code min} until one encloses the target count.
     *
     * @return the bracketing interval, or null when {@code max} is passed first
     */
    private static double[] scan(RadialProfile profile, double target, double step, double min, double max) {
        double r0 = min;
        double r1 = min + step;
        while (true) {
            int s0 = profile.countWithin(r0);
            int s1 = profile.countWithin(r1);
            if (s0 < target && target <= s1) {
                return new double[] {r0, r1};
            }
            if (r1 > max) {
                return null;
            }
            r0 += step;
            r1 += step;
        }
    }
}
