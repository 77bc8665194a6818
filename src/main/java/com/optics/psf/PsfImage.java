package com.optics.psf;

import com.google.common.base.Preconditions;
import com.optics.model.PhotonSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Image made of the 2-D photon positions of one ray-tracing configuration.
 * <p>
 * Positions are in cm. Containment diameters are computed on demand and kept per
 * fraction; an image built from an external summary only knows the diameter it was
 * given plus centroid and effective area.
 */
public class PsfImage {

    private static final Logger log = LoggerFactory.getLogger(PsfImage.class);

    private static final int DEFAULT_CUMULATIVE_POINTS = 30;
    private static final double DEFAULT_CUMULATIVE_RANGE = 1.6;

    private final PhotonSample sample;
    private final ContainmentRadiusSolver solver;
    private final Double cmToDeg;
    private final Map<Double, Double> storedPsf = new HashMap<>();

    private RadialProfile profile;
    private double centroidX;
    private double centroidY;
    private Double effectiveArea;

    private PsfImage(PhotonSample sample, Double focalLengthCm, ContainmentRadiusSolver solver) {
        this.sample = sample;
        this.solver = solver;
        this.cmToDeg = conversionFactor(focalLengthCm);
    }

    /**
     * @param sample        photon positions
     * @param focalLengthCm focal length in cm, or null when only cm results are needed
     * @param solver        containment radius search
     */
    public static PsfImage fromPhotons(PhotonSample sample, Double focalLengthCm, ContainmentRadiusSolver solver) {
        PsfImage image = new PsfImage(sample, focalLengthCm, solver);
        RadialProfile radial = image.radialProfile();
        image.centroidX = radial.centroidX();
        image.centroidY = radial.centroidY();
        image.effectiveArea = sample.detectedPhotons() * sample.totalScatteredArea() / sample.totalPhotons();
        return image;
    }

    /**
     * Image whose quantities were computed elsewhere (e.g. by the rx tool).
     *
     * @param diameterCm    containment diameter for {@code fraction}, in cm
     */
    public static PsfImage fromSummary(double diameterCm, double fraction, double centroidX, double centroidY,
                                       double effectiveArea, Double focalLengthCm) {
        PsfImage image = new PsfImage(null, focalLengthCm, null);
        image.setPsf(diameterCm, fraction, PsfUnit.CM);
        image.centroidX = centroidX;
        image.centroidY = centroidY;
        image.effectiveArea = effectiveArea;
        return image;
    }

    private static Double conversionFactor(Double focalLengthCm) {
        if (focalLengthCm == null) {
            return null;
        }
        if (focalLengthCm == 0.0) {
            log.warn("Focal length is zero; no conversion from cm to deg possible");
            return null;
        }
        return 180.0 / Math.PI / focalLengthCm;
    }

    public boolean hasPhotons() {
        return sample != null;
    }

    public boolean hasFocalLength() {
        return cmToDeg != null;
    }

    private RadialProfile radialProfile() {
        if (sample == null) {
            throw new IllegalStateException("Photon positions were not loaded for this image");
        }
        if (profile == null) {
            profile = RadialProfile.of(sample);
        }
        return profile;
    }

    /**
     * Containment diameter for a fraction of the detected light.
     *
     * @throws UnitUnavailableException if {@code unit} is DEG and no focal length is known
     * @throws PsfNotFoundException     if the search fails
     */
    public double getPsf(double fraction, PsfUnit unit) {
        Preconditions.checkArgument(fraction > 0 && fraction <= 1, "fraction must be in (0, 1]: %s", fraction);
        double factor = unitFactor(unit, "computed");
        Double diameter = storedPsf.get(fraction);
        if (diameter == null) {
            diameter = solver.findDiameter(radialProfile(), fraction);
            storedPsf.put(fraction, diameter);
        }
        return diameter * factor;
    }

    /** D80 in cm. */
    public double getPsf() {
        return getPsf(0.8, PsfUnit.CM);
    }

    /**
     * Stores a diameter obtained by other means.
     */
    public void setPsf(double value, double fraction, PsfUnit unit) {
        Preconditions.checkArgument(fraction > 0 && fraction <= 1, "fraction must be in (0, 1]: %s", fraction);
        storedPsf.put(fraction, value / unitFactor(unit, "set"));
    }

    private double unitFactor(PsfUnit unit, String action) {
        if (unit == PsfUnit.CM) {
            return 1.0;
        }
        if (cmToDeg == null) {
            throw new UnitUnavailableException("PSF cannot be " + action + " in deg because focal length is not set");
        }
        return cmToDeg;
    }

    public double getCentroidX() {
        return centroidX;
    }

    public double getCentroidY() {
        return centroidY;
    }

    public int getDetectedPhotons() {
        return sample == null ? 0 : sample.detectedPhotons();
    }

    public long getTotalPhotons() {
        return sample == null ? 0 : sample.totalPhotons();
    }

    public double getEffectiveArea() {
        return getEffectiveArea(1.0);
    }

    /**
     * @param telescopeTransmission transmission factor in [0, 1]
     */
    public double getEffectiveArea(double telescopeTransmission) {
        if (effectiveArea == null || effectiveArea.isNaN()) {
            throw new IllegalStateException("Effective area could not be calculated");
        }
        return effectiveArea * telescopeTransmission;
    }

    public void setEffectiveArea(double value) {
        this.effectiveArea = value;
    }

    /**
     * Fraction of the detected photons inside each radius (cm).
     */
    public CumulativeProfile getCumulativeData(double[] radii) {
        RadialProfile radial = radialProfile();
        double[] fractions = new double[radii.length];
        for (int i = 0; i < radii.length; i++) {
            fractions[i] = (double) radial.countWithin(radii[i]) / radial.size();
        }
        return new CumulativeProfile(radii, fractions);
    }

    /**
     * Cumulative data on 30 radii spanning 0 to 1.6 times D80.
     */
    public CumulativeProfile getCumulativeData() {
        double max = DEFAULT_CUMULATIVE_RANGE * getPsf();
        double[] radii = new double[DEFAULT_CUMULATIVE_POINTS];
        for (int i = 0; i < radii.length; i++) {
            radii[i] = max * i / (radii.length - 1);
        }
        return getCumulativeData(radii);
    }

    /**
     * Photon positions in cm, as {x[], y[]}.
     *
     * @param centralized shift positions so that the centroid is at the origin
     */
    public double[][] getImageData(boolean centralized) {
        if (sample == null) {
            throw new IllegalStateException("Photon positions were not loaded for this image");
        }
        double[] x = sample.x();
        double[] y = sample.y();
        if (centralized) {
            for (int i = 0; i < x.length; i++) {
                x[i] -= centroidX;
                y[i] -= centroidY;
            }
        }
        return new double[][] {x, y};
    }

    @Override
    public String toString() {
        return "PsfImage(" + getDetectedPhotons() + "/" + getTotalPhotons() + " photons)";
    }
}
