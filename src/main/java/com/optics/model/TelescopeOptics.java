package com.optics.model;

/**
 * Model parameters of the telescope that the analysis needs.
 */
public class TelescopeOptics {
    public final String telescopeName;     // e.g. "MST-FlashCam"
    public final String site;              // "North" or "South"
    public final double focalLength;       // cm
    public final double mirrorFocalLength; // single mirror panel, cm
    public final int numberOfMirrors;
    public final TelescopeTransmission transmission;

    public TelescopeOptics(String telescopeName, String site, double focalLength, double mirrorFocalLength,
                           int numberOfMirrors, TelescopeTransmission transmission) {
        this.telescopeName = telescopeName;
        this.site = site;
        this.focalLength = focalLength;
        this.mirrorFocalLength = mirrorFocalLength;
        this.numberOfMirrors = numberOfMirrors;
        this.transmission = transmission;
    }
}
