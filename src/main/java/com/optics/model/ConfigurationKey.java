package com.optics.model;

import java.util.Objects;

/**
 * One point of the ray-tracing configuration matrix.
 */
public final class ConfigurationKey {
    public final double offAxisAngle;   // deg
    public final Integer mirrorNumber;  // null unless single-mirror mode is active
    public final double zenithAngle;    // deg
    public final double sourceDistance; // km

    public ConfigurationKey(double offAxisAngle, Integer mirrorNumber, double zenithAngle, double sourceDistance) {
        this.offAxisAngle = offAxisAngle;
        this.mirrorNumber = mirrorNumber;
        this.zenithAngle = zenithAngle;
        this.sourceDistance = sourceDistance;
    }

    public boolean isSingleMirror() {
        return mirrorNumber != null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConfigurationKey)) return false;
        ConfigurationKey other = (ConfigurationKey) o;
        return Double.compare(offAxisAngle, other.offAxisAngle) == 0
                && Objects.equals(mirrorNumber, other.mirrorNumber)
                && Double.compare(zenithAngle, other.zenithAngle) == 0
                && Double.compare(sourceDistance, other.sourceDistance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offAxisAngle, mirrorNumber, zenithAngle, sourceDistance);
    }

    @Override
    public String toString() {
        return String.format("off-axis=%.3f deg%s", offAxisAngle, mirrorNumber == null ? "" : ", mirror=" + mirrorNumber);
    }
}
