package com.optics.service;

import com.optics.model.ConfigurationKey;
import com.optics.model.RayTracingConfig;
import com.optics.model.TelescopeOptics;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Names of the files written and read during ray tracing. Every name is derived from the
 * telescope, the configuration key and the optional label only.
 */
public final class RayTracingFileNames {

    public static final String PHOTONS = "photons";
    public static final String STARS = "stars";
    public static final String LOG = "log";

    private RayTracingFileNames() {
    }

    /** {@code <base>[/<label>]/ray-tracing} */
    public static Path outputDirectory(Path base, String label) {
        Path dir = label == null ? base : base.resolve(label);
        return dir.resolve("ray-tracing");
    }

    /**
     * e.g. {@code photons-North-LST-1-d10.0-za20.0-off0.500_mirror3_test.lis}
     *
     * @param kind {@link #PHOTONS}, {@link #STARS} or {@link #LOG}
     */
    public static String rayTracingFileName(TelescopeOptics optics, ConfigurationKey key, String label, String kind) {
        StringBuilder name = new StringBuilder(String.format(Locale.US, "%s-%s-%s-d%.1f-za%.1f-off%.3f",
                kind, optics.site, optics.telescopeName, key.sourceDistance, key.zenithAngle,
                key.offAxisAngle));
        if (key.mirrorNumber != null) {
            name.append("_mirror").append(key.mirrorNumber);
        }
        if (label != null) {
            name.append('_').append(label);
        }
        name.append(LOG.equals(kind) ? ".log" : ".lis");
        return name.toString();
    }

    /**
     * Photon list of a configuration; the gzip variant is returned when only it exists.
     */
    public static Path photonListFile(Path directory, TelescopeOptics optics, ConfigurationKey key, String label) {
        Path plain = directory.resolve(rayTracingFileName(optics, key, label, PHOTONS));
        Path gzipped = plain.resolveSibling(plain.getFileName() + ".gz");
        if (!Files.exists(plain) && Files.exists(gzipped)) {
            return gzipped;
        }
        return plain;
    }

    /** e.g. {@code ray-tracing-North-LST-1-d10.0-za20.0_test.ecsv} */
    public static String resultsFileName(TelescopeOptics optics, RayTracingConfig config) {
        String name = String.format(Locale.US, "ray-tracing-%s-%s-d%.1f-za%.1f", optics.site,
                optics.telescopeName, config.getSourceDistance(), config.getZenithAngle());
        if (config.getLabel() != null) {
            name += "_" + config.getLabel();
        }
        return name + config.getResultsFormat().extension();
    }
}
