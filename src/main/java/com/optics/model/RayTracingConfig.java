package com.optics.model;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.optics.psf.SolverSettings;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Settings of one ray-tracing run: the configuration matrix and how it is analysed.
 */
public final class RayTracingConfig {

    public enum ResultsFormat {
        ECSV(".ecsv"),
        FITS(".fits");

        private final String extension;

        ResultsFormat(String extension) {
            this.extension = extension;
        }

        public String extension() {
            return extension;
        }
    }

    private static final double CM_TO_KM = 1.0e-5;

    private final String label;
    private final double zenithAngle;
    private final List<Double> offAxisAngles;
    private final double sourceDistance;
    private final boolean singleMirrorMode;
    private final List<Integer> mirrorNumbers;
    private final int workerThreads;
    private final SolverSettings solverSettings;
    private final ResultsFormat resultsFormat;

    private RayTracingConfig(Builder b) {
        this.label = b.label;
        this.zenithAngle = b.zenithAngle;
        this.offAxisAngles = ImmutableList.copyOf(b.offAxisAngles);
        this.sourceDistance = b.sourceDistance;
        this.singleMirrorMode = b.singleMirrorMode;
        this.mirrorNumbers = ImmutableList.copyOf(b.mirrorNumbers);
        this.workerThreads = b.workerThreads;
        this.solverSettings = b.solverSettings;
        this.resultsFormat = b.resultsFormat;
    }

    /**
     * Builder preloaded with the defaults of the telescope: 7 off-axis angles between 0 and
     * 3 deg at 20 deg zenith and 10 km, or on-axis at zenith with the source at twice the
     * mirror focal length in single-mirror mode.
     */
    public static Builder builder(TelescopeOptics optics, boolean singleMirrorMode) {
        return new Builder(optics, singleMirrorMode);
    }

    /** Matrix keys, off-axis angle outermost. */
    public List<ConfigurationKey> configurationMatrix() {
        List<ConfigurationKey> keys = new ArrayList<>();
        for (double offAxis : offAxisAngles) {
            if (singleMirrorMode) {
                for (Integer mirror : mirrorNumbers) {
                    keys.add(new ConfigurationKey(offAxis, mirror, zenithAngle, sourceDistance));
                }
            } else {
                keys.add(new ConfigurationKey(offAxis, null, zenithAngle, sourceDistance));
            }
        }
        return keys;
    }

    public String getLabel() { return label; }
    public double getZenithAngle() { return zenithAngle; }
    public List<Double> getOffAxisAngles() { return offAxisAngles; }
    public double getSourceDistance() { return sourceDistance; }
    public boolean isSingleMirrorMode() { return singleMirrorMode; }
    public List<Integer> getMirrorNumbers() { return mirrorNumbers; }
    public int getWorkerThreads() { return workerThreads; }
    public SolverSettings getSolverSettings() { return solverSettings; }
    public ResultsFormat getResultsFormat() { return resultsFormat; }

    @Override
    public String toString() {
        return "RayTracingConfig{" +
                "label=" + label +
                ", zenithAngle=" + zenithAngle +
                ", offAxisAngles=" + offAxisAngles +
                ", sourceDistance=" + sourceDistance +
                ", singleMirrorMode=" + singleMirrorMode +
                ", mirrorNumbers=" + mirrorNumbers +
                ", workerThreads=" + workerThreads +
                '}';
    }

    public static final class Builder {
        private final int numberOfMirrors;
        private String label;
        private double zenithAngle;
        private List<Double> offAxisAngles;
        private double sourceDistance;
        private final boolean singleMirrorMode;
        private List<Integer> mirrorNumbers = List.of();
        private int workerThreads = 1;
        private SolverSettings solverSettings = SolverSettings.defaults();
        private ResultsFormat resultsFormat = ResultsFormat.ECSV;

        private Builder(TelescopeOptics optics, boolean singleMirrorMode) {
            this.numberOfMirrors = optics.numberOfMirrors;
            this.singleMirrorMode = singleMirrorMode;
            if (singleMirrorMode) {
                zenithAngle = 0;
                offAxisAngles = List.of(0.0);
                sourceDistance = 2 * optics.mirrorFocalLength * CM_TO_KM;
                mirrorNumbers = List.of(1);
            } else {
                zenithAngle = 20;
                offAxisAngles = IntStream.rangeClosed(0, 6).mapToObj(i -> i * 0.5).collect(Collectors.toList());
                sourceDistance = 10;
            }
        }

        public Builder label(String label) {
            this.label = label;
            return this;
        }

        public Builder zenithAngle(double zenithAngle) {
            this.zenithAngle = zenithAngle;
            return this;
        }

        public Builder offAxisAngles(List<Double> offAxisAngles) {
            Preconditions.checkArgument(!offAxisAngles.isEmpty(), "at least one off-axis angle is needed");
            this.offAxisAngles = offAxisAngles;
            return this;
        }

        public Builder sourceDistance(double sourceDistance) {
            Preconditions.checkArgument(sourceDistance > 0, "source distance must be positive");
            this.sourceDistance = sourceDistance;
            return this;
        }

        public Builder mirrorNumbers(List<Integer> mirrorNumbers) {
            Preconditions.checkState(singleMirrorMode, "mirror numbers only apply in single-mirror mode");
            Preconditions.checkArgument(!mirrorNumbers.isEmpty(), "at least one mirror number is needed");
            this.mirrorNumbers = mirrorNumbers;
            return this;
        }

        /** Every mirror panel of the telescope. */
        public Builder allMirrors() {
            return mirrorNumbers(IntStream.rangeClosed(1, numberOfMirrors).boxed().collect(Collectors.toList()));
        }

        public Builder workerThreads(int workerThreads) {
            Preconditions.checkArgument(workerThreads >= 1, "worker threads must be >= 1");
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder solverSettings(SolverSettings solverSettings) {
            this.solverSettings = solverSettings;
            return this;
        }

        public Builder resultsFormat(ResultsFormat resultsFormat) {
            this.resultsFormat = resultsFormat;
            return this;
        }

        public RayTracingConfig build() {
            return new RayTracingConfig(this);
        }
    }
}
