package com.optics.service;

import com.google.common.base.Preconditions;
import com.optics.model.ConfigurationKey;
import com.optics.model.RayTracingConfig;
import com.optics.model.ResultRow;
import com.optics.model.ResultsTable;
import com.optics.model.TelescopeOptics;
import com.optics.psf.ContainmentRadiusSolver;
import com.optics.psf.PsfImage;
import com.optics.psf.PsfNotFoundException;
import com.optics.psf.PsfUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the ray-tracing simulations of a configuration matrix and turns the photon lists
 * into a table of D80, effective area and effective focal length per configuration.
 * <p>
 * A results file already on disk is reused by {@link #analyze} unless {@code force} is set.
 */
public class RayTracingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RayTracingOrchestrator.class);

    public enum State {
        CONFIGURED,
        SIMULATED,
        ANALYZED
    }

    static final double D80_FRACTION = 0.8;

    private final RayTracingConfig config;
    private final TelescopeOptics optics;
    private final SimulatorRunner runner;
    private final PhotonListParser parser;
    private final RxToolService rxTool;
    private final ResultsTableStore store;
    private final PsfImageCache images;
    private final ContainmentRadiusSolver solver;
    private final Path outputDirectory;
    private final Path resultsFile;

    private State state = State.CONFIGURED;
    private ResultsTable results;
    private final Map<ConfigurationKey, String> failures = new LinkedHashMap<>();

    public RayTracingOrchestrator(RayTracingConfig config,
                                  TelescopeOptics optics,
                                  Path outputBase,
                                  SimulatorRunner runner,
                                  PhotonListParser parser,
                                  RxToolService rxTool,
                                  ResultsTableStore store,
                                  PsfImageCache images) {
        this.config = config;
        this.optics = optics;
        this.runner = runner;
        this.parser = parser;
        this.rxTool = rxTool;
        this.store = store;
        this.images = images;
        this.solver = new ContainmentRadiusSolver(config.getSolverSettings());
        this.outputDirectory = RayTracingFileNames.outputDirectory(outputBase, config.getLabel());
        this.resultsFile = outputDirectory.resolve(RayTracingFileNames.resultsFileName(optics, config));
    }

    /**
     * Requests a photon list for every configuration; existing lists are kept unless
     * {@code force} is set.
     *
     * @param test reduced photon budget, passed to the runner
     */
    public void simulate(boolean test, boolean force) throws IOException {
        Files.createDirectories(outputDirectory);
        for (ConfigurationKey key : config.configurationMatrix()) {
            Path photonFile = photonFile(key);
            if (Files.exists(photonFile) && !force) {
                log.info("Skipping simulation for {} because {} exists and force = false", key, photonFile);
                continue;
            }
            log.info("Simulating ray tracing for {}", key);
            runner.run(key, photonFile, test, force);
        }
        state = State.SIMULATED;
    }

    public ResultsTable analyze(boolean export, boolean force, boolean useRx) throws IOException {
        return analyze(export, force, useRx, false);
    }

    /**
     * @param export                  write the table to {@link #getResultsFile()}
     * @param force                   recompute even if the results file exists
     * @param useRx                   take D80, centroid and area from the rx tool
     * @param noTelescopeTransmission use a transmission of 1 for every off-axis angle
     */
    public ResultsTable analyze(boolean export, boolean force, boolean useRx, boolean noTelescopeTransmission)
            throws IOException {
        if (Files.exists(resultsFile) && !force) {
            log.info("Skipping analysis because {} exists and force = false", resultsFile);
            images.clear();
            failures.clear();
            readResults();
            return results;
        }

        images.clear();
        List<ConfigurationKey> keys = config.configurationMatrix();
        List<Outcome> outcomes = config.getWorkerThreads() > 1
                ? analyzeInPool(keys, useRx, noTelescopeTransmission)
                : analyzeSequentially(keys, useRx, noTelescopeTransmission);

        ResultsTable table = new ResultsTable(config.getZenithAngle(), config.getSourceDistance(),
                config.isSingleMirrorMode());
        failures.clear();
        for (int i = 0; i < keys.size(); i++) {
            Outcome outcome = outcomes.get(i);
            if (outcome.row != null) {
                table.add(outcome.row);
                images.put(keys.get(i), outcome.image);
            } else {
                failures.put(keys.get(i), outcome.failure);
            }
        }
        if (!failures.isEmpty()) {
            log.warn("{} of {} configurations failed: {}", failures.size(), keys.size(), failures.keySet());
        }

        results = table;
        state = State.ANALYZED;
        if (export) {
            exportResults();
        }
        return results;
    }

    private List<Outcome> analyzeSequentially(List<ConfigurationKey> keys, boolean useRx, boolean noTransmission)
            throws IOException {
        List<Outcome> outcomes = new ArrayList<>(keys.size());
        for (ConfigurationKey key : keys) {
            outcomes.add(analyzeOrRecord(key, useRx, noTransmission));
        }
        return outcomes;
    }

    private List<Outcome> analyzeInPool(List<ConfigurationKey> keys, boolean useRx, boolean noTransmission)
            throws IOException {
        ExecutorService pool = Executors.newFixedThreadPool(config.getWorkerThreads());
        try {
            List<Future<Outcome>> futures = new ArrayList<>(keys.size());
            for (ConfigurationKey key : keys) {
                futures.add(pool.submit(() -> analyzeOrRecord(key, useRx, noTransmission)));
            }
            List<Outcome> outcomes = new ArrayList<>(keys.size());
            for (Future<Outcome> future : futures) {
                outcomes.add(future.get());
            }
            return outcomes;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while analysing ray tracing", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IOException("Ray-tracing analysis failed", cause);
        } finally {
            pool.shutdownNow();
        }
    }

    private Outcome analyzeOrRecord(ConfigurationKey key, boolean useRx, boolean noTransmission)
            throws IOException {
        try {
            return analyzeConfiguration(key, useRx, noTransmission);
        } catch (PsfNotFoundException e) {
            log.error("PSF not found for {}: {}", key, e.getMessage());
            return new Outcome(null, null, e.getMessage());
        }
    }

    private Outcome analyzeConfiguration(ConfigurationKey key, boolean useRx, boolean noTransmission)
            throws IOException {
        log.info("Analyzing ray tracing for {}", key);
        Path photonFile = photonFile(key);
        Double focalLength = optics.focalLength;
        PsfImage image = useRx
                ? rxTool.analyze(photonFile, D80_FRACTION, focalLength)
                : PsfImage.fromPhotons(parser.parse(photonFile), focalLength, solver);

        double offAxis = key.offAxisAngle;
        double d80Cm = image.getPsf(D80_FRACTION, PsfUnit.CM);
        double d80Deg;
        if (image.hasFocalLength()) {
            d80Deg = image.getPsf(D80_FRACTION, PsfUnit.DEG);
        } else {
            log.warn("No usable focal length for {}; d80_deg set to NaN", key);
            d80Deg = Double.NaN;
        }
        double transmission = noTransmission ? 1.0 : optics.transmission.at(offAxis);
        double effArea = image.getEffectiveArea(transmission);
        double effFlen = offAxis == 0 ? Double.NaN : image.getCentroidX() / Math.tan(Math.toRadians(offAxis));

        return new Outcome(new ResultRow(offAxis, d80Cm, d80Deg, effArea, effFlen, key.mirrorNumber), image, null);
    }

    public void exportResults() throws IOException {
        if (results == null) {
            log.error("Cannot export results because they do not exist");
            return;
        }
        log.info("Exporting results to {}", resultsFile);
        store.write(results, resultsFile);
    }

    public ResultsTable readResults() throws IOException {
        results = store.read(resultsFile);
        state = State.ANALYZED;
        return results;
    }

    public Optional<ResultsTable> getResults() {
        return Optional.ofNullable(results);
    }

    /**
     * @throws com.optics.model.UnknownColumnException if {@code column} is not a results column
     */
    public double getMean(String column) {
        return requireResults().mean(column);
    }

    /**
     * Population standard deviation of a results column.
     *
     * @throws com.optics.model.UnknownColumnException if {@code column} is not a results column
     */
    public double getStdDev(String column) {
        return requireResults().stdDev(column);
    }

    private ResultsTable requireResults() {
        Preconditions.checkState(results != null, "No results available; run analyze() first");
        return results;
    }

    /**
     * Images of the last computed analysis keyed by off-axis angle; empty after a cache hit
     * or before any analysis.
     */
    public Map<Double, PsfImage> images() {
        if (images.isEmpty()) {
            log.error("No image found");
            return Collections.emptyMap();
        }
        return images.byOffAxis();
    }

    /** Configurations whose PSF could not be found in the last analysis, with the reason. */
    public Map<ConfigurationKey, String> getFailures() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public State getState() {
        return state;
    }

    public Path getResultsFile() {
        return resultsFile;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    private Path photonFile(ConfigurationKey key) {
        return RayTracingFileNames.photonListFile(outputDirectory, optics, key, config.getLabel());
    }

    /** Result of one configuration: a row and its image, or the reason it failed. */
    private static class Outcome {
        final ResultRow row;
        final PsfImage image;
        final String failure;

        Outcome(ResultRow row, PsfImage image, String failure) {
            this.row = row;
            this.image = image;
            this.failure = failure;
        }
    }
}
