package com.optics.service;

import com.optics.model.ConfigurationKey;
import com.optics.model.TelescopeOptics;
import org.apache.commons.io.input.ReversedLinesFileReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Runs sim_telarray in ray-tracing mode (full telescope or one mirror panel) for a single
 * configuration.
 */
public class SimtelRayTracingRunner implements SimulatorRunner {

    private static final Logger log = LoggerFactory.getLogger(SimtelRayTracingRunner.class);

    static final int PHOTONS_PER_RUN = 100000;
    static final int PHOTONS_PER_TEST_RUN = 5000;
    private static final int LOG_LINES_ON_ERROR = 30;

    private final Path simtelPath;
    private final Path configFile;
    private final TelescopeOptics optics;
    private final double siteAltitude;
    private final String label;
    private final Duration timeout;

    /**
     * @param simtelPath   sim_telarray installation
     * @param configFile   sim_telarray configuration of the telescope
     * @param siteAltitude observation level in m
     * @param label        label used in file names, may be null
     */
    public SimtelRayTracingRunner(Path simtelPath, Path configFile, TelescopeOptics optics, double siteAltitude,
                                  String label, Duration timeout) {
        this.simtelPath = simtelPath;
        this.configFile = configFile;
        this.optics = optics;
        this.siteAltitude = siteAltitude;
        this.label = label;
        this.timeout = timeout;
    }

    @Override
    public void run(ConfigurationKey key, Path photonFile, boolean test, boolean force) throws IOException {
        if (Files.exists(photonFile) && !force) {
            log.info("Skipping simulation of {} because {} exists and force = false", key, photonFile);
            return;
        }
        Path directory = photonFile.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Files.deleteIfExists(photonFile);

        Path starsFile = directory.resolve(RayTracingFileNames.rayTracingFileName(optics, key, label,
                RayTracingFileNames.STARS));
        Files.writeString(starsFile, String.format(Locale.US, "0. %.1f 1.0 %.3f%n",
                90.0 - key.zenithAngle, key.sourceDistance));
        Path logFile = directory.resolve(RayTracingFileNames.rayTracingFileName(optics, key, label,
                RayTracingFileNames.LOG));

        List<String> command = buildCommand(key, photonFile, starsFile, test);
        log.info("Simulating ray tracing for {}{}", key, test ? " (test)" : "");
        log.debug("Running {}", String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        pb.redirectOutput(logFile.toFile());
        Process p = pb.start();
        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new ExternalToolException("sim_telarray", -1, collectFinalLines(logFile),
                        "sim_telarray did not finish within " + timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new ExternalToolException("sim_telarray", "Interrupted while running sim_telarray", e);
        }

        if (p.exitValue() != 0) {
            String tail = collectFinalLines(logFile);
            String msg = "Simtel Error - See below the relevant part of the simtel log file.\n"
                    + "===== from simtel log file ======\n" + tail + "=================================";
            log.error(msg);
            throw new ExternalToolException("sim_telarray", p.exitValue(), tail, msg);
        }
        if (!Files.exists(photonFile)) {
            throw new ExternalToolException("sim_telarray", 0, collectFinalLines(logFile),
                    "sim_telarray finished but did not write " + photonFile);
        }
    }

    List<String> buildCommand(ConfigurationKey key, Path photonFile, Path starsFile, boolean test)
            throws IOException {
        List<String> command = new ArrayList<>();
        command.add(simtelPath.resolve("sim_telarray").resolve("bin").resolve("sim_telarray").toString());
        command.add("-c");
        command.add(configFile.toString());
        command.add("-I" + configFile.toAbsolutePath().getParent());
        option(command, "IMAGING_LIST", photonFile);
        option(command, "stars", starsFile);
        option(command, "altitude", siteAltitude);
        option(command, "telescope_theta", key.zenithAngle + key.offAxisAngle);
        option(command, "star_photons", test ? PHOTONS_PER_TEST_RUN : PHOTONS_PER_RUN);
        option(command, "telescope_phi", 0);
        option(command, "camera_transmission", 1.0);
        option(command, "nightsky_background", "all:0.");
        option(command, "trigger_current_limit", "1e10");
        option(command, "telescope_random_angle", 0);
        option(command, "telescope_random_error", 0);
        option(command, "convergent_depth", 0);
        option(command, "maximum_telescopes", 1);
        option(command, "show", "all");
        option(command, "camera_filter", "none");
        if (key.isSingleMirror()) {
            double mirrorFlen = optics.mirrorFocalLength;
            option(command, "focus_offset", "all:0.");
            option(command, "camera_config_file", "single_pixel_camera.dat");
            option(command, "camera_pixels", 1);
            option(command, "trigger_pixels", 1);
            option(command, "camera_body_diameter", 0);
            option(command, "mirror_list", singleMirrorListFile(key.mirrorNumber));
            option(command, "focal_length", 2 * mirrorFlen);
            option(command, "dish_shape_length", mirrorFlen);
            option(command, "mirror_focal_length", mirrorFlen);
            option(command, "parabolic_dish", 0);
            option(command, "mirror_align_random_distance", 0);
            option(command, "mirror_align_random_vertical", "0.,28.,0.,0.");
        }
        command.add("/dev/null");
        return command;
    }

    /**
     * Mirror list describing one panel, written next to the telescope configuration.
     */
    Path singleMirrorListFile(int mirrorNumber) throws IOException {
        Path file = configFile.toAbsolutePath().getParent().resolve(String.format(
                "CTA-single-mirror-list-%s-%s-mirror%d.dat", optics.site, optics.telescopeName, mirrorNumber));
        if (!Files.exists(file)) {
            throw new NoSuchFileException(file.toString(), null, "Single mirror list not found");
        }
        return file;
    }

    private static void option(List<String> command, String parameter, Object value) {
        command.add("-C");
        command.add(parameter + "=" + value);
    }

    static String collectFinalLines(Path logFile) throws IOException {
        if (!Files.exists(logFile)) {
            return "Simtel log file does not exist.\n";
        }
        List<String> lines = new ArrayList<>();
        try (ReversedLinesFileReader reader = ReversedLinesFileReader.builder()
                .setPath(logFile)
                .setCharset(StandardCharsets.UTF_8)
                .get()) {
            String line;
            while (lines.size() < LOG_LINES_ON_ERROR && (line = reader.readLine()) != null) {
                lines.add(line);
            }
        }
        Collections.reverse(lines);
        StringBuilder tail = new StringBuilder();
        lines.forEach(l -> tail.append(l).append('\n'));
        return tail.toString();
    }
}
