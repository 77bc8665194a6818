package com.optics.service;

import com.optics.psf.PsfImage;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the sim_telarray {@code rx} tool on a photon list and turns its one-line summary
 * into a {@link PsfImage}.
 * <p>
 * The decompressed photon list is fed on standard input. The last line rx writes to
 * standard output holds the containment radius, the centroid and, in its sixth column,
 * the effective area. Standard error is kept apart and only reported on failure.
 */
public class RxToolService {

    private static final Logger log = LoggerFactory.getLogger(RxToolService.class);

    /** Values reported by rx, lengths in cm and area in cm^2. */
    public static class RxSummary {
        public final double containmentRadius;
        public final double centroidX;
        public final double centroidY;
        public final double effectiveArea;

        public RxSummary(double containmentRadius, double centroidX, double centroidY, double effectiveArea) {
            this.containmentRadius = containmentRadius;
            this.centroidX = centroidX;
            this.centroidY = centroidY;
            this.effectiveArea = effectiveArea;
        }
    }

    private final Path simtelPath;
    private final Duration timeout;

    public RxToolService(Path simtelPath, Duration timeout) {
        this.simtelPath = simtelPath;
        this.timeout = timeout;
    }

    public Path getExecutable() {
        return simtelPath.resolve("sim_telarray").resolve("bin").resolve("rx");
    }

    /**
     * @param fraction      containment fraction passed to rx
     * @param focalLengthCm focal length for deg conversions, may be null
     */
    public PsfImage analyze(Path photonFile, double fraction, Double focalLengthCm) throws IOException {
        RxSummary summary = run(photonFile, fraction);
        return PsfImage.fromSummary(2 * summary.containmentRadius, fraction, summary.centroidX,
                summary.centroidY, summary.effectiveArea, focalLengthCm);
    }

    public RxSummary run(Path photonFile, double fraction) throws IOException {
        if (!Files.exists(photonFile)) {
            throw new NoSuchFileException(photonFile.toString(), null, "Photon list file not found");
        }
        List<String> command = List.of(getExecutable().toString(), "-f", String.format(Locale.US, "%.2f", fraction), "-v");
        log.debug("Running {} < {}", command, photonFile);

        Path errorFile = Files.createTempFile("rx-", ".err");
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectError(errorFile.toFile());
            Process p = pb.start();
            return collect(p, photonFile, errorFile);
        } finally {
            Files.deleteIfExists(errorFile);
        }
    }

    private RxSummary collect(Process p, Path photonFile, Path errorFile) throws IOException {
        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> {
            try (InputStream out = p.getInputStream()) {
                return IOUtils.toString(out, StandardCharsets.US_ASCII);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });

        // rx may stop reading early, its exit status decides what gets reported
        IOException feedFailure = null;
        try (InputStream photons = PhotonListParser.open(photonFile); OutputStream stdin = p.getOutputStream()) {
            IOUtils.copy(photons, stdin);
        } catch (IOException e) {
            feedFailure = e;
        }

        String output;
        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                p.destroyForcibly();
                throw new ExternalToolException("rx", -1, "", "rx did not finish within " + timeout);
            }
            output = stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            p.destroyForcibly();
            throw new ExternalToolException("rx", "Interrupted while waiting for rx", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new ExternalToolException("rx", "Failed to read rx output", e);
        }
        String errors = Files.readString(errorFile, StandardCharsets.US_ASCII);

        if (p.exitValue() != 0) {
            String captured = output + errors;
            throw new ExternalToolException("rx", p.exitValue(), captured,
                    "rx exited with status " + p.exitValue() + ":\n" + captured, feedFailure);
        }
        if (feedFailure != null) {
            throw new ExternalToolException("rx", 0, output + errors, "Failed to feed " + photonFile + " to rx",
                    feedFailure);
        }
        if (!errors.isBlank()) {
            log.debug("rx diagnostics: {}", errors.trim());
        }
        return parseOutput(output);
    }

    static RxSummary parseOutput(String output) throws ExternalToolException {
        String lastLine = output.lines().filter(l -> !l.isBlank()).reduce((first, second) -> second).orElse("");
        String[] words = lastLine.trim().split("\\s+");
        try {
            return new RxSummary(Double.parseDouble(words[0]), Double.parseDouble(words[1]),
                    Double.parseDouble(words[2]), Double.parseDouble(words[5]));
        } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
            throw new ExternalToolException("rx", 0, output, "Unexpected output format from rx: '" + lastLine + "'");
        }
    }
}
