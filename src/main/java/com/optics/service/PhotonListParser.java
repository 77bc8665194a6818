package com.optics.service;

import com.optics.model.PhotonSample;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.math3.util.ResizableDoubleArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Reads sim_telarray imaging lists (plain or gzip) into a {@link PhotonSample}.
 * <p>
 * Header lines carry the number of photons thrown and the area they were thrown over;
 * data lines carry the photon position in cm in their third and fourth column.
 */
public class PhotonListParser {

    private static final Logger log = LoggerFactory.getLogger(PhotonListParser.class);

    static final String HEADER_MARKER = "falling on an area of";
    private static final int PHOTONS_TOKEN = 4;
    private static final int AREA_TOKEN = 14;
    private static final int X_TOKEN = 2;
    private static final int Y_TOKEN = 3;

    public PhotonSample parse(Path photonFile) throws IOException {
        if (!Files.exists(photonFile)) {
            throw new NoSuchFileException(photonFile.toString(), null, "Photon list file not found");
        }
        log.info("Reading photon list {}", photonFile);
        try (InputStream in = open(photonFile)) {
            return parse(in, photonFile.getFileName().toString());
        }
    }

    /** Opens a photon list, decompressing it when the name ends in .gz. */
    public static InputStream open(Path photonFile) throws IOException {
        InputStream in = Files.newInputStream(photonFile);
        if ("gz".equalsIgnoreCase(FilenameUtils.getExtension(photonFile.toString()))) {
            return new GZIPInputStream(in);
        }
        return in;
    }

    /**
     * @param source name used in messages
     */
    public PhotonSample parse(InputStream in, String source) throws IOException {
        ResizableDoubleArray x = new ResizableDoubleArray();
        ResizableDoubleArray y = new ResizableDoubleArray();
        long totalPhotons = 0;
        Double totalArea = null;

        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.US_ASCII));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.contains(HEADER_MARKER)) {
                String[] words = trimmed.split("\\s+");
                try {
                    totalPhotons += Long.parseLong(words[PHOTONS_TOKEN]);
                    double area = Double.parseDouble(words[AREA_TOKEN]);
                    if (totalArea == null) {
                        totalArea = area;
                    } else if (area != totalArea) {
                        log.warn("Conflicting value of the total area found {} != {} - keeping the original value",
                                totalArea, area);
                    }
                } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                    throw new InvalidPhotonListException(
                            String.format("%s:%d: malformed header line '%s'", source, lineNumber, trimmed), e);
                }
            } else if (!trimmed.isEmpty() && !trimmed.startsWith("#")) {
                String[] words = trimmed.split("\\s+");
                try {
                    x.addElement(Double.parseDouble(words[X_TOKEN]));
                    y.addElement(Double.parseDouble(words[Y_TOKEN]));
                } catch (NumberFormatException | ArrayIndexOutOfBoundsException e) {
                    throw new InvalidPhotonListException(
                            String.format("%s:%d: malformed photon line '%s'", source, lineNumber, trimmed), e);
                }
            }
        }

        if (x.getNumElements() == 0 || x.getNumElements() != y.getNumElements()) {
            log.error("Problems reading photon list {} - invalid data", source);
            throw new InvalidPhotonListException("Problems reading photon list " + source + " - no photon positions");
        }
        if (totalArea == null || totalPhotons < x.getNumElements()) {
            throw new InvalidPhotonListException(String.format(
                    "Photon list %s has no valid '%s' header (%d photons thrown, %d detected)",
                    source, HEADER_MARKER, totalPhotons, x.getNumElements()));
        }
        return new PhotonSample(x.getElements(), y.getElements(), totalPhotons, totalArea);
    }
}
