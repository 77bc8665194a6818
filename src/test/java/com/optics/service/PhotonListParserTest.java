package com.optics.service;

import com.optics.model.PhotonFixtures;
import com.optics.model.PhotonSample;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class PhotonListParserTest {

    @TempDir
    Path tempDir;

    private final PhotonListParser parser = new PhotonListParser();

    private static PhotonSample parse(PhotonListParser parser, String content) throws IOException {
        return parser.parse(new ByteArrayInputStream(content.getBytes(StandardCharsets.US_ASCII)), "test");
    }

    @Test
    void testParsePlainFile() throws IOException {
        PhotonSample written = PhotonFixtures.spiralDisk(200, 5.0, 1.0, -2.0, 1000, 1256.6);
        Path file = tempDir.resolve("photons.lis");
        PhotonFixtures.writePhotonList(file, written);

        PhotonSample read = parser.parse(file);

        assertEquals(200, read.detectedPhotons());
        assertEquals(1000, read.totalPhotons());
        assertEquals(1256.6, read.totalScatteredArea(), 1e-6);
        assertArrayEquals(written.x(), read.x(), 1e-5);
        assertArrayEquals(written.y(), read.y(), 1e-5);
    }

    @Test
    void testParseGzipFile() throws IOException {
        PhotonSample written = PhotonFixtures.spiralDisk(50, 2.0);
        Path file = tempDir.resolve("photons.lis.gz");
        PhotonFixtures.writePhotonList(file, written);

        PhotonSample read = parser.parse(file);

        assertEquals(50, read.detectedPhotons());
        assertArrayEquals(written.x(), read.x(), 1e-5);
    }

    @Test
    void testPhotonCountsAddUpAcrossHeadersAndFirstAreaWins() throws IOException {
        String content = PhotonFixtures.headerLine(100, 500.0) + "\n"
                + "1 0 0.5 0.5\n"
                + PhotonFixtures.headerLine(150, 800.0) + "\n"
                + "1 0 -0.5 0.25\n";

        PhotonSample sample = parse(parser, content);

        assertEquals(250, sample.totalPhotons());
        assertEquals(500.0, sample.totalScatteredArea(), 1e-9);
        assertEquals(2, sample.detectedPhotons());
    }

    @Test
    void testCommentsAndBlankLinesAreSkipped() throws IOException {
        String content = "# comment\n\n" + PhotonFixtures.headerLine(10, 1.0) + "\n   \n1 0 1.0 2.0\n#x\n";

        PhotonSample sample = parse(parser, content);

        assertEquals(1, sample.detectedPhotons());
        assertEquals(1.0, sample.x()[0]);
        assertEquals(2.0, sample.y()[0]);
    }

    @Test
    void testNoPhotonsIsInvalid() {
        String content = PhotonFixtures.headerLine(10, 1.0) + "\n# nothing else\n";
        assertThrows(InvalidPhotonListException.class, () -> parse(parser, content));
    }

    @Test
    void testMissingHeaderIsInvalid() {
        assertThrows(InvalidPhotonListException.class, () -> parse(parser, "1 0 1.0 2.0\n"));
    }

    @Test
    void testMalformedDataLineReportsLineNumber() {
        String content = PhotonFixtures.headerLine(10, 1.0) + "\n1 0 1.0 2.0\n1 0 abc 2.0\n";

        InvalidPhotonListException e = assertThrows(InvalidPhotonListException.class, () -> parse(parser, content));
        assertTrue(e.getMessage().contains("test:3"), e.getMessage());
    }

    @Test
    void testShortDataLineIsInvalid() {
        String content = PhotonFixtures.headerLine(10, 1.0) + "\n1 0 1.0\n";
        assertThrows(InvalidPhotonListException.class, () -> parse(parser, content));
    }

    @Test
    void testFewerThrownThanDetectedIsInvalid() {
        String content = PhotonFixtures.headerLine(1, 1.0) + "\n1 0 1.0 2.0\n1 0 1.5 2.0\n";
        assertThrows(InvalidPhotonListException.class, () -> parse(parser, content));
    }

    @Test
    void testMissingFile() {
        assertThrows(NoSuchFileException.class, () -> parser.parse(tempDir.resolve("missing.lis")));
    }

    @Test
    void testOpenReturnsDecompressedBytes() throws IOException {
        Path file = tempDir.resolve("list.lis.gz");
        PhotonFixtures.writePhotonList(file, PhotonFixtures.spiralDisk(3, 1.0));

        String text;
        try (InputStream in = PhotonListParser.open(file)) {
            text = new String(in.readAllBytes(), StandardCharsets.US_ASCII);
        }
        assertTrue(text.contains(PhotonListParser.HEADER_MARKER));
        assertTrue(Files.size(file) > 0);
    }
}
