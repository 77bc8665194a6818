package com.optics.service;

import com.optics.model.ResultColumn;
import com.optics.model.ResultRow;
import com.optics.model.ResultsTable;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ResultsTableStoreTest {

    @TempDir
    Path tempDir;

    private final ResultsTableStore store = new ResultsTableStore();

    private static ResultsTable fullTelescopeTable() {
        ResultsTable table = new ResultsTable(20.0, 10.0, false);
        table.add(new ResultRow(0.0, 3.456789, 0.0707, 9.5e5, Double.NaN, null));
        table.add(new ResultRow(1.5, 3.9, 0.0798, 9.1e5, 2801.25, null));
        table.add(new ResultRow(0.5, 3.5, 0.0716, 9.4e5, 2799.5, null));
        return table;
    }

    private static void assertSameColumns(ResultsTable expected, ResultsTable actual) {
        assertEquals(expected.size(), actual.size());
        assertEquals(expected.columns(), actual.columns());
        assertEquals(expected.getZenithAngle(), actual.getZenithAngle(), 1e-12);
        assertEquals(expected.getSourceDistance(), actual.getSourceDistance(), 1e-12);
        for (ResultColumn column : expected.columns()) {
            assertArrayEquals(expected.column(column), actual.column(column), 1e-9, column.columnName());
        }
    }

    @Test
    void testEcsvRoundTrip() throws IOException {
        ResultsTable table = fullTelescopeTable();
        Path file = tempDir.resolve("ray-tracing-North-LST-1-d10.0-za20.0.ecsv");

        store.write(table, file);

        List<String> lines = Files.readAllLines(file);
        assertEquals("# %ECSV 1.0", lines.get(0));
        assertTrue(lines.contains("off_axis d80_cm d80_deg eff_area eff_flen"));
        assertTrue(lines.stream().anyMatch(l -> l.endsWith(" nan")));
        assertSameColumns(table, store.read(file));
    }

    @Test
    void testEcsvRoundTripSingleMirror() throws IOException {
        ResultsTable table = new ResultsTable(0.0, 0.056, true);
        table.add(new ResultRow(0.0, 1.2, 0.02, 1.1e4, Double.NaN, 1));
        table.add(new ResultRow(0.0, 1.4, 0.03, 1.0e4, Double.NaN, 2));
        Path file = tempDir.resolve("single.ecsv");

        store.write(table, file);
        ResultsTable read = store.read(file);

        assertTrue(read.isSingleMirror());
        assertEquals(2, read.rows().get(1).mirrorNumber);
        assertSameColumns(table, read);
        assertTrue(Files.readAllLines(file).contains("off_axis d80_cm d80_deg eff_area eff_flen mirror_no"));
    }

    @Test
    void testFitsRoundTrip() throws IOException {
        ResultsTable table = fullTelescopeTable();
        Path file = tempDir.resolve("results.fits");

        store.write(table, file);

        assertSameColumns(table, store.read(file));
    }

    @Test
    void testFitsRoundTripSingleMirror() throws IOException {
        ResultsTable table = new ResultsTable(0.0, 0.056, true);
        table.add(new ResultRow(0.0, 1.2, 0.02, 1.1e4, Double.NaN, 7));
        Path file = tempDir.resolve("single.fits");

        store.write(table, file);
        ResultsTable read = store.read(file);

        assertEquals(7, read.rows().get(0).mirrorNumber);
        assertSameColumns(table, read);
    }

    @Test
    void testOverwrite() throws IOException {
        Path file = tempDir.resolve("results.ecsv");
        store.write(fullTelescopeTable(), file);

        ResultsTable smaller = new ResultsTable(20.0, 10.0, false);
        smaller.add(new ResultRow(0.0, 1.0, 0.02, 1.0, Double.NaN, null));
        store.write(smaller, file);

        assertEquals(1, store.read(file).size());
    }

    @Test
    void testUnknownColumnInFile() throws IOException {
        Path file = tempDir.resolve("bad.ecsv");
        Files.writeString(file, "# %ECSV 1.0\n# ---\n# schema: astropy-2.0\noff_axis d90_cm\n0.0 1.0\n");

        assertThrows(IOException.class, () -> store.read(file));
    }

    @Test
    void testNotEcsv() throws IOException {
        Path file = tempDir.resolve("plain.ecsv");
        Files.writeString(file, "off_axis d80_cm\n0.0 1.0\n");

        assertThrows(IOException.class, () -> store.read(file));
    }
}
