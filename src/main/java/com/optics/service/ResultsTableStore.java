package com.optics.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.optics.model.ResultColumn;
import com.optics.model.ResultRow;
import com.optics.model.ResultsTable;
import com.optics.model.UnknownColumnException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Persists a {@link ResultsTable} as ECSV, or as a FITS binary table when the file name
 * ends in {@code .fits}.
 */
public class ResultsTableStore {

    private static final Logger log = LoggerFactory.getLogger(ResultsTableStore.class);

    private static final String ECSV_SIGNATURE = "%ECSV 1.0";
    private static final String ZENITH_ANGLE = "zenith_angle";
    private static final String SOURCE_DISTANCE = "source_distance";
    private static final String FITS_ZENITH = "ZENITH";
    private static final String FITS_DISTANCE = "SRCDIST";

    private final YAMLMapper yaml = YAMLMapper.builder()
            .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();

    public void write(ResultsTable table, Path file) throws IOException {
        Files.createDirectories(file.toAbsolutePath().getParent());
        if (isFits(file)) {
            writeFits(table, file);
        } else {
            writeEcsv(table, file);
        }
        log.info("Exported {} result rows to {}", table.size(), file);
    }

    public ResultsTable read(Path file) throws IOException {
        ResultsTable table = isFits(file) ? readFits(file) : readEcsv(file);
        log.info("Read {} result rows from {}", table.size(), file);
        return table;
    }

    private static boolean isFits(Path file) {
        String ext = FilenameUtils.getExtension(file.getFileName().toString()).toLowerCase();
        return ext.equals("fits") || ext.equals("fit");
    }

    // --- ECSV ---

    private void writeEcsv(ResultsTable table, Path file) throws IOException {
        List<Map<String, Object>> datatype = new ArrayList<>();
        for (ResultColumn column : table.columns()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", column.columnName());
            if (column.unit() != null) {
                entry.put("unit", column.unit());
            }
            entry.put("datatype", column == ResultColumn.MIRROR_NUMBER ? "int64" : "float64");
            datatype.add(entry);
        }
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(ZENITH_ANGLE, table.getZenithAngle());
        meta.put(SOURCE_DISTANCE, table.getSourceDistance());

        Map<String, Object> header = new LinkedHashMap<>();
        header.put("datatype", datatype);
        header.put("meta", meta);
        header.put("schema", "astropy-2.0");

        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            out.write("# " + ECSV_SIGNATURE + "\n");
            out.write("# ---\n");
            for (String line : yaml.writeValueAsString(header).split("\n")) {
                out.write("# " + line + "\n");
            }
            List<String> names = new ArrayList<>();
            table.columns().forEach(c -> names.add(c.columnName()));
            out.write(String.join(" ", names) + "\n");

            for (ResultRow row : table.rows()) {
                List<String> cells = new ArrayList<>();
                for (ResultColumn column : table.columns()) {
                    cells.add(column == ResultColumn.MIRROR_NUMBER
                            ? String.valueOf(row.mirrorNumber)
                            : formatDouble(column.valueOf(row)));
                }
                out.write(String.join(" ", cells) + "\n");
            }
        }
    }

    private ResultsTable readEcsv(Path file) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        if (lines.isEmpty() || !lines.get(0).startsWith("# %ECSV")) {
            throw new IOException(file + " is not an ECSV file");
        }
        StringBuilder headerYaml = new StringBuilder();
        int i = 1;
        for (; i < lines.size() && lines.get(i).startsWith("#"); i++) {
            String content = lines.get(i).length() > 1 ? lines.get(i).substring(2) : "";
            headerYaml.append(content).append('\n');
        }
        if (i >= lines.size()) {
            throw new IOException(file + " has no column names line");
        }

        JsonNode header = yaml.readTree(headerYaml.toString());
        JsonNode meta = header.path("meta");
        double zenith = meta.path(ZENITH_ANGLE).asDouble(Double.NaN);
        double distance = meta.path(SOURCE_DISTANCE).asDouble(Double.NaN);

        String[] names = lines.get(i++).trim().split("\\s+");
        Map<ResultColumn, Integer> index = columnIndex(names, file);
        boolean singleMirror = index.containsKey(ResultColumn.MIRROR_NUMBER);

        ResultsTable table = new ResultsTable(zenith, distance, singleMirror);
        for (; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] cells = line.split("\\s+");
            if (cells.length != names.length) {
                throw new IOException(String.format("%s:%d: expected %d values, found %d", file, i + 1,
                        names.length, cells.length));
            }
            try {
                table.add(new ResultRow(
                        parseDouble(cells[index.get(ResultColumn.OFF_AXIS)]),
                        parseDouble(cells[index.get(ResultColumn.D80_CM)]),
                        parseDouble(cells[index.get(ResultColumn.D80_DEG)]),
                        parseDouble(cells[index.get(ResultColumn.EFF_AREA)]),
                        parseDouble(cells[index.get(ResultColumn.EFF_FLEN)]),
                        singleMirror ? Integer.valueOf(cells[index.get(ResultColumn.MIRROR_NUMBER)]) : null));
            } catch (NumberFormatException e) {
                throw new IOException(String.format("%s:%d: invalid number in '%s'", file, i + 1, line), e);
            }
        }
        return table;
    }

    private static Map<ResultColumn, Integer> columnIndex(String[] names, Path file) throws IOException {
        Map<ResultColumn, Integer> index = new LinkedHashMap<>();
        for (int c = 0; c < names.length; c++) {
            try {
                index.put(ResultColumn.fromName(names[c]), c);
            } catch (UnknownColumnException e) {
                throw new IOException("Unexpected column in " + file + ": " + names[c], e);
            }
        }
        for (ResultColumn required : List.of(ResultColumn.OFF_AXIS, ResultColumn.D80_CM, ResultColumn.D80_DEG,
                ResultColumn.EFF_AREA, ResultColumn.EFF_FLEN)) {
            if (!index.containsKey(required)) {
                throw new IOException("Column " + required.columnName() + " missing in " + file);
            }
        }
        return index;
    }

    private static String formatDouble(double value) {
        return Double.isNaN(value) ? "nan" : Double.toString(value);
    }

    private static double parseDouble(String cell) {
        return cell.equalsIgnoreCase("nan") ? Double.NaN : Double.parseDouble(cell);
    }

    // --- FITS ---

    private void writeFits(ResultsTable table, Path file) throws IOException {
        try (Fits fits = new Fits()) {
            BinaryTable data = new BinaryTable();
            List<ResultColumn> columns = table.columns();
            for (ResultColumn column : columns) {
                if (column == ResultColumn.MIRROR_NUMBER) {
                    data.addColumn(table.rows().stream().mapToInt(row -> row.mirrorNumber).toArray());
                } else {
                    data.addColumn(table.column(column));
                }
            }
            BinaryTableHDU hdu = new BinaryTableHDU(BinaryTableHDU.manufactureHeader(data), data);
            for (int c = 0; c < columns.size(); c++) {
                ResultColumn column = columns.get(c);
                hdu.setColumnName(c, column.columnName(), "results column");
                if (column.unit() != null) {
                    hdu.getHeader().addValue("TUNIT" + (c + 1), column.unit(), "physical unit of column");
                }
            }
            hdu.getHeader().addValue(FITS_ZENITH, table.getZenithAngle(), "zenith angle (deg)");
            hdu.getHeader().addValue(FITS_DISTANCE, table.getSourceDistance(), "source distance (km)");
            fits.addHDU(hdu);
            Files.deleteIfExists(file);
            fits.write(file.toFile());
        } catch (FitsException e) {
            throw new IOException("Cannot write FITS results table " + file, e);
        }
    }

    private ResultsTable readFits(Path file) throws IOException {
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?> hdu = fits.getHDU(1);
            if (!(hdu instanceof BinaryTableHDU)) {
                throw new IOException(file + " has no binary table extension");
            }
            BinaryTableHDU tableHdu = (BinaryTableHDU) hdu;
            Header header = tableHdu.getHeader();
            boolean singleMirror = tableHdu.findColumn(ResultColumn.MIRROR_NUMBER.columnName()) >= 0;

            double[] offAxis = doubleColumn(tableHdu, ResultColumn.OFF_AXIS, file);
            double[] d80Cm = doubleColumn(tableHdu, ResultColumn.D80_CM, file);
            double[] d80Deg = doubleColumn(tableHdu, ResultColumn.D80_DEG, file);
            double[] effArea = doubleColumn(tableHdu, ResultColumn.EFF_AREA, file);
            double[] effFlen = doubleColumn(tableHdu, ResultColumn.EFF_FLEN, file);
            int[] mirrors = singleMirror
                    ? (int[]) tableHdu.getColumn(tableHdu.findColumn(ResultColumn.MIRROR_NUMBER.columnName()))
                    : null;

            ResultsTable table = new ResultsTable(header.getDoubleValue(FITS_ZENITH, Double.NaN),
                    header.getDoubleValue(FITS_DISTANCE, Double.NaN), singleMirror);
            for (int r = 0; r < offAxis.length; r++) {
                table.add(new ResultRow(offAxis[r], d80Cm[r], d80Deg[r], effArea[r], effFlen[r],
                        mirrors == null ? null : mirrors[r]));
            }
            return table;
        } catch (FitsException e) {
            throw new IOException("Cannot read FITS results table " + file, e);
        }
    }

    private static double[] doubleColumn(BinaryTableHDU hdu, ResultColumn column, Path file)
            throws FitsException, IOException {
        int index = hdu.findColumn(column.columnName());
        if (index < 0) {
            throw new IOException("Column " + column.columnName() + " missing in " + file);
        }
        return (double[]) hdu.getColumn(index);
    }
}
