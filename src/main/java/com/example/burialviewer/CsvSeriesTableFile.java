package com.example.burialviewer;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Comma separated {@link SeriesTableFile}. A leading header row is skipped when its first cell is
 * not a number, after dropping a UTF-8 byte order mark; blank lines are ignored. Written files always start with an {@code X,Y} header.
 */
public class CsvSeriesTableFile implements SeriesTableFile {
    public static final String HEADER = "X,Y";
    public static final String EXTENSION = "*.csv";
    // Written by Excel's "CSV UTF-8" export
    private static final String BYTE_ORDER_MARK = "\uFEFF";

    @Override
    public List<MeasurementPoint> read(File file) throws IOException {
        List<MeasurementPoint> points = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(new FileReader(file, StandardCharsets.UTF_8))) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (lineNumber == 1 && line.startsWith(BYTE_ORDER_MARK)) {
                    line = line.substring(1);
                }
                if (line.isBlank()) continue;
                String[] cells = line.split(",", -1);
                if (lineNumber == 1 && !isNumeric(cells[0])) continue;
                if (cells.length < 2) {
                    throw new SeriesFormatException("Expected two columns", lineNumber, line, null);
                }
                try {
                    double x = Double.parseDouble(cells[0].strip());
                    int y = (int) Double.parseDouble(cells[1].strip());
                    points.add(new MeasurementPoint(x, y));
                } catch (NumberFormatException e) {
                    throw new SeriesFormatException("Non-numeric cell", lineNumber, line, e);
                }
            }
        }
        return points;
    }

    @Override
    public void write(File file, DenseSeries series) throws IOException {
        try (BufferedWriter writer = new BufferedWriter(new FileWriter(file, StandardCharsets.UTF_8))) {
            writer.write(HEADER);
            writer.newLine();
            for (DepthStep step : series.getSteps()) {
                writer.write(step.getX() + "," + step.getY());
                writer.newLine();
            }
        }
    }

    private static boolean isNumeric(String cell) {
        try {
            Double.parseDouble(cell.strip());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
