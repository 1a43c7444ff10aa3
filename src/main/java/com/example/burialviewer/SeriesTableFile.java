package com.example.burialviewer;

import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Two-column table on disk: distance in the first column, burial depth in the second.
 */
public interface SeriesTableFile {

    /** Reads every row in file order. Depths are truncated to whole centimetres. */
    List<MeasurementPoint> read(File file) throws IOException;

    void write(File file, DenseSeries series) throws IOException;
}
