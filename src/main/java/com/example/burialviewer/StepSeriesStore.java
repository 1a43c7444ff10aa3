package com.example.burialviewer;

import java.io.File;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Owns the series shown in the data table and the pointer to the file it was last saved to.
 * Not thread safe; every call is expected on the JavaFX Application Thread.
 */
public class StepSeriesStore {
    private final SeriesTableFile tableFile;
    private final LastPathStore lastPathStore;
    private DenseSeries current = DenseSeries.empty();

    public StepSeriesStore(SeriesTableFile tableFile, LastPathStore lastPathStore) {
        this.tableFile = tableFile;
        this.lastPathStore = lastPathStore;
    }

    public DenseSeries current() {
        return current;
    }

    /**
     * Restores the series from the last saved file, if there is one. The saved rows are installed
     * as written. Anything that goes wrong leaves the store empty.
     *
     * @return true if a series was restored
     */
    public boolean load() {
        Optional<String> lastPath = lastPathStore.get();
        if (lastPath.isEmpty()) return false;

        File file = new File(lastPath.get());
        if (!file.isFile() || !file.canRead()) {
            System.out.println("Last saved file no longer available: " + file);
            return false;
        }
        try {
            current = DenseSeriesBuilder.restore(tableFile.read(file));
            System.out.println("Restored " + current.size() + " rows from " + file);
            return true;
        } catch (IOException | RuntimeException e) {
            System.err.println("Could not restore last saved file " + file + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Reads raw samples from {@code file} and makes them the current series. On failure the
     * previous series stays in place.
     */
    public DenseSeries upload(File file) throws IOException {
        return replace(tableFile.read(file));
    }

    public DenseSeries replace(List<MeasurementPoint> rawPoints) {
        List<MeasurementPoint> sorted = InputNormalizer.sortByDistance(rawPoints);
        current = DenseSeriesBuilder.build(sorted);
        return current;
    }

    /**
     * Writes the current series and remembers {@code file} for the next start. The pointer is only
     * updated once the write succeeded.
     */
    public void save(File file) throws IOException {
        tableFile.write(file, current);
        lastPathStore.set(file.getAbsolutePath());
    }
}
