package com.example.burialviewer;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a distance-sorted list of samples into a {@link DenseSeries} with a row for every whole
 * metre between the first and last sample.
 *
 * <p>Gap rows carry a depth forward from the samples rather than interpolating. Each sample's own
 * row, and the gap rows after it, show the depth of the <em>previous</em> sample; only the first
 * sample shows its own depth. Distances are truncated toward zero.
 */
public final class DenseSeriesBuilder {
    private DenseSeriesBuilder() {
    }

    public static DenseSeries build(List<MeasurementPoint> sorted) {
        if (sorted.isEmpty()) return DenseSeries.empty();

        List<DepthStep> out = new ArrayList<>();
        Integer previousY = null;
        for (int i = 0; i < sorted.size(); i++) {
            MeasurementPoint point = sorted.get(i);
            int x = (int) point.getX();
            int shownY = (previousY != null) ? previousY : point.getY();

            out.add(new DepthStep(x, shownY));
            if (i < sorted.size() - 1) {
                int nextX = (int) sorted.get(i + 1).getX();
                for (int missingX = x + 1; missingX < nextX; missingX++) {
                    out.add(new DepthStep(missingX, shownY));
                }
            }
            previousY = point.getY();
        }
        return new DenseSeries(out);
    }

    /**
     * Rows read back from a saved series are already dense; they are kept in file order exactly
     * as written, without carrying depths forward again.
     */
    public static DenseSeries restore(List<MeasurementPoint> savedRows) {
        List<DepthStep> steps = new ArrayList<>();
        for (MeasurementPoint row : savedRows) {
            steps.add(new DepthStep((int) row.getX(), row.getY()));
        }
        return new DenseSeries(steps);
    }
}
