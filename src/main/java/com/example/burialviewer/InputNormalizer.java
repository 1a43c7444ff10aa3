package com.example.burialviewer;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public final class InputNormalizer {
    private InputNormalizer() {
    }

    /**
     * Returns a copy of {@code raw} ordered by distance. Points sharing a distance keep their
     * original relative order; duplicates are not removed.
     */
    public static List<MeasurementPoint> sortByDistance(List<MeasurementPoint> raw) {
        List<MeasurementPoint> sorted = new ArrayList<>(raw);
        // List.sort is a stable merge sort
        sorted.sort(Comparator.comparingDouble(MeasurementPoint::getX));
        return sorted;
    }
}
