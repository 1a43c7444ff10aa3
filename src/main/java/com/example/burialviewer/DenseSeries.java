package com.example.burialviewer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable burial-depth series with one row per whole metre of distance.
 */
public class DenseSeries {
    private static final DenseSeries EMPTY = new DenseSeries(Collections.emptyList());

    private final List<DepthStep> steps;

    public DenseSeries(List<DepthStep> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public static DenseSeries empty() {
        return EMPTY;
    }

    public List<DepthStep> getSteps() { return steps; }

    public int size() { return steps.size(); }

    public boolean isEmpty() { return steps.isEmpty(); }

    public DepthStep get(int index) { return steps.get(index); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DenseSeries)) return false;
        return steps.equals(((DenseSeries) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return "DenseSeries{" +
                "size=" + steps.size() +
                ", steps=" + steps +
                '}';
    }
}
