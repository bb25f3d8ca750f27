package com.dynascope.core.analysis;

import com.dynascope.core.model.BoundaryForceSample;
import com.dynascope.core.model.NodalSample;

import java.util.List;
import java.util.stream.Stream;

/**
 * Lazy access to the per-node time histories. Each call opens a fresh
 * single-pass stream; callers must close it.
 */
public interface TimeHistorySource {

    Stream<NodalSample> nodal();

    Stream<BoundaryForceSample> boundary();

    static TimeHistorySource none() {
        return of(List.of(), List.of());
    }

    /** In-memory histories, for small runs and tests. */
    static TimeHistorySource of(List<NodalSample> nodal, List<BoundaryForceSample> boundary) {
        List<NodalSample> nodalCopy = List.copyOf(nodal);
        List<BoundaryForceSample> boundaryCopy = List.copyOf(boundary);
        return new TimeHistorySource() {
            @Override
            public Stream<NodalSample> nodal() {
                return nodalCopy.stream();
            }

            @Override
            public Stream<BoundaryForceSample> boundary() {
                return boundaryCopy.stream();
            }
        };
    }
}
