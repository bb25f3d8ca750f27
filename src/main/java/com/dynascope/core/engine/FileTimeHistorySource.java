package com.dynascope.core.engine;

import com.dynascope.core.analysis.TimeHistorySource;
import com.dynascope.core.model.BoundaryForceSample;
import com.dynascope.core.model.NodalSample;
import com.dynascope.core.parser.BndoutReader;
import com.dynascope.core.parser.CancellationToken;
import com.dynascope.core.parser.NodoutReader;

import java.nio.file.Path;
import java.util.stream.Stream;

/**
 * Time histories read straight from the nodal and boundary-force files. Every call
 * reopens the file, so nothing is held in memory between passes.
 */
class FileTimeHistorySource implements TimeHistorySource {

    private final Path nodout;
    private final Path bndout;
    private final int maxTrackedNodes;
    private final CancellationToken cancellation;

    /**
     * @param nodout nodal history file, {@code null} when unavailable
     * @param bndout boundary force file, {@code null} when unavailable
     */
    FileTimeHistorySource(Path nodout, Path bndout, int maxTrackedNodes, CancellationToken cancellation) {
        this.nodout = nodout;
        this.bndout = bndout;
        this.maxTrackedNodes = maxTrackedNodes;
        this.cancellation = cancellation;
    }

    @Override
    public Stream<NodalSample> nodal() {
        if (nodout == null) {
            return Stream.empty();
        }
        return NodoutReader.open(nodout, maxTrackedNodes, cancellation).stream();
    }

    @Override
    public Stream<BoundaryForceSample> boundary() {
        if (bndout == null) {
            return Stream.empty();
        }
        return BndoutReader.open(bndout, maxTrackedNodes, cancellation).stream();
    }
}
