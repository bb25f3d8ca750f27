package com.dynascope.core.analysis;

import com.dynascope.core.knowledge.KnowledgeBase;
import com.dynascope.core.mapping.ElementPartMapper;
import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.RunBundle;
import com.dynascope.core.model.TimestepRecord;
import com.dynascope.core.model.WarningEvent;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Builders for analyzer inputs that do not need files on disk.
 */
final class AnalysisFixtures {

    static final Path RUN_DIR = Path.of("/runs/crash-01");

    private static KnowledgeBase knowledge;

    private AnalysisFixtures() {}

    static synchronized KnowledgeBase knowledge() {
        if (knowledge == null) {
            knowledge = KnowledgeBase.loadDefault(new ObjectMapper());
        }
        return knowledge;
    }

    static RunBundle bundle(InputKind... kinds) {
        Map<InputKind, Path> files = new EnumMap<>(InputKind.class);
        for (InputKind kind : kinds) {
            files.put(kind, RUN_DIR.resolve(kind.label()));
        }
        return new RunBundle(RUN_DIR, files, new TreeMap<>());
    }

    static AnalysisInputs inputs(ParsedRun run) {
        return inputs(run, ElementPartMapper.empty(), TimeHistorySource.none());
    }

    static AnalysisInputs inputs(ParsedRun run, ElementPartMapper mapper, TimeHistorySource timeHistory) {
        return new AnalysisInputs(bundle(InputKind.HSP, InputKind.GLSTAT, InputKind.MESSAGE),
                run, mapper, knowledge(), timeHistory);
    }

    /** Energy sample with the balance ratio derived from the total against an initial total of 1000. */
    static EnergySample energy(long cycle, double kinetic, double internal, double hourglass) {
        double total = kinetic + internal + hourglass;
        return new EnergySample(cycle, cycle * 1.0e-6, 1.0e-6, kinetic, internal, hourglass, 0.0, total, 0.0,
                total / 1000.0, "solid", 12, 3, InputKind.GLSTAT);
    }

    static TimestepRecord timestep(long cycle, String type, long elementId, int partId, double dt) {
        return new TimestepRecord(cycle, cycle * 1.0e-6, type, elementId, partId, dt, InputKind.GLSTAT);
    }

    static WarningEvent warning(int code, Long elementId, int rank) {
        return new WarningEvent(code, WarningEvent.Level.WARNING, WarningEvent.Condition.GENERAL,
                null, null, elementId, null, rank, "*** Warning " + code, InputKind.MESSAGE);
    }

    static WarningEvent negativeVolume(int code, long elementId, Integer partId, Long cycle, int rank) {
        return new WarningEvent(code, WarningEvent.Level.ERROR, WarningEvent.Condition.NEGATIVE_VOLUME,
                null, partId, elementId, cycle, rank,
                "*** Error " + code + " negative volume in element " + elementId, InputKind.MESSAGE);
    }
}
