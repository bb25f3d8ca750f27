package com.dynascope.core.analysis;

import com.dynascope.core.knowledge.KnowledgeBase;
import com.dynascope.core.mapping.ElementPartMapper;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.PartDefinition;
import com.dynascope.core.model.RunBundle;

import java.util.OptionalInt;

/**
 * Everything an {@link Analyzer} may read. All members are shared read-only
 * between analyzers running in parallel.
 */
public record AnalysisInputs(
    RunBundle bundle,
    ParsedRun run,
    ElementPartMapper mapper,
    KnowledgeBase knowledge,
    TimeHistorySource timeHistory
) {

    /** Part name from the part table, or {@code "part N"} when the table does not list it. */
    public String partName(int partId) {
        for (PartDefinition part : run.parts()) {
            if (part.partId() == partId && !part.name().isBlank()) {
                return part.name();
            }
        }
        return "part " + partId;
    }

    public OptionalInt owningPart(long elementId) {
        return mapper.owningPart(elementId);
    }
}
