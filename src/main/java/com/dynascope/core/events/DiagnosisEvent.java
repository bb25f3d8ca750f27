package com.dynascope.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * A progress event emitted while a result directory is diagnosed. Events are for
 * progress display only and never feed into the report.
 *
 * @param eventType event type ("run.started", "reader.completed", "analyzer.completed", "run.completed", "run.aborted")
 * @param runId     the run this event belongs to
 * @param subject   reader or analyzer the event relates to (nullable for run-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record DiagnosisEvent(
    String eventType,
    String runId,
    String subject,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {}
