package com.dynascope.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Which inputs contributed to a report and how much of each was unusable.
 *
 * @param found          file families that were read
 * @param unavailable    file families that were absent or could not be read
 * @param messageRanks   ranks of the per-process message logs that were read
 * @param skippedRecords malformed records skipped, per file family
 */
public record Coverage(
    List<InputKind> found,
    List<InputKind> unavailable,
    List<Integer> messageRanks,
    Map<InputKind, Long> skippedRecords
) implements Serializable {

    public Coverage {
        found = List.copyOf(found);
        unavailable = List.copyOf(unavailable);
        messageRanks = List.copyOf(messageRanks);
        skippedRecords = Collections.unmodifiableMap(new TreeMap<>(skippedRecords));
    }

    public boolean degraded() {
        return !unavailable.isEmpty() || skippedRecords.values().stream().anyMatch(n -> n > 0);
    }
}
