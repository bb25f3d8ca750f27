package com.dynascope.core.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The input files found in one result directory.
 *
 * @param directory      the result directory that was probed
 * @param files          one path per file family that was found
 * @param rankedMessages per-process message logs keyed by processor rank
 */
public record RunBundle(
    Path directory,
    Map<InputKind, Path> files,
    SortedMap<Integer, Path> rankedMessages
) {

    public RunBundle {
        EnumMap<InputKind, Path> copy = new EnumMap<>(InputKind.class);
        copy.putAll(files);
        files = Collections.unmodifiableMap(copy);
        rankedMessages = Collections.unmodifiableSortedMap(new TreeMap<>(rankedMessages));
    }

    public boolean has(InputKind kind) {
        if (kind == InputKind.MESSAGE) {
            return files.containsKey(kind) || !rankedMessages.isEmpty();
        }
        return files.containsKey(kind);
    }

    public Optional<Path> path(InputKind kind) {
        return Optional.ofNullable(files.get(kind));
    }

    /** True when the high-speed-printer log or any message log is present. */
    public boolean hasRequiredInputs() {
        return has(InputKind.HSP) || has(InputKind.MESSAGE);
    }

    /** Labels of the required inputs, used when none of them was found. */
    public List<String> missingRequired() {
        if (hasRequiredInputs()) {
            return List.of();
        }
        return List.of(InputKind.HSP.label(), InputKind.MESSAGE.label() + " / mesNNNN");
    }

    /** Optional families that were not found, in declaration order. */
    public List<InputKind> missingOptional() {
        List<InputKind> missing = new ArrayList<>();
        for (InputKind kind : InputKind.values()) {
            if (!kind.required() && !has(kind)) {
                missing.add(kind);
            }
        }
        return missing;
    }

    /** Families that were found, in declaration order. */
    public List<InputKind> found() {
        List<InputKind> found = new ArrayList<>();
        for (InputKind kind : InputKind.values()) {
            if (has(kind)) {
                found.add(kind);
            }
        }
        return found;
    }
}
