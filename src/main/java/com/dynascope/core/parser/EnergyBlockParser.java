package com.dynascope.core.parser;

import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.InputKind;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Accumulates one "dt of cycle" energy block, shared by the global-statistics
 * reader and the high-speed-printer reader (which prints the same blocks).
 */
final class EnergyBlockParser {

    /**
     * {@code dt of cycle 1234 is controlled by solid 56 of part 7}. Contacts and rigid
     * bodies are written without the part: {@code dt of cycle 500 is controlled by contact 3}.
     */
    static final Pattern DT_OF_CYCLE = Pattern.compile(
            "dt of cycle\\s+(\\d+)\\s+is controlled by\\s+(\\w+)\\s+(\\d+)(?:\\s+of part\\s+(\\d+))?");

    /** Cycle line that names no controller at all. */
    static final Pattern DT_OF_CYCLE_BARE = Pattern.compile("dt of cycle\\s+(\\d+)");

    /** {@code kinetic energy.............  1.2345E+03}. */
    private static final Pattern FIELD = Pattern.compile("^\\s*([A-Za-z][\\w\\s/().\\-]*?)\\s*\\.{2,}\\s*(\\S+)\\s*$");

    /** Normalised field names, most specific first, mapped to sample slots. */
    private static final Map<String, String> FIELD_NAMES = new LinkedHashMap<>();

    static {
        FIELD_NAMES.put("total energy / initial energy", "ratio");
        FIELD_NAMES.put("sliding interface energy", "sliding");
        FIELD_NAMES.put("kinetic energy", "kinetic");
        FIELD_NAMES.put("internal energy", "internal");
        FIELD_NAMES.put("hourglass energy", "hourglass");
        FIELD_NAMES.put("total energy", "total");
        FIELD_NAMES.put("external work", "external");
        FIELD_NAMES.put("time step", "dt");
        FIELD_NAMES.put("time", "time");
    }

    private static final String[] REQUIRED = {"time", "kinetic", "internal", "total"};

    private final InputKind source;
    private final Map<String, String> raw = new HashMap<>();
    private boolean open;
    private long cycle;
    private String controllingType = "";
    private long controllingElement;
    private int controllingPart;

    EnergyBlockParser(InputKind source) {
        this.source = source;
    }

    boolean isOpen() {
        return open;
    }

    boolean hasFields() {
        return !raw.isEmpty();
    }

    /**
     * Starts a block if the line is a "dt of cycle" header.
     *
     * @return true when the line opened a block
     */
    boolean tryOpen(String line) {
        if (!line.contains("dt of cycle")) {
            return false;
        }
        Matcher m = DT_OF_CYCLE.matcher(line);
        if (m.find()) {
            reset();
            open = true;
            cycle = Long.parseLong(m.group(1));
            controllingType = m.group(2).toLowerCase();
            controllingElement = Long.parseLong(m.group(3));
            controllingPart = m.group(4) != null ? Integer.parseInt(m.group(4)) : 0;
            return true;
        }
        Matcher bare = DT_OF_CYCLE_BARE.matcher(line);
        if (bare.find()) {
            reset();
            open = true;
            cycle = Long.parseLong(bare.group(1));
            return true;
        }
        return false;
    }

    /**
     * Offers a line inside an open block.
     *
     * @return true when the line was a field of the block
     */
    boolean accept(String line) {
        Matcher m = FIELD.matcher(line);
        if (!m.matches()) {
            return false;
        }
        String name = m.group(1).trim().toLowerCase().replaceAll("\\s+", " ");
        String slot = FIELD_NAMES.get(name);
        if (slot != null) {
            raw.put(slot, m.group(2));
        }
        return true;
    }

    /**
     * Closes the block and converts it.
     *
     * @return the sample, or {@code null} when a required field is missing or unparseable
     */
    EnergySample close() {
        open = false;
        try {
            for (String required : REQUIRED) {
                if (!raw.containsKey(required)) {
                    return null;
                }
            }
            return new EnergySample(
                    cycle,
                    Numbers.parseDouble(raw.get("time")),
                    Numbers.parseDoubleOr(raw.get("dt"), Double.NaN),
                    Numbers.parseDouble(raw.get("kinetic")),
                    Numbers.parseDouble(raw.get("internal")),
                    Numbers.parseDoubleOr(raw.get("hourglass"), 0.0),
                    Numbers.parseDoubleOr(raw.get("sliding"), 0.0),
                    Numbers.parseDouble(raw.get("total")),
                    Numbers.parseDoubleOr(raw.get("external"), 0.0),
                    Numbers.parseDoubleOr(raw.get("ratio"), Double.NaN),
                    controllingType,
                    controllingElement,
                    controllingPart,
                    source);
        } catch (NumberFormatException e) {
            return null;
        } finally {
            raw.clear();
        }
    }

    private void reset() {
        raw.clear();
        controllingType = "";
        controllingElement = 0;
        controllingPart = 0;
    }
}
