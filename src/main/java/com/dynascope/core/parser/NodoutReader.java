package com.dynascope.core.parser;

import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.NodalSample;

import java.io.Reader;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the nodal time history: one {@link NodalSample} per tracked node and output step.
 * <p>
 * At most {@code maxTrackedNodes} distinct node ids are tracked, in order of first
 * appearance; rows for any further node are dropped without counting as skipped.
 */
public class NodoutReader extends LineRecordReader<NodalSample> {

    private static final String STEP_BANNER = "n o d a l   p r i n t   o u t";
    private static final Pattern STEP = Pattern.compile("t i m e\\s+s t e p\\s+(\\d+)");
    private static final Pattern STEP_TIME = Pattern.compile("\\(\\s*at time\\s+(\\S+)\\s*\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final int maxTrackedNodes;
    private final Set<Long> tracked = new HashSet<>();

    private boolean inLegend;
    private long cycle;
    private double time;

    public NodoutReader(Reader reader, String sourceName, int maxTrackedNodes, CancellationToken cancellation) {
        super(reader, InputKind.NODOUT, sourceName, cancellation);
        this.maxTrackedNodes = maxTrackedNodes;
    }

    public static NodoutReader open(Path path, int maxTrackedNodes, CancellationToken cancellation) {
        return new NodoutReader(openFile(path), path.getFileName().toString(), maxTrackedNodes, cancellation);
    }

    @Override
    protected void onLine(String line) {
        if (line.contains("{BEGIN LEGEND}")) {
            inLegend = true;
            return;
        }
        if (line.contains("{END LEGEND}")) {
            inLegend = false;
            return;
        }
        if (inLegend || line.isBlank()) {
            return;
        }
        if (line.toLowerCase(Locale.ROOT).contains(STEP_BANNER)) {
            Matcher m = STEP.matcher(line);
            if (m.find()) {
                cycle = Numbers.parseLongOr(m.group(1), cycle);
            }
            m = STEP_TIME.matcher(line);
            if (m.find()) {
                time = Numbers.parseDoubleOr(m.group(1), time);
            }
            return;
        }
        String[] tokens = WHITESPACE.split(line.trim());
        if (tokens.length < 13) {
            return;
        }
        long nodeId;
        try {
            nodeId = Numbers.parseLong(tokens[0]);
        } catch (NumberFormatException e) {
            // column header or other text row
            return;
        }
        if (!track(nodeId)) {
            return;
        }
        try {
            emit(new NodalSample(nodeId, cycle, time,
                    Numbers.parseDouble(tokens[1]),
                    Numbers.parseDouble(tokens[2]),
                    Numbers.parseDouble(tokens[3]),
                    Numbers.parseDouble(tokens[4]),
                    Numbers.parseDouble(tokens[5]),
                    Numbers.parseDouble(tokens[6]),
                    Numbers.parseDouble(tokens[7]),
                    Numbers.parseDouble(tokens[8]),
                    Numbers.parseDouble(tokens[9])));
        } catch (NumberFormatException e) {
            skip("nodal row with unparseable value");
        }
    }

    private boolean track(long nodeId) {
        if (tracked.contains(nodeId)) {
            return true;
        }
        if (tracked.size() >= maxTrackedNodes) {
            return false;
        }
        tracked.add(nodeId);
        return true;
    }
}
