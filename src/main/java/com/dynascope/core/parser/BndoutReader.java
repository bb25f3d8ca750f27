package com.dynascope.core.parser;

import com.dynascope.core.model.BoundaryForceSample;
import com.dynascope.core.model.InputKind;

import java.io.Reader;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the boundary-force time history: one {@link BoundaryForceSample} per
 * constrained node and output step. The cycle of a sample is the 1-based ordinal
 * of its output step. Tracking is capped the same way as {@link NodoutReader}.
 */
public class BndoutReader extends LineRecordReader<BoundaryForceSample> {

    private static final String STEP_BANNER = "n o d a l   f o r c e";
    private static final Pattern STEP_TIME = Pattern.compile("t\\s*=\\s*(\\S+)");
    private static final Pattern NODE = Pattern.compile("nd#\\s+(\\d+)");
    private static final Pattern X_FORCE = field("xforce");
    private static final Pattern Y_FORCE = field("yforce");
    private static final Pattern Z_FORCE = field("zforce");
    private static final Pattern ENERGY = field("energy");
    private static final Pattern X_MOMENT = field("xmoment");
    private static final Pattern Y_MOMENT = field("ymoment");
    private static final Pattern Z_MOMENT = field("zmoment");

    private final int maxTrackedNodes;
    private final Set<Long> tracked = new HashSet<>();

    private long step;
    private double time;

    public BndoutReader(Reader reader, String sourceName, int maxTrackedNodes, CancellationToken cancellation) {
        super(reader, InputKind.BNDOUT, sourceName, cancellation);
        this.maxTrackedNodes = maxTrackedNodes;
    }

    public static BndoutReader open(Path path, int maxTrackedNodes, CancellationToken cancellation) {
        return new BndoutReader(openFile(path), path.getFileName().toString(), maxTrackedNodes, cancellation);
    }

    @Override
    protected void onLine(String line) {
        if (line.toLowerCase(Locale.ROOT).contains(STEP_BANNER) && line.contains(" t=")) {
            Matcher m = STEP_TIME.matcher(line.substring(line.indexOf(" t=")));
            if (m.find()) {
                time = Numbers.parseDoubleOr(m.group(1), time);
            }
            step++;
            return;
        }
        if (!line.trim().startsWith("nd#")) {
            return;
        }
        Matcher node = NODE.matcher(line);
        if (!node.find()) {
            skip("force row without node id");
            return;
        }
        long nodeId = Numbers.parseLongOr(node.group(1), -1);
        if (nodeId < 0) {
            skip("force row with node id out of range");
            return;
        }
        if (!track(nodeId)) {
            return;
        }
        try {
            emit(new BoundaryForceSample(nodeId, step, time,
                    value(X_FORCE, line),
                    value(Y_FORCE, line),
                    value(Z_FORCE, line),
                    value(ENERGY, line),
                    value(X_MOMENT, line),
                    value(Y_MOMENT, line),
                    value(Z_MOMENT, line)));
        } catch (NumberFormatException e) {
            skip("force row with unparseable value");
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

    /** Value of a labelled field; an absent field reads as zero. */
    private static double value(Pattern pattern, String line) {
        Matcher m = pattern.matcher(line);
        return m.find() ? Numbers.parseDouble(m.group(1)) : 0.0;
    }

    private static Pattern field(String label) {
        return Pattern.compile("\\b" + label + "\\s*=\\s*(\\S+)");
    }
}
