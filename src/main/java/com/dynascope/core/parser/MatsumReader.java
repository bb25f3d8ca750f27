package com.dynascope.core.parser;

import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.MaterialSample;

import java.io.Reader;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the material summary: one {@link MaterialSample} per part and output state.
 * <p>
 * The file carries no cycle numbers, so the sample's cycle is the 1-based ordinal
 * of its {@code time =} header. Part names come from the legend block at the top.
 */
public class MatsumReader extends LineRecordReader<MaterialSample> {

    private static final Pattern LEGEND_ROW = Pattern.compile("^\\s*(\\d+)\\s+(.+?)\\s*$");
    private static final Pattern TIME = Pattern.compile("^\\s*time\\s*=\\s*(\\S+)");
    private static final Pattern PART = Pattern.compile("(?:mat\\.#|part id)\\s*=\\s*(\\d+)");
    private static final Pattern VALUE = Pattern.compile("([a-z_\\-]+)\\s*=\\s*(\\S+)");

    private final Map<Integer, String> legend = new HashMap<>();
    private final Map<String, String> values = new HashMap<>();

    private boolean inLegend;
    private long state;
    private double time;
    private Integer partId;

    public MatsumReader(Reader reader, String sourceName, CancellationToken cancellation) {
        super(reader, InputKind.MATSUM, sourceName, cancellation);
    }

    public static MatsumReader open(Path path, CancellationToken cancellation) {
        return new MatsumReader(openFile(path), path.getFileName().toString(), cancellation);
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
        if (inLegend) {
            Matcher m = LEGEND_ROW.matcher(line);
            if (m.find()) {
                legend.put(Numbers.parseIntOr(m.group(1), 0), m.group(2));
            }
            return;
        }
        Matcher m = TIME.matcher(line);
        if (m.find()) {
            flush();
            state++;
            time = Numbers.parseDoubleOr(m.group(1), Double.NaN);
            return;
        }
        m = PART.matcher(line);
        if (m.find()) {
            flush();
            partId = Numbers.parseIntOr(m.group(1), 0);
            collect(line.substring(m.end()));
            return;
        }
        if (partId != null) {
            collect(line);
        }
    }

    @Override
    protected void onEnd() {
        flush();
    }

    private void collect(String text) {
        Matcher m = VALUE.matcher(text);
        while (m.find()) {
            values.put(m.group(1), m.group(2));
        }
    }

    private void flush() {
        if (partId == null) {
            return;
        }
        try {
            if (!values.containsKey("inten") || !values.containsKey("kinen")) {
                skip("material block without internal/kinetic energy");
                return;
            }
            emit(new MaterialSample(
                    partId,
                    legend.getOrDefault(partId, ""),
                    state,
                    time,
                    Numbers.parseDouble(values.get("inten")),
                    Numbers.parseDouble(values.get("kinen")),
                    Numbers.parseDoubleOr(values.get("hgeng"), 0.0),
                    Numbers.parseDoubleOr(values.get("eroded_ie"), 0.0),
                    Numbers.parseDoubleOr(values.get("eroded_ke"), 0.0),
                    Numbers.parseDoubleOr(values.get("eroded_he"), 0.0),
                    Numbers.parseDoubleOr(values.get("x-mom"), 0.0),
                    Numbers.parseDoubleOr(values.get("y-mom"), 0.0),
                    Numbers.parseDoubleOr(values.get("z-mom"), 0.0)));
        } catch (NumberFormatException e) {
            skip("material block with unparseable energy");
        } finally {
            partId = null;
            values.clear();
        }
    }
}
