package com.dynascope.core.parser;

import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.StatusSample;

import java.io.Reader;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the status log. The solver rewrites the same block of progress
 * fields at every report interval; a field that reappears within the current
 * block starts a new {@link StatusSample}.
 */
public class StatusReader extends LineRecordReader<StatusSample> {

    private static final Map<String, Pattern> FIELDS = new LinkedHashMap<>();

    static {
        // Averages before the plain per-zone figure so the longer label wins.
        FIELDS.put("avgCpu", Pattern.compile("average cpu time per zone cycle\\.+\\s+(\\S+)\\s+nanoseconds"));
        FIELDS.put("avgClock", Pattern.compile("average clock time per zone cycle\\.+\\s+(\\S+)\\s+nanoseconds"));
        FIELDS.put("cpu", Pattern.compile("cpu time per zone cycle\\.+\\s+(\\S+)\\s+nanoseconds"));
        FIELDS.put("totalCpu", Pattern.compile("estimated total cpu time\\s+=\\s+(\\S+)\\s+sec"));
        FIELDS.put("cpuRemaining", Pattern.compile("estimated cpu time to complete\\s+=\\s+(\\S+)\\s+sec"));
        FIELDS.put("totalClock", Pattern.compile("estimated total clock time\\s+=\\s+(\\S+)\\s+sec"));
        FIELDS.put("clockRemaining", Pattern.compile("estimated clock time to complete\\s+=\\s+(\\S+)\\s+sec"));
        FIELDS.put("cycle", Pattern.compile("^\\s*cycle\\s*[=:]?\\s*(\\d\\S*)\\s*$"));
        FIELDS.put("time", Pattern.compile("^\\s*(?:problem\\s+)?time\\s*[=:]\\s*(\\S+)\\s*$"));
    }

    private final Map<String, String> current = new LinkedHashMap<>();

    public StatusReader(Reader reader, String sourceName, CancellationToken cancellation) {
        super(reader, InputKind.STATUS, sourceName, cancellation);
    }

    public static StatusReader open(Path path, CancellationToken cancellation) {
        return new StatusReader(openFile(path), path.getFileName().toString(), cancellation);
    }

    @Override
    protected void onLine(String line) {
        String lower = line.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Pattern> field : FIELDS.entrySet()) {
            Matcher m = field.getValue().matcher(lower);
            if (m.find()) {
                if (current.containsKey(field.getKey())) {
                    flush();
                }
                current.put(field.getKey(), m.group(1));
                return;
            }
        }
    }

    @Override
    protected void onEnd() {
        flush();
    }

    private void flush() {
        if (current.isEmpty()) {
            return;
        }
        try {
            emit(new StatusSample(
                    wholeOr("cycle"),
                    current.containsKey("time") ? Numbers.parseDouble(current.get("time")) : Double.NaN,
                    wholeOr("cpu"),
                    wholeOr("avgCpu"),
                    wholeOr("avgClock"),
                    wholeOr("totalCpu"),
                    wholeOr("cpuRemaining"),
                    wholeOr("totalClock"),
                    wholeOr("clockRemaining")));
        } catch (NumberFormatException e) {
            skip("status block with unparseable field");
        } finally {
            current.clear();
        }
    }

    /** Value of a present field rounded to a whole number, -1 when the block lacks it. */
    private long wholeOr(String field) {
        String raw = current.get(field);
        if (raw == null) {
            return -1;
        }
        return Math.round(Numbers.parseDouble(raw));
    }
}
