package com.dynascope.core.parser;

import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.ProcessorLoadSample;

import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the per-rank load profile ({@code load_profile.csv}).
 * <p>
 * The file holds a seconds table and a percentage table with one row per rank
 * and one column per pipeline component. Seconds rows are held until the matching
 * percentage row arrives, so memory is bounded by the rank count; ranks without a
 * percentage row are emitted at end of file with a {@code NaN} percent.
 */
public class LoadProfileReader extends LineRecordReader<ProcessorLoadSample> {

    public static final List<String> COMPONENTS = List.of(
            "solids", "shells", "tshells", "beams", "sph", "e_other",
            "force_shr", "tstep_shr", "swtch_shr", "matrl_shr", "elmnt_shr",
            "time_step", "contact", "rigid_bdy", "others");

    private enum Table { NONE, SECONDS, PERCENT }

    private final Map<Integer, double[]> pendingSeconds = new TreeMap<>();
    private Table table = Table.NONE;
    private int rank;

    public LoadProfileReader(Reader reader, String sourceName, CancellationToken cancellation) {
        super(reader, InputKind.LOAD_PROFILE, sourceName, cancellation);
    }

    public static LoadProfileReader open(Path path, CancellationToken cancellation) {
        return new LoadProfileReader(openFile(path), path.getFileName().toString(), cancellation);
    }

    @Override
    protected void onLine(String line) {
        String row = line.trim();
        if (row.isEmpty()) {
            table = Table.NONE;
            return;
        }
        if (row.contains("\"Clock (seconds)\"")) {
            enter(Table.SECONDS);
            return;
        }
        if (row.contains("\"Clock and percentage(%)\"")) {
            enter(Table.PERCENT);
            return;
        }
        if (row.startsWith("\"") || row.startsWith("Solids") || table == Table.NONE) {
            return;
        }
        String[] cells = row.split(",");
        if (cells.length < COMPONENTS.size()) {
            skip("profile row with " + cells.length + " columns");
            return;
        }
        double[] values;
        try {
            values = parseRow(cells);
        } catch (NumberFormatException e) {
            skip("profile row with unparseable value");
            rank++;
            return;
        }
        if (table == Table.SECONDS) {
            pendingSeconds.put(rank, values);
        } else {
            double[] seconds = pendingSeconds.remove(rank);
            emitRank(rank, seconds, values);
        }
        rank++;
    }

    @Override
    protected void onEnd() {
        List<Integer> ranks = new ArrayList<>(pendingSeconds.keySet());
        for (int r : ranks) {
            emitRank(r, pendingSeconds.remove(r), null);
        }
    }

    private void enter(Table next) {
        table = next;
        rank = 0;
    }

    private void emitRank(int r, double[] seconds, double[] percent) {
        for (int i = 0; i < COMPONENTS.size(); i++) {
            emit(new ProcessorLoadSample(COMPONENTS.get(i), r,
                    seconds != null ? seconds[i] : Double.NaN,
                    percent != null ? percent[i] : Double.NaN));
        }
    }

    private static double[] parseRow(String[] cells) {
        double[] values = new double[COMPONENTS.size()];
        for (int i = 0; i < values.length; i++) {
            String cell = cells[i].trim();
            values[i] = cell.isEmpty() ? 0.0 : Numbers.parseDouble(cell);
        }
        return values;
    }
}
