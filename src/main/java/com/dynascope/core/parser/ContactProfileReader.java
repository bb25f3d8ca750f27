package com.dynascope.core.parser;

import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.InterfaceLoadSample;

import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the per-rank contact profile ({@code cont_profile.csv}): the clock
 * seconds each rank spent in each contact interface. The first unquoted row of
 * a table lists the interface ids; every following row is one rank. Only the
 * seconds table is emitted.
 */
public class ContactProfileReader extends LineRecordReader<InterfaceLoadSample> {

    private final List<Integer> interfaceIds = new ArrayList<>();
    private boolean inSeconds;
    private boolean inPercent;
    private int rank;

    public ContactProfileReader(Reader reader, String sourceName, CancellationToken cancellation) {
        super(reader, InputKind.CONTACT_PROFILE, sourceName, cancellation);
    }

    public static ContactProfileReader open(Path path, CancellationToken cancellation) {
        return new ContactProfileReader(openFile(path), path.getFileName().toString(), cancellation);
    }

    @Override
    protected void onLine(String line) {
        String row = line.trim();
        if (row.isEmpty()) {
            inSeconds = false;
            inPercent = false;
            return;
        }
        if (row.contains("\"Clock (seconds)\"")) {
            startTable(true);
            return;
        }
        if (row.contains("\"Clock percentage(%)\"")) {
            startTable(false);
            return;
        }
        if (row.startsWith("\"") || !(inSeconds || inPercent)) {
            return;
        }
        String[] cells = row.split(",");
        if (interfaceIds.isEmpty()) {
            readIds(cells);
            return;
        }
        if (inSeconds) {
            readRank(cells);
        }
        rank++;
    }

    private void startTable(boolean seconds) {
        inSeconds = seconds;
        inPercent = !seconds;
        interfaceIds.clear();
        rank = 0;
    }

    private void readIds(String[] cells) {
        try {
            for (String cell : cells) {
                if (!cell.isBlank()) {
                    interfaceIds.add(Numbers.parseInt(cell));
                }
            }
        } catch (NumberFormatException e) {
            interfaceIds.clear();
            skip("interface id row with non-numeric id");
        }
    }

    private void readRank(String[] cells) {
        for (int i = 0; i < interfaceIds.size() && i < cells.length; i++) {
            String cell = cells[i].trim();
            if (cell.isEmpty()) {
                continue;
            }
            try {
                emit(new InterfaceLoadSample(interfaceIds.get(i), rank, Numbers.parseDouble(cell)));
            } catch (NumberFormatException e) {
                skip("contact profile cell with unparseable value");
            }
        }
    }
}
