package com.dynascope.core.parser;

import com.dynascope.core.model.ElementAssociation;
import com.dynascope.core.model.InputKind;

import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reads element cards from a keyword input deck. Inside an {@code *ELEMENT_SOLID},
 * {@code *ELEMENT_SHELL}, {@code *ELEMENT_TSHELL} or {@code *ELEMENT_BEAM} block,
 * every card whose first two fields are integers yields an {@link ElementAssociation};
 * any other keyword line ends the block. A solid card holding only the two ids takes
 * its nodes from the following card; other continuation cards (thickness,
 * orientation) are ignored.
 */
public class KeywordDeckReader extends LineRecordReader<ElementAssociation> {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    private String elementType;
    /** Two-field solid card whose node list follows on the next card. */
    private long[] pendingSolid;

    public KeywordDeckReader(Reader reader, String sourceName, CancellationToken cancellation) {
        super(reader, InputKind.INPUT_DECK, sourceName, cancellation);
    }

    public static KeywordDeckReader open(Path path, CancellationToken cancellation) {
        return new KeywordDeckReader(openFile(path), path.getFileName().toString(), cancellation);
    }

    @Override
    protected void onLine(String line) {
        if (line.startsWith("*")) {
            flushPendingSolid();
            elementType = blockType(line.toUpperCase(Locale.ROOT));
            return;
        }
        if (elementType == null || line.startsWith("$") || line.isBlank()) {
            return;
        }
        String[] fields = SEPARATORS.split(line.trim());
        if (pendingSolid != null) {
            emit(new ElementAssociation(elementType, pendingSolid[0], (int) pendingSolid[1], nodes(fields, 0)));
            pendingSolid = null;
            return;
        }
        if (fields.length < 2 || !isInteger(fields[0])) {
            return;
        }
        try {
            long elementId = Numbers.parseLong(fields[0]);
            int partId = Numbers.parseInt(fields[1]);
            if (fields.length == 2 && "solid".equals(elementType)) {
                pendingSolid = new long[] {elementId, partId};
                return;
            }
            emit(new ElementAssociation(elementType, elementId, partId, nodes(fields, 2)));
        } catch (NumberFormatException e) {
            skip("element card with unparseable part id");
        }
    }

    @Override
    protected void onEnd() {
        flushPendingSolid();
    }

    private void flushPendingSolid() {
        if (pendingSolid != null) {
            emit(new ElementAssociation(elementType, pendingSolid[0], (int) pendingSolid[1], List.of()));
            pendingSolid = null;
        }
    }

    private static List<Long> nodes(String[] fields, int from) {
        List<Long> nodes = new ArrayList<>();
        for (int i = from; i < fields.length; i++) {
            long node = Numbers.parseLongOr(fields[i], 0);
            if (node > 0) {
                nodes.add(node);
            }
        }
        return nodes;
    }

    private static String blockType(String keyword) {
        if (keyword.startsWith("*ELEMENT_SOLID")) {
            return "solid";
        }
        if (keyword.startsWith("*ELEMENT_TSHELL")) {
            return "tshell";
        }
        if (keyword.startsWith("*ELEMENT_SHELL")) {
            return "shell";
        }
        if (keyword.startsWith("*ELEMENT_BEAM")) {
            return "beam";
        }
        return null;
    }

    private static boolean isInteger(String field) {
        for (int i = 0; i < field.length(); i++) {
            if (!Character.isDigit(field.charAt(i))) {
                return false;
            }
        }
        return !field.isEmpty();
    }
}
