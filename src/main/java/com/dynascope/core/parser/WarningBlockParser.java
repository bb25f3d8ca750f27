package com.dynascope.core.parser;

import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.WarningEvent;
import com.dynascope.core.model.WarningEvent.Condition;
import com.dynascope.core.model.WarningEvent.Level;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns a {@code *** Warning NNNNN} / {@code *** Error NNNNN} header and up to
 * {@value #CONTEXT_LINES} following context lines into one {@link WarningEvent}.
 * A context line that reports a failure on another element than the one the block
 * already names starts a new event under the same code, so each failing element
 * listed under one header is kept.
 * Shared by the message readers and the high-speed-printer reader.
 */
final class WarningBlockParser {

    static final int CONTEXT_LINES = 5;

    static final Pattern HEADER = Pattern.compile("^\\s*\\*\\*\\*\\s+(Warning|Error)\\s+(\\S+)");

    private static final Pattern INTERFACE_REF = Pattern.compile("interface\\s*(?:#|id|no\\.?)?\\s*=?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PART_REF = Pattern.compile("\\bpart\\s*(?:#|id)?\\s*=?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELEMENT_REF = Pattern.compile("element\\s*(?:#|id|number)?\\s*=?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CYCLE_REF = Pattern.compile("\\bcycle\\s*=?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NAN_WORD = Pattern.compile("\\bnan\\b");

    private final InputKind source;
    private final int rank;
    private final StringBuilder text = new StringBuilder();

    private boolean open;
    private int code;
    private Level level;
    private int contextLines;

    WarningBlockParser(InputKind source, int rank) {
        this.source = source;
        this.rank = rank;
    }

    boolean isOpen() {
        return open;
    }

    /** True once the block holds its maximum number of context lines. */
    boolean isFull() {
        return contextLines >= CONTEXT_LINES;
    }

    int contextLines() {
        return contextLines;
    }

    static boolean isHeader(String line) {
        return line.contains("***") && HEADER.matcher(line).find();
    }

    /**
     * Opens a block from a header line.
     *
     * @throws NumberFormatException when the code is not an integer
     */
    void open(String line) {
        Matcher m = HEADER.matcher(line);
        if (!m.find()) {
            throw new IllegalArgumentException("Not a warning header: " + line);
        }
        int parsed = Numbers.parseInt(m.group(2));
        text.setLength(0);
        text.append(line.trim());
        code = parsed;
        level = "Error".equals(m.group(1)) ? Level.ERROR : Level.WARNING;
        contextLines = 0;
        open = true;
    }

    void addContext(String line) {
        text.append(' ').append(line.trim());
        contextLines++;
    }

    /** True when the line reports a failure on an element other than the one the open block names. */
    boolean namesAnotherFailingElement(String line) {
        if (!open || classify(line) == Condition.GENERAL) {
            return false;
        }
        Long element = longRef(ELEMENT_REF, line);
        if (element == null) {
            return false;
        }
        Long current = longRef(ELEMENT_REF, collapse(text));
        return current != null && !current.equals(element);
    }

    /**
     * Closes the open block and continues with the line as the start of the next
     * event, keeping the code and level of the header.
     *
     * @return the event of the block that was closed
     */
    WarningEvent split(String line) {
        WarningEvent closed = close();
        text.setLength(0);
        text.append(line.trim());
        contextLines = 0;
        open = true;
        return closed;
    }

    WarningEvent close() {
        open = false;
        return build(code, level, collapse(text));
    }

    /** Builds an uncoded event from a single stand-alone line. */
    WarningEvent standalone(String line, Level standaloneLevel) {
        return build(0, standaloneLevel, collapse(new StringBuilder(line.trim())));
    }

    private WarningEvent build(int eventCode, Level eventLevel, String message) {
        return new WarningEvent(
                eventCode,
                eventLevel,
                classify(message),
                intRef(INTERFACE_REF, message),
                intRef(PART_REF, message),
                longRef(ELEMENT_REF, message),
                longRef(CYCLE_REF, message),
                rank,
                message,
                source);
    }

    /** Recognises the failure conditions traced to elements. */
    static Condition classify(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (lower.contains("negative volume")) {
            return Condition.NEGATIVE_VOLUME;
        }
        if (lower.contains("constraint") && NAN_WORD.matcher(lower).find()) {
            return Condition.CONSTRAINT_NAN;
        }
        return Condition.GENERAL;
    }

    private static String collapse(StringBuilder text) {
        return text.toString().replaceAll("\\s+", " ").trim();
    }

    private static Integer intRef(Pattern pattern, String message) {
        Matcher m = pattern.matcher(message);
        if (!m.find()) {
            return null;
        }
        try {
            return Integer.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Long longRef(Pattern pattern, String message) {
        Matcher m = pattern.matcher(message);
        if (!m.find()) {
            return null;
        }
        try {
            return Long.valueOf(m.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
