package com.dynascope.core.parser;

import com.dynascope.core.model.InitialPenetration;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.InterfaceWarningCount;
import com.dynascope.core.model.MemoryRequest;
import com.dynascope.core.model.RunRecord;
import com.dynascope.core.model.TerminationMarker;
import com.dynascope.core.model.TerminationState;
import com.dynascope.core.model.WarningEvent;

import java.io.Reader;
import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads one message log: the primary {@code messag} file or a per-process
 * {@code mesNNNN} sibling. Every record is tagged with the rank given at
 * construction; merging ranks is left to the caller.
 * <p>
 * Emits {@link WarningEvent}, {@link InitialPenetration}, {@link InterfaceWarningCount},
 * {@link MemoryRequest} and {@link TerminationMarker} records.
 */
public class MessageReader extends LineRecordReader<RunRecord> {

    private static final Pattern INITIAL_PENETRATION = Pattern.compile(
            "(\\d+)\\s+initial penetrations? (?:were|was) found for interface\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WARNING_SUMMARY = Pattern.compile(
            "summary of warning messages for interface\\s*#?\\s*=?\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern WARNING_COUNT = Pattern.compile(
            "number of warning messages\\s*=\\s*(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern MEMORY = Pattern.compile(
            "(?:expanding|allocating|contracting)\\s+memory to\\s+(\\d+)\\s+d\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NORMAL_TERMINATION = Pattern.compile("N o r m a l\\s+t e r m i n a t i o n");
    private static final Pattern ERROR_TERMINATION = Pattern.compile("E r r o r\\s+t e r m i n a t i o n");
    private static final Pattern TERMINATION_REACHED = Pattern.compile("\\*\\*\\*\\s+termination time reached\\s+\\*\\*\\*");

    private final int rank;
    private final WarningBlockParser block;
    private Integer summaryInterface;

    public MessageReader(Reader reader, String sourceName, int rank, CancellationToken cancellation) {
        super(reader, InputKind.MESSAGE, sourceName, cancellation);
        this.rank = rank;
        this.block = new WarningBlockParser(InputKind.MESSAGE, rank);
    }

    public static MessageReader open(Path path, int rank, CancellationToken cancellation) {
        return new MessageReader(openFile(path), path.getFileName().toString(), rank, cancellation);
    }

    public int rank() {
        return rank;
    }

    @Override
    protected void onLine(String line) {
        if (WarningBlockParser.isHeader(line)) {
            closeBlock();
            try {
                block.open(line);
            } catch (NumberFormatException e) {
                skip("warning header with unparseable code");
            }
            return;
        }
        if (block.isOpen() && isTerminationBanner(line)) {
            closeBlock();
        }
        if (block.isOpen()) {
            if (line.isBlank()) {
                if (block.contextLines() > 0) {
                    closeBlock();
                }
                return;
            }
            if (block.namesAnotherFailingElement(line)) {
                emit(block.split(line));
                return;
            }
            block.addContext(line);
            if (block.isFull()) {
                closeBlock();
            }
            return;
        }
        scanFreeText(line);
    }

    @Override
    protected void onEnd() {
        closeBlock();
    }

    private void scanFreeText(String line) {
        if (line.isBlank()) {
            return;
        }
        if (NORMAL_TERMINATION.matcher(line).find() || TERMINATION_REACHED.matcher(line).find()) {
            emit(new TerminationMarker(TerminationState.NORMAL, rank));
            return;
        }
        if (ERROR_TERMINATION.matcher(line).find()) {
            emit(new TerminationMarker(TerminationState.ERROR_TERMINATED, rank));
            return;
        }
        Matcher m = INITIAL_PENETRATION.matcher(line);
        if (m.find()) {
            try {
                emit(new InitialPenetration(Numbers.parseInt(m.group(2)), Numbers.parseLong(m.group(1)), rank));
            } catch (NumberFormatException e) {
                skip("initial penetration count out of range");
            }
            return;
        }
        m = WARNING_SUMMARY.matcher(line);
        if (m.find()) {
            summaryInterface = Numbers.parseIntOr(m.group(1), -1);
            return;
        }
        m = WARNING_COUNT.matcher(line);
        if (m.find() && summaryInterface != null) {
            try {
                emit(new InterfaceWarningCount(summaryInterface, Numbers.parseLong(m.group(1)), rank));
            } catch (NumberFormatException e) {
                skip("interface warning count out of range");
            }
            summaryInterface = null;
            return;
        }
        m = MEMORY.matcher(line);
        if (m.find()) {
            try {
                emit(new MemoryRequest(Numbers.parseLong(m.group(1)), Numbers.parseLong(m.group(2)), rank));
            } catch (NumberFormatException e) {
                skip("memory size out of range");
            }
            return;
        }
        if (WarningBlockParser.classify(line) != WarningEvent.Condition.GENERAL
                && line.toLowerCase(Locale.ROOT).contains("element")) {
            emit(block.standalone(line, WarningEvent.Level.ERROR));
        }
    }

    private static boolean isTerminationBanner(String line) {
        return NORMAL_TERMINATION.matcher(line).find()
                || ERROR_TERMINATION.matcher(line).find()
                || TERMINATION_REACHED.matcher(line).find();
    }

    private void closeBlock() {
        if (block.isOpen()) {
            emit(block.close());
        }
    }
}
