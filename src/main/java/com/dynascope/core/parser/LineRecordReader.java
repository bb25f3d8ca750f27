package com.dynascope.core.parser;

import com.dynascope.core.model.InputKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Base for the streaming readers: pulls one line at a time from the underlying
 * text and lets the subclass turn lines into typed records.
 * <p>
 * A reader is a single-use, forward-only sequence. It holds at most the records
 * produced by the current line plus whatever section state the subclass keeps,
 * so memory does not grow with file size. The cancellation token is checked
 * before every line; on cancellation the file handle is closed and
 * {@link AnalysisCancelledException} propagates to the consumer.
 *
 * @param <T> record type produced
 */
public abstract class LineRecordReader<T> implements Iterator<T>, Closeable {

    private static final Logger log = LoggerFactory.getLogger(LineRecordReader.class);

    private final BufferedReader reader;
    private final InputKind input;
    private final String sourceName;
    private final CancellationToken cancellation;
    private final ArrayDeque<T> pending = new ArrayDeque<>();

    private long lineNumber;
    private long skipped;
    private long emitted;
    private boolean exhausted;
    private boolean closed;

    protected LineRecordReader(Reader reader, InputKind input, String sourceName, CancellationToken cancellation) {
        this.reader = reader instanceof BufferedReader buffered ? buffered : new BufferedReader(reader);
        this.input = input;
        this.sourceName = sourceName;
        this.cancellation = cancellation;
    }

    /** Opens a solver file. Latin-1 never rejects a byte, so damaged output still decodes. */
    protected static BufferedReader openFile(Path path) {
        try {
            return Files.newBufferedReader(path, StandardCharsets.ISO_8859_1);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open " + path, e);
        }
    }

    /** Handles one line (without terminator). May call {@link #emit} any number of times. */
    protected abstract void onLine(String line);

    /** Called once after the last line; subclasses flush open sections here. */
    protected void onEnd() {
    }

    protected final void emit(T record) {
        pending.add(record);
        emitted++;
    }

    /** Counts one malformed record and logs where it was found. */
    protected final void skip(String reason) {
        skipped++;
        log.debug("Skipping malformed record in {} at line {}: {}", sourceName, lineNumber, reason);
    }

    protected final long lineNumber() {
        return lineNumber;
    }

    @Override
    public boolean hasNext() {
        fill();
        return !pending.isEmpty();
    }

    @Override
    public T next() {
        fill();
        if (pending.isEmpty()) {
            throw new NoSuchElementException("No more records in " + sourceName);
        }
        return pending.poll();
    }

    /** The remaining records as a sequential stream that closes this reader when closed. */
    public Stream<T> stream() {
        Spliterator<T> split = Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(split, false).onClose(this::close);
    }

    public InputKind input() {
        return input;
    }

    public String sourceName() {
        return sourceName;
    }

    /** Malformed records dropped so far. */
    public long skippedRecords() {
        return skipped;
    }

    public long emittedRecords() {
        return emitted;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            reader.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot close " + sourceName, e);
        }
    }

    private void fill() {
        while (pending.isEmpty() && !exhausted) {
            if (cancellation.isCancelled()) {
                close();
                cancellation.throwIfCancelled();
            }
            if (closed) {
                exhausted = true;
                return;
            }
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                close();
                throw new UncheckedIOException("Read failed in " + sourceName + " at line " + lineNumber, e);
            }
            if (line == null) {
                exhausted = true;
                onEnd();
                close();
                log.debug("Finished {}: {} records, {} skipped", sourceName, emitted, skipped);
                return;
            }
            lineNumber++;
            onLine(line);
        }
    }
}
