package com.dynascope.core.parser;

import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.InputKind;

import java.io.Reader;
import java.nio.file.Path;

/**
 * Reads the global-statistics log: one {@link EnergySample} per cycle block.
 * <p>
 * States: between blocks, and inside a block (after a "dt of cycle" header, until
 * a blank line that follows at least one field, or the next header). A block whose
 * required fields are missing or unparseable is dropped and counted as skipped.
 */
public class GlstatReader extends LineRecordReader<EnergySample> {

    private final EnergyBlockParser block = new EnergyBlockParser(InputKind.GLSTAT);

    public GlstatReader(Reader reader, String sourceName, CancellationToken cancellation) {
        super(reader, InputKind.GLSTAT, sourceName, cancellation);
    }

    public static GlstatReader open(Path path, CancellationToken cancellation) {
        return new GlstatReader(openFile(path), path.getFileName().toString(), cancellation);
    }

    @Override
    protected void onLine(String line) {
        if (line.contains("dt of cycle")) {
            if (block.isOpen()) {
                finishBlock();
            }
            block.tryOpen(line);
            return;
        }
        if (!block.isOpen()) {
            return;
        }
        if (line.isBlank()) {
            if (block.hasFields()) {
                finishBlock();
            }
            return;
        }
        block.accept(line);
    }

    @Override
    protected void onEnd() {
        if (block.isOpen()) {
            finishBlock();
        }
    }

    private void finishBlock() {
        EnergySample sample = block.close();
        if (sample != null) {
            emit(sample);
        } else {
            skip("energy block without parseable time/kinetic/internal/total");
        }
    }
}
