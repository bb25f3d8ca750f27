package com.dynascope.core.parser;

import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.TimestepRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GlstatReaderTest {

    private static String block(long cycle, String kinetic, String internal, String hourglass) {
        return " dt of cycle " + cycle + " is controlled by solid      12 of part       3\n"
                + "\n"
                + " time...........................   " + (cycle * 1.0e-6) + "\n"
                + " time step......................   1.00000E-06\n"
                + " kinetic energy.................   " + kinetic + "\n"
                + " internal energy................   " + internal + "\n"
                + " hourglass energy ..............   " + hourglass + "\n"
                + " sliding interface energy.......   0.00000E+00\n"
                + " total energy...................   1.00000E+03\n"
                + " total energy / initial energy..   1.00000E+00\n"
                + " external work..................   0.00000E+00\n"
                + "\n";
    }

    private static List<EnergySample> readAll(GlstatReader reader) {
        List<EnergySample> samples = new ArrayList<>();
        reader.forEachRemaining(samples::add);
        return samples;
    }

    @Test
    @DisplayName("reads one sample per cycle block with the controlling element")
    void readsBlocks() {
        String text = block(0, "1.00000E+03", "0.00000E+00", "0.00000E+00")
                + block(100, "6.00000E+02", "4.00000E+02", "8.00000E+00");
        GlstatReader reader = new GlstatReader(new StringReader(text), "glstat", CancellationToken.none());

        List<EnergySample> samples = readAll(reader);

        assertEquals(2, samples.size());
        EnergySample second = samples.get(1);
        assertEquals(100, second.cycle());
        assertEquals(600.0, second.kinetic(), 1e-9);
        assertEquals(400.0, second.internal(), 1e-9);
        assertEquals(0.02, second.hourglassRatio(), 1e-12);
        assertEquals(1.0, second.ratio(), 1e-12);
        assertEquals("solid", second.controllingType());
        assertEquals(12, second.controllingElement());
        assertEquals(3, second.controllingPart());
        assertEquals(InputKind.GLSTAT, second.source());
        assertEquals(0, reader.skippedRecords());
    }

    @Test
    @DisplayName("drops a block with an overflowed field and counts it as skipped")
    void skipsOverflowedBlock() {
        String text = block(0, "1.00000E+03", "0.00000E+00", "0.00000E+00")
                + block(100, "**********", "4.00000E+02", "0.00000E+00")
                + block(200, "5.00000E+02", "5.00000E+02", "0.00000E+00");
        GlstatReader reader = new GlstatReader(new StringReader(text), "glstat", CancellationToken.none());

        List<EnergySample> samples = readAll(reader);

        assertEquals(List.of(0L, 200L), samples.stream().map(EnergySample::cycle).toList());
        assertEquals(1, reader.skippedRecords());
        assertEquals(2, reader.emittedRecords());
    }

    @Test
    @DisplayName("accepts Fortran exponents without the exponent letter")
    void readsBareExponent() {
        String text = block(0, "1.234-100", "1.00000E+02", "0.00000E+00");
        GlstatReader reader = new GlstatReader(new StringReader(text), "glstat", CancellationToken.none());

        List<EnergySample> samples = readAll(reader);

        assertEquals(1, samples.size());
        assertEquals(1.234e-100, samples.get(0).kinetic(), 1e-110);
    }

    @Test
    @DisplayName("keeps the controller and dt of blocks written without a part")
    void readsContactControlledBlock() {
        String header = " dt of cycle 100 is controlled by solid      12 of part       3\n";
        String text = block(100, "1.00000E+03", "1.00000E+02", "0.00000E+00")
                + block(500, "1.00000E+03", "1.00000E+02", "0.00000E+00")
                        .replace(header.replace("100", "500"), " dt of cycle 500 is controlled by contact 3\n")
                        .replace("1.00000E-06", "5.00000E-12");
        GlstatReader reader = new GlstatReader(new StringReader(text), "glstat", CancellationToken.none());

        List<EnergySample> samples = readAll(reader);

        assertEquals(2, samples.size());
        EnergySample contact = samples.get(1);
        assertEquals("contact", contact.controllingType());
        assertEquals(3, contact.controllingElement());
        assertEquals(0, contact.controllingPart());
        TimestepRecord record = TimestepRecord.from(contact);
        assertNotNull(record);
        assertEquals(500, record.cycle());
        assertEquals(5.0e-12, record.dt(), 1e-24);
        assertTrue(record.hasController());
    }

    @Test
    @DisplayName("a block naming no controller still yields a timestep record")
    void readsBareCycleHeader() {
        String text = block(700, "1.00000E+03", "1.00000E+02", "0.00000E+00")
                .replace(" is controlled by solid      12 of part       3", "");
        GlstatReader reader = new GlstatReader(new StringReader(text), "glstat", CancellationToken.none());

        List<EnergySample> samples = readAll(reader);

        assertEquals(1, samples.size());
        TimestepRecord record = TimestepRecord.from(samples.get(0));
        assertNotNull(record);
        assertFalse(record.hasController());
        assertEquals(700, record.cycle());
    }

    @Test
    @DisplayName("flushes the last block at end of file without a trailing blank line")
    void flushesLastBlock() {
        String text = block(0, "1.00000E+03", "0.00000E+00", "0.00000E+00").stripTrailing();
        GlstatReader reader = new GlstatReader(new StringReader(text), "glstat", CancellationToken.none());

        assertEquals(1, readAll(reader).size());
    }

    @Test
    @DisplayName("stops with AnalysisCancelledException once cancelled")
    void honoursCancellation() {
        CancellationToken token = new CancellationToken();
        GlstatReader reader = new GlstatReader(new StringReader(block(0, "1.0E+03", "0.0", "0.0")), "glstat", token);
        token.cancel();

        assertThrows(AnalysisCancelledException.class, reader::hasNext);
    }
}
