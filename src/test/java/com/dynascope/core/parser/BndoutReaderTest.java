package com.dynascope.core.parser;

import com.dynascope.core.model.BoundaryForceSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BndoutReaderTest {

    private static String step(String time, String xForce) {
        return " n o d a l   f o r c e/e n e r g y    o u t p u t  t=   " + time + "\n"
                + "\n"
                + " nd#     201  xforce=   " + xForce + "   yforce=   4.0000E+00 zforce=   0.0000E+00   energy=   2.0000E+00\n"
                + "              xmoment=  0.0000E+00   ymoment=  0.0000E+00   zmoment=  0.0000E+00\n"
                + "\n";
    }

    private static List<BoundaryForceSample> readAll(BndoutReader reader) {
        List<BoundaryForceSample> samples = new ArrayList<>();
        reader.forEachRemaining(samples::add);
        return samples;
    }

    @Test
    @DisplayName("numbers output steps from one and reads the labelled forces")
    void readsForces() {
        String text = step("1.0000E-04", "3.0000E+00") + step("2.0000E-04", "6.0000E+00");
        BndoutReader reader = new BndoutReader(new StringReader(text), "bndout", 100, CancellationToken.none());

        List<BoundaryForceSample> samples = readAll(reader);

        assertEquals(2, samples.size());
        assertEquals(1, samples.get(0).cycle());
        assertEquals(2, samples.get(1).cycle());
        assertEquals(2.0e-4, samples.get(1).time(), 1e-15);
        assertEquals(201, samples.get(0).nodeId());
        assertEquals(5.0, samples.get(0).forceMagnitude(), 1e-9);
        assertEquals(2.0, samples.get(0).energy(), 1e-9);
    }

    @Test
    @DisplayName("skips a row whose force overflowed")
    void skipsOverflow() {
        String text = step("1.0000E-04", "**********") + step("2.0000E-04", "6.0000E+00");
        BndoutReader reader = new BndoutReader(new StringReader(text), "bndout", 100, CancellationToken.none());

        List<BoundaryForceSample> samples = readAll(reader);

        assertEquals(1, samples.size());
        assertEquals(2, samples.get(0).cycle());
        assertEquals(1, reader.skippedRecords());
    }
}
