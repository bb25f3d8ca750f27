package com.dynascope.core.parser;

import com.dynascope.core.model.NodalSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NodoutReaderTest {

    private static final String COLUMNS =
            " nodal point  x-disp     y-disp      z-disp      x-vel       y-vel       z-vel      x-accl      y-accl      z-accl      x-coor      y-coor      z-coor\n";

    private static String step(long step, String time, long... nodes) {
        StringBuilder text = new StringBuilder();
        text.append(" n o d a l   p r i n t   o u t   f o r   t i m e  s t e p")
                .append(String.format("%8d", step))
                .append("                              ( at time ").append(time).append(" )\n\n")
                .append(COLUMNS);
        for (long node : nodes) {
            text.append(String.format("%9d", node))
                    .append("  1.0E-03  0.0E+00  0.0E+00  1.5E+03  0.0E+00  0.0E+00  2.0E+01  0.0E+00  0.0E+00  1.0  2.0  3.0\n");
        }
        return text.append('\n').toString();
    }

    private static List<NodalSample> readAll(NodoutReader reader) {
        List<NodalSample> samples = new ArrayList<>();
        reader.forEachRemaining(samples::add);
        return samples;
    }

    @Test
    @DisplayName("reads one sample per node with the step's cycle and time")
    void readsSamples() {
        String text = " {BEGIN LEGEND}\n  101   top corner\n {END LEGEND}\n"
                + step(10, "1.0000000E-04", 101, 102);
        NodoutReader reader = new NodoutReader(new StringReader(text), "nodout", 100, CancellationToken.none());

        List<NodalSample> samples = readAll(reader);

        assertEquals(2, samples.size());
        NodalSample first = samples.get(0);
        assertEquals(101, first.nodeId());
        assertEquals(10, first.cycle());
        assertEquals(1.0e-4, first.time(), 1e-15);
        assertEquals(1.5e3, first.xVelocity(), 1e-9);
        assertEquals(1.5e3, first.speed(), 1e-9);
        assertEquals(0, reader.skippedRecords());
    }

    @Test
    @DisplayName("tracks only the first nodes up to the cap without counting the rest as skipped")
    void capsTrackedNodes() {
        String text = step(10, "1.0E-04", 101, 102, 103) + step(20, "2.0E-04", 103, 102, 101);
        NodoutReader reader = new NodoutReader(new StringReader(text), "nodout", 2, CancellationToken.none());

        List<NodalSample> samples = readAll(reader);

        assertEquals(List.of(101L, 102L, 102L, 101L), samples.stream().map(NodalSample::nodeId).toList());
        assertEquals(0, reader.skippedRecords());
    }

    @Test
    @DisplayName("counts a row with an unparseable value as skipped")
    void skipsBrokenRow() {
        String text = step(10, "1.0E-04", 101)
                + "      102  ********  0.0E+00  0.0E+00  1.5E+03  0.0E+00  0.0E+00  2.0E+01  0.0E+00  0.0E+00  1.0  2.0  3.0\n";
        NodoutReader reader = new NodoutReader(new StringReader(text), "nodout", 100, CancellationToken.none());

        assertEquals(1, readAll(reader).size());
        assertEquals(1, reader.skippedRecords());
    }
}
