package com.dynascope.core.parser;

import com.dynascope.core.model.StatusSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StatusReaderTest {

    private static String block(long cycle, String time, long remaining) {
        return " cycle =         " + cycle + "\n"
                + " time  =   " + time + "\n"
                + " cpu time per zone cycle.........     150 nanoseconds\n"
                + " average cpu time per zone cycle.     140 nanoseconds\n"
                + " estimated total cpu time     =      3600 sec\n"
                + " estimated cpu time to complete =    " + remaining + " sec\n";
    }

    @Test
    @DisplayName("a repeated field starts the next sample")
    void splitsOnRepeatedField() {
        String text = block(1000, "1.0000E-03", 1800) + block(2000, "2.0000E-03", 900);
        StatusReader reader = new StatusReader(new StringReader(text), "status.out", CancellationToken.none());
        List<StatusSample> samples = new ArrayList<>();
        reader.forEachRemaining(samples::add);

        assertEquals(2, samples.size());
        StatusSample first = samples.get(0);
        assertEquals(1000, first.cycle());
        assertEquals(1.0e-3, first.time(), 1e-15);
        assertEquals(150, first.cpuPerZoneCycleNs());
        assertEquals(140, first.averageCpuPerZoneCycleNs());
        assertEquals(3600, first.estimatedTotalCpuSeconds());
        assertEquals(1800, first.estimatedCpuRemainingSeconds());
        assertEquals(-1, first.estimatedTotalClockSeconds());
        assertEquals(900, samples.get(1).estimatedCpuRemainingSeconds());
    }
}
