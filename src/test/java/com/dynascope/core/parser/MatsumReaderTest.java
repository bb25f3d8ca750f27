package com.dynascope.core.parser;

import com.dynascope.core.model.MaterialSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MatsumReaderTest {

    private static final String LEGEND = """
             {BEGIN LEGEND}
              Entity #        Title
                    3     Bumper beam
             {END LEGEND}
            """;

    private static String state(String time, String internal, String hourglass) {
        return "\n time =  " + time + "\n"
                + " mat.#=    3             inten=   " + internal + "   kinen=   2.0000E+01   eroded_ie=  0.0000E+00\n"
                + " x-mom=   1.0000E+00   y-mom=   0.0000E+00   z-mom=   0.0000E+00   hgeng=   " + hourglass + "\n";
    }

    private static List<MaterialSample> readAll(MatsumReader reader) {
        List<MaterialSample> samples = new ArrayList<>();
        reader.forEachRemaining(samples::add);
        return samples;
    }

    @Test
    @DisplayName("numbers states by their time header and names parts from the legend")
    void readsStates() {
        String text = LEGEND + state("1.0000E-04", "1.0000E+02", "5.0000E+00")
                + state("2.0000E-04", "2.0000E+02", "3.0000E+01");
        List<MaterialSample> samples = readAll(new MatsumReader(new StringReader(text), "matsum", CancellationToken.none()));

        assertEquals(2, samples.size());
        MaterialSample second = samples.get(1);
        assertEquals(3, second.partId());
        assertEquals("Bumper beam", second.name());
        assertEquals(2, second.cycle());
        assertEquals(2.0e-4, second.time(), 1e-15);
        assertEquals(200.0, second.internal(), 1e-9);
        assertEquals(30.0, second.hourglass(), 1e-9);
        assertEquals(1.0, second.xMomentum(), 1e-12);
    }

    @Test
    @DisplayName("skips a part block whose internal energy overflowed")
    void skipsOverflow() {
        MatsumReader reader = new MatsumReader(
                new StringReader(LEGEND + state("1.0000E-04", "**********", "0.0")), "matsum", CancellationToken.none());

        assertTrue(readAll(reader).isEmpty());
        assertEquals(1, reader.skippedRecords());
    }
}
