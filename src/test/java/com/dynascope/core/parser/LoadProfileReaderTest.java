package com.dynascope.core.parser;

import com.dynascope.core.model.ProcessorLoadSample;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LoadProfileReaderTest {

    private static final String HEADER = "Solids,Shells,Tshells,Beams,SPH,E_Other,Force_Shr,Tstep_Shr,Swtch_Shr,"
            + "Matrl_Shr,Elmnt_Shr,Time_Step,Contact,Rigid_Bdy,Others\n";

    private static String row(double solids, double contact) {
        return solids + ",0,0,0,0,0,1.0,0,0,0,0,0," + contact + ",0,0\n";
    }

    private static List<ProcessorLoadSample> readAll(String text) {
        LoadProfileReader reader = new LoadProfileReader(new StringReader(text), "load_profile.csv", CancellationToken.none());
        List<ProcessorLoadSample> samples = new ArrayList<>();
        reader.forEachRemaining(samples::add);
        return samples;
    }

    private static ProcessorLoadSample find(List<ProcessorLoadSample> samples, String component, int rank) {
        return samples.stream()
                .filter(s -> s.component().equals(component) && s.rank() == rank)
                .findFirst()
                .orElseThrow();
    }

    @Test
    @DisplayName("pairs each rank's seconds with its percentage row")
    void pairsTables() {
        String text = "\"Clock (seconds)\"\n" + HEADER + row(10.0, 4.0) + row(12.0, 2.0) + "\n"
                + "\"Clock and percentage(%)\"\n" + HEADER + row(60.0, 24.0) + row(70.0, 12.0) + "\n";

        List<ProcessorLoadSample> samples = readAll(text);

        assertEquals(2 * LoadProfileReader.COMPONENTS.size(), samples.size());
        ProcessorLoadSample solids1 = find(samples, "solids", 1);
        assertEquals(12.0, solids1.seconds(), 1e-12);
        assertEquals(70.0, solids1.percent(), 1e-12);
        assertEquals(4.0, find(samples, "contact", 0).seconds(), 1e-12);
    }

    @Test
    @DisplayName("emits ranks without a percentage row with NaN percent")
    void secondsOnly() {
        String text = "\"Clock (seconds)\"\n" + HEADER + row(10.0, 4.0);

        List<ProcessorLoadSample> samples = readAll(text);

        assertEquals(LoadProfileReader.COMPONENTS.size(), samples.size());
        assertTrue(Double.isNaN(find(samples, "solids", 0).percent()));
    }
}
