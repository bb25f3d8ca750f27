package com.dynascope.core.parser;

import com.dynascope.core.model.ComponentTiming;
import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.ModelSummary;
import com.dynascope.core.model.PartDefinition;
import com.dynascope.core.model.PartTable;
import com.dynascope.core.model.PerformanceProfile;
import com.dynascope.core.model.RunRecord;
import com.dynascope.core.model.SmallestTimestep;
import com.dynascope.core.model.TerminationState;
import com.dynascope.core.model.TerminationStatus;
import com.dynascope.core.model.TimestepRecord;
import com.dynascope.core.model.WarningEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HspReaderTest {

    private static final String SEPARATOR = " " + "*".repeat(72) + "\n";

    private static final String PREAMBLE = """
                 Date: 01/02/2024    Time: 10:00:00
             |  Version : R13.1                         |
             MPP execution with       4 procs

             c o n t r o l   i n f o r m a t i o n
               termination time.....................  2.0000E-03
               time step scale factor...............  9.0000E-01

             p a r t   d e f i n i t i o n s
            """
            + SEPARATOR
            + """
              Bumper beam
              part id ...................     3
              section id ................     1
              material id ...............     1
              material type .............    24
              hourglass type ............     4
              hourglass coefficient .....  =  1.0000E-01
              density ...................  =  7.8500E-09
            """
            + SEPARATOR;

    private static final String ENERGY_BLOCK = """

             dt of cycle     100 is controlled by shell      77 of part       2

             time...........................   1.00000E-04
             time step......................   1.00000E-06
             kinetic energy.................   1.00000E+03
             internal energy................   1.00000E+02
             total energy...................   1.10000E+03

            """;

    private static final String ERROR_TAIL = """
             *** Error 30010 (OTH+123)
                 negative volume in solid element # 55 of part 3

             E r r o r   t e r m i n a t i o n

             Problem time       =    1.2000E-03
             Problem cycle      =      1200

             T i m i n g   i n f o r m a t i o n
                                      CPU(seconds)   %CPU  Clock(seconds) %Clock
              ----------------------------------------------------------------
              Element processing ...  6.0000E+01   60.00   6.1000E+01   61.00
              Contact algorithm .....  2.0000E+01   20.00   2.0000E+01   20.00
                Interf. ID     3    1.0000E+01   10.00   1.0000E+01   10.00
              T o t a l s            1.0000E+02  100.00   1.0000E+02  100.00

             Elapsed time      30 seconds
            """;

    private static List<RunRecord> read(String text) {
        HspReader reader = new HspReader(new StringReader(text), "d3hsp", CancellationToken.none());
        List<RunRecord> records = new ArrayList<>();
        reader.forEachRemaining(records::add);
        return records;
    }

    private static <T> List<T> only(List<RunRecord> records, Class<T> type) {
        return records.stream().filter(type::isInstance).map(type::cast).toList();
    }

    // -- Error-terminated run --------------------------------------------------

    @Nested
    @DisplayName("error-terminated run")
    class ErrorTerminatedRun {

        private final List<RunRecord> records = read(PREAMBLE + ENERGY_BLOCK + ERROR_TAIL);

        @Test
        @DisplayName("reports error termination with the last error code and reached cycle")
        void termination() {
            TerminationStatus status = only(records, TerminationStatus.class).get(0);

            assertEquals(TerminationState.ERROR_TERMINATED, status.state());
            assertEquals(30010, status.errorCode());
            assertEquals(1200, status.cycles());
            assertEquals(1.2e-3, status.problemTime(), 1e-15);
            assertEquals(2.0e-3, status.targetTime(), 1e-15);
            assertEquals(30.0, status.elapsedSeconds(), 1e-12);
        }

        @Test
        @DisplayName("reads the run header and control settings")
        void header() {
            ModelSummary model = only(records, ModelSummary.class).get(0);

            assertEquals("R13.1", model.header().version());
            assertEquals("01/02/2024", model.header().date());
            assertEquals(4, model.header().processors());
            assertEquals(0.9, model.control().timestepScaleFactor(), 1e-12);
        }

        @Test
        @DisplayName("reads part definitions with their title")
        void parts() {
            PartTable table = only(records, PartTable.class).get(0);

            assertEquals(1, table.parts().size());
            PartDefinition part = table.parts().get(0);
            assertEquals(3, part.partId());
            assertEquals("Bumper beam", part.name());
            assertEquals(24, part.materialType());
            assertEquals("Piecewise Linear Plasticity", part.materialTypeName());
            assertEquals(0.1, part.hourglassCoefficient(), 1e-12);
        }

        @Test
        @DisplayName("emits an energy sample with its controlling element as a timestep record")
        void energyBlock() {
            EnergySample sample = only(records, EnergySample.class).get(0);
            TimestepRecord timestep = only(records, TimestepRecord.class).get(0);

            assertEquals(100, sample.cycle());
            assertEquals(1000.0, sample.kinetic(), 1e-9);
            assertEquals("shell", timestep.elementType());
            assertEquals(77, timestep.elementId());
            assertEquals(2, timestep.partId());
            assertEquals(1.0e-6, timestep.dt(), 1e-18);
        }

        @Test
        @DisplayName("emits the error block as an unranked negative volume event")
        void warningEvent() {
            WarningEvent event = only(records, WarningEvent.class).get(0);

            assertEquals(30010, event.code());
            assertEquals(WarningEvent.UNRANKED, event.rank());
            assertEquals(WarningEvent.Condition.NEGATIVE_VOLUME, event.condition());
            assertEquals(55L, event.elementId());
            assertEquals(3, event.partId());
        }

        @Test
        @DisplayName("reads the timing table into component and interface timings")
        void timing() {
            PerformanceProfile profile = only(records, PerformanceProfile.class).get(0);

            assertEquals(List.of("Element processing", "Contact algorithm"),
                    profile.components().stream().map(ComponentTiming::component).toList());
            assertEquals(61.0, profile.components().get(0).clockPercent(), 1e-12);
            assertEquals(1, profile.interfaces().size());
            assertEquals(3, profile.interfaces().get(0).interfaceId());
        }
    }

    // -- Incomplete run --------------------------------------------------------

    @Nested
    @DisplayName("incomplete run")
    class IncompleteRun {

        @Test
        @DisplayName("without a termination banner the run is incomplete at the last progress line")
        void incomplete() {
            String text = ENERGY_BLOCK + """
                         500 t 5.0000E-04 dt 1.00E-06 write d3plot file
                    """;

            TerminationStatus status = only(read(text), TerminationStatus.class).get(0);

            assertEquals(TerminationState.INCOMPLETE, status.state());
            assertEquals(500, status.cycles());
            assertEquals(5.0e-4, status.problemTime(), 1e-15);
        }

        @Test
        @DisplayName("reads the smallest timestep table")
        void smallestTimesteps() {
            String text = ENERGY_BLOCK + """
                     100 smallest timesteps
                      solid       55        3    1.0000E-08
                      shell       77        2    2.0000E-08

                    """;

            List<SmallestTimestep> smallest = only(read(text), SmallestTimestep.class);

            assertEquals(List.of(new SmallestTimestep("solid", 55, 3, 1.0e-8),
                    new SmallestTimestep("shell", 77, 2, 2.0e-8)), smallest);
        }

        @Test
        @DisplayName("splits an error block that lists several failing elements")
        void elementsUnderOneHeader() {
            String text = ENERGY_BLOCK + """
                     *** Error 40509 (OTH+22)
                         negative volume in solid element # 101
                         negative volume in solid element # 102
                         negative volume in solid element # 103

                    """;

            List<WarningEvent> events = only(read(text), WarningEvent.class);

            assertEquals(List.of(101L, 102L, 103L), events.stream().map(WarningEvent::elementId).toList());
            assertTrue(events.stream().allMatch(event -> event.code() == 40509
                    && event.rank() == WarningEvent.UNRANKED));
        }

        @Test
        @DisplayName("an empty file still yields summary, performance and termination records")
        void emptyFile() {
            List<RunRecord> records = read("");

            assertEquals(1, only(records, ModelSummary.class).size());
            assertTrue(only(records, PerformanceProfile.class).get(0).isEmpty());
            assertEquals(TerminationState.INCOMPLETE, only(records, TerminationStatus.class).get(0).state());
        }
    }
}
