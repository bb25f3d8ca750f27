package com.dynascope.core.scanner;

import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.engine.MissingInputException;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.RunBundle;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link RunBundleScanner}, against result directories laid out
 * in a {@code @TempDir}.
 */
class RunBundleScannerTest {

    @TempDir
    Path tempDir;

    private DynascopeProperties properties;
    private RunBundleScanner scanner;

    @BeforeEach
    void setUp() {
        properties = new DynascopeProperties();
        scanner = new RunBundleScanner(properties);
    }

    private Path write(String name) throws IOException {
        return Files.writeString(tempDir.resolve(name), "content\n");
    }

    // -- Fixed names -----------------------------------------------------------

    @Nested
    @DisplayName("fixed names")
    class FixedNames {

        @Test
        @DisplayName("finds the well-known files and treats empty ones as absent")
        void wellKnownFiles() throws IOException {
            write("d3hsp");
            write("glstat");
            Files.createFile(tempDir.resolve("nodout"));

            RunBundle bundle = scanner.scan(tempDir);

            assertEquals(List.of(InputKind.HSP, InputKind.GLSTAT), bundle.found());
            assertFalse(bundle.has(InputKind.NODOUT));
            assertTrue(bundle.missingOptional().contains(InputKind.NODOUT));
            assertTrue(bundle.hasRequiredInputs());
        }

        @Test
        @DisplayName("accepts alternative spellings of the message log")
        void messageSpelling() throws IOException {
            Path message = write("message");

            RunBundle bundle = scanner.scan(tempDir);

            assertEquals(message, bundle.path(InputKind.MESSAGE).orElseThrow());
        }

        @Test
        @DisplayName("names both required inputs when neither is present")
        void missingRequired() throws IOException {
            write("glstat");

            RunBundle bundle = scanner.scan(tempDir);

            assertFalse(bundle.hasRequiredInputs());
            assertEquals(List.of("d3hsp", "messag / mesNNNN"), bundle.missingRequired());
        }

        @Test
        @DisplayName("rejects a path that is not a directory")
        void notADirectory() throws IOException {
            Path file = write("d3hsp");

            MissingInputException e = assertThrows(MissingInputException.class, () -> scanner.scan(file));
            assertEquals(1, e.getMissing().size());
        }
    }

    // -- Per-process logs ------------------------------------------------------

    @Nested
    @DisplayName("per-process message logs")
    class RankedMessages {

        @Test
        @DisplayName("collects ranks across small gaps and alone satisfy the required set")
        void smallGaps() throws IOException {
            write("mes0000");
            write("mes0001");
            write("mes0003");

            RunBundle bundle = scanner.scan(tempDir);

            assertEquals(List.of(0, 1, 3), List.copyOf(bundle.rankedMessages().keySet()));
            assertTrue(bundle.has(InputKind.MESSAGE));
            assertTrue(bundle.hasRequiredInputs());
        }

        @Test
        @DisplayName("stops probing after the configured number of consecutive misses")
        void gapLimit() throws IOException {
            properties.getInput().setSiblingGap(2);
            write("mes0000");
            write("mes0003");

            RunBundle bundle = scanner.scan(tempDir);

            assertEquals(List.of(0), List.copyOf(bundle.rankedMessages().keySet()));
        }
    }

    // -- Input deck ------------------------------------------------------------

    @Nested
    @DisplayName("input deck")
    class InputDeck {

        @Test
        @DisplayName("prefers a keyword file that is not an include")
        void prefersMainDeck() throws IOException {
            write("include_parts.k");
            Path main = write("sled.k");

            assertEquals(main, RunBundleScanner.findInputDeck(tempDir).orElseThrow());
        }

        @Test
        @DisplayName("falls back to an include file, then dynain")
        void fallbacks() throws IOException {
            Path dynain = write("dynain");
            assertEquals(dynain, RunBundleScanner.findInputDeck(tempDir).orElseThrow());

            Path include = write("include_parts.k");
            assertEquals(include, RunBundleScanner.findInputDeck(tempDir).orElseThrow());
        }

        @Test
        @DisplayName("is optional")
        void none() {
            assertTrue(RunBundleScanner.findInputDeck(tempDir).isEmpty());
        }
    }
}
