package com.dynascope.core.scanner;

import com.dynascope.core.config.DynascopeProperties;
import com.dynascope.core.engine.MissingInputException;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.RunBundle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Stream;

/**
 * Probes a result directory for the well-known solver output files and builds a
 * {@link RunBundle}.
 * <p>
 * Only fixed names are probed; the directory is listed once to find the input deck.
 * Per-process message logs ({@code mes0000}, {@code mes0001}, ...) are probed by rank
 * until {@code sibling-gap} consecutive ranks are missing. Empty files count as absent.
 */
@Service
public class RunBundleScanner {

    private static final Logger log = LoggerFactory.getLogger(RunBundleScanner.class);

    private static final Map<InputKind, List<String>> FIXED_NAMES = fixedNames();

    private final DynascopeProperties properties;

    public RunBundleScanner(DynascopeProperties properties) {
        this.properties = properties;
    }

    /**
     * @throws MissingInputException if {@code directory} is not a readable directory
     */
    public RunBundle scan(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new MissingInputException(directory.toString(), List.of("result directory " + directory));
        }
        Map<InputKind, Path> files = new EnumMap<>(InputKind.class);
        for (Map.Entry<InputKind, List<String>> entry : FIXED_NAMES.entrySet()) {
            for (String name : entry.getValue()) {
                Path candidate = directory.resolve(name);
                if (isUsable(candidate)) {
                    files.put(entry.getKey(), candidate);
                    break;
                }
            }
        }
        findInputDeck(directory).ifPresent(deck -> files.put(InputKind.INPUT_DECK, deck));
        SortedMap<Integer, Path> ranked = probeRankedMessages(directory);

        RunBundle bundle = new RunBundle(directory, files, ranked);
        log.info("Scanned {}: found {}, {} per-process message logs, missing optional {}",
                directory, bundle.found(), ranked.size(), bundle.missingOptional());
        return bundle;
    }

    SortedMap<Integer, Path> probeRankedMessages(Path directory) {
        int gap = properties.getInput().getSiblingGap();
        int maxRank = properties.getInput().getMaxSiblingRank();
        SortedMap<Integer, Path> ranked = new TreeMap<>();
        int misses = 0;
        for (int rank = 0; rank <= maxRank && misses < gap; rank++) {
            Path candidate = directory.resolve(String.format("mes%04d", rank));
            if (isUsable(candidate)) {
                ranked.put(rank, candidate);
                misses = 0;
            } else {
                misses++;
            }
        }
        return ranked;
    }

    /**
     * A {@code *.k} deck that is not an include file, else any {@code *.k}, else
     * {@code dynain}, else a {@code *.dyn} deck. Candidates are taken in name order.
     */
    static Optional<Path> findInputDeck(Path directory) {
        List<Path> keywordFiles = listBySuffix(directory, ".k");
        for (Path candidate : keywordFiles) {
            if (!candidate.getFileName().toString().startsWith("include")) {
                return Optional.of(candidate);
            }
        }
        if (!keywordFiles.isEmpty()) {
            return Optional.of(keywordFiles.get(0));
        }
        Path dynain = directory.resolve("dynain");
        if (isUsable(dynain)) {
            return Optional.of(dynain);
        }
        return listBySuffix(directory, ".dyn").stream().findFirst();
    }

    private static List<Path> listBySuffix(Path directory, String suffix) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .filter(RunBundleScanner::isUsable)
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + directory, e);
        }
    }

    private static boolean isUsable(Path path) {
        try {
            return Files.isRegularFile(path) && Files.size(path) > 0;
        } catch (IOException e) {
            log.debug("Cannot stat {}: {}", path, e.getMessage());
            return false;
        }
    }

    private static Map<InputKind, List<String>> fixedNames() {
        Map<InputKind, List<String>> names = new EnumMap<>(InputKind.class);
        names.put(InputKind.HSP, List.of("d3hsp"));
        names.put(InputKind.GLSTAT, List.of("glstat"));
        names.put(InputKind.STATUS, List.of("status.out"));
        names.put(InputKind.MATSUM, List.of("matsum"));
        names.put(InputKind.MESSAGE, List.of("messag", "message", "MESSAG"));
        names.put(InputKind.NODOUT, List.of("nodout"));
        names.put(InputKind.BNDOUT, List.of("bndout"));
        names.put(InputKind.LOAD_PROFILE, List.of("load_profile.csv"));
        names.put(InputKind.CONTACT_PROFILE, List.of("cont_profile.csv"));
        return names;
    }
}
