package com.dynascope.core.engine;

import com.dynascope.core.analysis.TimeHistorySource;
import com.dynascope.core.events.DiagnosisEvent;
import com.dynascope.core.events.EventBus;
import com.dynascope.core.logging.MdcContext;
import com.dynascope.core.mapping.ElementPartMapper;
import com.dynascope.core.metrics.DiagnosisMetrics;
import com.dynascope.core.model.ContactTable;
import com.dynascope.core.model.Coverage;
import com.dynascope.core.model.ElementAssociation;
import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.EnergyTimeSeries;
import com.dynascope.core.model.InitialPenetration;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.InterfaceLoadSample;
import com.dynascope.core.model.InterfaceWarningCount;
import com.dynascope.core.model.MaterialSample;
import com.dynascope.core.model.MemoryRequest;
import com.dynascope.core.model.ModelSummary;
import com.dynascope.core.model.ParsedRun;
import com.dynascope.core.model.PartTable;
import com.dynascope.core.model.PerformanceProfile;
import com.dynascope.core.model.ProcessorLoadSample;
import com.dynascope.core.model.RunBundle;
import com.dynascope.core.model.SmallestTimestep;
import com.dynascope.core.model.StatusSample;
import com.dynascope.core.model.TerminationMarker;
import com.dynascope.core.model.TerminationState;
import com.dynascope.core.model.TerminationStatus;
import com.dynascope.core.model.TimestepRecord;
import com.dynascope.core.model.WarningEvent;
import com.dynascope.core.parser.AnalysisCancelledException;
import com.dynascope.core.parser.BndoutReader;
import com.dynascope.core.parser.CancellationToken;
import com.dynascope.core.parser.ContactProfileReader;
import com.dynascope.core.parser.GlstatReader;
import com.dynascope.core.parser.HspReader;
import com.dynascope.core.parser.KeywordDeckReader;
import com.dynascope.core.parser.LineRecordReader;
import com.dynascope.core.parser.LoadProfileReader;
import com.dynascope.core.parser.MatsumReader;
import com.dynascope.core.parser.MessageReader;
import com.dynascope.core.parser.NodoutReader;
import com.dynascope.core.parser.StatusReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

/**
 * Drives every reader of a {@link RunBundle} to completion, one task per file, and
 * joins their outputs into a {@link ParsedRun}.
 * <p>
 * Readers share no mutable state; the only exception is the input-deck task, which
 * fills the mapper builder that the joining thread completes afterwards. A reader
 * that fails with an I/O or data error marks its input unavailable instead of
 * failing the run. The time-history files are read here only to count their records;
 * analyzers stream them again through {@link TimeHistorySource}.
 */
@Service
public class RunReaders {

    private static final Logger log = LoggerFactory.getLogger(RunReaders.class);

    private static final List<InputKind> SINGLE_FILE_INPUTS = List.of(
            InputKind.HSP, InputKind.GLSTAT, InputKind.STATUS, InputKind.MATSUM, InputKind.LOAD_PROFILE,
            InputKind.CONTACT_PROFILE, InputKind.INPUT_DECK, InputKind.NODOUT, InputKind.BNDOUT);

    private final ExecutorService executor;
    private final EventBus eventBus;
    private final DiagnosisMetrics metrics;

    public RunReaders(ExecutorService diagnosisExecutor, EventBus eventBus, DiagnosisMetrics metrics) {
        this.executor = diagnosisExecutor;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /** Joined reader output of one run. */
    public record Result(ParsedRun run, ElementPartMapper mapper, TimeHistorySource timeHistory) {}

    /** One file to read. {@code rank} is only meaningful for message logs. */
    record Source(InputKind kind, int rank, String label, Path path) {}

    /** What a reader task produced; {@code failure} is non-null when the file could not be read. */
    record Outcome(Source source, List<Object> records, long emitted, long skipped, String failure) {

        boolean succeeded() {
            return failure == null;
        }
    }

    /**
     * @throws AnalysisCancelledException when cancellation is requested while reading
     */
    public Result read(String runId, RunBundle bundle, int maxTrackedNodes, CancellationToken cancellation) {
        List<Source> sources = sources(bundle);
        ElementPartMapper.Builder mapper = ElementPartMapper.builder();

        List<CompletableFuture<Outcome>> futures = new ArrayList<>();
        for (Source source : sources) {
            futures.add(CompletableFuture.supplyAsync(
                    () -> readSource(runId, source, mapper, maxTrackedNodes, cancellation), executor));
        }
        List<Outcome> outcomes = new ArrayList<>();
        for (CompletableFuture<Outcome> future : futures) {
            outcomes.add(DiagnosisEngine.join(future));
        }
        cancellation.throwIfCancelled();
        return merge(outcomes, mapper, maxTrackedNodes, cancellation);
    }

    /** Sources in a fixed order: single files by kind, then the primary message log, then ranks ascending. */
    static List<Source> sources(RunBundle bundle) {
        List<Source> sources = new ArrayList<>();
        for (InputKind kind : SINGLE_FILE_INPUTS) {
            bundle.path(kind).ifPresent(path ->
                    sources.add(new Source(kind, WarningEvent.UNRANKED, path.getFileName().toString(), path)));
        }
        bundle.path(InputKind.MESSAGE).ifPresent(path ->
                sources.add(new Source(InputKind.MESSAGE, WarningEvent.UNRANKED, path.getFileName().toString(), path)));
        for (Map.Entry<Integer, Path> entry : bundle.rankedMessages().entrySet()) {
            sources.add(new Source(InputKind.MESSAGE, entry.getKey(), entry.getValue().getFileName().toString(),
                    entry.getValue()));
        }
        return sources;
    }

    private Outcome readSource(String runId, Source source, ElementPartMapper.Builder mapper, int maxTrackedNodes,
                               CancellationToken cancellation) {
        MdcContext.setInput(runId, source.label());
        long started = System.nanoTime();
        try {
            List<Object> records = new ArrayList<>();
            Consumer<Object> sink = switch (source.kind()) {
                case NODOUT, BNDOUT -> ignored -> { };
                case INPUT_DECK -> association -> mapper.add((ElementAssociation) association);
                default -> records::add;
            };
            try (LineRecordReader<?> reader = open(source, maxTrackedNodes, cancellation)) {
                while (reader.hasNext()) {
                    sink.accept(reader.next());
                }
                log.info("Read {}: {} records, {} skipped", source.label(), reader.emittedRecords(),
                        reader.skippedRecords());
                metrics.recordSkippedRecords(source.kind().label(), reader.skippedRecords());
                eventBus.publish(new DiagnosisEvent("reader.completed", runId, source.label(),
                        Map.of("records", reader.emittedRecords(), "skipped", reader.skippedRecords()),
                        Instant.now()));
                return new Outcome(source, records, reader.emittedRecords(), reader.skippedRecords(), null);
            }
        } catch (AnalysisCancelledException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Cannot read {}, treating it as unavailable: {}", source.label(), e.getMessage());
            return new Outcome(source, List.of(), 0, 0, String.valueOf(e.getMessage()));
        } finally {
            metrics.recordReaderDuration(source.kind().label(), (System.nanoTime() - started) / 1_000_000);
            MdcContext.clear();
        }
    }

    private static LineRecordReader<?> open(Source source, int maxTrackedNodes, CancellationToken cancellation) {
        Path path = source.path();
        return switch (source.kind()) {
            case HSP -> HspReader.open(path, cancellation);
            case GLSTAT -> GlstatReader.open(path, cancellation);
            case STATUS -> StatusReader.open(path, cancellation);
            case MATSUM -> MatsumReader.open(path, cancellation);
            case MESSAGE -> MessageReader.open(path, source.rank(), cancellation);
            case NODOUT -> NodoutReader.open(path, maxTrackedNodes, cancellation);
            case BNDOUT -> BndoutReader.open(path, maxTrackedNodes, cancellation);
            case LOAD_PROFILE -> LoadProfileReader.open(path, cancellation);
            case CONTACT_PROFILE -> ContactProfileReader.open(path, cancellation);
            case INPUT_DECK -> KeywordDeckReader.open(path, cancellation);
        };
    }

    /**
     * Joins reader outputs. Energy comes from the global statistics log when it has
     * samples, otherwise from the high-speed-printer energy blocks; time-step records
     * follow the same source. Warnings come from the primary message log when it was
     * read, otherwise from the high-speed-printer log, plus every per-process log.
     */
    static Result merge(List<Outcome> outcomes, ElementPartMapper.Builder mapper, int maxTrackedNodes,
                        CancellationToken cancellation) {
        ParsedRun.Builder run = ParsedRun.builder();
        Set<InputKind> found = EnumSet.noneOf(InputKind.class);
        Map<InputKind, Long> skipped = new EnumMap<>(InputKind.class);
        List<Integer> messageRanks = new ArrayList<>();

        TerminationStatus hspTermination = null;
        List<EnergySample> hspEnergy = new ArrayList<>();
        List<TimestepRecord> hspTimesteps = new ArrayList<>();
        List<EnergySample> glstatEnergy = new ArrayList<>();
        List<SmallestTimestep> smallest = new ArrayList<>();
        List<WarningEvent> hspWarnings = new ArrayList<>();
        List<WarningEvent> primaryWarnings = new ArrayList<>();
        List<WarningEvent> rankedWarnings = new ArrayList<>();
        List<TerminationMarker> markers = new ArrayList<>();
        boolean primaryMessageRead = false;
        Path nodout = null;
        Path bndout = null;

        for (Outcome outcome : outcomes) {
            if (!outcome.succeeded()) {
                continue;
            }
            Source source = outcome.source();
            found.add(source.kind());
            skipped.merge(source.kind(), outcome.skipped(), Long::sum);
            switch (source.kind()) {
                case HSP -> {
                    for (Object record : outcome.records()) {
                        if (record instanceof ModelSummary model) {
                            run.model(model);
                        } else if (record instanceof TerminationStatus status) {
                            hspTermination = status;
                        } else if (record instanceof PartTable table) {
                            run.parts(table.parts());
                        } else if (record instanceof ContactTable table) {
                            run.contacts(table.contacts());
                        } else if (record instanceof PerformanceProfile profile) {
                            run.performance(profile);
                        } else if (record instanceof EnergySample sample) {
                            hspEnergy.add(sample);
                        } else if (record instanceof TimestepRecord timestep) {
                            hspTimesteps.add(timestep);
                        } else if (record instanceof SmallestTimestep row) {
                            smallest.add(row);
                        } else if (record instanceof WarningEvent event) {
                            hspWarnings.add(event);
                        }
                    }
                }
                case GLSTAT -> glstatEnergy.addAll(cast(outcome.records(), EnergySample.class));
                case STATUS -> run.status(cast(outcome.records(), StatusSample.class));
                case MATSUM -> run.materials(cast(outcome.records(), MaterialSample.class));
                case LOAD_PROFILE -> run.processorLoad(cast(outcome.records(), ProcessorLoadSample.class));
                case CONTACT_PROFILE -> run.interfaceLoad(cast(outcome.records(), InterfaceLoadSample.class));
                case NODOUT -> nodout = source.path();
                case BNDOUT -> bndout = source.path();
                case INPUT_DECK -> { }
                case MESSAGE -> {
                    if (source.rank() == WarningEvent.UNRANKED) {
                        primaryMessageRead = true;
                    } else {
                        messageRanks.add(source.rank());
                    }
                    List<WarningEvent> target = source.rank() == WarningEvent.UNRANKED ? primaryWarnings : rankedWarnings;
                    for (Object record : outcome.records()) {
                        if (record instanceof WarningEvent event) {
                            target.add(event);
                        } else if (record instanceof TerminationMarker marker) {
                            markers.add(marker);
                        } else if (record instanceof InitialPenetration penetration) {
                            run.addPenetrations(List.of(penetration));
                        } else if (record instanceof InterfaceWarningCount count) {
                            run.addInterfaceWarningCounts(List.of(count));
                        } else if (record instanceof MemoryRequest request) {
                            run.addMemoryRequests(List.of(request));
                        }
                    }
                }
            }
        }

        List<EnergySample> energy = glstatEnergy.isEmpty() ? hspEnergy : glstatEnergy;
        EnergyTimeSeries.Builder series = EnergyTimeSeries.builder();
        energy.forEach(series::append);
        run.energy(series.build());

        List<TimestepRecord> timesteps = new ArrayList<>();
        if (!glstatEnergy.isEmpty()) {
            for (EnergySample sample : glstatEnergy) {
                TimestepRecord record = TimestepRecord.from(sample);
                if (record != null) {
                    timesteps.add(record);
                }
            }
        }
        if (timesteps.isEmpty()) {
            timesteps = hspTimesteps;
        }
        run.timesteps(timesteps);
        run.smallestTimesteps(smallest);

        run.addWarnings(primaryMessageRead ? primaryWarnings : hspWarnings);
        run.addWarnings(rankedWarnings);
        run.termination(termination(hspTermination, markers, found));

        smallest.forEach(mapper::add);
        timesteps.forEach(mapper::add);

        List<InputKind> unavailable = new ArrayList<>();
        for (InputKind kind : InputKind.values()) {
            if (!found.contains(kind)) {
                unavailable.add(kind);
            }
        }
        run.coverage(new Coverage(List.copyOf(found), unavailable, messageRanks, skipped));

        return new Result(run.build(), mapper.build(),
                new FileTimeHistorySource(nodout, bndout, maxTrackedNodes, cancellation));
    }

    /**
     * The high-speed-printer status wins when it saw a banner. Otherwise an error
     * banner in any message log beats a normal one; with neither the run is incomplete.
     */
    static TerminationStatus termination(TerminationStatus hsp, List<TerminationMarker> markers, Set<InputKind> found) {
        if (hsp != null && hsp.state() != TerminationState.INCOMPLETE) {
            return hsp;
        }
        TerminationState fromMarkers = null;
        for (TerminationMarker marker : markers) {
            if (marker.state() == TerminationState.ERROR_TERMINATED) {
                fromMarkers = TerminationState.ERROR_TERMINATED;
                break;
            }
            fromMarkers = marker.state();
        }
        if (hsp != null) {
            if (fromMarkers == null) {
                return hsp;
            }
            return hsp.withState(fromMarkers, InputKind.MESSAGE);
        }
        if (fromMarkers != null) {
            return TerminationStatus.of(fromMarkers, InputKind.MESSAGE);
        }
        return found.contains(InputKind.MESSAGE) ? TerminationStatus.of(TerminationState.INCOMPLETE, InputKind.MESSAGE) : null;
    }

    private static <T> List<T> cast(List<Object> records, Class<T> type) {
        List<T> typed = new ArrayList<>(records.size());
        for (Object record : records) {
            typed.add(type.cast(record));
        }
        return typed;
    }
}
