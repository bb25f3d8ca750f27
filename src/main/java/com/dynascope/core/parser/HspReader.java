package com.dynascope.core.parser;

import com.dynascope.core.model.ComponentTiming;
import com.dynascope.core.model.ContactDefinition;
import com.dynascope.core.model.ContactTable;
import com.dynascope.core.model.ControlSettings;
import com.dynascope.core.model.DecompositionMetrics;
import com.dynascope.core.model.EnergySample;
import com.dynascope.core.model.InputKind;
import com.dynascope.core.model.InterfaceTiming;
import com.dynascope.core.model.MassProperty;
import com.dynascope.core.model.ModelSummary;
import com.dynascope.core.model.PartDefinition;
import com.dynascope.core.model.PartTable;
import com.dynascope.core.model.PerformanceProfile;
import com.dynascope.core.model.ProcessorTiming;
import com.dynascope.core.model.RunRecord;
import com.dynascope.core.model.SimulationHeader;
import com.dynascope.core.model.SmallestTimestep;
import com.dynascope.core.model.TerminationState;
import com.dynascope.core.model.TerminationStatus;
import com.dynascope.core.model.TimestepRecord;
import com.dynascope.core.model.WarningEvent;

import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the high-speed-printer log ({@code d3hsp}).
 * <p>
 * The file is walked as a state machine over its {@link Section}s. Spaced-out
 * banners ({@code c o n t r o l   i n f o r m a t i o n}, ...) move the machine
 * between sections; the first warning or energy block after the structural
 * sections opens {@link Section#WARNINGS}, the timing and termination banners
 * open {@link Section#TERMINATION}. Lines that no handler recognises are ignored.
 * <p>
 * Emits {@link PartTable} and {@link ContactTable} when their sections close,
 * {@link ModelSummary}, {@link PerformanceProfile} and {@link TerminationStatus}
 * once at end of file, and {@link EnergySample}, {@link TimestepRecord},
 * {@link SmallestTimestep} and {@link WarningEvent} as they are read.
 */
public class HspReader extends LineRecordReader<RunRecord> {

    public enum Section {
        HEADER,
        MODEL_STATS,
        TIMESTEP_CONTROL,
        PART_TABLE,
        CONTACT_TABLE,
        MASS_PROPERTIES,
        WARNINGS,
        TERMINATION
    }

    /** Sections that precede the cycle output; a warning or energy block ends them. */
    private static final EnumSet<Section> PREAMBLE = EnumSet.of(Section.HEADER, Section.MODEL_STATS,
            Section.TIMESTEP_CONTROL, Section.PART_TABLE, Section.CONTACT_TABLE, Section.MASS_PROPERTIES);

    // ── Banners ──
    private static final String KEYWORD_COUNTS_BANNER = "L I S T   O F   K E Y W O R D   C O U N T S";
    private static final String CONTROL_BANNER = "c o n t r o l   i n f o r m a t i o n";
    private static final String PART_BANNER = "p a r t   d e f i n i t i o n s";
    private static final String CONTACT_BANNER = "c o n t a c t   i n t e r f a c e s";
    private static final String TIMING_BANNER = "T i m i n g   i n f o r m a t i o n";
    private static final String CPU_TIMING_BANNER = "C P U   T i m i n g";
    private static final Pattern NORMAL_TERMINATION = Pattern.compile("N o r m a l\\s+t e r m i n a t i o n");
    private static final Pattern ERROR_TERMINATION = Pattern.compile("E r r o r\\s+t e r m i n a t i o n");
    private static final Pattern TERMINATION_REACHED = Pattern.compile("\\*\\*\\*\\s+termination time reached\\s+\\*\\*\\*");
    private static final Pattern MASS_HEADER = Pattern.compile("m a s s\\s+p r o p e r t i e s\\s+o f\\s+p a r t\\s*#\\s*(\\d+)");

    // ── Header ──
    private static final Pattern RUN_DATE = Pattern.compile("^\\s+Date:\\s+(\\S+)\\s+Time:\\s+(\\S+)");
    private static final Pattern INPUT_FILE = Pattern.compile("Input file:\\s*(\\S+)");
    private static final Pattern COMMAND_LINE_INPUT = Pattern.compile("Command line options:\\s*i=(\\S+)");
    private static final Pattern MPP_PROCESSORS = Pattern.compile("(?:MPP|Parallel)\\s+execution with\\s+(\\d+)\\s+(?:MPP\\s+)?procs?");
    private static final Map<String, Pattern> HEADER_FIELDS = new LinkedHashMap<>();

    static {
        HEADER_FIELDS.put("version", boxed("Version\\s*"));
        HEADER_FIELDS.put("revision", boxed("Revision\\s*"));
        HEADER_FIELDS.put("platform", boxed("Platform\\s+"));
        HEADER_FIELDS.put("osLevel", boxed("OS Level\\s+"));
        HEADER_FIELDS.put("compiler", boxed("Compiler\\s+"));
        HEADER_FIELDS.put("hostname", boxed("Hostname\\s+"));
        HEADER_FIELDS.put("precision", boxed("Precision\\s+"));
        HEADER_FIELDS.put("licensee", Pattern.compile("^\\s*\\|\\s+Licensed to:\\s*(.+?)\\s*\\|"));
    }

    // ── Model statistics and controls ──
    private static final Pattern KEYWORD_COUNT = Pattern.compile("total # of \\*([A-Za-z_0-9/,.+\\-()\\s]+?)\\.{2,}\\s+(\\d+)");
    private static final Map<String, Pattern> MODEL_FIELDS = new LinkedHashMap<>();

    static {
        MODEL_FIELDS.put("materials", Pattern.compile("number of materials or property sets\\.+\\s+(\\d+)"));
        MODEL_FIELDS.put("nodes", Pattern.compile("number of nodal\\+scalar points\\.+\\s+(\\d+)"));
        MODEL_FIELDS.put("solids", Pattern.compile("number of solid elements\\.+\\s+(\\d+)"));
        MODEL_FIELDS.put("shells", Pattern.compile("number of shell elements\\.+\\s+(\\d+)"));
        MODEL_FIELDS.put("beams", Pattern.compile("number of beam elements\\.+\\s+(\\d+)"));
        MODEL_FIELDS.put("thickShells", Pattern.compile("number of thick shell elements\\.+\\s+(\\d+)"));
        MODEL_FIELDS.put("sph", Pattern.compile("number of SPH particles\\.+\\s+(\\d+)"));
        MODEL_FIELDS.put("contacts", Pattern.compile("number of (?:number of )?contact definitions\\.+\\s+(\\d+)"));
        MODEL_FIELDS.put("spc", Pattern.compile("number of spc nodes\\.+\\s+(\\d+)"));
    }

    private static final Pattern TERMINATION_TIME = Pattern.compile("termination time\\.+\\s+(\\S+)");
    private static final Pattern TIMESTEP_SCALE = Pattern.compile("time step scale factor\\.+\\s+(\\S+)");
    private static final Pattern MASS_SCALING_DT = Pattern.compile("time step size for mass scaled solution.*?\\.+\\s+(\\S+)");
    private static final Pattern MINIMUM_TIMESTEP = Pattern.compile("reduction factor for minimum time step.*?\\.+\\s+(\\S+)");

    // ── Contacts ──
    private static final Pattern CONTACT_SUMMARY_ROW = Pattern.compile("^\\s+(\\d+)\\s+(\\d+)\\s+([oa]?\\s*\\d+)\\s+(.*?)\\s*$");
    private static final Pattern CONTACT_HEADER = Pattern.compile("Contact Interface\\s+(\\d+)");
    private static final Pattern CONTACT_TYPE = Pattern.compile("contact type\\.+\\s+(\\d+)");

    // ── Cycle output ──
    private static final Pattern SMALLEST_ROW = Pattern.compile("^\\s*(solid|shell|beam|tshell)\\s+(\\d+)\\s+(\\d+)\\s+(\\S+)");
    private static final Pattern CYCLE_PROGRESS = Pattern.compile("^\\s*(\\d+)\\s+t\\s+(\\S+)\\s+dt\\s+(\\S+)");

    // ── Tail ──
    private static final Pattern TIMING_ROW = Pattern.compile("^\\s{0,6}(\\S.*?)\\s*\\.{2,}\\s*(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s*$");
    private static final Pattern INTERFACE_ROW = Pattern.compile("^\\s*Interf\\.\\s+ID\\s+(\\d+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)");
    private static final Pattern PROCESSOR_ROW = Pattern.compile("^\\s*#\\s*(\\d+)\\s+(\\S+)\\s+(\\S+)\\s+(\\S+)");
    private static final Pattern DECOMPOSITION_MIN = Pattern.compile("Min(?:i|u)mum:\\s+(\\S+)");
    private static final Pattern DECOMPOSITION_MAX = Pattern.compile("Maximum:\\s+(\\S+)");
    private static final Pattern DECOMPOSITION_STDDEV = Pattern.compile("Standard Deviation:\\s+(\\S+)");
    private static final Pattern DECOMPOSITION_MEMORY = Pattern.compile("Memory required for decomposition\\s*:\\s+(\\d+)");
    private static final Pattern DYNAMIC_MEMORY = Pattern.compile("Additional dynamic memory required\\s*:\\s+(\\d+)");
    private static final Pattern PROBLEM_TIME = Pattern.compile("Problem time\\s+=\\s+(\\S+)");
    private static final Pattern PROBLEM_CYCLE = Pattern.compile("Problem cycle\\s+=\\s+(\\d+)");
    private static final Pattern TOTAL_CPU = Pattern.compile("Total CPU time\\s+=\\s+(\\S+)\\s+seconds");
    private static final Pattern CPU_PER_ZONE = Pattern.compile("CPU time per zone cycle\\s*=\\s+(\\S+)\\s+nanoseconds");
    private static final Pattern CLOCK_PER_ZONE = Pattern.compile("Clock time per zone cycle\\s*=\\s+(\\S+)\\s+nanoseconds");
    private static final Pattern START_TIME = Pattern.compile("Start time\\s+(\\d{2}/\\d{2}/\\d{4}\\s+\\d{2}:\\d{2}:\\d{2})");
    private static final Pattern END_TIME = Pattern.compile("End time\\s+(\\d{2}/\\d{2}/\\d{4}\\s+\\d{2}:\\d{2}:\\d{2})");
    private static final Pattern ELAPSED = Pattern.compile("Elapsed time\\s+(\\S+)\\s+seconds");

    // ── Mass properties ──
    private static final Pattern MASS_TOTAL = Pattern.compile("total mass of part\\s*=\\s*(\\S+)");
    private static final Pattern MASS_CENTER = Pattern.compile("([xyz])-coordinate of mass center\\s*=\\s*(\\S+)");
    private static final Pattern INERTIA = Pattern.compile("\\bi(11|22|33)\\s*=\\s*(\\S+)");

    private final EnergyBlockParser energyBlock = new EnergyBlockParser(InputKind.HSP);
    private final WarningBlockParser warningBlock = new WarningBlockParser(InputKind.HSP, WarningEvent.UNRANKED);

    private Section section = Section.HEADER;

    private final Map<String, String> header = new LinkedHashMap<>();
    private int processors;
    private final Map<String, Integer> keywordCounts = new TreeMap<>();
    private final Map<String, Long> modelCounts = new LinkedHashMap<>();
    private double terminationTime;
    private double timestepScale;
    private double massScalingDt;
    private double minimumTimestepFactor;

    private final List<String> partBlock = new ArrayList<>();
    private final List<PartDefinition> parts = new ArrayList<>();
    private boolean partTableEmitted;

    private final List<ContactDefinition> contacts = new ArrayList<>();
    private final Map<Integer, Integer> declaredContactTypes = new LinkedHashMap<>();
    private Integer lastDeclaredContact;
    private boolean inContactSummary;
    private boolean contactTableEmitted;

    private final List<MassProperty> massProperties = new ArrayList<>();
    private MassAccumulator mass;

    private boolean inSmallestTable;

    private boolean inTiming;
    private boolean inCpuTiming;
    private final List<ComponentTiming> components = new ArrayList<>();
    private final List<InterfaceTiming> interfaceTimings = new ArrayList<>();
    private final List<ProcessorTiming> processorTimings = new ArrayList<>();
    private double decompositionMin;
    private double decompositionMax;
    private double decompositionStdDev;
    private long decompositionMemory;
    private long dynamicMemory;

    private TerminationState terminationState;
    private long problemCycle;
    private double problemTime;
    private long progressCycle;
    private double progressTime;
    private double cpuSeconds;
    private double elapsedSeconds;
    private double cpuPerZone;
    private double clockPerZone;
    private String startedAt = "";
    private String endedAt = "";
    private int lastErrorCode;

    public HspReader(Reader reader, String sourceName, CancellationToken cancellation) {
        super(reader, InputKind.HSP, sourceName, cancellation);
    }

    public static HspReader open(Path path, CancellationToken cancellation) {
        return new HspReader(openFile(path), path.getFileName().toString(), cancellation);
    }

    /** The section the machine is currently in. */
    public Section section() {
        return section;
    }

    @Override
    protected void onLine(String line) {
        if (transition(line)) {
            return;
        }
        switch (section) {
            case HEADER -> onHeader(line);
            case MODEL_STATS -> onModelStats(line);
            case TIMESTEP_CONTROL -> onControl(line);
            case PART_TABLE -> onPartTable(line);
            case CONTACT_TABLE -> onContactTable(line);
            case MASS_PROPERTIES -> onMassProperties(line);
            case WARNINGS -> onCycleOutput(line);
            case TERMINATION -> onTail(line);
        }
    }

    @Override
    protected void onEnd() {
        leave(section);
        emitPartTable();
        emitContactTable();
        emit(buildModelSummary());
        emit(new PerformanceProfile(components, interfaceTimings, processorTimings,
                new DecompositionMetrics(decompositionMin, decompositionMax, decompositionStdDev,
                        decompositionMemory, dynamicMemory)));
        emit(buildTermination());
    }

    // ── Transitions ──

    /**
     * Applies banner-driven transitions.
     *
     * @return true when the line was consumed as a banner
     */
    private boolean transition(String line) {
        if (line.contains(KEYWORD_COUNTS_BANNER)) {
            enter(Section.MODEL_STATS);
            return true;
        }
        if (line.contains(CONTROL_BANNER)) {
            enter(Section.TIMESTEP_CONTROL);
            return true;
        }
        if (line.contains(PART_BANNER)) {
            enter(Section.PART_TABLE);
            return true;
        }
        if (line.contains(CONTACT_BANNER)) {
            enter(Section.CONTACT_TABLE);
            return true;
        }
        if (line.contains("m a s s")) {
            Matcher m = MASS_HEADER.matcher(line);
            if (m.find()) {
                enter(Section.MASS_PROPERTIES);
                finishMass();
                mass = new MassAccumulator(Numbers.parseIntOr(m.group(1), 0));
                return true;
            }
        }
        if (line.contains(TIMING_BANNER)) {
            enter(Section.TERMINATION);
            inTiming = true;
            inCpuTiming = false;
            return true;
        }
        if (line.contains(CPU_TIMING_BANNER)) {
            enter(Section.TERMINATION);
            inCpuTiming = true;
            inTiming = false;
            return true;
        }
        if (line.contains("t e r m i n a t i o n")) {
            if (NORMAL_TERMINATION.matcher(line).find()) {
                terminationState = TerminationState.NORMAL;
                enter(Section.TERMINATION);
                return true;
            }
            if (ERROR_TERMINATION.matcher(line).find()) {
                terminationState = TerminationState.ERROR_TERMINATED;
                enter(Section.TERMINATION);
                return true;
            }
        }
        if (PREAMBLE.contains(section)
                && (line.contains("dt of cycle") || WarningBlockParser.isHeader(line))) {
            enter(Section.WARNINGS);
        }
        return false;
    }

    private void enter(Section next) {
        if (next != section) {
            leave(section);
            section = next;
        }
    }

    private void leave(Section current) {
        switch (current) {
            case PART_TABLE -> {
                flushPartBlock();
                emitPartTable();
            }
            case CONTACT_TABLE -> {
                inContactSummary = false;
                emitContactTable();
            }
            case MASS_PROPERTIES -> finishMass();
            case WARNINGS, TERMINATION -> {
                closeEnergyBlock();
                closeWarningBlock();
                inSmallestTable = false;
                if (current == Section.TERMINATION) {
                    finishMass();
                }
            }
            default -> {
            }
        }
    }

    // ── Structural sections ──

    private void onHeader(String line) {
        Matcher m = RUN_DATE.matcher(line);
        if (m.find()) {
            header.put("date", m.group(1));
            header.put("time", m.group(2));
            return;
        }
        for (Map.Entry<String, Pattern> field : HEADER_FIELDS.entrySet()) {
            m = field.getValue().matcher(line);
            if (m.find()) {
                header.put(field.getKey(), m.group(1));
                return;
            }
        }
        m = INPUT_FILE.matcher(line);
        if (m.find()) {
            header.put("inputFile", m.group(1));
            return;
        }
        m = COMMAND_LINE_INPUT.matcher(line);
        if (m.find()) {
            header.putIfAbsent("inputFile", m.group(1));
            return;
        }
        scanProcessors(line);
    }

    private void onModelStats(String line) {
        Matcher m = KEYWORD_COUNT.matcher(line);
        if (m.find()) {
            String keyword = m.group(1).trim();
            int count = Numbers.parseIntOr(m.group(2), 0);
            if (count > 0) {
                keywordCounts.put(keyword, count);
            }
            return;
        }
        scanModelCounts(line);
        scanProcessors(line);
    }

    private void onControl(String line) {
        if (scanModelCounts(line)) {
            return;
        }
        Matcher m = TERMINATION_TIME.matcher(line);
        if (m.find()) {
            terminationTime = Numbers.parseDoubleOr(m.group(1), terminationTime);
        }
        m = TIMESTEP_SCALE.matcher(line);
        if (m.find()) {
            timestepScale = Numbers.parseDoubleOr(m.group(1), timestepScale);
        }
        m = MASS_SCALING_DT.matcher(line);
        if (m.find()) {
            massScalingDt = Numbers.parseDoubleOr(m.group(1), massScalingDt);
        }
        m = MINIMUM_TIMESTEP.matcher(line);
        if (m.find()) {
            minimumTimestepFactor = Numbers.parseDoubleOr(m.group(1), minimumTimestepFactor);
        }
        scanProcessors(line);
    }

    private boolean scanModelCounts(String line) {
        if (!line.contains("number of")) {
            return false;
        }
        for (Map.Entry<String, Pattern> field : MODEL_FIELDS.entrySet()) {
            Matcher m = field.getValue().matcher(line);
            if (m.find()) {
                modelCounts.put(field.getKey(), Numbers.parseLongOr(m.group(1), 0));
                return true;
            }
        }
        return false;
    }

    private void scanProcessors(String line) {
        Matcher m = MPP_PROCESSORS.matcher(line);
        if (m.find()) {
            processors = Numbers.parseIntOr(m.group(1), processors);
        }
    }

    private void onPartTable(String line) {
        if (PartBlockParser.SEPARATOR.matcher(line).find()) {
            flushPartBlock();
        } else {
            partBlock.add(line);
        }
    }

    private void flushPartBlock() {
        if (partBlock.isEmpty()) {
            return;
        }
        PartDefinition part = PartBlockParser.parse(partBlock);
        if (part != null) {
            parts.add(part);
        }
        partBlock.clear();
    }

    private void emitPartTable() {
        if (!partTableEmitted) {
            partTableEmitted = true;
            emit(new PartTable(parts));
        }
    }

    private void onContactTable(String line) {
        if (line.contains("Contact summary")) {
            inContactSummary = true;
            return;
        }
        if (inContactSummary) {
            if (line.contains("Order #")) {
                return;
            }
            Matcher m = CONTACT_SUMMARY_ROW.matcher(line);
            if (m.matches()) {
                addSummaryRow(m);
                return;
            }
            if (PartBlockParser.SEPARATOR.matcher(line).find()) {
                inContactSummary = false;
                return;
            }
        }
        Matcher m = CONTACT_HEADER.matcher(line);
        if (m.find()) {
            lastDeclaredContact = Numbers.parseIntOr(m.group(1), 0);
            declaredContactTypes.putIfAbsent(lastDeclaredContact, 0);
            return;
        }
        m = CONTACT_TYPE.matcher(line);
        if (m.find() && lastDeclaredContact != null) {
            declaredContactTypes.put(lastDeclaredContact, Numbers.parseIntOr(m.group(1), 0));
        }
    }

    private void addSummaryRow(Matcher m) {
        String typeCode = m.group(3).trim();
        String[] typeParts = typeCode.split("\\s+");
        String prefix = typeParts.length == 2 ? typeParts[0] : "";
        int typeNumber = Numbers.parseIntOr(typeParts[typeParts.length - 1], 0);
        contacts.add(new ContactDefinition(
                Numbers.parseIntOr(m.group(1), 0),
                Numbers.parseIntOr(m.group(2), 0),
                typeCode,
                typeNumber,
                prefix,
                m.group(4).trim()));
    }

    private void emitContactTable() {
        if (contactTableEmitted) {
            return;
        }
        contactTableEmitted = true;
        List<ContactDefinition> table = new ArrayList<>(contacts);
        if (table.isEmpty()) {
            int order = 1;
            for (Map.Entry<Integer, Integer> declared : declaredContactTypes.entrySet()) {
                int type = declared.getValue();
                table.add(new ContactDefinition(order++, declared.getKey(), String.valueOf(type), type, "", ""));
            }
        }
        emit(new ContactTable(table));
    }

    private void onMassProperties(String line) {
        if (mass == null) {
            return;
        }
        Matcher m = MASS_TOTAL.matcher(line);
        if (m.find()) {
            mass.total = Numbers.parseDoubleOr(m.group(1), 0.0);
            return;
        }
        m = MASS_CENTER.matcher(line);
        if (m.find()) {
            double value = Numbers.parseDoubleOr(m.group(2), 0.0);
            switch (m.group(1)) {
                case "x" -> mass.centerX = value;
                case "y" -> mass.centerY = value;
                default -> mass.centerZ = value;
            }
            return;
        }
        m = INERTIA.matcher(line);
        while (m.find()) {
            double value = Numbers.parseDoubleOr(m.group(2), 0.0);
            switch (m.group(1)) {
                case "11" -> mass.i11 = value;
                case "22" -> mass.i22 = value;
                default -> mass.i33 = value;
            }
        }
    }

    private void finishMass() {
        if (mass != null) {
            massProperties.add(mass.build());
            mass = null;
        }
    }

    // ── Cycle output ──

    private void onCycleOutput(String line) {
        if (handleWarning(line)) {
            return;
        }
        if (line.contains("dt of cycle")) {
            closeEnergyBlock();
            energyBlock.tryOpen(line);
            return;
        }
        if (energyBlock.isOpen()) {
            if (line.isBlank()) {
                if (energyBlock.hasFields()) {
                    closeEnergyBlock();
                }
                return;
            }
            if (energyBlock.accept(line)) {
                return;
            }
        }
        if (line.contains("100 smallest timesteps")) {
            inSmallestTable = true;
            return;
        }
        if (inSmallestTable) {
            Matcher m = SMALLEST_ROW.matcher(line);
            if (m.find()) {
                addSmallestRow(m);
                return;
            }
            if (line.isBlank()) {
                return;
            }
            inSmallestTable = false;
        }
        Matcher m = CYCLE_PROGRESS.matcher(line);
        if (m.find()) {
            progressCycle = Numbers.parseLongOr(m.group(1), progressCycle);
            progressTime = Numbers.parseDoubleOr(m.group(2), progressTime);
            return;
        }
        if (line.contains("termination time reached") && TERMINATION_REACHED.matcher(line).find()) {
            terminationState = TerminationState.NORMAL;
            return;
        }
        scanSummary(line);
    }

    private boolean handleWarning(String line) {
        if (WarningBlockParser.isHeader(line)) {
            closeWarningBlock();
            closeEnergyBlock();
            try {
                warningBlock.open(line);
                Matcher m = WarningBlockParser.HEADER.matcher(line);
                if (m.find() && "Error".equals(m.group(1))) {
                    lastErrorCode = Numbers.parseIntOr(m.group(2), lastErrorCode);
                }
            } catch (NumberFormatException e) {
                skip("warning header with unparseable code");
            }
            return true;
        }
        if (!warningBlock.isOpen()) {
            return false;
        }
        if (line.isBlank()) {
            if (warningBlock.contextLines() > 0) {
                closeWarningBlock();
            }
            return true;
        }
        if (line.contains("dt of cycle")) {
            closeWarningBlock();
            return false;
        }
        if (warningBlock.namesAnotherFailingElement(line)) {
            emit(warningBlock.split(line));
            return true;
        }
        warningBlock.addContext(line);
        if (warningBlock.isFull()) {
            closeWarningBlock();
        }
        return true;
    }

    private void closeWarningBlock() {
        if (warningBlock.isOpen()) {
            emit(warningBlock.close());
        }
    }

    private void closeEnergyBlock() {
        if (!energyBlock.isOpen()) {
            return;
        }
        EnergySample sample = energyBlock.close();
        if (sample == null) {
            skip("energy block without parseable time/kinetic/internal/total");
            return;
        }
        emit(sample);
        TimestepRecord timestep = TimestepRecord.from(sample);
        if (timestep != null) {
            emit(timestep);
        }
    }

    private void addSmallestRow(Matcher m) {
        try {
            emit(new SmallestTimestep(m.group(1), Numbers.parseLong(m.group(2)),
                    Numbers.parseInt(m.group(3)), Numbers.parseDouble(m.group(4))));
        } catch (NumberFormatException e) {
            skip("smallest timestep row with unparseable value");
        }
    }

    // ── Tail ──

    private void onTail(String line) {
        if (handleWarning(line)) {
            return;
        }
        if (inTiming) {
            if (line.contains("T o t a l s") && !line.contains("C P U")) {
                inTiming = false;
                return;
            }
            if (addTimingRow(line)) {
                return;
            }
        }
        if (inCpuTiming) {
            if (line.contains("T o t a l s")) {
                inCpuTiming = false;
                return;
            }
            Matcher m = PROCESSOR_ROW.matcher(line);
            if (m.find()) {
                try {
                    processorTimings.add(new ProcessorTiming(Numbers.parseInt(m.group(1)), m.group(2),
                            Numbers.parseDouble(m.group(3)), Numbers.parseDouble(m.group(4))));
                } catch (NumberFormatException e) {
                    skip("processor timing row with unparseable value");
                }
                return;
            }
        }
        if (mass != null) {
            onMassProperties(line);
        }
        scanSummary(line);
    }

    private boolean addTimingRow(String line) {
        Matcher m = INTERFACE_ROW.matcher(line);
        if (m.find()) {
            try {
                interfaceTimings.add(new InterfaceTiming(Numbers.parseInt(m.group(1)),
                        Numbers.parseDouble(m.group(2)), Numbers.parseDouble(m.group(3)),
                        Numbers.parseDouble(m.group(4)), Numbers.parseDouble(m.group(5))));
            } catch (NumberFormatException e) {
                skip("interface timing row with unparseable value");
            }
            return true;
        }
        m = TIMING_ROW.matcher(line);
        if (!m.find()) {
            return false;
        }
        try {
            components.add(new ComponentTiming(m.group(1).trim(),
                    Numbers.parseDouble(m.group(2)), Numbers.parseDouble(m.group(3)),
                    Numbers.parseDouble(m.group(4)), Numbers.parseDouble(m.group(5))));
        } catch (NumberFormatException e) {
            skip("timing row with unparseable value");
        }
        return true;
    }

    /** End-of-run summary and decomposition lines; they appear in the body of MPP runs as well. */
    private void scanSummary(String line) {
        Matcher m;
        if (line.contains("imum:") || line.contains("Standard Deviation:")) {
            if ((m = DECOMPOSITION_MIN.matcher(line)).find()) {
                decompositionMin = Numbers.parseDoubleOr(m.group(1), decompositionMin);
            } else if ((m = DECOMPOSITION_MAX.matcher(line)).find()) {
                decompositionMax = Numbers.parseDoubleOr(m.group(1), decompositionMax);
            } else if ((m = DECOMPOSITION_STDDEV.matcher(line)).find()) {
                decompositionStdDev = Numbers.parseDoubleOr(m.group(1), decompositionStdDev);
            }
        } else if ((m = DECOMPOSITION_MEMORY.matcher(line)).find()) {
            decompositionMemory = Numbers.parseLongOr(m.group(1), decompositionMemory);
        } else if ((m = DYNAMIC_MEMORY.matcher(line)).find()) {
            dynamicMemory = Numbers.parseLongOr(m.group(1), dynamicMemory);
        } else if ((m = PROBLEM_TIME.matcher(line)).find()) {
            problemTime = Numbers.parseDoubleOr(m.group(1), problemTime);
        } else if ((m = PROBLEM_CYCLE.matcher(line)).find()) {
            problemCycle = Numbers.parseLongOr(m.group(1), problemCycle);
        } else if ((m = TOTAL_CPU.matcher(line)).find()) {
            cpuSeconds = Numbers.parseDoubleOr(m.group(1), cpuSeconds);
        } else if ((m = CPU_PER_ZONE.matcher(line)).find()) {
            cpuPerZone = Numbers.parseDoubleOr(m.group(1), cpuPerZone);
        } else if ((m = CLOCK_PER_ZONE.matcher(line)).find()) {
            clockPerZone = Numbers.parseDoubleOr(m.group(1), clockPerZone);
        } else if ((m = START_TIME.matcher(line)).find()) {
            startedAt = m.group(1);
        } else if ((m = END_TIME.matcher(line)).find()) {
            endedAt = m.group(1);
        } else if ((m = ELAPSED.matcher(line)).find()) {
            elapsedSeconds = Numbers.parseDoubleOr(m.group(1), elapsedSeconds);
        }
    }

    // ── End-of-file records ──

    private ModelSummary buildModelSummary() {
        SimulationHeader simulationHeader = new SimulationHeader(
                header.getOrDefault("version", ""),
                header.getOrDefault("revision", ""),
                header.getOrDefault("date", ""),
                header.getOrDefault("time", ""),
                header.getOrDefault("platform", ""),
                header.getOrDefault("osLevel", ""),
                header.getOrDefault("compiler", ""),
                header.getOrDefault("hostname", ""),
                header.getOrDefault("precision", ""),
                header.getOrDefault("licensee", ""),
                header.getOrDefault("inputFile", ""),
                processors);
        int partCount = keywordCounts.entrySet().stream()
                .filter(e -> e.getKey().contains("PART_option card"))
                .mapToInt(Map.Entry::getValue)
                .findFirst()
                .orElse(parts.size());
        return new ModelSummary(
                simulationHeader,
                new ControlSettings(terminationTime, timestepScale, massScalingDt, minimumTimestepFactor),
                (int) count("materials"),
                count("nodes"),
                count("solids"),
                count("shells"),
                count("beams"),
                count("thickShells"),
                count("sph"),
                (int) count("contacts"),
                count("spc"),
                partCount,
                keywordCounts,
                massProperties);
    }

    private long count(String field) {
        return modelCounts.getOrDefault(field, 0L);
    }

    private TerminationStatus buildTermination() {
        TerminationState state = terminationState != null ? terminationState : TerminationState.INCOMPLETE;
        long cycles = problemCycle > 0 ? problemCycle : progressCycle;
        double reached = problemTime > 0.0 ? problemTime : progressTime;
        return new TerminationStatus(state, cycles, reached, terminationTime, cpuSeconds, elapsedSeconds,
                cpuPerZone, clockPerZone, startedAt, endedAt, lastErrorCode, InputKind.HSP);
    }

    private static Pattern boxed(String label) {
        return Pattern.compile("^\\s*\\|\\s+" + label + ":\\s*(.+?)\\s*\\|");
    }

    private static final class MassAccumulator {
        private final int partId;
        private double total;
        private double centerX;
        private double centerY;
        private double centerZ;
        private double i11;
        private double i22;
        private double i33;

        private MassAccumulator(int partId) {
            this.partId = partId;
        }

        private MassProperty build() {
            return new MassProperty(partId, total, centerX, centerY, centerZ, i11, i22, i33);
        }
    }
}
