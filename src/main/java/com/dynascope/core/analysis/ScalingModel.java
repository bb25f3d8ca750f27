package com.dynascope.core.analysis;

import com.dynascope.core.model.ComponentTiming;
import com.dynascope.core.model.ScalingProjection;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Communication-overhead growth model for projecting run time at other core counts.
 * <p>
 * Measured component clock time is split into parallel work, communication and
 * serial work. At {@code r = target / current} the projected elapsed time is
 * {@code T * (parallel / r + communication * r^g + serial)}, with the three shares
 * summing to one. Components with an unrecognised name count half parallel and half serial.
 */
public final class ScalingModel {

    private static final List<String> COMMUNICATION = List.of("sharing", "shr", "share");
    private static final List<String> PARALLEL = List.of("element", "contact", "rigid");
    private static final List<String> SERIAL = List.of("keyword", "initialization", "decomposition", "init solver",
            "binary database", "ascii database", "sense switch", "group force", "time step size");

    /** Share of measured time in each class. */
    public record Split(double parallel, double communication, double serial) {}

    private ScalingModel() {}

    public static boolean isCommunication(String component) {
        return containsAny(component.toLowerCase(Locale.ROOT), COMMUNICATION);
    }

    /** Classifies the timing table; all shares are zero when no time was measured. */
    public static Split split(List<ComponentTiming> components) {
        double parallel = 0.0;
        double communication = 0.0;
        double serial = 0.0;
        for (ComponentTiming timing : components) {
            String name = timing.component().toLowerCase(Locale.ROOT);
            double seconds = Math.max(0.0, timing.clockSeconds());
            if (containsAny(name, COMMUNICATION)) {
                communication += seconds;
            } else if (containsAny(name, PARALLEL)) {
                parallel += seconds;
            } else if (containsAny(name, SERIAL)) {
                serial += seconds;
            } else {
                parallel += seconds * 0.5;
                serial += seconds * 0.5;
            }
        }
        double total = parallel + communication + serial;
        if (total <= 0.0) {
            return new Split(0.0, 0.0, 0.0);
        }
        return new Split(parallel / total, communication / total, serial / total);
    }

    /**
     * Projects every target core count above {@code currentCores}.
     *
     * @param elapsedSeconds measured wall-clock time of the run at {@code currentCores}
     * @param growthExponent exponent g of the communication growth term
     */
    public static List<ScalingProjection> project(Split split, int currentCores, double elapsedSeconds,
                                                  List<Integer> targets, double growthExponent) {
        List<ScalingProjection> projections = new ArrayList<>();
        if (currentCores < 1 || elapsedSeconds <= 0.0
                || split.parallel() + split.communication() + split.serial() <= 0.0) {
            return projections;
        }
        for (int target : targets.stream().sorted().distinct().toList()) {
            if (target <= currentCores) {
                continue;
            }
            double ratio = (double) target / currentCores;
            double communication = split.communication() * Math.pow(ratio, growthExponent);
            double relative = split.parallel() / ratio + communication + split.serial();
            double projected = elapsedSeconds * relative;
            double speedup = 1.0 / relative;
            double efficiency = speedup / ratio;
            projections.add(new ScalingProjection(target, projected, speedup, efficiency,
                    communication / relative, ScalingProjection.classify(efficiency)));
        }
        return projections;
    }

    private static boolean containsAny(String name, List<String> needles) {
        for (String needle : needles) {
            if (name.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
