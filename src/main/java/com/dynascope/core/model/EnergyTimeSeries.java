package com.dynascope.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered energy samples of one run. Built append-only by {@link Builder},
 * immutable afterwards.
 */
public record EnergyTimeSeries(List<EnergySample> samples) implements Serializable {

    public EnergyTimeSeries {
        samples = List.copyOf(samples);
    }

    public static EnergyTimeSeries empty() {
        return new EnergyTimeSeries(List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int size() {
        return samples.size();
    }

    public Optional<EnergySample> first() {
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(0));
    }

    public Optional<EnergySample> last() {
        return samples.isEmpty() ? Optional.empty() : Optional.of(samples.get(samples.size() - 1));
    }

    public static final class Builder {

        private final List<EnergySample> samples = new ArrayList<>();

        private Builder() {}

        public Builder append(EnergySample sample) {
            samples.add(sample);
            return this;
        }

        public EnergyTimeSeries build() {
            return new EnergyTimeSeries(samples);
        }
    }
}
