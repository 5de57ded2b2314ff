package com.questrail.ucca.config;

import com.questrail.ucca.api.ControlCatalog;
import com.questrail.ucca.evaluate.SeverityPolicy;
import com.questrail.ucca.generate.TimingBoundPolicy;
import com.questrail.ucca.observability.EngineObservabilitySink;
import com.questrail.ucca.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for the temporal analysis engine.
 *
 * @param timingBounds      bounds attached to generated formulas
 * @param severities        severity assignment for violations
 * @param observabilitySink where engine events are reported
 * @param catalog           optional catalog used to phrase descriptions, or
 *                          {@code null}
 */
public record EngineConfig(
    TimingBoundPolicy timingBounds,
    SeverityPolicy severities,
    EngineObservabilitySink observabilitySink,
    ControlCatalog catalog
) {
    public EngineConfig {
        Objects.requireNonNull(timingBounds, "timingBounds");
        Objects.requireNonNull(severities, "severities");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
    }

    public Optional<ControlCatalog> catalogLookup() {
        return Optional.ofNullable(catalog);
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TimingBoundPolicy timingBounds = TimingBoundPolicy.defaults();
        private SeverityPolicy severities = SeverityPolicy.defaults();
        private EngineObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private ControlCatalog catalog;

        public Builder withTimingBounds(TimingBoundPolicy timingBounds) {
            this.timingBounds = timingBounds;
            return this;
        }

        public Builder withSeverities(SeverityPolicy severities) {
            this.severities = severities;
            return this;
        }

        public Builder withObservabilitySink(EngineObservabilitySink sink) {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withCatalog(ControlCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(timingBounds, severities, observabilitySink, catalog);
        }
    }
}
