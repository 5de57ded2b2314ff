package com.questrail.ucca.config;

import com.questrail.ucca.api.InMemoryControlCatalog;
import com.questrail.ucca.evaluate.Severity;
import com.questrail.ucca.evaluate.SeverityPolicy;
import com.questrail.ucca.formula.TimingConstraint;
import com.questrail.ucca.generate.TimingBoundPolicy;
import com.questrail.ucca.observability.NullObservabilitySink;
import com.questrail.ucca.observability.Slf4jObservabilitySink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineConfigTest {

    @Test
    void defaultsAreSilentAndCatalogFree() {
        EngineConfig config = EngineConfig.defaults();

        assertSame(NullObservabilitySink.INSTANCE, config.observabilitySink());
        assertEquals(TimingBoundPolicy.defaults(), config.timingBounds());
        assertEquals(SeverityPolicy.defaults(), config.severities());
        assertTrue(config.catalogLookup().isEmpty());
    }

    @Test
    void builderOverridesEachPart() {
        Slf4jObservabilitySink sink = new Slf4jObservabilitySink();
        InMemoryControlCatalog catalog = new InMemoryControlCatalog(List.of(), List.of());
        SeverityPolicy severities = SeverityPolicy.builder()
                .withSeverity(TimingConstraint.WRONG_ORDER, Severity.CRITICAL)
                .build();

        EngineConfig config = EngineConfig.builder()
                .withTimingBounds(TimingBoundPolicy.uniform(10))
                .withSeverities(severities)
                .withObservabilitySink(sink)
                .withCatalog(catalog)
                .build();

        assertEquals(TimingBoundPolicy.uniform(10), config.timingBounds());
        assertEquals(Severity.CRITICAL, config.severities().severityFor(TimingConstraint.WRONG_ORDER));
        assertSame(sink, config.observabilitySink());
        assertSame(catalog, config.catalogLookup().orElseThrow());
    }

    @Test
    void requiredPartsMustNotBeNull() {
        assertThrows(NullPointerException.class,
                () -> EngineConfig.builder().withObservabilitySink(null).build());
        assertThrows(NullPointerException.class,
                () -> EngineConfig.builder().withSeverities(null).build());
    }
}
