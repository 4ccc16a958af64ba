package com.acme.perfgate.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DerivedMetricsTest {

    @Test
    void shouldBeZeroWhenThroughputIsZero() {
        assertEquals(0d, DerivedMetrics.cpuPerKiloRps(95d, 0d));
    }

    @Test
    void shouldStayConstantWhenCpuAndThroughputScaleTogether() {
        double base = DerivedMetrics.cpuPerKiloRps(50d, 10_000d);
        assertEquals(5d, base, 1e-9);
        assertEquals(base, DerivedMetrics.cpuPerKiloRps(100d, 20_000d), 1e-9);
        assertEquals(base, DerivedMetrics.cpuPerKiloRps(25d, 5_000d), 1e-9);
    }

    @Test
    void shouldDeriveFromSampleAndBaselineTheSameWay() {
        Scenario scenario = Scenario.of("forward_nonstream_wrk");
        MetricSample sample = new MetricSample(scenario, 1, 12_000d, 900d, 96d, 8_000L);
        BaselineEntry baseline = new BaselineEntry(scenario, 12_000d, 900d, 96d, 8_000d);
        assertEquals(baseline.cpuPerKiloRps(), sample.cpuPerKiloRps(), 1e-12);
        assertEquals(8d, sample.cpuPerKiloRps(), 1e-9);
    }
}
