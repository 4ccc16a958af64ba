package com.acme.perfgate.round;

import com.acme.perfgate.lifecycle.UpstreamMode;
import com.acme.perfgate.model.Scenario;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed scenario set of one invocation, in report order.
 */
public final class ScenarioCatalog {
    public static final Scenario FORWARD_NONSTREAM = Scenario.of("forward_nonstream_wrk");
    public static final Scenario FORWARD_STREAM = Scenario.of("forward_stream_wrk");
    public static final Scenario FC_INJECT_NONSTREAM = Scenario.of("fc_inject_nonstream_wrk");
    public static final Scenario FC_INJECT_STREAM = Scenario.of("fc_inject_stream_wrk");
    public static final Scenario ALIAS_REMAP_NONSTREAM = Scenario.of("alias_remap_nonstream_wrk");
    public static final Scenario ALIAS_REMAP_STREAM = Scenario.of("alias_remap_stream_wrk");

    private static final String DIRECT_MODEL = "m1";
    private static final String ALIAS_MODEL = "smart";

    private final Map<Scenario, ScenarioWorkload> workloads;

    private ScenarioCatalog(Map<Scenario, ScenarioWorkload> workloads) {
        this.workloads = Collections.unmodifiableMap(workloads);
    }

    public static ScenarioCatalog standard(boolean includeAliasRemap) {
        Map<Scenario, ScenarioWorkload> workloads = new LinkedHashMap<>();
        put(workloads, new ScenarioWorkload(FORWARD_NONSTREAM, false, false, UpstreamMode.SINGLE, DIRECT_MODEL));
        put(workloads, new ScenarioWorkload(FORWARD_STREAM, true, false, UpstreamMode.SINGLE, DIRECT_MODEL));
        put(workloads, new ScenarioWorkload(FC_INJECT_NONSTREAM, false, true, UpstreamMode.SINGLE, DIRECT_MODEL));
        put(workloads, new ScenarioWorkload(FC_INJECT_STREAM, true, true, UpstreamMode.SINGLE, DIRECT_MODEL));
        if (includeAliasRemap) {
            put(workloads, new ScenarioWorkload(ALIAS_REMAP_NONSTREAM, false, false, UpstreamMode.ALIAS_GROUP, ALIAS_MODEL));
            put(workloads, new ScenarioWorkload(ALIAS_REMAP_STREAM, true, false, UpstreamMode.ALIAS_GROUP, ALIAS_MODEL));
        }
        return new ScenarioCatalog(workloads);
    }

    public static ScenarioCatalog of(List<ScenarioWorkload> workloads) {
        Map<Scenario, ScenarioWorkload> map = new LinkedHashMap<>();
        workloads.forEach(w -> put(map, w));
        return new ScenarioCatalog(map);
    }

    private static void put(Map<Scenario, ScenarioWorkload> map, ScenarioWorkload workload) {
        if (map.putIfAbsent(workload.scenario(), workload) != null) {
            throw new IllegalArgumentException("duplicate scenario: " + workload.scenario());
        }
    }

    public List<Scenario> scenarios() {
        return List.copyOf(workloads.keySet());
    }

    public List<ScenarioWorkload> workloads() {
        return new ArrayList<>(workloads.values());
    }

    public Optional<ScenarioWorkload> workload(Scenario scenario) {
        return Optional.ofNullable(workloads.get(scenario));
    }
}
