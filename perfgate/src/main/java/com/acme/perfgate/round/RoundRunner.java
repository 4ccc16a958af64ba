package com.acme.perfgate.round;

import com.acme.perfgate.model.MetricSample;
import com.acme.perfgate.model.Scenario;

import java.util.Map;

/**
 * Produces one sample per scenario for a round.
 */
public interface RoundRunner extends AutoCloseable {

    /**
     * @throws com.acme.perfgate.model.RoundFailureException when the round cannot produce a
     *                                                       complete sample set
     */
    Map<Scenario, MetricSample> runRound(int roundIndex);

    @Override
    default void close() throws Exception {
    }
}
