package com.phishguard.common.history;

import com.phishguard.common.model.Analysis;

/**
 * Hands a completed {@link Analysis} to the history store.
 *
 * <p>Current implementation: {@code RestAnalysisPublisher} in analysis-engine,
 * which POSTs to history-service fire-and-forget.
 *
 * <p>Implementations MUST be non-blocking and MUST NOT propagate failures:
 * a history outage never fails a scoring call.
 */
public interface AnalysisPublisher {

    /**
     * @param analysis the analysis to append; never {@code null}
     */
    void publish(Analysis analysis);
}
