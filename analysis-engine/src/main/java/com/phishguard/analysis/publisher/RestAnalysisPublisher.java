package com.phishguard.analysis.publisher;

import com.phishguard.common.history.AnalysisPublisher;
import com.phishguard.common.model.Analysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * REST-based implementation of {@link AnalysisPublisher}.
 *
 * <p>Appends each {@link Analysis} to history-service via HTTP POST (fire-and-forget).
 * A failed append is logged and never affects the scoring response.
 */
@Component
public class RestAnalysisPublisher implements AnalysisPublisher {

    private static final Logger log = LoggerFactory.getLogger(RestAnalysisPublisher.class);

    private final WebClient historyClient;

    public RestAnalysisPublisher(WebClient historyClient) {
        this.historyClient = historyClient;
    }

    @Override
    public void publish(Analysis analysis) {
        historyClient.post()
            .uri("/api/v1/history/save")
            .bodyValue(analysis)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.debug("Analysis stored in history. score={} status={}",
                                 analysis.score(), r.getStatusCode()),
                err -> log.warn("History append failed (non-critical). score={} label={}",
                                analysis.score(), analysis.label(), err)
            );
    }
}
