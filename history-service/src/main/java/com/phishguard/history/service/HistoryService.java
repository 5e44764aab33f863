package com.phishguard.history.service;

import com.phishguard.common.exception.InvalidInputException;
import com.phishguard.common.model.Analysis;
import com.phishguard.common.model.RiskDistribution;
import com.phishguard.history.model.AnalysisHistory;
import com.phishguard.history.repository.AnalysisHistoryRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class HistoryService {

    private static final Logger log = LoggerFactory.getLogger(HistoryService.class);

    static final String COMPONENT = "HistoryService";

    private final AnalysisHistoryRepository repository;
    private final HistoryReportFormatter reportFormatter;
    private final Clock clock;

    public HistoryService(AnalysisHistoryRepository repository,
                          HistoryReportFormatter reportFormatter,
                          Clock clock) {
        this.repository      = repository;
        this.reportFormatter = reportFormatter;
        this.clock           = clock;
    }

    /**
     * Appends one analysis. An analysis without a score in [0, 100] is rejected with
     * {@link InvalidInputException} and nothing is stored.
     */
    public Mono<AnalysisHistory> save(Analysis analysis) {
        if (analysis == null) {
            return Mono.error(new InvalidInputException(COMPONENT, "Analysis body is required."));
        }
        if (analysis.score() < 0 || analysis.score() > 100) {
            return Mono.error(new InvalidInputException(COMPONENT,
                "Score must be between 0 and 100, was " + analysis.score() + "."));
        }
        return Mono.fromCallable(() -> AnalysisHistory.from(analysis, LocalDateTime.now(clock)))
            .flatMap(repository::save)
            .doOnSuccess(h -> log.info("Analysis persisted. id={} score={} label={}",
                                       h.getId(), h.getScore(), h.getLabel()))
            .doOnError(e -> log.error("Failed to persist analysis. score={}", analysis.score(), e));
    }

    /** All analyses, oldest first. */
    public Flux<Analysis> findAll() {
        return repository.findAllInInsertionOrder()
            .map(AnalysisHistory::toAnalysis);
    }

    public Mono<Analysis> latest() {
        return repository.findLatest()
            .map(AnalysisHistory::toAnalysis);
    }

    public Mono<RiskDistribution> dashboard() {
        return repository.findAll()
            .reduce(RiskDistribution.EMPTY, (dist, h) -> dist.add(h.getScore()))
            .doOnSuccess(d -> log.debug("Dashboard computed. low={} medium={} high={}",
                                        d.low(), d.medium(), d.high()));
    }

    /** Plain-text report, or empty when there is no history. */
    public Mono<String> report() {
        return findAll()
            .collectList()
            .filter(list -> !list.isEmpty())
            .map(list -> reportFormatter.format(list, LocalDateTime.now(clock)));
    }

    public Mono<Void> clear() {
        return repository.count()
            .flatMap(n -> repository.deleteAll()
                .doOnSuccess(v -> log.info("History cleared. removed={}", n)));
    }
}
