package com.phishguard.analysis.service;

import com.phishguard.analysis.dto.AnalysisResponse;
import com.phishguard.analysis.remote.RemoteRiskModel;
import com.phishguard.common.exception.InvalidInputException;
import com.phishguard.common.history.AnalysisPublisher;
import com.phishguard.common.model.Analysis;
import com.phishguard.common.model.RiskAssessment;
import com.phishguard.common.scoring.PhishingRiskScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Scores text with the local pipeline, lets the remote model override the result when
 * it is enabled and answers, records the outcome as an {@link Analysis} and publishes it.
 *
 * <p>Remote failures never reach the caller: every error path resolves to the local
 * assessment. Publishing is fire-and-forget.
 */
@Service
public class ScoringService {

    private static final Logger log = LoggerFactory.getLogger(ScoringService.class);

    static final String COMPONENT          = "ScoringService";
    static final String EMPTY_INPUT_MSG    = "Please enter text or URL to analyze.";
    static final String MISSING_SOURCE_MSG = "An image source name is required.";
    static final String EMPTY_BATCH_MSG    = "Batch must contain at least one text.";
    static final String IMAGE_TEXT_PREFIX  = "[Image Analysis] ";
    static final String REMOTE_PREFIX      = "[Advanced AI Model] ";

    private final PhishingRiskScorer scorer;
    private final RemoteRiskModel remoteModel;
    private final AnalysisPublisher publisher;
    private final Clock clock;
    private final int maxBatchSize;

    public ScoringService(PhishingRiskScorer scorer,
                          RemoteRiskModel remoteModel,
                          AnalysisPublisher publisher,
                          Clock clock,
                          @Value("${phishguard.batch.max-size:100}") int maxBatchSize) {
        this.scorer       = scorer;
        this.remoteModel  = remoteModel;
        this.publisher    = publisher;
        this.clock        = clock;
        this.maxBatchSize = maxBatchSize;
    }

    public Mono<AnalysisResponse> analyze(String text) {
        if (text == null || text.isBlank()) {
            return Mono.error(new InvalidInputException(COMPONENT, EMPTY_INPUT_MSG));
        }
        return assessAndRecord(text, text);
    }

    /** Scores OCR output; the history entry names the image rather than repeating its text. */
    public Mono<AnalysisResponse> analyzeImageText(String sourceName, String extractedText) {
        if (sourceName == null || sourceName.isBlank()) {
            return Mono.error(new InvalidInputException(COMPONENT, MISSING_SOURCE_MSG));
        }
        return assessAndRecord(IMAGE_TEXT_PREFIX + sourceName.trim(), blankToEmpty(extractedText));
    }

    /**
     * Scores every text concurrently on the bounded elastic pool. Results keep input order.
     * Null or blank entries are not rejected; they score as zero.
     */
    public Mono<List<AnalysisResponse>> analyzeBatch(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return Mono.error(new InvalidInputException(COMPONENT, EMPTY_BATCH_MSG));
        }
        if (texts.size() > maxBatchSize) {
            return Mono.error(new InvalidInputException(COMPONENT,
                "Batch of " + texts.size() + " exceeds the limit of " + maxBatchSize + " texts."));
        }
        log.info("Scoring batch of {} texts", texts.size());
        // Flux.fromIterable rejects null elements, so entries are normalized up front
        List<String> normalized = texts.stream().map(ScoringService::blankToEmpty).toList();
        return Flux.fromIterable(normalized)
            .flatMapSequential(t -> assessAndRecord(t, t).subscribeOn(Schedulers.boundedElastic()))
            .collectList();
    }

    private Mono<AnalysisResponse> assessAndRecord(String recordedText, String scoredText) {
        return assess(scoredText)
            .map(assessment -> {
                Analysis analysis = Analysis.of(recordedText, assessment, LocalDateTime.now(clock));
                log.info("Analysis complete. score={} label={} source={} indicators={}",
                    analysis.score(), analysis.label(), assessment.source(),
                    assessment.heuristicEvidence().size());
                publish(analysis);
                return AnalysisResponse.of(analysis, assessment);
            });
    }

    Mono<RiskAssessment> assess(String text) {
        return Mono.fromCallable(() -> scorer.score(text))
            .flatMap(local -> {
                if (!remoteModel.isEnabled()) {
                    return Mono.just(local);
                }
                return remoteModel.evaluate(text)
                    .map(verdict -> local.withRemoteVerdict(verdict.score(),
                        REMOTE_PREFIX + verdict.explanation()))
                    .doOnNext(remote -> log.debug("Remote model verdict applied. local={} remote={}",
                        local.score(), remote.score()))
                    .defaultIfEmpty(local)
                    .onErrorResume(e -> {
                        log.warn("Remote model unavailable, using local assessment. reason={}",
                            e.getMessage());
                        return Mono.just(local);
                    });
            });
    }

    private static String blankToEmpty(String text) {
        return text == null || text.isBlank() ? "" : text;
    }

    private void publish(Analysis analysis) {
        try {
            publisher.publish(analysis);
        } catch (RuntimeException e) {
            log.warn("Analysis publish failed (non-critical). score={}", analysis.score(), e);
        }
    }
}
