package com.phishguard.history.controller;

import com.phishguard.common.exception.InvalidInputException;
import com.phishguard.common.model.Analysis;
import com.phishguard.common.model.RiskDistribution;
import com.phishguard.history.service.HistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/v1/history")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);

    static final String NO_HISTORY_MSG = "No history to generate a report.";

    private final HistoryService historyService;

    public HistoryController(HistoryService historyService) {
        this.historyService = historyService;
    }

    @PostMapping("/save")
    public Mono<ResponseEntity<Map<String, String>>> save(@RequestBody Analysis analysis) {
        log.info("Received analysis for persistence. score={} label={}", analysis.score(), analysis.label());
        return historyService.save(analysis)
            .then(Mono.just(ResponseEntity.ok().<Map<String, String>>build()))
            .onErrorResume(InvalidInputException.class, e -> {
                log.warn("Rejected analysis. reason={}", e.getUserMessage());
                return Mono.just(ResponseEntity.badRequest().body(Map.of("error", e.getUserMessage())));
            })
            .doOnError(e -> log.error("Save endpoint error", e));
    }

    @GetMapping
    public Flux<Analysis> history() {
        return historyService.findAll();
    }

    @GetMapping("/latest")
    public Mono<ResponseEntity<Analysis>> latest() {
        return historyService.latest()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping("/dashboard")
    public Mono<ResponseEntity<RiskDistribution>> dashboard() {
        log.info("Dashboard query received");
        return historyService.dashboard()
            .map(ResponseEntity::ok)
            .doOnError(e -> log.error("Dashboard endpoint error", e));
    }

    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> report() {
        log.info("Report requested");
        return historyService.report()
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND).body(NO_HISTORY_MSG));
    }

    @DeleteMapping
    public Mono<ResponseEntity<Void>> clear() {
        log.info("Clear history requested");
        return historyService.clear()
            .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }
}
