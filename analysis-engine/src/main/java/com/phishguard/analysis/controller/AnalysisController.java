package com.phishguard.analysis.controller;

import com.phishguard.analysis.dto.AnalysisResponse;
import com.phishguard.analysis.dto.AnalyzeRequest;
import com.phishguard.analysis.dto.BatchAnalyzeRequest;
import com.phishguard.analysis.dto.OcrAnalyzeRequest;
import com.phishguard.analysis.service.ScoringService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    private final ScoringService scoringService;

    public AnalysisController(ScoringService scoringService) {
        this.scoringService = scoringService;
    }

    @PostMapping
    public Mono<ResponseEntity<AnalysisResponse>> analyze(@RequestBody AnalyzeRequest request) {
        return scoringService.analyze(request.text())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/ocr")
    public Mono<ResponseEntity<AnalysisResponse>> analyzeImageText(@RequestBody OcrAnalyzeRequest request) {
        return scoringService.analyzeImageText(request.sourceName(), request.extractedText())
            .map(ResponseEntity::ok);
    }

    @PostMapping("/batch")
    public Mono<ResponseEntity<List<AnalysisResponse>>> analyzeBatch(@RequestBody BatchAnalyzeRequest request) {
        return scoringService.analyzeBatch(request.texts())
            .map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
