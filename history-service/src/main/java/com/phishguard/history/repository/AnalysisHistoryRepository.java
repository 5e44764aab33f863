package com.phishguard.history.repository;

import com.phishguard.history.model.AnalysisHistory;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AnalysisHistoryRepository extends ReactiveCrudRepository<AnalysisHistory, Long> {

    @Query("SELECT * FROM analysis_history ORDER BY id ASC")
    Flux<AnalysisHistory> findAllInInsertionOrder();

    @Query("SELECT * FROM analysis_history ORDER BY id DESC LIMIT 1")
    Mono<AnalysisHistory> findLatest();
}
