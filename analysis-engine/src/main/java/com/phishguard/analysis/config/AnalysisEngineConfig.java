package com.phishguard.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.phishguard.common.feature.FeatureVocabulary;
import com.phishguard.common.ml.ModelWeights;
import com.phishguard.common.rule.RuleTable;
import com.phishguard.common.scoring.PhishingRiskScorer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;

@Configuration
public class AnalysisEngineConfig {

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${phishguard.remote-model.base-url:http://localhost:8500}")
    private String remoteModelUrl;

    @Value("${phishguard.rules.uppercase-run-length:" + RuleTable.DEFAULT_UPPERCASE_RUN + "}")
    private int uppercaseRunLength;

    @Value("${phishguard.rules.suspicious-tlds:}")
    private String suspiciousTlds;

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return builder.baseUrl(historyUrl).build();
    }

    @Bean
    public WebClient remoteModelClient(WebClient.Builder builder) {
        return builder.baseUrl(remoteModelUrl).build();
    }

    @Bean
    public PhishingRiskScorer phishingRiskScorer() {
        List<String> tlds = (suspiciousTlds == null || suspiciousTlds.isBlank())
            ? RuleTable.DEFAULT_SUSPICIOUS_TLDS
            : Arrays.stream(suspiciousTlds.split(","))
                .map(String::trim)
                .filter(t -> !t.isEmpty())
                .toList();
        return PhishingRiskScorer.create(
            RuleTable.defaults(uppercaseRunLength, tlds),
            FeatureVocabulary.defaults(),
            ModelWeights.DEFAULT);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
