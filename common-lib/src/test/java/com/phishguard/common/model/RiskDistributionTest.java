package com.phishguard.common.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RiskDistributionTest {

    @Test
    @DisplayName("buckets use the shared label thresholds")
    void boundaries() {
        RiskDistribution distribution = RiskDistribution.fromScores(List.of(0, 30, 31, 60, 61, 100));
        assertEquals(new RiskDistribution(2, 2, 2), distribution);
        assertEquals(6, distribution.total());
    }

    @Test
    @DisplayName("no analyses → all zero")
    void empty() {
        assertEquals(RiskDistribution.EMPTY, RiskDistribution.fromScores(List.of()));
    }

    @Test
    @DisplayName("null scores are skipped")
    void nullSkipped() {
        assertEquals(new RiskDistribution(1, 0, 0), RiskDistribution.fromScores(Arrays.asList(10, null)));
    }
}
