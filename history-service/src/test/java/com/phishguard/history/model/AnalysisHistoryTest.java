package com.phishguard.history.model;

import com.phishguard.common.model.Analysis;
import com.phishguard.common.model.RiskLabel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.junit.jupiter.api.Assertions.*;

class AnalysisHistoryTest {

    private static final LocalDateTime SAVED = LocalDateTime.of(2026, 3, 14, 10, 0);

    @Test
    @DisplayName("Entity maps back to the same Analysis")
    void mapsBothWays() {
        Analysis analysis = new Analysis("Verify your account", 55, RiskLabel.MEDIUM,
            LocalDateTime.of(2026, 3, 14, 9, 59), "Credential request.");

        AnalysisHistory entity = AnalysisHistory.from(analysis, SAVED);

        assertNull(entity.getId());
        assertEquals("MEDIUM", entity.getLabel());
        assertEquals(SAVED, entity.getSavedAt());
        assertEquals(analysis, entity.toAnalysis());
    }

    @Test
    @DisplayName("Missing label is derived from the score; missing time uses the save time")
    void fillsMissingFields() {
        AnalysisHistory entity = AnalysisHistory.from(new Analysis(null, 61, null, null, null), SAVED);

        assertEquals("", entity.getText());
        assertEquals("HIGH", entity.getLabel());
        assertEquals(SAVED, entity.getAnalyzedAt());
        assertEquals(RiskLabel.HIGH, entity.toAnalysis().label());
    }
}
