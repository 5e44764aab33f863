package com.phishguard.history.service;

import com.phishguard.common.model.Analysis;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Renders the analysis history as a numbered plain-text report.
 *
 * <pre>
 * PhishGuard - Analysis Report
 * Report generated on: 2026-03-14 09:30:00
 *
 * 1. Risk Level: High Risk (85%)
 *    Analyzed on: 2026-03-14 09:12:44
 *    Reasoning: ...
 *    Content: ...
 * </pre>
 */
@Component
public class HistoryReportFormatter {

    static final String TITLE = "PhishGuard - Analysis Report";
    static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private static final String INDENT = "   ";

    public String format(List<Analysis> history, LocalDateTime generatedAt) {
        StringBuilder sb = new StringBuilder();
        sb.append(TITLE).append('\n');
        sb.append("Report generated on: ").append(formatTime(generatedAt)).append('\n');

        for (int i = 0; i < history.size(); i++) {
            Analysis a = history.get(i);
            sb.append('\n');
            sb.append(i + 1).append(". Risk Level: ")
              .append(a.label().displayName()).append(" (").append(a.score()).append("%)\n");
            sb.append(INDENT).append("Analyzed on: ").append(formatTime(a.time())).append('\n');
            sb.append(INDENT).append("Reasoning: ").append(indentContinuation(orNa(a.explanation()))).append('\n');
            sb.append(INDENT).append("Content: ").append(indentContinuation(orNa(a.text()))).append('\n');
        }
        return sb.toString();
    }

    private static String formatTime(LocalDateTime time) {
        return time == null ? "N/A" : TIME_FORMAT.format(time);
    }

    private static String orNa(String value) {
        return value == null || value.isBlank() ? "N/A" : value.strip();
    }

    // multi-line explanations stay inside their numbered entry
    private static String indentContinuation(String value) {
        return value.replace("\r\n", "\n").replace("\n", "\n" + INDENT + INDENT);
    }
}
