package com.phishguard.common.explain;

import com.phishguard.common.heuristic.HeuristicResult;
import com.phishguard.common.ml.ModelResult;
import com.phishguard.common.model.Features;
import com.phishguard.common.model.MatchEvidence;
import com.phishguard.common.model.RiskCategory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the evidence of both scoring layers into a human-readable report.
 *
 * <p>Branches only on the final score:
 * <ul>
 *   <li>{@code score < 5} → {@link #LOW_RISK_MESSAGE}, evidence ignored even if
 *       some low-weight rule matched.</li>
 *   <li>otherwise → assessment header, indicators grouped by category, optional
 *       linguistic cues, and a recommendation for the score tier.</li>
 * </ul>
 *
 * <p>Stateless and thread-safe.
 */
public final class ExplanationGenerator {

    public static final String LOW_RISK_MESSAGE =
        "Low Risk: No phishing indicators were found. The content appears safe, "
            + "but always verify unexpected requests through a channel you trust.";

    static final int    MIN_EXPLAINED_SCORE = 5;
    static final int    MAX_PHRASES         = 3;
    static final int    MAX_KEYWORDS        = 4;
    static final double MODEL_CUE_SCORE     = 20.0;
    static final double UPPERCASE_CUE_RATIO = 0.1;
    static final double SYMBOL_CUE_RATIO    = 0.05;

    public String generate(int score, HeuristicResult heuristic, ModelResult model) {
        if (score < MIN_EXPLAINED_SCORE) {
            return LOW_RISK_MESSAGE;
        }

        List<String> sections = new ArrayList<>();
        sections.add(header(score));
        sections.add(indicators(heuristic.evidence()));

        Features features = model.features();
        if (!features.flaggedNgrams().isEmpty()
                || !features.flaggedWords().isEmpty()
                || model.score() > MODEL_CUE_SCORE) {
            sections.add(linguisticCues(model));
        }

        sections.add(recommendation(score));
        return String.join("\n\n", sections);
    }

    // ── sections ──────────────────────────────────────────────────────────────

    private String header(int score) {
        String assessment;
        if (score > 60) {
            assessment = "High Risk (score " + score + "/100). This content shows strong signs of a phishing attempt.";
        } else if (score > 30) {
            assessment = "Medium Risk (score " + score + "/100). This content contains several suspicious elements.";
        } else {
            assessment = "Low Risk (score " + score + "/100). No strong phishing signals were detected.";
        }
        return "Overall Assessment: " + assessment;
    }

    private String indicators(List<MatchEvidence> evidence) {
        if (evidence.isEmpty()) {
            return "Detected Indicators:\n- No rule-based indicators matched.";
        }
        Map<RiskCategory, List<String>> byCategory = new LinkedHashMap<>();
        for (MatchEvidence e : evidence) {
            byCategory.computeIfAbsent(e.category(), c -> new ArrayList<>()).add(e.reason());
        }
        StringBuilder sb = new StringBuilder("Detected Indicators:");
        byCategory.forEach((category, reasons) ->
            sb.append("\n- ").append(category.displayName()).append(": ").append(String.join(" ", reasons)));
        return sb.toString();
    }

    private String linguisticCues(ModelResult model) {
        Features features = model.features();
        StringBuilder sb = new StringBuilder("Linguistic Cues:\n");
        sb.append(String.format(Locale.ROOT,
            "The language model rates this content at %.0f%% phishing likelihood.", model.score()));

        if (!features.flaggedNgrams().isEmpty()) {
            sb.append("\n- Suspicious phrases: ").append(quoted(features.flaggedNgrams(), MAX_PHRASES));
        }
        if (!features.flaggedWords().isEmpty()) {
            sb.append("\n- Flagged keywords: ").append(quoted(features.flaggedWords(), MAX_KEYWORDS));
        }
        if (features.uppercaseRatio() > UPPERCASE_CUE_RATIO) {
            sb.append("\n- Unusually heavy use of capital letters, a common way to create alarm.");
        }
        if (features.symbolRatio() > SYMBOL_CUE_RATIO) {
            sb.append("\n- High density of symbols and punctuation, often used to disguise links or add urgency.");
        }
        return sb.toString();
    }

    private String recommendation(int score) {
        if (score > 60) {
            return "Recommendation: This is very likely a phishing attempt. Do NOT click any links, "
                + "open attachments or reply with personal information. Delete the message or report it "
                + "to your security team.";
        }
        if (score > 30) {
            return "Recommendation: Proceed with caution. Verify the sender through an independent channel "
                + "before clicking links or sharing any information.";
        }
        return "Recommendation: The risk is low, but stay alert and double-check any unexpected request "
            + "for information or payment.";
    }

    private static String quoted(List<String> values, int limit) {
        return values.stream()
            .limit(limit)
            .map(v -> "\"" + v + "\"")
            .collect(Collectors.joining(", "));
    }
}
