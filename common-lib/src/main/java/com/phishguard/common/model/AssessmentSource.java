package com.phishguard.common.model;

/**
 * Which path produced the score and explanation of a {@link RiskAssessment}.
 */
public enum AssessmentSource {
    /** Deterministic heuristic + linear-model blend. */
    LOCAL,
    /** Optional remote model verdict that replaced the local blend for this call. */
    REMOTE_MODEL
}
