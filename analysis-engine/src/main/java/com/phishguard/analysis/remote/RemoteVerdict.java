package com.phishguard.analysis.remote;

/**
 * Score and explanation supplied by the remote model for one text.
 *
 * @param probability phishing probability in [0, 1]
 */
public record RemoteVerdict(double probability, String explanation) {

    public double score() {
        return Math.min(100.0, probability * 100.0);
    }
}
