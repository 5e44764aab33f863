package com.phishguard.analysis.remote;

import reactor.core.publisher.Mono;

/**
 * Optional learned-model collaborator. When enabled, a successful verdict replaces
 * the local blend for that call; any error leaves the local result in place.
 *
 * <p>Presence is an explicit configuration flag ({@link #isEnabled()}), not
 * something discovered by catching failures.
 */
public interface RemoteRiskModel {

    boolean isEnabled();

    /**
     * @return the verdict, or an error signal (timeout, transport failure,
     *         {@link RemoteModelException} for malformed payloads)
     */
    Mono<RemoteVerdict> evaluate(String text);
}
