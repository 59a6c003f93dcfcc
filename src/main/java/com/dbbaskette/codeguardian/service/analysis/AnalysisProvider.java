package com.dbbaskette.codeguardian.service.analysis;

/**
 * Source of scores and line-level comments for a pull request.
 *
 * <p>Implementations may block; callers bound them with a timeout. Any exception is treated
 * as a provider failure.</p>
 */
public interface AnalysisProvider {

    AnalysisReport analyze(AnalysisSubject subject) throws AnalysisProviderException;

    /**
     * Short name used in logs, metrics and error details.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
