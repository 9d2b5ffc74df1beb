package com.truthlens.tracker.analysis;

import com.truthlens.tracker.content.ContentSnapshot;

/**
 * External capability that scores a page for credibility and bias.
 *
 * Calls are blocking and are only made from the tracker's network executor.
 */
public interface AnalysisProvider {

    /**
     * @param snapshot extracted page content
     * @return scores for the page
     * @throws AnalysisException when no score could be obtained
     */
    AnalysisResult analyze(ContentSnapshot snapshot);
}
