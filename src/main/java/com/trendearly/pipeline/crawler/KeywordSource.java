package com.trendearly.pipeline.crawler;

import java.util.List;

/**
 * Supplies raw candidate keywords. Results may contain duplicates and case variants.
 */
public interface KeywordSource {

    /**
     * @param limit maximum number of candidates, {@code null} for no limit
     * @throws com.trendearly.pipeline.exception.InfrastructureException if no candidates can be
     * obtained at all
     */
    List<String> fetchCandidateKeywords(Integer limit);
}
