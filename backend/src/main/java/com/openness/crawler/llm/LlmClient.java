package com.openness.crawler.llm;

/**
 * Language-model collaborator used for subpage selection and semantic criterion checks.
 * Both calls may throw {@link LlmException}; callers treat that as "no signal" and degrade.
 */
public interface LlmClient {

    SubpageSelection selectSubpages(SubpageSelectionRequest request);

    CriterionAnalysis analyzeCriterion(CriterionAnalysisRequest request);

    boolean ping();
}
