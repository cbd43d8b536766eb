package com.purchasingpower.micros.workflow.state;

/**
 * Who produced the candidate list carried in the state.
 * Browse lists are suggestions only and never count as a prior food choice.
 */
public enum CandidateSource {
    CALLER,
    SEARCH,
    UPC_LOOKUP,
    BROWSE,
    TOOL
}
