package com.williamcallahan.lawlens.domain.retrieval;

/**
 * Where the content of an expanded view came from.
 */
public enum ExpansionStatus {
    /** The back end returned wider content. */
    EXPANDED,
    /** The back end failed, timed out or added nothing; the original excerpt is shown. */
    FALLBACK
}
