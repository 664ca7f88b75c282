package com.williamcallahan.lawlens.domain.navigation;

import com.williamcallahan.lawlens.domain.retrieval.ExpandedView;
import com.williamcallahan.lawlens.domain.retrieval.ExpansionKey;

/**
 * Expansion progress of one visible citation.
 *
 * @param citationNumber 1-indexed citation number
 * @param key expansion key of the cited source
 * @param loading whether a fetch is still in flight
 * @param view resolved view, null while loading
 */
public record CitationExpansion(int citationNumber, ExpansionKey key, boolean loading, ExpandedView view) {}
