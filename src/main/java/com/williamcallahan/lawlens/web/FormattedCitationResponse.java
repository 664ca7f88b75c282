package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.citation.CitationStyle;

/**
 * A source formatted for export.
 *
 * @param style style used
 * @param citation formatted citation
 */
public record FormattedCitationResponse(CitationStyle style, String citation) {}
