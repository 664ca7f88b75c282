package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import jakarta.validation.constraints.NotNull;

/**
 * Citation chosen on one of the viewer surfaces.
 *
 * @param source cited source
 * @param citationNumber 1-indexed citation number
 */
public record CitationSelectionRequest(@NotNull ChatSource source, int citationNumber) {}
