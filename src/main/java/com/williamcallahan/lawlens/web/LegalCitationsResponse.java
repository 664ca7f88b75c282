package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.citation.LegalCitation;
import java.util.List;

/**
 * Legal citations found in prose.
 *
 * @param citations citations ordered by position
 * @param eids distinct element ids in order of first appearance
 */
public record LegalCitationsResponse(List<LegalCitation> citations, List<String> eids) {}
