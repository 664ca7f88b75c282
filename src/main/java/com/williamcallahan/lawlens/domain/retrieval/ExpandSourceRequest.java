package com.williamcallahan.lawlens.domain.retrieval;

/**
 * Body of the expand-source call.
 *
 * @param excerpt excerpt to widen
 * @param sectionHint raw section label that helps the back end locate the excerpt
 */
public record ExpandSourceRequest(String excerpt, String sectionHint) {}
