package com.williamcallahan.lawlens.web;

/**
 * Resolved legal reference for a source.
 *
 * @param reference reference such as "Section 11(2)"
 */
public record ReferenceResponse(String reference) {}
