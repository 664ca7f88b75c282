package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.citation.TableShape;

/**
 * Rendered excerpt content.
 *
 * @param html HTML fragment
 * @param shape detected table shape of the raw excerpt
 * @param summary tooltip summary, null when the excerpt is not tabular
 */
public record TableRenderResponse(String html, TableShape shape, String summary) {}
