package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.document.DocumentTable;
import java.util.List;

/**
 * Excerpt to render, with optional server-extracted tables that take precedence.
 *
 * @param excerpt excerpt text
 * @param tables structured tables, may be null
 */
public record TableRenderRequest(String excerpt, List<DocumentTable> tables) {}
