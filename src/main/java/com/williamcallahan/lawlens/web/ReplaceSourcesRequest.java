package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * New source list for a viewer session.
 *
 * @param sources sources in citation order
 */
public record ReplaceSourcesRequest(@NotNull List<ChatSource> sources) {}
