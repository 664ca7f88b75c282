package com.williamcallahan.lawlens.web;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Answer text together with the sources its markers point into.
 *
 * @param text answer text
 * @param sources sources in citation order
 */
public record AnnotateRequest(@NotNull String text, List<ChatSource> sources) {}
