package com.williamcallahan.lawlens.web;

import jakarta.validation.constraints.NotNull;

/**
 * Request body carrying a block of text.
 *
 * @param text text to process
 */
public record TextRequest(@NotNull String text) {}
