package com.williamcallahan.lawlens.web;

import jakarta.validation.constraints.NotBlank;

/**
 * Key press forwarded from the viewer.
 *
 * @param key key name such as "j", "ArrowLeft" or "Escape"
 * @param focusInTextField whether focus was in an editable field
 */
public record KeyRequest(@NotBlank String key, boolean focusInTextField) {}
