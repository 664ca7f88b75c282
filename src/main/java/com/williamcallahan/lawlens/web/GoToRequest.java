package com.williamcallahan.lawlens.web;

/**
 * Target of a jump within the source list; out-of-range values are clamped.
 *
 * @param index zero-based source index
 */
public record GoToRequest(int index) {}
