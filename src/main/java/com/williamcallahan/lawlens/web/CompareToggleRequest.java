package com.williamcallahan.lawlens.web;

/**
 * Citation to add to or remove from the compare selection.
 *
 * @param citationNumber 1-indexed citation number
 */
public record CompareToggleRequest(int citationNumber) {}
