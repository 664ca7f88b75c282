package com.williamcallahan.lawlens.domain.citation;

/**
 * A document cited one or more times in the same answer.
 *
 * @param source first occurrence of the document
 * @param count number of occurrences
 */
public record DeduplicatedSource(ChatSource source, int count) {}
