package com.williamcallahan.lawlens.domain.retrieval;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Identity of one expansion request, used for de-duplication, caching and stale checks.
 *
 * @param documentId cited document
 * @param sectionId section id, or an excerpt fingerprint when the source has none
 */
public record ExpansionKey(String documentId, String sectionId) {

    private static final String EXCERPT_PREFIX = "excerpt:";

    public ExpansionKey {
        Objects.requireNonNull(documentId, "Document id is required");
        Objects.requireNonNull(sectionId, "Section id is required");
    }

    /**
     * Builds the key for a source.
     *
     * @param source cited source
     * @return key on the section id, or on the excerpt fingerprint when no section id is set
     */
    public static ExpansionKey of(ChatSource source) {
        String documentId = source.documentId() == null ? "" : source.documentId();
        String sectionId = source.sectionId();
        if (sectionId == null || sectionId.isBlank()) {
            sectionId = EXCERPT_PREFIX + fingerprint(source.excerpt());
        }
        return new ExpansionKey(documentId, sectionId);
    }

    private static String fingerprint(String excerpt) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(excerpt.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash, 0, 8);
        } catch (NoSuchAlgorithmException missingAlgorithm) {
            throw new IllegalStateException("SHA-256 unavailable", missingAlgorithm);
        }
    }
}
