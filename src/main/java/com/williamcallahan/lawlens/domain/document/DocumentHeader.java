package com.williamcallahan.lawlens.domain.document;

/**
 * Header metadata shown above a rendered document.
 *
 * @param title full title
 * @param shortTitle short title, shown only when it differs from the title
 * @param jurisdiction jurisdiction code or name, e.g. "UG"
 * @param chapter chapter of the revised laws
 * @param publicationDate ISO date string
 * @param commencementDate ISO date string
 * @param actYear year of enactment
 */
public record DocumentHeader(
        String title,
        String shortTitle,
        String jurisdiction,
        String chapter,
        String publicationDate,
        String commencementDate,
        Integer actYear) {

    /**
     * Picks the name used in snippet labels: short title first, then full title.
     *
     * @return display name, empty when neither is set
     */
    public String displayName() {
        if (shortTitle != null && !shortTitle.isBlank()) {
            return shortTitle;
        }
        return title == null ? "" : title;
    }
}
