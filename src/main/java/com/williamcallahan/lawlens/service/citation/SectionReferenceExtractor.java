package com.williamcallahan.lawlens.service.citation;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.retrieval.SectionResponse;
import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the heterogeneous section labels attached to retrieved sources into readable legal
 * references such as "Section 11(2)".
 *
 * <p>Inputs come in several shapes: "Section 3(1)", "11. Imposition of duty", breadcrumb paths
 * "Part I > 3. Interpretation", element ids "sec_11__subsec_2" and bare numbers. Document ids
 * like "EDA-2014-11" are never mistaken for section numbers. Every method is total.</p>
 */
public final class SectionReferenceExtractor {
    private static final Pattern DOCUMENT_ID = Pattern.compile("^[A-Z]+-([A-Z]+-)?(\\d{4}-)?\\d+$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SECTION_AS_WRITTEN = Pattern.compile("(Section\\s+\\d+(?:\\s*\\([^)]+\\))?)", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMBERED_TITLE = Pattern.compile("^(\\d+)\\.\\s");
    private static final Pattern SECTION_NUMBER = Pattern.compile("Section\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern ELEMENT_ID = Pattern.compile("sec_(\\d+)(?:__subsec_(\\d+))?(?:__para_([a-z]))?", Pattern.CASE_INSENSITIVE);
    private static final Pattern PARENT_SECTION_IN_EID = Pattern.compile("sec_(\\d+)__");
    private static final Pattern BARE_NUMBER = Pattern.compile("^\\d+$");
    private static final Pattern LEADING_SUBSECTION = Pattern.compile("^\\s*\\((\\d+)\\)\\s");
    private static final String BREADCRUMB_SEPARATOR = ">";

    private SectionReferenceExtractor() {}

    /**
     * Whether a value looks like a document id rather than a section label.
     *
     * @param value candidate value
     * @return true for values like "EDA-2014-11" or "UGA-ACT-2024-001"
     */
    public static boolean isDocumentId(String value) {
        return value != null && DOCUMENT_ID.matcher(value).matches();
    }

    /**
     * Runs the extraction chain over {@code section}, then {@code sectionId}, then the excerpt.
     *
     * @param section raw section label, may be null
     * @param sectionId raw section id, may be null
     * @param excerpt excerpt text, may be null
     * @return readable reference, empty when nothing matched
     */
    public static Optional<String> extractReference(String section, String sectionId, String excerpt) {
        for (String candidate : new String[] {section, sectionId}) {
            if (candidate == null || candidate.isEmpty() || isDocumentId(candidate)) {
                continue;
            }
            Optional<String> reference = fromCandidate(candidate);
            if (reference.isPresent()) {
                return reference;
            }
        }
        if (excerpt != null) {
            Matcher subsection = LEADING_SUBSECTION.matcher(excerpt);
            if (subsection.find()) {
                return Optional.of("Subsection (" + subsection.group(1) + ")");
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves the reference shown for a source; a backend-provided reference wins.
     *
     * @param source cited source
     * @return readable reference, empty when nothing matched
     */
    public static Optional<String> resolve(ChatSource source) {
        if (source.legalReference() != null && !source.legalReference().isBlank()) {
            return Optional.of(source.legalReference());
        }
        return extractReference(source.section(), source.sectionId(), source.excerpt());
    }

    /**
     * Resolves a reference from a full section payload.
     *
     * @param sectionData section returned by the document back end, may be null
     * @return readable reference, empty when nothing matched
     */
    public static Optional<String> fromSectionData(SectionResponse sectionData) {
        if (sectionData == null) {
            return Optional.empty();
        }
        if (sectionData.legalReference() != null && !sectionData.legalReference().isBlank()) {
            return Optional.of(sectionData.legalReference());
        }
        String number = sectionData.number();
        if (number != null && !number.isBlank()) {
            String cleanNumber = number.endsWith(".") ? number.substring(0, number.length() - 1) : number;
            String sectionType = sectionData.sectionType() == null
                    ? ""
                    : sectionData.sectionType().toLowerCase(Locale.ROOT);
            return Optional.of(switch (sectionType) {
                case "section" -> "Section " + cleanNumber;
                case "subsection" -> subsectionReference(sectionData.eid(), cleanNumber);
                case "paragraph" -> "Paragraph (" + cleanNumber + ")";
                default -> (sectionData.sectionType() == null ? "Section" : sectionData.sectionType()) + " " + cleanNumber;
            });
        }
        if (sectionData.eid() != null && !sectionData.eid().isBlank()) {
            return extractReference(null, sectionData.eid(), null);
        }
        return Optional.empty();
    }

    /**
     * Reference for a detail view: section data, then the source's own reference, then the chain.
     *
     * @param sectionData full section payload, may be null
     * @param source cited source
     * @return readable reference, empty when nothing matched
     */
    public static Optional<String> resolveForDetail(SectionResponse sectionData, ChatSource source) {
        Optional<String> fromSection = fromSectionData(sectionData);
        return fromSection.isPresent() ? fromSection : resolve(source);
    }

    private static Optional<String> fromCandidate(String candidate) {
        Matcher asWritten = SECTION_AS_WRITTEN.matcher(candidate);
        if (asWritten.find()) {
            return Optional.of(asWritten.group(1));
        }
        Matcher numbered = NUMBERED_TITLE.matcher(candidate);
        if (numbered.find()) {
            return Optional.of("Section " + numbered.group(1));
        }
        if (candidate.contains(BREADCRUMB_SEPARATOR)) {
            Optional<String> fromBreadcrumb = Arrays.stream(candidate.split(BREADCRUMB_SEPARATOR))
                    .map(String::trim)
                    .filter(segment -> !isDocumentId(segment))
                    .map(SectionReferenceExtractor::fromBreadcrumbSegment)
                    .flatMap(Optional::stream)
                    .findFirst();
            if (fromBreadcrumb.isPresent()) {
                return fromBreadcrumb;
            }
        }
        Matcher elementId = ELEMENT_ID.matcher(candidate);
        if (elementId.find()) {
            StringBuilder reference = new StringBuilder("Section ").append(elementId.group(1));
            if (elementId.group(2) != null) {
                reference.append('(').append(elementId.group(2)).append(')');
            }
            if (elementId.group(3) != null) {
                reference.append('(').append(elementId.group(3)).append(')');
            }
            return Optional.of(reference.toString());
        }
        if (BARE_NUMBER.matcher(candidate).matches()) {
            return Optional.of("Section " + candidate);
        }
        return Optional.empty();
    }

    private static Optional<String> fromBreadcrumbSegment(String segment) {
        Matcher numbered = NUMBERED_TITLE.matcher(segment);
        if (numbered.find()) {
            return Optional.of("Section " + numbered.group(1));
        }
        Matcher section = SECTION_NUMBER.matcher(segment);
        if (section.find()) {
            return Optional.of("Section " + section.group(1));
        }
        return Optional.empty();
    }

    private static String subsectionReference(String eid, String number) {
        if (eid != null) {
            Matcher parent = PARENT_SECTION_IN_EID.matcher(eid);
            if (parent.find()) {
                return "Section " + parent.group(1) + "(" + number + ")";
            }
        }
        return "Subsection (" + number + ")";
    }
}
