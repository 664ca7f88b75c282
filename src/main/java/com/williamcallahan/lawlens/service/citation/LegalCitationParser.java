package com.williamcallahan.lawlens.service.citation;

import com.williamcallahan.lawlens.domain.citation.LegalCitation;
import com.williamcallahan.lawlens.domain.citation.LegalCitationKind;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds legal citations written in prose ("Section 19(2)(a)", "s. 4", "Article 28(1)",
 * "Part II") and converts them to element ids such as {@code sec_19__subsec_2__para_a}.
 *
 * <p>Patterns are tried from most to least specific, keyword forms before bare "19(2)" forms; a
 * match overlapping an earlier one is skipped so "Article 28(1)" is never also reported as
 * section "28(1)".</p>
 */
@Component
public class LegalCitationParser {
    private static final Logger logger = LoggerFactory.getLogger(LegalCitationParser.class);

    private static final String SECTION_WORD = "\\b(?:[Ss]ection|[Ss]ec\\.?|[Ss]\\.)\\s*";
    private static final String ARTICLE_WORD = "\\b(?:[Aa]rticle|[Aa]rt\\.?)\\s*";
    private static final String SUBSECTION = "\\s*\\((\\d+)\\)";
    private static final String PARAGRAPH = "\\s*\\(([a-z])\\)";
    private static final String SUBPARAGRAPH = "\\s*\\(([ivxlcdm]+)\\)";

    private static final List<CitationPattern> PATTERNS = List.of(
            new CitationPattern(SECTION_WORD + "(\\d+)" + SUBSECTION + PARAGRAPH + SUBPARAGRAPH, LegalCitationKind.SECTION),
            new CitationPattern(SECTION_WORD + "(\\d+)" + SUBSECTION + PARAGRAPH, LegalCitationKind.SECTION),
            new CitationPattern(SECTION_WORD + "(\\d+)" + SUBSECTION, LegalCitationKind.SECTION),
            new CitationPattern(SECTION_WORD + "(\\d+)\\b", LegalCitationKind.SECTION),
            new CitationPattern(ARTICLE_WORD + "(\\d+)" + SUBSECTION + PARAGRAPH, LegalCitationKind.ARTICLE),
            new CitationPattern(ARTICLE_WORD + "(\\d+)" + SUBSECTION, LegalCitationKind.ARTICLE),
            new CitationPattern(ARTICLE_WORD + "(\\d+)\\b", LegalCitationKind.ARTICLE),
            new CitationPattern("\\b[Rr]egulation\\s*(\\d+)" + SUBSECTION, LegalCitationKind.REGULATION),
            new CitationPattern("\\b[Rr]egulation\\s*(\\d+)\\b", LegalCitationKind.REGULATION),
            new CitationPattern("\\b(\\d+)" + SUBSECTION + PARAGRAPH + SUBPARAGRAPH, LegalCitationKind.SECTION),
            new CitationPattern("\\b(\\d+)" + SUBSECTION + PARAGRAPH, LegalCitationKind.SECTION),
            new CitationPattern("\\b(\\d+)" + SUBSECTION, LegalCitationKind.SECTION),
            new CitationPattern("\\b[Pp]art\\s+([IVXLCDM]+|\\d+)\\b", LegalCitationKind.PART),
            new CitationPattern("\\b[Cc]hapter\\s+([IVXLCDM]+|\\d+)\\b", LegalCitationKind.CHAPTER));

    private static final Pattern ROMAN_NUMERAL = Pattern.compile("^[ivxlcdm]+$", Pattern.CASE_INSENSITIVE);
    private static final Map<Character, Integer> ROMAN_VALUES = Map.of(
            'i', 1, 'v', 5, 'x', 10, 'l', 50, 'c', 100, 'd', 500, 'm', 1000);

    /**
     * Extracts every legal citation in the text, ordered by position.
     *
     * @param text prose to scan, may be null
     * @return citations, empty when none
     */
    public List<LegalCitation> parse(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<LegalCitation> citations = new ArrayList<>();
        for (CitationPattern citationPattern : PATTERNS) {
            Matcher matcher = citationPattern.pattern().matcher(text);
            while (matcher.find()) {
                int start = matcher.start();
                int end = matcher.end();
                boolean overlaps = citations.stream()
                        .anyMatch(existing -> start < existing.end() && end > existing.start());
                if (overlaps) {
                    continue;
                }
                citations.add(toCitation(matcher, citationPattern.kind()));
            }
        }
        citations.sort(Comparator.comparingInt(LegalCitation::start));
        logger.debug("Found {} legal citations", citations.size());
        return List.copyOf(citations);
    }

    /**
     * Converts the first citation in a string to its element id.
     *
     * @param citation text such as "Section 19(2)(a)"
     * @return element id, empty when the text has no citation
     */
    public Optional<String> citationToEid(String citation) {
        return parse(citation).stream().findFirst().map(LegalCitation::eId);
    }

    /**
     * Distinct element ids cited in the text, in order of first appearance.
     *
     * @param text prose to scan
     * @return unique element ids
     */
    public List<String> extractUniqueEids(String text) {
        LinkedHashSet<String> eids = new LinkedHashSet<>();
        parse(text).forEach(citation -> eids.add(citation.eId()));
        return List.copyOf(eids);
    }

    /**
     * Converts an element id back to a readable citation, e.g. {@code sec_19__subsec_2} to
     * "Section 19(2)". Unknown parts are kept verbatim.
     *
     * @param eid element id
     * @return readable citation, or the id itself when nothing could be formatted
     */
    public static String eidToCitation(String eid) {
        if (eid == null || eid.isBlank()) {
            return eid;
        }
        StringBuilder formatted = new StringBuilder();
        for (String part : eid.split("__")) {
            int separator = part.indexOf('_');
            String prefix = separator < 0 ? part : part.substring(0, separator);
            String value = separator < 0 ? "" : part.substring(separator + 1);
            String rendered = switch (prefix) {
                case "sec" -> "Section " + value;
                case "art" -> "Article " + value;
                case "reg" -> "Regulation " + value;
                case "part" -> "Part " + value;
                case "chp" -> "Chapter " + value;
                case "subsec", "para", "subpara" -> "(" + value + ")";
                default -> part;
            };
            if (rendered.startsWith("(") || formatted.length() == 0) {
                formatted.append(rendered);
            } else {
                formatted.append(' ').append(rendered);
            }
        }
        return formatted.length() == 0 ? eid : formatted.toString();
    }

    static String generateEid(LegalCitationKind kind, String number, String subsection, String paragraph, String subparagraph) {
        List<String> parts = new ArrayList<>();
        parts.add(kind.eidPrefix() + "_" + normalizeNumber(number));
        if (subsection != null) {
            parts.add("subsec_" + subsection);
        }
        if (paragraph != null) {
            parts.add("para_" + paragraph);
        }
        if (subparagraph != null) {
            parts.add("subpara_" + normalizeNumber(subparagraph));
        }
        return String.join("__", parts);
    }

    static int romanToArabic(String roman) {
        String lower = roman.toLowerCase(Locale.ROOT);
        int result = 0;
        for (int i = 0; i < lower.length(); i++) {
            int current = ROMAN_VALUES.get(lower.charAt(i));
            Integer next = i + 1 < lower.length() ? ROMAN_VALUES.get(lower.charAt(i + 1)) : null;
            if (next != null && current < next) {
                result -= current;
            } else {
                result += current;
            }
        }
        return result;
    }

    private static String normalizeNumber(String number) {
        return ROMAN_NUMERAL.matcher(number).matches() ? Integer.toString(romanToArabic(number)) : number;
    }

    private static LegalCitation toCitation(Matcher matcher, LegalCitationKind kind) {
        String number = group(matcher, 1);
        String subsection = group(matcher, 2);
        String paragraph = group(matcher, 3);
        String subparagraph = group(matcher, 4);
        return new LegalCitation(
                matcher.group(),
                generateEid(kind, number, subsection, paragraph, subparagraph),
                kind,
                number,
                subsection,
                paragraph,
                subparagraph,
                matcher.start(),
                matcher.end());
    }

    private static String group(Matcher matcher, int index) {
        return index <= matcher.groupCount() ? matcher.group(index) : null;
    }

    private record CitationPattern(Pattern pattern, LegalCitationKind kind) {
        CitationPattern(String regex, LegalCitationKind kind) {
            this(Pattern.compile(regex), kind);
        }
    }
}
