package com.williamcallahan.lawlens.service.citation;

import com.williamcallahan.lawlens.domain.citation.ChatSource;
import com.williamcallahan.lawlens.domain.citation.CitationStyle;
import com.williamcallahan.lawlens.domain.citation.DocumentType;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Formats a cited source in one of the supported citation styles.
 */
@Component
public class CitationStyleFormatter {
    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
    private static final Pattern SECTION_WORD_PREFIX = Pattern.compile("^(section|sec\\.?)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIRST_YEAR = Pattern.compile("\\s*\\[?\\d{4}\\]?\\s*");
    private static final Pattern NON_KEY_CHARACTERS = Pattern.compile("[^a-z0-9]");
    private static final String NO_DATE = "n.d.";
    private static final String PUBLISHER = "Kenya Law";

    /**
     * Formats a source.
     *
     * @param source cited source
     * @param style target style
     * @return formatted citation
     */
    public String format(ChatSource source, CitationStyle style) {
        String sectionRef = SectionReferenceExtractor.resolve(source).orElse(null);
        return switch (style) {
            case LEGAL -> legal(source, sectionRef);
            case ACADEMIC -> academic(source, sectionRef);
            case BIBTEX -> bibtex(source, sectionRef);
            case BLUEBOOK -> bluebook(source, sectionRef);
            case OSCOLA -> oscola(source, sectionRef);
        };
    }

    private String legal(ChatSource source, String sectionRef) {
        List<String> parts = new ArrayList<>();
        parts.add(title(source));
        String section = firstPresent(sectionRef, source.section());
        if (section != null) {
            parts.add(section);
        }
        String humanReadableId = source.humanReadableId();
        if (hasText(humanReadableId) && parts.stream().noneMatch(part -> part.contains(humanReadableId))) {
            parts.add("(" + humanReadableId + ")");
        }
        return String.join(", ", parts);
    }

    private String academic(ChatSource source, String sectionRef) {
        List<String> parts = new ArrayList<>();
        parts.add(title(source));
        String year = year(source);
        if (year != null) {
            parts.add("(" + year + ")");
        }
        if (hasText(source.humanReadableId())) {
            parts.add(source.humanReadableId());
        }
        if (sectionRef != null) {
            parts.add(sectionRef);
        }
        return String.join(". ", parts) + ".";
    }

    private String bibtex(ChatSource source, String sectionRef) {
        String year = year(source);
        String titleWords = Arrays.stream(title(source).trim().split("\\s+"))
                .limit(2)
                .collect(Collectors.joining());
        String key = NON_KEY_CHARACTERS.matcher(titleWords.toLowerCase(Locale.ROOT)).replaceAll("")
                + (year == null ? NO_DATE : year);
        String entryType = source.documentType() == DocumentType.JUDGMENT ? "misc" : "legislation";

        List<String> fields = new ArrayList<>();
        fields.add("  title = {" + title(source) + "}");
        if (hasText(source.humanReadableId())) {
            fields.add("  number = {" + source.humanReadableId() + "}");
        }
        if (year != null) {
            fields.add("  year = {" + year + "}");
        }
        if (sectionRef != null) {
            fields.add("  note = {" + sectionRef + "}");
        }
        fields.add("  howpublished = {" + PUBLISHER + "}");
        return "@" + entryType + "{" + key + ",\n" + String.join(",\n", fields) + "\n}";
    }

    private String bluebook(ChatSource source, String sectionRef) {
        String year = year(source);
        if (source.documentType() == DocumentType.JUDGMENT) {
            List<String> parts = new ArrayList<>();
            parts.add(title(source));
            if (hasText(source.humanReadableId())) {
                parts.add(source.humanReadableId());
            }
            if (year != null) {
                parts.add("(" + year + ")");
            }
            return String.join(", ", parts);
        }
        StringBuilder citation = new StringBuilder(title(source));
        String section = firstPresent(sectionRef, source.section());
        if (section != null) {
            citation.append(" § ").append(stripSectionWord(section));
        }
        if (year != null) {
            citation.append(" (").append(year).append(')');
        }
        return citation.toString();
    }

    private String oscola(ChatSource source, String sectionRef) {
        String year = year(source);
        StringBuilder citation = new StringBuilder(title(source));
        if (source.documentType() == DocumentType.JUDGMENT) {
            if (year != null) {
                citation.append(" [").append(year).append(']');
            }
            if (hasText(source.humanReadableId())) {
                String court = FIRST_YEAR.matcher(source.humanReadableId()).replaceFirst(" ").trim();
                citation.append(' ').append(court);
            }
            return citation.toString();
        }
        if (year != null && !citation.toString().contains(year)) {
            citation.append(' ').append(year);
        }
        String section = firstPresent(sectionRef, source.section());
        if (section != null) {
            citation.append(", s ").append(stripSectionWord(section));
        }
        return citation.toString();
    }

    private static String year(ChatSource source) {
        if (source.humanReadableId() == null) {
            return null;
        }
        Matcher matcher = YEAR.matcher(source.humanReadableId());
        return matcher.find() ? matcher.group() : null;
    }

    private static String stripSectionWord(String section) {
        return SECTION_WORD_PREFIX.matcher(section).replaceFirst("");
    }

    private static String title(ChatSource source) {
        return source.title() == null ? "" : source.title();
    }

    private static String firstPresent(String preferred, String fallback) {
        if (hasText(preferred)) {
            return preferred;
        }
        return hasText(fallback) ? fallback : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
