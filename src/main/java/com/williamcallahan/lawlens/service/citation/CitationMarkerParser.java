package com.williamcallahan.lawlens.service.citation;

import com.williamcallahan.lawlens.domain.citation.CitationMarker;
import com.williamcallahan.lawlens.domain.citation.CitationSegment;
import com.williamcallahan.lawlens.domain.citation.TextSegment;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits generated answer text into prose and bracketed citation markers.
 *
 * <p>Markers look like {@code [1]} or {@code [2, 3]}. Numbers are 1-indexed positions into the
 * answer's source list and are not validated here.</p>
 */
public final class CitationMarkerParser {
    private static final Pattern MARKER = Pattern.compile("\\[(\\d+(?:\\s*,\\s*\\d+)*)\\]");
    private static final Pattern NUMBER_SEPARATOR = Pattern.compile("\\s*,\\s*");

    private CitationMarkerParser() {}

    /**
     * Parses text in a single left-to-right scan.
     *
     * <p>Concatenating the segment texts reproduces the input. Text without markers, including
     * the empty string, yields exactly one text segment.</p>
     *
     * @param text answer text, null treated as empty
     * @return alternating text and citation segments
     */
    public static List<CitationSegment> parse(String text) {
        String input = text == null ? "" : text;
        List<CitationSegment> segments = new ArrayList<>();
        StringBuilder pendingText = new StringBuilder();
        Matcher matcher = MARKER.matcher(input);
        int lastIndex = 0;
        while (matcher.find()) {
            pendingText.append(input, lastIndex, matcher.start());
            lastIndex = matcher.end();
            List<Integer> numbers = parseNumbers(matcher.group(1));
            if (numbers == null) {
                pendingText.append(matcher.group());
                continue;
            }
            if (pendingText.length() > 0) {
                segments.add(new TextSegment(pendingText.toString()));
                pendingText.setLength(0);
            }
            segments.add(new CitationMarker(matcher.group(), numbers));
        }
        pendingText.append(input, lastIndex, input.length());
        if (pendingText.length() > 0 || segments.isEmpty()) {
            segments.add(new TextSegment(pendingText.toString()));
        }
        return List.copyOf(segments);
    }

    /**
     * Distinct citation numbers referenced anywhere in the segments, in order of first use.
     *
     * @param segments parsed segments
     * @return citation numbers
     */
    public static List<Integer> citedNumbers(List<CitationSegment> segments) {
        List<Integer> numbers = new ArrayList<>();
        for (CitationSegment segment : segments) {
            if (segment instanceof CitationMarker marker) {
                marker.numbers().stream().filter(number -> !numbers.contains(number)).forEach(numbers::add);
            }
        }
        return List.copyOf(numbers);
    }

    private static List<Integer> parseNumbers(String numberList) {
        List<Integer> numbers = new ArrayList<>();
        for (String token : NUMBER_SEPARATOR.split(numberList)) {
            try {
                numbers.add(Integer.parseInt(token));
            } catch (NumberFormatException overflow) {
                return null;
            }
        }
        return numbers;
    }
}
