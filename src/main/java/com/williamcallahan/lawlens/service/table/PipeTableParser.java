package com.williamcallahan.lawlens.service.table;

import com.williamcallahan.lawlens.domain.citation.ParsedPipeTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Decomposes pipe-delimited excerpt text into headers and rows.
 *
 * <p>Two layouts are understood: one row per line, and numbered rows run together on a single
 * line ("1. | Theft | 7 years 2. | Fraud | 10 years"). Anything else is left to the raw
 * fallback.</p>
 */
public final class PipeTableParser {
    private static final Pattern LEADING_ROW_NUMBER = Pattern.compile("^\\d+\\.?\\s*");
    private static final Pattern STARTS_WITH_DIGIT = Pattern.compile("^\\d");

    private PipeTableParser() {}

    /**
     * Parses tabular text.
     *
     * @param text excerpt text
     * @return parsed table, empty when the text cannot be decomposed
     */
    public static Optional<ParsedPipeTable> parse(String text) {
        if (text == null || PipeTableDetector.countPipes(text) < 2) {
            return Optional.empty();
        }
        List<String> lines = text.lines().filter(line -> !line.isBlank()).toList();
        if (lines.size() < 2) {
            return parseNumberedRows(text);
        }
        return parseLines(lines);
    }

    private static Optional<ParsedPipeTable> parseLines(List<String> lines) {
        List<List<String>> rows = lines.stream()
                .map(PipeTableDetector::nonBlankCells)
                .filter(row -> !row.isEmpty())
                .toList();
        if (rows.size() < 2) {
            return Optional.empty();
        }
        List<String> firstRow = rows.get(0);
        boolean firstRowIsHeader = !PipeTableDetector.BARE_ROW_NUMBER.matcher(firstRow.get(0)).matches();
        if (firstRowIsHeader) {
            return Optional.of(new ParsedPipeTable(firstRow, rows.subList(1, rows.size())));
        }
        return Optional.of(new ParsedPipeTable(genericHeaders(maxColumns(rows)), rows));
    }

    private static Optional<ParsedPipeTable> parseNumberedRows(String text) {
        List<Integer> rowStarts = new ArrayList<>();
        Matcher matcher = PipeTableDetector.NUMBERED_ROW.matcher(text);
        while (matcher.find()) {
            rowStarts.add(matcher.start());
        }
        if (rowStarts.size() < 2) {
            return Optional.empty();
        }

        List<List<String>> rows = new ArrayList<>();
        for (int i = 0; i < rowStarts.size(); i++) {
            int end = i + 1 < rowStarts.size() ? rowStarts.get(i + 1) : text.length();
            String chunk = LEADING_ROW_NUMBER.matcher(text.substring(rowStarts.get(i), end)).replaceFirst("");
            List<String> cells = PipeTableDetector.nonBlankCells(chunk);
            if (!cells.isEmpty()) {
                rows.add(cells);
            }
        }
        if (rows.isEmpty()) {
            return Optional.empty();
        }

        int maxColumns = maxColumns(rows);
        List<String> firstRow = rows.get(0);
        boolean firstRowIsHeader = firstRow.size() == maxColumns
                && !STARTS_WITH_DIGIT.matcher(firstRow.get(0)).find();
        List<List<String>> dataRows = firstRowIsHeader ? rows.subList(1, rows.size()) : rows;
        if (dataRows.isEmpty()) {
            return Optional.empty();
        }
        List<String> headers = firstRowIsHeader ? firstRow : genericHeaders(maxColumns);
        return Optional.of(new ParsedPipeTable(headers, dataRows));
    }

    private static int maxColumns(List<List<String>> rows) {
        return rows.stream().mapToInt(List::size).max().orElse(0);
    }

    private static List<String> genericHeaders(int columns) {
        return IntStream.rangeClosed(1, columns).mapToObj(index -> "Column " + index).toList();
    }
}
