package com.williamcallahan.lawlens.service.table;

import com.williamcallahan.lawlens.domain.citation.TableShape;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Heuristic detection of pipe-delimited tables flattened into excerpt text.
 */
public final class PipeTableDetector {
    static final Pattern NUMBERED_ROW = Pattern.compile("\\d+\\.?\\s*\\|");
    static final Pattern BARE_ROW_NUMBER = Pattern.compile("^\\d+\\.?$");
    private static final int MIN_PIPES = 2;
    private static final int MIN_ROWS = 2;

    private PipeTableDetector() {}

    /**
     * Detects whether text is a pipe table and estimates its shape.
     *
     * @param text excerpt text, may be null
     * @return shape, {@link TableShape#none()} when the text is not tabular
     */
    public static TableShape detect(String text) {
        if (text == null) {
            return TableShape.none();
        }
        int pipeCount = countPipes(text);
        if (pipeCount < MIN_PIPES) {
            return TableShape.none();
        }

        List<String> pipeLines = text.lines()
                .filter(line -> !line.isBlank() && line.indexOf('|') >= 0)
                .toList();
        if (pipeLines.size() >= MIN_ROWS) {
            List<String> firstCells = nonBlankCells(pipeLines.get(0));
            boolean firstRowIsHeader = firstCells.isEmpty()
                    || !BARE_ROW_NUMBER.matcher(firstCells.get(0)).matches();
            return new TableShape(true, pipeLines.size(), firstCells.size(), firstRowIsHeader);
        }

        int numberedRows = 0;
        Matcher matcher = NUMBERED_ROW.matcher(text);
        while (matcher.find()) {
            numberedRows++;
        }
        if (numberedRows >= MIN_ROWS) {
            int columnCount = (int) Math.round((double) pipeCount / numberedRows) + 1;
            return new TableShape(true, numberedRows, columnCount, false);
        }
        return TableShape.none();
    }

    /**
     * Tooltip summary such as "Table Data · 3 rows × 2 columns".
     *
     * @param shape detected shape
     * @return summary text
     */
    public static String summarize(TableShape shape) {
        return "Table Data · " + shape.rowCount() + " rows × " + shape.columnCount() + " columns";
    }

    static int countPipes(String text) {
        int count = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '|') {
                count++;
            }
        }
        return count;
    }

    static List<String> nonBlankCells(String line) {
        return Arrays.stream(line.split("\\|", -1))
                .map(String::trim)
                .filter(cell -> !cell.isEmpty())
                .toList();
    }
}
