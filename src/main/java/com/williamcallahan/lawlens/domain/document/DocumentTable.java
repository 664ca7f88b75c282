package com.williamcallahan.lawlens.domain.document;

import java.util.List;
import java.util.Set;

/**
 * A table extracted server-side from a legal document.
 *
 * <p>Header semantics come only from {@code headerRows}; when the payload omits them the
 * first row is the header, while an explicit empty set means no header row. Null cells
 * become empty strings.</p>
 *
 * @param rows ordered rows of cell text
 * @param headerRows zero-based indices of header rows
 * @param identifier optional table label
 * @param page optional source page number
 */
public record DocumentTable(List<List<String>> rows, Set<Integer> headerRows, String identifier, Integer page) {

    private static final Set<Integer> DEFAULT_HEADER_ROWS = Set.of(0);

    public DocumentTable {
        rows = rows == null ? List.of() : rows.stream()
                .map(DocumentTable::copyRow)
                .toList();
        headerRows = headerRows == null ? DEFAULT_HEADER_ROWS : Set.copyOf(headerRows);
    }

    /**
     * Creates a table whose first row is the header.
     *
     * @param rows ordered rows of cell text
     * @return table with default header rows
     */
    public static DocumentTable of(List<List<String>> rows) {
        return new DocumentTable(rows, null, null, null);
    }

    public boolean isHeaderRow(int rowIndex) {
        return headerRows.contains(rowIndex);
    }

    private static List<String> copyRow(List<String> row) {
        if (row == null) {
            return List.of();
        }
        return row.stream().map(cell -> cell == null ? "" : cell).toList();
    }
}
