package com.williamcallahan.lawlens.domain.citation;

/**
 * Result of pipe-table detection over an excerpt.
 *
 * @param isTable whether the text looks tabular
 * @param rowCount detected rows
 * @param columnCount detected columns
 * @param firstRowIsHeader whether the first row reads as a header
 */
public record TableShape(boolean isTable, int rowCount, int columnCount, boolean firstRowIsHeader) {

    private static final TableShape NONE = new TableShape(false, 0, 0, false);

    public static TableShape none() {
        return NONE;
    }
}
