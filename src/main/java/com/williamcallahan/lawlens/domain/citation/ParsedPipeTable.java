package com.williamcallahan.lawlens.domain.citation;

import java.util.List;

/**
 * Pipe-delimited excerpt decomposed into headers and data rows.
 *
 * @param headers column headers, generic "Column N" labels when the text had none
 * @param rows data rows, possibly shorter than the header row
 */
public record ParsedPipeTable(List<String> headers, List<List<String>> rows) {

    public ParsedPipeTable {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    public int columnCount() {
        return headers.size();
    }
}
