package com.williamcallahan.lawlens.service.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawlens.domain.citation.ParsedPipeTable;
import java.util.List;
import org.junit.jupiter.api.Test;

class PipeTableParserTest {

    @Test
    void firstLineBecomesHeader() {
        ParsedPipeTable table = PipeTableParser.parse("Offence | Penalty\nTheft | 7 years\nFraud | 10 years").orElseThrow();

        assertEquals(List.of("Offence", "Penalty"), table.headers());
        assertEquals(List.of(List.of("Theft", "7 years"), List.of("Fraud", "10 years")), table.rows());
    }

    @Test
    void numberedLinesGetGenericHeaders() {
        ParsedPipeTable table = PipeTableParser.parse("1 | Theft | 7 years\n2 | Fraud").orElseThrow();

        assertEquals(List.of("Column 1", "Column 2", "Column 3"), table.headers());
        assertEquals(2, table.rows().size());
        assertEquals(3, table.columnCount());
    }

    @Test
    void splitsNumberedRowsRunTogether() {
        ParsedPipeTable table = PipeTableParser.parse("1. | 5 cases | closed 2. | 7 cases | open").orElseThrow();

        assertEquals(List.of("Column 1", "Column 2"), table.headers());
        assertEquals(List.of(List.of("5 cases", "closed"), List.of("7 cases", "open")), table.rows());
    }

    @Test
    void textualFirstRowOfRunTogetherRowsIsHeader() {
        ParsedPipeTable table = PipeTableParser.parse("1. | Offence | Penalty 2. | Theft | 7 years").orElseThrow();

        assertEquals(List.of("Offence", "Penalty"), table.headers());
        assertEquals(List.of(List.of("Theft", "7 years")), table.rows());
    }

    @Test
    void undecomposableTextIsEmpty() {
        assertTrue(PipeTableParser.parse("a | b | c").isEmpty());
        assertTrue(PipeTableParser.parse("no pipes at all").isEmpty());
        assertTrue(PipeTableParser.parse(null).isEmpty());
    }
}
