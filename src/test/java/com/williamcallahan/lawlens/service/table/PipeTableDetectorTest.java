package com.williamcallahan.lawlens.service.table;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.lawlens.domain.citation.TableShape;
import org.junit.jupiter.api.Test;

class PipeTableDetectorTest {

    @Test
    void detectsOneRowPerLine() {
        TableShape shape = PipeTableDetector.detect("Offence | Penalty\nTheft | 7 years\nFraud | 10 years");

        assertTrue(shape.isTable());
        assertEquals(3, shape.rowCount());
        assertEquals(2, shape.columnCount());
        assertTrue(shape.firstRowIsHeader());
    }

    @Test
    void bareRowNumberInFirstCellMeansNoHeader() {
        TableShape shape = PipeTableDetector.detect("1 | Theft | 7 years\n2 | Fraud | 10 years");

        assertTrue(shape.isTable());
        assertFalse(shape.firstRowIsHeader());
        assertEquals(3, shape.columnCount());
    }

    @Test
    void estimatesShapeOfNumberedRowsOnOneLine() {
        TableShape shape = PipeTableDetector.detect("1. | Theft | 7 years 2. | Fraud | 10 years");

        assertTrue(shape.isTable());
        assertEquals(2, shape.rowCount());
        assertEquals(3, shape.columnCount());
        assertFalse(shape.firstRowIsHeader());
    }

    @Test
    void proseIsNotATable() {
        assertFalse(PipeTableDetector.detect("An employer shall pay wages | monthly.").isTable());
        assertFalse(PipeTableDetector.detect("Either a | b | c on a single line").isTable());
        assertFalse(PipeTableDetector.detect(null).isTable());
        assertFalse(PipeTableDetector.detect("").isTable());
    }

    @Test
    void summarizesShape() {
        assertEquals("Table Data · 3 rows × 2 columns", PipeTableDetector.summarize(new TableShape(true, 3, 2, true)));
    }
}
